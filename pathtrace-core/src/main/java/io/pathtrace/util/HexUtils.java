/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.pathtrace.util;

/**
 * Lower case hex rendering of ids, as used in trace context info and in the records of the in-memory agent.
 */
public class HexUtils {

    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private HexUtils() {
    }

    public static String bytesToHex(byte[] bytes) {
        final StringBuilder sb = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            appendHex(b & 0xFF, sb);
        }
        return sb.toString();
    }

    public static String longToHex(long value) {
        final StringBuilder sb = new StringBuilder(16);
        writeLongAsHex(value, sb);
        return sb.toString();
    }

    /**
     * Appends exactly 16 characters, most significant byte first.
     */
    public static void writeLongAsHex(long value, StringBuilder sb) {
        for (int shift = 56; shift >= 0; shift -= 8) {
            appendHex((int) (value >>> shift) & 0xFF, sb);
        }
    }

    private static void appendHex(int unsignedByte, StringBuilder sb) {
        sb.append(HEX_DIGITS[unsignedByte >>> 4]).append(HEX_DIGITS[unsignedByte & 0x0F]);
    }
}
