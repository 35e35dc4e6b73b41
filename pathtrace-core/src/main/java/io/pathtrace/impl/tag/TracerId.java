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
package io.pathtrace.impl.tag;

import io.pathtrace.util.HexUtils;

import java.nio.ByteBuffer;

/**
 * The 128 bit identity of a tracer.
 * <p>
 * The high half identifies the issuing process session, the low half is a sequence within that session.
 * The all-zero id is {@link #INVALID} and is never issued.
 * </p>
 */
public final class TracerId {

    public static final int LENGTH = 16;
    public static final TracerId INVALID = new TracerId(0, 0);

    private final long high;
    private final long low;

    public TracerId(long high, long low) {
        this.high = high;
        this.low = low;
    }

    public static TracerId fromBytes(byte[] bytes, int offset) {
        final ByteBuffer buffer = ByteBuffer.wrap(bytes, offset, LENGTH);
        return new TracerId(buffer.getLong(), buffer.getLong());
    }

    public void writeTo(byte[] bytes, int offset) {
        ByteBuffer.wrap(bytes, offset, LENGTH).putLong(high).putLong(low);
    }

    public long getHigh() {
        return high;
    }

    public long getLow() {
        return low;
    }

    public boolean isValid() {
        return high != 0 || low != 0;
    }

    /**
     * @return 32 lowercase hex characters
     */
    public String toHexString() {
        final StringBuilder sb = new StringBuilder(LENGTH * 2);
        HexUtils.writeLongAsHex(high, sb);
        HexUtils.writeLongAsHex(low, sb);
        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        TracerId that = (TracerId) o;
        return high == that.high && low == that.low;
    }

    @Override
    public int hashCode() {
        return 31 * Long.hashCode(high) + Long.hashCode(low);
    }

    @Override
    public String toString() {
        return toHexString();
    }
}
