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

import javax.annotation.Nullable;
import java.util.Base64;

/**
 * Encodes tracer identities into tags and back.
 * <p>
 * Byte tag layout: one version byte ({@value #TAG_VERSION}) followed by the 16 big endian bytes of the {@link TracerId}.
 * The string tag is the standard Base64 encoding of the byte tag.
 * In-process links use the same layout with version {@value #LINK_VERSION}.
 * </p>
 * <p>
 * Decoding never throws: anything that is not a well-formed tag of a valid id decodes to {@code null}.
 * </p>
 */
public final class TagCodec {

    static final byte TAG_VERSION = 0;
    static final byte LINK_VERSION = 1;
    public static final int ENCODED_LENGTH = 1 + TracerId.LENGTH;

    private TagCodec() {
    }

    public static OutgoingTag encodeOutgoing(TracerId id) {
        if (!id.isValid()) {
            return OutgoingTag.EMPTY;
        }
        final byte[] byteTag = encode(TAG_VERSION, id);
        return new OutgoingTag(Base64.getEncoder().encodeToString(byteTag), byteTag);
    }

    @Nullable
    public static TracerId decodeIncoming(@Nullable String stringTag) {
        if (stringTag == null || stringTag.isEmpty()) {
            return null;
        }
        final byte[] bytes;
        try {
            bytes = Base64.getDecoder().decode(stringTag);
        } catch (IllegalArgumentException e) {
            return null;
        }
        return decode(TAG_VERSION, bytes);
    }

    @Nullable
    public static TracerId decodeIncoming(@Nullable byte[] byteTag) {
        return decode(TAG_VERSION, byteTag);
    }

    public static byte[] encodeInProcessLink(TracerId id) {
        if (!id.isValid()) {
            return new byte[0];
        }
        return encode(LINK_VERSION, id);
    }

    @Nullable
    public static TracerId decodeInProcessLink(@Nullable byte[] link) {
        return decode(LINK_VERSION, link);
    }

    private static byte[] encode(byte version, TracerId id) {
        final byte[] bytes = new byte[ENCODED_LENGTH];
        bytes[0] = version;
        id.writeTo(bytes, 1);
        return bytes;
    }

    @Nullable
    private static TracerId decode(byte expectedVersion, @Nullable byte[] bytes) {
        if (bytes == null || bytes.length != ENCODED_LENGTH || bytes[0] != expectedVersion) {
            return null;
        }
        final TracerId id = TracerId.fromBytes(bytes, 1);
        return id.isValid() ? id : null;
    }
}
