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
package io.pathtrace.api;

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Describes how a remote service is reached.
 * The endpoint format depends on the type, e.g. {@code host:port} for {@link ChannelType#TCP_IP}.
 */
public final class Channel {

    private final ChannelType type;
    @Nullable
    private final String endpoint;

    private Channel(ChannelType type, @Nullable String endpoint) {
        this.type = Objects.requireNonNull(type, "type");
        this.endpoint = endpoint;
    }

    public static Channel of(ChannelType type) {
        return new Channel(type, null);
    }

    public static Channel of(ChannelType type, @Nullable String endpoint) {
        return new Channel(type, endpoint);
    }

    public ChannelType getType() {
        return type;
    }

    @Nullable
    public String getEndpoint() {
        return endpoint;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Channel channel = (Channel) o;
        return type == channel.type && Objects.equals(endpoint, channel.endpoint);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, endpoint);
    }

    @Override
    public String toString() {
        return "Channel(" + type + (endpoint != null ? ", " + endpoint : "") + ")";
    }
}
