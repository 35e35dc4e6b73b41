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
package io.pathtrace.impl.tracer;

import io.pathtrace.agent.TracerField;
import io.pathtrace.api.Channel;
import io.pathtrace.api.OutgoingRemoteCallTracer;
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.tag.TracerId;

import javax.annotation.Nullable;
import java.util.Map;

public class OutgoingRemoteCallTracerImpl extends AbstractTracer implements OutgoingRemoteCallTracer {

    private final String serviceMethod;
    private final String serviceName;
    private final String serviceEndpoint;
    private final Channel channel;
    @Nullable
    private String protocolName;

    public OutgoingRemoteCallTracerImpl(PathTracer pathTracer, TracerId id, String serviceMethod, String serviceName, String serviceEndpoint,
                                        Channel channel) {
        super(pathTracer, id, TracerKind.OUTGOING_REMOTE_CALL);
        this.serviceMethod = serviceMethod;
        this.serviceName = serviceName;
        this.serviceEndpoint = serviceEndpoint;
        this.channel = channel;
    }

    @Override
    public void setProtocolName(@Nullable String protocolName) {
        checkEntryField("protocol name");
        this.protocolName = protocolName;
        setField(TracerField.PROTOCOL_NAME, protocolName);
    }

    @Nullable
    public String getProtocolName() {
        return protocolName;
    }

    public Channel getChannel() {
        return channel;
    }

    @Override
    protected void collectValues(Map<String, Object> values) {
        values.put("service_method", serviceMethod);
        values.put("service_name", serviceName);
        values.put("service_endpoint", serviceEndpoint);
        values.put("channel_type", channel.getType().name());
        if (channel.getEndpoint() != null) {
            values.put("channel_endpoint", channel.getEndpoint());
        }
        if (protocolName != null) {
            values.put("protocol_name", protocolName);
        }
    }
}
