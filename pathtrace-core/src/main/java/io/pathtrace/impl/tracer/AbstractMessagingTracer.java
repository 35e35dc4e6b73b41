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
import io.pathtrace.api.MessagingSystemInfo;
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.tag.TracerId;

import javax.annotation.Nullable;
import java.util.Map;

public abstract class AbstractMessagingTracer extends AbstractTracer {

    private final MessagingSystemInfo messagingSystem;
    @Nullable
    private String vendorMessageId;
    @Nullable
    private String correlationId;

    protected AbstractMessagingTracer(PathTracer pathTracer, TracerId id, TracerKind kind, MessagingSystemInfo messagingSystem) {
        super(pathTracer, id, kind);
        this.messagingSystem = messagingSystem;
    }

    // the broker often assigns ids only while the message is sent, so these are not entry fields
    public void setVendorMessageId(@Nullable String vendorMessageId) {
        checkExitField("vendor message id");
        this.vendorMessageId = vendorMessageId;
        setField(TracerField.VENDOR_MESSAGE_ID, vendorMessageId);
    }

    public void setCorrelationId(@Nullable String correlationId) {
        checkExitField("correlation id");
        this.correlationId = correlationId;
        setField(TracerField.CORRELATION_ID, correlationId);
    }

    public MessagingSystemInfo getMessagingSystem() {
        return messagingSystem;
    }

    @Nullable
    public String getVendorMessageId() {
        return vendorMessageId;
    }

    @Nullable
    public String getCorrelationId() {
        return correlationId;
    }

    @Override
    protected void collectValues(Map<String, Object> values) {
        values.put("vendor", messagingSystem.getVendor());
        values.put("destination_name", messagingSystem.getDestinationName());
        values.put("destination_type", messagingSystem.getDestinationType().name());
        values.put("channel_type", messagingSystem.getChannel().getType().name());
        if (messagingSystem.getChannel().getEndpoint() != null) {
            values.put("channel_endpoint", messagingSystem.getChannel().getEndpoint());
        }
        if (vendorMessageId != null) {
            values.put("vendor_message_id", vendorMessageId);
        }
        if (correlationId != null) {
            values.put("correlation_id", correlationId);
        }
    }
}
