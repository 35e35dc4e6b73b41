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
package io.pathtrace.impl;

import io.pathtrace.agent.Agent;
import io.pathtrace.api.AgentState;
import io.pathtrace.api.Channel;
import io.pathtrace.api.CustomServiceTracer;
import io.pathtrace.api.DatabaseInfo;
import io.pathtrace.api.DatabaseRequestTracer;
import io.pathtrace.api.DiagnosticCallback;
import io.pathtrace.api.InProcessLinkTracer;
import io.pathtrace.api.IncomingMessageProcessTracer;
import io.pathtrace.api.IncomingMessageReceiveTracer;
import io.pathtrace.api.IncomingRemoteCallTracer;
import io.pathtrace.api.IncomingWebRequestTracer;
import io.pathtrace.api.MessagingDestinationType;
import io.pathtrace.api.MessagingSystemInfo;
import io.pathtrace.api.OutgoingMessageTracer;
import io.pathtrace.api.OutgoingRemoteCallTracer;
import io.pathtrace.api.OutgoingWebRequestTracer;
import io.pathtrace.api.PathSdk;
import io.pathtrace.api.TraceContextInfo;
import io.pathtrace.api.WebApplicationInfo;
import io.pathtrace.impl.tracer.AbstractTracer;
import io.pathtrace.impl.tracer.CustomServiceTracerImpl;
import io.pathtrace.impl.tracer.DatabaseRequestTracerImpl;
import io.pathtrace.impl.tracer.InProcessLinkTracerImpl;
import io.pathtrace.impl.tracer.IncomingMessageProcessTracerImpl;
import io.pathtrace.impl.tracer.IncomingMessageReceiveTracerImpl;
import io.pathtrace.impl.tracer.IncomingRemoteCallTracerImpl;
import io.pathtrace.impl.tracer.IncomingWebRequestTracerImpl;
import io.pathtrace.impl.tracer.OutgoingMessageTracerImpl;
import io.pathtrace.impl.tracer.OutgoingRemoteCallTracerImpl;
import io.pathtrace.impl.tracer.OutgoingWebRequestTracerImpl;
import io.pathtrace.util.KeyValues;

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

import static io.pathtrace.util.Arguments.requireNonEmpty;
import static io.pathtrace.util.Arguments.requireNonNull;

/**
 * Validates the arguments of the tracer factories and wires new tracers to the {@link PathTracer}.
 * <p>
 * Required arguments are checked before the agent learns about a tracer.
 * Once a tracer exists, a failure while applying optional arguments ends it before the failure is rethrown,
 * so that it never lingers in the created state.
 * </p>
 */
class PathSdkImpl implements PathSdk {

    private final PathTracer pathTracer;
    private final Agent agent;
    private final Diagnostics diagnostics;
    private final KeyValues.Consumer<Object> customRequestAttributeAdder = new KeyValues.Consumer<Object>() {
        @Override
        public void accept(String key, Object value) {
            addTypedCustomRequestAttribute(key, value);
        }
    };

    PathSdkImpl(PathTracer pathTracer) {
        this.pathTracer = pathTracer;
        this.agent = pathTracer.getAgent();
        this.diagnostics = pathTracer.getDiagnostics();
    }

    @Override
    public DatabaseInfo createDatabaseInfo(String name, String vendor, Channel channel) {
        return new DatabaseInfo(requireNonEmpty(name, "database name"), requireNonEmpty(vendor, "database vendor"),
            requireNonNull(channel, "channel"));
    }

    @Override
    public WebApplicationInfo createWebApplicationInfo(String virtualHost, String applicationId, String contextRoot) {
        return new WebApplicationInfo(requireNonEmpty(virtualHost, "virtual host"), requireNonEmpty(applicationId, "application id"),
            requireNonEmpty(contextRoot, "context root"));
    }

    @Override
    public MessagingSystemInfo createMessagingSystemInfo(String vendor, String destinationName, MessagingDestinationType destinationType,
                                                         Channel channel) {
        return new MessagingSystemInfo(requireNonEmpty(vendor, "messaging vendor"), requireNonEmpty(destinationName, "destination name"),
            requireNonNull(destinationType, "destination type"), requireNonNull(channel, "channel"));
    }

    @Override
    public IncomingRemoteCallTracer traceIncomingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint) {
        return traceIncomingRemoteCall(serviceMethod, serviceName, serviceEndpoint, null, null, null);
    }

    @Override
    public IncomingRemoteCallTracer traceIncomingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint,
                                                            @Nullable String protocolName, @Nullable String stringTag, @Nullable byte[] byteTag) {
        requireNonEmpty(serviceMethod, "service method");
        requireNonEmpty(serviceName, "service name");
        requireNonEmpty(serviceEndpoint, "service endpoint");
        final IncomingRemoteCallTracerImpl tracer = new IncomingRemoteCallTracerImpl(pathTracer,
            agent.createIncomingRemoteCall(serviceMethod, serviceName, serviceEndpoint), serviceMethod, serviceName, serviceEndpoint);
        try {
            if (protocolName != null) {
                tracer.setProtocolName(protocolName);
            }
            applyIncomingTag(tracer, stringTag, byteTag);
        } catch (RuntimeException e) {
            tracer.end();
            throw e;
        }
        return tracer;
    }

    @Override
    public OutgoingRemoteCallTracer traceOutgoingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint, Channel channel) {
        return traceOutgoingRemoteCall(serviceMethod, serviceName, serviceEndpoint, channel, null);
    }

    @Override
    public OutgoingRemoteCallTracer traceOutgoingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint, Channel channel,
                                                            @Nullable String protocolName) {
        requireNonEmpty(serviceMethod, "service method");
        requireNonEmpty(serviceName, "service name");
        requireNonEmpty(serviceEndpoint, "service endpoint");
        requireNonNull(channel, "channel");
        final OutgoingRemoteCallTracerImpl tracer = new OutgoingRemoteCallTracerImpl(pathTracer,
            agent.createOutgoingRemoteCall(serviceMethod, serviceName, serviceEndpoint, channel), serviceMethod, serviceName,
            serviceEndpoint, channel);
        if (protocolName != null) {
            try {
                tracer.setProtocolName(protocolName);
            } catch (RuntimeException e) {
                tracer.end();
                throw e;
            }
        }
        return tracer;
    }

    @Override
    public DatabaseRequestTracer traceSqlDatabaseRequest(DatabaseInfo database, String statement) {
        requireNonNull(database, "database");
        requireNonEmpty(statement, "statement");
        return new DatabaseRequestTracerImpl(pathTracer, agent.createDatabaseRequest(database, statement), database, statement);
    }

    @Override
    public IncomingWebRequestTracer traceIncomingWebRequest(WebApplicationInfo webApplication, String url, String method) {
        return traceIncomingWebRequest(webApplication, url, method, null, null, null, null);
    }

    @Override
    public IncomingWebRequestTracer traceIncomingWebRequest(WebApplicationInfo webApplication, String url, String method,
                                                            @Nullable Map<String, String> headers, @Nullable String remoteAddress,
                                                            @Nullable String stringTag, @Nullable byte[] byteTag) {
        requireNonNull(webApplication, "web application");
        requireNonEmpty(url, "url");
        requireNonEmpty(method, "method");
        final IncomingWebRequestTracerImpl tracer = new IncomingWebRequestTracerImpl(pathTracer,
            agent.createIncomingWebRequest(webApplication, url, method), webApplication, url, method);
        try {
            if (headers != null) {
                tracer.addRequestHeaders(headers);
            }
            if (remoteAddress != null) {
                tracer.setRemoteAddress(remoteAddress);
            }
            applyIncomingTag(tracer, stringTag, byteTag);
        } catch (RuntimeException e) {
            tracer.end();
            throw e;
        }
        return tracer;
    }

    @Override
    public OutgoingWebRequestTracer traceOutgoingWebRequest(String url, String method) {
        return traceOutgoingWebRequest(url, method, null);
    }

    @Override
    public OutgoingWebRequestTracer traceOutgoingWebRequest(String url, String method, @Nullable Map<String, String> headers) {
        requireNonEmpty(url, "url");
        requireNonEmpty(method, "method");
        final OutgoingWebRequestTracerImpl tracer = new OutgoingWebRequestTracerImpl(pathTracer, agent.createOutgoingWebRequest(url, method),
            url, method);
        if (headers != null) {
            try {
                tracer.addRequestHeaders(headers);
            } catch (RuntimeException e) {
                tracer.end();
                throw e;
            }
        }
        return tracer;
    }

    @Override
    public OutgoingMessageTracer traceOutgoingMessage(MessagingSystemInfo messagingSystem) {
        requireNonNull(messagingSystem, "messaging system");
        return new OutgoingMessageTracerImpl(pathTracer, agent.createOutgoingMessage(messagingSystem), messagingSystem);
    }

    @Override
    public IncomingMessageReceiveTracer traceIncomingMessageReceive(MessagingSystemInfo messagingSystem) {
        requireNonNull(messagingSystem, "messaging system");
        return new IncomingMessageReceiveTracerImpl(pathTracer, agent.createIncomingMessageReceive(messagingSystem), messagingSystem);
    }

    @Override
    public IncomingMessageProcessTracer traceIncomingMessageProcess(MessagingSystemInfo messagingSystem) {
        return traceIncomingMessageProcess(messagingSystem, null, null);
    }

    @Override
    public IncomingMessageProcessTracer traceIncomingMessageProcess(MessagingSystemInfo messagingSystem, @Nullable String stringTag,
                                                                    @Nullable byte[] byteTag) {
        requireNonNull(messagingSystem, "messaging system");
        final IncomingMessageProcessTracerImpl tracer = new IncomingMessageProcessTracerImpl(pathTracer,
            agent.createIncomingMessageProcess(messagingSystem), messagingSystem);
        try {
            applyIncomingTag(tracer, stringTag, byteTag);
        } catch (RuntimeException e) {
            tracer.end();
            throw e;
        }
        return tracer;
    }

    @Override
    public CustomServiceTracer traceCustomService(String serviceMethod, String serviceName) {
        requireNonEmpty(serviceMethod, "service method");
        requireNonEmpty(serviceName, "service name");
        return new CustomServiceTracerImpl(pathTracer, agent.createCustomService(serviceMethod, serviceName), serviceMethod, serviceName);
    }

    @Override
    public byte[] createInProcessLink() {
        final AbstractTracer active = pathTracer.getActive();
        if (active == null) {
            return new byte[0];
        }
        return agent.createInProcessLink(active.getId());
    }

    @Override
    public InProcessLinkTracer traceInProcessLink(byte[] link) {
        requireNonNull(link, "link");
        return new InProcessLinkTracerImpl(pathTracer, agent.createInProcessLinkTracer(link), link);
    }

    @Override
    public void addCustomRequestAttribute(String key, String value) {
        addCustomRequestAttributeInternal(key, requireNonNull(value, "value"));
    }

    @Override
    public void addCustomRequestAttribute(String key, long value) {
        addCustomRequestAttributeInternal(key, value);
    }

    @Override
    public void addCustomRequestAttribute(String key, double value) {
        addCustomRequestAttributeInternal(key, value);
    }

    @Override
    public void addCustomRequestAttributes(Map<String, ?> attributes) {
        KeyValues.forEach(attributes, customRequestAttributeAdder);
    }

    @Override
    public void addCustomRequestAttributes(List<String> keys, List<?> values, int count) {
        KeyValues.forEach(keys, values, count, customRequestAttributeAdder);
    }

    private void addTypedCustomRequestAttribute(String key, @Nullable Object value) {
        if (value instanceof String) {
            addCustomRequestAttribute(key, (String) value);
        } else if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            addCustomRequestAttribute(key, ((Number) value).longValue());
        } else if (value instanceof Double || value instanceof Float) {
            addCustomRequestAttribute(key, ((Number) value).doubleValue());
        } else {
            diagnostics.warn("Can't add custom request attribute '" + key + "' of unsupported type " +
                (value != null ? value.getClass().getName() : "null"));
        }
    }

    private void addCustomRequestAttributeInternal(String key, Object value) {
        requireNonEmpty(key, "attribute key");
        final AbstractTracer active = pathTracer.getActive();
        if (active == null) {
            diagnostics.warn("No active tracer, dropping custom request attribute '" + key + "'");
            return;
        }
        active.addCustomAttribute(key, value);
    }

    private void applyIncomingTag(AbstractTracer tracer, @Nullable String stringTag, @Nullable byte[] byteTag) {
        if (stringTag != null && byteTag != null) {
            diagnostics.warn("Both string and byte tag specified for " + tracer + ", ignoring both");
        } else if (stringTag != null) {
            tracer.setIncomingStringTag(stringTag);
        } else if (byteTag != null) {
            tracer.setIncomingByteTag(byteTag);
        }
    }

    @Override
    public TraceContextInfo getTraceContextInfo() {
        return pathTracer.getTraceContextInfo();
    }

    @Override
    public AgentState getAgentState() {
        return agent.getState();
    }

    @Override
    public String getAgentVersionString() {
        return agent.getVersionString();
    }

    @Override
    public boolean isAgentFound() {
        return agent.isFound();
    }

    @Override
    public boolean isAgentCompatible() {
        return agent.isCompatible();
    }

    @Override
    public void setDiagnosticCallback(@Nullable DiagnosticCallback callback) {
        diagnostics.setCallback(callback);
        agent.setDiagnosticCallback(callback);
    }

    @Override
    public void shutdown() {
        pathTracer.stop();
    }
}
