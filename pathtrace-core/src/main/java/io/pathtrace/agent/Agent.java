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
package io.pathtrace.agent;

import io.pathtrace.api.AgentState;
import io.pathtrace.api.Channel;
import io.pathtrace.api.DatabaseInfo;
import io.pathtrace.api.DiagnosticCallback;
import io.pathtrace.api.MessagingSystemInfo;
import io.pathtrace.api.TraceContextInfo;
import io.pathtrace.api.WebApplicationInfo;
import io.pathtrace.impl.tag.TracerId;

import javax.annotation.Nullable;

/**
 * The capabilities of the agent which transmits the recorded tracers.
 * <p>
 * The path and tag correlation model is maintained by the {@link io.pathtrace.impl.PathTracer} itself;
 * an agent only gets told about tracers, their values and their lifecycle.
 * Every implementation must accept the same sequence of calls,
 * so that application code behaves the same whichever agent is in use.
 * </p>
 * <p>
 * Implementations are discovered via {@link java.util.ServiceLoader} when the {@code agent} option is {@code AUTO}.
 * </p>
 */
public interface Agent {

    void initialize();

    void shutdown();

    AgentState getState();

    String getVersionString();

    /**
     * @return whether an agent which transmits data is present
     */
    boolean isFound();

    boolean isCompatible();

    void setDiagnosticCallback(@Nullable DiagnosticCallback callback);

    // tracer creation, each returns a new unique id

    TracerId createIncomingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint);

    TracerId createOutgoingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint, Channel channel);

    TracerId createDatabaseRequest(DatabaseInfo database, String statement);

    TracerId createIncomingWebRequest(WebApplicationInfo webApplication, String url, String method);

    TracerId createOutgoingWebRequest(String url, String method);

    TracerId createOutgoingMessage(MessagingSystemInfo messagingSystem);

    TracerId createIncomingMessageReceive(MessagingSystemInfo messagingSystem);

    TracerId createIncomingMessageProcess(MessagingSystemInfo messagingSystem);

    TracerId createCustomService(String serviceMethod, String serviceName);

    TracerId createInProcessLinkTracer(byte[] link);

    // tracer values

    void setField(TracerId id, TracerField field, @Nullable Object value);

    void addEntry(TracerId id, TracerField field, String key, String value);

    void addCustomRequestAttribute(TracerId id, String key, Object value);

    // lifecycle

    void startTracer(TracerId id);

    void endTracer(TracerId id);

    void errorTracer(TracerId id, @Nullable String errorClass, @Nullable String message);

    // tags

    String getOutgoingStringTag(TracerId id);

    byte[] getOutgoingByteTag(TracerId id);

    void setIncomingStringTag(TracerId id, String tag);

    void setIncomingByteTag(TracerId id, byte[] tag);

    byte[] createInProcessLink(TracerId activeTracer);

    /**
     * @param root   the root of the path of the active tracer
     * @param active the active tracer
     * @return the trace context of the active tracer, {@link TraceContextInfo#INVALID} if it is not recorded
     */
    TraceContextInfo getTraceContextInfo(TracerId root, TracerId active);
}
