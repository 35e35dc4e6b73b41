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
import io.pathtrace.impl.tag.TracerIdGenerator;

import javax.annotation.Nullable;

/**
 * Used when no agent is present or tracing is deactivated.
 * Every operation succeeds and tags are empty.
 * Ids are still unique, as the in-process model relies on them.
 */
public class NoopAgent implements Agent {

    private static final byte[] EMPTY = new byte[0];

    private final TracerIdGenerator idGenerator = new TracerIdGenerator();

    @Override
    public void initialize() {
    }

    @Override
    public void shutdown() {
    }

    @Override
    public AgentState getState() {
        return AgentState.PERMANENTLY_INACTIVE;
    }

    @Override
    public String getVersionString() {
        return "";
    }

    @Override
    public boolean isFound() {
        return false;
    }

    @Override
    public boolean isCompatible() {
        return false;
    }

    @Override
    public void setDiagnosticCallback(@Nullable DiagnosticCallback callback) {
    }

    @Override
    public TracerId createIncomingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint) {
        return idGenerator.next();
    }

    @Override
    public TracerId createOutgoingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint, Channel channel) {
        return idGenerator.next();
    }

    @Override
    public TracerId createDatabaseRequest(DatabaseInfo database, String statement) {
        return idGenerator.next();
    }

    @Override
    public TracerId createIncomingWebRequest(WebApplicationInfo webApplication, String url, String method) {
        return idGenerator.next();
    }

    @Override
    public TracerId createOutgoingWebRequest(String url, String method) {
        return idGenerator.next();
    }

    @Override
    public TracerId createOutgoingMessage(MessagingSystemInfo messagingSystem) {
        return idGenerator.next();
    }

    @Override
    public TracerId createIncomingMessageReceive(MessagingSystemInfo messagingSystem) {
        return idGenerator.next();
    }

    @Override
    public TracerId createIncomingMessageProcess(MessagingSystemInfo messagingSystem) {
        return idGenerator.next();
    }

    @Override
    public TracerId createCustomService(String serviceMethod, String serviceName) {
        return idGenerator.next();
    }

    @Override
    public TracerId createInProcessLinkTracer(byte[] link) {
        return idGenerator.next();
    }

    @Override
    public void setField(TracerId id, TracerField field, @Nullable Object value) {
    }

    @Override
    public void addEntry(TracerId id, TracerField field, String key, String value) {
    }

    @Override
    public void addCustomRequestAttribute(TracerId id, String key, Object value) {
    }

    @Override
    public void startTracer(TracerId id) {
    }

    @Override
    public void endTracer(TracerId id) {
    }

    @Override
    public void errorTracer(TracerId id, @Nullable String errorClass, @Nullable String message) {
    }

    @Override
    public String getOutgoingStringTag(TracerId id) {
        return "";
    }

    @Override
    public byte[] getOutgoingByteTag(TracerId id) {
        return EMPTY;
    }

    @Override
    public void setIncomingStringTag(TracerId id, String tag) {
    }

    @Override
    public void setIncomingByteTag(TracerId id, byte[] tag) {
    }

    @Override
    public byte[] createInProcessLink(TracerId activeTracer) {
        return EMPTY;
    }

    @Override
    public TraceContextInfo getTraceContextInfo(TracerId root, TracerId active) {
        return TraceContextInfo.INVALID;
    }
}
