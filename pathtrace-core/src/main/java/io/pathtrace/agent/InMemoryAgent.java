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
import io.pathtrace.impl.tag.TagCodec;
import io.pathtrace.impl.tag.TracerId;
import io.pathtrace.impl.tag.TracerIdGenerator;
import io.pathtrace.util.HexUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * An agent which keeps everything it is told in memory and strictly rejects calls in the wrong state.
 * <p>
 * Useful for tests and for inspecting what an application reports without transmitting anything.
 * </p>
 */
public class InMemoryAgent implements Agent {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryAgent.class);
    static final String VERSION = "1.0.0/in-memory";

    private final TracerIdGenerator idGenerator;
    private final Map<TracerId, RecordedTracer> recordedTracers = new ConcurrentHashMap<>();
    private volatile AgentState state = AgentState.NOT_INITIALIZED;
    @Nullable
    private volatile DiagnosticCallback diagnosticCallback;

    public InMemoryAgent() {
        this(new TracerIdGenerator());
    }

    public InMemoryAgent(TracerIdGenerator idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public void initialize() {
        state = AgentState.ACTIVE;
        logger.debug("In-memory agent initialized");
    }

    @Override
    public void shutdown() {
        state = AgentState.PERMANENTLY_INACTIVE;
    }

    @Override
    public AgentState getState() {
        return state;
    }

    @Override
    public String getVersionString() {
        return VERSION;
    }

    @Override
    public boolean isFound() {
        return true;
    }

    @Override
    public boolean isCompatible() {
        return true;
    }

    @Override
    public void setDiagnosticCallback(@Nullable DiagnosticCallback callback) {
        this.diagnosticCallback = callback;
    }

    @Override
    public TracerId createIncomingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint) {
        return create("IncomingRemoteCall", serviceMethod, serviceName, serviceEndpoint);
    }

    @Override
    public TracerId createOutgoingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint, Channel channel) {
        return create("OutgoingRemoteCall", serviceMethod, serviceName, serviceEndpoint, channel);
    }

    @Override
    public TracerId createDatabaseRequest(DatabaseInfo database, String statement) {
        return create("DatabaseRequest", database, statement);
    }

    @Override
    public TracerId createIncomingWebRequest(WebApplicationInfo webApplication, String url, String method) {
        return create("IncomingWebRequest", webApplication, url, method);
    }

    @Override
    public TracerId createOutgoingWebRequest(String url, String method) {
        return create("OutgoingWebRequest", url, method);
    }

    @Override
    public TracerId createOutgoingMessage(MessagingSystemInfo messagingSystem) {
        return create("OutgoingMessage", messagingSystem);
    }

    @Override
    public TracerId createIncomingMessageReceive(MessagingSystemInfo messagingSystem) {
        return create("IncomingMessageReceive", messagingSystem);
    }

    @Override
    public TracerId createIncomingMessageProcess(MessagingSystemInfo messagingSystem) {
        return create("IncomingMessageProcess", messagingSystem);
    }

    @Override
    public TracerId createCustomService(String serviceMethod, String serviceName) {
        return create("CustomService", serviceMethod, serviceName);
    }

    @Override
    public TracerId createInProcessLinkTracer(byte[] link) {
        return create("InProcessLink", HexUtils.bytesToHex(link));
    }

    private TracerId create(String kind, Object... arguments) {
        final TracerId id = idGenerator.next();
        recordedTracers.put(id, new RecordedTracer(id, kind, Arrays.asList(arguments)));
        return id;
    }

    @Override
    public void setField(TracerId id, TracerField field, @Nullable Object value) {
        final RecordedTracer tracer = get(id);
        tracer.assertNotEnded("set " + field);
        tracer.fields.put(field, value);
    }

    @Override
    public void addEntry(TracerId id, TracerField field, String key, String value) {
        final RecordedTracer tracer = get(id);
        tracer.assertNotEnded("add " + field);
        synchronized (tracer) {
            List<String> entries = tracer.entries.get(field);
            if (entries == null) {
                entries = new ArrayList<>();
                tracer.entries.put(field, entries);
            }
            entries.add(key + "=" + value);
        }
    }

    @Override
    public void addCustomRequestAttribute(TracerId id, String key, Object value) {
        final RecordedTracer tracer = get(id);
        tracer.assertState(RecordedTracer.State.STARTED, "add a custom request attribute");
        tracer.customRequestAttributes.put(key, value);
    }

    @Override
    public void startTracer(TracerId id) {
        final RecordedTracer tracer = get(id);
        tracer.assertState(RecordedTracer.State.CREATED, "start");
        tracer.state = RecordedTracer.State.STARTED;
    }

    @Override
    public void endTracer(TracerId id) {
        get(id).state = RecordedTracer.State.ENDED;
    }

    @Override
    public void errorTracer(TracerId id, @Nullable String errorClass, @Nullable String message) {
        final RecordedTracer tracer = get(id);
        tracer.assertState(RecordedTracer.State.STARTED, "mark as failed");
        if (tracer.failed) {
            throw new IllegalStateException(tracer + " has already been marked as failed");
        }
        tracer.failed = true;
        tracer.errorClass = errorClass;
        tracer.errorMessage = message;
    }

    @Override
    public String getOutgoingStringTag(TracerId id) {
        get(id).assertState(RecordedTracer.State.STARTED, "obtain a tag");
        return TagCodec.encodeOutgoing(id).getStringTag();
    }

    @Override
    public byte[] getOutgoingByteTag(TracerId id) {
        get(id).assertState(RecordedTracer.State.STARTED, "obtain a tag");
        return TagCodec.encodeOutgoing(id).getByteTag();
    }

    @Override
    public void setIncomingStringTag(TracerId id, String tag) {
        final RecordedTracer tracer = get(id);
        tracer.assertState(RecordedTracer.State.CREATED, "set a tag");
        tracer.incomingTag = tag;
    }

    @Override
    public void setIncomingByteTag(TracerId id, byte[] tag) {
        final RecordedTracer tracer = get(id);
        tracer.assertState(RecordedTracer.State.CREATED, "set a tag");
        tracer.incomingTag = HexUtils.bytesToHex(tag);
    }

    @Override
    public byte[] createInProcessLink(TracerId activeTracer) {
        get(activeTracer).assertState(RecordedTracer.State.STARTED, "create an in-process link");
        return TagCodec.encodeInProcessLink(activeTracer);
    }

    @Override
    public TraceContextInfo getTraceContextInfo(TracerId root, TracerId active) {
        if (!recordedTracers.containsKey(active)) {
            return TraceContextInfo.INVALID;
        }
        return new TraceContextInfo(root.toHexString(), HexUtils.longToHex(active.getLow()));
    }

    /**
     * Sends a message to the diagnostic callback, as a transmitting agent would do for its own problems.
     */
    public void reportDiagnostic(String message) {
        final DiagnosticCallback callback = diagnosticCallback;
        if (callback != null) {
            callback.onDiagnostic(message);
        }
    }

    @Nullable
    public RecordedTracer getRecordedTracer(TracerId id) {
        return recordedTracers.get(id);
    }

    public Collection<RecordedTracer> getRecordedTracers() {
        return Collections.unmodifiableCollection(recordedTracers.values());
    }

    public void reset() {
        recordedTracers.clear();
    }

    private RecordedTracer get(TracerId id) {
        final RecordedTracer tracer = recordedTracers.get(id);
        if (tracer == null) {
            throw new IllegalArgumentException("Unknown tracer " + id);
        }
        return tracer;
    }

    /**
     * What the agent knows about a single tracer.
     */
    public static class RecordedTracer {

        public enum State {
            CREATED, STARTED, ENDED
        }

        private final TracerId id;
        private final String kind;
        private final List<Object> arguments;
        private final Map<TracerField, Object> fields = Collections.synchronizedMap(new LinkedHashMap<TracerField, Object>());
        private final Map<TracerField, List<String>> entries = new LinkedHashMap<>();
        private final Map<String, Object> customRequestAttributes = Collections.synchronizedMap(new LinkedHashMap<String, Object>());
        private volatile State state = State.CREATED;
        private volatile boolean failed;
        @Nullable
        private volatile String errorClass;
        @Nullable
        private volatile String errorMessage;
        @Nullable
        private volatile String incomingTag;

        RecordedTracer(TracerId id, String kind, List<Object> arguments) {
            this.id = id;
            this.kind = kind;
            this.arguments = arguments;
        }

        private void assertState(State expected, String operation) {
            if (state != expected) {
                throw new IllegalStateException("Cannot " + operation + " on " + this + " in state " + state + ", needs " + expected);
            }
        }

        private void assertNotEnded(String operation) {
            if (state == State.ENDED) {
                throw new IllegalStateException("Cannot " + operation + " on ended " + this);
            }
        }

        public TracerId getId() {
            return id;
        }

        public String getKind() {
            return kind;
        }

        public List<Object> getArguments() {
            return arguments;
        }

        public State getState() {
            return state;
        }

        public boolean isFailed() {
            return failed;
        }

        @Nullable
        public String getErrorClass() {
            return errorClass;
        }

        @Nullable
        public String getErrorMessage() {
            return errorMessage;
        }

        @Nullable
        public String getIncomingTag() {
            return incomingTag;
        }

        @Nullable
        public Object getField(TracerField field) {
            return fields.get(field);
        }

        public synchronized List<String> getEntries(TracerField field) {
            final List<String> values = entries.get(field);
            return values != null ? new ArrayList<>(values) : Collections.<String>emptyList();
        }

        public Map<String, Object> getCustomRequestAttributes() {
            return customRequestAttributes;
        }

        @Override
        public String toString() {
            return kind + "#" + id;
        }
    }
}
