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

/**
 * The kinds of tracers and their capabilities.
 * The flags correspond to the capability interfaces of the API
 * ({@link io.pathtrace.api.Entrypoint}, {@link io.pathtrace.api.IncomingTaggable}, {@link io.pathtrace.api.OutgoingTaggable}).
 */
public enum TracerKind {
    INCOMING_REMOTE_CALL("IncomingRemoteCall", true, true, false),
    OUTGOING_REMOTE_CALL("OutgoingRemoteCall", false, false, true),
    DATABASE_REQUEST("DatabaseRequest", false, false, false),
    INCOMING_WEB_REQUEST("IncomingWebRequest", true, true, false),
    OUTGOING_WEB_REQUEST("OutgoingWebRequest", false, false, true),
    OUTGOING_MESSAGE("OutgoingMessage", false, false, true),
    INCOMING_MESSAGE_RECEIVE("IncomingMessageReceive", true, false, false),
    INCOMING_MESSAGE_PROCESS("IncomingMessageProcess", true, true, false),
    CUSTOM_SERVICE("CustomService", true, false, false),
    IN_PROCESS_LINK("InProcessLink", true, false, false);

    private final String displayName;
    private final boolean entrypoint;
    private final boolean incomingTaggable;
    private final boolean outgoingTaggable;

    TracerKind(String displayName, boolean entrypoint, boolean incomingTaggable, boolean outgoingTaggable) {
        this.displayName = displayName;
        this.entrypoint = entrypoint;
        this.incomingTaggable = incomingTaggable;
        this.outgoingTaggable = outgoingTaggable;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * @return whether tracers of this kind may start a new path
     */
    public boolean isEntrypoint() {
        return entrypoint;
    }

    public boolean isIncomingTaggable() {
        return incomingTaggable;
    }

    public boolean isOutgoingTaggable() {
        return outgoingTaggable;
    }
}
