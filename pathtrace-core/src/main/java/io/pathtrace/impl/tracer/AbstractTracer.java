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

import io.pathtrace.agent.Agent;
import io.pathtrace.agent.TracerField;
import io.pathtrace.api.PathStructureException;
import io.pathtrace.api.ThreadAffinityException;
import io.pathtrace.api.TracedCallable;
import io.pathtrace.api.TracedRunnable;
import io.pathtrace.api.Tracer;
import io.pathtrace.impl.Path;
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.StartedTracerReference;
import io.pathtrace.impl.tag.TagCodec;
import io.pathtrace.impl.tag.TracerId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The state machine shared by all tracer kinds.
 * <p>
 * All mutations happen on the thread which created the tracer.
 * The only exception are {@link LinkKind#TAG_LINKED} children,
 * which the {@link io.pathtrace.impl.CorrelationResolver} adds under the lock of the archive,
 * hence the copy-on-write child list.
 * </p>
 */
public abstract class AbstractTracer implements Tracer {

    private static final Logger logger = LoggerFactory.getLogger(AbstractTracer.class);

    protected final PathTracer pathTracer;
    protected final Agent agent;
    private final TracerId id;
    private final TracerKind kind;
    private final long ownerThreadId;
    private final String ownerThreadName;
    private final List<TracerLink> children = new CopyOnWriteArrayList<>();
    private final Map<String, Object> customAttributes = Collections.synchronizedMap(new LinkedHashMap<String, Object>());
    private volatile TracerState state = TracerState.CREATED;
    @Nullable
    private volatile Path path;
    @Nullable
    private volatile StartedTracerReference startedReference;
    private volatile boolean recorded;
    @Nullable
    private volatile ErrorInfo errorInfo;
    @Nullable
    private String incomingStringTag;
    @Nullable
    private byte[] incomingByteTag;
    @Nullable
    private volatile TracerId incomingTagId;
    private volatile boolean incomingTagResolved;
    @Nullable
    private volatile AbstractTracer linkedParent;

    protected AbstractTracer(PathTracer pathTracer, TracerId id, TracerKind kind) {
        this.pathTracer = pathTracer;
        this.agent = pathTracer.getAgent();
        this.id = id;
        this.kind = kind;
        final Thread currentThread = Thread.currentThread();
        this.ownerThreadId = currentThread.getId();
        this.ownerThreadName = currentThread.getName();
    }

    @Override
    public void start() {
        checkThread();
        if (state != TracerState.CREATED) {
            throw new IllegalStateException(this + " has state " + state + ", but needs " + TracerState.CREATED);
        }
        applyIncomingTag();
        pathTracer.startTracer(this);
    }

    @Override
    public void end() {
        checkThread();
        if (state == TracerState.ENDED) {
            return;
        }
        if (state == TracerState.CREATED) {
            logger.debug("{} ended without having been started", this);
            state = TracerState.ENDED;
            agent.endTracer(id);
            return;
        }
        for (TracerLink link : children) {
            if (link.getKind() == LinkKind.CHILD && link.getTracer().getState() == TracerState.STARTED) {
                throw new PathStructureException("Ending tracer " + this + " that has un-ended children: " + children);
            }
        }
        pathTracer.endTracer(this);
    }

    @Override
    public void close() {
        end();
    }

    @Override
    public void markFailed(@Nullable String errorClass, @Nullable String message) {
        checkThread();
        if (state != TracerState.STARTED) {
            throw new IllegalStateException("Can only mark started tracers as failed, but " + this + " is " + state);
        }
        if (errorInfo != null) {
            throw new IllegalStateException(this + " has already been marked as failed with " + errorInfo);
        }
        errorInfo = new ErrorInfo(errorClass, message);
        agent.errorTracer(id, errorClass, message);
    }

    @Override
    public void markFailed(Throwable throwable) {
        markFailed(throwable.getClass().getName(), throwable.getMessage());
    }

    @Override
    public <T, E extends Exception> T call(TracedCallable<T, E> callable) throws E {
        start();
        Throwable failure = null;
        try {
            return callable.call();
        } catch (Throwable t) {
            failure = t;
            recordFailure(t);
            throw t;
        } finally {
            endAfterScope(failure);
        }
    }

    @Override
    public <E extends Exception> void run(TracedRunnable<E> runnable) throws E {
        start();
        Throwable failure = null;
        try {
            runnable.run();
        } catch (Throwable t) {
            failure = t;
            recordFailure(t);
            throw t;
        } finally {
            endAfterScope(failure);
        }
    }

    /**
     * A usage error detected while ending must not replace the failure of the traced code,
     * it is attached to it instead.
     */
    private void endAfterScope(@Nullable Throwable failure) {
        if (failure == null) {
            end();
            return;
        }
        try {
            end();
        } catch (RuntimeException e) {
            failure.addSuppressed(e);
        }
    }

    private void recordFailure(Throwable t) {
        // the traced code may have recorded a more specific failure or ended the tracer itself
        if (state == TracerState.STARTED && errorInfo == null) {
            markFailed(t);
        }
    }

    /**
     * @throws UnsupportedOperationException if this kind of tracer has no tag
     */
    public String getOutgoingStringTag() {
        checkOutgoingTag();
        return recorded ? agent.getOutgoingStringTag(id) : "";
    }

    /**
     * @throws UnsupportedOperationException if this kind of tracer has no tag
     */
    public byte[] getOutgoingByteTag() {
        checkOutgoingTag();
        return recorded ? agent.getOutgoingByteTag(id) : new byte[0];
    }

    private void checkOutgoingTag() {
        checkThread();
        if (!kind.isOutgoingTaggable()) {
            throw new UnsupportedOperationException(kind.getDisplayName() + " tracers are not outgoing-taggable");
        }
        if (state != TracerState.STARTED) {
            throw new IllegalStateException("Can only obtain the tag of started tracers, but " + this + " is " + state);
        }
    }

    /**
     * The tag is applied when the tracer starts.
     * If a byte tag is set as well, neither is applied.
     *
     * @throws UnsupportedOperationException if this kind of tracer cannot continue tagged work
     */
    public void setIncomingStringTag(@Nullable String tag) {
        checkIncomingTag();
        incomingStringTag = tag;
    }

    /**
     * @see #setIncomingStringTag(String)
     */
    public void setIncomingByteTag(@Nullable byte[] tag) {
        checkIncomingTag();
        incomingByteTag = tag != null ? tag.clone() : null;
    }

    private void checkIncomingTag() {
        if (!kind.isIncomingTaggable()) {
            checkThread();
            throw new UnsupportedOperationException(kind.getDisplayName() + " tracers are not incoming-taggable");
        }
        checkEntryField("incoming tag");
    }

    private void applyIncomingTag() {
        final String stringTag = incomingStringTag;
        final byte[] byteTag = incomingByteTag;
        if (stringTag != null && byteTag != null) {
            pathTracer.getDiagnostics().warn("Both string and byte tag specified for " + this + ", ignoring both");
            incomingStringTag = null;
            incomingByteTag = null;
        } else if (stringTag != null && !stringTag.isEmpty()) {
            incomingTagId = TagCodec.decodeIncoming(stringTag);
            agent.setIncomingStringTag(id, stringTag);
        } else if (byteTag != null && byteTag.length > 0) {
            incomingTagId = TagCodec.decodeIncoming(byteTag);
            agent.setIncomingByteTag(id, byteTag);
        }
    }

    /**
     * For tracers which continue work identified by something else than an incoming tag, like an in-process link.
     */
    protected void setIncomingTagId(@Nullable TracerId incomingTagId) {
        this.incomingTagId = incomingTagId;
    }

    public void addCustomAttribute(String key, Object value) {
        checkThread();
        if (state != TracerState.STARTED) {
            throw new IllegalStateException("Can only add attributes to started tracers, but " + this + " is " + state);
        }
        customAttributes.put(key, value);
        agent.addCustomRequestAttribute(id, key, value);
    }

    /**
     * Fields describing the request may only be set before the tracer is started.
     */
    protected void checkEntryField(String fieldName) {
        checkThread();
        if (state != TracerState.CREATED) {
            throw new IllegalStateException("Attempt to set entry field too late: " + fieldName + " on " + this + " in state " + state);
        }
    }

    /**
     * Fields describing the outcome may be set until the tracer ends.
     */
    protected void checkExitField(String fieldName) {
        checkThread();
        if (state == TracerState.ENDED) {
            throw new IllegalStateException("Attempt to set " + fieldName + " on ended tracer " + this);
        }
    }

    protected void setField(TracerField field, @Nullable Object value) {
        agent.setField(id, field, value);
    }

    protected void addEntry(List<KeyValuePair> entries, TracerField field, String key, String value) {
        entries.add(new KeyValuePair(key, value));
        agent.addEntry(id, field, key, value);
    }

    public void checkThread() {
        final Thread currentThread = Thread.currentThread();
        if (currentThread.getId() != ownerThreadId) {
            throw new ThreadAffinityException(this + " was created on thread " + ownerThreadName + " (" + ownerThreadId +
                "), but thread " + currentThread.getName() + " (" + currentThread.getId() + ") attempted an access");
        }
    }

    // callbacks of the path model

    /**
     * @param path      the path the tracer has been pushed onto, {@code null} if it was started outside of any path
     * @param reference the registration which reports this tracer if it is garbage collected before it ends
     */
    public void onStarted(@Nullable Path path, StartedTracerReference reference) {
        this.path = path;
        this.startedReference = reference;
        this.recorded = path != null;
        this.state = TracerState.STARTED;
    }

    public void onEnded() {
        this.state = TracerState.ENDED;
        this.path = null;
    }

    public void addChild(TracerLink link) {
        children.add(link);
    }

    /**
     * Links this tracer to the tracer whose tag it carried.
     */
    public void onIncomingTagResolved(AbstractTracer parent) {
        linkedParent = parent;
        incomingTagResolved = true;
        parent.addChild(new TracerLink(LinkKind.TAG_LINKED, this));
    }

    // accessors

    public TracerId getId() {
        return id;
    }

    public TracerKind getKind() {
        return kind;
    }

    public TracerState getState() {
        return state;
    }

    public long getOwnerThreadId() {
        return ownerThreadId;
    }

    public String getOwnerThreadName() {
        return ownerThreadName;
    }

    @Nullable
    public StartedTracerReference getStartedReference() {
        return startedReference;
    }

    @Nullable
    public Path getPath() {
        return path;
    }

    /**
     * @return whether this tracer was started within a path and is therefore part of a completed tree once it ends
     */
    public boolean isRecorded() {
        return recorded;
    }

    public List<TracerLink> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<AbstractTracer> getChildren(LinkKind linkKind) {
        final List<AbstractTracer> result = new ArrayList<>();
        for (TracerLink link : children) {
            if (link.getKind() == linkKind) {
                result.add(link.getTracer());
            }
        }
        return result;
    }

    @Nullable
    public ErrorInfo getErrorInfo() {
        return errorInfo;
    }

    @Nullable
    public TracerId getIncomingTagId() {
        return incomingTagId;
    }

    public boolean isIncomingTagResolved() {
        return incomingTagResolved;
    }

    @Nullable
    public AbstractTracer getLinkedParent() {
        return linkedParent;
    }

    public Map<String, Object> getCustomAttributes() {
        synchronized (customAttributes) {
            return new LinkedHashMap<>(customAttributes);
        }
    }

    /**
     * @return the constructor arguments and fields of this tracer, in a stable order
     */
    public Map<String, Object> getValues() {
        final Map<String, Object> values = new LinkedHashMap<>();
        collectValues(values);
        return values;
    }

    protected abstract void collectValues(Map<String, Object> values);

    /**
     * Renders this tracer and all its children as an indented tree.
     */
    public String dump() {
        final StringBuilder sb = new StringBuilder();
        dump(sb, "");
        return sb.toString();
    }

    private void dump(StringBuilder sb, String indent) {
        sb.append(indent).append(this).append("(S=").append(state);
        final TracerId tagId = incomingTagId;
        if (tagId != null) {
            sb.append(",I=").append(incomingTagResolved ? "" : "!").append(tagId);
        }
        final ErrorInfo error = errorInfo;
        if (error != null) {
            sb.append(",E=").append(error);
        }
        sb.append(')');
        final Map<String, Object> values = getValues();
        if (!values.isEmpty()) {
            sb.append('\n').append(indent).append(" V=").append(values);
        }
        for (TracerLink link : children) {
            sb.append('\n').append(indent).append(' ').append(link.getKind()).append('\n');
            link.getTracer().dump(sb, indent + "  ");
        }
    }

    @Override
    public String toString() {
        return kind.getDisplayName() + "#" + id.getLow();
    }
}
