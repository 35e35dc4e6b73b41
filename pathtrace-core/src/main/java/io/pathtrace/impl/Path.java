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

import io.pathtrace.api.PathStructureException;
import io.pathtrace.impl.tracer.AbstractTracer;
import io.pathtrace.impl.tracer.LinkKind;
import io.pathtrace.impl.tracer.TracerLink;
import io.pathtrace.impl.tracer.TracerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.lang.ref.WeakReference;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * The stack of started tracers of one thread.
 * Instances of this class are held in a thread-local of the {@link PathTracer}.
 * Accordingly, it is implemented without taking any thread-safety considerations into account:
 * only the owner thread mutates a path, and the {@link LeakDetector} only reads paths of threads that have terminated.
 * <p>
 * The stack refers to its tracers weakly, the application owns them.
 * A tracer which the application dropped without ending it is removed from the stack
 * the next time the owner thread uses the path, so that later tracers are not nested below it.
 * </p>
 */
public class Path {

    private static final Logger logger = LoggerFactory.getLogger(Path.class);

    private final Deque<StartedTracerReference> stack = new ArrayDeque<>();
    private final WeakReference<Thread> ownerThread;
    private final long ownerThreadId;
    private final String ownerThreadName;
    private final int maxDepth;
    private final Diagnostics diagnostics;
    private boolean overflowReported;

    Path(int maxDepth, Diagnostics diagnostics) {
        final Thread currentThread = Thread.currentThread();
        this.ownerThread = new WeakReference<>(currentThread);
        this.ownerThreadId = currentThread.getId();
        this.ownerThreadName = currentThread.getName();
        this.maxDepth = maxDepth;
        this.diagnostics = diagnostics;
    }

    /**
     * Makes the tracer the innermost active tracer of this path,
     * and a {@link LinkKind#CHILD} of the previously innermost one.
     */
    void push(AbstractTracer tracer, StartedTracerReference reference) {
        if (tracer.getState() != TracerState.CREATED) {
            throw new IllegalStateException("Tracer state " + tracer.getState() + " of " + tracer + " is != " + TracerState.CREATED);
        }
        removeReclaimed();
        if (stack.size() >= maxDepth) {
            if (!overflowReported) {
                overflowReported = true;
                diagnostics.warn("Path depth reached its maximum of " + maxDepth + " on thread " + ownerThreadName +
                    ". This is likely caused by tracers which are started but never ended. Root: " + getRoot());
            }
            throw new PathStructureException("Cannot start " + tracer + ", the path of thread " + ownerThreadName +
                " already has the maximum depth of " + maxDepth);
        }
        final AbstractTracer parent = peek();
        if (parent != null) {
            parent.addChild(new TracerLink(LinkKind.CHILD, tracer));
        }
        stack.push(reference);
        tracer.onStarted(this, reference);
        logger.debug("Started {} on thread {}, depth {}", tracer, ownerThreadName, stack.size());
    }

    void pop(AbstractTracer tracer) {
        removeReclaimed();
        final AbstractTracer top = peek();
        if (top != tracer) {
            throw new PathStructureException("Attempt to end " + tracer + " while " + top + " was active");
        }
        stack.remove(tracer.getStartedReference());
        logger.debug("Ended {} on thread {}, depth {}", tracer, ownerThreadName, stack.size());
    }

    /**
     * Drops the entries of tracers which have been garbage collected while started.
     * Their leak is reported by the {@link PathTracer} when their reference is enqueued.
     */
    private void removeReclaimed() {
        for (Iterator<StartedTracerReference> it = stack.iterator(); it.hasNext(); ) {
            final StartedTracerReference reference = it.next();
            if (reference.get() == null) {
                logger.debug("Removing reclaimed tracer {} from the path of thread {}", reference, ownerThreadName);
                it.remove();
            }
        }
    }

    @Nullable
    public AbstractTracer peek() {
        for (StartedTracerReference reference : stack) {
            final AbstractTracer tracer = reference.get();
            if (tracer != null) {
                return tracer;
            }
        }
        return null;
    }

    @Nullable
    public AbstractTracer getRoot() {
        for (Iterator<StartedTracerReference> it = stack.descendingIterator(); it.hasNext(); ) {
            final AbstractTracer tracer = it.next().get();
            if (tracer != null) {
                return tracer;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        removeReclaimed();
        return stack.isEmpty();
    }

    public int getDepth() {
        return stack.size();
    }

    /**
     * @return the active tracers which have not been reclaimed, outermost first
     */
    public List<AbstractTracer> getActiveTracers() {
        final List<AbstractTracer> result = new ArrayList<>(stack.size());
        for (Iterator<StartedTracerReference> it = stack.descendingIterator(); it.hasNext(); ) {
            final AbstractTracer tracer = it.next().get();
            if (tracer != null) {
                result.add(tracer);
            }
        }
        return result;
    }

    /**
     * @return the references of all tracers on this path, including reclaimed ones, outermost first
     */
    List<StartedTracerReference> getStartedReferences() {
        final List<StartedTracerReference> result = new ArrayList<>(stack.size());
        for (Iterator<StartedTracerReference> it = stack.descendingIterator(); it.hasNext(); ) {
            result.add(it.next());
        }
        return result;
    }

    /**
     * Once this returns {@code false}, the termination of the owner happens-before any subsequent read of this path.
     */
    public boolean isOwnerAlive() {
        final Thread thread = ownerThread.get();
        return thread != null && thread.isAlive();
    }

    public long getOwnerThreadId() {
        return ownerThreadId;
    }

    public String getOwnerThreadName() {
        return ownerThreadName;
    }

    @Override
    public String toString() {
        return "Path(" + ownerThreadName + ", depth " + stack.size() + ")";
    }
}
