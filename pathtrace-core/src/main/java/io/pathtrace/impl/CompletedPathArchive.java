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

import io.pathtrace.impl.tag.TracerId;
import io.pathtrace.impl.tracer.AbstractTracer;
import io.pathtrace.impl.tracer.LinkKind;
import io.pathtrace.impl.tracer.TracerLink;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The roots of all completed paths, shared by all threads.
 * Every access happens under a single lock;
 * appends are rare compared to starting and ending tracers, which need no lock at all.
 */
public class CompletedPathArchive {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<AbstractTracer> roots = new ArrayList<>();

    void add(AbstractTracer root) {
        lock.lock();
        try {
            roots.add(root);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Holds the lock while the action runs, so that no root is added in the meantime.
     */
    <T> T withLock(LockedAction<T> action) {
        lock.lock();
        try {
            return action.run(roots);
        } finally {
            lock.unlock();
        }
    }

    interface LockedAction<T> {
        T run(List<AbstractTracer> roots);
    }

    public List<AbstractTracer> getRoots() {
        lock.lock();
        try {
            return new ArrayList<>(roots);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return all roots and their {@link LinkKind#CHILD} descendants, each root followed by its subtree in depth-first order
     */
    public List<AbstractTracer> allNodes() {
        final List<AbstractTracer> result = new ArrayList<>();
        for (AbstractTracer root : getRoots()) {
            collectSubtree(root, result);
        }
        return result;
    }

    static void collectSubtree(AbstractTracer node, List<AbstractTracer> result) {
        result.add(node);
        for (TracerLink link : node.getChildren()) {
            if (link.getKind() == LinkKind.CHILD) {
                collectSubtree(link.getTracer(), result);
            }
        }
    }

    @Nullable
    public AbstractTracer findById(TracerId id) {
        for (AbstractTracer node : allNodes()) {
            if (node.getId().equals(id)) {
                return node;
            }
        }
        return null;
    }

    public int size() {
        lock.lock();
        try {
            return roots.size();
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            roots.clear();
        } finally {
            lock.unlock();
        }
    }
}
