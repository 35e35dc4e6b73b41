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

import io.pathtrace.impl.tracer.AbstractTracer;

import javax.annotation.Nullable;
import java.lang.ref.ReferenceQueue;
import java.lang.ref.WeakReference;

/**
 * Tracks a started tracer without keeping it reachable.
 * <p>
 * The tracer handle is owned by the application.
 * Once the application drops a tracer it has not ended, nobody can end it anymore,
 * and the garbage collector enqueues this reference so that the leak can be reported.
 * The description of the tracer is captured eagerly, as the referent is gone by then.
 * </p>
 */
public final class StartedTracerReference extends WeakReference<AbstractTracer> {

    private final String description;
    private final String ownerThreadName;

    StartedTracerReference(AbstractTracer tracer, @Nullable ReferenceQueue<? super AbstractTracer> queue) {
        super(tracer, queue);
        this.description = tracer.toString();
        this.ownerThreadName = tracer.getOwnerThreadName();
    }

    public String getDescription() {
        return description;
    }

    public String getOwnerThreadName() {
        return ownerThreadName;
    }

    @Override
    public String toString() {
        return description;
    }
}
