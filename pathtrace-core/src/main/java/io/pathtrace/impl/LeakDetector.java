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

import io.pathtrace.configuration.CoreConfiguration;
import io.pathtrace.context.LifecycleListener;
import io.pathtrace.util.ExecutorUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Reports tracers which were started but never ended.
 * <p>
 * A started tracer which the application drops can never be ended.
 * It is reported once the garbage collector has reclaimed it.
 * Tracers of a thread which has terminated can't be ended either, even if they are still referenced.
 * Each of them is reported to the {@link Diagnostics} and the path of that thread is dropped.
 * </p>
 */
public class LeakDetector implements Runnable, LifecycleListener {

    private static final Logger logger = LoggerFactory.getLogger(LeakDetector.class);

    @Nullable
    private PathTracer tracer;
    @Nullable
    private ScheduledThreadPoolExecutor scheduler;

    @Override
    public void start(PathTracer tracer) {
        this.tracer = tracer;
        final long interval = tracer.getConfig(CoreConfiguration.class).getLeakDetectionInterval();
        if (interval <= 0) {
            logger.debug("Leak detection is disabled");
            return;
        }
        scheduler = ExecutorUtils.createSingleThreadSchedulingDaemonPool("leak-detector");
        scheduler.scheduleWithFixedDelay(this, interval, interval, TimeUnit.MILLISECONDS);
    }

    @Override
    public void run() {
        if (tracer != null) {
            detectLeaks(tracer);
        }
    }

    /**
     * @return the number of leaked tracers found
     */
    int detectLeaks(PathTracer tracer) {
        int leaked = tracer.reportReclaimedTracers();
        for (Path path : tracer.getLivePaths()) {
            if (path.isOwnerAlive()) {
                continue;
            }
            for (StartedTracerReference reference : path.getStartedReferences()) {
                if (tracer.unregister(reference)) {
                    tracer.getDiagnostics().warn("Un-ended tracer " + reference.getDescription() + " on terminated thread " +
                        path.getOwnerThreadName());
                    leaked++;
                }
            }
            tracer.discardPath(path);
        }
        return leaked;
    }

    @Override
    public void stop() {
        if (scheduler != null) {
            ExecutorUtils.shutdownAndWaitTermination(scheduler, 1000);
        }
    }
}
