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
package io.pathtrace;

import io.pathtrace.agent.NoopAgent;
import io.pathtrace.api.AgentState;
import io.pathtrace.api.PathSdk;
import io.pathtrace.context.LifecycleListener;
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.PathTracerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.Collections;

/**
 * Process-wide access to a shared {@link PathSdk}.
 * <p>
 * Every successful or failed {@link #initialize()} has to be balanced by one {@link #shutdown()};
 * the tracer is stopped when the last reference is released.
 * Before initialization, and after a failed one, {@link #getSdk()} returns an SDK backed by the {@link NoopAgent}.
 * </p>
 */
public class PathTrace {

    private static final Logger logger = LoggerFactory.getLogger(PathTrace.class);

    private static final Object lock = new Object();
    @Nullable
    private static volatile PathTracer tracer;
    @Nullable
    private static volatile PathTracer noopTracer;
    private static int referenceCount;

    PathTrace() {
        // do not instantiate
    }

    public static InitResult initialize() {
        return initialize(new PathTracerBuilder());
    }

    /**
     * @param builder used only by the first call, later calls just increase the reference count
     */
    public static InitResult initialize(PathTracerBuilder builder) {
        synchronized (lock) {
            logger.debug("initialize: reference count = {}", referenceCount);
            InitResult result;
            if (tracer != null) {
                logger.debug("Already initialized, only increasing the reference count");
                result = new InitResult(InitResult.Status.ALREADY_INITIALIZED, null);
            } else {
                result = createTracer(builder);
            }
            referenceCount++;
            return result;
        }
    }

    private static InitResult createTracer(PathTracerBuilder builder) {
        try {
            final PathTracer created = builder.build();
            tracer = created;
            if (created.getAgent().getState() != AgentState.ACTIVE) {
                logger.info("Initialized, but the agent is {}", created.getAgent().getState());
                return new InitResult(InitResult.Status.INITIALIZED_WITH_WARNING, null);
            }
            logger.debug("Initialized");
            return new InitResult(InitResult.Status.INITIALIZED, null);
        } catch (LinkageError e) {
            logger.error("Could not load the agent, continuing with the no-op agent", e);
            tracer = getNoopTracer();
            return new InitResult(InitResult.Status.STUB_LOAD_ERROR, e);
        } catch (RuntimeException e) {
            logger.error("Failed to initialize, continuing with the no-op agent", e);
            tracer = getNoopTracer();
            return new InitResult(InitResult.Status.INIT_ERROR, e);
        }
    }

    /**
     * @return the shared SDK, or a no-op SDK if {@link #initialize()} has not been called
     */
    public static PathSdk getSdk() {
        final PathTracer current = tracer;
        if (current == null) {
            return getNoopTracer().getSdk();
        }
        return current.getSdk();
    }

    /**
     * Releases one reference obtained by {@link #initialize()}.
     *
     * @return the exception thrown while stopping the tracer, {@code null} otherwise
     */
    @Nullable
    public static Throwable shutdown() {
        synchronized (lock) {
            final PathTracer current = tracer;
            if (current == null) {
                logger.warn("shutdown: not initialized or already shut down");
                referenceCount = 0;
                return null;
            }
            if (referenceCount > 1) {
                referenceCount--;
                logger.debug("shutdown: reference count is now {}", referenceCount);
                return null;
            }
            logger.info("Shutting down");
            referenceCount = 0;
            tracer = null;
            if (current == noopTracer) {
                return null;
            }
            try {
                current.stop();
            } catch (RuntimeException e) {
                logger.warn("shutdown failed", e);
                return e;
            }
            return null;
        }
    }

    static int getReferenceCount() {
        synchronized (lock) {
            return referenceCount;
        }
    }

    private static PathTracer getNoopTracer() {
        PathTracer noop = noopTracer;
        if (noop == null) {
            synchronized (lock) {
                noop = noopTracer;
                if (noop == null) {
                    noop = new PathTracerBuilder()
                        .agent(new NoopAgent())
                        .lifecycleListeners(Collections.<LifecycleListener>emptyList())
                        .build();
                    noopTracer = noop;
                }
            }
        }
        return noop;
    }
}
