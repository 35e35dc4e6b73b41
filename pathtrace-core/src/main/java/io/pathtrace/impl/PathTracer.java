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

import io.pathtrace.agent.Agent;
import io.pathtrace.api.PathSdk;
import io.pathtrace.api.TraceContextInfo;
import io.pathtrace.configuration.CoreConfiguration;
import io.pathtrace.context.LifecycleListener;
import io.pathtrace.impl.tracer.AbstractTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;

import javax.annotation.Nullable;
import java.lang.ref.Reference;
import java.lang.ref.ReferenceQueue;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maintains the path of every thread and the archive of completed paths,
 * and reports the lifecycle of tracers to the {@link Agent}.
 * <p>
 * Note that this is an internal API, so there are no guarantees in terms of backwards compatibility.
 * Applications use the {@link PathSdk} returned by {@link #getSdk()}.
 * </p>
 */
public class PathTracer {

    private static final Logger logger = LoggerFactory.getLogger(PathTracer.class);

    private final ConfigurationRegistry configurationRegistry;
    private final CoreConfiguration coreConfiguration;
    private final Agent agent;
    private final Diagnostics diagnostics;
    private final Iterable<LifecycleListener> lifecycleListeners;
    private final ThreadLocal<Path> activePath = new ThreadLocal<>();
    private final Set<Path> livePaths = ConcurrentHashMap.newKeySet();
    private final Set<StartedTracerReference> startedTracers = ConcurrentHashMap.newKeySet();
    private final ReferenceQueue<AbstractTracer> reclaimedTracers = new ReferenceQueue<>();
    private final CompletedPathArchive archive = new CompletedPathArchive();
    private final CorrelationResolver correlationResolver = new CorrelationResolver();
    private final PathSdk sdk;
    private volatile boolean stopped;

    PathTracer(ConfigurationRegistry configurationRegistry, Agent agent, Iterable<LifecycleListener> lifecycleListeners) {
        this.configurationRegistry = configurationRegistry;
        this.coreConfiguration = configurationRegistry.getConfig(CoreConfiguration.class);
        this.agent = agent;
        this.diagnostics = new Diagnostics();
        this.lifecycleListeners = lifecycleListeners;
        this.sdk = new PathSdkImpl(this);
        agent.initialize();
        for (LifecycleListener lifecycleListener : lifecycleListeners) {
            lifecycleListener.start(this);
        }
        logger.info("Started path tracer with agent {} ({}), state {}", agent.getClass().getSimpleName(), agent.getVersionString(),
            agent.getState());
    }

    public PathSdk getSdk() {
        return sdk;
    }

    /**
     * @return the path of the current thread, {@code null} if no tracer is active on this thread
     */
    @Nullable
    public Path getActivePath() {
        return activePath.get();
    }

    private Path getOrCreateActivePath() {
        Path path = activePath.get();
        if (path == null) {
            path = new Path(coreConfiguration.getPathMaxDepth(), diagnostics);
            activePath.set(path);
            livePaths.add(path);
        }
        return path;
    }

    /**
     * @return the innermost started tracer of the current thread
     */
    @Nullable
    public AbstractTracer getActive() {
        final Path path = activePath.get();
        return path != null ? path.peek() : null;
    }

    public void startTracer(AbstractTracer tracer) {
        final Path path = tracer.getKind().isEntrypoint() ? getOrCreateActivePath() : activePath.get();
        final StartedTracerReference reference = new StartedTracerReference(tracer, reclaimedTracers);
        if (path != null) {
            path.push(tracer, reference);
        } else {
            tracer.onStarted(null, reference);
            logger.debug("{} has been started outside of any path and is not recorded", tracer);
        }
        startedTracers.add(reference);
        agent.startTracer(tracer.getId());
        if (logger.isTraceEnabled()) {
            logger.trace("starting tracer at",
                new RuntimeException("this exception is just used to record where the tracer has been started from"));
        }
    }

    public void endTracer(AbstractTracer tracer) {
        final Path path = tracer.getPath();
        if (path != null) {
            path.pop(tracer);
        }
        final StartedTracerReference reference = tracer.getStartedReference();
        if (reference != null) {
            unregister(reference);
        }
        tracer.onEnded();
        agent.endTracer(tracer.getId());
        if (path != null && path.isEmpty()) {
            completePath(path, tracer);
        }
    }

    private void completePath(Path path, AbstractTracer root) {
        activePath.remove();
        livePaths.remove(path);
        archive.add(root);
        if (logger.isDebugEnabled()) {
            logger.debug("Completed path on thread {}:\n{}", path.getOwnerThreadName(), root.dump());
        }
    }

    /**
     * Reports the started tracers which the application has dropped without ending them.
     *
     * @return the number of tracers reported
     */
    int reportReclaimedTracers() {
        int reported = 0;
        Reference<? extends AbstractTracer> reference;
        while ((reference = reclaimedTracers.poll()) != null) {
            final StartedTracerReference reclaimed = (StartedTracerReference) reference;
            if (unregister(reclaimed)) {
                diagnostics.warn("Un-ended tracer " + reclaimed.getDescription() + " started on thread " +
                    reclaimed.getOwnerThreadName() + " has been garbage collected");
                reported++;
            }
        }
        return reported;
    }

    /**
     * @return {@code false} if the tracer has already been ended or reported
     */
    boolean unregister(StartedTracerReference reference) {
        if (startedTracers.remove(reference)) {
            reference.clear();
            return true;
        }
        return false;
    }

    /**
     * @return the number of tracers which have been started but have neither ended nor been reported as leaked
     */
    public int getStartedTracerCount() {
        return startedTracers.size();
    }

    /**
     * Forgets a path whose owner thread has terminated without ending all its tracers.
     */
    void discardPath(Path path) {
        livePaths.remove(path);
    }

    public Collection<Path> getLivePaths() {
        return new ArrayList<>(livePaths);
    }

    public TraceContextInfo getTraceContextInfo() {
        final Path path = activePath.get();
        if (path == null) {
            return TraceContextInfo.INVALID;
        }
        final AbstractTracer active = path.peek();
        final AbstractTracer root = path.getRoot();
        if (active == null || root == null) {
            return TraceContextInfo.INVALID;
        }
        return agent.getTraceContextInfo(root.getId(), active.getId());
    }

    /**
     * Links archived tracers which carried a tag to the tracer the tag was obtained from.
     *
     * @return the tracers whose tag could not be resolved (yet)
     */
    public List<AbstractTracer> resolvePendingTags() {
        return correlationResolver.resolvePending(archive);
    }

    public CompletedPathArchive getArchive() {
        return archive;
    }

    public Agent getAgent() {
        return agent;
    }

    public Diagnostics getDiagnostics() {
        return diagnostics;
    }

    public <T extends ConfigurationOptionProvider> T getConfig(Class<T> configProvider) {
        return configurationRegistry.getConfig(configProvider);
    }

    public ConfigurationRegistry getConfigurationRegistry() {
        return configurationRegistry;
    }

    public boolean isStopped() {
        return stopped;
    }

    public void stop() {
        if (stopped) {
            return;
        }
        stopped = true;
        try {
            for (LifecycleListener lifecycleListener : lifecycleListeners) {
                lifecycleListener.stop();
            }
            agent.shutdown();
            configurationRegistry.close();
        } catch (Exception e) {
            logger.warn("Suppressed exception while calling stop()", e);
        }
    }
}
