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

import io.pathtrace.agent.Agent;
import io.pathtrace.agent.InMemoryAgent;
import io.pathtrace.configuration.SpyConfiguration;
import io.pathtrace.context.LifecycleListener;
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.PathTracerBuilder;
import org.stagemonitor.configuration.ConfigurationRegistry;

import java.util.Collections;
import java.util.List;

public class MockPathTracer {

    /**
     * Creates a real tracer backed by an {@link InMemoryAgent} and a spy configuration,
     * without any lifecycle listeners, so that no background threads are started.
     */
    public static PathTracer createRealTracer() {
        return createRealTracer(new InMemoryAgent());
    }

    public static PathTracer createRealTracer(Agent agent) {
        return createRealTracer(agent, SpyConfiguration.createSpyConfig());
    }

    public static PathTracer createRealTracer(Agent agent, ConfigurationRegistry config) {
        return createRealTracer(agent, config, Collections.<LifecycleListener>emptyList());
    }

    public static PathTracer createRealTracer(Agent agent, ConfigurationRegistry config, List<LifecycleListener> lifecycleListeners) {
        return new PathTracerBuilder()
            .configurationRegistry(config)
            .agent(agent)
            .lifecycleListeners(lifecycleListeners)
            .build();
    }
}
