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

import io.pathtrace.agent.InMemoryAgent;
import io.pathtrace.agent.NoopAgent;
import io.pathtrace.api.AgentState;
import io.pathtrace.configuration.CoreConfiguration;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PathTracerBuilderTest {

    @Test
    void testInlineConfiguration() {
        PathTracer tracer = new PathTracerBuilder()
            .withConfig(CoreConfiguration.AGENT, "IN_MEMORY")
            .withConfig(CoreConfiguration.PATH_MAX_DEPTH, "16")
            .build();
        try {
            assertThat(tracer.getAgent()).isInstanceOf(InMemoryAgent.class);
            assertThat(tracer.getConfig(CoreConfiguration.class).getPathMaxDepth()).isEqualTo(16);
            assertThat(tracer.getSdk().getAgentState()).isEqualTo(AgentState.ACTIVE);
        } finally {
            tracer.stop();
        }
    }

    @Test
    void testDeactivated() {
        PathTracer tracer = new PathTracerBuilder()
            .withConfig(CoreConfiguration.ACTIVE, "false")
            .build();
        try {
            assertThat(tracer.getAgent()).isInstanceOf(NoopAgent.class);
            assertThat(tracer.getSdk().isAgentFound()).isFalse();
        } finally {
            tracer.stop();
        }
    }

    @Test
    void testExplicitAgentWinsOverConfiguration() {
        InMemoryAgent agent = new InMemoryAgent();
        PathTracer tracer = new PathTracerBuilder()
            .withConfig(CoreConfiguration.AGENT, "NOOP")
            .agent(agent)
            .build();
        try {
            assertThat(tracer.getAgent()).isSameAs(agent);
        } finally {
            tracer.stop();
        }
        assertThat(tracer.isStopped()).isTrue();
        assertThat(agent.getState()).isEqualTo(AgentState.PERMANENTLY_INACTIVE);
    }
}
