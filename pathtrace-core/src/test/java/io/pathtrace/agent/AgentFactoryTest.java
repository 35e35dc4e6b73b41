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
package io.pathtrace.agent;

import io.pathtrace.configuration.CoreConfiguration;
import io.pathtrace.configuration.SpyConfiguration;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AgentFactoryTest {

    private final AgentFactory agentFactory = new AgentFactory();

    @Test
    void testInactiveUsesNoopAgent() {
        Agent agent = agentFactory.createAgent(SpyConfiguration.createSpyConfig(
            CoreConfiguration.ACTIVE, "false",
            CoreConfiguration.AGENT, "IN_MEMORY"));
        assertThat(agent).isInstanceOf(NoopAgent.class);
    }

    @Test
    void testExplicitAgentType() {
        assertThat(agentFactory.createAgent(SpyConfiguration.createSpyConfig(CoreConfiguration.AGENT, "IN_MEMORY"))).isInstanceOf(InMemoryAgent.class);
        assertThat(agentFactory.createAgent(SpyConfiguration.createSpyConfig(CoreConfiguration.AGENT, "NOOP"))).isInstanceOf(NoopAgent.class);
    }

    @Test
    void testAutoFallsBackToNoopAgent() {
        assertThat(agentFactory.createAgent(SpyConfiguration.createSpyConfig())).isInstanceOf(NoopAgent.class);
        assertThat(agentFactory.loadAgent(getClass().getClassLoader())).isInstanceOf(NoopAgent.class);
    }
}
