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
package io.pathtrace.configuration;

import io.pathtrace.agent.AgentType;
import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.SimpleSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;

class CoreConfigurationTest {

    @Test
    void testDefaults() {
        CoreConfiguration config = SpyConfiguration.createSpyConfig().getConfig(CoreConfiguration.class);
        assertThat(config.isActive()).isTrue();
        assertThat(config.getAgent()).isEqualTo(AgentType.AUTO);
        assertThat(config.getPathMaxDepth()).isEqualTo(256);
        assertThat(config.getLeakDetectionInterval()).isEqualTo(1000L);
    }

    @Test
    void testValuesFromSource() {
        ConfigurationRegistry registry = SpyConfiguration.createSpyConfig(new SimpleSource("test")
            .add(CoreConfiguration.ACTIVE, "false")
            .add(CoreConfiguration.AGENT, "IN_MEMORY")
            .add(CoreConfiguration.PATH_MAX_DEPTH, "8")
            .add(CoreConfiguration.LEAK_DETECTION_INTERVAL, "0"));
        CoreConfiguration config = registry.getConfig(CoreConfiguration.class);
        assertThat(config.isActive()).isFalse();
        assertThat(config.getAgent()).isEqualTo(AgentType.IN_MEMORY);
        assertThat(config.getPathMaxDepth()).isEqualTo(8);
        assertThat(config.getLeakDetectionInterval()).isZero();
    }

    @Test
    void testResetRemovesStubbing() {
        ConfigurationRegistry registry = SpyConfiguration.createSpyConfig(CoreConfiguration.PATH_MAX_DEPTH, "8");
        CoreConfiguration config = registry.getConfig(CoreConfiguration.class);
        doReturn(2).when(config).getPathMaxDepth();
        assertThat(config.getPathMaxDepth()).isEqualTo(2);

        SpyConfiguration.reset(registry);
        assertThat(config.getPathMaxDepth()).isEqualTo(8);
    }
}
