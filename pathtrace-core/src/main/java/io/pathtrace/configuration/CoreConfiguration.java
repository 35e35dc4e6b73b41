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
import org.stagemonitor.configuration.ConfigurationOption;
import org.stagemonitor.configuration.ConfigurationOptionProvider;

public class CoreConfiguration extends ConfigurationOptionProvider {

    public static final String ACTIVE = "active";
    public static final String AGENT = "agent";
    public static final String PATH_MAX_DEPTH = "path_max_depth";
    public static final String LEAK_DETECTION_INTERVAL = "leak_detection_interval";
    private static final String CORE_CATEGORY = "Core";

    private final ConfigurationOption<Boolean> active = ConfigurationOption.booleanOption()
        .key(ACTIVE)
        .configurationCategory(CORE_CATEGORY)
        .description("A boolean specifying if tracers should be reported to an agent.\n" +
            "\n" +
            "When set to false, the no-op agent is used. Paths are still tracked, but tags are empty.")
        .buildWithDefault(true);

    private final ConfigurationOption<AgentType> agent = ConfigurationOption.enumOption(AgentType.class)
        .key(AGENT)
        .configurationCategory(CORE_CATEGORY)
        .description("Which agent tracers are reported to.\n" +
            "\n" +
            "`AUTO` uses the first agent registered as a `java.util.ServiceLoader` service and falls back to `NOOP`. " +
            "`IN_MEMORY` keeps all tracers in memory, which is useful for tests.")
        .buildWithDefault(AgentType.AUTO);

    private final ConfigurationOption<Integer> pathMaxDepth = ConfigurationOption.integerOption()
        .key(PATH_MAX_DEPTH)
        .configurationCategory(CORE_CATEGORY)
        .description("The maximum number of nested active tracers per thread.\n" +
            "\n" +
            "Reaching this limit almost always means that tracers are started but never ended.")
        .addValidator(new ConfigurationOption.Validator<Integer>() {
            @Override
            public void assertValid(Integer value) {
                if (value != null && value < 1) {
                    throw new IllegalArgumentException("The maximum path depth must be at least 1");
                }
            }
        })
        .buildWithDefault(256);

    private final ConfigurationOption<Long> leakDetectionInterval = ConfigurationOption.longOption()
        .key(LEAK_DETECTION_INTERVAL)
        .configurationCategory(CORE_CATEGORY)
        .description("How often, in milliseconds, the paths of terminated threads are checked for tracers which were never ended.\n" +
            "\n" +
            "Set to 0 to disable leak detection.")
        .addValidator(new ConfigurationOption.Validator<Long>() {
            @Override
            public void assertValid(Long value) {
                if (value != null && value < 0) {
                    throw new IllegalArgumentException("The leak detection interval must not be negative");
                }
            }
        })
        .buildWithDefault(1000L);

    public boolean isActive() {
        return active.get();
    }

    public AgentType getAgent() {
        return agent.get();
    }

    public int getPathMaxDepth() {
        return pathMaxDepth.get();
    }

    public long getLeakDetectionInterval() {
        return leakDetectionInterval.get();
    }
}
