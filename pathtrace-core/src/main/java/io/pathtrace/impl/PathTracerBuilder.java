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
import io.pathtrace.agent.AgentFactory;
import io.pathtrace.configuration.CoreConfiguration;
import io.pathtrace.configuration.PrefixingConfigurationSourceWrapper;
import io.pathtrace.configuration.source.PropertyFileConfigurationSource;
import io.pathtrace.context.LifecycleListener;
import io.pathtrace.logging.LoggingConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.AbstractConfigurationSource;
import org.stagemonitor.configuration.source.ConfigurationSource;
import org.stagemonitor.configuration.source.SimpleSource;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.ServiceLoader;

public class PathTracerBuilder {

    static final String PROPERTIES_FILE = "pathtrace.properties";

    private final Logger logger;
    @Nullable
    private ConfigurationRegistry configurationRegistry;
    @Nullable
    private Agent agent;
    @Nullable
    private Iterable<LifecycleListener> lifecycleListeners;
    private final Map<String, String> inlineConfig = new HashMap<>();

    public PathTracerBuilder() {
        final List<ConfigurationSource> configSources = getConfigSources();
        // the ConfigurationRegistry uses and thereby initializes a logger,
        // so we can't use it here
        LoggingConfiguration.init(configSources);
        logger = LoggerFactory.getLogger(getClass());
    }

    public PathTracerBuilder configurationRegistry(ConfigurationRegistry configurationRegistry) {
        this.configurationRegistry = configurationRegistry;
        return this;
    }

    public PathTracerBuilder agent(Agent agent) {
        this.agent = agent;
        return this;
    }

    public PathTracerBuilder lifecycleListeners(List<LifecycleListener> lifecycleListeners) {
        this.lifecycleListeners = lifecycleListeners;
        return this;
    }

    public PathTracerBuilder withConfig(String key, String value) {
        inlineConfig.put(key, value);
        return this;
    }

    public PathTracer build() {
        if (configurationRegistry == null) {
            configurationRegistry = getDefaultConfigurationRegistry(getConfigSources());
        }
        if (agent == null) {
            agent = new AgentFactory().createAgent(configurationRegistry);
        }
        if (lifecycleListeners == null) {
            lifecycleListeners = ServiceLoader.load(LifecycleListener.class, getClass().getClassLoader());
        }
        return new PathTracer(configurationRegistry, agent, lifecycleListeners);
    }

    private ConfigurationRegistry getDefaultConfigurationRegistry(List<ConfigurationSource> configSources) {
        try {
            return ConfigurationRegistry.builder()
                .configSources(configSources)
                .optionProviders(ServiceLoader.load(ConfigurationOptionProvider.class, PathTracer.class.getClassLoader()))
                .failOnMissingRequiredValues(true)
                .build();
        } catch (IllegalStateException e) {
            logger.warn(e.getMessage());
            return ConfigurationRegistry.builder()
                .addConfigSource(new SimpleSource("Noop Configuration")
                    .add(CoreConfiguration.ACTIVE, "false"))
                .optionProviders(ServiceLoader.load(ConfigurationOptionProvider.class, PathTracer.class.getClassLoader()))
                .build();
        }
    }

    private List<ConfigurationSource> getConfigSources() {
        List<ConfigurationSource> result = new ArrayList<>();
        result.add(PrefixingConfigurationSourceWrapper.systemProperties());
        result.add(PrefixingConfigurationSourceWrapper.environmentVariables());
        result.add(new AbstractConfigurationSource() {
            @Override
            public String getValue(String key) {
                return inlineConfig.get(key);
            }

            @Override
            public String getName() {
                return "Inline configuration";
            }
        });
        if (PropertyFileConfigurationSource.isPresent(PROPERTIES_FILE)) {
            result.add(new PropertyFileConfigurationSource(PROPERTIES_FILE));
        }
        return result;
    }
}
