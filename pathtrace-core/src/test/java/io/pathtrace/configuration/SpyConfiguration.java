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

import io.pathtrace.configuration.source.PropertyFileConfigurationSource;
import org.mockito.Mockito;
import org.stagemonitor.configuration.ConfigurationOptionProvider;
import org.stagemonitor.configuration.ConfigurationRegistry;
import org.stagemonitor.configuration.source.ConfigurationSource;
import org.stagemonitor.configuration.source.SimpleSource;

import java.util.ServiceLoader;

/**
 * Builds configuration registries for tests in which every option provider of pathtrace is a Mockito spy.
 * Options therefore have their defaults, unless a test stubs them, like
 * {@code doReturn(1).when(registry.getConfig(CoreConfiguration.class)).getPathMaxDepth()}.
 */
public class SpyConfiguration {

    public static final String CONFIG_SOURCE_NAME = "test config source";

    /**
     * @param keysAndValues alternating option keys and values, like {@code "agent", "NOOP"}
     */
    public static ConfigurationRegistry createSpyConfig(String... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected pairs of keys and values");
        }
        final SimpleSource source = new SimpleSource(CONFIG_SOURCE_NAME);
        for (int i = 0; i < keysAndValues.length; i += 2) {
            source.add(keysAndValues[i], keysAndValues[i + 1]);
        }
        return createSpyConfig(source);
    }

    /**
     * The given source takes precedence over {@code pathtrace.properties} on the test class path.
     */
    public static ConfigurationRegistry createSpyConfig(ConfigurationSource configurationSource) {
        final ConfigurationRegistry.Builder builder = ConfigurationRegistry.builder()
            .addConfigSource(configurationSource)
            .addConfigSource(new PropertyFileConfigurationSource("pathtrace.properties"));
        for (ConfigurationOptionProvider provider : ServiceLoader.load(ConfigurationOptionProvider.class)) {
            builder.addOptionProvider(Mockito.spy(provider));
        }
        return builder.build();
    }

    /**
     * Removes the stubbing of all option providers, restoring the configured values.
     */
    public static void reset(ConfigurationRegistry registry) {
        for (ConfigurationOptionProvider provider : registry.getConfigurationOptionProviders()) {
            Mockito.reset(provider);
        }
    }
}
