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

import org.stagemonitor.configuration.source.ConfigurationSource;
import org.stagemonitor.configuration.source.EnvironmentVariableConfigurationSource;
import org.stagemonitor.configuration.source.SystemPropertyConfigurationSource;

import javax.annotation.Nullable;
import java.io.IOException;

/**
 * Reads the options of pathtrace from a process-wide source, where they share a namespace with unrelated settings.
 * <p>
 * {@code path_max_depth} is read from the system property {@code pathtrace.path_max_depth}
 * or from the environment variable {@code PATHTRACE_PATH_MAX_DEPTH}.
 * Such sources are read-only.
 * </p>
 */
public class PrefixingConfigurationSourceWrapper implements ConfigurationSource {

    public static final String SYSTEM_PROPERTY_PREFIX = "pathtrace.";
    public static final String ENVIRONMENT_VARIABLE_PREFIX = "PATHTRACE_";

    private final ConfigurationSource delegate;
    private final String prefix;

    public PrefixingConfigurationSourceWrapper(ConfigurationSource delegate, String prefix) {
        this.delegate = delegate;
        this.prefix = prefix;
    }

    public static PrefixingConfigurationSourceWrapper systemProperties() {
        return new PrefixingConfigurationSourceWrapper(new SystemPropertyConfigurationSource(), SYSTEM_PROPERTY_PREFIX);
    }

    public static PrefixingConfigurationSourceWrapper environmentVariables() {
        return new PrefixingConfigurationSourceWrapper(new EnvironmentVariableConfigurationSource(), ENVIRONMENT_VARIABLE_PREFIX);
    }

    @Nullable
    @Override
    public String getValue(String key) {
        final String value = delegate.getValue(prefix + key);
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    @Override
    public void reload() throws IOException {
        delegate.reload();
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    public String getPrefix() {
        return prefix;
    }

    @Override
    public boolean isSavingPossible() {
        return false;
    }

    @Override
    public boolean isSavingPersistent() {
        return false;
    }

    @Override
    public void save(String key, String value) {
        throw new UnsupportedOperationException(getName() + " is read-only, can't save " + prefix + key);
    }
}
