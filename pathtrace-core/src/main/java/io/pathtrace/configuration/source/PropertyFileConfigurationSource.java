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
package io.pathtrace.configuration.source;

import org.stagemonitor.configuration.source.AbstractConfigurationSource;

import javax.annotation.Nullable;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Reads options from a properties file, which is looked up on the class path first and then on the file system.
 * <p>
 * Unlike {@link org.stagemonitor.configuration.source.PropertyFileConfigurationSource}, this source does not use a logger,
 * because it is read before logging is configured. For the same reason, problems are reported to {@link System#err}.
 * The file is never written to.
 * </p>
 */
public final class PropertyFileConfigurationSource extends AbstractConfigurationSource {

    private final String location;
    private volatile Properties properties;

    public PropertyFileConfigurationSource(String location) {
        this.location = location;
        this.properties = loadOrEmpty(location);
    }

    /**
     * @return whether a readable properties file exists at the location
     */
    public static boolean isPresent(String location) {
        return load(location) != null;
    }

    private static Properties loadOrEmpty(String location) {
        final Properties loaded = load(location);
        return loaded != null ? loaded : new Properties();
    }

    @Nullable
    private static Properties load(String location) {
        final ClassLoader classLoader = PropertyFileConfigurationSource.class.getClassLoader();
        try (InputStream fromClasspath = classLoader.getResourceAsStream(location)) {
            if (fromClasspath != null) {
                return read(fromClasspath);
            }
        } catch (IOException e) {
            System.err.println("[pathtrace] Could not read " + location + " from the class path: " + e.getMessage());
            return null;
        }
        try (InputStream fromFile = new FileInputStream(location)) {
            return read(fromFile);
        } catch (FileNotFoundException e) {
            return null;
        } catch (IOException e) {
            System.err.println("[pathtrace] Could not read " + location + ": " + e.getMessage());
            return null;
        }
    }

    private static Properties read(InputStream input) throws IOException {
        final Properties props = new Properties();
        props.load(input);
        return props;
    }

    /**
     * Re-reads the file. If it has disappeared, all options fall back to the next source.
     */
    @Override
    public void reload() {
        properties = loadOrEmpty(location);
    }

    @Override
    public String getName() {
        return location;
    }

    @Nullable
    @Override
    public String getValue(String key) {
        return properties.getProperty(key);
    }
}
