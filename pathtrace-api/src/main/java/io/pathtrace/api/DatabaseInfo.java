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
package io.pathtrace.api;

/**
 * Describes a database; shared by all {@link DatabaseRequestTracer}s targeting it.
 * Obtained from {@link PathSdk#createDatabaseInfo(String, String, Channel)}.
 */
public final class DatabaseInfo {

    private final String name;
    private final String vendor;
    private final Channel channel;

    public DatabaseInfo(String name, String vendor, Channel channel) {
        this.name = name;
        this.vendor = vendor;
        this.channel = channel;
    }

    public String getName() {
        return name;
    }

    /**
     * @return the vendor, see {@link DatabaseVendor} for well-known values
     */
    public String getVendor() {
        return vendor;
    }

    public Channel getChannel() {
        return channel;
    }

    @Override
    public String toString() {
        return "DatabaseInfo(" + name + ", " + vendor + ", " + channel + ")";
    }
}
