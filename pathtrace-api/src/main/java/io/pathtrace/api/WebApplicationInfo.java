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
 * Describes a web application handling {@link IncomingWebRequestTracer incoming web requests}.
 * Obtained from {@link PathSdk#createWebApplicationInfo(String, String, String)}.
 */
public final class WebApplicationInfo {

    private final String virtualHost;
    private final String applicationId;
    private final String contextRoot;

    public WebApplicationInfo(String virtualHost, String applicationId, String contextRoot) {
        this.virtualHost = virtualHost;
        this.applicationId = applicationId;
        this.contextRoot = contextRoot;
    }

    public String getVirtualHost() {
        return virtualHost;
    }

    public String getApplicationId() {
        return applicationId;
    }

    public String getContextRoot() {
        return contextRoot;
    }

    @Override
    public String toString() {
        return "WebApplicationInfo(" + virtualHost + ", " + applicationId + ", " + contextRoot + ")";
    }
}
