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
package io.pathtrace.impl.tracer;

import io.pathtrace.agent.TracerField;
import io.pathtrace.api.IncomingWebRequestTracer;
import io.pathtrace.api.WebApplicationInfo;
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.tag.TracerId;
import io.pathtrace.util.Arguments;
import io.pathtrace.util.KeyValues;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class IncomingWebRequestTracerImpl extends AbstractWebRequestTracer implements IncomingWebRequestTracer {

    private final WebApplicationInfo webApplication;
    private final List<KeyValuePair> parameters = new ArrayList<>();
    @Nullable
    private String remoteAddress;

    public IncomingWebRequestTracerImpl(PathTracer pathTracer, TracerId id, WebApplicationInfo webApplication, String url, String method) {
        super(pathTracer, id, TracerKind.INCOMING_WEB_REQUEST, url, method);
        this.webApplication = webApplication;
    }

    @Override
    public void setRemoteAddress(@Nullable String remoteAddress) {
        checkEntryField("remote address");
        this.remoteAddress = remoteAddress;
        setField(TracerField.REMOTE_ADDRESS, remoteAddress);
    }

    @Override
    public void addParameter(String name, String value) {
        checkEntryField("parameter");
        addEntry(parameters, TracerField.PARAMETER, Arguments.requireNonNull(name, "parameter name"),
            Arguments.requireNonNull(value, "parameter value"));
    }

    @Override
    public void addParameters(Map<String, String> parameters) {
        KeyValues.forEach(parameters, new KeyValues.Consumer<String>() {
            @Override
            public void accept(String key, String value) {
                addParameter(key, value);
            }
        });
    }

    @Override
    public void addParameters(List<String> names, List<String> values, int count) {
        KeyValues.forEach(names, values, count, new KeyValues.Consumer<String>() {
            @Override
            public void accept(String key, String value) {
                addParameter(key, value);
            }
        });
    }

    public WebApplicationInfo getWebApplication() {
        return webApplication;
    }

    @Nullable
    public String getRemoteAddress() {
        return remoteAddress;
    }

    public List<KeyValuePair> getParameters() {
        return Collections.unmodifiableList(parameters);
    }

    @Override
    protected void collectValues(Map<String, Object> values) {
        values.put("virtual_host", webApplication.getVirtualHost());
        values.put("application_id", webApplication.getApplicationId());
        values.put("context_root", webApplication.getContextRoot());
        super.collectValues(values);
        if (remoteAddress != null) {
            values.put("remote_address", remoteAddress);
        }
        if (!parameters.isEmpty()) {
            values.put("parameters", new ArrayList<>(parameters));
        }
    }
}
