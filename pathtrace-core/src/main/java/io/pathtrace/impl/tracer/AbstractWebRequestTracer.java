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
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.tag.TracerId;
import io.pathtrace.util.Arguments;
import io.pathtrace.util.KeyValues;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Headers and status code shared by incoming and outgoing web requests.
 * Request headers describe the request and are entry fields, response headers and the status code are not.
 */
public abstract class AbstractWebRequestTracer extends AbstractTracer {

    protected final String url;
    protected final String method;
    private final List<KeyValuePair> requestHeaders = new ArrayList<>();
    private final List<KeyValuePair> responseHeaders = new ArrayList<>();
    @Nullable
    private Integer statusCode;

    protected AbstractWebRequestTracer(PathTracer pathTracer, TracerId id, TracerKind kind, String url, String method) {
        super(pathTracer, id, kind);
        this.url = url;
        this.method = method;
    }

    public void addRequestHeader(String name, String value) {
        checkEntryField("request header");
        addEntry(requestHeaders, TracerField.REQUEST_HEADER, Arguments.requireNonNull(name, "header name"),
            Arguments.requireNonNull(value, "header value"));
    }

    public void addRequestHeaders(Map<String, String> headers) {
        KeyValues.forEach(headers, new KeyValues.Consumer<String>() {
            @Override
            public void accept(String key, String value) {
                addRequestHeader(key, value);
            }
        });
    }

    public void addRequestHeaders(List<String> names, List<String> values, int count) {
        KeyValues.forEach(names, values, count, new KeyValues.Consumer<String>() {
            @Override
            public void accept(String key, String value) {
                addRequestHeader(key, value);
            }
        });
    }

    public void addResponseHeader(String name, String value) {
        checkExitField("response header");
        addEntry(responseHeaders, TracerField.RESPONSE_HEADER, Arguments.requireNonNull(name, "header name"),
            Arguments.requireNonNull(value, "header value"));
    }

    public void addResponseHeaders(Map<String, String> headers) {
        KeyValues.forEach(headers, new KeyValues.Consumer<String>() {
            @Override
            public void accept(String key, String value) {
                addResponseHeader(key, value);
            }
        });
    }

    public void addResponseHeaders(List<String> names, List<String> values, int count) {
        KeyValues.forEach(names, values, count, new KeyValues.Consumer<String>() {
            @Override
            public void accept(String key, String value) {
                addResponseHeader(key, value);
            }
        });
    }

    public void setStatusCode(int statusCode) {
        checkExitField("status code");
        Arguments.requireNonNegative(statusCode, "status code");
        this.statusCode = statusCode;
        setField(TracerField.STATUS_CODE, statusCode);
    }

    public String getUrl() {
        return url;
    }

    public String getMethod() {
        return method;
    }

    public List<KeyValuePair> getRequestHeaders() {
        return Collections.unmodifiableList(requestHeaders);
    }

    public List<KeyValuePair> getResponseHeaders() {
        return Collections.unmodifiableList(responseHeaders);
    }

    @Nullable
    public Integer getStatusCode() {
        return statusCode;
    }

    @Override
    protected void collectValues(Map<String, Object> values) {
        values.put("url", url);
        values.put("method", method);
        if (!requestHeaders.isEmpty()) {
            values.put("request_headers", new ArrayList<>(requestHeaders));
        }
        if (!responseHeaders.isEmpty()) {
            values.put("response_headers", new ArrayList<>(responseHeaders));
        }
        if (statusCode != null) {
            values.put("status_code", statusCode);
        }
    }
}
