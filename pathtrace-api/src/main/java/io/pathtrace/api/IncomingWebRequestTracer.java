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

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Traces an HTTP request handled by a web application.
 * <p>
 * Remote address, request headers and parameters describe the request and may only be set before the tracer is started.
 * The response status code and headers may be set until the tracer ends.
 * </p>
 * <p>
 * Methods accepting a list of keys, a list of values and a count process exactly {@code count} pairs in list order.
 * </p>
 */
public interface IncomingWebRequestTracer extends Tracer, IncomingTaggable, Entrypoint {

    void setRemoteAddress(@Nullable String remoteAddress);

    void addRequestHeader(String name, String value);

    void addRequestHeaders(Map<String, String> headers);

    void addRequestHeaders(List<String> names, List<String> values, int count);

    void addParameter(String name, String value);

    void addParameters(Map<String, String> parameters);

    void addParameters(List<String> names, List<String> values, int count);

    void addResponseHeader(String name, String value);

    void addResponseHeaders(Map<String, String> headers);

    void addResponseHeaders(List<String> names, List<String> values, int count);

    /**
     * @param statusCode the HTTP status code of the response, must not be negative
     */
    void setStatusCode(int statusCode);
}
