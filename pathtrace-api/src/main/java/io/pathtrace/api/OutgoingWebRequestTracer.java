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

import java.util.List;
import java.util.Map;

/**
 * Traces an HTTP request sent by this process.
 * <p>
 * Add the {@linkplain #getOutgoingStringTag() tag} as a request header
 * so that the receiving web application can link its {@link IncomingWebRequestTracer} to this tracer.
 * Request headers may only be added before the tracer is started.
 * </p>
 */
public interface OutgoingWebRequestTracer extends Tracer, OutgoingTaggable {

    void addRequestHeader(String name, String value);

    void addRequestHeaders(Map<String, String> headers);

    void addRequestHeaders(List<String> names, List<String> values, int count);

    void addResponseHeader(String name, String value);

    void addResponseHeaders(Map<String, String> headers);

    void addResponseHeaders(List<String> names, List<String> values, int count);

    void setStatusCode(int statusCode);
}
