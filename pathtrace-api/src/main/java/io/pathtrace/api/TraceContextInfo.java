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
 * Identifies the trace and the span of the currently active tracer,
 * for example to correlate log records with traces.
 */
public final class TraceContextInfo {

    private static final String INVALID_TRACE_ID = "00000000000000000000000000000000";
    private static final String INVALID_SPAN_ID = "0000000000000000";

    public static final TraceContextInfo INVALID = new TraceContextInfo(INVALID_TRACE_ID, INVALID_SPAN_ID);

    private final String traceId;
    private final String spanId;

    public TraceContextInfo(String traceId, String spanId) {
        this.traceId = traceId;
        this.spanId = spanId;
    }

    /**
     * @return {@code false} if there is no active tracer, or the agent does not record it
     */
    public boolean isValid() {
        return !INVALID_TRACE_ID.equals(traceId) && !INVALID_SPAN_ID.equals(spanId);
    }

    /**
     * @return the trace id as 32 lowercase hex characters
     */
    public String getTraceId() {
        return traceId;
    }

    /**
     * @return the span id as 16 lowercase hex characters
     */
    public String getSpanId() {
        return spanId;
    }

    @Override
    public String toString() {
        return "TraceContextInfo(" + traceId + ", " + spanId + ")";
    }
}
