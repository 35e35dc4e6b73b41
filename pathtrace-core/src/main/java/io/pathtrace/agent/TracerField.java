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
package io.pathtrace.agent;

/**
 * Kind-specific values of a tracer which are reported to the {@link Agent}.
 */
public enum TracerField {
    PROTOCOL_NAME,
    REMOTE_ADDRESS,
    REQUEST_HEADER,
    PARAMETER,
    RESPONSE_HEADER,
    STATUS_CODE,
    RETURNED_ROW_COUNT,
    ROUND_TRIP_COUNT,
    VENDOR_MESSAGE_ID,
    CORRELATION_ID
}
