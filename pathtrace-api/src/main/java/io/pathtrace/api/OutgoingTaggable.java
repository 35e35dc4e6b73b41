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
 * A tracer which can hand out a tag identifying itself,
 * so that work done in another thread or process can be linked to it.
 * <p>
 * The tag is only available while the tracer is started.
 * Transport it alongside the request, for example as a header or message property,
 * and pass it to the corresponding incoming tracer on the receiving side.
 * </p>
 */
public interface OutgoingTaggable {

    /**
     * Returns the tag in its string form.
     * The result is the empty string if the agent does not trace this operation.
     *
     * @return the string tag, never {@code null}
     * @throws IllegalStateException if the tracer is not started
     */
    String getOutgoingStringTag();

    /**
     * Returns the tag in its binary form.
     * The result is empty if the agent does not trace this operation.
     *
     * @return the byte tag, never {@code null}
     * @throws IllegalStateException if the tracer is not started
     */
    byte[] getOutgoingByteTag();
}
