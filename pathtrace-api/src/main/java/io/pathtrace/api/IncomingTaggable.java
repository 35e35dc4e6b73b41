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

/**
 * A tracer which can continue work that was started elsewhere,
 * identified by a tag obtained from an {@link OutgoingTaggable} tracer.
 * <p>
 * Only one of the two forms may be set, and only before the tracer is started.
 * </p>
 */
public interface IncomingTaggable {

    /**
     * @param tag the string form of the tag, as returned by {@link OutgoingTaggable#getOutgoingStringTag()}
     * @throws IllegalStateException if the tracer has already been started
     */
    void setIncomingStringTag(@Nullable String tag);

    /**
     * @param tag the binary form of the tag, as returned by {@link OutgoingTaggable#getOutgoingByteTag()}
     * @throws IllegalStateException if the tracer has already been started
     */
    void setIncomingByteTag(@Nullable byte[] tag);
}
