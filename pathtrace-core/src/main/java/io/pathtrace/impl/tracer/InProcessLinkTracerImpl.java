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

import io.pathtrace.api.InProcessLinkTracer;
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.tag.TagCodec;
import io.pathtrace.impl.tag.TracerId;

import java.util.Map;

/**
 * Continues the work of the tracer encoded in the link.
 * Once both paths have completed, the {@link io.pathtrace.impl.CorrelationResolver} links this tracer to it,
 * just like a tracer carrying an incoming tag.
 */
public class InProcessLinkTracerImpl extends AbstractTracer implements InProcessLinkTracer {

    public InProcessLinkTracerImpl(PathTracer pathTracer, TracerId id, byte[] link) {
        super(pathTracer, id, TracerKind.IN_PROCESS_LINK);
        setIncomingTagId(TagCodec.decodeInProcessLink(link));
    }

    @Override
    protected void collectValues(Map<String, Object> values) {
    }
}
