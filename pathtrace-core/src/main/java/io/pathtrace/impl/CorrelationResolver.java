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
package io.pathtrace.impl;

import io.pathtrace.impl.tag.TracerId;
import io.pathtrace.impl.tracer.AbstractTracer;
import io.pathtrace.impl.tracer.LinkKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Links completed tracers which carried an incoming tag (or an in-process link)
 * to the completed tracer the tag was obtained from.
 * <p>
 * Resolution can run any number of times. Tracers which are already linked are skipped,
 * tracers whose counterpart has not completed yet are returned and may be linked by a later run.
 * </p>
 */
public class CorrelationResolver {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationResolver.class);

    /**
     * @return the tracers carrying a tag for which no completed tracer exists (yet)
     */
    public List<AbstractTracer> resolvePending(CompletedPathArchive archive) {
        return archive.withLock(new CompletedPathArchive.LockedAction<List<AbstractTracer>>() {
            @Override
            public List<AbstractTracer> run(List<AbstractTracer> roots) {
                return resolve(roots);
            }
        });
    }

    private List<AbstractTracer> resolve(List<AbstractTracer> roots) {
        final List<AbstractTracer> nodes = new ArrayList<>();
        for (AbstractTracer root : roots) {
            CompletedPathArchive.collectSubtree(root, nodes);
        }
        final Map<TracerId, AbstractTracer> nodesById = new HashMap<>(nodes.size() * 2);
        for (AbstractTracer node : nodes) {
            nodesById.put(node.getId(), node);
        }
        final List<AbstractTracer> unresolved = new ArrayList<>();
        int linked = 0;
        for (AbstractTracer node : nodes) {
            final TracerId incomingTagId = node.getIncomingTagId();
            if (incomingTagId == null || node.isIncomingTagResolved()) {
                continue;
            }
            final AbstractTracer parent = nodesById.get(incomingTagId);
            if (parent == null) {
                unresolved.add(node);
            } else {
                node.onIncomingTagResolved(parent);
                linked++;
            }
        }
        logger.debug("Linked {} tracers via {}, {} unresolved", linked, LinkKind.TAG_LINKED, unresolved.size());
        return unresolved;
    }
}
