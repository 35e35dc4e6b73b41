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
package io.pathtrace.impl.tag;

import java.security.SecureRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Issues unique {@link TracerId}s.
 * Each generator draws a random session half, so ids of different processes do not collide.
 */
public class TracerIdGenerator {

    private final long session;
    private final AtomicLong sequence = new AtomicLong();

    public TracerIdGenerator() {
        this(randomSession());
    }

    public TracerIdGenerator(long session) {
        this.session = session;
    }

    private static long randomSession() {
        final SecureRandom random = new SecureRandom();
        long session;
        do {
            session = random.nextLong();
        } while (session == 0);
        return session;
    }

    public TracerId next() {
        return new TracerId(session, sequence.incrementAndGet());
    }
}
