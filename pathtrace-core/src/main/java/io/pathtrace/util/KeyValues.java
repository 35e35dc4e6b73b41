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
package io.pathtrace.util;

import java.util.List;
import java.util.Map;

/**
 * Feeds batches of key/value pairs, given either as a map or as parallel lists, to a single-pair consumer.
 */
public final class KeyValues {

    private KeyValues() {
    }

    public interface Consumer<V> {
        void accept(String key, V value);
    }

    public static <V> void forEach(Map<String, ? extends V> map, Consumer<V> consumer) {
        for (Map.Entry<String, ? extends V> entry : map.entrySet()) {
            consumer.accept(entry.getKey(), entry.getValue());
        }
    }

    /**
     * Processes exactly {@code count} pairs, in list order.
     *
     * @throws IllegalArgumentException if {@code count} is negative or exceeds one of the list sizes
     */
    public static <V> void forEach(List<String> keys, List<? extends V> values, int count, Consumer<V> consumer) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative, but was " + count);
        }
        if (count > keys.size() || count > values.size()) {
            throw new IllegalArgumentException("count " + count + " exceeds the number of keys (" + keys.size()
                + ") or values (" + values.size() + ")");
        }
        for (int i = 0; i < count; i++) {
            consumer.accept(keys.get(i), values.get(i));
        }
    }
}
