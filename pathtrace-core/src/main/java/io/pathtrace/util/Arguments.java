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

import javax.annotation.Nullable;

/**
 * Argument checks of the tracer factories.
 * All of them throw {@link IllegalArgumentException}s.
 */
public final class Arguments {

    private Arguments() {
    }

    public static String requireNonEmpty(@Nullable String value, String name) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException("Expected non-empty string for " + name + ", but got " +
                (value == null ? "null" : "'" + value + "'"));
        }
        return value;
    }

    public static <T> T requireNonNull(@Nullable T value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }
        return value;
    }

    public static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative, but was " + value);
        }
        return value;
    }
}
