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

import javax.annotation.Nullable;
import java.util.Objects;

/**
 * The failure recorded for a tracer.
 */
public final class ErrorInfo {

    @Nullable
    private final String errorClass;
    @Nullable
    private final String message;

    public ErrorInfo(@Nullable String errorClass, @Nullable String message) {
        this.errorClass = errorClass;
        this.message = message;
    }

    @Nullable
    public String getErrorClass() {
        return errorClass;
    }

    @Nullable
    public String getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ErrorInfo errorInfo = (ErrorInfo) o;
        return Objects.equals(errorClass, errorInfo.errorClass) && Objects.equals(message, errorInfo.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(errorClass, message);
    }

    @Override
    public String toString() {
        return "(" + errorClass + ", " + message + ")";
    }
}
