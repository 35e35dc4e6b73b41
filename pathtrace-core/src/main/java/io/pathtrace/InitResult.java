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
package io.pathtrace;

import javax.annotation.Nullable;

/**
 * Outcome of {@link PathTrace#initialize()}.
 * Negative status codes are errors; even then {@link PathTrace#getSdk()} returns a usable no-op SDK.
 */
public final class InitResult {

    public enum Status {
        /**
         * The agent implementation could not be loaded.
         */
        STUB_LOAD_ERROR(-2),
        /**
         * The tracer could not be built.
         */
        INIT_ERROR(-1),
        INITIALIZED(0),
        /**
         * Initialized, but the agent is not active.
         */
        INITIALIZED_WITH_WARNING(1),
        /**
         * A previous call already initialized the SDK (not necessarily with success).
         * Only the reference count was increased.
         */
        ALREADY_INITIALIZED(2);

        private final int code;

        Status(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    private final Status status;
    @Nullable
    private final Throwable error;

    InitResult(Status status, @Nullable Throwable error) {
        this.status = status;
        this.error = error;
    }

    public Status getStatus() {
        return status;
    }

    @Nullable
    public Throwable getError() {
        return error;
    }

    public boolean isError() {
        return status.getCode() < 0;
    }

    @Override
    public String toString() {
        return error == null ? status.toString() : status + " (" + error + ")";
    }
}
