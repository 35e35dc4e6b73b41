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

import io.pathtrace.api.DiagnosticCallback;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;

/**
 * The channel for problems which must not interrupt the application, like leaked tracers.
 * Messages are logged and passed to the registered {@link DiagnosticCallback}.
 */
public class Diagnostics {

    private static final Logger logger = LoggerFactory.getLogger(Diagnostics.class);

    @Nullable
    private volatile DiagnosticCallback callback;

    public void setCallback(@Nullable DiagnosticCallback callback) {
        this.callback = callback;
    }

    public void warn(String message) {
        logger.warn(message);
        final DiagnosticCallback callback = this.callback;
        if (callback != null) {
            try {
                callback.onDiagnostic(message);
            } catch (Error e) {
                throw e;
            } catch (Throwable t) {
                logger.warn("Exception while calling diagnostic callback {}", callback, t);
            }
        }
    }
}
