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
 * The state of the agent the SDK reports to.
 */
public enum AgentState {
    /**
     * Tracers are recorded.
     */
    ACTIVE(0),
    /**
     * Tracers are currently not recorded, the agent may become active again.
     */
    TEMPORARILY_INACTIVE(1),
    /**
     * The agent will never record tracers in this process.
     */
    PERMANENTLY_INACTIVE(2),
    NOT_INITIALIZED(3);

    private final int code;

    AgentState(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }
}
