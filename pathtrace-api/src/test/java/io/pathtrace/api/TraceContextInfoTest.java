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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TraceContextInfoTest {

    @Test
    void testInvalid() {
        assertThat(TraceContextInfo.INVALID.isValid()).isFalse();
        assertThat(TraceContextInfo.INVALID.getTraceId()).hasSize(32);
        assertThat(TraceContextInfo.INVALID.getSpanId()).hasSize(16);
    }

    @Test
    void testValid() {
        TraceContextInfo info = new TraceContextInfo("0af7651916cd43dd8448eb211c80319c", "b7ad6b7169203331");
        assertThat(info.isValid()).isTrue();
        assertThat(info.toString()).contains("0af7651916cd43dd8448eb211c80319c");
    }

    @Test
    void testPartiallyInvalid() {
        assertThat(new TraceContextInfo("0af7651916cd43dd8448eb211c80319c", "0000000000000000").isValid()).isFalse();
    }
}
