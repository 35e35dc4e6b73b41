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
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChannelTest {

    @Test
    void testEquality() {
        assertThat(Channel.of(ChannelType.TCP_IP, "host:80")).isEqualTo(Channel.of(ChannelType.TCP_IP, "host:80"));
        assertThat(Channel.of(ChannelType.TCP_IP)).isEqualTo(Channel.of(ChannelType.TCP_IP, null));
        assertThat(Channel.of(ChannelType.TCP_IP)).isNotEqualTo(Channel.of(ChannelType.NAMED_PIPE));
        assertThat(Channel.of(ChannelType.TCP_IP, "a")).isNotEqualTo(Channel.of(ChannelType.TCP_IP, "b"));
    }

    @Test
    void testTypeIsRequired() {
        assertThatThrownBy(() -> Channel.of(null)).isInstanceOf(NullPointerException.class);
    }

    @Test
    void testWireCodes() {
        assertThat(ChannelType.OTHER.getCode()).isZero();
        assertThat(ChannelType.IN_PROCESS.getCode()).isEqualTo(4);
        assertThat(MessagingDestinationType.QUEUE.getCode()).isEqualTo(1);
        assertThat(AgentState.NOT_INITIALIZED.getCode()).isEqualTo(3);
    }
}
