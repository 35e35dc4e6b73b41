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

import io.pathtrace.MockPathTracer;
import io.pathtrace.agent.InMemoryAgent;
import io.pathtrace.agent.NoopAgent;
import io.pathtrace.agent.TracerField;
import io.pathtrace.api.AgentState;
import io.pathtrace.api.Channel;
import io.pathtrace.api.ChannelType;
import io.pathtrace.api.DatabaseInfo;
import io.pathtrace.api.DatabaseRequestTracer;
import io.pathtrace.api.DatabaseVendor;
import io.pathtrace.api.IncomingMessageProcessTracer;
import io.pathtrace.api.IncomingRemoteCallTracer;
import io.pathtrace.api.IncomingWebRequestTracer;
import io.pathtrace.api.MessagingDestinationType;
import io.pathtrace.api.MessagingSystemInfo;
import io.pathtrace.api.MessagingVendor;
import io.pathtrace.api.OutgoingMessageTracer;
import io.pathtrace.api.OutgoingWebRequestTracer;
import io.pathtrace.api.PathSdk;
import io.pathtrace.api.WebApplicationInfo;
import io.pathtrace.impl.tracer.AbstractTracer;
import io.pathtrace.impl.tracer.IncomingWebRequestTracerImpl;
import io.pathtrace.impl.tracer.KeyValuePair;
import io.pathtrace.impl.tracer.LinkKind;
import io.pathtrace.impl.tracer.OutgoingWebRequestTracerImpl;
import io.pathtrace.impl.tracer.TracerState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PathSdkImplTest {

    private InMemoryAgent agent;
    private PathTracer tracer;
    private PathSdk sdk;
    private final List<String> diagnostics = new ArrayList<>();

    @BeforeEach
    void setUp() {
        agent = new InMemoryAgent();
        tracer = MockPathTracer.createRealTracer(agent);
        sdk = tracer.getSdk();
        sdk.setDiagnosticCallback(diagnostics::add);
    }

    @AfterEach
    void tearDown() {
        tracer.stop();
    }

    private WebApplicationInfo webApplication() {
        return sdk.createWebApplicationInfo("localhost", "shop", "/shop");
    }

    private MessagingSystemInfo queue() {
        return sdk.createMessagingSystemInfo(MessagingVendor.RABBIT_MQ, "orders", MessagingDestinationType.QUEUE,
            Channel.of(ChannelType.TCP_IP, "mq:5672"));
    }

    @Test
    void testRequiredArgumentsAreValidatedBeforeTheAgentIsCalled() {
        assertThatThrownBy(() -> sdk.traceIncomingRemoteCall("", "service", "endpoint"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("service method");
        assertThatThrownBy(() -> sdk.traceOutgoingRemoteCall("method", "service", "endpoint", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sdk.traceSqlDatabaseRequest(null, "SELECT 1"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sdk.traceOutgoingWebRequest("http://localhost", " "))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sdk.traceCustomService("method", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sdk.traceInProcessLink(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(agent.getRecordedTracers()).isEmpty();
    }

    @Test
    void testInfoObjectsAreValidated() {
        assertThatThrownBy(() -> sdk.createDatabaseInfo("", "vendor", Channel.of(ChannelType.OTHER)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sdk.createWebApplicationInfo("host", "app", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sdk.createMessagingSystemInfo("vendor", "queue", null, Channel.of(ChannelType.OTHER)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testFailureWhileApplyingOptionalArgumentsEndsTheTracer() {
        Map<String, String> headers = new HashMap<>();
        headers.put("Accept", null);

        assertThatThrownBy(() -> sdk.traceIncomingWebRequest(webApplication(), "http://localhost/shop", "GET", headers, null, null, null))
            .isInstanceOf(IllegalArgumentException.class);

        assertThat(agent.getRecordedTracers()).hasSize(1);
        assertThat(agent.getRecordedTracers().iterator().next().getState()).isEqualTo(InMemoryAgent.RecordedTracer.State.ENDED);
        assertThat(tracer.getActivePath()).isNull();
    }

    @Test
    void testIncomingWebRequestWithOptionalArguments() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Host", "localhost");
        headers.put("Accept", "text/html");
        IncomingWebRequestTracer request = sdk.traceIncomingWebRequest(webApplication(), "http://localhost/shop", "GET", headers,
            "10.0.0.1", null, null);
        request.addParameter("item", "42");
        request.start();
        request.addResponseHeader("Content-Type", "text/html");
        request.setStatusCode(200);
        request.end();

        IncomingWebRequestTracerImpl impl = (IncomingWebRequestTracerImpl) request;
        assertThat(impl.getRequestHeaders()).containsExactly(new KeyValuePair("Host", "localhost"), new KeyValuePair("Accept", "text/html"));
        assertThat(impl.getParameters()).containsExactly(new KeyValuePair("item", "42"));
        assertThat(impl.getResponseHeaders()).containsExactly(new KeyValuePair("Content-Type", "text/html"));
        assertThat(impl.getRemoteAddress()).isEqualTo("10.0.0.1");
        assertThat(impl.getStatusCode()).isEqualTo(200);
        assertThat(agent.getRecordedTracer(impl.getId()).getEntries(TracerField.REQUEST_HEADER))
            .containsExactly("Host=localhost", "Accept=text/html");
        assertThat(agent.getRecordedTracer(impl.getId()).getField(TracerField.STATUS_CODE)).isEqualTo(200);
    }

    @Test
    void testRequestHeadersAreEntryFields() {
        IncomingWebRequestTracer request = sdk.traceIncomingWebRequest(webApplication(), "http://localhost/shop", "GET");
        request.start();
        assertThatThrownBy(() -> request.addRequestHeader("Host", "localhost")).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> request.addParameter("item", "42")).isInstanceOf(IllegalStateException.class);
        request.end();
    }

    @Test
    void testBatchedHeadersRespectCount() {
        OutgoingWebRequestTracer request = sdk.traceOutgoingWebRequest("http://backend/api", "POST");
        request.addRequestHeaders(Arrays.asList("a", "b", "c"), Arrays.asList("1", "2", "3"), 2);
        assertThatThrownBy(() -> request.addRequestHeaders(Arrays.asList("x"), Arrays.asList("9"), 2))
            .isInstanceOf(IllegalArgumentException.class);
        request.end();

        assertThat(((OutgoingWebRequestTracerImpl) request).getRequestHeaders())
            .containsExactly(new KeyValuePair("a", "1"), new KeyValuePair("b", "2"));
    }

    @Test
    void testBothTagsAreDiscardedWithDiagnostic() {
        IncomingRemoteCallTracer server = sdk.traceIncomingRemoteCall("method", "service", "endpoint", null,
            "AAAAAAAAAAAqAAAAAAAAACo=", new byte[17]);
        server.start();
        server.end();

        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0)).contains("Both string and byte tag");
        assertThat(((AbstractTracer) server).getIncomingTagId()).isNull();
        assertThat(agent.getRecordedTracer(((AbstractTracer) server).getId()).getIncomingTag()).isNull();
    }

    @Test
    void testBothTagsViaSettersAreDiscardedOnStart() {
        IncomingRemoteCallTracer server = sdk.traceIncomingRemoteCall("method", "service", "endpoint");
        server.setIncomingStringTag("AAAAAAAAAAAqAAAAAAAAACo=");
        server.setIncomingByteTag(new byte[17]);
        assertThat(diagnostics).isEmpty();
        server.start();
        server.end();

        assertThat(diagnostics).hasSize(1);
        assertThat(((AbstractTracer) server).getIncomingTagId()).isNull();
    }

    @Test
    void testIncomingTagIsEntryField() {
        IncomingRemoteCallTracer server = sdk.traceIncomingRemoteCall("method", "service", "endpoint");
        server.start();
        assertThatThrownBy(() -> server.setIncomingStringTag("AAAAAAAAAAAqAAAAAAAAACo=")).isInstanceOf(IllegalStateException.class);
        server.end();
    }

    @Test
    void testCustomRequestAttributes() {
        sdk.addCustomRequestAttribute("dropped", "value");
        assertThat(diagnostics).hasSize(1);

        IncomingRemoteCallTracer root = sdk.traceIncomingRemoteCall("method", "service", "endpoint");
        root.start();
        sdk.addCustomRequestAttribute("customer", "acme");
        sdk.addCustomRequestAttribute("items", 3L);
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("amount", 9.5);
        attributes.put("retries", 2);
        attributes.put("flag", Boolean.TRUE);
        sdk.addCustomRequestAttributes(attributes);
        root.end();

        AbstractTracer impl = (AbstractTracer) root;
        assertThat(impl.getCustomAttributes())
            .containsEntry("customer", "acme")
            .containsEntry("items", 3L)
            .containsEntry("amount", 9.5)
            .containsEntry("retries", 2L)
            .doesNotContainKey("flag");
        assertThat(diagnostics).hasSize(2);
        assertThat(agent.getRecordedTracer(impl.getId()).getCustomRequestAttributes()).containsEntry("customer", "acme");
    }

    @Test
    void testCustomRequestAttributeGoesToInnermostTracer() {
        IncomingRemoteCallTracer root = sdk.traceIncomingRemoteCall("method", "service", "endpoint");
        root.start();
        OutgoingWebRequestTracer child = sdk.traceOutgoingWebRequest("http://backend/api", "GET");
        child.start();
        sdk.addCustomRequestAttribute("key", "value");
        child.end();
        root.end();

        assertThat(((AbstractTracer) child).getCustomAttributes()).containsOnlyKeys("key");
        assertThat(((AbstractTracer) root).getCustomAttributes()).isEmpty();
    }

    @Test
    void testBatchedCustomRequestAttributesRespectCount() {
        IncomingRemoteCallTracer root = sdk.traceIncomingRemoteCall("method", "service", "endpoint");
        root.start();
        sdk.addCustomRequestAttributes(Arrays.asList("customer", "items", "flag", "ignored"),
            Arrays.<Object>asList("acme", 3, Boolean.TRUE, "ignored"), 3);
        assertThatThrownBy(() -> sdk.addCustomRequestAttributes(Arrays.asList("a", "b"), Arrays.<Object>asList("a"), 2))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> sdk.addCustomRequestAttributes(Arrays.asList("a"), Arrays.<Object>asList("a"), -1))
            .isInstanceOf(IllegalArgumentException.class);
        root.end();

        assertThat(((AbstractTracer) root).getCustomAttributes())
            .containsOnlyKeys("customer", "items")
            .containsEntry("customer", "acme")
            .containsEntry("items", 3L);
        assertThat(diagnostics).hasSize(1);
        assertThat(diagnostics.get(0)).contains("flag").contains(Boolean.class.getName());
    }

    @Test
    void testNegativeCountsAndStatusCodesAreRejected() {
        DatabaseInfo database = sdk.createDatabaseInfo("orders", DatabaseVendor.POSTGRESQL, Channel.of(ChannelType.TCP_IP, "db:5432"));
        DatabaseRequestTracer query = sdk.traceSqlDatabaseRequest(database, "SELECT * FROM orders");
        query.start();
        assertThatThrownBy(() -> query.setReturnedRowCount(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> query.setRoundTripCount(-1)).isInstanceOf(IllegalArgumentException.class);
        query.setReturnedRowCount(0);
        query.end();

        InMemoryAgent.RecordedTracer recordedQuery = agent.getRecordedTracer(((AbstractTracer) query).getId());
        assertThat(recordedQuery.getField(TracerField.RETURNED_ROW_COUNT)).isEqualTo(0);
        assertThat(recordedQuery.getField(TracerField.ROUND_TRIP_COUNT)).isNull();

        IncomingWebRequestTracer incoming = sdk.traceIncomingWebRequest(webApplication(), "http://localhost/shop/cart", "GET");
        assertThatThrownBy(() -> incoming.setStatusCode(-200)).isInstanceOf(IllegalArgumentException.class);
        OutgoingWebRequestTracer outgoing = sdk.traceOutgoingWebRequest("http://backend/api", "POST");
        assertThatThrownBy(() -> outgoing.setStatusCode(-1)).isInstanceOf(IllegalArgumentException.class);
        assertThat(agent.getRecordedTracer(((AbstractTracer) incoming).getId()).getField(TracerField.STATUS_CODE)).isNull();
        assertThat(agent.getRecordedTracer(((AbstractTracer) outgoing).getId()).getField(TracerField.STATUS_CODE)).isNull();
    }

    @Test
    void testBatchedParametersRespectCount() {
        IncomingWebRequestTracer request = sdk.traceIncomingWebRequest(webApplication(), "http://localhost/shop/search", "GET");
        request.addParameters(Arrays.asList("q", "page", "debug"), Arrays.asList("socks", "2", "true"), 2);
        assertThatThrownBy(() -> request.addParameters(Arrays.asList("q"), Arrays.asList("socks"), 2))
            .isInstanceOf(IllegalArgumentException.class);
        request.start();
        assertThatThrownBy(() -> request.addParameters(Arrays.asList("late"), Arrays.asList("1"), 1))
            .isInstanceOf(IllegalStateException.class);
        request.end();

        IncomingWebRequestTracerImpl impl = (IncomingWebRequestTracerImpl) request;
        assertThat(impl.getParameters()).containsExactly(new KeyValuePair("q", "socks"), new KeyValuePair("page", "2"));
        assertThat(agent.getRecordedTracer(impl.getId()).getEntries(TracerField.PARAMETER)).containsExactly("q=socks", "page=2");
    }

    @Test
    void testMessagingRoundTrip() {
        IncomingRemoteCallTracer root = sdk.traceIncomingRemoteCall("method", "service", "endpoint");
        root.start();
        OutgoingMessageTracer send = sdk.traceOutgoingMessage(queue());
        send.start();
        String tag = send.getOutgoingStringTag();
        // assigned by the broker while sending
        send.setVendorMessageId("msg-1");
        send.end();
        root.end();

        IncomingMessageProcessTracer process = sdk.traceIncomingMessageProcess(queue(), tag, null);
        process.setCorrelationId("corr-1");
        process.start();
        process.end();

        assertThat(tracer.resolvePendingTags()).isEmpty();
        assertThat(((AbstractTracer) process).getLinkedParent()).isSameAs(send);
        assertThat(((AbstractTracer) send).getValues()).containsEntry("vendor_message_id", "msg-1").containsEntry("destination_type", "QUEUE");
        assertThat(((AbstractTracer) process).getValues()).containsEntry("correlation_id", "corr-1");
    }

    @Test
    void testIncomingMessageReceiveIsEntrypoint() {
        sdk.traceIncomingMessageReceive(queue()).run(() -> {
            sdk.traceIncomingMessageProcess(queue()).run(() -> {
            });
        });
        AbstractTracer receive = tracer.getArchive().getRoots().get(0);
        assertThat(receive.getKind().getDisplayName()).isEqualTo("IncomingMessageReceive");
        assertThat(receive.getChildren(LinkKind.CHILD)).hasSize(1);
    }

    @Test
    void testInProcessLinkWithoutActiveTracer() {
        assertThat(sdk.createInProcessLink()).isEmpty();
        sdk.traceInProcessLink(new byte[0]).run(() -> {
        });
        assertThat(tracer.getArchive().getRoots().get(0).getIncomingTagId()).isNull();
    }

    @Test
    void testAgentInfo() {
        assertThat(sdk.getAgentState()).isEqualTo(AgentState.ACTIVE);
        assertThat(sdk.getAgentVersionString()).isEqualTo("1.0.0/in-memory");
        assertThat(sdk.isAgentFound()).isTrue();
        assertThat(sdk.isAgentCompatible()).isTrue();
    }

    @Test
    void testAgentDiagnosticsReachCallback() {
        agent.reportDiagnostic("agent problem");
        assertThat(diagnostics).containsExactly("agent problem");
    }

    @Test
    void testNoopAgentKeepsPathModel() {
        PathTracer noopTracer = MockPathTracer.createRealTracer(new NoopAgent());
        try {
            PathSdk noopSdk = noopTracer.getSdk();
            IncomingRemoteCallTracer root = noopSdk.traceIncomingRemoteCall("method", "service", "endpoint");
            root.start();
            OutgoingWebRequestTracer child = noopSdk.traceOutgoingWebRequest("http://backend/api", "GET");
            child.start();
            assertThat(child.getOutgoingStringTag()).isEmpty();
            assertThat(child.getOutgoingByteTag()).isEmpty();
            assertThat(noopSdk.getTraceContextInfo().isValid()).isFalse();
            child.end();
            root.end();

            assertThat(noopTracer.getArchive().getRoots()).containsExactly((AbstractTracer) root);
            assertThat(((AbstractTracer) root).getChildren(LinkKind.CHILD)).containsExactly((AbstractTracer) child);
            assertThat(((AbstractTracer) child).getState()).isEqualTo(TracerState.ENDED);
            assertThat(noopSdk.getAgentState()).isEqualTo(AgentState.PERMANENTLY_INACTIVE);
            assertThat(noopSdk.isAgentFound()).isFalse();
        } finally {
            noopTracer.stop();
        }
    }

    @Test
    void testShutdownStopsTracer() {
        sdk.shutdown();
        assertThat(tracer.isStopped()).isTrue();
    }
}
