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
import io.pathtrace.api.Channel;
import io.pathtrace.api.ChannelType;
import io.pathtrace.api.CustomServiceTracer;
import io.pathtrace.api.DatabaseInfo;
import io.pathtrace.api.DatabaseRequestTracer;
import io.pathtrace.api.DatabaseVendor;
import io.pathtrace.api.IncomingRemoteCallTracer;
import io.pathtrace.api.OutgoingRemoteCallTracer;
import io.pathtrace.api.PathSdk;
import io.pathtrace.api.PathStructureException;
import io.pathtrace.api.TraceContextInfo;
import io.pathtrace.configuration.CoreConfiguration;
import io.pathtrace.configuration.SpyConfiguration;
import io.pathtrace.impl.tag.TagCodec;
import io.pathtrace.impl.tracer.AbstractTracer;
import io.pathtrace.impl.tracer.ErrorInfo;
import io.pathtrace.impl.tracer.LinkKind;
import io.pathtrace.impl.tracer.TracerState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.stagemonitor.configuration.ConfigurationRegistry;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;

class PathTracerTest {

    private InMemoryAgent agent;
    private PathTracer tracer;
    private PathSdk sdk;

    @BeforeEach
    void setUp() {
        agent = new InMemoryAgent();
        tracer = MockPathTracer.createRealTracer(agent);
        sdk = tracer.getSdk();
    }

    @AfterEach
    void tearDown() {
        tracer.stop();
    }

    private AbstractTracer incomingRemoteCall() {
        return (AbstractTracer) sdk.traceIncomingRemoteCall("method", "service", "endpoint");
    }

    private AbstractTracer outgoingRemoteCall() {
        return (AbstractTracer) sdk.traceOutgoingRemoteCall("method", "service", "endpoint", Channel.of(ChannelType.TCP_IP, "localhost:1234"));
    }

    private AbstractTracer databaseRequest() {
        DatabaseInfo database = sdk.createDatabaseInfo("db", DatabaseVendor.POSTGRESQL, Channel.of(ChannelType.TCP_IP));
        return (AbstractTracer) sdk.traceSqlDatabaseRequest(database, "SELECT 1");
    }

    @Test
    void testSingleRootIsArchived() {
        AbstractTracer root = incomingRemoteCall();
        assertThat(root.getState()).isEqualTo(TracerState.CREATED);
        root.start();
        assertThat(root.getState()).isEqualTo(TracerState.STARTED);
        assertThat(tracer.getActive()).isSameAs(root);
        root.end();

        assertThat(root.getState()).isEqualTo(TracerState.ENDED);
        assertThat(root.getChildren()).isEmpty();
        assertThat(tracer.getArchive().getRoots()).containsExactly(root);
        assertThat(tracer.getActivePath()).isNull();
        assertThat(tracer.getLivePaths()).isEmpty();
        assertThat(agent.getRecordedTracer(root.getId()).getState()).isEqualTo(InMemoryAgent.RecordedTracer.State.ENDED);
    }

    @Test
    void testNestedTracersBecomeChildrenInStartOrder() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        AbstractTracer first = outgoingRemoteCall();
        first.start();
        AbstractTracer nested = databaseRequest();
        nested.start();
        nested.end();
        first.end();
        AbstractTracer second = databaseRequest();
        second.start();
        second.end();
        root.end();

        assertThat(root.getChildren(LinkKind.CHILD)).containsExactly(first, second);
        assertThat(first.getChildren(LinkKind.CHILD)).containsExactly(nested);
        assertThat(root.getChildren().get(0).getKind()).isEqualTo(LinkKind.CHILD);
        assertThat(tracer.getArchive().getRoots()).containsExactly(root);
        assertThat(tracer.getArchive().allNodes()).containsExactly(root, first, nested, second);
    }

    @Test
    void testEndingWithStartedChildFails() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        AbstractTracer child = outgoingRemoteCall();
        child.start();

        assertThatThrownBy(root::end).isInstanceOf(PathStructureException.class);
        assertThat(root.getState()).isEqualTo(TracerState.STARTED);
        assertThat(tracer.getActive()).isSameAs(child);

        child.end();
        root.end();
        assertThat(root.getState()).isEqualTo(TracerState.ENDED);
        assertThat(tracer.getArchive().getRoots()).containsExactly(root);
    }

    @Test
    void testEndIsIdempotent() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        root.end();
        root.end();
        root.close();
        assertThat(tracer.getArchive().size()).isEqualTo(1);
    }

    @Test
    void testEndWithoutStart() {
        AbstractTracer root = incomingRemoteCall();
        root.end();
        assertThat(root.getState()).isEqualTo(TracerState.ENDED);
        assertThat(tracer.getArchive().size()).isZero();
        assertThat(agent.getRecordedTracer(root.getId()).getState()).isEqualTo(InMemoryAgent.RecordedTracer.State.ENDED);
        assertThatThrownBy(root::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testStartTwice() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        assertThatThrownBy(root::start)
            .isInstanceOf(IllegalStateException.class)
            .isNotInstanceOf(PathStructureException.class);
        root.end();
    }

    @Test
    void testMarkFailed() {
        AbstractTracer root = incomingRemoteCall();
        assertThatThrownBy(() -> root.markFailed("Foo", "bar")).isInstanceOf(IllegalStateException.class);
        root.start();
        root.markFailed("Foo", "bar");
        assertThatThrownBy(() -> root.markFailed("Baz", "qux"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already been marked as failed");
        root.end();
        assertThat(root.getErrorInfo()).isEqualTo(new ErrorInfo("Foo", "bar"));
        assertThat(agent.getRecordedTracer(root.getId()).getErrorClass()).isEqualTo("Foo");
        assertThatThrownBy(() -> root.markFailed("Foo", "bar")).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testRunRecordsFailureAndRethrows() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        OutgoingRemoteCallTracer child = sdk.traceOutgoingRemoteCall("m", "s", "e", Channel.of(ChannelType.TCP_IP));

        assertThatThrownBy(() -> child.run(() -> {
            throw new RuntimeException("bla");
        })).isInstanceOf(RuntimeException.class).hasMessage("bla");

        AbstractTracer childImpl = (AbstractTracer) child;
        assertThat(childImpl.getState()).isEqualTo(TracerState.ENDED);
        assertThat(childImpl.getErrorInfo()).isEqualTo(new ErrorInfo(RuntimeException.class.getName(), "bla"));
        root.end();
        assertThat(root.getChildren(LinkKind.CHILD)).containsExactly(childImpl);
        assertThat(root.getErrorInfo()).isNull();
    }

    @Test
    void testCallReturnsValue() throws Exception {
        CustomServiceTracer service = sdk.traceCustomService("method", "service");
        String result = service.call(() -> "result");
        assertThat(result).isEqualTo("result");
        assertThat(((AbstractTracer) service).getState()).isEqualTo(TracerState.ENDED);
        assertThat(((AbstractTracer) service).getErrorInfo()).isNull();
    }

    @Test
    void testCallPropagatesCheckedException() {
        CustomServiceTracer service = sdk.traceCustomService("method", "service");
        assertThatThrownBy(() -> service.call(() -> {
            throw new IOException("io");
        })).isInstanceOf(IOException.class);
        assertThat(((AbstractTracer) service).getErrorInfo()).isEqualTo(new ErrorInfo(IOException.class.getName(), "io"));
    }

    @Test
    void testExplicitFailureIsNotOverwritten() {
        CustomServiceTracer service = sdk.traceCustomService("method", "service");
        assertThatThrownBy(() -> service.run(() -> {
            service.markFailed("Custom", "explicit");
            throw new IllegalArgumentException("implicit");
        })).isInstanceOf(IllegalArgumentException.class);
        assertThat(((AbstractTracer) service).getErrorInfo()).isEqualTo(new ErrorInfo("Custom", "explicit"));
    }

    @Test
    void testRunKeepsApplicationFailureWhenEndingFails() {
        AbstractTracer root = incomingRemoteCall();
        AbstractTracer inner = outgoingRemoteCall();
        IOException applicationFailure = new IOException("application failure");

        assertThatThrownBy(() -> root.run(() -> {
            inner.start();
            throw applicationFailure;
        })).isSameAs(applicationFailure);

        assertThat(applicationFailure.getSuppressed()).hasSize(1);
        assertThat(applicationFailure.getSuppressed()[0]).isInstanceOf(PathStructureException.class);
        assertThat(root.getErrorInfo()).isEqualTo(new ErrorInfo(IOException.class.getName(), "application failure"));
        assertThat(root.getState()).isEqualTo(TracerState.STARTED);

        inner.end();
        root.end();
        assertThat(tracer.getArchive().getRoots()).containsExactly(root);
        assertThat(root.getChildren(LinkKind.CHILD)).containsExactly(inner);
    }

    @Test
    void testEntryFieldAfterStart() {
        IncomingRemoteCallTracer root = sdk.traceIncomingRemoteCall("method", "service", "endpoint");
        root.setProtocolName("grpc");
        root.start();
        assertThatThrownBy(() -> root.setProtocolName("http"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("too late");
        root.end();
        assertThat(((AbstractTracer) root).getValues()).containsEntry("protocol_name", "grpc");
    }

    @Test
    void testExitFieldAfterEnd() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        DatabaseRequestTracer db = (DatabaseRequestTracer) databaseRequest();
        db.start();
        db.setReturnedRowCount(42);
        db.end();
        assertThatThrownBy(() -> db.setRoundTripCount(1)).isInstanceOf(IllegalStateException.class);
        root.end();
        assertThat(((AbstractTracer) db).getValues()).containsEntry("returned_row_count", 42).doesNotContainKey("round_trip_count");
    }

    @Test
    void testUnsupportedCapabilities() {
        AbstractTracer root = incomingRemoteCall();
        AbstractTracer db = databaseRequest();
        AbstractTracer outgoing = outgoingRemoteCall();
        root.start();
        db.start();
        assertThatThrownBy(db::getOutgoingStringTag).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> outgoing.setIncomingStringTag("tag")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(root::getOutgoingByteTag).isInstanceOf(UnsupportedOperationException.class);
        db.end();
        outgoing.end();
        root.end();
    }

    @Test
    void testOutgoingTagRequiresStartedTracer() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        AbstractTracer outgoing = outgoingRemoteCall();
        assertThatThrownBy(outgoing::getOutgoingStringTag).isInstanceOf(IllegalStateException.class);
        outgoing.start();
        String tag = outgoing.getOutgoingStringTag();
        outgoing.end();
        assertThatThrownBy(outgoing::getOutgoingStringTag).isInstanceOf(IllegalStateException.class);
        root.end();

        assertThat(TagCodec.decodeIncoming(tag)).isEqualTo(outgoing.getId());
    }

    @Test
    void testByteTagRoundTrip() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        AbstractTracer outgoing = outgoingRemoteCall();
        outgoing.start();
        byte[] tag = outgoing.getOutgoingByteTag();
        outgoing.end();
        root.end();

        assertThat(tag).hasSize(TagCodec.ENCODED_LENGTH);
        assertThat(TagCodec.decodeIncoming(tag)).isEqualTo(outgoing.getId());
    }

    @Test
    void testNonEntrypointWithoutPathIsNotRecorded() {
        AbstractTracer outgoing = outgoingRemoteCall();
        outgoing.start();
        assertThat(outgoing.getState()).isEqualTo(TracerState.STARTED);
        assertThat(outgoing.isRecorded()).isFalse();
        assertThat(tracer.getActive()).isNull();
        assertThat(outgoing.getOutgoingStringTag()).isEmpty();
        assertThat(outgoing.getOutgoingByteTag()).isEmpty();
        outgoing.end();

        assertThat(outgoing.getState()).isEqualTo(TracerState.ENDED);
        assertThat(tracer.getArchive().size()).isZero();
        assertThat(tracer.getActivePath()).isNull();
    }

    @Test
    void testEntrypointNestedInOtherEntrypoint() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        CustomServiceTracer nested = sdk.traceCustomService("method", "service");
        nested.start();
        nested.end();
        root.end();
        assertThat(root.getChildren(LinkKind.CHILD)).containsExactly((AbstractTracer) nested);
        assertThat(tracer.getArchive().getRoots()).containsExactly(root);
    }

    @Test
    void testSequentialRootsOnSameThread() {
        AbstractTracer first = incomingRemoteCall();
        first.start();
        first.end();
        AbstractTracer second = incomingRemoteCall();
        second.start();
        second.end();
        assertThat(tracer.getArchive().getRoots()).containsExactly(first, second);
        assertThat(first.getChildren()).isEmpty();
    }

    @Test
    void testMaximumPathDepth() {
        ConfigurationRegistry config = SpyConfiguration.createSpyConfig();
        doReturn(2).when(config.getConfig(CoreConfiguration.class)).getPathMaxDepth();
        PathTracer shallowTracer = MockPathTracer.createRealTracer(new InMemoryAgent(), config);
        List<String> diagnostics = new ArrayList<>();
        shallowTracer.getSdk().setDiagnosticCallback(diagnostics::add);
        try {
            CustomServiceTracer root = shallowTracer.getSdk().traceCustomService("m", "s");
            root.start();
            CustomServiceTracer child = shallowTracer.getSdk().traceCustomService("m", "s");
            child.start();
            CustomServiceTracer tooDeep = shallowTracer.getSdk().traceCustomService("m", "s");
            assertThatThrownBy(tooDeep::start).isInstanceOf(PathStructureException.class);
            CustomServiceTracer evenDeeper = shallowTracer.getSdk().traceCustomService("m", "s");
            assertThatThrownBy(evenDeeper::start).isInstanceOf(PathStructureException.class);

            assertThat(diagnostics).hasSize(1);
            assertThat(diagnostics.get(0)).contains("started but never ended");
            assertThat(((AbstractTracer) tooDeep).getState()).isEqualTo(TracerState.CREATED);
            child.end();
            root.end();
            assertThat(shallowTracer.getArchive().allNodes()).hasSize(2);
        } finally {
            shallowTracer.stop();
        }
    }

    @Test
    void testTraceContextInfo() {
        assertThat(sdk.getTraceContextInfo().isValid()).isFalse();
        AbstractTracer root = incomingRemoteCall();
        root.start();
        AbstractTracer child = databaseRequest();
        child.start();

        TraceContextInfo info = sdk.getTraceContextInfo();
        assertThat(info.isValid()).isTrue();
        assertThat(info.getTraceId()).isEqualTo(root.getId().toHexString());
        assertThat(info.getSpanId()).hasSize(16).isNotEqualTo("0000000000000000");

        child.end();
        root.end();
        assertThat(sdk.getTraceContextInfo()).isSameAs(TraceContextInfo.INVALID);
    }

    @Test
    void testDumpRendersTree() {
        AbstractTracer root = incomingRemoteCall();
        root.start();
        AbstractTracer child = databaseRequest();
        child.start();
        child.end();
        root.end();
        assertThat(root.dump())
            .contains(root.toString())
            .contains("CHILD")
            .contains(child.toString())
            .contains("statement=SELECT 1");
    }

    @Test
    void testStopShutsDownAgent() {
        tracer.stop();
        assertThat(tracer.isStopped()).isTrue();
        assertThat(sdk.getAgentState()).isEqualTo(io.pathtrace.api.AgentState.PERMANENTLY_INACTIVE);
    }
}
