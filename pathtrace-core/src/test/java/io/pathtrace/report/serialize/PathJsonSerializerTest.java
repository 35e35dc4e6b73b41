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
package io.pathtrace.report.serialize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.pathtrace.MockPathTracer;
import io.pathtrace.api.Channel;
import io.pathtrace.api.ChannelType;
import io.pathtrace.api.DatabaseInfo;
import io.pathtrace.api.DatabaseRequestTracer;
import io.pathtrace.api.DatabaseVendor;
import io.pathtrace.api.IncomingRemoteCallTracer;
import io.pathtrace.api.IncomingWebRequestTracer;
import io.pathtrace.api.OutgoingRemoteCallTracer;
import io.pathtrace.api.PathSdk;
import io.pathtrace.impl.PathTracer;
import io.pathtrace.impl.tracer.AbstractTracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;

class PathJsonSerializerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private PathJsonSerializer serializer;
    private PathTracer tracer;
    private PathSdk sdk;

    @BeforeEach
    void setUp() {
        serializer = new PathJsonSerializer();
        tracer = MockPathTracer.createRealTracer();
        sdk = tracer.getSdk();
    }

    @AfterEach
    void tearDown() {
        tracer.stop();
    }

    private JsonNode readJsonString(String jsonString) throws IOException {
        return objectMapper.readTree(jsonString);
    }

    @Test
    void testSerializeTree() throws Exception {
        IncomingRemoteCallTracer root = sdk.traceIncomingRemoteCall("method", "service", "endpoint");
        root.start();
        sdk.addCustomRequestAttribute("customer \"acme\"", "gold");
        DatabaseInfo database = sdk.createDatabaseInfo("orders", DatabaseVendor.POSTGRESQL, Channel.of(ChannelType.TCP_IP));
        DatabaseRequestTracer db = sdk.traceSqlDatabaseRequest(database, "SELECT * FROM orders");
        db.start();
        db.setReturnedRowCount(3);
        db.markFailed("java.sql.SQLException", "timeout");
        db.end();
        root.end();

        JsonNode json = readJsonString(serializer.toJsonString((AbstractTracer) root));

        assertThat(json.get("id").textValue()).isEqualTo(((AbstractTracer) root).getId().toHexString());
        assertThat(json.get("kind").textValue()).isEqualTo("IncomingRemoteCall");
        assertThat(json.get("state").textValue()).isEqualTo("ENDED");
        assertThat(json.get("thread").textValue()).isEqualTo(Thread.currentThread().getName());
        assertThat(json.get("values").get("service_method").textValue()).isEqualTo("method");
        assertThat(json.get("custom_attributes").get("customer \"acme\"").textValue()).isEqualTo("gold");
        assertThat(json.get("error")).isNull();

        JsonNode children = json.get("children");
        assertThat(children).hasSize(1);
        assertThat(children.get(0).get("link").textValue()).isEqualTo("CHILD");
        JsonNode child = children.get(0).get("tracer");
        assertThat(child.get("kind").textValue()).isEqualTo("DatabaseRequest");
        assertThat(child.get("values").get("statement").textValue()).isEqualTo("SELECT * FROM orders");
        assertThat(child.get("values").get("returned_row_count").intValue()).isEqualTo(3);
        assertThat(child.get("error").get("class").textValue()).isEqualTo("java.sql.SQLException");
        assertThat(child.get("error").get("message").textValue()).isEqualTo("timeout");
        assertThat(child.get("children")).isEmpty();
    }

    @Test
    void testSerializeTagLink() throws Exception {
        IncomingRemoteCallTracer client = sdk.traceIncomingRemoteCall("main", "client", "local");
        client.start();
        OutgoingRemoteCallTracer outgoing = sdk.traceOutgoingRemoteCall("call", "server", "remote", Channel.of(ChannelType.TCP_IP, "server:80"));
        outgoing.start();
        String tag = outgoing.getOutgoingStringTag();
        outgoing.end();
        client.end();
        IncomingRemoteCallTracer server = sdk.traceIncomingRemoteCall("call", "server", "remote", null, tag, null);
        server.start();
        server.end();
        tracer.resolvePendingTags();

        JsonNode paths = readJsonString(serializer.toJsonString(tracer.getArchive().getRoots()));

        assertThat(paths).hasSize(2);
        JsonNode outgoingJson = paths.get(0).get("children").get(0).get("tracer");
        assertThat(outgoingJson.get("values").get("channel_endpoint").textValue()).isEqualTo("server:80");
        JsonNode link = outgoingJson.get("children").get(0);
        assertThat(link.get("link").textValue()).isEqualTo("TAG_LINKED");
        assertThat(link.get("id").textValue()).isEqualTo(((AbstractTracer) server).getId().toHexString());
        assertThat(link.get("tracer")).isNull();

        JsonNode incomingTag = paths.get(1).get("incoming_tag");
        assertThat(incomingTag.get("id").textValue()).isEqualTo(((AbstractTracer) outgoing).getId().toHexString());
        assertThat(incomingTag.get("resolved").booleanValue()).isTrue();
    }

    @Test
    void testSerializeHeaders() throws Exception {
        IncomingWebRequestTracer request = sdk.traceIncomingWebRequest(sdk.createWebApplicationInfo("localhost", "shop", "/"),
            "http://localhost/", "GET");
        request.addRequestHeaders(Arrays.asList("Host", "Accept"), Arrays.asList("localhost", "*/*"), 2);
        request.start();
        request.setStatusCode(204);
        request.end();

        JsonNode values = readJsonString(serializer.toJsonString((AbstractTracer) request)).get("values");

        assertThat(values.get("request_headers")).hasSize(2);
        assertThat(values.get("request_headers").get(1).get("key").textValue()).isEqualTo("Accept");
        assertThat(values.get("request_headers").get(1).get("value").textValue()).isEqualTo("*/*");
        assertThat(values.get("status_code").intValue()).isEqualTo(204);
        assertThat(values.get("virtual_host").textValue()).isEqualTo("localhost");
    }

    @Test
    void testLongValuesAreTruncated() throws Exception {
        char[] chars = new char[PathJsonSerializer.MAX_VALUE_LENGTH + 100];
        Arrays.fill(chars, 'x');
        IncomingRemoteCallTracer root = sdk.traceIncomingRemoteCall(new String(chars), "service", "endpoint");
        root.start();
        root.end();

        String serviceMethod = readJsonString(serializer.toJsonString((AbstractTracer) root)).get("values").get("service_method").textValue();

        assertThat(serviceMethod).hasSize(PathJsonSerializer.MAX_VALUE_LENGTH);
        assertThat(serviceMethod).endsWith("…");
    }

    @Test
    void testSerializePathsWritesOneLinePerPath() throws Exception {
        for (int i = 0; i < 3; i++) {
            sdk.traceCustomService("method" + i, "service").run(() -> {
            });
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializer.serializePaths(tracer.getArchive().getRoots(), out);

        String[] lines = new String(out.toByteArray(), StandardCharsets.UTF_8).split("\n");
        assertThat(lines).hasSize(3);
        for (int i = 0; i < 3; i++) {
            assertThat(readJsonString(lines[i]).get("values").get("service_method").textValue()).isEqualTo("method" + i);
        }
    }

    @Test
    void testSerializeEmptyList() throws Exception {
        assertThat(readJsonString(serializer.toJsonString(Collections.<AbstractTracer>emptyList()))).isEmpty();
    }
}
