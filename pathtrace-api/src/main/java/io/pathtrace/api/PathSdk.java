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

import javax.annotation.Nullable;
import java.util.List;
import java.util.Map;

/**
 * Entry point for creating tracers.
 * <p>
 * All {@code trace*} methods return a tracer in the created state.
 * Invalid arguments are rejected with an {@link IllegalArgumentException};
 * a tracer which was partially set up when the validation failed is discarded.
 * </p>
 * <p>
 * Incoming tags may be supplied either in their string or in their binary form.
 * Supplying both is reported to the {@linkplain #setDiagnosticCallback(DiagnosticCallback) diagnostic callback},
 * and neither tag is applied.
 * </p>
 */
public interface PathSdk {

    // value objects

    /**
     * @param name   the name of the database, must not be empty
     * @param vendor the database vendor, must not be empty, see {@link DatabaseVendor}
     * @param channel how the database is reached
     * @return the database info
     */
    DatabaseInfo createDatabaseInfo(String name, String vendor, Channel channel);

    /**
     * @param virtualHost   the logical name of the web server, must not be empty
     * @param applicationId identifies the application, must not be empty
     * @param contextRoot   the URL path prefix of the application, must not be empty
     * @return the web application info
     */
    WebApplicationInfo createWebApplicationInfo(String virtualHost, String applicationId, String contextRoot);

    /**
     * @param vendor          the vendor of the messaging system, must not be empty, see {@link MessagingVendor}
     * @param destinationName the name of the queue or topic, must not be empty
     * @param destinationType queue or topic
     * @param channel         how the messaging system is reached
     * @return the messaging system info
     */
    MessagingSystemInfo createMessagingSystemInfo(String vendor, String destinationName, MessagingDestinationType destinationType,
                                                  Channel channel);

    // remote calls

    IncomingRemoteCallTracer traceIncomingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint);

    /**
     * @param serviceMethod   the name of the called method, must not be empty
     * @param serviceName     the name of the called service, must not be empty
     * @param serviceEndpoint the endpoint of the called service, must not be empty
     * @param protocolName    optional name of the protocol
     * @param stringTag       the tag sent by the caller in its string form
     * @param byteTag         the tag sent by the caller in its binary form
     * @return the tracer
     */
    IncomingRemoteCallTracer traceIncomingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint,
                                                     @Nullable String protocolName, @Nullable String stringTag, @Nullable byte[] byteTag);

    OutgoingRemoteCallTracer traceOutgoingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint, Channel channel);

    OutgoingRemoteCallTracer traceOutgoingRemoteCall(String serviceMethod, String serviceName, String serviceEndpoint, Channel channel,
                                                     @Nullable String protocolName);

    // database

    /**
     * @param database  the database the statement is executed on
     * @param statement the SQL statement, must not be empty
     * @return the tracer
     */
    DatabaseRequestTracer traceSqlDatabaseRequest(DatabaseInfo database, String statement);

    // web requests

    IncomingWebRequestTracer traceIncomingWebRequest(WebApplicationInfo webApplication, String url, String method);

    /**
     * @param webApplication the application handling the request
     * @param url            the requested URL, must not be empty
     * @param method         the HTTP method, must not be empty
     * @param headers        request headers, added in iteration order
     * @param remoteAddress  the address of the client
     * @param stringTag      the tag sent by the client in its string form
     * @param byteTag        the tag sent by the client in its binary form
     * @return the tracer
     */
    IncomingWebRequestTracer traceIncomingWebRequest(WebApplicationInfo webApplication, String url, String method,
                                                     @Nullable Map<String, String> headers, @Nullable String remoteAddress,
                                                     @Nullable String stringTag, @Nullable byte[] byteTag);

    OutgoingWebRequestTracer traceOutgoingWebRequest(String url, String method);

    OutgoingWebRequestTracer traceOutgoingWebRequest(String url, String method, @Nullable Map<String, String> headers);

    // messaging

    OutgoingMessageTracer traceOutgoingMessage(MessagingSystemInfo messagingSystem);

    IncomingMessageReceiveTracer traceIncomingMessageReceive(MessagingSystemInfo messagingSystem);

    IncomingMessageProcessTracer traceIncomingMessageProcess(MessagingSystemInfo messagingSystem);

    IncomingMessageProcessTracer traceIncomingMessageProcess(MessagingSystemInfo messagingSystem, @Nullable String stringTag,
                                                             @Nullable byte[] byteTag);

    // custom services

    /**
     * @param serviceMethod the name of the operation, must not be empty
     * @param serviceName   the name of the service, must not be empty
     * @return the tracer
     */
    CustomServiceTracer traceCustomService(String serviceMethod, String serviceName);

    // in-process links

    /**
     * Creates a link to the currently active tracer,
     * which can be passed to another thread and continued with {@link #traceInProcessLink(byte[])}.
     *
     * @return the link, or an empty array if no tracer is active
     */
    byte[] createInProcessLink();

    /**
     * @param link a link created by {@link #createInProcessLink()}
     * @return the tracer
     */
    InProcessLinkTracer traceInProcessLink(byte[] link);

    // custom request attributes

    /**
     * Attaches an attribute to the currently active tracer.
     * If there is no active tracer, a diagnostic message is issued and the attribute is dropped.
     *
     * @param key   the attribute key, must not be empty
     * @param value the attribute value
     */
    void addCustomRequestAttribute(String key, String value);

    void addCustomRequestAttribute(String key, long value);

    void addCustomRequestAttribute(String key, double value);

    /**
     * Adds all entries in iteration order.
     * Values of other types than {@link String}, {@link Long}, {@link Integer}, {@link Double} and {@link Float}
     * are reported to the diagnostic callback and skipped.
     *
     * @param attributes the attributes
     */
    void addCustomRequestAttributes(Map<String, ?> attributes);

    /**
     * Adds the first {@code count} pairs of the parallel lists, in list order.
     * Values are treated like in {@link #addCustomRequestAttributes(Map)}.
     *
     * @throws IllegalArgumentException if {@code count} is negative or larger than one of the lists
     */
    void addCustomRequestAttributes(List<String> keys, List<?> values, int count);

    // agent

    TraceContextInfo getTraceContextInfo();

    AgentState getAgentState();

    String getAgentVersionString();

    boolean isAgentFound();

    boolean isAgentCompatible();

    /**
     * @param callback the callback, or {@code null} to only log diagnostic messages
     */
    void setDiagnosticCallback(@Nullable DiagnosticCallback callback);

    /**
     * Stops background tasks and shuts the agent down.
     */
    void shutdown();
}
