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
 * Vendor names of well-known messaging systems.
 */
public final class MessagingVendor {

    public static final String HORNETQ = "HornetQ";
    public static final String ACTIVE_MQ = "ActiveMQ";
    public static final String RABBIT_MQ = "RabbitMQ";
    public static final String ARTEMIS = "Artemis";
    public static final String WEBSPHERE = "WebSphere";
    public static final String MQSERIES_JMS = "MQSeries JMS";
    public static final String MQSERIES = "MQSeries";
    public static final String TIBCO = "Tibco";

    private MessagingVendor() {
    }
}
