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
 * Describes a queue or topic of a messaging system.
 * Obtained from {@link PathSdk#createMessagingSystemInfo(String, String, MessagingDestinationType, Channel)}.
 */
public final class MessagingSystemInfo {

    private final String vendor;
    private final String destinationName;
    private final MessagingDestinationType destinationType;
    private final Channel channel;

    public MessagingSystemInfo(String vendor, String destinationName, MessagingDestinationType destinationType, Channel channel) {
        this.vendor = vendor;
        this.destinationName = destinationName;
        this.destinationType = destinationType;
        this.channel = channel;
    }

    /**
     * @return the vendor, see {@link MessagingVendor} for well-known values
     */
    public String getVendor() {
        return vendor;
    }

    public String getDestinationName() {
        return destinationName;
    }

    public MessagingDestinationType getDestinationType() {
        return destinationType;
    }

    public Channel getChannel() {
        return channel;
    }

    @Override
    public String toString() {
        return "MessagingSystemInfo(" + vendor + ", " + destinationName + ", " + destinationType + ", " + channel + ")";
    }
}
