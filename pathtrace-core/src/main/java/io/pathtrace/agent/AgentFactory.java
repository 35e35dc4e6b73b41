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
package io.pathtrace.agent;

import io.pathtrace.configuration.CoreConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stagemonitor.configuration.ConfigurationRegistry;

import java.util.Iterator;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

public class AgentFactory {

    private static final Logger logger = LoggerFactory.getLogger(AgentFactory.class);

    public Agent createAgent(ConfigurationRegistry configurationRegistry) {
        final CoreConfiguration coreConfiguration = configurationRegistry.getConfig(CoreConfiguration.class);
        if (!coreConfiguration.isActive()) {
            logger.info("Tracing is deactivated, using the no-op agent");
            return new NoopAgent();
        }
        switch (coreConfiguration.getAgent()) {
            case NOOP:
                return new NoopAgent();
            case IN_MEMORY:
                return new InMemoryAgent();
            case AUTO:
            default:
                return loadAgent(AgentFactory.class.getClassLoader());
        }
    }

    Agent loadAgent(ClassLoader classLoader) {
        try {
            final Iterator<Agent> agents = ServiceLoader.load(Agent.class, classLoader).iterator();
            if (agents.hasNext()) {
                final Agent agent = agents.next();
                logger.debug("Using agent {}", agent.getClass().getName());
                return agent;
            }
        } catch (ServiceConfigurationError e) {
            logger.warn("Could not load agent, falling back to the no-op agent", e);
            return new NoopAgent();
        }
        logger.info("No agent found, using the no-op agent");
        return new NoopAgent();
    }
}
