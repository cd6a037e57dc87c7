/*
 * Copyright 2024-2026 The OpenPaaS Orchestrator Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.openpaas.orchestrator.config;

import io.nats.client.Connection;
import io.nats.client.JetStreamManagement;
import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.core.exception.EventBusException;
import org.openpaas.orchestrator.eventbus.EventBus;
import org.openpaas.orchestrator.eventbus.EventSerializer;
import org.openpaas.orchestrator.eventbus.StreamSettings;
import org.openpaas.orchestrator.eventbus.memory.InMemoryEventBus;
import org.openpaas.orchestrator.eventbus.nats.NatsConnectionFactory;
import org.openpaas.orchestrator.eventbus.nats.NatsEventBus;
import org.openpaas.orchestrator.eventbus.nats.NatsStreamProvisioner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Clock;

/**
 * Auto-configuration for the domain event bus.
 *
 * <p>{@code openpaas.orchestrator.event-bus.provider} selects the implementation:
 * {@code in-memory} (default) or {@code nats}. A user-supplied {@link EventBus} bean wins over both.
 */
@Slf4j
@AutoConfiguration(after = OrchestratorAutoConfiguration.class)
public class EventBusAutoConfiguration {

    private static final String PROVIDER = "openpaas.orchestrator.event-bus.provider";

    @Bean
    @ConditionalOnMissingBean
    public EventSerializer eventSerializer() {
        return new EventSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public StreamSettings streamSettings(OrchestratorProperties properties) {
        OrchestratorProperties.StreamProperties streams = properties.getEventBus().getStreams();
        return new StreamSettings(streams.getMaxAge(), streams.getMaxBytes(), streams.getMaxMessages(),
                streams.getReplicas(), streams.isFileStorage());
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(name = PROVIDER, havingValue = "in-memory", matchIfMissing = true)
    static class InMemoryEventBusConfiguration {

        @Bean
        @ConditionalOnMissingBean(EventBus.class)
        public InMemoryEventBus inMemoryEventBus(EventSerializer serializer, StreamSettings streamSettings) {
            log.info("[orchestrator] In-memory event bus initialized");
            return new InMemoryEventBus(serializer, streamSettings, Schedulers.boundedElastic(), Clock.systemUTC());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(Connection.class)
    @ConditionalOnProperty(name = PROVIDER, havingValue = "nats")
    static class NatsEventBusConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public NatsConnectionFactory natsConnectionFactory(OrchestratorProperties properties) {
            return new NatsConnectionFactory(properties.getEventBus().getNats());
        }

        @Bean
        @ConditionalOnMissingBean
        public Connection natsConnection(NatsConnectionFactory factory) {
            return factory.connect();
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnProperty(name = "openpaas.orchestrator.event-bus.nats.jet-stream-enabled",
                havingValue = "true", matchIfMissing = true)
        public NatsStreamProvisioner natsStreamProvisioner(Connection connection, StreamSettings streamSettings) {
            JetStreamManagement management;
            try {
                management = connection.jetStreamManagement();
            } catch (IOException e) {
                throw new EventBusException("JetStream is not available on " + connection.getConnectedUrl(), e);
            }
            NatsStreamProvisioner provisioner = new NatsStreamProvisioner(management, streamSettings);
            provisioner.provisionAll();
            return provisioner;
        }

        @Bean
        @ConditionalOnMissingBean(EventBus.class)
        public NatsEventBus natsEventBus(Connection connection, EventSerializer serializer,
                                         OrchestratorProperties properties) {
            OrchestratorProperties.EventBusProperties bus = properties.getEventBus();
            OrchestratorProperties.NatsProperties nats = bus.getNats();
            NatsEventBus.Settings settings = new NatsEventBus.Settings(nats.isJetStreamEnabled(),
                    bus.getPublishTimeout(), bus.getRequestTimeout(), nats.getDrainTimeout(),
                    nats.getReplayBatchSize());
            log.info("[orchestrator] NATS event bus initialized url={} jetStream={}",
                    nats.getUrl(), nats.isJetStreamEnabled());
            return new NatsEventBus(connection, serializer, settings, Clock.systemUTC());
        }
    }
}
