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

package org.openpaas.orchestrator.eventbus.nats;

import io.nats.client.Connection;
import io.nats.client.ConnectionListener;
import io.nats.client.Consumer;
import io.nats.client.ErrorListener;
import io.nats.client.Nats;
import io.nats.client.Options;
import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.config.OrchestratorProperties;
import org.openpaas.orchestrator.core.exception.EventBusException;

import java.io.IOException;

/**
 * Opens the NATS connection used by {@link NatsEventBus}. TLS is selected through a
 * {@code tls://} server URL.
 */
@Slf4j
public class NatsConnectionFactory {

    private final OrchestratorProperties.NatsProperties properties;

    public NatsConnectionFactory(OrchestratorProperties.NatsProperties properties) {
        this.properties = properties;
    }

    public Options buildOptions() {
        Options.Builder builder = new Options.Builder()
                .server(properties.getUrl())
                .connectionName(properties.getConnectionName())
                .maxReconnects(properties.getMaxReconnects())
                .reconnectWait(properties.getReconnectWait())
                .connectionTimeout(properties.getConnectionTimeout())
                .connectionListener(NatsConnectionFactory::onConnectionEvent)
                .errorListener(new LoggingErrorListener());

        if (hasText(properties.getToken())) {
            builder.token(properties.getToken().toCharArray());
        } else if (hasText(properties.getUsername())) {
            builder.userInfo(properties.getUsername(), properties.getPassword());
        }
        return builder.build();
    }

    public Connection connect() {
        try {
            Connection connection = Nats.connect(buildOptions());
            log.info("[event-bus] Connected to NATS url={} name={}", properties.getUrl(), properties.getConnectionName());
            return connection;
        } catch (IOException e) {
            throw new EventBusException("Failed to connect to NATS at " + properties.getUrl(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EventBusException("Interrupted while connecting to NATS at " + properties.getUrl(), e);
        }
    }

    static void onConnectionEvent(Connection connection, ConnectionListener.Events type) {
        switch (type) {
            case DISCONNECTED -> log.warn("[event-bus] NATS disconnected");
            case RECONNECTED -> log.info("[event-bus] NATS reconnected url={}", connection.getConnectedUrl());
            case CLOSED -> log.info("[event-bus] NATS connection closed");
            default -> log.debug("[event-bus] NATS connection event={}", type);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    private static final class LoggingErrorListener implements ErrorListener {
        @Override
        public void errorOccurred(Connection conn, String error) {
            log.error("[event-bus] NATS error: {}", error);
        }

        @Override
        public void exceptionOccurred(Connection conn, Exception exp) {
            log.error("[event-bus] NATS exception: {}", exp.getMessage(), exp);
        }

        @Override
        public void slowConsumerDetected(Connection conn, Consumer consumer) {
            log.warn("[event-bus] NATS slow consumer detected");
        }
    }
}
