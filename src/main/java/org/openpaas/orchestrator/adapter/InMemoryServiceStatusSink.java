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

package org.openpaas.orchestrator.adapter;

import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.adapter.model.ServiceStatus;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the latest status per service in memory. Default sink when the host application
 * does not provide one.
 */
@Slf4j
public class InMemoryServiceStatusSink implements ServiceStatusSink {

    private final ConcurrentHashMap<String, ServiceStatus> statuses = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> updateStatus(String serviceId, ServiceStatus status) {
        return Mono.fromRunnable(() -> {
            statuses.put(serviceId, status);
            log.debug("[adapter] Service status updated: service={}, status={}", serviceId, status);
        });
    }

    public Optional<ServiceStatus> statusOf(String serviceId) {
        return Optional.ofNullable(statuses.get(serviceId));
    }

    public Map<String, ServiceStatus> snapshot() {
        return Map.copyOf(statuses);
    }
}
