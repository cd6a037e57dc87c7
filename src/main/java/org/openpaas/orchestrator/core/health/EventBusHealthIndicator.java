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

package org.openpaas.orchestrator.core.health;

import org.openpaas.orchestrator.eventbus.EventBus;
import org.openpaas.orchestrator.workflow.registry.DeploymentWorkflowRegistry;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

public class EventBusHealthIndicator implements ReactiveHealthIndicator {

    private final EventBus eventBus;
    private final DeploymentWorkflowRegistry workflows;

    public EventBusHealthIndicator(EventBus eventBus, DeploymentWorkflowRegistry workflows) {
        this.eventBus = eventBus;
        this.workflows = workflows;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(eventBus::isHealthy)
                .map(healthy -> (healthy ? Health.up() : Health.down().withDetail("reason", "Event bus unavailable"))
                        .withDetail("eventBus", eventBus.getClass().getSimpleName())
                        .withDetail("workflows", workflows.size())
                        .build())
                .onErrorResume(e -> Mono.just(Health.down().withException(e).build()));
    }
}
