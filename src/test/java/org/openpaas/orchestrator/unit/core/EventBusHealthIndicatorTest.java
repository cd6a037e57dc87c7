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

package org.openpaas.orchestrator.unit.core;

import org.junit.jupiter.api.Test;
import org.openpaas.orchestrator.core.health.EventBusHealthIndicator;
import org.openpaas.orchestrator.eventbus.EventBus;
import org.openpaas.orchestrator.workflow.registry.DeploymentWorkflowRegistry;
import org.springframework.boot.actuate.health.Status;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EventBusHealthIndicatorTest {

    private final DeploymentWorkflowRegistry workflows = new DeploymentWorkflowRegistry();

    @Test
    void upWhenBusIsHealthy() {
        EventBus bus = mock(EventBus.class);
        when(bus.isHealthy()).thenReturn(true);
        workflows.create("svc-1", "proj", "cl");

        StepVerifier.create(new EventBusHealthIndicator(bus, workflows).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.UP);
                    assertThat(health.getDetails()).containsEntry("workflows", 1).containsKey("eventBus");
                })
                .verifyComplete();
    }

    @Test
    void downWhenBusIsUnavailable() {
        EventBus bus = mock(EventBus.class);
        when(bus.isHealthy()).thenReturn(false);

        StepVerifier.create(new EventBusHealthIndicator(bus, workflows).health())
                .assertNext(health -> {
                    assertThat(health.getStatus()).isEqualTo(Status.DOWN);
                    assertThat(health.getDetails()).containsEntry("reason", "Event bus unavailable");
                })
                .verifyComplete();
    }

    @Test
    void downWhenHealthCheckThrows() {
        EventBus bus = mock(EventBus.class);
        when(bus.isHealthy()).thenThrow(new IllegalStateException("connection lost"));

        StepVerifier.create(new EventBusHealthIndicator(bus, workflows).health())
                .assertNext(health -> assertThat(health.getStatus()).isEqualTo(Status.DOWN))
                .verifyComplete();
    }
}
