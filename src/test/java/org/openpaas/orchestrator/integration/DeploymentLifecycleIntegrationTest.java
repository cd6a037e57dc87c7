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

package org.openpaas.orchestrator.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.openpaas.orchestrator.adapter.CiAdapter;
import org.openpaas.orchestrator.adapter.GitOpsAdapter;
import org.openpaas.orchestrator.adapter.InMemoryServiceStatusSink;
import org.openpaas.orchestrator.adapter.model.ApplicationStatus;
import org.openpaas.orchestrator.adapter.model.Build;
import org.openpaas.orchestrator.adapter.model.BuildSource;
import org.openpaas.orchestrator.adapter.model.Service;
import org.openpaas.orchestrator.adapter.model.ServiceStatus;
import org.openpaas.orchestrator.core.dlq.DeadLetterService;
import org.openpaas.orchestrator.core.dlq.InMemoryDeadLetterStore;
import org.openpaas.orchestrator.core.observability.WorkflowEvents;
import org.openpaas.orchestrator.eventbus.DomainEvent;
import org.openpaas.orchestrator.eventbus.EventSerializer;
import org.openpaas.orchestrator.eventbus.StreamCategory;
import org.openpaas.orchestrator.eventbus.StreamSettings;
import org.openpaas.orchestrator.eventbus.memory.InMemoryEventBus;
import org.openpaas.orchestrator.workflow.effect.SideEffectExecutor;
import org.openpaas.orchestrator.workflow.engine.DeploymentWorkflowEngine;
import org.openpaas.orchestrator.workflow.engine.WorkflowResult;
import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;
import org.openpaas.orchestrator.workflow.model.DeploymentWorkflow;
import org.openpaas.orchestrator.workflow.model.TransitionPayload;
import org.openpaas.orchestrator.workflow.registry.DeploymentWorkflowRegistry;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

/**
 * Drives a service through build, deploy and rollback with the in-memory event bus and status
 * sink, checking what subscribers and the status sink observe.
 */
@ExtendWith(MockitoExtension.class)
class DeploymentLifecycleIntegrationTest {

    private static final Service SERVICE = new Service("S1", "P1", "api", "api", ServiceStatus.PENDING,
            BuildSource.git("https://git.example.com/acme/api.git", "main"), null, "C1", Map.of());

    @Mock
    private GitOpsAdapter gitOps;

    private Scheduler busScheduler;
    private Scheduler effectScheduler;
    private InMemoryEventBus bus;
    private InMemoryServiceStatusSink statusSink;
    private InMemoryDeadLetterStore deadLetters;
    private SideEffectExecutor sideEffects;
    private DeploymentWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        busScheduler = Schedulers.newBoundedElastic(4, 1000, "lifecycle-bus");
        effectScheduler = Schedulers.newBoundedElastic(4, 1000, "lifecycle-effects");
        bus = new InMemoryEventBus(new EventSerializer(), StreamSettings.defaults(), busScheduler, Clock.systemUTC());
        statusSink = new InMemoryServiceStatusSink();
        deadLetters = new InMemoryDeadLetterStore();
        WorkflowEvents events = new WorkflowEvents() { };
        sideEffects = new SideEffectExecutor(statusSink, bus, new DeadLetterService(deadLetters, events), events,
                "workflow-engine", effectScheduler);
        CiAdapter ci = (service, source) -> Mono.just(Build.queued("B1", service.id(), service.projectId(),
                "registry.example.com/api:abc"));
        engine = new DeploymentWorkflowEngine(new DeploymentWorkflowRegistry(), sideEffects, ci, gitOps, null, events);
    }

    @AfterEach
    void tearDown() {
        sideEffects.shutdown();
        bus.close();
        effectScheduler.dispose();
        busScheduler.dispose();
    }

    @Test
    void buildDeployAndRollbackReachSubscribersInOrder() throws Exception {
        CountDownLatch received = new CountDownLatch(4);
        List<String> types = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe("build.>", event -> record(event, types, received));
        bus.subscribe("deploy.>", event -> record(event, types, received));
        bus.subscribe("rollback.>", event -> record(event, types, received));

        when(gitOps.syncApplication("app-1")).thenReturn(Mono.empty());
        when(gitOps.getApplicationStatus("app-1")).thenReturn(Mono.just(
                new ApplicationStatus("Healthy", "Synced", "registry.example.com/api:abc",
                        "registry.example.com/api:abc", 2, 2, List.of())));
        when(gitOps.rollbackApplication("app-1", 3L)).thenReturn(Mono.empty());

        WorkflowResult build = engine.triggerBuildAndDeploy(SERVICE, "C1").block();
        assertThat(build.isSuccess()).isTrue();
        String workflowId = build.workflow().id();

        engine.processEvent(workflowId, DeploymentEvent.BUILD_SUCCEEDED, TransitionPayload.empty());
        WorkflowResult deploy = engine.triggerDeploy(workflowId, "app-1").block();
        assertThat(deploy.workflow().state()).isEqualTo(DeploymentState.DEPLOYING);

        WorkflowResult settled = engine.refreshDeploymentStatus(workflowId, "app-1").block();
        assertThat(settled.workflow().state()).isEqualTo(DeploymentState.DEPLOY_COMPLETE);

        WorkflowResult rollback = engine.triggerRollback(workflowId, "app-1", 3L).block();
        assertThat(rollback.isSuccess()).isTrue();

        assertThat(received.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(types).containsExactlyInAnyOrder(
                "build.completed", "deploy.started", "deploy.completed", "rollback.completed");

        List<String> deployments = bus.replay(StreamCategory.DEPLOYMENTS, Instant.EPOCH)
                .map(DomainEvent::type).collectList().block();
        assertThat(deployments).containsExactly("deploy.started", "deploy.completed", "rollback.completed");

        DeploymentWorkflow finalState = engine.getWorkflow(workflowId).orElseThrow();
        assertThat(finalState.state()).isEqualTo(DeploymentState.ROLLBACK_COMPLETE);
        assertThat(finalState.buildId()).isEqualTo("B1");
        assertThat(statusSink.statusOf("S1")).contains(ServiceStatus.RUNNING);
        assertThat(deadLetters.count().block()).isZero();
    }

    private static Mono<Void> record(DomainEvent event, List<String> types, CountDownLatch latch) {
        return Mono.fromRunnable(() -> {
            types.add(event.type());
            latch.countDown();
        });
    }
}
