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

package org.openpaas.orchestrator.unit.workflow;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.openpaas.orchestrator.adapter.CiAdapter;
import org.openpaas.orchestrator.adapter.ServiceStatusSink;
import org.openpaas.orchestrator.adapter.model.ServiceStatus;
import org.openpaas.orchestrator.core.exception.InvalidTransitionException;
import org.openpaas.orchestrator.core.exception.WorkflowNotFoundException;
import org.openpaas.orchestrator.core.observability.WorkflowEvents;
import org.openpaas.orchestrator.eventbus.EventBus;
import org.openpaas.orchestrator.eventbus.EventSubject;
import org.openpaas.orchestrator.workflow.effect.SideEffectExecutor;
import org.openpaas.orchestrator.workflow.engine.DeploymentWorkflowEngine;
import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;
import org.openpaas.orchestrator.workflow.model.DeploymentWorkflow;
import org.openpaas.orchestrator.workflow.model.TransitionPayload;
import org.openpaas.orchestrator.workflow.registry.DeploymentWorkflowRegistry;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeploymentWorkflowEngineTest {

    @Mock
    private ServiceStatusSink statusSink;

    @Mock
    private EventBus eventBus;

    @Mock
    private CiAdapter ciAdapter;

    @Mock
    private WorkflowEvents events;

    private MutableClock clock;
    private Scheduler scheduler;
    private SideEffectExecutor sideEffects;
    private DeploymentWorkflowEngine engine;

    @BeforeEach
    void setUp() {
        lenient().when(statusSink.updateStatus(anyString(), any())).thenReturn(Mono.empty());
        lenient().when(eventBus.publish(any(), any())).thenReturn(Mono.empty());

        clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        scheduler = Schedulers.newBoundedElastic(8, 1000, "engine-test");
        sideEffects = new SideEffectExecutor(statusSink, eventBus, null, events, "workflow-engine", scheduler);
        engine = new DeploymentWorkflowEngine(new DeploymentWorkflowRegistry(clock), sideEffects,
                ciAdapter, null, null, events);
    }

    @AfterEach
    void tearDown() {
        sideEffects.shutdown();
        scheduler.dispose();
    }

    @Test
    void buildHappyPathRecordsBuildIdAndVersion() {
        DeploymentWorkflow wf = engine.createWorkflow("S1", "P1", "C1");
        assertThat(wf.state()).isEqualTo(DeploymentState.IDLE);

        assertThat(engine.processEvent(wf.id(), DeploymentEvent.TRIGGER_BUILD, TransitionPayload.empty()).state())
                .isEqualTo(DeploymentState.BUILD_QUEUED);

        DeploymentWorkflow building = engine.processEvent(wf.id(), DeploymentEvent.BUILD_STARTED,
                TransitionPayload.ofBuild("B1"));
        assertThat(building.state()).isEqualTo(DeploymentState.BUILDING);
        assertThat(building.buildId()).isEqualTo("B1");

        DeploymentWorkflow complete = engine.processEvent(wf.id(), "build_succeeded", Map.of("version", "v1"));
        assertThat(complete.state()).isEqualTo(DeploymentState.BUILD_COMPLETE);
        assertThat(complete.version()).isEqualTo("v1");
        assertThat(complete.buildId()).isEqualTo("B1");

        verify(statusSink, timeout(2000)).updateStatus("S1", ServiceStatus.BUILDING);
        verify(eventBus, timeout(2000)).publish(eq(EventSubject.BUILD_COMPLETED), any());
        verify(events).onWorkflowCreated(wf.id(), "S1", "C1");
        verify(events).onTransition(wf.id(), "S1", DeploymentState.BUILDING,
                DeploymentEvent.BUILD_SUCCEEDED, DeploymentState.BUILD_COMPLETE);
    }

    @Test
    void buildFailureRecordsErrorAndMarksServiceFailed() {
        DeploymentWorkflow wf = engine.createWorkflow("S1", "P1", "C1");
        engine.processEvent(wf.id(), DeploymentEvent.TRIGGER_BUILD, TransitionPayload.empty());
        engine.processEvent(wf.id(), DeploymentEvent.BUILD_STARTED, TransitionPayload.ofBuild("B1"));

        DeploymentWorkflow failed = engine.processEvent(wf.id(), DeploymentEvent.BUILD_FAILED,
                TransitionPayload.ofError("compile error"));

        assertThat(failed.state()).isEqualTo(DeploymentState.BUILD_FAILED);
        assertThat(failed.error()).isEqualTo("compile error");
        verify(statusSink, timeout(2000)).updateStatus("S1", ServiceStatus.FAILED);
        verify(eventBus, timeout(2000)).publish(eq(EventSubject.BUILD_FAILED), any());
    }

    @Test
    void rollbackFromDeployingMarksServiceRunning() {
        DeploymentWorkflow wf = engine.createWorkflow("S1", "P1", "C1");
        engine.processEvent(wf.id(), DeploymentEvent.TRIGGER_DEPLOY, TransitionPayload.empty());
        engine.processEvent(wf.id(), DeploymentEvent.DEPLOY_STARTED, TransitionPayload.empty());

        assertThat(engine.processEvent(wf.id(), DeploymentEvent.TRIGGER_ROLLBACK, TransitionPayload.empty()).state())
                .isEqualTo(DeploymentState.ROLLING_BACK);
        assertThat(engine.processEvent(wf.id(), DeploymentEvent.ROLLBACK_COMPLETE, TransitionPayload.empty()).state())
                .isEqualTo(DeploymentState.ROLLBACK_COMPLETE);

        verify(statusSink, timeout(2000)).updateStatus("S1", ServiceStatus.RUNNING);
        verify(eventBus, timeout(2000)).publish(eq(EventSubject.ROLLBACK_COMPLETED), any());
    }

    @Test
    void rejectedEventIsReportedAndLeavesStateUnchanged() {
        DeploymentWorkflow wf = engine.createWorkflow("S1", "P1", "C1");

        assertThatThrownBy(() -> engine.processEvent(wf.id(), DeploymentEvent.BUILD_SUCCEEDED, TransitionPayload.empty()))
                .isInstanceOf(InvalidTransitionException.class);

        assertThat(engine.getWorkflow(wf.id())).map(DeploymentWorkflow::state).contains(DeploymentState.IDLE);
        verify(events).onTransitionRejected(wf.id(), DeploymentState.IDLE, DeploymentEvent.BUILD_SUCCEEDED);
        verifyNoInteractions(statusSink, eventBus);
    }

    @Test
    void unknownWorkflowAndUnknownEventAreRejected() {
        assertThatThrownBy(() -> engine.processEvent("missing", DeploymentEvent.CANCEL, TransitionPayload.empty()))
                .isInstanceOf(WorkflowNotFoundException.class);

        DeploymentWorkflow wf = engine.createWorkflow("S1", null, null);
        assertThatThrownBy(() -> engine.processEvent(wf.id(), "build_exploded", Map.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cancelFromBuildingReturnsToIdle() {
        DeploymentWorkflow wf = engine.createWorkflow("S1", null, null);
        engine.processEvent(wf.id(), DeploymentEvent.TRIGGER_BUILD, TransitionPayload.empty());
        engine.processEvent(wf.id(), DeploymentEvent.BUILD_STARTED, TransitionPayload.ofBuild("B1"));

        DeploymentWorkflow cancelled = engine.processEvent(wf.id(), DeploymentEvent.CANCEL, TransitionPayload.empty());

        assertThat(cancelled.state()).isEqualTo(DeploymentState.IDLE);
        assertThat(engine.findActiveByService("S1")).isEmpty();
    }

    @Test
    void cleanupRemovesOnlyExpiredQuiescentWorkflows() {
        DeploymentWorkflow idle = engine.createWorkflow("S-idle", null, null);
        DeploymentWorkflow done = engine.createWorkflow("S-done", null, null);
        drive(done.id(), DeploymentEvent.TRIGGER_DEPLOY, DeploymentEvent.DEPLOY_STARTED, DeploymentEvent.DEPLOY_SUCCEEDED);
        DeploymentWorkflow rolledBack = engine.createWorkflow("S-rb", null, null);
        drive(rolledBack.id(), DeploymentEvent.TRIGGER_DEPLOY, DeploymentEvent.DEPLOY_STARTED,
                DeploymentEvent.TRIGGER_ROLLBACK, DeploymentEvent.ROLLBACK_COMPLETE);
        DeploymentWorkflow buildFailed = engine.createWorkflow("S-bf", null, null);
        drive(buildFailed.id(), DeploymentEvent.TRIGGER_BUILD, DeploymentEvent.BUILD_STARTED, DeploymentEvent.BUILD_FAILED);
        DeploymentWorkflow deployFailed = engine.createWorkflow("S-df", null, null);
        drive(deployFailed.id(), DeploymentEvent.TRIGGER_DEPLOY, DeploymentEvent.DEPLOY_STARTED, DeploymentEvent.DEPLOY_FAILED);

        clock.advance(Duration.ofHours(48));
        DeploymentWorkflow recentDone = engine.createWorkflow("S-recent", null, null);
        drive(recentDone.id(), DeploymentEvent.TRIGGER_DEPLOY, DeploymentEvent.DEPLOY_STARTED, DeploymentEvent.DEPLOY_SUCCEEDED);

        int removed = engine.cleanupOldWorkflows(Duration.ofHours(24));

        assertThat(removed).isEqualTo(3);
        assertThat(engine.findAll()).extracting(DeploymentWorkflow::id)
                .containsExactlyInAnyOrder(buildFailed.id(), deployFailed.id(), recentDone.id());
        assertThat(engine.getWorkflow(idle.id())).isEmpty();
        verify(events).onWorkflowsCleanedUp(3);
    }

    @Test
    void cleanupRejectsNegativeRetention() {
        assertThatThrownBy(() -> engine.cleanupOldWorkflows(Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void drive(String workflowId, DeploymentEvent... sequence) {
        for (DeploymentEvent event : sequence) {
            engine.processEvent(workflowId, event, TransitionPayload.empty());
        }
    }
}
