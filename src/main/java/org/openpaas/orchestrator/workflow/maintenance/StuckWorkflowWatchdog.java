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

package org.openpaas.orchestrator.workflow.maintenance;

import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.core.exception.OrchestratorException;
import org.openpaas.orchestrator.core.observability.WorkflowEvents;
import org.openpaas.orchestrator.core.scheduling.OrchestrationScheduler;
import org.openpaas.orchestrator.workflow.engine.DeploymentWorkflowEngine;
import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;
import org.openpaas.orchestrator.workflow.model.DeploymentWorkflow;
import org.openpaas.orchestrator.workflow.model.TransitionPayload;
import org.openpaas.orchestrator.workflow.registry.DeploymentWorkflowRegistry;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

import static org.openpaas.orchestrator.workflow.maintenance.WorkflowCleanupService.requirePositive;

/**
 * Fails workflows whose external build or deployment never reported back.
 *
 * <p>{@code building} past the build timeout receives {@code build_failed}; {@code deploying} and
 * {@code rolling_back} past the deploy timeout receive {@code deploy_failed}. Queued states have
 * no failure edge and are only reported. A failure is injected only if the workflow is still the
 * snapshot the scan judged stale; any callback that lands in between makes the injection a no-op.
 */
@Slf4j
public class StuckWorkflowWatchdog implements SmartInitializingSingleton {

    static final String TASK_ID = "workflow-watchdog";

    private final DeploymentWorkflowEngine engine;
    private final DeploymentWorkflowRegistry registry;
    private final OrchestrationScheduler scheduler;
    private final WorkflowEvents events;
    private final Duration interval;
    private final Duration buildTimeout;
    private final Duration deployTimeout;

    public StuckWorkflowWatchdog(DeploymentWorkflowEngine engine, DeploymentWorkflowRegistry registry,
                                 OrchestrationScheduler scheduler, WorkflowEvents events,
                                 Duration interval, Duration buildTimeout, Duration deployTimeout) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.events = Objects.requireNonNull(events, "events");
        this.interval = requirePositive(interval, "interval");
        this.buildTimeout = requirePositive(buildTimeout, "buildTimeout");
        this.deployTimeout = requirePositive(deployTimeout, "deployTimeout");
    }

    @Override
    public void afterSingletonsInstantiated() {
        start();
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(TASK_ID, this::scan, interval.toMillis(), interval.toMillis());
        log.info("[workflow] Watchdog started buildTimeout={} deployTimeout={}", buildTimeout, deployTimeout);
    }

    public void stop() {
        scheduler.cancel(TASK_ID);
    }

    /**
     * @return the number of workflows failed by this pass
     */
    public int scan() {
        Instant now = registry.clock().instant();
        int failed = 0;

        for (DeploymentWorkflow w : registry.findStale(s -> s == DeploymentState.BUILDING, now.minus(buildTimeout))) {
            if (fail(w, DeploymentEvent.BUILD_FAILED, "build timed out after " + buildTimeout, now)) {
                failed++;
            }
        }
        for (DeploymentWorkflow w : registry.findStale(
                s -> s == DeploymentState.DEPLOYING || s == DeploymentState.ROLLING_BACK, now.minus(deployTimeout))) {
            String what = w.state() == DeploymentState.ROLLING_BACK ? "rollback" : "deployment";
            if (fail(w, DeploymentEvent.DEPLOY_FAILED, what + " timed out after " + deployTimeout, now)) {
                failed++;
            }
        }
        for (DeploymentWorkflow w : registry.findStale(
                s -> s == DeploymentState.BUILD_QUEUED || s == DeploymentState.DEPLOY_QUEUED, now.minus(buildTimeout))) {
            log.warn("[workflow] Workflow stuck in queue workflowId={} state={} since={}", w.id(), w.state(), w.updatedAt());
        }
        return failed;
    }

    private boolean fail(DeploymentWorkflow workflow, DeploymentEvent event, String reason, Instant now) {
        try {
            engine.processEventIfUnchanged(workflow, event, TransitionPayload.ofError(reason));
            events.onWorkflowTimedOut(workflow.id(), workflow.state(), Duration.between(workflow.updatedAt(), now));
            return true;
        } catch (OrchestratorException e) {
            log.info("[workflow] Watchdog skipped workflowId={} reason={}", workflow.id(), e.getMessage());
            return false;
        }
    }
}
