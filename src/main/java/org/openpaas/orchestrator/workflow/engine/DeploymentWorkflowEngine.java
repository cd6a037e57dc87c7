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

package org.openpaas.orchestrator.workflow.engine;

import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.adapter.CiAdapter;
import org.openpaas.orchestrator.adapter.GitOpsAdapter;
import org.openpaas.orchestrator.adapter.model.ApplicationStatus;
import org.openpaas.orchestrator.adapter.model.Build;
import org.openpaas.orchestrator.adapter.model.Service;
import org.openpaas.orchestrator.core.exception.AdapterException;
import org.openpaas.orchestrator.core.exception.InvalidTransitionException;
import org.openpaas.orchestrator.core.exception.StaleWorkflowException;
import org.openpaas.orchestrator.core.exception.WorkflowNotFoundException;
import org.openpaas.orchestrator.core.observability.WorkflowEvents;
import org.openpaas.orchestrator.core.resilience.ResilienceDecorator;
import org.openpaas.orchestrator.workflow.effect.SideEffectExecutor;
import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;
import org.openpaas.orchestrator.workflow.model.DeploymentWorkflow;
import org.openpaas.orchestrator.workflow.model.TransitionPayload;
import org.openpaas.orchestrator.workflow.registry.DeploymentWorkflowRegistry;
import org.openpaas.orchestrator.workflow.registry.TransitionResult;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Entry point for driving deployment workflows.
 *
 * <p>Every state change goes through {@link #processEvent}; the trigger operations call an external
 * system and fold its failure back into the workflow as a {@code *_failed} transition instead of
 * throwing it past the state machine. Invalid event sequences always fail with
 * {@link InvalidTransitionException} and leave the workflow untouched.
 */
@Slf4j
public class DeploymentWorkflowEngine {

    static final String CI = "ci";
    static final String GITOPS = "gitops";

    private final DeploymentWorkflowRegistry registry;
    private final SideEffectExecutor sideEffects;
    private final CiAdapter ciAdapter;
    private final GitOpsAdapter gitOpsAdapter;
    private final ResilienceDecorator resilience;
    private final WorkflowEvents events;

    public DeploymentWorkflowEngine(DeploymentWorkflowRegistry registry, SideEffectExecutor sideEffects,
                                    CiAdapter ciAdapter, GitOpsAdapter gitOpsAdapter,
                                    ResilienceDecorator resilience, WorkflowEvents events) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.sideEffects = Objects.requireNonNull(sideEffects, "sideEffects");
        this.ciAdapter = Objects.requireNonNull(ciAdapter, "ciAdapter");
        this.gitOpsAdapter = gitOpsAdapter;
        this.resilience = resilience;
        this.events = events != null ? events : new WorkflowEvents() {};
    }

    // --- Registry access ---

    public DeploymentWorkflow createWorkflow(String serviceId, String projectId, String clusterId) {
        DeploymentWorkflow workflow = registry.create(serviceId, projectId, clusterId);
        events.onWorkflowCreated(workflow.id(), serviceId, clusterId);
        return workflow;
    }

    public Optional<DeploymentWorkflow> getWorkflow(String workflowId) {
        return registry.get(workflowId);
    }

    /**
     * Returns a non-idle workflow of the service. Callers are expected to serialize workflow creation
     * per service; if two active workflows exist anyway, either may be returned.
     */
    public Optional<DeploymentWorkflow> findActiveByService(String serviceId) {
        return registry.findActiveByService(serviceId);
    }

    public List<DeploymentWorkflow> findAll() {
        return registry.findAll();
    }

    // --- Transitions ---

    /**
     * Applies {@code event} to the workflow and schedules the side effect of the state entered.
     *
     * @return the workflow after the transition
     * @throws WorkflowNotFoundException if the id is unknown
     * @throws InvalidTransitionException if the event is not allowed from the current state
     */
    public DeploymentWorkflow processEvent(String workflowId, DeploymentEvent event, TransitionPayload payload) {
        return apply(workflowId, null, event, payload);
    }

    /**
     * Applies {@code event} only if the workflow is still exactly the {@code expected} snapshot.
     * Used by maintenance tasks that decide on a snapshot read earlier.
     *
     * @throws StaleWorkflowException if the workflow moved on since {@code expected} was read
     */
    public DeploymentWorkflow processEventIfUnchanged(DeploymentWorkflow expected, DeploymentEvent event,
                                                      TransitionPayload payload) {
        Objects.requireNonNull(expected, "expected");
        return apply(expected.id(), expected, event, payload);
    }

    private DeploymentWorkflow apply(String workflowId, DeploymentWorkflow expected, DeploymentEvent event,
                                     TransitionPayload payload) {
        TransitionResult result;
        try {
            result = registry.transition(workflowId, expected, event, payload, sideEffects::schedule);
        } catch (InvalidTransitionException e) {
            events.onTransitionRejected(workflowId, e.getState(), event);
            throw e;
        }
        DeploymentWorkflow current = result.current();
        events.onTransition(workflowId, current.serviceId(), result.previous().state(), event, current.state());
        return current;
    }

    /**
     * Callback form used by CI and GitOps webhooks: the event is given by its wire value and the
     * payload in its loose map form.
     */
    public DeploymentWorkflow processEvent(String workflowId, String event, Map<String, ?> payload) {
        return processEvent(workflowId, DeploymentEvent.fromValue(event), TransitionPayload.fromMap(payload));
    }

    // --- Orchestration ---

    /**
     * Creates a workflow for the service, queues a build and hands it to the CI runner.
     */
    public Mono<WorkflowResult> triggerBuildAndDeploy(Service service, String clusterId) {
        return Mono.defer(() -> {
            DeploymentWorkflow workflow = createWorkflow(service.id(), service.projectId(), clusterId);
            String workflowId = workflow.id();
            processEvent(workflowId, DeploymentEvent.TRIGGER_BUILD, TransitionPayload.empty());

            return attempt(CI, "trigger-build", () -> ciAdapter.triggerBuild(service, service.buildSource()))
                    .map(outcome -> {
                        Throwable failure = outcome.error();
                        if (failure == null && outcome.value() == null) {
                            failure = new AdapterException(CI, "no build returned");
                        }
                        if (failure != null) {
                            return failBuild(workflowId, failure);
                        }
                        Build build = outcome.value();
                        TransitionPayload payload = TransitionPayload.ofBuild(build.id());
                        if (build.imageTag() != null) {
                            payload = payload.withMetadata("image_tag", build.imageTag());
                        }
                        return WorkflowResult.success(processEvent(workflowId, DeploymentEvent.BUILD_STARTED, payload));
                    });
        });
    }

    /**
     * Queues a deployment for the workflow and asks the GitOps controller to sync the application.
     */
    public Mono<WorkflowResult> triggerDeploy(String workflowId, String externalAppId) {
        return Mono.defer(() -> {
            processEvent(workflowId, DeploymentEvent.TRIGGER_DEPLOY, TransitionPayload.empty());
            TransitionPayload started = new TransitionPayload(null, externalAppId, null, null, Map.of());

            return attempt(GITOPS, "sync", () -> gitOps().syncApplication(externalAppId))
                    .map(outcome -> {
                        DeploymentWorkflow deploying = processEvent(workflowId, DeploymentEvent.DEPLOY_STARTED, started);
                        if (outcome.error() == null) {
                            return WorkflowResult.success(deploying);
                        }
                        onAdapterFailure(workflowId, GITOPS, outcome.error());
                        DeploymentWorkflow failed = processEvent(workflowId, DeploymentEvent.DEPLOY_FAILED,
                                TransitionPayload.ofError(messageOf(outcome.error())));
                        return WorkflowResult.failed(failed, outcome.error());
                    });
        });
    }

    /**
     * Starts a rollback to {@code revision}. A failed rollback leaves the workflow in {@code deploy_failed}.
     */
    public Mono<WorkflowResult> triggerRollback(String workflowId, String externalAppId, long revision) {
        return Mono.defer(() -> {
            processEvent(workflowId, DeploymentEvent.TRIGGER_ROLLBACK,
                    TransitionPayload.empty().withMetadata("rollback_revision", String.valueOf(revision)));

            return attempt(GITOPS, "rollback", () -> gitOps().rollbackApplication(externalAppId, revision))
                    .map(outcome -> {
                        if (outcome.error() == null) {
                            return WorkflowResult.success(processEvent(workflowId,
                                    DeploymentEvent.ROLLBACK_COMPLETE, TransitionPayload.empty()));
                        }
                        onAdapterFailure(workflowId, GITOPS, outcome.error());
                        DeploymentWorkflow failed = processEvent(workflowId, DeploymentEvent.DEPLOY_FAILED,
                                TransitionPayload.ofError(messageOf(outcome.error())));
                        return WorkflowResult.failed(failed, outcome.error());
                    });
        });
    }

    /**
     * Polls the GitOps controller for a workflow in {@code deploying} and completes or fails the
     * deployment when the application has settled. Workflows in any other state are returned as-is.
     */
    public Mono<WorkflowResult> refreshDeploymentStatus(String workflowId, String externalAppId) {
        return Mono.defer(() -> {
            DeploymentWorkflow workflow = registry.get(workflowId)
                    .orElseThrow(() -> new WorkflowNotFoundException(workflowId));
            if (workflow.state() != DeploymentState.DEPLOYING) {
                return Mono.just(WorkflowResult.success(workflow));
            }

            return attempt(GITOPS, "status", () -> gitOps().getApplicationStatus(externalAppId))
                    .map(outcome -> {
                        if (outcome.error() != null) {
                            onAdapterFailure(workflowId, GITOPS, outcome.error());
                            return WorkflowResult.failed(workflow, outcome.error());
                        }
                        ApplicationStatus status = outcome.value();
                        if (status == null) {
                            return WorkflowResult.success(workflow);
                        }
                        if (status.isHealthyAndSynced()) {
                            TransitionPayload payload = TransitionPayload.empty();
                            if (status.currentImage() != null) {
                                payload = payload.withMetadata("current_image", status.currentImage());
                            }
                            return WorkflowResult.success(processEvent(workflowId, DeploymentEvent.DEPLOY_SUCCEEDED, payload));
                        }
                        if (status.isBroken()) {
                            return WorkflowResult.success(processEvent(workflowId, DeploymentEvent.DEPLOY_FAILED,
                                    TransitionPayload.ofError("application health is " + status.health())));
                        }
                        return WorkflowResult.success(workflow);
                    });
        });
    }

    // --- Maintenance ---

    /**
     * Removes quiescent workflows ({@code idle}, {@code deploy_complete}, {@code rollback_complete})
     * last updated more than {@code retention} ago. Failed workflows are kept regardless of age.
     *
     * @return the number of workflows removed
     */
    public int cleanupOldWorkflows(Duration retention) {
        Objects.requireNonNull(retention, "retention");
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative, got: " + retention);
        }
        List<DeploymentWorkflow> removed = registry.removeExpired(retention);
        removed.forEach(w -> sideEffects.closeLane(w.id()));
        events.onWorkflowsCleanedUp(removed.size());
        return removed.size();
    }

    // --- Internals ---

    private WorkflowResult failBuild(String workflowId, Throwable failure) {
        onAdapterFailure(workflowId, CI, failure);
        processEvent(workflowId, DeploymentEvent.BUILD_STARTED, TransitionPayload.empty());
        DeploymentWorkflow failed = processEvent(workflowId, DeploymentEvent.BUILD_FAILED,
                TransitionPayload.ofError(messageOf(failure)));
        return WorkflowResult.failed(failed, failure);
    }

    private void onAdapterFailure(String workflowId, String adapter, Throwable error) {
        events.onAdapterFailure(workflowId, adapter, error);
    }

    private GitOpsAdapter gitOps() {
        if (gitOpsAdapter == null) {
            throw new AdapterException(GITOPS, "no GitOps adapter configured");
        }
        return gitOpsAdapter;
    }

    private <T> Mono<Attempt<T>> attempt(String adapter, String operation, Supplier<Mono<T>> call) {
        Mono<T> mono = Mono.defer(call);
        if (resilience != null) {
            mono = resilience.decorate(adapter, operation, mono);
        }
        return mono
                .map(value -> new Attempt<T>(value, null))
                .defaultIfEmpty(new Attempt<>(null, null))
                .onErrorResume(e -> Mono.just(new Attempt<>(null, e)));
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    private record Attempt<T>(T value, Throwable error) {}
}
