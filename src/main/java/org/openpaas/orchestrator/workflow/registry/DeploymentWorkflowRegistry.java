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

package org.openpaas.orchestrator.workflow.registry;

import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.core.exception.InvalidTransitionException;
import org.openpaas.orchestrator.core.exception.StaleWorkflowException;
import org.openpaas.orchestrator.core.exception.WorkflowNotFoundException;
import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;
import org.openpaas.orchestrator.workflow.model.DeploymentWorkflow;
import org.openpaas.orchestrator.workflow.model.TransitionPayload;
import org.openpaas.orchestrator.workflow.statemachine.TransitionTable;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * In-memory, single-process store of deployment workflows.
 *
 * <p>Transitions on the same workflow id are serialized through {@link ConcurrentHashMap#compute};
 * transitions on different ids proceed in parallel. Reads return immutable snapshots and never block.
 * Nothing here survives a restart.
 */
@Slf4j
public class DeploymentWorkflowRegistry {

    private final ConcurrentHashMap<String, DeploymentWorkflow> workflows = new ConcurrentHashMap<>();
    private final Clock clock;

    public DeploymentWorkflowRegistry() {
        this(Clock.systemUTC());
    }

    public DeploymentWorkflowRegistry(Clock clock) {
        this.clock = clock;
    }

    public DeploymentWorkflow create(String serviceId, String projectId, String clusterId) {
        DeploymentWorkflow workflow = DeploymentWorkflow.create(
                UUID.randomUUID().toString(), serviceId, projectId, clusterId, clock.instant());
        workflows.put(workflow.id(), workflow);
        log.debug("[workflow] Created workflow id={} service={} cluster={}", workflow.id(), serviceId, clusterId);
        return workflow;
    }

    public Optional<DeploymentWorkflow> get(String id) {
        return Optional.ofNullable(workflows.get(id));
    }

    /**
     * Returns a workflow for the service whose state is not {@code idle}. If more than one exists,
     * which one is returned is unspecified.
     */
    public Optional<DeploymentWorkflow> findActiveByService(String serviceId) {
        return workflows.values().stream()
                .filter(w -> w.serviceId().equals(serviceId))
                .filter(DeploymentWorkflow::isActive)
                .findFirst();
    }

    /**
     * Applies {@code event} to the workflow atomically. {@code onCommit} runs inside the same
     * atomic section after the new snapshot is computed; it must only enqueue work, never block.
     *
     * @throws WorkflowNotFoundException if no workflow has this id
     * @throws InvalidTransitionException if the event is not valid from the current state
     */
    public TransitionResult transition(String id, DeploymentEvent event, TransitionPayload payload,
                                       Consumer<TransitionResult> onCommit) {
        return transition(id, null, event, payload, onCommit);
    }

    /**
     * Same as {@link #transition(String, DeploymentEvent, TransitionPayload, Consumer)}, but only
     * applies when the stored workflow still equals {@code expected}. A {@code null} snapshot
     * applies unconditionally.
     *
     * @throws StaleWorkflowException if the workflow changed after {@code expected} was read
     */
    public TransitionResult transition(String id, DeploymentWorkflow expected, DeploymentEvent event,
                                       TransitionPayload payload, Consumer<TransitionResult> onCommit) {
        TransitionResult[] holder = new TransitionResult[1];
        workflows.compute(id, (key, current) -> {
            if (current == null) {
                throw new WorkflowNotFoundException(id);
            }
            if (expected != null && !current.equals(expected)) {
                throw new StaleWorkflowException(id, expected.state(), current.state());
            }
            DeploymentState next = TransitionTable.next(current.state(), event)
                    .orElseThrow(() -> new InvalidTransitionException(
                            id, current.state(), event, TransitionTable.validEvents(current.state())));
            DeploymentWorkflow updated = current.advance(next, payload, clock.instant());
            TransitionResult result = new TransitionResult(current, updated, event);
            if (onCommit != null) {
                onCommit.accept(result);
            }
            holder[0] = result;
            return updated;
        });
        return holder[0];
    }

    public List<DeploymentWorkflow> findAll() {
        return List.copyOf(workflows.values());
    }

    public List<DeploymentWorkflow> findByState(DeploymentState state) {
        return workflows.values().stream().filter(w -> w.state() == state).toList();
    }

    /**
     * Workflows in one of the given states that have not been touched since {@code before}.
     */
    public List<DeploymentWorkflow> findStale(Predicate<DeploymentState> states, Instant before) {
        return workflows.values().stream()
                .filter(w -> states.test(w.state()))
                .filter(w -> w.updatedAt().isBefore(before))
                .toList();
    }

    /**
     * Removes collectable workflows last updated before {@code now - retention}. Each removal is
     * conditional on the snapshot still being the one inspected, so a workflow transitioned
     * concurrently is kept.
     *
     * @return the removed snapshots
     */
    public List<DeploymentWorkflow> removeExpired(Duration retention) {
        Instant threshold = clock.instant().minus(retention);
        List<DeploymentWorkflow> removed = new ArrayList<>();
        for (DeploymentWorkflow w : workflows.values()) {
            if (w.state().isCollectable() && w.updatedAt().isBefore(threshold)
                    && workflows.remove(w.id(), w)) {
                removed.add(w);
            }
        }
        return removed;
    }

    public int size() {
        return workflows.size();
    }

    public Clock clock() {
        return clock;
    }
}
