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

package org.openpaas.orchestrator.workflow.effect;

import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.adapter.ServiceStatusSink;
import org.openpaas.orchestrator.core.dlq.DeadLetterEntry;
import org.openpaas.orchestrator.core.dlq.DeadLetterService;
import org.openpaas.orchestrator.core.observability.WorkflowEvents;
import org.openpaas.orchestrator.eventbus.DomainEvent;
import org.openpaas.orchestrator.eventbus.EventBus;
import org.openpaas.orchestrator.eventbus.EventMetadata;
import org.openpaas.orchestrator.workflow.model.DeploymentWorkflow;
import org.openpaas.orchestrator.workflow.registry.TransitionResult;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the {@link SideEffect} of every accepted transition outside the registry's atomic section.
 *
 * <p>Each workflow gets a serial lane: effects of one workflow run strictly in the order their
 * transitions committed, while lanes of different workflows run in parallel on the shared
 * scheduler. Failures are logged, dead-lettered and counted; they are never retried and never
 * undo the transition that caused them.
 */
@Slf4j
public class SideEffectExecutor {

    public static final String ACTION_STATUS_UPDATE = "status-update";
    public static final String ACTION_PUBLISH = "publish";

    private final ServiceStatusSink statusSink;
    private final EventBus eventBus;
    private final DeadLetterService deadLetters;
    private final WorkflowEvents events;
    private final String source;
    private final Scheduler scheduler;
    private final ConcurrentHashMap<String, Lane> lanes = new ConcurrentHashMap<>();
    private final AtomicInteger pending = new AtomicInteger();

    public SideEffectExecutor(ServiceStatusSink statusSink, EventBus eventBus, DeadLetterService deadLetters,
                              WorkflowEvents events, String source, Scheduler scheduler) {
        this.statusSink = statusSink;
        this.eventBus = eventBus;
        this.deadLetters = deadLetters;
        this.events = events;
        this.source = source;
        this.scheduler = scheduler;
    }

    /**
     * Enqueues the effect for the state just entered, if that state has one. Never blocks.
     */
    public void schedule(TransitionResult result) {
        DeploymentWorkflow workflow = result.current();
        SideEffect.forState(workflow.state()).ifPresent(effect -> {
            pending.incrementAndGet();
            Lane lane = lanes.computeIfAbsent(workflow.id(), Lane::new);
            if (!lane.offer(new Task(effect, workflow))) {
                pending.decrementAndGet();
                log.warn("[workflow] Side effect dropped, lane closed workflowId={} state={}",
                        workflow.id(), workflow.state());
            }
        });
    }

    /**
     * Stops accepting effects for the workflow. Effects already queued still run.
     */
    public void closeLane(String workflowId) {
        Lane lane = lanes.remove(workflowId);
        if (lane != null) {
            lane.close();
        }
    }

    public int pendingEffects() {
        return pending.get();
    }

    public int activeLanes() {
        return lanes.size();
    }

    public void shutdown() {
        lanes.keySet().forEach(this::closeLane);
        log.info("[workflow] Side-effect executor shut down pending={}", pending.get());
    }

    Mono<Void> execute(SideEffect effect, DeploymentWorkflow workflow) {
        long start = System.currentTimeMillis();
        AtomicBoolean failed = new AtomicBoolean(false);
        Map<String, Object> data = eventData(workflow);

        Mono<Void> statusUpdate = effect.statusUpdate()
                .map(status -> Mono.defer(() -> statusSink.updateStatus(workflow.serviceId(), status))
                        .onErrorResume(e -> recordFailure(workflow, ACTION_STATUS_UPDATE, e, data, failed)))
                .orElse(Mono.empty());

        Mono<Void> publication = effect.publication()
                .map(subject -> Mono.defer(() -> eventBus.publish(subject,
                                DomainEvent.of(subject.subject(), source, data, EventMetadata.correlatedBy(workflow.id()))))
                        .onErrorResume(e -> recordFailure(workflow, ACTION_PUBLISH, e, data, failed)))
                .orElse(Mono.empty());

        return statusUpdate
                .then(publication)
                .doOnSuccess(v -> {
                    if (!failed.get()) {
                        events.onSideEffectCompleted(workflow.id(), workflow.state(), System.currentTimeMillis() - start);
                    }
                });
    }

    static Map<String, Object> eventData(DeploymentWorkflow workflow) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("workflow_id", workflow.id());
        data.put("service_id", workflow.serviceId());
        data.put("project_id", nullToEmpty(workflow.projectId()));
        data.put("cluster_id", nullToEmpty(workflow.clusterId()));
        data.put("state", workflow.state().value());
        data.put("version", nullToEmpty(workflow.version()));
        putIfPresent(data, "prev_version", workflow.prevVersion());
        putIfPresent(data, "build_id", workflow.buildId());
        putIfPresent(data, "deployment_id", workflow.deploymentId());
        putIfPresent(data, "error", workflow.error());
        return data;
    }

    private Mono<Void> recordFailure(DeploymentWorkflow workflow, String action, Throwable error,
                                     Map<String, Object> data, AtomicBoolean failed) {
        failed.set(true);
        events.onSideEffectFailed(workflow.id(), workflow.state(), action, error);
        if (deadLetters == null) {
            return Mono.empty();
        }
        return deadLetters.deadLetter(DeadLetterEntry.create(
                        workflow.id(), workflow.serviceId(), workflow.state(), action, error, data))
                .onErrorResume(dlqError -> {
                    log.error("[workflow] Failed to dead-letter side effect workflowId={} action={} error={}",
                            workflow.id(), action, dlqError.getMessage());
                    return Mono.empty();
                });
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static void putIfPresent(Map<String, Object> data, String key, String value) {
        if (value != null && !value.isEmpty()) {
            data.put(key, value);
        }
    }

    private record Task(SideEffect effect, DeploymentWorkflow workflow) {}

    private final class Lane {
        private final String workflowId;
        private final Sinks.Many<Task> queue = Sinks.many().unicast().onBackpressureBuffer();
        private boolean closed;

        private Lane(String workflowId) {
            this.workflowId = workflowId;
            queue.asFlux()
                    .concatMap(task -> execute(task.effect(), task.workflow())
                            .subscribeOn(scheduler)
                            .onErrorResume(e -> {
                                log.error("[workflow] Side effect crashed workflowId={} error={}",
                                        workflowId, e.getMessage(), e);
                                return Mono.empty();
                            })
                            .doFinally(signal -> pending.decrementAndGet()))
                    .subscribe();
        }

        synchronized boolean offer(Task task) {
            return !closed && queue.tryEmitNext(task).isSuccess();
        }

        synchronized void close() {
            if (!closed) {
                closed = true;
                queue.tryEmitComplete();
            }
        }
    }
}
