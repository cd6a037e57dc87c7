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
import org.openpaas.orchestrator.core.scheduling.OrchestrationScheduler;
import org.openpaas.orchestrator.workflow.engine.DeploymentWorkflowEngine;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.time.Duration;
import java.util.Objects;

/**
 * Periodically garbage-collects quiescent workflows through
 * {@link DeploymentWorkflowEngine#cleanupOldWorkflows(Duration)}.
 */
@Slf4j
public class WorkflowCleanupService implements SmartInitializingSingleton {

    static final String TASK_ID = "workflow-cleanup";

    private final DeploymentWorkflowEngine engine;
    private final OrchestrationScheduler scheduler;
    private final Duration interval;
    private final Duration retention;

    public WorkflowCleanupService(DeploymentWorkflowEngine engine, OrchestrationScheduler scheduler,
                                  Duration interval, Duration retention) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = requirePositive(interval, "interval");
        this.retention = requirePositive(retention, "retention");
    }

    @Override
    public void afterSingletonsInstantiated() {
        start();
    }

    public void start() {
        scheduler.scheduleAtFixedRate(TASK_ID, this::runOnce, interval.toMillis(), interval.toMillis());
        log.info("[workflow] Cleanup scheduled every {} with retention {}", interval, retention);
    }

    public void stop() {
        scheduler.cancel(TASK_ID);
    }

    public int runOnce() {
        int removed = engine.cleanupOldWorkflows(retention);
        log.debug("[workflow] Cleanup pass finished removed={}", removed);
        return removed;
    }

    static Duration requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + value);
        }
        return value;
    }
}
