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

package org.openpaas.orchestrator.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class WorkflowMetrics implements WorkflowEvents {
    static final String PREFIX = "openpaas.workflow";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public WorkflowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onWorkflowCreated(String workflowId, String serviceId, String clusterId) {
        counter("created").increment();
    }

    @Override
    public void onTransition(String workflowId, String serviceId, DeploymentState from, DeploymentEvent event, DeploymentState to) {
        counter("transitions", "event", event.value(), "to", to.value()).increment();
    }

    @Override
    public void onTransitionRejected(String workflowId, DeploymentState state, DeploymentEvent event) {
        counter("transitions.rejected", "event", event.value(), "state", state.value()).increment();
    }

    @Override
    public void onSideEffectCompleted(String workflowId, DeploymentState state, long latencyMs) {
        counter("side-effects", "state", state.value(), "success", "true").increment();
        timer("side-effects.duration", "state", state.value()).record(Duration.ofMillis(latencyMs));
    }

    @Override
    public void onSideEffectFailed(String workflowId, DeploymentState state, String action, Throwable error) {
        counter("side-effects", "state", state.value(), "success", "false").increment();
    }

    @Override
    public void onAdapterFailure(String workflowId, String adapter, Throwable error) {
        counter("adapter.failures", "adapter", adapter).increment();
    }

    @Override
    public void onWorkflowsCleanedUp(int removed) {
        counter("cleanup.removed").increment(removed);
    }

    @Override
    public void onWorkflowTimedOut(String workflowId, DeploymentState state, Duration age) {
        counter("timeouts", "state", state.value()).increment();
    }

    @Override
    public void onDeadLettered(String workflowId, DeploymentState state, String action, Throwable error) {
        counter("dlq.entries", "action", action).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
