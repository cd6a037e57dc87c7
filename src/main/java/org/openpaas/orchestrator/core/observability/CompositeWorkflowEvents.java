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

import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;

import java.time.Duration;
import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeWorkflowEvents implements WorkflowEvents {
    private final List<WorkflowEvents> delegates;

    public CompositeWorkflowEvents(List<WorkflowEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    private void safeForEach(Consumer<WorkflowEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onWorkflowCreated(String workflowId, String serviceId, String clusterId) { safeForEach(d -> d.onWorkflowCreated(workflowId, serviceId, clusterId)); }
    @Override public void onTransition(String workflowId, String serviceId, DeploymentState from, DeploymentEvent event, DeploymentState to) { safeForEach(d -> d.onTransition(workflowId, serviceId, from, event, to)); }
    @Override public void onTransitionRejected(String workflowId, DeploymentState state, DeploymentEvent event) { safeForEach(d -> d.onTransitionRejected(workflowId, state, event)); }
    @Override public void onSideEffectCompleted(String workflowId, DeploymentState state, long latencyMs) { safeForEach(d -> d.onSideEffectCompleted(workflowId, state, latencyMs)); }
    @Override public void onSideEffectFailed(String workflowId, DeploymentState state, String action, Throwable error) { safeForEach(d -> d.onSideEffectFailed(workflowId, state, action, error)); }
    @Override public void onAdapterFailure(String workflowId, String adapter, Throwable error) { safeForEach(d -> d.onAdapterFailure(workflowId, adapter, error)); }
    @Override public void onWorkflowsCleanedUp(int removed) { safeForEach(d -> d.onWorkflowsCleanedUp(removed)); }
    @Override public void onWorkflowTimedOut(String workflowId, DeploymentState state, Duration age) { safeForEach(d -> d.onWorkflowTimedOut(workflowId, state, age)); }
    @Override public void onDeadLettered(String workflowId, DeploymentState state, String action, Throwable error) { safeForEach(d -> d.onDeadLettered(workflowId, state, action, error)); }
}
