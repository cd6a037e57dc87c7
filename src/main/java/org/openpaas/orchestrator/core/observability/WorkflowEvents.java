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

import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;

import java.time.Duration;

public interface WorkflowEvents {
    // Lifecycle
    default void onWorkflowCreated(String workflowId, String serviceId, String clusterId) {}
    default void onTransition(String workflowId, String serviceId, DeploymentState from, DeploymentEvent event, DeploymentState to) {}
    default void onTransitionRejected(String workflowId, DeploymentState state, DeploymentEvent event) {}

    // Side effects
    default void onSideEffectCompleted(String workflowId, DeploymentState state, long latencyMs) {}
    default void onSideEffectFailed(String workflowId, DeploymentState state, String action, Throwable error) {}

    // Adapters
    default void onAdapterFailure(String workflowId, String adapter, Throwable error) {}

    // Maintenance
    default void onWorkflowsCleanedUp(int removed) {}
    default void onWorkflowTimedOut(String workflowId, DeploymentState state, Duration age) {}

    // DLQ
    default void onDeadLettered(String workflowId, DeploymentState state, String action, Throwable error) {}
}
