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

@Slf4j
public class WorkflowLoggerEvents implements WorkflowEvents {
    @Override
    public void onWorkflowCreated(String workflowId, String serviceId, String clusterId) {
        log.info("[workflow] created workflowId={} serviceId={} clusterId={}", workflowId, serviceId, clusterId);
    }
    @Override
    public void onTransition(String workflowId, String serviceId, DeploymentState from, DeploymentEvent event, DeploymentState to) {
        log.info("[workflow] transition workflowId={} serviceId={} from={} event={} to={}", workflowId, serviceId, from, event, to);
    }
    @Override
    public void onTransitionRejected(String workflowId, DeploymentState state, DeploymentEvent event) {
        log.warn("[workflow] transition.rejected workflowId={} state={} event={}", workflowId, state, event);
    }
    @Override
    public void onSideEffectCompleted(String workflowId, DeploymentState state, long latencyMs) {
        log.debug("[workflow] side-effect.completed workflowId={} state={} latencyMs={}", workflowId, state, latencyMs);
    }
    @Override
    public void onSideEffectFailed(String workflowId, DeploymentState state, String action, Throwable error) {
        log.error("[workflow] side-effect.failed workflowId={} state={} action={} error={}", workflowId, state, action, error.getMessage());
    }
    @Override
    public void onAdapterFailure(String workflowId, String adapter, Throwable error) {
        log.warn("[workflow] adapter.failed workflowId={} adapter={} error={}", workflowId, adapter, error.getMessage());
    }
    @Override
    public void onWorkflowsCleanedUp(int removed) {
        if (removed > 0) {
            log.info("[workflow] cleanup removed={}", removed);
        }
    }
    @Override
    public void onWorkflowTimedOut(String workflowId, DeploymentState state, Duration age) {
        log.warn("[workflow] timed-out workflowId={} state={} ageSeconds={}", workflowId, state, age.toSeconds());
    }
    @Override
    public void onDeadLettered(String workflowId, DeploymentState state, String action, Throwable error) {
        log.error("[workflow] dead-lettered workflowId={} state={} action={} error={}", workflowId, state, action, error.getMessage());
    }
}
