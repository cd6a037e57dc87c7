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

package org.openpaas.orchestrator.core.exception;

import org.openpaas.orchestrator.workflow.model.DeploymentState;

/**
 * Raised by a conditional transition when the workflow changed after the caller read it.
 */
public final class StaleWorkflowException extends OrchestratorException {
    private final String workflowId;
    private final DeploymentState expectedState;
    private final DeploymentState actualState;

    public StaleWorkflowException(String workflowId, DeploymentState expectedState, DeploymentState actualState) {
        super("Workflow '" + workflowId + "' changed since it was read (was '" + expectedState
                + "', now '" + actualState + "')", "WORKFLOW_CHANGED");
        this.workflowId = workflowId;
        this.expectedState = expectedState;
        this.actualState = actualState;
    }

    public String getWorkflowId() { return workflowId; }
    public DeploymentState getExpectedState() { return expectedState; }
    public DeploymentState getActualState() { return actualState; }
}
