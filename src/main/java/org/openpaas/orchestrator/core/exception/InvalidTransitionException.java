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

import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;

import java.util.Set;

/**
 * Raised when an event has no edge from the workflow's current state. The workflow is left
 * exactly as it was; callers should re-read it before deciding whether to retry.
 */
public final class InvalidTransitionException extends OrchestratorException {
    private final String workflowId;
    private final DeploymentState state;
    private final DeploymentEvent event;
    private final Set<DeploymentEvent> validEvents;

    public InvalidTransitionException(String workflowId, DeploymentState state, DeploymentEvent event,
                                      Set<DeploymentEvent> validEvents) {
        super("Invalid transition for workflow '" + workflowId + "': event '" + event
                + "' not allowed in state '" + state + "' (valid: " + validEvents + ")",
                "WORKFLOW_INVALID_TRANSITION");
        this.workflowId = workflowId;
        this.state = state;
        this.event = event;
        this.validEvents = Set.copyOf(validEvents);
    }

    public String getWorkflowId() { return workflowId; }
    public DeploymentState getState() { return state; }
    public DeploymentEvent getEvent() { return event; }
    public Set<DeploymentEvent> getValidEvents() { return validEvents; }
}
