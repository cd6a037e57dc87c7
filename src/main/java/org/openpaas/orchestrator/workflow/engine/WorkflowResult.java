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

import org.openpaas.orchestrator.workflow.model.DeploymentWorkflow;

import java.util.Optional;

/**
 * Outcome of an orchestration call that talks to an external system. The workflow is always
 * present; {@code failure} is set when the external call failed and was folded into the workflow.
 */
public record WorkflowResult(DeploymentWorkflow workflow, Throwable failure) {

    public static WorkflowResult success(DeploymentWorkflow workflow) {
        return new WorkflowResult(workflow, null);
    }

    public static WorkflowResult failed(DeploymentWorkflow workflow, Throwable failure) {
        return new WorkflowResult(workflow, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public Optional<Throwable> error() {
        return Optional.ofNullable(failure);
    }
}
