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

package org.openpaas.orchestrator.core.dlq;

import org.openpaas.orchestrator.workflow.model.DeploymentState;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * A side effect that failed and was not retried.
 *
 * @param action which half of the side effect failed, {@code status-update} or {@code publish}
 */
public record DeadLetterEntry(
        String id,
        String workflowId,
        String serviceId,
        DeploymentState state,
        String action,
        String errorMessage,
        String errorType,
        Map<String, Object> payload,
        Instant createdAt
) {
    public static DeadLetterEntry create(String workflowId, String serviceId, DeploymentState state,
                                         String action, Throwable error, Map<String, Object> payload) {
        return new DeadLetterEntry(
                UUID.randomUUID().toString(), workflowId, serviceId, state, action,
                error != null ? error.getMessage() : null,
                error != null ? error.getClass().getName() : null,
                payload != null ? Map.copyOf(payload) : Map.of(),
                Instant.now());
    }
}
