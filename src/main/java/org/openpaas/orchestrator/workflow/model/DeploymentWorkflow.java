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

package org.openpaas.orchestrator.workflow.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of one deployment workflow instance.
 *
 * <p>The registry never mutates a snapshot in place. Every accepted transition produces a new
 * snapshot through {@link #advance(DeploymentState, TransitionPayload, Instant)}.
 */
public record DeploymentWorkflow(
        String id,
        String serviceId,
        String projectId,
        String clusterId,
        DeploymentState state,
        String buildId,
        String deploymentId,
        String version,
        String prevVersion,
        String error,
        Instant startedAt,
        Instant updatedAt,
        Map<String, String> metadata
) {
    public DeploymentWorkflow {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(serviceId, "serviceId");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(startedAt, "startedAt");
        Objects.requireNonNull(updatedAt, "updatedAt");
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static DeploymentWorkflow create(String id, String serviceId, String projectId,
                                            String clusterId, Instant now) {
        return new DeploymentWorkflow(id, serviceId, projectId, clusterId, DeploymentState.IDLE,
                null, null, null, null, null, now, now, Map.of());
    }

    /**
     * Returns a copy moved to {@code next} with the payload fields folded in.
     * Absent payload fields leave the current values untouched.
     */
    public DeploymentWorkflow advance(DeploymentState next, TransitionPayload payload, Instant now) {
        TransitionPayload p = payload != null ? payload : TransitionPayload.empty();

        String nextVersion = version;
        String nextPrevVersion = prevVersion;
        if (p.version() != null && !p.version().equals(version)) {
            nextPrevVersion = version;
            nextVersion = p.version();
        }

        Map<String, String> merged = metadata;
        if (!p.metadata().isEmpty()) {
            Map<String, String> copy = new LinkedHashMap<>(metadata);
            copy.putAll(p.metadata());
            merged = copy;
        }

        Instant touched = now.isAfter(updatedAt) ? now : updatedAt;

        return new DeploymentWorkflow(id, serviceId, projectId, clusterId, next,
                p.buildId() != null ? p.buildId() : buildId,
                p.deploymentId() != null ? p.deploymentId() : deploymentId,
                nextVersion, nextPrevVersion,
                p.error() != null ? p.error() : error,
                startedAt, touched, merged);
    }


    public boolean isActive() {
        return state != DeploymentState.IDLE;
    }
}
