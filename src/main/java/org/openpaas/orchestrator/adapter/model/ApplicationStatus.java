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

package org.openpaas.orchestrator.adapter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Live status of a GitOps application as reported by the controller.
 */
public record ApplicationStatus(
        String health,
        @JsonProperty("sync_status") String syncStatus,
        @JsonProperty("current_image") String currentImage,
        @JsonProperty("desired_image") String desiredImage,
        int replicas,
        @JsonProperty("ready_replicas") int readyReplicas,
        List<ResourceStatus> resources
) {
    public static final String HEALTHY = "Healthy";
    public static final String DEGRADED = "Degraded";
    public static final String MISSING = "Missing";
    public static final String SYNCED = "Synced";

    public ApplicationStatus {
        resources = resources == null ? List.of() : List.copyOf(resources);
    }

    public boolean isHealthyAndSynced() {
        return HEALTHY.equalsIgnoreCase(health) && SYNCED.equalsIgnoreCase(syncStatus);
    }

    public boolean isBroken() {
        return DEGRADED.equalsIgnoreCase(health) || MISSING.equalsIgnoreCase(health);
    }
}
