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

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One entry of a GitOps application's rollout history.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Deployment(
        String id,
        @JsonProperty("service_id") String serviceId,
        @JsonProperty("cluster_id") String clusterId,
        @JsonProperty("build_id") String buildId,
        DeploymentStatus status,
        String version,
        @JsonProperty("previous_version") String previousVersion,
        long revision,
        int replicas,
        @JsonProperty("ready_replicas") int readyReplicas,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt
) {}
