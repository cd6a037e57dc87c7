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
 * Build record returned by a CI runner when a build is accepted.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Build(
        String id,
        @JsonProperty("service_id") String serviceId,
        @JsonProperty("project_id") String projectId,
        BuildStatus status,
        BuildSource source,
        @JsonProperty("image_tag") String imageTag,
        @JsonProperty("image_digest") String imageDigest,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("created_at") Instant createdAt
) {
    public static Build queued(String id, String serviceId, String projectId, String imageTag) {
        return new Build(id, serviceId, projectId, BuildStatus.QUEUED, null, imageTag, null, null, Instant.now());
    }
}
