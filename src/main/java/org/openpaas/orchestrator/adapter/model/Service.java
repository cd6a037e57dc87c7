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

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Service(
        String id,
        @JsonProperty("project_id") String projectId,
        String name,
        String slug,
        ServiceStatus status,
        @JsonProperty("build_source") BuildSource buildSource,
        @JsonProperty("current_version") String currentVersion,
        @JsonProperty("target_cluster_id") String targetClusterId,
        Map<String, String> labels
) {
    public Service {
        labels = labels == null ? Map.of() : Map.copyOf(labels);
    }
}
