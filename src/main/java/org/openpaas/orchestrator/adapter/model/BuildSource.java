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

/**
 * Where a service's image comes from: a git repository to build, a Dockerfile, or a prebuilt image.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BuildSource(
        String type,
        String repository,
        String branch,
        @JsonProperty("commit_sha") String commitSha,
        String dockerfile,
        String image,
        String registry
) {
    public static BuildSource git(String repository, String branch) {
        return new BuildSource("git", repository, branch, null, null, null, null);
    }
}
