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

package org.openpaas.orchestrator.eventbus;

import java.util.List;
import java.util.Optional;

/**
 * Durable stream groupings. Every {@link EventSubject} belongs to exactly one category, and each
 * category is backed by one stream capturing all of its subject filters.
 */
public enum StreamCategory {
    BUILDS("build.>"),
    DEPLOYMENTS("deploy.>", "rollback.>"),
    SERVICES("service.>"),
    PROJECTS("project.>"),
    CLUSTERS("cluster.>"),
    SECRETS("secret.>"),
    ALERTS("alert.>"),
    WEBHOOKS("webhook.>"),
    AUDIT("audit.>");

    private final List<String> subjects;

    StreamCategory(String... subjects) {
        this.subjects = List.of(subjects);
    }

    /** Stream name as provisioned on the broker. */
    public String streamName() {
        return name();
    }

    public List<String> subjects() {
        return subjects;
    }

    public boolean captures(String subject) {
        return subjects.stream().anyMatch(filter -> SubjectMatcher.matches(filter, subject));
    }

    public static Optional<StreamCategory> forSubject(String subject) {
        for (StreamCategory category : values()) {
            if (category.captures(subject)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }
}
