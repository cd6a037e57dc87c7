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

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of subjects the platform publishes on. Publishing to a subject outside this set is
 * not possible through {@link EventBus#publish}.
 */
public enum EventSubject {
    BUILD_STARTED("build.started", StreamCategory.BUILDS),
    BUILD_COMPLETED("build.completed", StreamCategory.BUILDS),
    BUILD_FAILED("build.failed", StreamCategory.BUILDS),

    DEPLOY_STARTED("deploy.started", StreamCategory.DEPLOYMENTS),
    DEPLOY_COMPLETED("deploy.completed", StreamCategory.DEPLOYMENTS),
    DEPLOY_FAILED("deploy.failed", StreamCategory.DEPLOYMENTS),
    ROLLBACK_COMPLETED("rollback.completed", StreamCategory.DEPLOYMENTS),

    SERVICE_CREATED("service.created", StreamCategory.SERVICES),
    SERVICE_UPDATED("service.updated", StreamCategory.SERVICES),
    SERVICE_DELETED("service.deleted", StreamCategory.SERVICES),
    SERVICE_SCALED("service.scaled", StreamCategory.SERVICES),

    PROJECT_CREATED("project.created", StreamCategory.PROJECTS),
    PROJECT_DELETED("project.deleted", StreamCategory.PROJECTS),

    CLUSTER_CREATED("cluster.created", StreamCategory.CLUSTERS),
    CLUSTER_UPDATED("cluster.updated", StreamCategory.CLUSTERS),
    CLUSTER_DELETED("cluster.deleted", StreamCategory.CLUSTERS),

    SECRET_CREATED("secret.created", StreamCategory.SECRETS),
    SECRET_UPDATED("secret.updated", StreamCategory.SECRETS),
    SECRET_DELETED("secret.deleted", StreamCategory.SECRETS),

    ALERT_FIRED("alert.fired", StreamCategory.ALERTS),
    ALERT_RESOLVED("alert.resolved", StreamCategory.ALERTS),

    WEBHOOK_RECEIVED("webhook.received", StreamCategory.WEBHOOKS),

    AUDIT_LOG("audit.log", StreamCategory.AUDIT);

    private static final Map<String, EventSubject> BY_SUBJECT = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(EventSubject::subject, Function.identity()));

    private final String subject;
    private final StreamCategory category;

    EventSubject(String subject, StreamCategory category) {
        this.subject = subject;
        this.category = category;
    }

    public String subject() {
        return subject;
    }

    public StreamCategory category() {
        return category;
    }

    public static Optional<EventSubject> of(String subject) {
        return Optional.ofNullable(BY_SUBJECT.get(subject));
    }

    @Override
    public String toString() {
        return subject;
    }
}
