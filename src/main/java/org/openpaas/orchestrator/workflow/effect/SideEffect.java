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

package org.openpaas.orchestrator.workflow.effect;

import org.openpaas.orchestrator.adapter.model.ServiceStatus;
import org.openpaas.orchestrator.eventbus.EventSubject;
import org.openpaas.orchestrator.workflow.model.DeploymentState;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * What happens outside the registry when a workflow enters a state: an optional service status
 * update followed by an optional domain event.
 */
public record SideEffect(DeploymentState state, ServiceStatus status, EventSubject subject) {

    private static final Map<DeploymentState, SideEffect> BY_STATE = new EnumMap<>(DeploymentState.class);

    static {
        register(DeploymentState.BUILDING, ServiceStatus.BUILDING, null);
        register(DeploymentState.BUILD_COMPLETE, null, EventSubject.BUILD_COMPLETED);
        register(DeploymentState.BUILD_FAILED, ServiceStatus.FAILED, EventSubject.BUILD_FAILED);
        register(DeploymentState.DEPLOYING, ServiceStatus.DEPLOYING, EventSubject.DEPLOY_STARTED);
        register(DeploymentState.DEPLOY_COMPLETE, ServiceStatus.RUNNING, EventSubject.DEPLOY_COMPLETED);
        register(DeploymentState.DEPLOY_FAILED, ServiceStatus.FAILED, EventSubject.DEPLOY_FAILED);
        register(DeploymentState.ROLLBACK_COMPLETE, ServiceStatus.RUNNING, EventSubject.ROLLBACK_COMPLETED);
    }

    public static Optional<SideEffect> forState(DeploymentState state) {
        return Optional.ofNullable(BY_STATE.get(state));
    }

    public Optional<ServiceStatus> statusUpdate() {
        return Optional.ofNullable(status);
    }

    public Optional<EventSubject> publication() {
        return Optional.ofNullable(subject);
    }

    private static void register(DeploymentState state, ServiceStatus status, EventSubject subject) {
        BY_STATE.put(state, new SideEffect(state, status, subject));
    }
}
