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

package org.openpaas.orchestrator.workflow.statemachine;

import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.openpaas.orchestrator.workflow.model.DeploymentEvent.*;
import static org.openpaas.orchestrator.workflow.model.DeploymentState.*;

/**
 * Pure {@code (state, event) -> state} mapping for deployment workflows.
 *
 * <p>Any pair absent from the table is an invalid transition. The table has no side effects
 * and is safe to share between threads.
 */
public final class TransitionTable {

    private static final Map<DeploymentState, Map<DeploymentEvent, DeploymentState>> TABLE = build();

    private TransitionTable() {}

    public static Optional<DeploymentState> next(DeploymentState from, DeploymentEvent event) {
        Map<DeploymentEvent, DeploymentState> edges = TABLE.get(from);
        return edges == null ? Optional.empty() : Optional.ofNullable(edges.get(event));
    }

    public static boolean isValid(DeploymentState from, DeploymentEvent event) {
        return next(from, event).isPresent();
    }

    public static Set<DeploymentEvent> validEvents(DeploymentState from) {
        Map<DeploymentEvent, DeploymentState> edges = TABLE.get(from);
        return edges == null ? Set.of() : Collections.unmodifiableSet(edges.keySet());
    }

    private static Map<DeploymentState, Map<DeploymentEvent, DeploymentState>> build() {
        Map<DeploymentState, Map<DeploymentEvent, DeploymentState>> t = new EnumMap<>(DeploymentState.class);

        edge(t, IDLE, TRIGGER_BUILD, BUILD_QUEUED);
        edge(t, IDLE, TRIGGER_DEPLOY, DEPLOY_QUEUED);

        edge(t, BUILD_QUEUED, BUILD_STARTED, BUILDING);
        edge(t, BUILD_QUEUED, CANCEL, IDLE);

        edge(t, BUILDING, BUILD_SUCCEEDED, BUILD_COMPLETE);
        edge(t, BUILDING, DeploymentEvent.BUILD_FAILED, DeploymentState.BUILD_FAILED);
        edge(t, BUILDING, CANCEL, IDLE);

        edge(t, BUILD_COMPLETE, TRIGGER_DEPLOY, DEPLOY_QUEUED);
        edge(t, BUILD_COMPLETE, TRIGGER_BUILD, BUILD_QUEUED);

        edge(t, DeploymentState.BUILD_FAILED, TRIGGER_BUILD, BUILD_QUEUED);

        edge(t, DEPLOY_QUEUED, DEPLOY_STARTED, DEPLOYING);
        edge(t, DEPLOY_QUEUED, CANCEL, BUILD_COMPLETE);

        edge(t, DEPLOYING, DEPLOY_SUCCEEDED, DEPLOY_COMPLETE);
        edge(t, DEPLOYING, DeploymentEvent.DEPLOY_FAILED, DeploymentState.DEPLOY_FAILED);
        edge(t, DEPLOYING, TRIGGER_ROLLBACK, ROLLING_BACK);

        edge(t, DEPLOY_COMPLETE, TRIGGER_BUILD, BUILD_QUEUED);
        edge(t, DEPLOY_COMPLETE, TRIGGER_DEPLOY, DEPLOY_QUEUED);
        edge(t, DEPLOY_COMPLETE, TRIGGER_ROLLBACK, ROLLING_BACK);

        edge(t, DeploymentState.DEPLOY_FAILED, TRIGGER_ROLLBACK, ROLLING_BACK);
        edge(t, DeploymentState.DEPLOY_FAILED, TRIGGER_BUILD, BUILD_QUEUED);
        edge(t, DeploymentState.DEPLOY_FAILED, TRIGGER_DEPLOY, DEPLOY_QUEUED);

        edge(t, ROLLING_BACK, DeploymentEvent.ROLLBACK_COMPLETE, DeploymentState.ROLLBACK_COMPLETE);
        edge(t, ROLLING_BACK, DeploymentEvent.DEPLOY_FAILED, DeploymentState.DEPLOY_FAILED);

        edge(t, DeploymentState.ROLLBACK_COMPLETE, TRIGGER_BUILD, BUILD_QUEUED);
        edge(t, DeploymentState.ROLLBACK_COMPLETE, TRIGGER_DEPLOY, DEPLOY_QUEUED);

        Map<DeploymentState, Map<DeploymentEvent, DeploymentState>> frozen = new EnumMap<>(DeploymentState.class);
        t.forEach((state, edges) -> frozen.put(state, Collections.unmodifiableMap(edges)));
        return Collections.unmodifiableMap(frozen);
    }

    private static void edge(Map<DeploymentState, Map<DeploymentEvent, DeploymentState>> t,
                             DeploymentState from, DeploymentEvent event, DeploymentState to) {
        t.computeIfAbsent(from, k -> new EnumMap<>(DeploymentEvent.class)).put(event, to);
    }
}
