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

package org.openpaas.orchestrator.unit.workflow;

import org.junit.jupiter.api.Test;
import org.openpaas.orchestrator.workflow.model.DeploymentEvent;
import org.openpaas.orchestrator.workflow.model.DeploymentState;
import org.openpaas.orchestrator.workflow.statemachine.TransitionTable;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.openpaas.orchestrator.workflow.model.DeploymentEvent.*;
import static org.openpaas.orchestrator.workflow.model.DeploymentState.*;

class TransitionTableTest {

    private static final Map<DeploymentState, Map<DeploymentEvent, DeploymentState>> EXPECTED = expected();

    @Test
    void everyStateEventPairMatchesTheTable() {
        int valid = 0;
        for (DeploymentState from : DeploymentState.values()) {
            for (DeploymentEvent event : DeploymentEvent.values()) {
                DeploymentState expected = EXPECTED.getOrDefault(from, Map.of()).get(event);
                assertThat(TransitionTable.next(from, event))
                        .as("%s --%s-->", from, event)
                        .isEqualTo(Optional.ofNullable(expected));
                assertThat(TransitionTable.isValid(from, event)).isEqualTo(expected != null);
                if (expected != null) {
                    valid++;
                }
            }
        }
        assertThat(valid).isEqualTo(25);
    }

    @Test
    void validEventsListsOutgoingEdges() {
        assertThat(TransitionTable.validEvents(IDLE)).containsExactlyInAnyOrder(TRIGGER_BUILD, TRIGGER_DEPLOY);
        assertThat(TransitionTable.validEvents(DEPLOYING))
                .containsExactlyInAnyOrder(DEPLOY_SUCCEEDED, DeploymentEvent.DEPLOY_FAILED, TRIGGER_ROLLBACK);
        assertThat(TransitionTable.validEvents(BUILD_QUEUED)).containsExactlyInAnyOrder(BUILD_STARTED, CANCEL);
    }

    @Test
    void cancelIsOnlyValidWhileQueuedOrBuilding() {
        for (DeploymentState from : DeploymentState.values()) {
            boolean expected = from == BUILD_QUEUED || from == BUILDING || from == DEPLOY_QUEUED;
            assertThat(TransitionTable.isValid(from, CANCEL)).as("cancel from %s", from).isEqualTo(expected);
        }
        assertThat(TransitionTable.next(DEPLOY_QUEUED, CANCEL)).contains(BUILD_COMPLETE);
    }

    @Test
    void buildFailureHasNoEdgeFromQueued() {
        assertThat(TransitionTable.isValid(BUILD_QUEUED, DeploymentEvent.BUILD_FAILED)).isFalse();
        assertThat(TransitionTable.isValid(DEPLOY_QUEUED, DeploymentEvent.DEPLOY_FAILED)).isFalse();
    }

    private static Map<DeploymentState, Map<DeploymentEvent, DeploymentState>> expected() {
        Map<DeploymentState, Map<DeploymentEvent, DeploymentState>> t = new EnumMap<>(DeploymentState.class);
        t.put(IDLE, Map.of(TRIGGER_BUILD, BUILD_QUEUED, TRIGGER_DEPLOY, DEPLOY_QUEUED));
        t.put(BUILD_QUEUED, Map.of(BUILD_STARTED, BUILDING, CANCEL, IDLE));
        t.put(BUILDING, Map.of(BUILD_SUCCEEDED, BUILD_COMPLETE,
                DeploymentEvent.BUILD_FAILED, DeploymentState.BUILD_FAILED, CANCEL, IDLE));
        t.put(BUILD_COMPLETE, Map.of(TRIGGER_DEPLOY, DEPLOY_QUEUED, TRIGGER_BUILD, BUILD_QUEUED));
        t.put(DeploymentState.BUILD_FAILED, Map.of(TRIGGER_BUILD, BUILD_QUEUED));
        t.put(DEPLOY_QUEUED, Map.of(DEPLOY_STARTED, DEPLOYING, CANCEL, BUILD_COMPLETE));
        t.put(DEPLOYING, Map.of(DEPLOY_SUCCEEDED, DEPLOY_COMPLETE,
                DeploymentEvent.DEPLOY_FAILED, DeploymentState.DEPLOY_FAILED, TRIGGER_ROLLBACK, ROLLING_BACK));
        t.put(DEPLOY_COMPLETE, Map.of(TRIGGER_BUILD, BUILD_QUEUED, TRIGGER_DEPLOY, DEPLOY_QUEUED,
                TRIGGER_ROLLBACK, ROLLING_BACK));
        t.put(DeploymentState.DEPLOY_FAILED, Map.of(TRIGGER_ROLLBACK, ROLLING_BACK, TRIGGER_BUILD, BUILD_QUEUED,
                TRIGGER_DEPLOY, DEPLOY_QUEUED));
        t.put(ROLLING_BACK, Map.of(DeploymentEvent.ROLLBACK_COMPLETE, DeploymentState.ROLLBACK_COMPLETE,
                DeploymentEvent.DEPLOY_FAILED, DeploymentState.DEPLOY_FAILED));
        t.put(DeploymentState.ROLLBACK_COMPLETE, Map.of(TRIGGER_BUILD, BUILD_QUEUED, TRIGGER_DEPLOY, DEPLOY_QUEUED));
        return t;
    }
}
