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

package org.openpaas.orchestrator.unit.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openpaas.orchestrator.core.dlq.DeadLetterEntry;
import org.openpaas.orchestrator.core.dlq.DeadLetterService;
import org.openpaas.orchestrator.core.dlq.InMemoryDeadLetterStore;
import org.openpaas.orchestrator.core.observability.WorkflowEvents;
import org.openpaas.orchestrator.workflow.model.DeploymentState;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class DeadLetterServiceTest {

    private InMemoryDeadLetterStore store;
    private DeadLetterService service;
    private final List<String> deadLettered = new ArrayList<>();

    @BeforeEach
    void setUp() {
        store = new InMemoryDeadLetterStore();
        service = new DeadLetterService(store, new WorkflowEvents() {
            @Override
            public void onDeadLettered(String workflowId, DeploymentState state, String action, Throwable error) {
                deadLettered.add(workflowId + ":" + action + ":" + error.getMessage());
            }
        });
    }

    @Test
    void deadLetter_savesEntryAndNotifies() {
        var entry = DeadLetterEntry.create("wf-1", "svc-1", DeploymentState.DEPLOYING,
                "publish", new RuntimeException("bus down"), Map.of("state", "deploying"));

        StepVerifier.create(service.deadLetter(entry).then(service.count()))
                .assertNext(count -> assertThat(count).isEqualTo(1))
                .verifyComplete();
        assertThat(deadLettered).containsExactly("wf-1:publish:bus down");
    }

    @Test
    void create_capturesErrorTypeAndCopiesPayload() {
        var entry = DeadLetterEntry.create("wf-1", "svc-1", DeploymentState.BUILDING,
                "status-update", new IllegalStateException("db down"), null);

        assertThat(entry.id()).isNotBlank();
        assertThat(entry.errorType()).isEqualTo(IllegalStateException.class.getName());
        assertThat(entry.payload()).isEmpty();
        assertThat(entry.createdAt()).isNotNull();
    }

    @Test
    void getEntry_findsById() {
        var entry = DeadLetterEntry.create("wf-2", "svc-2", DeploymentState.DEPLOY_FAILED,
                "publish", new RuntimeException("err"), Map.of());

        StepVerifier.create(service.deadLetter(entry).then(service.getEntry(entry.id())))
                .assertNext(opt -> assertThat(opt).hasValueSatisfying(e -> assertThat(e.workflowId()).isEqualTo("wf-2")))
                .verifyComplete();

        StepVerifier.create(service.getEntry("missing"))
                .assertNext(opt -> assertThat(opt).isEmpty())
                .verifyComplete();
    }

    @Test
    void deleteEntry_removesFromStore() {
        var entry = DeadLetterEntry.create("wf-3", "svc-3", DeploymentState.DEPLOY_COMPLETE,
                "status-update", new RuntimeException("err"), Map.of());

        StepVerifier.create(service.deadLetter(entry).then(service.deleteEntry(entry.id())).then(service.count()))
                .assertNext(count -> assertThat(count).isZero())
                .verifyComplete();
    }

    @Test
    void getByWorkflowId_filtersCorrectly() {
        var e1 = DeadLetterEntry.create("wf-a", "svc", DeploymentState.BUILDING, "publish", new RuntimeException("x"), Map.of());
        var e2 = DeadLetterEntry.create("wf-b", "svc", DeploymentState.BUILDING, "publish", new RuntimeException("y"), Map.of());
        var e3 = DeadLetterEntry.create("wf-a", "svc", DeploymentState.BUILD_FAILED, "status-update", new RuntimeException("z"), Map.of());

        StepVerifier.create(service.deadLetter(e1).then(service.deadLetter(e2)).then(service.deadLetter(e3))
                        .thenMany(service.getByWorkflowId("wf-a")).collectList())
                .assertNext(list -> assertThat(list).extracting(DeadLetterEntry::errorMessage)
                        .containsExactlyInAnyOrder("x", "z"))
                .verifyComplete();
    }
}
