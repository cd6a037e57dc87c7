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

package org.openpaas.orchestrator.core.dlq;

import org.springframework.boot.actuate.endpoint.annotation.DeleteOperation;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.boot.actuate.endpoint.annotation.Selector;
import org.springframework.lang.Nullable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Actuator endpoint over the dead letter queue, at {@code /actuator/workflow-dead-letters}.
 *
 * <p>Lists side effects that failed without retry, optionally narrowed to one workflow, and lets an
 * operator discard an entry once it has been handled. Entries are listed newest first.
 */
@Endpoint(id = "workflow-dead-letters")
public class DeadLetterEndpoint {

    private final DeadLetterService deadLetters;

    public DeadLetterEndpoint(DeadLetterService deadLetters) {
        this.deadLetters = deadLetters;
    }

    @ReadOperation
    public Map<String, Object> entries(@Nullable String workflowId) {
        Flux<DeadLetterEntry> source = workflowId != null
                ? deadLetters.getByWorkflowId(workflowId)
                : deadLetters.getAllEntries();
        List<Map<String, Object>> entries = source
                .sort(Comparator.comparing(DeadLetterEntry::createdAt).reversed())
                .map(DeadLetterEndpoint::describe)
                .collectList()
                .block();

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("stored", deadLetters.count().block());
        result.put("entries", entries);
        return result;
    }

    @ReadOperation
    public Map<String, Object> entry(@Selector String id) {
        return deadLetters.getEntry(id)
                .flatMap(found -> Mono.justOrEmpty(found.map(DeadLetterEndpoint::describe)))
                .block();
    }

    @DeleteOperation
    public void delete(@Selector String id) {
        deadLetters.deleteEntry(id).block();
    }

    private static Map<String, Object> describe(DeadLetterEntry e) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", e.id());
        view.put("workflowId", e.workflowId());
        view.put("serviceId", e.serviceId());
        view.put("state", e.state() != null ? e.state().value() : null);
        view.put("action", e.action());
        view.put("error", e.errorMessage());
        view.put("errorType", e.errorType());
        view.put("payload", e.payload());
        view.put("createdAt", e.createdAt().toString());
        return view;
    }
}
