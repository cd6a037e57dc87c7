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

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record EventMetadata(String correlationId, String causationId, String userId, String traceId) {

    private static final EventMetadata EMPTY = new EventMetadata(null, null, null, null);

    public static EventMetadata empty() {
        return EMPTY;
    }

    public static EventMetadata correlatedBy(String correlationId) {
        return new EventMetadata(correlationId, null, null, null);
    }

    public EventMetadata withCausationId(String causationId) {
        return new EventMetadata(correlationId, causationId, userId, traceId);
    }
}
