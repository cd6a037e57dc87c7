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

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Envelope for everything travelling on the event bus. {@code id}, {@code subject} and
 * {@code timestamp} are assigned by the bus on publish when the producer leaves them empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DomainEvent(
        String id,
        String type,
        String source,
        String subject,
        Instant timestamp,
        Map<String, Object> data,
        EventMetadata metadata
) {
    public DomainEvent {
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        metadata = metadata == null ? EventMetadata.empty() : metadata;
    }

    public static DomainEvent of(String type, String source, Map<String, Object> data, EventMetadata metadata) {
        return new DomainEvent(null, type, source, null, null, data, metadata);
    }

    /**
     * Fills the fields a publisher is responsible for.
     */
    public DomainEvent stamped(String subject, Instant now) {
        return new DomainEvent(
                id == null || id.isEmpty() ? UUID.randomUUID().toString() : id,
                type, source, subject,
                timestamp == null ? now : timestamp,
                data, metadata);
    }

    /**
     * Builds a reply correlated with this event.
     */
    public DomainEvent reply(String type, String source, Map<String, Object> data) {
        return of(type, source, data, new EventMetadata(metadata.correlationId(), id, metadata.userId(), metadata.traceId()));
    }
}
