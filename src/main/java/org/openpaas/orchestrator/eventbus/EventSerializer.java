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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.openpaas.orchestrator.core.exception.EventBusException;

import java.io.IOException;

/**
 * JSON codec for {@link DomainEvent}. Timestamps are written as ISO-8601 strings.
 */
public class EventSerializer {

    private final ObjectMapper mapper;

    public EventSerializer() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
    }

    public EventSerializer(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public byte[] serialize(DomainEvent event) {
        try {
            return mapper.writeValueAsBytes(event);
        } catch (JsonProcessingException e) {
            throw new EventBusException("Failed to serialize event type=" + event.type(), e);
        }
    }

    public DomainEvent deserialize(byte[] payload) {
        try {
            return mapper.readValue(payload, DomainEvent.class);
        } catch (IOException e) {
            throw new EventBusException("Failed to deserialize event", e);
        }
    }
}
