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

package org.openpaas.orchestrator.unit.eventbus;

import org.junit.jupiter.api.Test;
import org.openpaas.orchestrator.core.exception.EventBusException;
import org.openpaas.orchestrator.eventbus.DomainEvent;
import org.openpaas.orchestrator.eventbus.EventMetadata;
import org.openpaas.orchestrator.eventbus.EventSerializer;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventSerializerTest {

    private final EventSerializer serializer = new EventSerializer();

    @Test
    void writesIsoTimestampsAndSnakeCaseData() {
        DomainEvent event = DomainEvent.of("deploy.completed", "workflow-engine",
                        Map.of("workflow_id", "wf-1"), EventMetadata.correlatedBy("wf-1"))
                .stamped("deploy.completed", Instant.parse("2026-03-01T10:00:00Z"));

        String json = new String(serializer.serialize(event), StandardCharsets.UTF_8);

        assertThat(json).contains("\"timestamp\":\"2026-03-01T10:00:00Z\"");
        assertThat(json).contains("\"workflow_id\":\"wf-1\"");
        assertThat(json).contains("\"correlationId\":\"wf-1\"");

        DomainEvent back = serializer.deserialize(json.getBytes(StandardCharsets.UTF_8));
        assertThat(back.id()).isEqualTo(event.id());
        assertThat(back.timestamp()).isEqualTo(event.timestamp());
        assertThat(back.metadata().correlationId()).isEqualTo("wf-1");
    }

    @Test
    void ignoresUnknownFieldsFromNewerPublishers() {
        String json = "{\"id\":\"e-1\",\"type\":\"alert.fired\",\"source\":\"monitor\","
                + "\"subject\":\"alert.fired\",\"priority\":\"high\",\"data\":{}}";

        DomainEvent event = serializer.deserialize(json.getBytes(StandardCharsets.UTF_8));

        assertThat(event.id()).isEqualTo("e-1");
        assertThat(event.metadata()).isEqualTo(EventMetadata.empty());
    }

    @Test
    void malformedPayloadRaisesEventBusException() {
        assertThatThrownBy(() -> serializer.deserialize("not json".getBytes(StandardCharsets.UTF_8)))
                .isInstanceOf(EventBusException.class)
                .hasFieldOrPropertyWithValue("errorCode", "EVENT_BUS_ERROR");
    }
}
