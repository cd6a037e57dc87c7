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

package org.openpaas.orchestrator.eventbus.nats;

import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.api.DiscardPolicy;
import io.nats.client.api.RetentionPolicy;
import io.nats.client.api.StorageType;
import io.nats.client.api.StreamConfiguration;
import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.eventbus.StreamCategory;
import org.openpaas.orchestrator.eventbus.StreamSettings;

import java.io.IOException;
import java.time.Duration;

/**
 * Ensures one JetStream stream per {@link StreamCategory}. Existing streams are updated in place.
 */
@Slf4j
public class NatsStreamProvisioner {

    private final JetStreamManagement management;
    private final StreamSettings settings;

    public NatsStreamProvisioner(JetStreamManagement management, StreamSettings settings) {
        this.management = management;
        this.settings = settings;
    }

    public StreamConfiguration configurationFor(StreamCategory category) {
        return StreamConfiguration.builder()
                .name(category.streamName())
                .subjects(category.subjects())
                .retentionPolicy(RetentionPolicy.Limits)
                .maxAge(settings.ageLimited() ? settings.maxAge() : Duration.ZERO)
                .maxBytes(settings.maxBytes())
                .maxMessages(settings.maxMessages())
                .discardPolicy(DiscardPolicy.Old)
                .storageType(settings.fileStorage() ? StorageType.File : StorageType.Memory)
                .replicas(settings.replicas())
                .build();
    }

    /**
     * @return the number of streams created or updated
     */
    public int provisionAll() {
        int provisioned = 0;
        for (StreamCategory category : StreamCategory.values()) {
            if (provision(category)) {
                provisioned++;
            }
        }
        log.info("[event-bus] JetStream streams provisioned count={}/{}", provisioned, StreamCategory.values().length);
        return provisioned;
    }

    private boolean provision(StreamCategory category) {
        StreamConfiguration config = configurationFor(category);
        try {
            management.addStream(config);
            log.debug("[event-bus] Stream created name={}", category.streamName());
            return true;
        } catch (JetStreamApiException | IOException addError) {
            try {
                management.updateStream(config);
                log.debug("[event-bus] Stream updated name={}", category.streamName());
                return true;
            } catch (JetStreamApiException | IOException updateError) {
                log.warn("[event-bus] Failed to create/update stream name={} error={}",
                        category.streamName(), updateError.getMessage());
                return false;
            }
        }
    }
}
