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
import org.openpaas.orchestrator.eventbus.EventSubject;
import org.openpaas.orchestrator.eventbus.StreamCategory;

import static org.assertj.core.api.Assertions.assertThat;

class EventSubjectTest {

    @Test
    void everySubjectIsCapturedByItsOwnCategoryOnly() {
        for (EventSubject subject : EventSubject.values()) {
            assertThat(StreamCategory.forSubject(subject.subject()))
                    .as(subject.subject())
                    .contains(subject.category());
            for (StreamCategory other : StreamCategory.values()) {
                if (other != subject.category()) {
                    assertThat(other.captures(subject.subject())).as("%s in %s", subject, other).isFalse();
                }
            }
        }
    }

    @Test
    void rollbackEventsLiveInDeploymentsStream() {
        assertThat(EventSubject.ROLLBACK_COMPLETED.subject()).isEqualTo("rollback.completed");
        assertThat(EventSubject.ROLLBACK_COMPLETED.category()).isEqualTo(StreamCategory.DEPLOYMENTS);
        assertThat(StreamCategory.DEPLOYMENTS.subjects()).containsExactly("deploy.>", "rollback.>");
    }

    @Test
    void lookupBySubjectString() {
        assertThat(EventSubject.values()).hasSize(23);
        assertThat(EventSubject.of("alert.fired")).contains(EventSubject.ALERT_FIRED);
        assertThat(EventSubject.of("alert.exploded")).isEmpty();
        assertThat(StreamCategory.forSubject("metrics.cpu")).isEmpty();
        assertThat(StreamCategory.values()).hasSize(9);
        assertThat(StreamCategory.AUDIT.streamName()).isEqualTo("AUDIT");
    }
}
