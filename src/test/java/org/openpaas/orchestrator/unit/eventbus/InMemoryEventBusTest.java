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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.openpaas.orchestrator.core.exception.EventBusException;
import org.openpaas.orchestrator.eventbus.DomainEvent;
import org.openpaas.orchestrator.eventbus.EventHandler;
import org.openpaas.orchestrator.eventbus.EventMetadata;
import org.openpaas.orchestrator.eventbus.EventSerializer;
import org.openpaas.orchestrator.eventbus.EventSubject;
import org.openpaas.orchestrator.eventbus.EventSubscription;
import org.openpaas.orchestrator.eventbus.StreamCategory;
import org.openpaas.orchestrator.eventbus.StreamSettings;
import org.openpaas.orchestrator.eventbus.memory.InMemoryEventBus;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryEventBusTest {

    private Scheduler scheduler;
    private InMemoryEventBus bus;

    @BeforeEach
    void setUp() {
        scheduler = Schedulers.newBoundedElastic(4, 1000, "bus-test");
        bus = new InMemoryEventBus(new EventSerializer(), StreamSettings.defaults(), scheduler, Clock.systemUTC());
    }

    @AfterEach
    void tearDown() {
        bus.close();
        scheduler.dispose();
    }

    @Test
    void publishStampsEventAndDeliversToMatchingSubscribers() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);
        List<DomainEvent> wildcard = Collections.synchronizedList(new ArrayList<>());
        List<DomainEvent> exact = Collections.synchronizedList(new ArrayList<>());
        List<DomainEvent> other = Collections.synchronizedList(new ArrayList<>());
        bus.subscribe("deploy.>", collect(wildcard, latch));
        bus.subscribe("deploy.completed", collect(exact, latch));
        bus.subscribe("build.*", collect(other, null));

        StepVerifier.create(bus.publish(EventSubject.DEPLOY_COMPLETED, event("deploy.completed")))
                .verifyComplete();

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        DomainEvent received = wildcard.get(0);
        assertThat(received.id()).isNotBlank();
        assertThat(received.subject()).isEqualTo("deploy.completed");
        assertThat(received.timestamp()).isNotNull();
        assertThat(exact).extracting(DomainEvent::id).containsExactly(received.id());
        assertThat(other).isEmpty();
    }

    @Test
    void queueGroupDeliversEachEventToOneMember() throws Exception {
        int events = 10;
        CountDownLatch latch = new CountDownLatch(events);
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        bus.queueSubscribe("build.>", "builders", e -> Mono.fromRunnable(() -> {
            first.incrementAndGet();
            latch.countDown();
        }));
        bus.queueSubscribe("build.>", "builders", e -> Mono.fromRunnable(() -> {
            second.incrementAndGet();
            latch.countDown();
        }));

        for (int i = 0; i < events; i++) {
            bus.publish(EventSubject.BUILD_STARTED, event("build.started")).block();
        }

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(first.get() + second.get()).isEqualTo(events);
        assertThat(first.get()).isEqualTo(5);
        assertThatThrownBy(() -> bus.queueSubscribe("build.>", " ", e -> Mono.empty()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sameQueueNameOnDifferentPatternsFormsSeparateGroups() throws Exception {
        CountDownLatch latch = new CountDownLatch(2);
        AtomicInteger wide = new AtomicInteger();
        AtomicInteger narrow = new AtomicInteger();
        bus.queueSubscribe("build.>", "workers", e -> Mono.fromRunnable(() -> {
            wide.incrementAndGet();
            latch.countDown();
        }));
        bus.queueSubscribe("build.started", "workers", e -> Mono.fromRunnable(() -> {
            narrow.incrementAndGet();
            latch.countDown();
        }));

        bus.publish(EventSubject.BUILD_STARTED, event("build.started")).block();

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(wide.get()).isEqualTo(1);
        assertThat(narrow.get()).isEqualTo(1);
    }

    @Test
    void failingHandlerDoesNotAffectOtherSubscribersOrPublisher() throws Exception {
        CountDownLatch latch = new CountDownLatch(1);
        bus.subscribe("alert.fired", e -> Mono.error(new IllegalStateException("boom")));
        bus.subscribe("alert.fired", e -> Mono.fromRunnable(latch::countDown));

        StepVerifier.create(bus.publish(EventSubject.ALERT_FIRED, event("alert.fired"))).verifyComplete();

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void unsubscribeStopsDelivery() throws Exception {
        AtomicInteger count = new AtomicInteger();
        EventSubscription sub = bus.subscribe("service.>", e -> Mono.fromRunnable(count::incrementAndGet));
        sub.unsubscribe();

        bus.publish(EventSubject.SERVICE_CREATED, event("service.created")).block();
        Thread.sleep(100);

        assertThat(sub.isActive()).isFalse();
        assertThat(count.get()).isZero();
        assertThat(bus.subscriptionCount()).isZero();
    }

    @Test
    void requestReceivesReplyCorrelatedWithRequest() {
        bus.respond("cluster.health", req -> Mono.just(req.reply("cluster.health.reply", "cluster-agent",
                Map.of("healthy", true))));

        DomainEvent request = event("cluster.health");
        StepVerifier.create(bus.request("cluster.health", request, Duration.ofSeconds(2)))
                .assertNext(reply -> {
                    assertThat(reply.type()).isEqualTo("cluster.health.reply");
                    assertThat(reply.data()).containsEntry("healthy", true);
                    assertThat(reply.metadata().correlationId()).isEqualTo("corr-1");
                    assertThat(reply.metadata().causationId()).isNotBlank();
                })
                .verifyComplete();
    }

    @Test
    void requestWithoutResponderOrReplyFails() {
        StepVerifier.create(bus.request("nobody.home", event("nobody.home"), Duration.ofSeconds(1)))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(EventBusException.class)
                        .hasMessageContaining("No responders"))
                .verify();

        bus.respond("slow.responder", req -> Mono.never());
        StepVerifier.create(bus.request("slow.responder", event("slow.responder"), Duration.ofMillis(100)))
                .expectErrorSatisfies(e -> assertThat(e)
                        .isInstanceOf(EventBusException.class)
                        .hasMessageContaining("timed out after 100ms"))
                .verify();
    }

    @Test
    void replayReturnsRetainedEventsOfCategoryInOrder() {
        Instant before = Instant.now().minusSeconds(1);
        bus.publish(EventSubject.DEPLOY_STARTED, event("deploy.started")).block();
        bus.publish(EventSubject.BUILD_STARTED, event("build.started")).block();
        bus.publish(EventSubject.ROLLBACK_COMPLETED, event("rollback.completed")).block();

        StepVerifier.create(bus.replay(StreamCategory.DEPLOYMENTS, before))
                .assertNext(e -> assertThat(e.subject()).isEqualTo("deploy.started"))
                .assertNext(e -> assertThat(e.subject()).isEqualTo("rollback.completed"))
                .verifyComplete();

        StepVerifier.create(bus.replay(StreamCategory.DEPLOYMENTS, Instant.now().plusSeconds(60)))
                .verifyComplete();
        assertThat(bus.stream(StreamCategory.BUILDS).size()).isEqualTo(1);
    }

    @Test
    void closedBusRejectsEverything() {
        bus.subscribe("audit.>", e -> Mono.empty());
        bus.close();

        assertThat(bus.isHealthy()).isFalse();
        assertThat(bus.subscriptionCount()).isZero();
        StepVerifier.create(bus.publish(EventSubject.AUDIT_LOG, event("audit.log")))
                .expectError(EventBusException.class)
                .verify();
        assertThatThrownBy(() -> bus.subscribe("audit.>", e -> Mono.empty()))
                .isInstanceOf(EventBusException.class);
        StepVerifier.create(bus.replay(StreamCategory.AUDIT, Instant.EPOCH))
                .expectError(EventBusException.class)
                .verify();
    }

    private static DomainEvent event(String type) {
        return DomainEvent.of(type, "test", Map.of("k", "v"), EventMetadata.correlatedBy("corr-1"));
    }

    private static EventHandler collect(List<DomainEvent> sink, CountDownLatch latch) {
        return e -> Mono.fromRunnable(() -> {
            sink.add(e);
            if (latch != null) {
                latch.countDown();
            }
        });
    }
}
