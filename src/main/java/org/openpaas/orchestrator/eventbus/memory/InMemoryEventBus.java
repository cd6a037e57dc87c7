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

package org.openpaas.orchestrator.eventbus.memory;

import lombok.extern.slf4j.Slf4j;
import org.openpaas.orchestrator.core.exception.EventBusException;
import org.openpaas.orchestrator.eventbus.DomainEvent;
import org.openpaas.orchestrator.eventbus.EventBus;
import org.openpaas.orchestrator.eventbus.EventHandler;
import org.openpaas.orchestrator.eventbus.EventSerializer;
import org.openpaas.orchestrator.eventbus.EventSubject;
import org.openpaas.orchestrator.eventbus.EventSubscription;
import org.openpaas.orchestrator.eventbus.RequestHandler;
import org.openpaas.orchestrator.eventbus.StreamCategory;
import org.openpaas.orchestrator.eventbus.StreamSettings;
import org.openpaas.orchestrator.eventbus.SubjectMatcher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process event bus. Every published event is serialized, appended to its category stream
 * and dispatched to matching subscribers on the delivery scheduler.
 */
@Slf4j
public class InMemoryEventBus implements EventBus {

    private final EventSerializer serializer;
    private final Scheduler deliveryScheduler;
    private final Clock clock;
    private final Map<StreamCategory, DurableStream> streams = new EnumMap<>(StreamCategory.class);
    private final List<MemorySubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final List<MemoryResponder> responders = new CopyOnWriteArrayList<>();
    private final ConcurrentHashMap<String, AtomicLong> roundRobin = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public InMemoryEventBus(EventSerializer serializer, StreamSettings streamSettings,
                            Scheduler deliveryScheduler, Clock clock) {
        this.serializer = serializer;
        this.deliveryScheduler = deliveryScheduler;
        this.clock = clock;
        for (StreamCategory category : StreamCategory.values()) {
            streams.put(category, new DurableStream(category, streamSettings, clock));
        }
    }

    @Override
    public Mono<Void> publish(EventSubject subject, DomainEvent event) {
        return Mono.<Void>defer(() -> {
            ensureOpen();
            DomainEvent stamped = event.stamped(subject.subject(), clock.instant());
            byte[] payload = serializer.serialize(stamped);
            streams.get(subject.category()).append(subject.subject(), payload);
            dispatch(subject.subject(), stamped);
            log.debug("[event-bus] Event published subject={} eventId={} type={}",
                    subject.subject(), stamped.id(), stamped.type());
            return Mono.empty();
        });
    }

    @Override
    public EventSubscription subscribe(String pattern, EventHandler handler) {
        return register(pattern, null, handler);
    }

    @Override
    public EventSubscription queueSubscribe(String pattern, String queue, EventHandler handler) {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("Queue group name must not be blank");
        }
        return register(pattern, queue, handler);
    }

    @Override
    public Mono<DomainEvent> request(String subject, DomainEvent event, Duration timeout) {
        return Mono.<DomainEvent>defer(() -> {
            ensureOpen();
            List<MemoryResponder> candidates = responders.stream()
                    .filter(r -> r.isActive() && SubjectMatcher.matches(r.pattern, subject))
                    .toList();
            if (candidates.isEmpty()) {
                return Mono.error(new EventBusException("No responders for subject " + subject));
            }
            MemoryResponder responder = candidates.get(
                    (int) (roundRobin.computeIfAbsent("_request." + subject, k -> new AtomicLong())
                            .getAndIncrement() % candidates.size()));
            DomainEvent stamped = event.stamped(subject, clock.instant());
            return responder.handler.handle(stamped)
                    .subscribeOn(deliveryScheduler)
                    .switchIfEmpty(Mono.error(new EventBusException("Empty reply for subject " + subject)));
        })
        .timeout(timeout)
        .onErrorMap(TimeoutException.class,
                e -> new EventBusException("Request timed out after " + timeout.toMillis() + "ms subject=" + subject, e));
    }

    @Override
    public EventSubscription respond(String subject, RequestHandler handler) {
        ensureOpen();
        SubjectMatcher.validatePattern(subject);
        MemoryResponder responder = new MemoryResponder(subject, handler);
        responders.add(responder);
        log.debug("[event-bus] Responder registered subject={}", subject);
        return responder;
    }

    @Override
    public Flux<DomainEvent> replay(StreamCategory category, Instant since) {
        return Flux.defer(() -> {
            ensureOpen();
            return Flux.fromIterable(streams.get(category).since(since))
                    .map(m -> serializer.deserialize(m.payload()));
        });
    }

    @Override
    public boolean isHealthy() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        subscriptions.forEach(MemorySubscription::unsubscribe);
        responders.forEach(MemoryResponder::unsubscribe);
        log.info("[event-bus] In-memory event bus closed");
    }

    public DurableStream stream(StreamCategory category) {
        return streams.get(category);
    }

    public int subscriptionCount() {
        return (int) subscriptions.stream().filter(MemorySubscription::isActive).count();
    }

    private EventSubscription register(String pattern, String queue, EventHandler handler) {
        ensureOpen();
        SubjectMatcher.validatePattern(pattern);
        MemorySubscription subscription = new MemorySubscription(pattern, queue, handler);
        subscriptions.add(subscription);
        log.debug("[event-bus] Subscribed pattern={} queue={}", pattern, queue);
        return subscription;
    }

    private void dispatch(String subject, DomainEvent event) {
        Map<String, List<MemorySubscription>> groups = new LinkedHashMap<>();
        for (MemorySubscription sub : subscriptions) {
            if (!sub.isActive() || !SubjectMatcher.matches(sub.pattern, subject)) {
                continue;
            }
            if (sub.queue == null) {
                deliver(sub, event);
            } else {
                groups.computeIfAbsent(sub.pattern + "|" + sub.queue, k -> new ArrayList<>()).add(sub);
            }
        }
        // a group is one queue name on one pattern
        groups.forEach((group, members) -> {
            long turn = roundRobin.computeIfAbsent(group, k -> new AtomicLong()).getAndIncrement();
            deliver(members.get((int) (turn % members.size())), event);
        });
    }

    private void deliver(MemorySubscription sub, DomainEvent event) {
        Mono.defer(() -> sub.handler.handle(event))
                .subscribeOn(deliveryScheduler)
                .subscribe(
                        v -> { },
                        e -> log.error("[event-bus] Event handler error subject={} eventId={} error={}",
                                event.subject(), event.id(), e.getMessage(), e));
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new EventBusException("Event bus is closed");
        }
    }

    private final class MemorySubscription implements EventSubscription {
        private final String pattern;
        private final String queue;
        private final EventHandler handler;
        private volatile boolean active = true;

        private MemorySubscription(String pattern, String queue, EventHandler handler) {
            this.pattern = pattern;
            this.queue = queue;
            this.handler = handler;
        }

        @Override public String pattern() { return pattern; }
        @Override public String queue() { return queue; }
        @Override public boolean isActive() { return active; }

        @Override
        public void unsubscribe() {
            active = false;
            subscriptions.remove(this);
        }
    }

    private final class MemoryResponder implements EventSubscription {
        private final String pattern;
        private final RequestHandler handler;
        private volatile boolean active = true;

        private MemoryResponder(String pattern, RequestHandler handler) {
            this.pattern = pattern;
            this.handler = handler;
        }

        @Override public String pattern() { return pattern; }
        @Override public String queue() { return null; }
        @Override public boolean isActive() { return active; }

        @Override
        public void unsubscribe() {
            active = false;
            responders.remove(this);
        }
    }
}
