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

import io.nats.client.Connection;
import io.nats.client.Dispatcher;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.Subscription;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.DeliverPolicy;
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
import org.openpaas.orchestrator.eventbus.SubjectMatcher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Event bus backed by NATS. Publication goes through JetStream when enabled so that category
 * streams retain events; subscriptions and request/reply use core NATS through a shared dispatcher.
 */
@Slf4j
public class NatsEventBus implements EventBus {

    public record Settings(boolean jetStreamEnabled, Duration publishTimeout, Duration handlerTimeout,
                           Duration drainTimeout, int replayBatchSize) {}

    private final Connection connection;
    private final JetStream jetStream;
    private final EventSerializer serializer;
    private final Settings settings;
    private final Clock clock;
    private final List<NatsSubscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Dispatcher dispatcher;

    public NatsEventBus(Connection connection, EventSerializer serializer, Settings settings, Clock clock) {
        this.connection = connection;
        this.serializer = serializer;
        this.settings = settings;
        this.clock = clock;
        this.jetStream = settings.jetStreamEnabled() ? openJetStream(connection) : null;
    }

    @Override
    public Mono<Void> publish(EventSubject subject, DomainEvent event) {
        return Mono.<Void>defer(() -> {
            ensureOpen();
            DomainEvent stamped = event.stamped(subject.subject(), clock.instant());
            byte[] payload = serializer.serialize(stamped);
            Mono<Void> send = jetStream != null
                    ? Mono.fromFuture(() -> jetStream.publishAsync(subject.subject(), payload)).then()
                    : Mono.fromRunnable(() -> connection.publish(subject.subject(), payload));
            return send
                    .timeout(settings.publishTimeout())
                    .doOnSuccess(v -> log.debug("[event-bus] Event published subject={} eventId={} type={}",
                            subject.subject(), stamped.id(), stamped.type()));
        }).onErrorMap(e -> !(e instanceof EventBusException),
                e -> new EventBusException("Failed to publish event subject=" + subject.subject(), e));
    }

    @Override
    public EventSubscription subscribe(String pattern, EventHandler handler) {
        ensureOpen();
        SubjectMatcher.validatePattern(pattern);
        Subscription sub = dispatcher().subscribe(pattern, msg -> onMessage(msg, handler));
        log.debug("[event-bus] Subscribed pattern={}", pattern);
        return track(new NatsSubscription(pattern, null, sub));
    }

    @Override
    public EventSubscription queueSubscribe(String pattern, String queue, EventHandler handler) {
        if (queue == null || queue.isBlank()) {
            throw new IllegalArgumentException("Queue group name must not be blank");
        }
        ensureOpen();
        SubjectMatcher.validatePattern(pattern);
        Subscription sub = dispatcher().subscribe(pattern, queue, msg -> onMessage(msg, handler));
        log.debug("[event-bus] Queue subscribed pattern={} queue={}", pattern, queue);
        return track(new NatsSubscription(pattern, queue, sub));
    }

    @Override
    public Mono<DomainEvent> request(String subject, DomainEvent event, Duration timeout) {
        return Mono.<DomainEvent>defer(() -> {
            ensureOpen();
            byte[] payload = serializer.serialize(event.stamped(subject, clock.instant()));
            return Mono.fromFuture(() -> connection.request(subject, payload))
                    .timeout(timeout)
                    .map(reply -> serializer.deserialize(reply.getData()));
        }).onErrorMap(e -> !(e instanceof EventBusException), e -> e instanceof TimeoutException
                ? new EventBusException("Request timed out after " + timeout.toMillis() + "ms subject=" + subject, e)
                : new EventBusException("Request failed subject=" + subject, e));
    }

    @Override
    public EventSubscription respond(String subject, RequestHandler handler) {
        ensureOpen();
        SubjectMatcher.validatePattern(subject);
        Subscription sub = dispatcher().subscribe(subject, msg -> onRequest(msg, handler));
        log.debug("[event-bus] Responder registered subject={}", subject);
        return track(new NatsSubscription(subject, null, sub));
    }

    @Override
    public Flux<DomainEvent> replay(StreamCategory category, Instant since) {
        return Flux.<DomainEvent>defer(() -> {
            ensureOpen();
            if (jetStream == null) {
                return Flux.error(new EventBusException("Replay requires JetStream"));
            }
            List<DomainEvent> events = new ArrayList<>();
            for (String filter : category.subjects()) {
                events.addAll(fetchSince(category, filter, since));
            }
            events.sort(Comparator.comparing(DomainEvent::timestamp, Comparator.nullsFirst(Comparator.naturalOrder())));
            return Flux.fromIterable(events);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public boolean isHealthy() {
        return !closed.get() && connection.getStatus() == Connection.Status.CONNECTED;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (NatsSubscription sub : subscriptions) {
            try {
                sub.unsubscribe();
            } catch (RuntimeException e) {
                log.warn("[event-bus] Failed to unsubscribe pattern={} error={}", sub.pattern(), e.getMessage());
            }
        }
        subscriptions.clear();
        try {
            connection.drain(settings.drainTimeout()).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[event-bus] Interrupted while draining NATS connection");
        } catch (TimeoutException | ExecutionException e) {
            log.warn("[event-bus] Failed to drain NATS connection: {}", e.getMessage());
        }
        log.info("[event-bus] NATS event bus closed");
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    private List<DomainEvent> fetchSince(StreamCategory category, String filter, Instant since) {
        ConsumerConfiguration consumer = ConsumerConfiguration.builder()
                .deliverPolicy(DeliverPolicy.ByStartTime)
                .startTime(since.atZone(ZoneOffset.UTC))
                .ackPolicy(AckPolicy.Explicit)
                .build();
        PullSubscribeOptions options = PullSubscribeOptions.builder()
                .stream(category.streamName())
                .configuration(consumer)
                .build();
        List<DomainEvent> events = new ArrayList<>();
        try {
            JetStreamSubscription sub = jetStream.subscribe(filter, options);
            try {
                List<Message> batch;
                do {
                    batch = sub.fetch(settings.replayBatchSize(), Duration.ofSeconds(1));
                    for (Message msg : batch) {
                        events.add(serializer.deserialize(msg.getData()));
                        msg.ack();
                    }
                } while (batch.size() == settings.replayBatchSize());
            } finally {
                sub.unsubscribe();
            }
        } catch (IOException | JetStreamApiException e) {
            throw new EventBusException("Failed to replay stream " + category.streamName() + " filter=" + filter, e);
        }
        return events;
    }

    private void onMessage(Message msg, EventHandler handler) {
        DomainEvent event;
        try {
            event = serializer.deserialize(msg.getData());
        } catch (EventBusException e) {
            log.error("[event-bus] Failed to unmarshal event subject={} error={}", msg.getSubject(), e.getMessage());
            return;
        }
        try {
            handler.handle(event).block(settings.handlerTimeout());
        } catch (RuntimeException e) {
            log.error("[event-bus] Event handler error subject={} eventId={} error={}",
                    msg.getSubject(), event.id(), e.getMessage(), e);
        }
    }

    private void onRequest(Message msg, RequestHandler handler) {
        if (msg.getReplyTo() == null) {
            log.warn("[event-bus] Request without reply subject ignored subject={}", msg.getSubject());
            return;
        }
        try {
            DomainEvent request = serializer.deserialize(msg.getData());
            DomainEvent reply = handler.handle(request).block(settings.handlerTimeout());
            if (reply == null) {
                log.warn("[event-bus] Responder produced no reply subject={} eventId={}", msg.getSubject(), request.id());
                return;
            }
            connection.publish(msg.getReplyTo(), serializer.serialize(reply.stamped(msg.getReplyTo(), clock.instant())));
        } catch (RuntimeException e) {
            log.error("[event-bus] Responder error subject={} error={}", msg.getSubject(), e.getMessage(), e);
        }
    }

    private Dispatcher dispatcher() {
        Dispatcher d = dispatcher;
        if (d == null) {
            synchronized (this) {
                d = dispatcher;
                if (d == null) {
                    d = connection.createDispatcher();
                    dispatcher = d;
                }
            }
        }
        return d;
    }

    private NatsSubscription track(NatsSubscription subscription) {
        subscriptions.add(subscription);
        return subscription;
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new EventBusException("Event bus is closed");
        }
    }

    private static JetStream openJetStream(Connection connection) {
        try {
            return connection.jetStream();
        } catch (IOException e) {
            throw new EventBusException("Failed to open JetStream context", e);
        }
    }

    private final class NatsSubscription implements EventSubscription {
        private final String pattern;
        private final String queue;
        private final Subscription subscription;
        private final AtomicBoolean active = new AtomicBoolean(true);

        private NatsSubscription(String pattern, String queue, Subscription subscription) {
            this.pattern = pattern;
            this.queue = queue;
            this.subscription = subscription;
        }

        @Override public String pattern() { return pattern; }
        @Override public String queue() { return queue; }
        @Override public boolean isActive() { return active.get(); }

        @Override
        public void unsubscribe() {
            if (active.compareAndSet(true, false)) {
                dispatcher().unsubscribe(subscription);
                subscriptions.remove(this);
            }
        }
    }
}
