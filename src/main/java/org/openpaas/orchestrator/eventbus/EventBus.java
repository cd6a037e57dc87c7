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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Typed publish/subscribe transport for domain events.
 *
 * <p>Publication is at-most-once from the caller's point of view: a failed publish is reported as
 * an error signal and is never retried by the bus. Operations on a closed bus fail with
 * {@link org.openpaas.orchestrator.core.exception.EventBusException}.
 */
public interface EventBus extends AutoCloseable {

    /**
     * Publishes {@code event} on {@code subject}, assigning id, subject and timestamp when absent.
     */
    Mono<Void> publish(EventSubject subject, DomainEvent event);

    /**
     * Delivers every event whose subject matches {@code pattern} to {@code handler}.
     */
    EventSubscription subscribe(String pattern, EventHandler handler);

    /**
     * Delivers each matching event to exactly one member of the {@code queue} group.
     */
    EventSubscription queueSubscribe(String pattern, String queue, EventHandler handler);

    /**
     * Sends a request and waits up to {@code timeout} for the first reply.
     */
    Mono<DomainEvent> request(String subject, DomainEvent event, Duration timeout);

    /**
     * Registers a responder for requests on {@code subject}.
     */
    EventSubscription respond(String subject, RequestHandler handler);

    /**
     * Re-reads events retained in a category stream, oldest first, starting at {@code since}.
     */
    Flux<DomainEvent> replay(StreamCategory category, Instant since);

    boolean isHealthy();

    @Override
    void close();
}
