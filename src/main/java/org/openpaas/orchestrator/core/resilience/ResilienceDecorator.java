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

package org.openpaas.orchestrator.core.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Wraps adapter calls in a circuit breaker named {@code adapter.operation}, e.g. {@code gitops.sync}.
 */
public class ResilienceDecorator {
    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public ResilienceDecorator(CircuitBreakerRegistry circuitBreakerRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    public <T> Mono<T> decorate(String adapter, String operation, Mono<T> mono) {
        return mono.transformDeferred(CircuitBreakerOperator.of(getCircuitBreaker(adapter, operation)));
    }

    public <T> Flux<T> decorate(String adapter, String operation, Flux<T> flux) {
        return flux.transformDeferred(CircuitBreakerOperator.of(getCircuitBreaker(adapter, operation)));
    }

    public CircuitBreaker getCircuitBreaker(String adapter, String operation) {
        return circuitBreakerRegistry.circuitBreaker(adapter + "." + operation);
    }

    public void resetCircuitBreaker(String adapter, String operation) {
        getCircuitBreaker(adapter, operation).reset();
    }
}
