/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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

package org.fireflyframework.journal.core.resilience;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import reactor.core.publisher.Mono;

/**
 * Guards outbound calls (saga step actions, event publication) with named circuit breakers.
 */
public class ResilienceDecorator {
    public static final String PUBLICATION = "journal.publication";

    private final CircuitBreakerRegistry circuitBreakerRegistry;

    public ResilienceDecorator(CircuitBreakerRegistry circuitBreakerRegistry) {
        this.circuitBreakerRegistry = circuitBreakerRegistry;
    }

    public <T> Mono<T> decorate(String name, Mono<T> mono) {
        CircuitBreaker cb = circuitBreakerRegistry.circuitBreaker(name);
        return mono.transformDeferred(CircuitBreakerOperator.of(cb));
    }

    public <T> Mono<T> decorateStep(String sagaName, String stepId, Mono<T> mono) {
        return decorate(sagaName + "." + stepId, mono);
    }

    public CircuitBreaker getCircuitBreaker(String name) {
        return circuitBreakerRegistry.circuitBreaker(name);
    }

    public void resetCircuitBreaker(String name) {
        circuitBreakerRegistry.circuitBreaker(name).reset();
    }
}
