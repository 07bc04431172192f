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

package org.fireflyframework.journal.saga.builder;

import org.fireflyframework.journal.saga.engine.SagaContext;
import org.fireflyframework.journal.saga.registry.SagaDefinition;
import org.fireflyframework.journal.saga.registry.SagaStepDefinition;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Fluent builder for saga definitions.
 *
 * <p>Usage:
 * <pre>{@code
 * SagaDefinition def = SagaBuilder.saga("PlaceOrder")
 *     .step("reserve").handler(ctx -> inventory.reserve(ctx.input(Order.class)))
 *         .compensation((reservation, ctx) -> inventory.release(reservation)).add()
 *     .step("charge").handler(ctx -> payments.charge(ctx.input(Order.class)))
 *         .compensationCtx(ctx -> payments.refund(ctx.sagaId())).timeoutMs(5_000).add()
 *     .step("ship").handler(ctx -> shipping.dispatch(ctx.input(Order.class))).add()
 *     .build();
 * }</pre>
 */
public class SagaBuilder {

    private final SagaDefinition saga;

    private SagaBuilder(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Saga name must not be blank");
        }
        this.saga = new SagaDefinition(name);
    }

    public static SagaBuilder saga(String name) {
        return new SagaBuilder(name);
    }

    public Step step(String id) {
        return new Step(id);
    }

    public SagaDefinition build() {
        if (saga.steps.isEmpty()) {
            throw new IllegalStateException("Saga '" + saga.name + "' has no steps");
        }
        return saga;
    }

    public class Step {
        private final String id;
        private Duration timeout;
        private Duration compensationTimeout;
        private Function<SagaContext, Mono<?>> handler;
        private BiFunction<Object, SagaContext, Mono<Void>> compensationFn;

        private Step(String id) {
            this.id = id;
        }

        public Step timeout(Duration timeout) { this.timeout = timeout; return this; }
        public Step timeoutMs(long ms) { this.timeout = ms > 0 ? Duration.ofMillis(ms) : null; return this; }
        public Step compensationTimeout(Duration d) { this.compensationTimeout = d; return this; }

        public Step handler(Function<SagaContext, Mono<?>> fn) {
            this.handler = fn;
            return this;
        }

        public Step handler(Supplier<Mono<?>> fn) {
            this.handler = ctx -> fn.get();
            return this;
        }

        /**
         * Compensation receiving the result the step produced.
         */
        public Step compensation(BiFunction<Object, SagaContext, Mono<Void>> fn) {
            this.compensationFn = fn;
            return this;
        }

        public Step compensationCtx(Function<SagaContext, Mono<Void>> fn) {
            this.compensationFn = (result, ctx) -> fn.apply(ctx);
            return this;
        }

        public Step compensation(Supplier<Mono<Void>> fn) {
            this.compensationFn = (result, ctx) -> fn.get();
            return this;
        }

        public SagaBuilder add() {
            if (id == null || id.isBlank()) {
                throw new IllegalStateException("Step id must not be blank in saga '" + saga.name + "'");
            }
            if (this.handler == null) {
                throw new IllegalStateException("Missing handler for step '" + id + "' in saga '" + saga.name + "'");
            }
            SagaStepDefinition sd = new SagaStepDefinition(id, handler, compensationFn, timeout, compensationTimeout);
            if (saga.steps.putIfAbsent(id, sd) != null) {
                throw new IllegalStateException("Duplicate step id '" + id + "' in saga '" + saga.name + "'");
            }
            return SagaBuilder.this;
        }
    }
}
