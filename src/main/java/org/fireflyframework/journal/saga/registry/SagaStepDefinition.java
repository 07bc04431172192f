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

package org.fireflyframework.journal.saga.registry;

import org.fireflyframework.journal.saga.engine.SagaContext;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.function.BiFunction;
import java.util.function.Function;

public class SagaStepDefinition {

    public final String id;
    public final Function<SagaContext, Mono<?>> action;
    public final BiFunction<Object, SagaContext, Mono<Void>> compensation;
    /** {@code null} falls back to the coordinator's step timeout. */
    public final Duration timeout;
    /** {@code null} falls back to the coordinator's compensation timeout. */
    public final Duration compensationTimeout;

    public SagaStepDefinition(String id, Function<SagaContext, Mono<?>> action,
                              BiFunction<Object, SagaContext, Mono<Void>> compensation,
                              Duration timeout, Duration compensationTimeout) {
        this.id = id;
        this.action = action;
        this.compensation = compensation;
        this.timeout = timeout;
        this.compensationTimeout = compensationTimeout;
    }

    public boolean hasCompensation() {
        return compensation != null;
    }
}
