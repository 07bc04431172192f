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

package org.fireflyframework.journal.saga.event;

import org.fireflyframework.journal.core.model.DomainEvent;

import java.time.Instant;

/**
 * Progress of one saga instance, appended to the saga's own stream.
 *
 * <p>The stream is the saga's durable state: replaying it reconstructs how far the
 * forward walk or the compensation walk got, which is what recovery resumes from.
 */
public sealed interface SagaEvent extends DomainEvent permits
        SagaStartedEvent, StepStartedEvent, StepCompletedEvent, StepFailedEvent,
        CompensationStartedEvent, StepCompensatedEvent, StepCompensationFailedEvent,
        SagaCompletedEvent, SagaCompensatedEvent, SagaCompensationFailedEvent {

    String sagaId();

    Instant timestamp();
}
