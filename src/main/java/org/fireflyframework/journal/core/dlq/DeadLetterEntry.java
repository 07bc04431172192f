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

package org.fireflyframework.journal.core.dlq;

import org.fireflyframework.journal.core.model.StoredEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * A failure isolated for operator attention.
 *
 * @param source    projection name or saga name
 * @param reference event id for projections, saga id for sagas
 * @param event     the offending event, if the failure was tied to one
 * @param stepId    saga step whose compensation failed, if any
 */
public record DeadLetterEntry(
        String id,
        String source,
        DeadLetterKind kind,
        String reference,
        StoredEvent event,
        String stepId,
        String errorMessage,
        String errorType,
        int retryCount,
        Instant createdAt,
        Instant lastRetriedAt
) {
    public static DeadLetterEntry forProjection(String projectionName, StoredEvent event, Throwable error) {
        return new DeadLetterEntry(
                UUID.randomUUID().toString(), projectionName, DeadLetterKind.PROJECTION, event.eventId(), event, null,
                error != null ? error.getMessage() : null,
                error != null ? error.getClass().getName() : null,
                0, Instant.now(), null);
    }

    public static DeadLetterEntry forSaga(String sagaName, String sagaId, String stepId, Throwable error) {
        return new DeadLetterEntry(
                UUID.randomUUID().toString(), sagaName, DeadLetterKind.SAGA, sagaId, null, stepId,
                error != null ? error.getMessage() : null,
                error != null ? error.getClass().getName() : null,
                0, Instant.now(), null);
    }

    public DeadLetterEntry withRetry() {
        return new DeadLetterEntry(id, source, kind, reference, event, stepId,
                errorMessage, errorType, retryCount + 1, createdAt, Instant.now());
    }
}
