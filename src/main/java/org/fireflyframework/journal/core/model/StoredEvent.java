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

package org.fireflyframework.journal.core.model;

import java.time.Instant;
import java.util.Map;

/**
 * A committed event. Never mutated or deleted once visible to readers.
 */
public record StoredEvent(
        String eventId,
        String streamId,
        String eventType,
        long streamVersion,
        long globalPosition,
        Instant timestamp,
        String causationId,
        String correlationId,
        Map<String, String> metadata,
        DomainEvent payload
) {
    public StoredEvent {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static StoredEvent commit(NewEvent event, String streamId, long streamVersion,
                                     long globalPosition, Instant timestamp) {
        return new StoredEvent(event.eventId(), streamId, event.eventType(), streamVersion, globalPosition,
                timestamp, event.causationId(), event.correlationId(), event.metadata(), event.payload());
    }

    public <E extends DomainEvent> E payloadAs(Class<E> type) {
        return type.cast(payload);
    }
}
