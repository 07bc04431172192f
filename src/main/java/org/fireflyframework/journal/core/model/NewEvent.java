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

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An event proposed for append. The store assigns stream version, global
 * position and commit timestamp.
 */
public record NewEvent(
        String eventId,
        String eventType,
        DomainEvent payload,
        String causationId,
        String correlationId,
        Map<String, String> metadata
) {
    public NewEvent {
        // null entries are kept so validation can reject them with a proper error
        metadata = metadata != null ? Collections.unmodifiableMap(new HashMap<>(metadata)) : Map.of();
    }

    public static NewEvent of(DomainEvent payload) {
        return new NewEvent(UUID.randomUUID().toString(), payload.eventType(), payload, null, null, Map.of());
    }

    public static NewEvent of(DomainEvent payload, CommandMetadata command) {
        CommandMetadata meta = command != null ? command : CommandMetadata.empty();
        return new NewEvent(UUID.randomUUID().toString(), payload.eventType(), payload,
                meta.causationId(), meta.correlationId(), meta.metadata());
    }
}
