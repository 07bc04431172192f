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

package org.fireflyframework.journal.store;

import org.fireflyframework.journal.core.exception.ValidationException;
import org.fireflyframework.journal.core.model.NewEvent;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Structural checks applied to every batch before it reaches storage.
 */
public class EventValidator {

    public static final int DEFAULT_MAX_BATCH_SIZE = 1000;

    private final int maxBatchSize;

    public EventValidator(int maxBatchSize) {
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("maxBatchSize must be positive, got: " + maxBatchSize);
        }
        this.maxBatchSize = maxBatchSize;
    }

    public void validate(String streamId, long expectedVersion, List<NewEvent> events) {
        if (streamId == null || streamId.isBlank()) {
            throw new ValidationException("streamId must not be blank");
        }
        if (expectedVersion < 0) {
            throw new ValidationException("expectedVersion must not be negative",
                    Map.of("streamId", streamId, "expectedVersion", expectedVersion));
        }
        if (events == null || events.isEmpty()) {
            throw new ValidationException("Append to '" + streamId + "' requires at least one event",
                    Map.of("streamId", streamId));
        }
        if (events.size() > maxBatchSize) {
            throw new ValidationException("Batch of " + events.size() + " events exceeds the maximum of " + maxBatchSize,
                    Map.of("streamId", streamId));
        }
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < events.size(); i++) {
            NewEvent event = events.get(i);
            if (event == null) {
                throw invalid(streamId, i, "event is null");
            }
            if (event.eventId() == null || event.eventId().isBlank()) {
                throw invalid(streamId, i, "eventId is blank");
            }
            if (!ids.add(event.eventId())) {
                throw invalid(streamId, i, "duplicate eventId " + event.eventId() + " in batch");
            }
            if (event.eventType() == null || event.eventType().isBlank()) {
                throw invalid(streamId, i, "eventType is blank");
            }
            if (event.payload() == null) {
                throw invalid(streamId, i, "payload is null");
            }
            for (Map.Entry<String, String> entry : event.metadata().entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    throw invalid(streamId, i, "metadata contains a null key or value");
                }
            }
        }
    }

    private ValidationException invalid(String streamId, int index, String reason) {
        return new ValidationException("Invalid event #" + index + " for stream '" + streamId + "': " + reason,
                Map.of("streamId", streamId, "index", index));
    }
}
