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

package org.fireflyframework.journal.core.exception;

import java.util.Map;

public final class ProjectionHandlerException extends JournalException {

    private final String projectionName;
    private final String eventId;
    private final long globalPosition;

    public ProjectionHandlerException(String projectionName, String eventId, long globalPosition, Throwable cause) {
        super("Projection '" + projectionName + "' failed on event " + eventId + " at position " + globalPosition
                        + ": " + (cause != null ? cause.getMessage() : "unknown error"),
                "JOURNAL_PROJECTION_HANDLER_ERROR",
                Map.of("projection", projectionName, "eventId", eventId, "globalPosition", globalPosition),
                cause);
        this.projectionName = projectionName;
        this.eventId = eventId;
        this.globalPosition = globalPosition;
    }

    public String getProjectionName() { return projectionName; }
    public String getEventId() { return eventId; }
    public long getGlobalPosition() { return globalPosition; }
}
