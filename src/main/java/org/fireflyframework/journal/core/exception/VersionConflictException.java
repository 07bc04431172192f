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

/**
 * Optimistic-concurrency violation: the stream moved on since the caller loaded it.
 * The caller must reload and reapply its command.
 */
public final class VersionConflictException extends JournalException {

    private final String streamId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String streamId, long expectedVersion, long actualVersion) {
        super("Stream '" + streamId + "' is at version " + actualVersion + ", expected " + expectedVersion,
                "JOURNAL_VERSION_CONFLICT",
                Map.of("streamId", streamId, "expectedVersion", expectedVersion, "actualVersion", actualVersion),
                null);
        this.streamId = streamId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getStreamId() { return streamId; }
    public long getExpectedVersion() { return expectedVersion; }
    public long getActualVersion() { return actualVersion; }
}
