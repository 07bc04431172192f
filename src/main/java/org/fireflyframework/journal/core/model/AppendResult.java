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

import java.util.List;

/**
 * Outcome of a successful append.
 */
public record AppendResult(
        String streamId,
        long previousVersion,
        long newVersion,
        long firstPosition,
        long lastPosition,
        List<StoredEvent> events
) {
    public AppendResult {
        events = events != null ? List.copyOf(events) : List.of();
    }

    public static AppendResult noop(String streamId, long version) {
        return new AppendResult(streamId, version, version, 0, 0, List.of());
    }

    public int size() {
        return events.size();
    }
}
