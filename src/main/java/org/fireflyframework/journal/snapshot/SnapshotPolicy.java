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

package org.fireflyframework.journal.snapshot;

/**
 * Decides whether a save that moved a stream from one version to another
 * should produce a snapshot.
 */
@FunctionalInterface
public interface SnapshotPolicy {

    boolean shouldSnapshot(long previousVersion, long newVersion);

    static SnapshotPolicy never() {
        return (previous, current) -> false;
    }

    /**
     * Snapshot each time the stream crosses a multiple of {@code interval}.
     */
    static SnapshotPolicy everyNEvents(int interval) {
        if (interval <= 0) {
            throw new IllegalArgumentException("interval must be positive, got: " + interval);
        }
        return (previous, current) -> current / interval > previous / interval;
    }
}
