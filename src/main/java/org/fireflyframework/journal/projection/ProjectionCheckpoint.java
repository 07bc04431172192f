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

package org.fireflyframework.journal.projection;

import org.fireflyframework.journal.core.model.ProjectionStatus;

import java.time.Instant;

/**
 * Last global position a projection has fully processed.
 *
 * <p>A checkpoint stored as {@code REBUILDING} keeps the position of the live model; the
 * rebuilt position is only stored when the new model is swapped in.
 */
public record ProjectionCheckpoint(
        String projectionName,
        long position,
        ProjectionStatus status,
        Instant updatedAt
) {
    public static ProjectionCheckpoint of(String projectionName, long position, ProjectionStatus status) {
        return new ProjectionCheckpoint(projectionName, position, status, Instant.now());
    }
}
