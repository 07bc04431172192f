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

import java.time.Duration;

/**
 * Tuning shared by all workers of an engine.
 *
 * @param parallelism  stream partitions of a batch handled at once; above 1 the handler must be thread-safe
 * @param pollInterval fallback wake-up when commit notifications are missed; {@code null} disables polling
 */
public record ProjectionSettings(
        int batchSize,
        int parallelism,
        Duration pollInterval,
        ProjectionFailurePolicy failurePolicy
) {
    public ProjectionSettings {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got: " + batchSize);
        }
        if (parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be positive, got: " + parallelism);
        }
        failurePolicy = failurePolicy != null ? failurePolicy : ProjectionFailurePolicy.SKIP;
    }

    public static ProjectionSettings defaults() {
        return new ProjectionSettings(256, 1, Duration.ofSeconds(5), ProjectionFailurePolicy.SKIP);
    }

    public ProjectionSettings withFailurePolicy(ProjectionFailurePolicy policy) {
        return new ProjectionSettings(batchSize, parallelism, pollInterval, policy);
    }

    public ProjectionSettings withParallelism(int value) {
        return new ProjectionSettings(batchSize, value, pollInterval, failurePolicy);
    }

    public ProjectionSettings withBatchSize(int value) {
        return new ProjectionSettings(value, parallelism, pollInterval, failurePolicy);
    }
}
