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

package org.fireflyframework.journal.saga.engine;

import java.time.Duration;

/**
 * @param streamPrefix prepended to the saga id to name the saga's progress stream
 */
public record SagaSettings(String streamPrefix, Duration stepTimeout, Duration compensationTimeout) {

    public SagaSettings {
        streamPrefix = streamPrefix != null ? streamPrefix : "saga-";
        stepTimeout = stepTimeout != null ? stepTimeout : Duration.ofSeconds(30);
        compensationTimeout = compensationTimeout != null ? compensationTimeout : Duration.ofSeconds(30);
    }

    public static SagaSettings defaults() {
        return new SagaSettings(null, null, null);
    }
}
