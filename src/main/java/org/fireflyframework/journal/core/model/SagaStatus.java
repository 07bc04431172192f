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

public enum SagaStatus {
    NOT_STARTED,
    RUNNING,
    COMPLETED,
    COMPENSATING,
    COMPENSATED,
    COMPENSATION_FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPENSATED || this == COMPENSATION_FAILED;
    }

    public boolean isActive() {
        return this == RUNNING || this == COMPENSATING;
    }

    /**
     * Terminal states that need an operator before anything else can happen.
     */
    public boolean requiresIntervention() {
        return this == COMPENSATION_FAILED;
    }
}
