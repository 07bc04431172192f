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

public enum StepStatus {
    PENDING,
    RUNNING,
    DONE,
    FAILED,
    TIMED_OUT,
    COMPENSATED,
    COMPENSATION_FAILED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == TIMED_OUT
                || this == COMPENSATED || this == COMPENSATION_FAILED;
    }

    public boolean isSuccessful() {
        return this == DONE || this == COMPENSATED;
    }
}
