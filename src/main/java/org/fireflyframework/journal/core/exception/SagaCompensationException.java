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
 * A compensation action failed. The saga is left in a terminal state for an operator.
 */
public final class SagaCompensationException extends JournalException {

    private final String stepId;

    public SagaCompensationException(String sagaId, String stepId, Throwable cause) {
        super("Saga '" + sagaId + "' compensation of step '" + stepId + "' failed: "
                        + SagaStepException.describe(cause),
                "JOURNAL_SAGA_COMPENSATION_FAILURE", Map.of("sagaId", sagaId, "stepId", stepId), cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }
}
