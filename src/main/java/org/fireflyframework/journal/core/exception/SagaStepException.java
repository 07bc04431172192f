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

public final class SagaStepException extends JournalException {

    private final String stepId;

    public SagaStepException(String sagaId, String stepId, Throwable cause) {
        super("Saga '" + sagaId + "' step '" + stepId + "' failed: " + describe(cause),
                "JOURNAL_SAGA_STEP_FAILURE", Map.of("sagaId", sagaId, "stepId", stepId), cause);
        this.stepId = stepId;
    }

    public String getStepId() {
        return stepId;
    }

    public static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
