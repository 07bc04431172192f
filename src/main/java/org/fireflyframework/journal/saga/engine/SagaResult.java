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

import org.fireflyframework.journal.core.model.SagaStatus;
import org.fireflyframework.journal.core.model.StepStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable snapshot of a saga instance once it stopped making progress.
 */
public final class SagaResult {

    private final String sagaName;
    private final String sagaId;
    private final SagaStatus status;
    private final Map<String, StepOutcome> steps;
    private final List<String> compensatedSteps;
    private final String failedStepId;
    private final String errorMessage;
    private final Throwable error;

    public record StepOutcome(StepStatus status, Object result) {}

    private SagaResult(String sagaName, String sagaId, SagaStatus status, Map<String, StepOutcome> steps,
                       List<String> compensatedSteps, String failedStepId, String errorMessage, Throwable error) {
        this.sagaName = sagaName;
        this.sagaId = sagaId;
        this.status = status;
        this.steps = steps;
        this.compensatedSteps = compensatedSteps;
        this.failedStepId = failedStepId;
        this.errorMessage = errorMessage;
        this.error = error;
    }

    public String sagaName() { return sagaName; }
    public String sagaId() { return sagaId; }
    public SagaStatus status() { return status; }
    public boolean isSuccess() { return status == SagaStatus.COMPLETED; }
    public Map<String, StepOutcome> steps() { return steps; }

    /**
     * Steps undone during compensation, in the order they were compensated.
     */
    public List<String> compensatedSteps() { return compensatedSteps; }

    public Optional<String> failedStepId() { return Optional.ofNullable(failedStepId); }
    public Optional<String> errorMessage() { return Optional.ofNullable(errorMessage); }

    /**
     * The exception that ended this run. Empty for results rebuilt from the saga stream.
     */
    public Optional<Throwable> error() { return Optional.ofNullable(error); }

    public <T> Optional<T> resultOf(String stepId, Class<T> type) {
        Objects.requireNonNull(stepId, "stepId");
        Objects.requireNonNull(type, "type");
        StepOutcome out = steps.get(stepId);
        if (out == null || out.result() == null) return Optional.empty();
        return type.isInstance(out.result()) ? Optional.of(type.cast(out.result())) : Optional.empty();
    }

    public static SagaResult from(SagaState state, Throwable error) {
        Map<String, StepOutcome> stepMap = new LinkedHashMap<>();
        state.stepLog().forEach((stepId, stepStatus) ->
                stepMap.put(stepId, new StepOutcome(stepStatus, state.results().get(stepId))));
        return new SagaResult(state.sagaName(), state.sagaId(), state.status(),
                Collections.unmodifiableMap(stepMap), state.compensatedSteps(),
                state.failedStepId(), state.error(), error);
    }
}
