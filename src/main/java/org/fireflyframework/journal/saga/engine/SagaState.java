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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Replayed state of a saga instance.
 *
 * @param stepIndex        index of the next step to run; a step that started but never completed is re-run
 * @param stepLog          status of each step touched so far, in first-touch order
 * @param completedSteps   steps whose action succeeded, in execution order
 * @param compensatedSteps steps undone so far, in compensation order
 */
public record SagaState(
        String sagaId,
        String sagaName,
        SagaStatus status,
        int stepIndex,
        Object input,
        Map<String, StepStatus> stepLog,
        Map<String, Object> results,
        List<String> completedSteps,
        List<String> compensatedSteps,
        String failedStepId,
        String error
) {
    public SagaState {
        stepLog = Collections.unmodifiableMap(new LinkedHashMap<>(stepLog));
        results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
        completedSteps = List.copyOf(completedSteps);
        compensatedSteps = List.copyOf(compensatedSteps);
    }

    public static SagaState initial() {
        return new SagaState(null, null, SagaStatus.NOT_STARTED, 0, null,
                Map.of(), Map.of(), List.of(), List.of(), null, null);
    }

    /**
     * Completed steps not yet compensated, most recent first.
     */
    public List<String> pendingCompensations() {
        List<String> pending = new ArrayList<>(completedSteps);
        pending.removeAll(compensatedSteps);
        Collections.reverse(pending);
        return pending;
    }

    SagaState started(String id, String name, Object sagaInput) {
        return new SagaState(id, name, SagaStatus.RUNNING, 0, sagaInput,
                Map.of(), Map.of(), List.of(), List.of(), null, null);
    }

    SagaState withStatus(SagaStatus next) {
        return new SagaState(sagaId, sagaName, next, stepIndex, input, stepLog, results,
                completedSteps, compensatedSteps, failedStepId, error);
    }

    SagaState withStep(String stepId, StepStatus stepStatus) {
        Map<String, StepStatus> log = new LinkedHashMap<>(stepLog);
        log.put(stepId, stepStatus);
        return new SagaState(sagaId, sagaName, status, stepIndex, input, log, results,
                completedSteps, compensatedSteps, failedStepId, error);
    }

    SagaState withCompleted(String stepId, int index, Object result) {
        Map<String, StepStatus> log = new LinkedHashMap<>(stepLog);
        log.put(stepId, StepStatus.DONE);
        Map<String, Object> res = new LinkedHashMap<>(results);
        if (result != null) {
            res.put(stepId, result);
        }
        List<String> done = new ArrayList<>(completedSteps);
        done.add(stepId);
        return new SagaState(sagaId, sagaName, status, index + 1, input, log, res,
                done, compensatedSteps, failedStepId, error);
    }

    SagaState withFailure(String stepId, StepStatus stepStatus, String message) {
        Map<String, StepStatus> log = new LinkedHashMap<>(stepLog);
        log.put(stepId, stepStatus);
        return new SagaState(sagaId, sagaName, status, stepIndex, input, log, results,
                completedSteps, compensatedSteps, stepId, message);
    }

    SagaState withCompensated(String stepId) {
        Map<String, StepStatus> log = new LinkedHashMap<>(stepLog);
        log.put(stepId, StepStatus.COMPENSATED);
        List<String> undone = new ArrayList<>(compensatedSteps);
        undone.add(stepId);
        return new SagaState(sagaId, sagaName, status, stepIndex, input, log, results,
                completedSteps, undone, failedStepId, error);
    }

    SagaState withError(String message) {
        return new SagaState(sagaId, sagaName, status, stepIndex, input, stepLog, results,
                completedSteps, compensatedSteps, failedStepId, message);
    }
}
