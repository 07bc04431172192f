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

import org.fireflyframework.journal.aggregate.AggregateRoot;
import org.fireflyframework.journal.core.model.SagaStatus;
import org.fireflyframework.journal.core.model.StepStatus;
import org.fireflyframework.journal.saga.event.CompensationStartedEvent;
import org.fireflyframework.journal.saga.event.SagaCompensatedEvent;
import org.fireflyframework.journal.saga.event.SagaCompensationFailedEvent;
import org.fireflyframework.journal.saga.event.SagaCompletedEvent;
import org.fireflyframework.journal.saga.event.SagaEvent;
import org.fireflyframework.journal.saga.event.SagaStartedEvent;
import org.fireflyframework.journal.saga.event.StepCompensatedEvent;
import org.fireflyframework.journal.saga.event.StepCompensationFailedEvent;
import org.fireflyframework.journal.saga.event.StepCompletedEvent;
import org.fireflyframework.journal.saga.event.StepFailedEvent;
import org.fireflyframework.journal.saga.event.StepStartedEvent;

import java.time.Instant;

/**
 * A saga instance as an aggregate over its own progress stream.
 */
public class SagaInstance extends AggregateRoot<SagaState, SagaEvent> {

    public SagaInstance(String streamId) {
        super(streamId, SagaState.initial(), SagaState.class, SagaEvent.class);
    }

    public String getSagaId() { return getState().sagaId(); }
    public SagaStatus getStatus() { return getState().status(); }

    void start(String sagaId, String sagaName, Object input, Instant now) {
        require(SagaStatus.NOT_STARTED);
        raise(new SagaStartedEvent(sagaId, sagaName, input, now));
    }

    void stepStarted(String stepId, int index, Instant now) {
        require(SagaStatus.RUNNING);
        raise(new StepStartedEvent(getSagaId(), stepId, index, now));
    }

    void stepCompleted(String stepId, int index, Object result, long latencyMs, Instant now) {
        require(SagaStatus.RUNNING);
        raise(new StepCompletedEvent(getSagaId(), stepId, index, result, latencyMs, now));
    }

    void stepFailed(String stepId, int index, String error, boolean timedOut, Instant now) {
        require(SagaStatus.RUNNING);
        raise(new StepFailedEvent(getSagaId(), stepId, index, error, timedOut, now));
    }

    void compensationStarted(String failedStepId, Instant now) {
        require(SagaStatus.RUNNING);
        raise(new CompensationStartedEvent(getSagaId(), failedStepId, now));
    }

    void stepCompensated(String stepId, Instant now) {
        require(SagaStatus.COMPENSATING);
        raise(new StepCompensatedEvent(getSagaId(), stepId, now));
    }

    void stepCompensationFailed(String stepId, String error, Instant now) {
        require(SagaStatus.COMPENSATING);
        raise(new StepCompensationFailedEvent(getSagaId(), stepId, error, now));
        raise(new SagaCompensationFailedEvent(getSagaId(), stepId, error, now));
    }

    void completed(Instant now) {
        require(SagaStatus.RUNNING);
        raise(new SagaCompletedEvent(getSagaId(), now));
    }

    void compensated(Instant now) {
        require(SagaStatus.COMPENSATING);
        raise(new SagaCompensatedEvent(getSagaId(), now));
    }

    @Override
    protected SagaState applyEvent(SagaState state, SagaEvent event) {
        if (event instanceof SagaStartedEvent e) {
            return state.started(e.sagaId(), e.sagaName(), e.input());
        }
        if (event instanceof StepStartedEvent e) {
            return state.withStep(e.stepId(), StepStatus.RUNNING);
        }
        if (event instanceof StepCompletedEvent e) {
            return state.withCompleted(e.stepId(), e.stepIndex(), e.result());
        }
        if (event instanceof StepFailedEvent e) {
            return state.withFailure(e.stepId(), e.timedOut() ? StepStatus.TIMED_OUT : StepStatus.FAILED, e.error());
        }
        if (event instanceof CompensationStartedEvent) {
            return state.withStatus(SagaStatus.COMPENSATING);
        }
        if (event instanceof StepCompensatedEvent e) {
            return state.withCompensated(e.stepId());
        }
        if (event instanceof StepCompensationFailedEvent e) {
            return state.withStep(e.stepId(), StepStatus.COMPENSATION_FAILED).withError(e.error());
        }
        if (event instanceof SagaCompletedEvent) {
            return state.withStatus(SagaStatus.COMPLETED);
        }
        if (event instanceof SagaCompensatedEvent) {
            return state.withStatus(SagaStatus.COMPENSATED);
        }
        if (event instanceof SagaCompensationFailedEvent) {
            return state.withStatus(SagaStatus.COMPENSATION_FAILED);
        }
        throw new IllegalStateException("Unhandled saga event " + event.getClass().getName());
    }

    private void require(SagaStatus expected) {
        if (getStatus() != expected) {
            throw new IllegalStateException("Saga '" + getSagaId() + "' is " + getStatus() + ", expected " + expected);
        }
    }
}
