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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.journal.aggregate.AggregateRepository;
import org.fireflyframework.journal.core.context.JournalRuntime;
import org.fireflyframework.journal.core.dlq.DeadLetterEntry;
import org.fireflyframework.journal.core.dlq.DeadLetterService;
import org.fireflyframework.journal.core.exception.SagaCompensationException;
import org.fireflyframework.journal.core.exception.SagaStepException;
import org.fireflyframework.journal.core.exception.ValidationException;
import org.fireflyframework.journal.core.model.CommandMetadata;
import org.fireflyframework.journal.core.model.SagaStatus;
import org.fireflyframework.journal.core.observability.JournalEvents;
import org.fireflyframework.journal.core.resilience.ResilienceDecorator;
import org.fireflyframework.journal.saga.registry.SagaDefinition;
import org.fireflyframework.journal.saga.registry.SagaRegistry;
import org.fireflyframework.journal.saga.registry.SagaStepDefinition;
import org.fireflyframework.journal.snapshot.SnapshotPolicy;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs sagas step by step and walks compensations backwards on failure.
 *
 * <p>Every transition is appended to the saga's own stream before the next action runs,
 * so {@link #resume(String)} can pick an interrupted instance up from its last recorded
 * position. A step that was started but not recorded as completed is executed again,
 * which makes step actions at-least-once. Compensation failures are terminal: the
 * instance ends in {@link SagaStatus#COMPENSATION_FAILED} and is dead-lettered.
 */
@Slf4j
public class SagaCoordinator {

    private record Attempt(Object result, Throwable error) {
        static Attempt ok(Object result) { return new Attempt(result, null); }
        static Attempt failed(Throwable error) { return new Attempt(null, error); }
        boolean isFailed() { return error != null; }
    }

    private record Progress(SagaInstance instance, Throwable error) {}

    private final SagaRegistry registry;
    private final AggregateRepository<SagaInstance> repository;
    private final DeadLetterService deadLetters;
    private final JournalEvents events;
    private final Clock clock;
    private final SagaSettings settings;
    private final ResilienceDecorator resilience;

    public SagaCoordinator(JournalRuntime runtime, SagaRegistry registry) {
        this(runtime, registry, SagaSettings.defaults(), null);
    }

    public SagaCoordinator(JournalRuntime runtime, SagaRegistry registry, SagaSettings settings,
                           ResilienceDecorator resilience) {
        this.registry = registry;
        this.repository = new AggregateRepository<>(runtime, SagaInstance::new, SnapshotPolicy.never());
        this.deadLetters = runtime.deadLetters();
        this.events = runtime.events();
        this.clock = runtime.clock();
        this.settings = settings;
        this.resilience = resilience;
    }

    public Mono<SagaResult> execute(String sagaName, String sagaId, Object input) {
        return Mono.defer(() -> execute(registry.getSaga(sagaName), sagaId, input));
    }

    /**
     * Starts a new saga instance and runs it to a terminal state.
     * Fails with {@link ValidationException} if an instance with this id already exists.
     */
    public Mono<SagaResult> execute(SagaDefinition definition, String sagaId, Object input) {
        if (sagaId == null || sagaId.isBlank()) {
            return Mono.error(new ValidationException("sagaId must not be blank"));
        }
        return Mono.defer(() -> {
            long startedAt = System.nanoTime();
            return repository.load(streamId(sagaId))
                    .flatMap(instance -> {
                        if (instance.getVersion() > 0) {
                            return Mono.error(new ValidationException(
                                    "Saga instance '" + sagaId + "' already exists", Map.of("sagaId", sagaId)));
                        }
                        instance.start(sagaId, definition.name, input, clock.instant());
                        return persist(instance)
                                .doOnNext(i -> {
                                    log.info("[saga] Starting saga '{}' instance '{}'", definition.name, sagaId);
                                    events.onSagaStarted(definition.name, sagaId);
                                })
                                .flatMap(i -> forward(definition, i));
                    })
                    .map(progress -> finish(definition, progress, startedAt));
        });
    }

    /**
     * Continues an interrupted instance from its recorded progress. Terminal instances
     * return their recorded result without running anything.
     */
    public Mono<SagaResult> resume(String sagaId) {
        return Mono.defer(() -> {
            long startedAt = System.nanoTime();
            return repository.load(streamId(sagaId))
                    .flatMap(instance -> {
                        if (instance.getVersion() == 0) {
                            return Mono.error(new IllegalArgumentException("Unknown saga instance: " + sagaId));
                        }
                        SagaState state = instance.getState();
                        if (state.status().isTerminal()) {
                            return Mono.just(SagaResult.from(state, null));
                        }
                        SagaDefinition definition = registry.getSaga(state.sagaName());
                        log.info("[saga] Resuming saga '{}' instance '{}' in {} at step {}",
                                state.sagaName(), sagaId, state.status(), state.stepIndex());
                        Mono<Progress> progress = state.status() == SagaStatus.COMPENSATING
                                ? compensate(definition, instance, null)
                                : forward(definition, instance);
                        return progress.map(p -> finish(definition, p, startedAt));
                    });
        });
    }

    /**
     * The instance as reconstructed from its stream, empty if it was never started.
     */
    public Mono<SagaInstance> find(String sagaId) {
        return repository.load(streamId(sagaId))
                .filter(instance -> instance.getVersion() > 0);
    }

    public String streamId(String sagaId) {
        return settings.streamPrefix() + sagaId;
    }

    private Mono<Progress> forward(SagaDefinition definition, SagaInstance instance) {
        return Mono.defer(() -> {
            SagaState state = instance.getState();
            List<SagaStepDefinition> steps = definition.orderedSteps();
            if (state.stepIndex() >= steps.size()) {
                instance.completed(clock.instant());
                return persist(instance).map(i -> new Progress(i, null));
            }
            int index = state.stepIndex();
            SagaStepDefinition step = steps.get(index);
            instance.stepStarted(step.id, index, clock.instant());
            return persist(instance).flatMap(i -> {
                events.onSagaStepStarted(definition.name, state.sagaId(), step.id);
                long stepStart = System.nanoTime();
                return runStep(definition, step, i).flatMap(attempt -> attempt.isFailed()
                        ? stepFailed(definition, i, step, index, attempt.error())
                        : stepCompleted(definition, i, step, index, attempt.result(), elapsedMs(stepStart)));
            });
        });
    }

    private Mono<Progress> stepCompleted(SagaDefinition definition, SagaInstance instance, SagaStepDefinition step,
                                         int index, Object result, long latencyMs) {
        instance.stepCompleted(step.id, index, result, latencyMs, clock.instant());
        return persist(instance)
                .doOnNext(i -> events.onSagaStepCompleted(definition.name, i.getSagaId(), step.id, latencyMs))
                .flatMap(i -> forward(definition, i));
    }

    private Mono<Progress> stepFailed(SagaDefinition definition, SagaInstance instance, SagaStepDefinition step,
                                      int index, Throwable error) {
        String sagaId = instance.getSagaId();
        var failure = new SagaStepException(sagaId, step.id, error);
        log.warn("[saga] Saga '{}' instance '{}' step '{}' failed: {}",
                definition.name, sagaId, step.id, SagaStepException.describe(error));
        events.onSagaStepFailed(definition.name, sagaId, step.id, error);
        instance.stepFailed(step.id, index, SagaStepException.describe(error),
                error instanceof TimeoutException, clock.instant());
        instance.compensationStarted(step.id, clock.instant());
        return persist(instance)
                .doOnNext(i -> events.onSagaCompensationStarted(definition.name, sagaId))
                .flatMap(i -> compensate(definition, i, failure));
    }

    private Mono<Progress> compensate(SagaDefinition definition, SagaInstance instance, Throwable cause) {
        return Mono.defer(() -> {
            List<String> pending = instance.getState().pendingCompensations();
            if (pending.isEmpty()) {
                instance.compensated(clock.instant());
                return persist(instance).map(i -> new Progress(i, cause));
            }
            String sagaId = instance.getSagaId();
            SagaStepDefinition step = definition.step(pending.get(0));
            return runCompensation(definition, step, instance).flatMap(attempt -> {
                if (!attempt.isFailed()) {
                    instance.stepCompensated(step.id, clock.instant());
                    return persist(instance)
                            .doOnNext(i -> events.onSagaStepCompensated(definition.name, sagaId, step.id))
                            .flatMap(i -> compensate(definition, i, cause));
                }
                var failure = new SagaCompensationException(sagaId, step.id, attempt.error());
                log.error("[saga] Saga '{}' instance '{}' could not compensate step '{}', operator action required: {}",
                        definition.name, sagaId, step.id, SagaStepException.describe(attempt.error()));
                events.onSagaStepCompensationFailed(definition.name, sagaId, step.id, attempt.error());
                instance.stepCompensationFailed(step.id, SagaStepException.describe(attempt.error()), clock.instant());
                return persist(instance)
                        .flatMap(i -> deadLetter(definition, sagaId, step.id, failure).thenReturn(new Progress(i, failure)));
            });
        });
    }

    private Mono<Attempt> runStep(SagaDefinition definition, SagaStepDefinition step, SagaInstance instance) {
        SagaContext ctx = context(definition, step, instance);
        Mono<Object> action = Mono.<Object>defer(() -> step.action.apply(ctx))
                .timeout(step.timeout != null ? step.timeout : settings.stepTimeout());
        if (resilience != null) {
            action = resilience.decorateStep(definition.name, step.id, action);
        }
        return action.map(Attempt::ok)
                .defaultIfEmpty(Attempt.ok(null))
                .onErrorResume(err -> Mono.just(Attempt.failed(err)));
    }

    private Mono<Attempt> runCompensation(SagaDefinition definition, SagaStepDefinition step, SagaInstance instance) {
        if (!step.hasCompensation()) {
            return Mono.just(Attempt.ok(null));
        }
        SagaContext ctx = context(definition, step, instance);
        Object result = instance.getState().results().get(step.id);
        Duration timeout = step.compensationTimeout != null ? step.compensationTimeout : settings.compensationTimeout();
        return Mono.defer(() -> step.compensation.apply(result, ctx))
                .timeout(timeout)
                .thenReturn(Attempt.ok(null))
                .onErrorResume(err -> Mono.just(Attempt.failed(err)));
    }

    private SagaContext context(SagaDefinition definition, SagaStepDefinition step, SagaInstance instance) {
        SagaState state = instance.getState();
        return new SagaContext(state.sagaId(), definition.name, step.id, state.input(), state.results());
    }

    private Mono<SagaInstance> persist(SagaInstance instance) {
        String sagaId = instance.getSagaId();
        CommandMetadata metadata = CommandMetadata.of(sagaId, sagaId).with("saga", instance.getState().sagaName());
        return repository.save(instance, metadata).thenReturn(instance);
    }

    private Mono<Void> deadLetter(SagaDefinition definition, String sagaId, String stepId, Throwable failure) {
        if (deadLetters == null) {
            return Mono.empty();
        }
        return deadLetters.deadLetter(DeadLetterEntry.forSaga(definition.name, sagaId, stepId, failure))
                .onErrorResume(err -> {
                    log.error("[saga] Could not dead-letter saga '{}' instance '{}': {}",
                            definition.name, sagaId, err.getMessage());
                    return Mono.empty();
                });
    }

    private SagaResult finish(SagaDefinition definition, Progress progress, long startedAt) {
        SagaState state = progress.instance().getState();
        long durationMs = elapsedMs(startedAt);
        log.info("[saga] Saga '{}' instance '{}' finished {} in {}ms",
                definition.name, state.sagaId(), state.status(), durationMs);
        events.onSagaFinished(definition.name, state.sagaId(), state.status(), durationMs);
        return SagaResult.from(state, progress.error());
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
