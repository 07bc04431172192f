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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.journal.core.dlq.DeadLetterEntry;
import org.fireflyframework.journal.core.dlq.DeadLetterKind;
import org.fireflyframework.journal.core.dlq.DeadLetterService;
import org.fireflyframework.journal.core.exception.ProjectionHandlerException;
import org.fireflyframework.journal.core.model.EventTypeFilter;
import org.fireflyframework.journal.core.model.ProjectionStatus;
import org.fireflyframework.journal.core.model.StoredEvent;
import org.fireflyframework.journal.core.observability.JournalEvents;
import org.fireflyframework.journal.store.EventStore;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tails the global log for one projection and keeps its read model and checkpoint current.
 *
 * <p>All work for a projection (catch-up batches, restarts and rebuilds) runs one signal at a
 * time on a dedicated single-threaded scheduler, so the read model sees events in commit order
 * and a rebuild naturally pauses tailing until it has been swapped in. Commit notifications
 * from the store wake the worker; a periodic poll covers missed notifications.
 */
@Slf4j
public class ProjectionWorker {

    private sealed interface Signal permits Load, Tick, Restart, Rebuild {}
    private record Load() implements Signal {}
    private record Tick() implements Signal {}
    private record Restart(Sinks.Empty<Void> done) implements Signal {}
    private record Rebuild(RebuildRun run) implements Signal {}

    private record HandlerFailure(StoredEvent event, Throwable error) {}

    /**
     * @param lastPosition position the checkpoint may advance to
     * @param halted       a failure stopped the batch under {@link ProjectionFailurePolicy#HALT}
     */
    private record BatchOutcome(long lastPosition, int handled, boolean halted, List<HandlerFailure> failures) {}

    private static final class RebuildRun {
        private final Sinks.One<Long> result = Sinks.one();
        private final Sinks.One<Boolean> cancelSignal = Sinks.one();
        private volatile boolean cancelled;

        void cancel() {
            cancelled = true;
            cancelSignal.tryEmitValue(Boolean.TRUE);
        }

        void complete(long head) { result.tryEmitValue(head); }
        void fail(Throwable error) { result.tryEmitError(error); }
    }

    private final ProjectionDefinition definition;
    private final EventStore eventStore;
    private final CheckpointStore checkpointStore;
    private final DeadLetterService deadLetters;
    private final JournalEvents events;
    private final ProjectionSettings settings;

    private final AtomicReference<ProjectionHandler> readModel = new AtomicReference<>();
    private final AtomicBoolean tickPending = new AtomicBoolean();
    private final Sinks.Many<Long> progress = Sinks.many().replay().latest();
    private volatile long position;
    private volatile ProjectionStatus status = ProjectionStatus.IDLE;
    private volatile RebuildRun activeRebuild;
    private volatile boolean running;

    private Sinks.Many<Signal> signals;
    private Scheduler scheduler;
    private Disposable loop;
    private Disposable wakeups;

    public ProjectionWorker(ProjectionDefinition definition, EventStore eventStore, CheckpointStore checkpointStore,
                            DeadLetterService deadLetters, JournalEvents events, ProjectionSettings settings) {
        this.definition = definition;
        this.eventStore = eventStore;
        this.checkpointStore = checkpointStore;
        this.deadLetters = deadLetters;
        this.events = events;
        this.settings = settings;
        this.readModel.set(definition.handlerFactory().get());
        this.progress.tryEmitNext(0L);
    }

    public String getName() { return definition.name(); }
    public ProjectionStatus getStatus() { return status; }
    public long getPosition() { return position; }
    public ProjectionHandler getReadModel() { return readModel.get(); }
    public boolean isRunning() { return running; }
    public boolean isRebuilding() { return activeRebuild != null; }

    public synchronized void start() {
        if (running) {
            return;
        }
        scheduler = Schedulers.newSingle("projection-" + definition.name());
        signals = Sinks.many().unicast().onBackpressureBuffer();
        tickPending.set(false);
        loop = signals.asFlux()
                .publishOn(scheduler)
                .concatMap(signal -> handle(signal).onErrorResume(err -> {
                    log.error("[projection] '{}' worker error: {}", definition.name(), err.getMessage(), err);
                    return Mono.empty();
                }), 1)
                .subscribe();

        Flux<Long> wake = eventStore.commits();
        Duration poll = settings.pollInterval();
        if (poll != null && !poll.isZero() && !poll.isNegative()) {
            wake = Flux.merge(wake, Flux.interval(poll, poll));
        }
        wakeups = wake.onBackpressureLatest().subscribe(p -> tick());
        running = true;
        emit(new Load());
        log.info("[projection] '{}' started", definition.name());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        RebuildRun run = activeRebuild;
        if (run != null) {
            run.cancel();
            run.fail(new CancellationException("Projection '" + definition.name() + "' stopped during rebuild"));
            activeRebuild = null;
        }
        wakeups.dispose();
        loop.dispose();
        scheduler.dispose();
        signals = null;
        transition(ProjectionStatus.IDLE);
        log.info("[projection] '{}' stopped at position {}", definition.name(), position);
    }

    /**
     * Rebuilds the read model from the beginning of the log. Completes with the head position
     * the new model was built to once it has been swapped in.
     */
    public Mono<Long> rebuild() {
        return Mono.defer(() -> {
            RebuildRun run = new RebuildRun();
            synchronized (this) {
                if (!running) {
                    return Mono.error(new IllegalStateException(
                            "Projection '" + definition.name() + "' is not running"));
                }
                if (activeRebuild != null) {
                    return Mono.error(new IllegalStateException(
                            "Projection '" + definition.name() + "' is already rebuilding"));
                }
                activeRebuild = run;
                emit(new Rebuild(run));
            }
            return run.result.asMono();
        });
    }

    /**
     * Aborts a pending or running rebuild. The previous read model and checkpoint stay in place.
     *
     * @return {@code true} if a rebuild was cancelled
     */
    public boolean cancelRebuild() {
        RebuildRun run = activeRebuild;
        if (run == null) {
            return false;
        }
        run.cancel();
        return true;
    }

    /**
     * Resumes a projection halted by a handler failure, from its checkpoint.
     */
    public Mono<Void> restart() {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            synchronized (this) {
                if (!running) {
                    return Mono.error(new IllegalStateException(
                            "Projection '" + definition.name() + "' is not running"));
                }
                emit(new Restart(done));
            }
            return done.asMono();
        });
    }

    /**
     * Completes once the checkpoint has reached {@code target}.
     */
    public Mono<Void> awaitPosition(long target, Duration timeout) {
        return progress.asFlux()
                .filter(p -> p >= target)
                .next()
                .timeout(timeout)
                .then();
    }

    private void tick() {
        if (running && tickPending.compareAndSet(false, true)) {
            emit(new Tick());
        }
    }

    private synchronized void emit(Signal signal) {
        if (signals == null) {
            return;
        }
        Sinks.EmitResult result = signals.tryEmitNext(signal);
        if (result.isFailure()) {
            log.debug("[projection] '{}' dropped {}: {}", definition.name(), signal, result);
        }
    }

    private Mono<Void> handle(Signal signal) {
        if (signal instanceof Tick) {
            tickPending.set(false);
            return status == ProjectionStatus.RUNNING ? catchUp() : Mono.empty();
        }
        if (signal instanceof Load) {
            return load();
        }
        if (signal instanceof Restart restart) {
            return resume(restart.done());
        }
        if (signal instanceof Rebuild rebuild) {
            return rebuild(rebuild.run());
        }
        return Mono.error(new IllegalStateException("Unhandled signal " + signal));
    }

    private Mono<Void> load() {
        return checkpointStore.find(definition.name())
                .doOnNext(found -> {
                    found.ifPresent(cp -> position = cp.position());
                    // REBUILDING left by an interrupted rebuild still points at the live model
                    boolean failed = found.map(cp -> cp.status() == ProjectionStatus.FAILED).orElse(false);
                    transition(failed ? ProjectionStatus.FAILED : ProjectionStatus.RUNNING);
                    progress.tryEmitNext(position);
                    log.debug("[projection] '{}' resuming from position {}", definition.name(), position);
                })
                .then(Mono.defer(() -> status == ProjectionStatus.RUNNING ? catchUp() : Mono.empty()));
    }

    private Mono<Void> resume(Sinks.Empty<Void> done) {
        if (status != ProjectionStatus.FAILED) {
            done.tryEmitEmpty();
            return Mono.empty();
        }
        return checkpointStore.save(ProjectionCheckpoint.of(definition.name(), position, ProjectionStatus.RUNNING))
                .then(Mono.fromRunnable(() -> {
                    transition(ProjectionStatus.RUNNING);
                    log.info("[projection] '{}' restarted from position {}", definition.name(), position);
                    done.tryEmitEmpty();
                }))
                .then(catchUp())
                .doOnError(done::tryEmitError);
    }

    private Mono<Void> catchUp() {
        ProjectionHandler handler = readModel.get();
        return eventStore.readAll(position, EventStore.UNBOUNDED, EventTypeFilter.all())
                .buffer(settings.batchSize())
                .concatMap(batch -> process(handler, batch)
                        .flatMap(outcome -> deadLetter(outcome).then(commit(outcome))), 1)
                .takeUntil(BatchOutcome::halted)
                .then();
    }

    private Mono<BatchOutcome> commit(BatchOutcome outcome) {
        ProjectionStatus next = outcome.halted() ? ProjectionStatus.FAILED : status;
        long newPosition = Math.max(position, outcome.lastPosition());
        return checkpointStore.save(ProjectionCheckpoint.of(definition.name(), newPosition, next))
                .then(Mono.fromCallable(() -> {
                    long from = position;
                    position = newPosition;
                    events.onProjectionBatch(definition.name(), from, newPosition, outcome.handled());
                    progress.tryEmitNext(newPosition);
                    if (outcome.halted()) {
                        transition(ProjectionStatus.FAILED);
                    }
                    return outcome;
                }));
    }

    private Mono<Void> rebuild(RebuildRun run) {
        if (run.cancelled) {
            clearActive(run);
            run.fail(new CancellationException("Rebuild of '" + definition.name() + "' cancelled"));
            return Mono.empty();
        }
        ProjectionStatus previous = status;
        long startedAt = System.nanoTime();
        ProjectionHandler shadow = definition.handlerFactory().get();
        transition(ProjectionStatus.REBUILDING);

        // the stored position keeps pointing at the live model until the swap
        return checkpointStore.save(ProjectionCheckpoint.of(definition.name(), position, ProjectionStatus.REBUILDING))
                .then(eventStore.headPosition())
                .flatMap(head -> {
                    log.info("[projection] '{}' rebuilding up to position {}", definition.name(), head);
                    events.onRebuildStarted(definition.name(), head);
                    return eventStore.readAll(0, head, EventTypeFilter.all())
                            .takeUntilOther(run.cancelSignal.asMono())
                            .buffer(settings.batchSize())
                            .concatMap(batch -> process(shadow, batch)
                                    .flatMap(outcome -> deadLetter(outcome).thenReturn(outcome)), 1)
                            .takeUntil(BatchOutcome::halted)
                            .filter(BatchOutcome::halted)
                            .next()
                            .map(Optional::of)
                            .defaultIfEmpty(Optional.empty())
                            .flatMap(halt -> {
                                if (run.cancelled) {
                                    log.info("[projection] '{}' rebuild cancelled", definition.name());
                                    events.onRebuildCancelled(definition.name());
                                    return abandon(run, previous, new CancellationException(
                                            "Rebuild of '" + definition.name() + "' cancelled"));
                                }
                                if (halt.isPresent()) {
                                    HandlerFailure failure = halt.get().failures().get(halt.get().failures().size() - 1);
                                    return abandon(run, previous, new ProjectionHandlerException(definition.name(),
                                            failure.event().eventId(), failure.event().globalPosition(),
                                            failure.error()));
                                }
                                return swap(shadow, head, startedAt, run);
                            });
                })
                .onErrorResume(err -> {
                    log.error("[projection] '{}' rebuild failed: {}", definition.name(), err.getMessage());
                    return abandon(run, previous, err);
                })
                .doFinally(signal -> clearActive(run))
                .flatMap(swapped -> swapped ? catchUp() : Mono.empty());
    }

    /**
     * Keeps the live model: restores the previous status, stored with the unchanged position.
     */
    private Mono<Boolean> abandon(RebuildRun run, ProjectionStatus previous, Throwable error) {
        return checkpointStore.save(ProjectionCheckpoint.of(definition.name(), position, previous))
                .onErrorResume(saveError -> {
                    log.warn("[projection] '{}' could not restore checkpoint status: {}",
                            definition.name(), saveError.getMessage());
                    return Mono.empty();
                })
                .then(Mono.fromCallable(() -> {
                    clearActive(run);
                    transition(previous);
                    run.fail(error);
                    return false;
                }));
    }

    private Mono<Boolean> swap(ProjectionHandler shadow, long head, long startedAt, RebuildRun run) {
        return checkpointStore.save(ProjectionCheckpoint.of(definition.name(), head, ProjectionStatus.RUNNING))
                .then(Mono.fromCallable(() -> {
                    readModel.set(shadow);
                    position = head;
                    clearActive(run);
                    transition(ProjectionStatus.RUNNING);
                    progress.tryEmitNext(head);
                    long durationMs = (System.nanoTime() - startedAt) / 1_000_000;
                    log.info("[projection] '{}' rebuilt to position {} in {}ms", definition.name(), head, durationMs);
                    events.onRebuildCompleted(definition.name(), head, durationMs);
                    run.complete(head);
                    return true;
                }));
    }

    private synchronized void clearActive(RebuildRun run) {
        if (activeRebuild == run) {
            activeRebuild = null;
        }
    }

    private Mono<BatchOutcome> process(ProjectionHandler handler, List<StoredEvent> batch) {
        long last = batch.get(batch.size() - 1).globalPosition();
        if (settings.parallelism() <= 1) {
            return Mono.fromCallable(() -> processPartition(handler, batch, last));
        }
        Map<String, List<StoredEvent>> partitions = new LinkedHashMap<>();
        for (StoredEvent event : batch) {
            partitions.computeIfAbsent(event.streamId(), k -> new ArrayList<>()).add(event);
        }
        Scheduler current = scheduler;
        return Flux.fromIterable(partitions.values())
                .flatMap(partition -> Mono.fromCallable(() -> processPartition(handler, partition, last))
                        .subscribeOn(Schedulers.boundedElastic()), settings.parallelism())
                .collectList()
                .map(results -> merge(results, last))
                .publishOn(current);
    }

    private BatchOutcome processPartition(ProjectionHandler handler, List<StoredEvent> partition, long last) {
        List<HandlerFailure> failures = new ArrayList<>();
        int handled = 0;
        for (StoredEvent event : partition) {
            if (!definition.filter().matches(event)) {
                continue;
            }
            Throwable error = deliver(handler, event);
            if (error == null) {
                handled++;
                continue;
            }
            failures.add(new HandlerFailure(event, error));
            if (settings.failurePolicy() == ProjectionFailurePolicy.HALT) {
                return new BatchOutcome(event.globalPosition() - 1, handled, true, failures);
            }
        }
        return new BatchOutcome(last, handled, false, failures);
    }

    private BatchOutcome merge(List<BatchOutcome> results, long last) {
        List<HandlerFailure> failures = new ArrayList<>();
        long safePosition = last;
        int handled = 0;
        boolean halted = false;
        for (BatchOutcome result : results) {
            handled += result.handled();
            failures.addAll(result.failures());
            if (result.halted()) {
                halted = true;
                safePosition = Math.min(safePosition, result.lastPosition());
            }
        }
        failures.sort((a, b) -> Long.compare(a.event().globalPosition(), b.event().globalPosition()));
        return new BatchOutcome(safePosition, handled, halted, failures);
    }

    private Throwable deliver(ProjectionHandler handler, StoredEvent event) {
        try {
            handler.handle(event);
            return null;
        } catch (Exception e) {
            log.warn("[projection] '{}' failed on event {} at position {}: {}",
                    definition.name(), event.eventId(), event.globalPosition(), e.getMessage());
            events.onProjectionHandlerFailed(definition.name(), event, e);
            return e;
        }
    }

    private Mono<Void> deadLetter(BatchOutcome outcome) {
        if (deadLetters == null || outcome.failures().isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(outcome.failures())
                .concatMap(failure -> alreadyDeadLettered(failure.event())
                        .flatMap(known -> known ? Mono.<Void>empty() : deadLetters.deadLetter(
                                DeadLetterEntry.forProjection(definition.name(), failure.event(), failure.error()))))
                .then();
    }

    /**
     * Replays (restart, rebuild) meet the same failing event again; it is recorded once.
     */
    private Mono<Boolean> alreadyDeadLettered(StoredEvent event) {
        return deadLetters.getByReference(event.eventId())
                .any(entry -> entry.kind() == DeadLetterKind.PROJECTION && definition.name().equals(entry.source()));
    }

    private void transition(ProjectionStatus next) {
        ProjectionStatus previous = status;
        if (previous != next) {
            status = next;
            events.onProjectionStatusChanged(definition.name(), previous, next);
        }
    }
}
