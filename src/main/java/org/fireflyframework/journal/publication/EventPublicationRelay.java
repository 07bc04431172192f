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

package org.fireflyframework.journal.publication;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.journal.core.model.ProjectionStatus;
import org.fireflyframework.journal.core.model.StoredEvent;
import org.fireflyframework.journal.core.observability.JournalEvents;
import org.fireflyframework.journal.core.resilience.ResilienceDecorator;
import org.fireflyframework.journal.projection.CheckpointStore;
import org.fireflyframework.journal.projection.ProjectionCheckpoint;
import org.fireflyframework.journal.store.EventStore;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;

/**
 * Forwards committed events to an {@link EventPublisher} in commit order.
 *
 * <p>The relay keeps its own checkpoint and only advances it after the publisher accepted a
 * batch. A failing publisher is retried with exponential backoff; once retries are exhausted
 * the batch is offered again on the next commit or poll, never skipped.
 */
@Slf4j
public class EventPublicationRelay {

    public static final String CHECKPOINT_NAME = "__publication";

    private final EventStore eventStore;
    private final CheckpointStore checkpointStore;
    private final EventPublisher publisher;
    private final JournalEvents events;
    private final int batchSize;
    private final int maxRetries;
    private final Duration backoff;
    private final Duration pollInterval;
    private final ResilienceDecorator resilience;

    private final Sinks.Many<Long> progress = Sinks.many().replay().latest();
    private volatile long position = -1;
    private Scheduler scheduler;
    private Disposable loop;

    public EventPublicationRelay(EventStore eventStore, CheckpointStore checkpointStore, EventPublisher publisher,
                                 JournalEvents events, int batchSize, int maxRetries, Duration backoff,
                                 Duration pollInterval, ResilienceDecorator resilience) {
        this.eventStore = eventStore;
        this.checkpointStore = checkpointStore;
        this.publisher = publisher;
        this.events = events;
        this.batchSize = batchSize;
        this.maxRetries = maxRetries;
        this.backoff = backoff;
        this.pollInterval = pollInterval;
        this.resilience = resilience;
    }

    public synchronized void start() {
        if (loop != null) {
            return;
        }
        Flux<Long> wake = Flux.merge(Flux.just(0L), eventStore.commits());
        if (pollInterval != null && !pollInterval.isZero() && !pollInterval.isNegative()) {
            wake = Flux.merge(wake, Flux.interval(pollInterval, pollInterval));
        }
        scheduler = Schedulers.newSingle("journal-relay");
        loop = wake.onBackpressureLatest()
                .publishOn(scheduler, 1)
                .concatMap(signal -> drain().onErrorResume(err -> {
                    log.warn("[relay] Publication stalled at position {}: {}", position, err.getMessage());
                    events.onPublishFailed(position, err);
                    return Mono.empty();
                }), 1)
                .subscribe();
        log.info("[relay] Event publication started with {}", publisher.getClass().getSimpleName());
    }

    public synchronized void stop() {
        if (loop == null) {
            return;
        }
        loop.dispose();
        scheduler.dispose();
        loop = null;
        log.info("[relay] Event publication stopped at position {}", position);
    }

    public boolean isRunning() { return loop != null; }

    public long getPosition() { return Math.max(position, 0); }

    /**
     * Completes once everything up to {@code target} has been published.
     */
    public Mono<Void> awaitPosition(long target, Duration timeout) {
        return progress.asFlux()
                .filter(p -> p >= target)
                .next()
                .timeout(timeout)
                .then();
    }

    private Mono<Void> drain() {
        return loadPosition()
                .flatMapMany(from -> eventStore.readAll(from))
                .buffer(batchSize)
                .concatMap(batch -> publishWithRetry(batch).then(advance(batch)), 1)
                .then();
    }

    private Mono<Long> loadPosition() {
        if (position >= 0) {
            return Mono.just(position);
        }
        return checkpointStore.find(CHECKPOINT_NAME)
                .map(found -> found.map(ProjectionCheckpoint::position).orElse(0L))
                .doOnNext(loaded -> {
                    position = loaded;
                    progress.tryEmitNext(loaded);
                });
    }

    private Mono<Void> publishWithRetry(List<StoredEvent> batch) {
        long first = batch.get(0).globalPosition();
        Mono<Void> publish = Mono.defer(() -> publisher.publish(batch));
        if (resilience != null) {
            publish = resilience.decorate(ResilienceDecorator.PUBLICATION, publish);
        }
        return publish.retryWhen(Retry.backoff(maxRetries, backoff)
                .doBeforeRetry(signal -> {
                    log.warn("[relay] Publishing from position {} failed (attempt {}): {}",
                            first, signal.totalRetries() + 1, signal.failure().getMessage());
                    events.onPublishFailed(first, signal.failure());
                }));
    }

    private Mono<Void> advance(List<StoredEvent> batch) {
        long first = batch.get(0).globalPosition();
        long last = batch.get(batch.size() - 1).globalPosition();
        return checkpointStore.save(ProjectionCheckpoint.of(CHECKPOINT_NAME, last, ProjectionStatus.RUNNING))
                .then(Mono.fromRunnable(() -> {
                    position = last;
                    progress.tryEmitNext(last);
                    events.onPublished(first, last, batch.size());
                }));
    }
}
