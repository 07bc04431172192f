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

package org.fireflyframework.journal.aggregate;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.journal.core.context.JournalRuntime;
import org.fireflyframework.journal.core.model.AppendResult;
import org.fireflyframework.journal.core.model.CommandMetadata;
import org.fireflyframework.journal.core.model.NewEvent;
import org.fireflyframework.journal.core.observability.JournalEvents;
import org.fireflyframework.journal.core.serialization.StateSerializer;
import org.fireflyframework.journal.snapshot.Snapshot;
import org.fireflyframework.journal.snapshot.SnapshotPolicy;
import org.fireflyframework.journal.snapshot.SnapshotStore;
import org.fireflyframework.journal.store.EventStore;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Loads aggregates by replaying their stream on top of the latest usable snapshot
 * and saves them with optimistic concurrency.
 *
 * <p>A {@code VersionConflictException} from {@link #save} is returned to the caller
 * unchanged; the repository never retries or merges. Snapshots are a cache: they are
 * written off the save path and a snapshot that cannot be read is skipped in favour
 * of a full replay.
 *
 * @param <A> the aggregate type
 */
@Slf4j
public class AggregateRepository<A extends AggregateRoot<?, ?>> {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final StateSerializer serializer;
    private final SnapshotPolicy snapshotPolicy;
    private final Scheduler snapshotScheduler;
    private final JournalEvents events;
    private final Clock clock;
    private final Function<String, A> factory;

    public AggregateRepository(JournalRuntime runtime, Function<String, A> factory) {
        this(runtime, factory, runtime.snapshotPolicy());
    }

    public AggregateRepository(JournalRuntime runtime, Function<String, A> factory, SnapshotPolicy snapshotPolicy) {
        this(runtime.eventStore(), runtime.snapshotStore(), runtime.serializer(), snapshotPolicy,
                runtime.snapshotScheduler(), runtime.events(), runtime.clock(), factory);
    }

    public AggregateRepository(EventStore eventStore, SnapshotStore snapshotStore, StateSerializer serializer,
                               SnapshotPolicy snapshotPolicy, Scheduler snapshotScheduler, JournalEvents events,
                               Clock clock, Function<String, A> factory) {
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.serializer = serializer;
        this.snapshotPolicy = snapshotPolicy;
        this.snapshotScheduler = snapshotScheduler;
        this.events = events;
        this.clock = clock;
        this.factory = factory;
    }

    /**
     * Reconstructs the aggregate at its latest committed version. A stream with no events
     * yields an aggregate in its initial state at version 0.
     */
    public Mono<A> load(String streamId) {
        return eventStore.currentVersion(streamId)
                .flatMap(current -> loadAt(streamId, current));
    }

    /**
     * Reconstructs the aggregate as it was at {@code version}.
     */
    public Mono<A> loadAt(String streamId, long version) {
        return Mono.defer(() -> {
            A aggregate = factory.apply(streamId);
            return latestSnapshot(streamId, version)
                    .map(snapshot -> restore(aggregate, snapshot))
                    .defaultIfEmpty(0L)
                    .flatMap(fromVersion -> eventStore.readStream(streamId, fromVersion)
                            .takeWhile(event -> event.streamVersion() <= version)
                            .doOnNext(aggregate::replay)
                            .then(Mono.just(aggregate)));
        });
    }

    public Mono<Boolean> exists(String streamId) {
        return eventStore.currentVersion(streamId).map(version -> version > 0);
    }

    public Mono<AppendResult> save(A aggregate) {
        return save(aggregate, CommandMetadata.empty());
    }

    /**
     * Appends the aggregate's pending events at the version it was loaded at.
     * On success the pending list is cleared and the in-memory version advances.
     */
    public Mono<AppendResult> save(A aggregate, CommandMetadata command) {
        return Mono.defer(() -> {
            String streamId = aggregate.getStreamId();
            long expectedVersion = aggregate.getVersion();
            if (!aggregate.hasUncommittedEvents()) {
                return Mono.just(AppendResult.noop(streamId, expectedVersion));
            }
            List<NewEvent> batch = aggregate.getUncommittedEvents().stream()
                    .map(event -> NewEvent.of(event, command))
                    .toList();
            return eventStore.append(streamId, expectedVersion, batch)
                    .doOnNext(result -> {
                        aggregate.markCommitted(result.newVersion());
                        if (snapshotPolicy.shouldSnapshot(result.previousVersion(), result.newVersion())) {
                            writeSnapshot(streamId, result.newVersion(), aggregate.captureSnapshot(serializer, clock));
                        }
                    });
        });
    }

    private Mono<Snapshot> latestSnapshot(String streamId, long maxVersion) {
        if (maxVersion <= 0) {
            return Mono.empty();
        }
        return snapshotStore.findLatest(streamId, maxVersion)
                .flatMap(Mono::justOrEmpty)
                .onErrorResume(err -> {
                    log.warn("[journal] Snapshot lookup failed for '{}', replaying full stream: {}",
                            streamId, err.getMessage());
                    return Mono.empty();
                });
    }

    private long restore(A aggregate, Snapshot snapshot) {
        try {
            aggregate.restore(snapshot, serializer);
            return snapshot.version();
        } catch (RuntimeException e) {
            log.warn("[journal] Ignoring unreadable snapshot of '{}' at version {}: {}",
                    snapshot.streamId(), snapshot.version(), e.getMessage());
            return 0L;
        }
    }

    private void writeSnapshot(String streamId, long version, Supplier<Snapshot> capture) {
        Mono.fromSupplier(capture)
                .flatMap(snapshotStore::save)
                .subscribeOn(snapshotScheduler)
                .subscribe(
                        unused -> {},
                        err -> {
                            log.warn("[journal] Snapshot of '{}' at version {} failed: {}",
                                    streamId, version, err.getMessage());
                            events.onSnapshotFailed(streamId, version, err);
                        },
                        () -> events.onSnapshotSaved(streamId, version));
    }
}
