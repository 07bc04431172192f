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

package org.fireflyframework.journal.store;

import org.fireflyframework.journal.core.exception.ValidationException;
import org.fireflyframework.journal.core.exception.VersionConflictException;
import org.fireflyframework.journal.core.model.AppendResult;
import org.fireflyframework.journal.core.model.EventTypeFilter;
import org.fireflyframework.journal.core.model.NewEvent;
import org.fireflyframework.journal.core.model.StoredEvent;
import org.fireflyframework.journal.core.observability.JournalEvents;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-memory {@link EventStore}.
 *
 * <p>Each stream has its own lock, held for the version check and the write. Global
 * positions are handed out in a short sequencer section that also publishes the batch,
 * so readers bounded by {@code head} never see a gap or half a batch.
 */
@Slf4j
public class InMemoryEventStore implements EventStore {

    private final ConcurrentHashMap<String, StreamLog> streams = new ConcurrentHashMap<>();
    private final ConcurrentSkipListMap<Long, StoredEvent> globalLog = new ConcurrentSkipListMap<>();
    private final Set<String> eventIds = ConcurrentHashMap.newKeySet();
    private final Object sequencer = new Object();
    private final Sinks.Many<Long> commitSink = Sinks.many().multicast().directBestEffort();
    private final EventValidator validator;
    private final JournalEvents events;
    private final Clock clock;

    private volatile long head;

    public InMemoryEventStore() {
        this(new EventValidator(EventValidator.DEFAULT_MAX_BATCH_SIZE), new JournalEvents() {}, Clock.systemUTC());
    }

    public InMemoryEventStore(EventValidator validator, JournalEvents events, Clock clock) {
        this.validator = Objects.requireNonNull(validator, "validator");
        this.events = Objects.requireNonNull(events, "events");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Mono<AppendResult> append(String streamId, long expectedVersion, List<NewEvent> batch) {
        return Mono.fromCallable(() -> doAppend(streamId, expectedVersion, batch))
                .doOnNext(result -> events.onAppended(streamId, result.previousVersion(),
                        result.newVersion(), result.lastPosition()))
                .doOnError(VersionConflictException.class, e -> events.onVersionConflict(
                        streamId, e.getExpectedVersion(), e.getActualVersion()))
                .doOnError(ValidationException.class, e -> events.onAppendRejected(streamId, e.getMessage()));
    }

    private AppendResult doAppend(String streamId, long expectedVersion, List<NewEvent> batch) {
        validator.validate(streamId, expectedVersion, batch);

        StreamLog existing = streams.get(streamId);
        if (existing == null) {
            // a stream that was never written is at version 0 and is not materialized by a rejected append
            if (expectedVersion != 0) {
                throw new VersionConflictException(streamId, expectedVersion, 0);
            }
            rejectCommittedIds(streamId, batch);
        }
        StreamLog stream = existing != null ? existing : streams.computeIfAbsent(streamId, id -> new StreamLog());
        stream.lock.lock();
        try {
            long current = stream.version;
            if (current != expectedVersion) {
                throw new VersionConflictException(streamId, expectedVersion, current);
            }
            List<StoredEvent> committed = new ArrayList<>(batch.size());
            long first;
            long last;
            synchronized (sequencer) {
                rejectCommittedIds(streamId, batch);
                Instant now = clock.instant();
                first = head + 1;
                for (int i = 0; i < batch.size(); i++) {
                    StoredEvent stored = StoredEvent.commit(batch.get(i), streamId,
                            expectedVersion + i + 1, first + i, now);
                    committed.add(stored);
                    eventIds.add(stored.eventId());
                    globalLog.put(stored.globalPosition(), stored);
                    stream.events.put(stored.streamVersion(), stored);
                }
                last = first + batch.size() - 1;
                stream.version = expectedVersion + batch.size();
                head = last;
                commitSink.tryEmitNext(last);
            }
            log.debug("[journal] appended stream={} versions={}..{} positions={}..{}",
                    streamId, expectedVersion + 1, stream.version, first, last);
            return new AppendResult(streamId, expectedVersion, stream.version, first, last, committed);
        } finally {
            stream.lock.unlock();
        }
    }

    @Override
    public Flux<StoredEvent> readStream(String streamId, long fromVersion) {
        return Flux.defer(() -> {
            StreamLog stream = streams.get(streamId);
            if (stream == null) return Flux.empty();
            long visible = stream.version;
            if (visible <= fromVersion) return Flux.empty();
            return Flux.fromIterable(stream.events.subMap(fromVersion, false, visible, true).values());
        });
    }

    @Override
    public Flux<StoredEvent> readAll(long fromPosition, long toPosition, EventTypeFilter filter) {
        EventTypeFilter effective = filter != null ? filter : EventTypeFilter.all();
        return Flux.defer(() -> {
            long upper = Math.min(toPosition, head);
            if (upper <= fromPosition) return Flux.empty();
            Flux<StoredEvent> range = Flux.fromIterable(globalLog.subMap(fromPosition, false, upper, true).values());
            return effective.isAll() ? range : range.filter(effective::matches);
        });
    }

    private void rejectCommittedIds(String streamId, List<NewEvent> batch) {
        synchronized (sequencer) {
            for (NewEvent event : batch) {
                if (eventIds.contains(event.eventId())) {
                    throw new ValidationException("Event id " + event.eventId() + " is already committed",
                            Map.of("streamId", streamId, "eventId", event.eventId()));
                }
            }
        }
    }

    @Override
    public Mono<Long> currentVersion(String streamId) {
        return Mono.fromCallable(() -> {
            StreamLog stream = streams.get(streamId);
            return stream != null ? stream.version : 0L;
        });
    }

    @Override
    public Mono<Long> headPosition() {
        return Mono.fromCallable(() -> head);
    }

    @Override
    public Flux<Long> commits() {
        return commitSink.asFlux();
    }

    @Override
    public Mono<Boolean> isHealthy() {
        return Mono.just(true);
    }

    // Test helpers
    public int streamCount() {
        return streams.size();
    }

    private static final class StreamLog {
        final ReentrantLock lock = new ReentrantLock();
        final ConcurrentSkipListMap<Long, StoredEvent> events = new ConcurrentSkipListMap<>();
        volatile long version;
    }
}
