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

import org.fireflyframework.journal.core.model.AppendResult;
import org.fireflyframework.journal.core.model.EventTypeFilter;
import org.fireflyframework.journal.core.model.NewEvent;
import org.fireflyframework.journal.core.model.StoredEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Durable, append-only, per-stream ordered event log with a global cross-stream order.
 *
 * <p>Implementations must guarantee:
 * <ul>
 *   <li>per-stream versions are contiguous integers starting at 1;</li>
 *   <li>global positions are strictly increasing and consecutive across all streams;</li>
 *   <li>a batch becomes visible to readers all at once, or not at all;</li>
 *   <li>appends to different streams do not wait for each other beyond position assignment.</li>
 * </ul>
 *
 * <p>Write failures are signalled as {@code ValidationException},
 * {@code VersionConflictException} or {@code StorageFailureException}. The store never
 * retries on behalf of the caller.
 */
public interface EventStore {

    long UNBOUNDED = Long.MAX_VALUE;

    /**
     * Appends a batch to {@code streamId} if the stream is still at {@code expectedVersion}.
     */
    Mono<AppendResult> append(String streamId, long expectedVersion, List<NewEvent> events);

    /**
     * Events of one stream with {@code streamVersion > fromVersion}, in version order.
     * The returned sequence is cold: every subscription reads the stream afresh.
     */
    Flux<StoredEvent> readStream(String streamId, long fromVersion);

    default Flux<StoredEvent> readStream(String streamId) {
        return readStream(streamId, 0);
    }

    /**
     * Events with {@code fromPosition < globalPosition <= toPosition} across all streams,
     * in global order, optionally restricted by type. Bounded by the head at subscription time.
     */
    Flux<StoredEvent> readAll(long fromPosition, long toPosition, EventTypeFilter filter);

    default Flux<StoredEvent> readAll(long fromPosition) {
        return readAll(fromPosition, UNBOUNDED, EventTypeFilter.all());
    }

    default Flux<StoredEvent> readAll() {
        return readAll(0);
    }

    /**
     * Current version of a stream, 0 when it does not exist.
     */
    Mono<Long> currentVersion(String streamId);

    /**
     * Global position of the last committed event, 0 when the store is empty.
     */
    Mono<Long> headPosition();

    /**
     * Hot signal of the new head position after each commit. Late subscribers only
     * see commits made after they subscribed. Signals may arrive on the committing
     * thread, so subscribers hand work off instead of doing it inline.
     */
    Flux<Long> commits();

    Mono<Boolean> isHealthy();
}
