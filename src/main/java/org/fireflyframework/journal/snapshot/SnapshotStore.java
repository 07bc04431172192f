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

package org.fireflyframework.journal.snapshot;

import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Checkpoints of aggregate state keyed by {@code (streamId, version)}.
 * Later snapshots supersede earlier ones; pruning is left to a retention policy.
 */
public interface SnapshotStore {

    Mono<Void> save(Snapshot snapshot);

    /**
     * Latest snapshot of the stream, if any.
     */
    Mono<Optional<Snapshot>> findLatest(String streamId);

    /**
     * Latest snapshot whose version does not exceed {@code maxVersion}.
     */
    Mono<Optional<Snapshot>> findLatest(String streamId, long maxVersion);

    /**
     * Removes snapshots older than the newest {@code keep} for the stream.
     */
    Mono<Long> prune(String streamId, int keep);
}
