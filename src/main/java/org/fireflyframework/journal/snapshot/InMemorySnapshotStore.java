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

import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

public class InMemorySnapshotStore implements SnapshotStore {

    private final ConcurrentHashMap<String, ConcurrentSkipListMap<Long, Snapshot>> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> save(Snapshot snapshot) {
        return Mono.fromRunnable(() -> store
                .computeIfAbsent(snapshot.streamId(), k -> new ConcurrentSkipListMap<>())
                .put(snapshot.version(), snapshot));
    }

    @Override
    public Mono<Optional<Snapshot>> findLatest(String streamId) {
        return findLatest(streamId, Long.MAX_VALUE);
    }

    @Override
    public Mono<Optional<Snapshot>> findLatest(String streamId, long maxVersion) {
        return Mono.fromCallable(() -> {
            NavigableMap<Long, Snapshot> versions = store.get(streamId);
            if (versions == null) return Optional.empty();
            Map.Entry<Long, Snapshot> entry = versions.floorEntry(maxVersion);
            return Optional.ofNullable(entry).map(Map.Entry::getValue);
        });
    }

    @Override
    public Mono<Long> prune(String streamId, int keep) {
        return Mono.fromCallable(() -> {
            ConcurrentSkipListMap<Long, Snapshot> versions = store.get(streamId);
            if (versions == null) return 0L;
            long removed = 0;
            while (versions.size() > Math.max(keep, 1)) {
                versions.pollFirstEntry();
                removed++;
            }
            return removed;
        });
    }

    // Test helpers
    public int size(String streamId) {
        var versions = store.get(streamId);
        return versions != null ? versions.size() : 0;
    }
    public void clear() { store.clear(); }
}
