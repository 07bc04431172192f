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

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCheckpointStore implements CheckpointStore {
    private final ConcurrentHashMap<String, ProjectionCheckpoint> store = new ConcurrentHashMap<>();

    @Override
    public Mono<Void> save(ProjectionCheckpoint checkpoint) {
        return Mono.fromRunnable(() -> store.put(checkpoint.projectionName(), checkpoint));
    }

    @Override
    public Mono<Optional<ProjectionCheckpoint>> find(String projectionName) {
        return Mono.fromCallable(() -> Optional.ofNullable(store.get(projectionName)));
    }

    @Override
    public Flux<ProjectionCheckpoint> findAll() {
        return Flux.defer(() -> Flux.fromIterable(store.values()));
    }

    @Override
    public Mono<Void> delete(String projectionName) {
        return Mono.fromRunnable(() -> store.remove(projectionName));
    }
}
