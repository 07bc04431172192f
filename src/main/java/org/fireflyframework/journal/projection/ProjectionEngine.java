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
import org.fireflyframework.journal.core.dlq.DeadLetterService;
import org.fireflyframework.journal.core.model.EventTypeFilter;
import org.fireflyframework.journal.core.model.ProjectionStatus;
import org.fireflyframework.journal.core.observability.JournalEvents;
import org.fireflyframework.journal.store.EventStore;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry and lifecycle owner of projection workers. Each projection is isolated:
 * a failing or rebuilding projection does not delay any other.
 */
@Slf4j
public class ProjectionEngine {

    private final EventStore eventStore;
    private final CheckpointStore checkpointStore;
    private final DeadLetterService deadLetters;
    private final JournalEvents events;
    private final ProjectionSettings settings;
    private final Map<String, ProjectionWorker> workers = new ConcurrentHashMap<>();
    private volatile boolean running;

    public ProjectionEngine(EventStore eventStore, CheckpointStore checkpointStore, DeadLetterService deadLetters,
                            JournalEvents events, ProjectionSettings settings) {
        this.eventStore = eventStore;
        this.checkpointStore = checkpointStore;
        this.deadLetters = deadLetters;
        this.events = events;
        this.settings = settings;
    }

    /**
     * Registers a projection. If the engine is already running the worker starts immediately.
     *
     * @throws IllegalStateException if a projection with the same name exists
     */
    public ProjectionWorker subscribe(String name, EventTypeFilter filter, Supplier<? extends ProjectionHandler> handlerFactory) {
        return subscribe(new ProjectionDefinition(name, filter, handlerFactory));
    }

    public synchronized ProjectionWorker subscribe(ProjectionDefinition definition) {
        if (workers.containsKey(definition.name())) {
            throw new IllegalStateException("Projection '" + definition.name() + "' is already registered");
        }
        var worker = new ProjectionWorker(definition, eventStore, checkpointStore, deadLetters, events, settings);
        workers.put(definition.name(), worker);
        log.info("[projection] Registered projection '{}'", definition.name());
        if (running) {
            worker.start();
        }
        return worker;
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        workers.values().forEach(ProjectionWorker::start);
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        workers.values().forEach(ProjectionWorker::stop);
    }

    public boolean isRunning() { return running; }

    public ProjectionWorker worker(String name) {
        var worker = workers.get(name);
        if (worker == null) {
            throw new IllegalArgumentException("Unknown projection: " + name);
        }
        return worker;
    }

    public Collection<ProjectionWorker> workers() {
        return List.copyOf(workers.values());
    }

    /**
     * Current read model of a projection, for queries.
     */
    public <H> H readModel(String name, Class<H> type) {
        return type.cast(worker(name).getReadModel());
    }

    public Mono<Long> rebuild(String name) {
        return Mono.defer(() -> worker(name).rebuild());
    }

    public boolean cancelRebuild(String name) {
        return worker(name).cancelRebuild();
    }

    public Mono<Void> restart(String name) {
        return Mono.defer(() -> worker(name).restart());
    }

    public Mono<Void> awaitPosition(String name, long position, Duration timeout) {
        return Mono.defer(() -> worker(name).awaitPosition(position, timeout));
    }

    /**
     * Waits until the projection has processed everything committed at the time of the call.
     */
    public Mono<Void> awaitHead(String name, Duration timeout) {
        return eventStore.headPosition().flatMap(head -> awaitPosition(name, head, timeout));
    }

    public long checkpoint(String name) {
        return worker(name).getPosition();
    }

    public ProjectionStatus status(String name) {
        return worker(name).getStatus();
    }

    public Map<String, ProjectionStatus> statuses() {
        Map<String, ProjectionStatus> result = new LinkedHashMap<>();
        workers.values().forEach(w -> result.put(w.getName(), w.getStatus()));
        return result;
    }
}
