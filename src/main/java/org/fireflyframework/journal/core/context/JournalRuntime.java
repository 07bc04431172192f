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

package org.fireflyframework.journal.core.context;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.journal.core.dlq.DeadLetterService;
import org.fireflyframework.journal.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.journal.core.observability.JournalEvents;
import org.fireflyframework.journal.core.resilience.ResilienceDecorator;
import org.fireflyframework.journal.core.serialization.StateSerializer;
import org.fireflyframework.journal.projection.CheckpointStore;
import org.fireflyframework.journal.projection.InMemoryCheckpointStore;
import org.fireflyframework.journal.projection.ProjectionEngine;
import org.fireflyframework.journal.projection.ProjectionSettings;
import org.fireflyframework.journal.publication.EventPublicationRelay;
import org.fireflyframework.journal.publication.EventPublisher;
import org.fireflyframework.journal.snapshot.InMemorySnapshotStore;
import org.fireflyframework.journal.snapshot.SnapshotPolicy;
import org.fireflyframework.journal.snapshot.SnapshotStore;
import org.fireflyframework.journal.store.EventStore;
import org.fireflyframework.journal.store.EventValidator;
import org.fireflyframework.journal.store.InMemoryEventStore;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the stores and background workers of one journal. Repositories, coordinators and
 * dispatchers are handed a runtime explicitly; there is no process-wide state.
 *
 * <p>{@link #start()} starts projection workers and the publication relay;
 * {@link #stop()} stops them. Stores stay usable while the runtime is stopped.
 */
@Slf4j
public class JournalRuntime {

    private final EventStore eventStore;
    private final SnapshotStore snapshotStore;
    private final CheckpointStore checkpointStore;
    private final DeadLetterService deadLetters;
    private final StateSerializer serializer;
    private final JournalEvents events;
    private final SnapshotPolicy snapshotPolicy;
    private final Scheduler snapshotScheduler;
    private final Clock clock;
    private final ProjectionEngine projections;
    private final EventPublicationRelay relay;
    private final AtomicBoolean running = new AtomicBoolean();

    private JournalRuntime(Builder b) {
        this.events = b.events;
        this.clock = b.clock;
        this.eventStore = b.eventStore != null ? b.eventStore
                : new InMemoryEventStore(new EventValidator(EventValidator.DEFAULT_MAX_BATCH_SIZE), events, clock);
        this.snapshotStore = b.snapshotStore;
        this.checkpointStore = b.checkpointStore;
        this.deadLetters = b.deadLetters;
        this.serializer = b.serializer;
        this.snapshotPolicy = b.snapshotPolicy;
        this.snapshotScheduler = b.snapshotScheduler;
        this.projections = new ProjectionEngine(eventStore, checkpointStore, deadLetters, events, b.projectionSettings);
        this.relay = b.publisher == null ? null : new EventPublicationRelay(eventStore, checkpointStore, b.publisher,
                events, b.projectionSettings.batchSize(), b.publicationMaxRetries, b.publicationBackoff,
                b.projectionSettings.pollInterval(), b.resilience);
    }

    public static Builder builder() {
        return new Builder();
    }

    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        projections.start();
        if (relay != null) {
            relay.start();
        }
        log.info("[journal] Runtime started with {} projection(s)", projections.workers().size());
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (relay != null) {
            relay.stop();
        }
        projections.stop();
        log.info("[journal] Runtime stopped");
    }

    public boolean isRunning() { return running.get(); }

    public EventStore eventStore() { return eventStore; }
    public SnapshotStore snapshotStore() { return snapshotStore; }
    public CheckpointStore checkpointStore() { return checkpointStore; }
    /** May be {@code null} when dead-lettering is disabled. */
    public DeadLetterService deadLetters() { return deadLetters; }
    public StateSerializer serializer() { return serializer; }
    public JournalEvents events() { return events; }
    public SnapshotPolicy snapshotPolicy() { return snapshotPolicy; }
    public Scheduler snapshotScheduler() { return snapshotScheduler; }
    public Clock clock() { return clock; }
    public ProjectionEngine projections() { return projections; }
    /** May be {@code null} when no publisher is configured. */
    public EventPublicationRelay relay() { return relay; }

    public static final class Builder {
        private EventStore eventStore;
        private SnapshotStore snapshotStore = new InMemorySnapshotStore();
        private CheckpointStore checkpointStore = new InMemoryCheckpointStore();
        private JournalEvents events = new JournalEvents() {};
        private DeadLetterService deadLetters;
        private boolean deadLettersDisabled;
        private StateSerializer serializer = new StateSerializer();
        private SnapshotPolicy snapshotPolicy = SnapshotPolicy.everyNEvents(100);
        private Scheduler snapshotScheduler = Schedulers.boundedElastic();
        private Clock clock = Clock.systemUTC();
        private ProjectionSettings projectionSettings = ProjectionSettings.defaults();
        private EventPublisher publisher;
        private int publicationMaxRetries = 5;
        private Duration publicationBackoff = Duration.ofMillis(200);
        private ResilienceDecorator resilience;

        private Builder() {
        }

        public Builder eventStore(EventStore eventStore) { this.eventStore = eventStore; return this; }
        public Builder snapshotStore(SnapshotStore snapshotStore) { this.snapshotStore = snapshotStore; return this; }
        public Builder checkpointStore(CheckpointStore checkpointStore) { this.checkpointStore = checkpointStore; return this; }
        public Builder events(JournalEvents events) { this.events = events; return this; }
        public Builder deadLetters(DeadLetterService deadLetters) { this.deadLetters = deadLetters; return this; }
        public Builder withoutDeadLetters() { this.deadLettersDisabled = true; return this; }
        public Builder serializer(StateSerializer serializer) { this.serializer = serializer; return this; }
        public Builder snapshotPolicy(SnapshotPolicy snapshotPolicy) { this.snapshotPolicy = snapshotPolicy; return this; }
        public Builder snapshotScheduler(Scheduler scheduler) { this.snapshotScheduler = scheduler; return this; }
        public Builder clock(Clock clock) { this.clock = clock; return this; }
        public Builder projectionSettings(ProjectionSettings settings) { this.projectionSettings = settings; return this; }
        public Builder resilience(ResilienceDecorator resilience) { this.resilience = resilience; return this; }

        /**
         * Enables the publication relay towards {@code publisher}.
         */
        public Builder publisher(EventPublisher publisher) { this.publisher = publisher; return this; }

        public Builder publicationRetry(int maxRetries, Duration backoff) {
            this.publicationMaxRetries = maxRetries;
            this.publicationBackoff = backoff;
            return this;
        }

        public JournalRuntime build() {
            Objects.requireNonNull(events, "events");
            Objects.requireNonNull(projectionSettings, "projectionSettings");
            if (deadLettersDisabled) {
                deadLetters = null;
            } else if (deadLetters == null) {
                deadLetters = new DeadLetterService(new InMemoryDeadLetterStore(), events);
            }
            return new JournalRuntime(this);
        }
    }
}
