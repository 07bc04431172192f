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

package org.fireflyframework.journal.unit.publication;

import org.fireflyframework.journal.core.context.JournalRuntime;
import org.fireflyframework.journal.core.model.NewEvent;
import org.fireflyframework.journal.core.model.ProjectionStatus;
import org.fireflyframework.journal.core.model.StoredEvent;
import org.fireflyframework.journal.projection.InMemoryCheckpointStore;
import org.fireflyframework.journal.projection.ProjectionCheckpoint;
import org.fireflyframework.journal.publication.EventPublicationRelay;
import org.fireflyframework.journal.publication.EventPublisher;
import org.fireflyframework.journal.publication.SinksEventPublisher;
import org.fireflyframework.journal.store.InMemoryEventStore;
import org.fireflyframework.journal.support.Await;
import org.fireflyframework.journal.support.OrderEvent;
import org.fireflyframework.journal.support.RecordingJournalEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class EventPublicationRelayTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemoryEventStore eventStore;
    private InMemoryCheckpointStore checkpoints;
    private RecordingJournalEvents events;
    private EventPublicationRelay relay;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        checkpoints = new InMemoryCheckpointStore();
        events = new RecordingJournalEvents();
    }

    @AfterEach
    void tearDown() {
        if (relay != null) {
            relay.stop();
        }
    }

    @Test
    void relay_publishesCommittedEventsInGlobalOrder() {
        SinksEventPublisher publisher = new SinksEventPublisher();
        List<Long> received = Collections.synchronizedList(new ArrayList<>());
        Disposable subscription = publisher.events().map(StoredEvent::globalPosition).subscribe(received::add);
        relay = relay(publisher, 3);

        relay.start();
        placeOrders(7);

        StepVerifier.create(relay.awaitPosition(7, TIMEOUT)).verifyComplete();
        assertThat(received).containsExactly(1L, 2L, 3L, 4L, 5L, 6L, 7L);
        assertThat(relay.getPosition()).isEqualTo(7);
        StepVerifier.create(checkpoints.find(EventPublicationRelay.CHECKPOINT_NAME))
                .assertNext(found -> assertThat(found).map(ProjectionCheckpoint::position).contains(7L))
                .verifyComplete();
        subscription.dispose();
    }

    @Test
    void relay_retriesFailingPublisherWithoutSkipping() {
        AtomicInteger attempts = new AtomicInteger();
        List<StoredEvent> published = Collections.synchronizedList(new ArrayList<>());
        EventPublisher flaky = batch -> Mono.defer(() -> {
            if (attempts.incrementAndGet() <= 2) {
                return Mono.error(new IllegalStateException("broker unavailable"));
            }
            published.addAll(batch);
            return Mono.empty();
        });
        relay = relay(flaky, 10);

        placeOrders(3);
        relay.start();

        StepVerifier.create(relay.awaitPosition(3, TIMEOUT)).verifyComplete();
        assertThat(published).extracting(StoredEvent::globalPosition).containsExactly(1L, 2L, 3L);
        assertThat(events.matching("publishFailed:")).containsExactly("publishFailed:1", "publishFailed:1");
    }

    @Test
    void relay_exhaustedRetries_offersBatchAgainOnNextCommit() {
        AtomicInteger attempts = new AtomicInteger();
        List<Long> published = Collections.synchronizedList(new ArrayList<>());
        EventPublisher flaky = batch -> Mono.defer(() -> {
            if (attempts.incrementAndGet() <= 2) {
                return Mono.error(new IllegalStateException("broker unavailable"));
            }
            batch.forEach(event -> published.add(event.globalPosition()));
            return Mono.empty();
        });
        relay = new EventPublicationRelay(eventStore, checkpoints, flaky, events,
                10, 1, Duration.ofMillis(5), null, null);

        placeOrders(2);
        relay.start();
        Await.until(() -> attempts.get() >= 2, TIMEOUT);
        assertThat(relay.getPosition()).isZero();

        placeOrders(1);

        StepVerifier.create(relay.awaitPosition(3, TIMEOUT)).verifyComplete();
        assertThat(published).containsExactly(1L, 2L, 3L);
    }

    @Test
    void relay_resumesFromStoredCheckpoint() {
        placeOrders(4);
        checkpoints.save(ProjectionCheckpoint.of(EventPublicationRelay.CHECKPOINT_NAME, 2,
                ProjectionStatus.RUNNING)).block();
        List<Long> published = Collections.synchronizedList(new ArrayList<>());
        relay = relay(batch -> Mono.fromRunnable(() -> batch.forEach(e -> published.add(e.globalPosition()))), 10);

        relay.start();

        StepVerifier.create(relay.awaitPosition(4, TIMEOUT)).verifyComplete();
        assertThat(published).containsExactly(3L, 4L);
    }

    @Test
    void runtime_startsRelayOnlyWhenPublisherConfigured() {
        JournalRuntime withoutPublisher = JournalRuntime.builder().eventStore(eventStore).build();
        assertThat(withoutPublisher.relay()).isNull();

        SinksEventPublisher publisher = new SinksEventPublisher();
        JournalRuntime runtime = JournalRuntime.builder()
                .eventStore(eventStore)
                .checkpointStore(checkpoints)
                .publisher(publisher)
                .publicationRetry(2, Duration.ofMillis(5))
                .build();
        runtime.start();
        try {
            assertThat(runtime.relay().isRunning()).isTrue();
            placeOrders(2);
            StepVerifier.create(runtime.relay().awaitPosition(2, TIMEOUT)).verifyComplete();
            StepVerifier.create(checkpoints.find(EventPublicationRelay.CHECKPOINT_NAME).map(Optional::isPresent))
                    .expectNext(true)
                    .verifyComplete();
        } finally {
            runtime.stop();
        }
        assertThat(runtime.relay().isRunning()).isFalse();
    }

    private EventPublicationRelay relay(EventPublisher publisher, int batchSize) {
        return new EventPublicationRelay(eventStore, checkpoints, publisher, events,
                batchSize, 5, Duration.ofMillis(5), null, null);
    }

    private void placeOrders(int count) {
        for (int i = 0; i < count; i++) {
            String orderId = "order-" + System.nanoTime() + "-" + i;
            eventStore.append(orderId, 0,
                    List.of(NewEvent.of(new OrderEvent.OrderPlaced(orderId, "c-1", 100)))).block();
        }
    }
}
