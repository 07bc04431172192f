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

package org.fireflyframework.journal.unit.projection;

import org.fireflyframework.journal.core.dlq.DeadLetterService;
import org.fireflyframework.journal.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.journal.core.exception.ProjectionHandlerException;
import org.fireflyframework.journal.core.model.EventTypeFilter;
import org.fireflyframework.journal.core.model.NewEvent;
import org.fireflyframework.journal.core.model.ProjectionStatus;
import org.fireflyframework.journal.projection.InMemoryCheckpointStore;
import org.fireflyframework.journal.projection.ProjectionCheckpoint;
import org.fireflyframework.journal.projection.ProjectionEngine;
import org.fireflyframework.journal.projection.ProjectionFailurePolicy;
import org.fireflyframework.journal.projection.ProjectionHandler;
import org.fireflyframework.journal.projection.ProjectionSettings;
import org.fireflyframework.journal.store.InMemoryEventStore;
import org.fireflyframework.journal.support.Await;
import org.fireflyframework.journal.support.OrderEvent;
import org.fireflyframework.journal.support.OrderSummaryProjection;
import org.fireflyframework.journal.support.RecordingJournalEvents;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class ProjectionRebuildTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private InMemoryEventStore eventStore;
    private InMemoryCheckpointStore checkpoints;
    private RecordingJournalEvents events;
    private ProjectionEngine engine;

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        checkpoints = new InMemoryCheckpointStore();
        events = new RecordingJournalEvents();
    }

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.stop();
        }
    }

    private void startEngine(ProjectionSettings settings) {
        engine = new ProjectionEngine(eventStore, checkpoints,
                new DeadLetterService(new InMemoryDeadLetterStore(), events), events, settings);
        engine.subscribe(OrderSummaryProjection.definition());
        engine.start();
    }

    private void placeOrders(int orders) {
        for (int i = 0; i < orders; i++) {
            String orderId = "o-" + i;
            OrderEvent followUp = i % 3 == 0 ? new OrderEvent.OrderCancelled(orderId) : new OrderEvent.OrderShipped(orderId);
            eventStore.append("order-" + orderId, 0, List.of(
                    NewEvent.of(new OrderEvent.OrderPlaced(orderId, "c-" + (i % 37), 100L + i)),
                    NewEvent.of(followUp))).block();
        }
    }

    @Test
    void rebuild_tenThousandEvents_matchesLiveReadModel() {
        startEngine(ProjectionSettings.defaults());
        placeOrders(5_000);
        StepVerifier.create(eventStore.headPosition()).expectNext(10_000L).verifyComplete();
        StepVerifier.create(engine.awaitHead(OrderSummaryProjection.NAME, TIMEOUT)).verifyComplete();

        OrderSummaryProjection live = engine.readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class);
        var liveRows = live.rows();
        long livePosition = engine.checkpoint(OrderSummaryProjection.NAME);

        StepVerifier.create(engine.rebuild(OrderSummaryProjection.NAME))
                .expectNext(10_000L)
                .verifyComplete();

        OrderSummaryProjection rebuilt = engine.readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class);
        assertThat(rebuilt).isNotSameAs(live);
        assertThat(engine.checkpoint(OrderSummaryProjection.NAME)).isEqualTo(livePosition);
        assertThat(rebuilt.rowCount()).isEqualTo(live.rowCount()).isEqualTo(37);
        assertThat(rebuilt.rows()).isEqualTo(liveRows);
        assertThat(engine.status(OrderSummaryProjection.NAME)).isEqualTo(ProjectionStatus.RUNNING);
    }

    @Test
    void rebuild_withParallelWorkers_matchesLiveReadModel() {
        startEngine(ProjectionSettings.defaults().withParallelism(4).withBatchSize(500));
        placeOrders(1_000);
        StepVerifier.create(engine.awaitHead(OrderSummaryProjection.NAME, TIMEOUT)).verifyComplete();
        var liveRows = engine.readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class).rows();

        StepVerifier.create(engine.rebuild(OrderSummaryProjection.NAME))
                .expectNext(2_000L)
                .verifyComplete();
        assertThat(engine.readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class).rows())
                .isEqualTo(liveRows);
    }

    @Test
    void rebuild_thenNewEvents_areAppliedToRebuiltModel() {
        startEngine(ProjectionSettings.defaults());
        placeOrders(10);
        StepVerifier.create(engine.rebuild(OrderSummaryProjection.NAME)).expectNext(20L).verifyComplete();

        eventStore.append("order-o-new", 0, List.of(
                NewEvent.of(new OrderEvent.OrderPlaced("o-new", "c-new", 5)))).block();
        StepVerifier.create(engine.awaitPosition(OrderSummaryProjection.NAME, 21, TIMEOUT)).verifyComplete();

        assertThat(engine.readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class).rows())
                .containsKey("c-new");
    }

    @Test
    void cancelRebuild_keepsPreviousReadModelAndCheckpoint() {
        AtomicInteger created = new AtomicInteger();
        CountDownLatch release = new CountDownLatch(1);
        engine = new ProjectionEngine(eventStore, checkpoints, null, events, ProjectionSettings.defaults().withBatchSize(1));
        engine.subscribe("blocking", EventTypeFilter.all(), () -> {
            boolean shadow = created.incrementAndGet() > 1;
            return (ProjectionHandler) event -> {
                if (shadow) {
                    release.await(5, TimeUnit.SECONDS);
                }
            };
        });
        engine.start();
        for (int i = 0; i < 5; i++) {
            eventStore.append("s-" + i, 0, List.of(NewEvent.of(new OrderEvent.OrderShipped("o-" + i)))).block();
        }
        StepVerifier.create(engine.awaitHead("blocking", TIMEOUT)).verifyComplete();
        ProjectionHandler before = engine.readModel("blocking", ProjectionHandler.class);

        var result = engine.rebuild("blocking").cache();
        result.subscribe(head -> {}, error -> {});
        Await.until(() -> storedStatus("blocking") == ProjectionStatus.REBUILDING, TIMEOUT);
        assertThat(engine.worker("blocking").isRebuilding()).isTrue();
        assertThat(checkpoints.find("blocking").block()).map(ProjectionCheckpoint::position).contains(5L);
        assertThat(engine.cancelRebuild("blocking")).isTrue();
        release.countDown();

        StepVerifier.create(result)
                .expectError(CancellationException.class)
                .verify(TIMEOUT);
        Await.until(() -> engine.status("blocking") == ProjectionStatus.RUNNING, TIMEOUT);
        assertThat(engine.readModel("blocking", ProjectionHandler.class)).isSameAs(before);
        assertThat(engine.checkpoint("blocking")).isEqualTo(5);
        assertThat(storedStatus("blocking")).isEqualTo(ProjectionStatus.RUNNING);
        assertThat(engine.worker("blocking").isRebuilding()).isFalse();
        assertThat(events.matching("rebuildCancelled")).containsExactly("rebuildCancelled:blocking");
    }

    @Test
    void rebuild_backToBack_eachRequestCompletes() {
        startEngine(ProjectionSettings.defaults());
        placeOrders(20);
        StepVerifier.create(engine.awaitHead(OrderSummaryProjection.NAME, TIMEOUT)).verifyComplete();
        var liveRows = engine.readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class).rows();

        for (int i = 0; i < 10; i++) {
            StepVerifier.create(engine.rebuild(OrderSummaryProjection.NAME))
                    .expectNext(40L)
                    .verifyComplete();
            assertThat(engine.worker(OrderSummaryProjection.NAME).isRebuilding()).isFalse();
        }
        assertThat(engine.readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class).rows())
                .isEqualTo(liveRows);
        assertThat(storedStatus(OrderSummaryProjection.NAME)).isEqualTo(ProjectionStatus.RUNNING);
    }

    @Test
    void rebuild_failingEventUnderSkip_isDeadLetteredOnce() {
        DeadLetterService deadLetters = new DeadLetterService(new InMemoryDeadLetterStore(), events);
        engine = new ProjectionEngine(eventStore, checkpoints, deadLetters, events, ProjectionSettings.defaults());
        engine.subscribe("picky", EventTypeFilter.all(), () -> event -> {
            if (event.globalPosition() == 2) {
                throw new IllegalStateException("unreadable order");
            }
        });
        engine.start();
        placeOrders(2);
        StepVerifier.create(engine.awaitHead("picky", TIMEOUT)).verifyComplete();
        String failingEventId = eventStore.readAll(1, 2, EventTypeFilter.all()).blockFirst().eventId();

        StepVerifier.create(engine.rebuild("picky")).expectNext(4L).verifyComplete();
        StepVerifier.create(engine.rebuild("picky")).expectNext(4L).verifyComplete();

        StepVerifier.create(deadLetters.getAllEntries().collectList())
                .assertNext(entries -> assertThat(entries).singleElement().satisfies(entry -> {
                    assertThat(entry.source()).isEqualTo("picky");
                    assertThat(entry.reference()).isEqualTo(failingEventId);
                }))
                .verifyComplete();
        assertThat(events.matching("deadLettered:")).containsExactly("deadLettered:picky:" + failingEventId);
    }

    private ProjectionStatus storedStatus(String name) {
        return checkpoints.find(name).block().map(ProjectionCheckpoint::status).orElse(null);
    }

    @Test
    void rebuild_concurrentRequest_rejected() {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger created = new AtomicInteger();
        engine = new ProjectionEngine(eventStore, checkpoints, null, events, ProjectionSettings.defaults());
        engine.subscribe("slow", EventTypeFilter.all(), () -> {
            boolean shadow = created.incrementAndGet() > 1;
            return (ProjectionHandler) event -> {
                if (shadow) {
                    release.await(5, TimeUnit.SECONDS);
                }
            };
        });
        engine.start();
        eventStore.append("s-1", 0, List.of(NewEvent.of(new OrderEvent.OrderShipped("o-1")))).block();
        StepVerifier.create(engine.awaitHead("slow", TIMEOUT)).verifyComplete();

        var first = engine.rebuild("slow").cache();
        first.subscribe(head -> {}, error -> {});
        StepVerifier.create(engine.rebuild("slow"))
                .expectErrorSatisfies(e -> assertThat(e).isInstanceOf(IllegalStateException.class)
                        .hasMessageContaining("already rebuilding"))
                .verify();
        release.countDown();
        StepVerifier.create(first).expectNext(1L).verifyComplete();
    }

    @Test
    void rebuild_haltOnFailure_keepsPreviousModel() {
        AtomicInteger created = new AtomicInteger();
        engine = new ProjectionEngine(eventStore, checkpoints, null, events,
                ProjectionSettings.defaults().withFailurePolicy(ProjectionFailurePolicy.HALT));
        engine.subscribe("fragile", EventTypeFilter.all(), () -> {
            boolean shadow = created.incrementAndGet() > 1;
            return (ProjectionHandler) event -> {
                if (shadow && event.globalPosition() == 2) {
                    throw new IllegalStateException("cannot rebuild");
                }
            };
        });
        engine.start();
        placeOrders(1);
        StepVerifier.create(engine.awaitHead("fragile", TIMEOUT)).verifyComplete();
        ProjectionHandler before = engine.readModel("fragile", ProjectionHandler.class);

        StepVerifier.create(engine.rebuild("fragile"))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ProjectionHandlerException.class);
                    assertThat(((ProjectionHandlerException) e).getGlobalPosition()).isEqualTo(2);
                })
                .verify(TIMEOUT);
        assertThat(engine.readModel("fragile", ProjectionHandler.class)).isSameAs(before);
        assertThat(engine.status("fragile")).isEqualTo(ProjectionStatus.RUNNING);
        assertThat(engine.checkpoint("fragile")).isEqualTo(2);
    }
}
