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

package org.fireflyframework.journal.integration;

import org.fireflyframework.journal.aggregate.AggregateRepository;
import org.fireflyframework.journal.command.CommandDispatcher;
import org.fireflyframework.journal.command.CommandResult;
import org.fireflyframework.journal.core.context.JournalRuntime;
import org.fireflyframework.journal.core.model.NewEvent;
import org.fireflyframework.journal.core.model.SagaStatus;
import org.fireflyframework.journal.core.model.StoredEvent;
import org.fireflyframework.journal.projection.ProjectionSettings;
import org.fireflyframework.journal.publication.SinksEventPublisher;
import org.fireflyframework.journal.saga.builder.SagaBuilder;
import org.fireflyframework.journal.saga.engine.SagaCoordinator;
import org.fireflyframework.journal.saga.registry.SagaDefinition;
import org.fireflyframework.journal.saga.registry.SagaRegistry;
import org.fireflyframework.journal.snapshot.InMemorySnapshotStore;
import org.fireflyframework.journal.snapshot.SnapshotPolicy;
import org.fireflyframework.journal.support.AccountAggregate;
import org.fireflyframework.journal.support.Await;
import org.fireflyframework.journal.support.OrderEvent;
import org.fireflyframework.journal.support.OrderSummaryProjection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Drives aggregates, projections, sagas and publication through one running runtime.
 */
class JournalRuntimeIntegrationTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);

    private InMemorySnapshotStore snapshotStore;
    private SinksEventPublisher publisher;
    private List<StoredEvent> published;
    private Disposable publishedSubscription;
    private JournalRuntime runtime;

    @BeforeEach
    void setUp() {
        snapshotStore = new InMemorySnapshotStore();
        publisher = new SinksEventPublisher();
        published = Collections.synchronizedList(new ArrayList<>());
        publishedSubscription = publisher.events().subscribe(published::add);
        runtime = JournalRuntime.builder()
                .snapshotStore(snapshotStore)
                .snapshotPolicy(SnapshotPolicy.everyNEvents(5))
                .snapshotScheduler(Schedulers.immediate())
                .projectionSettings(ProjectionSettings.defaults().withParallelism(4))
                .publisher(publisher)
                .publicationRetry(3, Duration.ofMillis(5))
                .build();
        runtime.projections().subscribe(OrderSummaryProjection.definition());
        runtime.start();
    }

    @AfterEach
    void tearDown() {
        runtime.stop();
        publishedSubscription.dispose();
    }

    @Test
    void accountCommands_replaySnapshotAndPublish() {
        var accounts = new AggregateRepository<>(runtime, AccountAggregate::new);
        var dispatcher = new CommandDispatcher();

        StepVerifier.create(dispatcher.dispatch(accounts, "acc-1", account -> account.open("ada", 1000)))
                .assertNext(result -> assertThat(result.isSuccess()).isTrue())
                .verifyComplete();
        StepVerifier.create(dispatcher.dispatch(accounts, "acc-1", account -> account.withdraw(250)))
                .assertNext(result -> assertThat(result).isEqualTo(new CommandResult.Success("acc-1", 1, 2, 1)))
                .verifyComplete();
        for (int i = 0; i < 4; i++) {
            dispatcher.dispatch(accounts, "acc-1", account -> account.deposit(10)).block();
        }

        StepVerifier.create(accounts.load("acc-1"))
                .assertNext(account -> {
                    assertThat(account.getVersion()).isEqualTo(6);
                    assertThat(account.getState().balance()).isEqualTo(790);
                })
                .verifyComplete();
        assertThat(snapshotStore.size("acc-1")).isEqualTo(1);

        StepVerifier.create(runtime.relay().awaitPosition(6, TIMEOUT)).verifyComplete();
        assertThat(published).extracting(StoredEvent::streamVersion).containsExactly(1L, 2L, 3L, 4L, 5L, 6L);
    }

    @Test
    void liveProjection_matchesRebuildOverManyStreams() {
        for (int i = 0; i < 200; i++) {
            String orderId = "o-" + i;
            List<NewEvent> batch = new ArrayList<>();
            batch.add(NewEvent.of(new OrderEvent.OrderPlaced(orderId, "c-" + (i % 7), 100 + i)));
            if (i % 3 == 0) {
                batch.add(NewEvent.of(new OrderEvent.OrderShipped(orderId)));
            }
            runtime.eventStore().append(orderId, 0, batch).block();
        }
        StepVerifier.create(runtime.projections().awaitHead(OrderSummaryProjection.NAME, TIMEOUT)).verifyComplete();
        var live = runtime.projections().readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class).rows();

        StepVerifier.create(runtime.projections().rebuild(OrderSummaryProjection.NAME))
                .assertNext(head -> assertThat(head).isEqualTo(267L))
                .verifyComplete();

        var rebuilt = runtime.projections().readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class).rows();
        assertThat(rebuilt).hasSize(7).isEqualTo(live);
    }

    @Test
    void failedSaga_compensatesAndProjectionSeesCancellation() {
        AtomicInteger shipped = new AtomicInteger();
        SagaDefinition placeOrder = SagaBuilder.saga("PlaceOrder")
                .step("reserve")
                    .handler(ctx -> runtime.eventStore().append("order-77", 0, List.of(NewEvent.of(
                            new OrderEvent.OrderPlaced("order-77", "c-9", 4200), ctx.commandMetadata()))))
                    .compensation((result, ctx) -> runtime.eventStore().append("order-77", 1, List.of(NewEvent.of(
                            new OrderEvent.OrderCancelled("order-77"), ctx.commandMetadata()))).then())
                    .add()
                .step("charge")
                    .handler(() -> Mono.error(new IllegalStateException("card declined")))
                    .add()
                .step("ship")
                    .handler(() -> Mono.fromCallable(shipped::incrementAndGet))
                    .add()
                .build();
        var coordinator = new SagaCoordinator(runtime, new SagaRegistry(List.of(placeOrder)));

        StepVerifier.create(coordinator.execute("PlaceOrder", "po-77", "order-77"))
                .assertNext(result -> {
                    assertThat(result.status()).isEqualTo(SagaStatus.COMPENSATED);
                    assertThat(result.compensatedSteps()).containsExactly("reserve");
                    assertThat(result.failedStepId()).contains("charge");
                })
                .verifyComplete();
        assertThat(shipped).hasValue(0);

        Await.until(() -> {
            var row = runtime.projections()
                    .readModel(OrderSummaryProjection.NAME, OrderSummaryProjection.class).rows().get("c-9");
            return row != null && row.cancelled() == 1;
        }, TIMEOUT);
        StepVerifier.create(runtime.eventStore().readStream("order-77", 0).collectList())
                .assertNext(events -> assertThat(events)
                        .extracting(StoredEvent::causationId)
                        .containsExactly("po-77:reserve", "po-77:reserve"))
                .verifyComplete();
    }
}
