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

package org.fireflyframework.journal.unit.core;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.fireflyframework.journal.core.context.JournalRuntime;
import org.fireflyframework.journal.core.model.NewEvent;
import org.fireflyframework.journal.core.model.SagaStatus;
import org.fireflyframework.journal.core.observability.JournalMetrics;
import org.fireflyframework.journal.support.AccountEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

class JournalMetricsTest {

    private SimpleMeterRegistry registry;
    private JournalMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new JournalMetrics(registry);
    }

    @Test
    void appends_countBatchesAndEvents() {
        JournalRuntime runtime = JournalRuntime.builder().events(metrics).build();

        runtime.eventStore().append("acc-1", 0, List.of(
                NewEvent.of(new AccountEvent.Opened("ada", 10)),
                NewEvent.of(new AccountEvent.Deposited(5)))).block();
        assertThatThrownBy(() -> runtime.eventStore().append("acc-1", 0,
                List.of(NewEvent.of(new AccountEvent.Deposited(1)))).block());

        assertThat(registry.get("firefly.journal.appends").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("firefly.journal.events.appended").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("firefly.journal.appends.conflicts").counter().count()).isEqualTo(1.0);
    }

    @Test
    void sagaOutcomes_taggedByNameAndStatus() {
        metrics.onSagaStarted("Shipment", "s-1");
        metrics.onSagaStepFailed("Shipment", "s-1", "ship", new RuntimeException("carrier offline"));
        metrics.onSagaFinished("Shipment", "s-1", SagaStatus.COMPENSATED, 40);

        assertThat(registry.get("firefly.journal.sagas.started").tag("name", "Shipment").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("firefly.journal.saga.steps.failed").tag("stepId", "ship").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("firefly.journal.sagas.finished").tag("status", "COMPENSATED").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.get("firefly.journal.sagas.duration").timer().totalTime(TimeUnit.MILLISECONDS))
                .isEqualTo(40.0);
    }

    @Test
    void projectionAndPublication_areCounted() {
        metrics.onProjectionBatch("order-summary", 0, 10, 10);
        metrics.onProjectionBatch("order-summary", 10, 14, 4);
        metrics.onProjectionHandlerFailed("order-summary", null, new RuntimeException("bad"));
        metrics.onPublished(1, 5, 5);
        metrics.onPublishFailed(6, new RuntimeException("broker"));
        metrics.onDeadLettered("order-summary", "evt-1", "bad");

        assertThat(registry.get("firefly.journal.projection.events").tag("projection", "order-summary")
                .counter().count()).isEqualTo(14.0);
        assertThat(registry.get("firefly.journal.projection.failures").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("firefly.journal.events.published").counter().count()).isEqualTo(5.0);
        assertThat(registry.get("firefly.journal.publication.failures").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("firefly.journal.dlq.entries").tag("source", "order-summary").counter().count())
                .isEqualTo(1.0);
    }
}
