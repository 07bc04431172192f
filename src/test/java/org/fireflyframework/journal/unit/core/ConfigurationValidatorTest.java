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

import org.fireflyframework.journal.config.JournalProperties;
import org.fireflyframework.journal.core.validation.ConfigurationValidator;
import org.fireflyframework.journal.saga.builder.SagaBuilder;
import org.fireflyframework.journal.saga.registry.SagaRegistry;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ConfigurationValidatorTest {

    @Test
    void defaults_areValid() {
        var result = new ConfigurationValidator(new JournalProperties(), null).validate();

        assertThat(result.isValid()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.warnings()).isEmpty();
    }

    @Test
    void outOfRangeSettings_areErrors() {
        JournalProperties properties = new JournalProperties();
        properties.getEventStore().setMaxBatchSize(0);
        properties.getSnapshot().setInterval(-1);
        properties.getProjection().setBatchSize(0);
        properties.getProjection().setParallelism(0);
        properties.getProjection().setPollInterval(Duration.ofSeconds(-1));
        properties.getPublication().setMaxRetries(-1);
        properties.getPublication().setBackoff(Duration.ZERO);
        properties.getSaga().setStreamPrefix(" ");
        properties.getSaga().setStepTimeout(null);

        var result = new ConfigurationValidator(properties, null).validate();

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).hasSize(9);
        assertThat(result.errors()).anySatisfy(e -> assertThat(e).startsWith("event-store.max-batch-size"));
        assertThat(result.errors()).anySatisfy(e -> assertThat(e).startsWith("saga.stream-prefix"));
    }

    @Test
    void disabledSnapshots_ignoreInterval() {
        JournalProperties properties = new JournalProperties();
        properties.getSnapshot().setEnabled(false);
        properties.getSnapshot().setInterval(0);

        assertThat(new ConfigurationValidator(properties, null).validate().isValid()).isTrue();
    }

    @Test
    void disabledPolling_andUncompensatedSteps_areWarnings() {
        JournalProperties properties = new JournalProperties();
        properties.getProjection().setPollInterval(Duration.ZERO);
        SagaRegistry registry = new SagaRegistry(List.of(SagaBuilder.saga("Shipment")
                .step("pack").handler(() -> Mono.just("packed")).compensation(() -> Mono.empty()).add()
                .step("notify").handler(() -> Mono.just("sent")).add()
                .build()));

        var result = new ConfigurationValidator(properties, registry).validate();

        assertThat(result.isValid()).isTrue();
        assertThat(result.warnings()).hasSize(2);
        assertThat(result.warnings()).anySatisfy(w -> assertThat(w).contains("'notify' has no compensation"));
    }
}
