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

package org.fireflyframework.journal.core.validation;

import org.fireflyframework.journal.config.JournalProperties;
import org.fireflyframework.journal.saga.registry.SagaDefinition;
import org.fireflyframework.journal.saga.registry.SagaRegistry;
import org.fireflyframework.journal.saga.registry.SagaStepDefinition;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates journal configuration at startup, detecting out-of-range settings
 * and saga definitions that cannot run.
 */
@Slf4j
public class ConfigurationValidator {

    private final JournalProperties properties;
    private final SagaRegistry sagaRegistry;

    public ConfigurationValidator(JournalProperties properties, SagaRegistry sagaRegistry) {
        this.properties = properties;
        this.sagaRegistry = sagaRegistry;
    }

    public record ValidationResult(List<String> errors, List<String> warnings) {
        public boolean isValid() { return errors.isEmpty(); }
    }

    public ValidationResult validate() {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        validateStore(errors);
        validateProjection(errors, warnings);
        validatePublication(errors);
        validateSagas(errors, warnings);

        if (errors.isEmpty()) {
            log.info("[validation] Journal configuration valid");
        } else {
            log.error("[validation] Found {} error(s) in journal configuration", errors.size());
            errors.forEach(e -> log.error("[validation]   - {}", e));
        }
        if (!warnings.isEmpty()) {
            warnings.forEach(w -> log.warn("[validation]   - {}", w));
        }

        return new ValidationResult(List.copyOf(errors), List.copyOf(warnings));
    }

    private void validateStore(List<String> errors) {
        if (properties.getEventStore().getMaxBatchSize() <= 0) {
            errors.add("event-store.max-batch-size must be positive, got "
                    + properties.getEventStore().getMaxBatchSize());
        }
        JournalProperties.SnapshotProperties snapshot = properties.getSnapshot();
        if (snapshot.isEnabled() && snapshot.getInterval() <= 0) {
            errors.add("snapshot.interval must be positive when snapshots are enabled, got " + snapshot.getInterval());
        }
    }

    private void validateProjection(List<String> errors, List<String> warnings) {
        JournalProperties.ProjectionProperties projection = properties.getProjection();
        if (projection.getBatchSize() <= 0) {
            errors.add("projection.batch-size must be positive, got " + projection.getBatchSize());
        }
        if (projection.getParallelism() <= 0) {
            errors.add("projection.parallelism must be positive, got " + projection.getParallelism());
        }
        Duration poll = projection.getPollInterval();
        if (poll == null || poll.isZero()) {
            warnings.add("projection.poll-interval disabled: projections rely on commit notifications only");
        } else if (poll.isNegative()) {
            errors.add("projection.poll-interval must not be negative, got " + poll);
        }
    }

    private void validatePublication(List<String> errors) {
        JournalProperties.PublicationProperties publication = properties.getPublication();
        if (publication.getMaxRetries() < 0) {
            errors.add("publication.max-retries must not be negative, got " + publication.getMaxRetries());
        }
        if (!isPositive(publication.getBackoff())) {
            errors.add("publication.backoff must be positive, got " + publication.getBackoff());
        }
    }

    private void validateSagas(List<String> errors, List<String> warnings) {
        JournalProperties.SagaProperties saga = properties.getSaga();
        if (saga.getStreamPrefix() == null || saga.getStreamPrefix().isBlank()) {
            errors.add("saga.stream-prefix must not be blank");
        }
        if (!isPositive(saga.getStepTimeout())) {
            errors.add("saga.step-timeout must be positive, got " + saga.getStepTimeout());
        }
        if (!isPositive(saga.getCompensationTimeout())) {
            errors.add("saga.compensation-timeout must be positive, got " + saga.getCompensationTimeout());
        }
        if (sagaRegistry == null) return;
        for (SagaDefinition definition : sagaRegistry.getAll()) {
            if (definition.steps.isEmpty()) {
                errors.add("Saga '" + definition.name + "' has no steps");
                continue;
            }
            for (SagaStepDefinition step : definition.orderedSteps()) {
                if (step.action == null) {
                    errors.add("Saga '" + definition.name + "' step '" + step.id + "' has no handler");
                }
                if (!step.hasCompensation()) {
                    warnings.add("Saga '" + definition.name + "' step '" + step.id
                            + "' has no compensation and will be recorded as compensated without action");
                }
            }
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isZero() && !duration.isNegative();
    }
}
