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

package org.fireflyframework.journal.config;

import org.fireflyframework.journal.projection.ProjectionFailurePolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;

import java.time.Duration;

/**
 * Configuration properties for the journal runtime under {@code firefly.journal}.
 *
 * <p>Example YAML:
 * <pre>{@code
 * firefly:
 *   journal:
 *     event-store:
 *       max-batch-size: 1000
 *     snapshot:
 *       enabled: true
 *       interval: 100
 *     projection:
 *       batch-size: 256
 *       parallelism: 1
 *       poll-interval: 5s
 *       failure-policy: SKIP
 *     publication:
 *       enabled: true
 *       max-retries: 5
 *       backoff: 200ms
 *     saga:
 *       enabled: true
 *       stream-prefix: saga-
 *       step-timeout: 30s
 *       compensation-timeout: 30s
 *     dlq:
 *       enabled: true
 *     metrics:
 *       enabled: true
 *     health:
 *       enabled: true
 *     resilience:
 *       enabled: false
 *     validation:
 *       enabled: true
 * }</pre>
 */
@ConfigurationProperties(prefix = "firefly.journal")
public class JournalProperties {

    @NestedConfigurationProperty
    private EventStoreProperties eventStore = new EventStoreProperties();

    @NestedConfigurationProperty
    private SnapshotProperties snapshot = new SnapshotProperties();

    @NestedConfigurationProperty
    private ProjectionProperties projection = new ProjectionProperties();

    @NestedConfigurationProperty
    private PublicationProperties publication = new PublicationProperties();

    @NestedConfigurationProperty
    private SagaProperties saga = new SagaProperties();

    @NestedConfigurationProperty
    private DlqProperties dlq = new DlqProperties();

    @NestedConfigurationProperty
    private MetricsProperties metrics = new MetricsProperties();

    @NestedConfigurationProperty
    private HealthProperties health = new HealthProperties();

    @NestedConfigurationProperty
    private ResilienceProperties resilience = new ResilienceProperties();

    @NestedConfigurationProperty
    private ValidationProperties validation = new ValidationProperties();

    // --- Getters and Setters ---

    public EventStoreProperties getEventStore() { return eventStore; }
    public void setEventStore(EventStoreProperties eventStore) { this.eventStore = eventStore; }

    public SnapshotProperties getSnapshot() { return snapshot; }
    public void setSnapshot(SnapshotProperties snapshot) { this.snapshot = snapshot; }

    public ProjectionProperties getProjection() { return projection; }
    public void setProjection(ProjectionProperties projection) { this.projection = projection; }

    public PublicationProperties getPublication() { return publication; }
    public void setPublication(PublicationProperties publication) { this.publication = publication; }

    public SagaProperties getSaga() { return saga; }
    public void setSaga(SagaProperties saga) { this.saga = saga; }

    public DlqProperties getDlq() { return dlq; }
    public void setDlq(DlqProperties dlq) { this.dlq = dlq; }

    public MetricsProperties getMetrics() { return metrics; }
    public void setMetrics(MetricsProperties metrics) { this.metrics = metrics; }

    public HealthProperties getHealth() { return health; }
    public void setHealth(HealthProperties health) { this.health = health; }

    public ResilienceProperties getResilience() { return resilience; }
    public void setResilience(ResilienceProperties resilience) { this.resilience = resilience; }

    public ValidationProperties getValidation() { return validation; }
    public void setValidation(ValidationProperties validation) { this.validation = validation; }

    // --- Nested property classes ---

    public static class EventStoreProperties {
        private int maxBatchSize = 1000;

        public int getMaxBatchSize() { return maxBatchSize; }
        public void setMaxBatchSize(int maxBatchSize) { this.maxBatchSize = maxBatchSize; }
    }

    public static class SnapshotProperties {
        private boolean enabled = true;
        private int interval = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getInterval() { return interval; }
        public void setInterval(int interval) { this.interval = interval; }
    }

    public static class ProjectionProperties {
        private int batchSize = 256;
        private int parallelism = 1;
        private Duration pollInterval = Duration.ofSeconds(5);
        private ProjectionFailurePolicy failurePolicy = ProjectionFailurePolicy.SKIP;

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }

        public Duration getPollInterval() { return pollInterval; }
        public void setPollInterval(Duration pollInterval) { this.pollInterval = pollInterval; }

        public ProjectionFailurePolicy getFailurePolicy() { return failurePolicy; }
        public void setFailurePolicy(ProjectionFailurePolicy failurePolicy) { this.failurePolicy = failurePolicy; }
    }

    public static class PublicationProperties {
        private boolean enabled = true;
        private int maxRetries = 5;
        private Duration backoff = Duration.ofMillis(200);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

        public Duration getBackoff() { return backoff; }
        public void setBackoff(Duration backoff) { this.backoff = backoff; }
    }

    public static class SagaProperties {
        private boolean enabled = true;
        private String streamPrefix = "saga-";
        private Duration stepTimeout = Duration.ofSeconds(30);
        private Duration compensationTimeout = Duration.ofSeconds(30);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getStreamPrefix() { return streamPrefix; }
        public void setStreamPrefix(String streamPrefix) { this.streamPrefix = streamPrefix; }

        public Duration getStepTimeout() { return stepTimeout; }
        public void setStepTimeout(Duration stepTimeout) { this.stepTimeout = stepTimeout; }

        public Duration getCompensationTimeout() { return compensationTimeout; }
        public void setCompensationTimeout(Duration compensationTimeout) { this.compensationTimeout = compensationTimeout; }
    }

    public static class DlqProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class MetricsProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class HealthProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class ResilienceProperties {
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    public static class ValidationProperties {
        private boolean enabled = true;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
