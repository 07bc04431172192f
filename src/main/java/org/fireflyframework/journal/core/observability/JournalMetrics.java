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

package org.fireflyframework.journal.core.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.fireflyframework.journal.core.model.SagaStatus;
import org.fireflyframework.journal.core.model.StoredEvent;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

public class JournalMetrics implements JournalEvents {
    private static final String PREFIX = "firefly.journal";
    private final MeterRegistry registry;
    private final ConcurrentHashMap<String, Timer> timers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> counters = new ConcurrentHashMap<>();

    public JournalMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void onAppended(String streamId, long previousVersion, long newVersion, long lastPosition) {
        counter("appends").increment();
        counter("events.appended").increment(newVersion - previousVersion);
    }

    @Override
    public void onVersionConflict(String streamId, long expectedVersion, long actualVersion) {
        counter("appends.conflicts").increment();
    }

    @Override
    public void onAppendRejected(String streamId, String reason) {
        counter("appends.rejected").increment();
    }

    @Override
    public void onSnapshotSaved(String streamId, long version) {
        counter("snapshots.saved", "success", "true").increment();
    }

    @Override
    public void onSnapshotFailed(String streamId, long version, Throwable error) {
        counter("snapshots.saved", "success", "false").increment();
    }

    @Override
    public void onProjectionBatch(String projection, long fromPosition, long toPosition, int handled) {
        counter("projection.events", "projection", projection).increment(handled);
    }

    @Override
    public void onProjectionHandlerFailed(String projection, StoredEvent event, Throwable error) {
        counter("projection.failures", "projection", projection).increment();
    }

    @Override
    public void onRebuildCompleted(String projection, long headPosition, long durationMs) {
        timer("projection.rebuild.duration", "projection", projection).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onSagaStarted(String sagaName, String sagaId) {
        counter("sagas.started", "name", sagaName).increment();
    }

    @Override
    public void onSagaStepFailed(String sagaName, String sagaId, String stepId, Throwable error) {
        counter("saga.steps.failed", "name", sagaName, "stepId", stepId).increment();
    }

    @Override
    public void onSagaFinished(String sagaName, String sagaId, SagaStatus status, long durationMs) {
        counter("sagas.finished", "name", sagaName, "status", status.name()).increment();
        timer("sagas.duration", "name", sagaName).record(Duration.ofMillis(durationMs));
    }

    @Override
    public void onPublished(long fromPosition, long toPosition, int count) {
        counter("events.published").increment(count);
    }

    @Override
    public void onPublishFailed(long fromPosition, Throwable error) {
        counter("publication.failures").increment();
    }

    @Override
    public void onDeadLettered(String source, String reference, String errorMessage) {
        counter("dlq.entries", "source", source).increment();
    }

    private Counter counter(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return counters.computeIfAbsent(key, k -> Counter.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }

    private Timer timer(String metricName, String... tags) {
        String key = metricName + String.join(",", tags);
        return timers.computeIfAbsent(key, k -> Timer.builder(PREFIX + "." + metricName).tags(tags).register(registry));
    }
}
