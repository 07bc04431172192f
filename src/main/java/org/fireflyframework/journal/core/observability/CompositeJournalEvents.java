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

import org.fireflyframework.journal.core.model.ProjectionStatus;
import org.fireflyframework.journal.core.model.SagaStatus;
import org.fireflyframework.journal.core.model.StoredEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Consumer;

@Slf4j
public class CompositeJournalEvents implements JournalEvents {
    private final List<JournalEvents> delegates;

    public CompositeJournalEvents(List<JournalEvents> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public List<JournalEvents> delegates() {
        return delegates;
    }

    private void safeForEach(Consumer<JournalEvents> action) {
        for (var d : delegates) {
            try { action.accept(d); }
            catch (Exception e) { log.warn("[composite-events] Delegate {} failed: {}", d.getClass().getSimpleName(), e.getMessage()); }
        }
    }

    @Override public void onAppended(String streamId, long previousVersion, long newVersion, long lastPosition) { safeForEach(d -> d.onAppended(streamId, previousVersion, newVersion, lastPosition)); }
    @Override public void onVersionConflict(String streamId, long expectedVersion, long actualVersion) { safeForEach(d -> d.onVersionConflict(streamId, expectedVersion, actualVersion)); }
    @Override public void onAppendRejected(String streamId, String reason) { safeForEach(d -> d.onAppendRejected(streamId, reason)); }
    @Override public void onSnapshotSaved(String streamId, long version) { safeForEach(d -> d.onSnapshotSaved(streamId, version)); }
    @Override public void onSnapshotFailed(String streamId, long version, Throwable error) { safeForEach(d -> d.onSnapshotFailed(streamId, version, error)); }
    @Override public void onProjectionBatch(String projection, long fromPosition, long toPosition, int handled) { safeForEach(d -> d.onProjectionBatch(projection, fromPosition, toPosition, handled)); }
    @Override public void onProjectionHandlerFailed(String projection, StoredEvent event, Throwable error) { safeForEach(d -> d.onProjectionHandlerFailed(projection, event, error)); }
    @Override public void onProjectionStatusChanged(String projection, ProjectionStatus from, ProjectionStatus to) { safeForEach(d -> d.onProjectionStatusChanged(projection, from, to)); }
    @Override public void onRebuildStarted(String projection, long headPosition) { safeForEach(d -> d.onRebuildStarted(projection, headPosition)); }
    @Override public void onRebuildCompleted(String projection, long headPosition, long durationMs) { safeForEach(d -> d.onRebuildCompleted(projection, headPosition, durationMs)); }
    @Override public void onRebuildCancelled(String projection) { safeForEach(d -> d.onRebuildCancelled(projection)); }
    @Override public void onSagaStarted(String sagaName, String sagaId) { safeForEach(d -> d.onSagaStarted(sagaName, sagaId)); }
    @Override public void onSagaStepStarted(String sagaName, String sagaId, String stepId) { safeForEach(d -> d.onSagaStepStarted(sagaName, sagaId, stepId)); }
    @Override public void onSagaStepCompleted(String sagaName, String sagaId, String stepId, long latencyMs) { safeForEach(d -> d.onSagaStepCompleted(sagaName, sagaId, stepId, latencyMs)); }
    @Override public void onSagaStepFailed(String sagaName, String sagaId, String stepId, Throwable error) { safeForEach(d -> d.onSagaStepFailed(sagaName, sagaId, stepId, error)); }
    @Override public void onSagaCompensationStarted(String sagaName, String sagaId) { safeForEach(d -> d.onSagaCompensationStarted(sagaName, sagaId)); }
    @Override public void onSagaStepCompensated(String sagaName, String sagaId, String stepId) { safeForEach(d -> d.onSagaStepCompensated(sagaName, sagaId, stepId)); }
    @Override public void onSagaStepCompensationFailed(String sagaName, String sagaId, String stepId, Throwable error) { safeForEach(d -> d.onSagaStepCompensationFailed(sagaName, sagaId, stepId, error)); }
    @Override public void onSagaFinished(String sagaName, String sagaId, SagaStatus status, long durationMs) { safeForEach(d -> d.onSagaFinished(sagaName, sagaId, status, durationMs)); }
    @Override public void onPublished(long fromPosition, long toPosition, int count) { safeForEach(d -> d.onPublished(fromPosition, toPosition, count)); }
    @Override public void onPublishFailed(long fromPosition, Throwable error) { safeForEach(d -> d.onPublishFailed(fromPosition, error)); }
    @Override public void onDeadLettered(String source, String reference, String errorMessage) { safeForEach(d -> d.onDeadLettered(source, reference, errorMessage)); }
}
