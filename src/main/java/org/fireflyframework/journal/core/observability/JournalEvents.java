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

/**
 * Lifecycle callbacks emitted by the runtime. Every method is optional.
 */
public interface JournalEvents {
    // Event store
    default void onAppended(String streamId, long previousVersion, long newVersion, long lastPosition) {}
    default void onVersionConflict(String streamId, long expectedVersion, long actualVersion) {}
    default void onAppendRejected(String streamId, String reason) {}

    // Snapshots
    default void onSnapshotSaved(String streamId, long version) {}
    default void onSnapshotFailed(String streamId, long version, Throwable error) {}

    // Projections
    default void onProjectionBatch(String projection, long fromPosition, long toPosition, int handled) {}
    default void onProjectionHandlerFailed(String projection, StoredEvent event, Throwable error) {}
    default void onProjectionStatusChanged(String projection, ProjectionStatus from, ProjectionStatus to) {}
    default void onRebuildStarted(String projection, long headPosition) {}
    default void onRebuildCompleted(String projection, long headPosition, long durationMs) {}
    default void onRebuildCancelled(String projection) {}

    // Sagas
    default void onSagaStarted(String sagaName, String sagaId) {}
    default void onSagaStepStarted(String sagaName, String sagaId, String stepId) {}
    default void onSagaStepCompleted(String sagaName, String sagaId, String stepId, long latencyMs) {}
    default void onSagaStepFailed(String sagaName, String sagaId, String stepId, Throwable error) {}
    default void onSagaCompensationStarted(String sagaName, String sagaId) {}
    default void onSagaStepCompensated(String sagaName, String sagaId, String stepId) {}
    default void onSagaStepCompensationFailed(String sagaName, String sagaId, String stepId, Throwable error) {}
    default void onSagaFinished(String sagaName, String sagaId, SagaStatus status, long durationMs) {}

    // Publication
    default void onPublished(long fromPosition, long toPosition, int count) {}
    default void onPublishFailed(long fromPosition, Throwable error) {}

    // DLQ
    default void onDeadLettered(String source, String reference, String errorMessage) {}
}
