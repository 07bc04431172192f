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

@Slf4j
public class JournalLoggerEvents implements JournalEvents {
    @Override
    public void onAppended(String streamId, long previousVersion, long newVersion, long lastPosition) {
        log.debug("[journal] appended streamId={} version={}->{} position={}", streamId, previousVersion, newVersion, lastPosition);
    }
    @Override
    public void onVersionConflict(String streamId, long expectedVersion, long actualVersion) {
        log.info("[journal] version.conflict streamId={} expected={} actual={}", streamId, expectedVersion, actualVersion);
    }
    @Override
    public void onAppendRejected(String streamId, String reason) {
        log.warn("[journal] append.rejected streamId={} reason={}", streamId, reason);
    }
    @Override
    public void onSnapshotFailed(String streamId, long version, Throwable error) {
        log.warn("[journal] snapshot.failed streamId={} version={} error={}", streamId, version, error.getMessage());
    }
    @Override
    public void onProjectionHandlerFailed(String projection, StoredEvent event, Throwable error) {
        log.error("[projection] handler.failed name={} eventId={} position={} error={}",
                projection, event.eventId(), event.globalPosition(), error.getMessage());
    }
    @Override
    public void onProjectionStatusChanged(String projection, ProjectionStatus from, ProjectionStatus to) {
        log.info("[projection] status name={} {}->{}", projection, from, to);
    }
    @Override
    public void onRebuildStarted(String projection, long headPosition) {
        log.info("[projection] rebuild.started name={} head={}", projection, headPosition);
    }
    @Override
    public void onRebuildCompleted(String projection, long headPosition, long durationMs) {
        log.info("[projection] rebuild.completed name={} head={} durationMs={}", projection, headPosition, durationMs);
    }
    @Override
    public void onRebuildCancelled(String projection) {
        log.warn("[projection] rebuild.cancelled name={}", projection);
    }
    @Override
    public void onSagaStarted(String sagaName, String sagaId) {
        log.info("[saga] started name={} sagaId={}", sagaName, sagaId);
    }
    @Override
    public void onSagaStepStarted(String sagaName, String sagaId, String stepId) {
        log.info("[saga] step.started name={} sagaId={} stepId={}", sagaName, sagaId, stepId);
    }
    @Override
    public void onSagaStepCompleted(String sagaName, String sagaId, String stepId, long latencyMs) {
        log.info("[saga] step.completed name={} sagaId={} stepId={} latencyMs={}", sagaName, sagaId, stepId, latencyMs);
    }
    @Override
    public void onSagaStepFailed(String sagaName, String sagaId, String stepId, Throwable error) {
        log.warn("[saga] step.failed name={} sagaId={} stepId={} error={}", sagaName, sagaId, stepId, error.getMessage());
    }
    @Override
    public void onSagaCompensationStarted(String sagaName, String sagaId) {
        log.warn("[saga] compensation.started name={} sagaId={}", sagaName, sagaId);
    }
    @Override
    public void onSagaStepCompensated(String sagaName, String sagaId, String stepId) {
        log.info("[saga] step.compensated name={} sagaId={} stepId={}", sagaName, sagaId, stepId);
    }
    @Override
    public void onSagaStepCompensationFailed(String sagaName, String sagaId, String stepId, Throwable error) {
        log.error("[saga] step.compensation.failed name={} sagaId={} stepId={} error={} (operator action required)",
                sagaName, sagaId, stepId, error.getMessage());
    }
    @Override
    public void onSagaFinished(String sagaName, String sagaId, SagaStatus status, long durationMs) {
        log.info("[saga] finished name={} sagaId={} status={} durationMs={}", sagaName, sagaId, status, durationMs);
    }
    @Override
    public void onPublishFailed(long fromPosition, Throwable error) {
        log.warn("[relay] publish.failed from={} error={}", fromPosition, error.getMessage());
    }
    @Override
    public void onDeadLettered(String source, String reference, String errorMessage) {
        log.error("[journal] dead-lettered source={} reference={} error={}", source, reference, errorMessage);
    }
}
