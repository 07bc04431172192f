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

package org.fireflyframework.journal.support;

import org.fireflyframework.journal.core.model.ProjectionStatus;
import org.fireflyframework.journal.core.model.SagaStatus;
import org.fireflyframework.journal.core.observability.JournalEvents;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Records callbacks as {@code "name:args"} strings.
 */
public class RecordingJournalEvents implements JournalEvents {

    public final List<String> calls = Collections.synchronizedList(new ArrayList<>());

    @Override
    public void onVersionConflict(String streamId, long expectedVersion, long actualVersion) {
        calls.add("conflict:" + streamId + ":" + expectedVersion + ":" + actualVersion);
    }

    @Override
    public void onSnapshotSaved(String streamId, long version) {
        calls.add("snapshotSaved:" + streamId + ":" + version);
    }

    @Override
    public void onSnapshotFailed(String streamId, long version, Throwable error) {
        calls.add("snapshotFailed:" + streamId + ":" + version);
    }

    @Override
    public void onProjectionStatusChanged(String projection, ProjectionStatus from, ProjectionStatus to) {
        calls.add("status:" + projection + ":" + from + "->" + to);
    }

    @Override
    public void onRebuildCancelled(String projection) {
        calls.add("rebuildCancelled:" + projection);
    }

    @Override
    public void onSagaStepCompensated(String sagaName, String sagaId, String stepId) {
        calls.add("compensated:" + stepId);
    }

    @Override
    public void onSagaFinished(String sagaName, String sagaId, SagaStatus status, long durationMs) {
        calls.add("finished:" + sagaName + ":" + status);
    }

    @Override
    public void onPublishFailed(long fromPosition, Throwable error) {
        calls.add("publishFailed:" + fromPosition);
    }

    @Override
    public void onDeadLettered(String source, String reference, String errorMessage) {
        calls.add("deadLettered:" + source + ":" + reference);
    }

    public List<String> matching(String prefix) {
        synchronized (calls) {
            return calls.stream().filter(c -> c.startsWith(prefix)).toList();
        }
    }
}
