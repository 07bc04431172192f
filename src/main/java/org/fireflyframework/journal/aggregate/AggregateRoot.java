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

package org.fireflyframework.journal.aggregate;

import org.fireflyframework.journal.core.model.DomainEvent;
import org.fireflyframework.journal.core.model.StoredEvent;
import org.fireflyframework.journal.core.serialization.StateSerializer;
import org.fireflyframework.journal.snapshot.Snapshot;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Base class for event-sourced aggregates. State is an immutable value of type {@code S}
 * derived only by folding events of type {@code E} through {@link #applyEvent}.
 *
 * <p>Command methods on subclasses validate against {@link #getState()} and call
 * {@link #raise(DomainEvent)}; the repository appends raised events on save.
 * Instances are not thread-safe: load, mutate and save within one flow.
 *
 * @param <S> immutable state type, serializable by {@link StateSerializer}
 * @param <E> the aggregate's event family, usually a sealed interface of records
 */
public abstract class AggregateRoot<S, E extends DomainEvent> {

    private final String streamId;
    private final Class<S> stateType;
    private final Class<E> eventType;
    private final List<E> uncommittedEvents = new ArrayList<>();
    private S state;
    private long version;

    protected AggregateRoot(String streamId, S initialState, Class<S> stateType, Class<E> eventType) {
        this.streamId = Objects.requireNonNull(streamId, "streamId");
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.stateType = Objects.requireNonNull(stateType, "stateType");
        this.eventType = Objects.requireNonNull(eventType, "eventType");
    }

    /**
     * Pure state transition. Must not perform I/O, read clocks or depend on anything but its arguments.
     */
    protected abstract S applyEvent(S state, E event);

    /**
     * Records a new event and applies it to the in-memory state.
     */
    protected final void raise(E event) {
        Objects.requireNonNull(event, "event");
        state = applyEvent(state, event);
        uncommittedEvents.add(event);
    }

    public String getStreamId() { return streamId; }
    public S getState() { return state; }
    public Class<S> getStateType() { return stateType; }

    /**
     * Last committed version this instance is based on. Pending events are not counted.
     */
    public long getVersion() { return version; }

    public List<E> getUncommittedEvents() { return List.copyOf(uncommittedEvents); }
    public boolean hasUncommittedEvents() { return !uncommittedEvents.isEmpty(); }

    final void replay(StoredEvent stored) {
        if (stored.streamVersion() != version + 1) {
            throw new IllegalStateException("Stream " + streamId + " is not contiguous: expected version "
                    + (version + 1) + " but read " + stored.streamVersion());
        }
        if (!eventType.isInstance(stored.payload())) {
            throw new IllegalStateException("Event " + stored.eventId() + " of type " + stored.eventType()
                    + " does not belong to " + eventType.getSimpleName());
        }
        state = applyEvent(state, eventType.cast(stored.payload()));
        version = stored.streamVersion();
    }

    final void restore(Snapshot snapshot, StateSerializer serializer) {
        if (!stateType.getName().equals(snapshot.stateType())) {
            throw new IllegalStateException("Snapshot of " + streamId + " holds " + snapshot.stateType()
                    + ", expected " + stateType.getName());
        }
        state = serializer.deserialize(snapshot.state(), stateType);
        version = snapshot.version();
    }

    /**
     * Captures the current state and version; serialization happens when the supplier is called.
     */
    final Supplier<Snapshot> captureSnapshot(StateSerializer serializer, Clock clock) {
        S captured = state;
        long capturedVersion = version;
        return () -> new Snapshot(streamId, capturedVersion, stateType.getName(),
                serializer.serialize(captured), clock.instant());
    }

    final void markCommitted(long newVersion) {
        uncommittedEvents.clear();
        version = newVersion;
    }
}
