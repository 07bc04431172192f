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

package org.fireflyframework.journal.core.model;

import java.util.Arrays;
import java.util.Set;

/**
 * Selects events by type tag. An empty filter accepts every event.
 */
public record EventTypeFilter(Set<String> eventTypes) {

    private static final EventTypeFilter ALL = new EventTypeFilter(Set.of());

    public EventTypeFilter {
        eventTypes = eventTypes != null ? Set.copyOf(eventTypes) : Set.of();
    }

    public static EventTypeFilter all() {
        return ALL;
    }

    public static EventTypeFilter of(String... eventTypes) {
        return new EventTypeFilter(Set.copyOf(Arrays.asList(eventTypes)));
    }

    @SafeVarargs
    public static EventTypeFilter ofTypes(Class<? extends DomainEvent>... types) {
        return new EventTypeFilter(Arrays.stream(types)
                .map(Class::getSimpleName)
                .collect(java.util.stream.Collectors.toUnmodifiableSet()));
    }

    public boolean matches(StoredEvent event) {
        return eventTypes.isEmpty() || eventTypes.contains(event.eventType());
    }

    public boolean isAll() {
        return eventTypes.isEmpty();
    }
}
