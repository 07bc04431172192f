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

package org.fireflyframework.journal.projection;

import org.fireflyframework.journal.core.model.EventTypeFilter;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A named projection: which events it consumes and how to create an empty read model.
 */
public record ProjectionDefinition(
        String name,
        EventTypeFilter filter,
        Supplier<? extends ProjectionHandler> handlerFactory
) {
    public ProjectionDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Projection name must not be blank");
        }
        filter = filter != null ? filter : EventTypeFilter.all();
        Objects.requireNonNull(handlerFactory, "handlerFactory");
    }
}
