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

import java.util.HashMap;
import java.util.Map;

/**
 * Tracing data stamped onto every event a command produces.
 */
public record CommandMetadata(String causationId, String correlationId, Map<String, String> metadata) {

    private static final CommandMetadata EMPTY = new CommandMetadata(null, null, Map.of());

    public CommandMetadata {
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static CommandMetadata empty() {
        return EMPTY;
    }

    public static CommandMetadata of(String causationId, String correlationId) {
        return new CommandMetadata(causationId, correlationId, Map.of());
    }

    public CommandMetadata with(String key, String value) {
        var copy = new HashMap<>(metadata);
        copy.put(key, value);
        return new CommandMetadata(causationId, correlationId, copy);
    }
}
