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

package org.fireflyframework.journal.saga.registry;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Indexes saga definitions by name so that persisted instances can find theirs on resume.
 */
public class SagaRegistry {

    private final Map<String, SagaDefinition> sagas = new ConcurrentHashMap<>();

    public SagaRegistry() {
    }

    public SagaRegistry(Collection<SagaDefinition> definitions) {
        definitions.forEach(this::register);
    }

    public SagaDefinition getSaga(String name) {
        SagaDefinition def = sagas.get(name);
        if (def == null) {
            throw new IllegalArgumentException("No saga registered under '" + name + "'");
        }
        return def;
    }

    public boolean hasSaga(String name) {
        return sagas.containsKey(name);
    }

    public Collection<SagaDefinition> getAll() {
        return Collections.unmodifiableCollection(sagas.values());
    }

    public void register(SagaDefinition definition) {
        if (definition.steps.isEmpty()) {
            throw new IllegalStateException("Saga '" + definition.name + "' has no steps");
        }
        if (sagas.putIfAbsent(definition.name, definition) != null) {
            throw new IllegalStateException("Duplicate saga '" + definition.name + "'");
        }
    }
}
