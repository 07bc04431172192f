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

package org.fireflyframework.journal.saga.engine;

import org.fireflyframework.journal.core.model.CommandMetadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What a step or compensation action sees: the saga input and the results of earlier steps.
 */
public final class SagaContext {

    private final String sagaId;
    private final String sagaName;
    private final String stepId;
    private final Object input;
    private final Map<String, Object> results;

    public SagaContext(String sagaId, String sagaName, String stepId, Object input, Map<String, Object> results) {
        this.sagaId = sagaId;
        this.sagaName = sagaName;
        this.stepId = stepId;
        this.input = input;
        this.results = Collections.unmodifiableMap(new LinkedHashMap<>(results));
    }

    public String sagaId() { return sagaId; }
    public String sagaName() { return sagaName; }
    public String stepId() { return stepId; }
    public Object input() { return input; }
    public Map<String, Object> results() { return results; }

    public <T> T input(Class<T> type) {
        return type.cast(input);
    }

    public <T> Optional<T> result(String stepId, Class<T> type) {
        Objects.requireNonNull(type, "type");
        Object value = results.get(stepId);
        return type.isInstance(value) ? Optional.of(type.cast(value)) : Optional.empty();
    }

    /**
     * Metadata for commands issued by this step: correlated to the saga, caused by the step.
     */
    public CommandMetadata commandMetadata() {
        return CommandMetadata.of(sagaId + ":" + stepId, sagaId).with("saga", sagaName);
    }
}
