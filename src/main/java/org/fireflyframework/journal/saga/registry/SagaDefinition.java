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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered steps of a saga. Steps run in insertion order and compensate in reverse.
 */
public class SagaDefinition {

    public final String name;
    public final Map<String, SagaStepDefinition> steps = new LinkedHashMap<>();

    public SagaDefinition(String name) {
        this.name = name;
    }

    public List<SagaStepDefinition> orderedSteps() {
        return new ArrayList<>(steps.values());
    }

    public SagaStepDefinition step(String id) {
        SagaStepDefinition step = steps.get(id);
        if (step == null) {
            throw new IllegalArgumentException("Unknown step '" + id + "' in saga '" + name + "'");
        }
        return step;
    }
}
