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

package org.fireflyframework.journal.config;

import org.fireflyframework.journal.core.context.JournalRuntime;
import org.fireflyframework.journal.core.resilience.ResilienceDecorator;
import org.fireflyframework.journal.saga.engine.SagaCoordinator;
import org.fireflyframework.journal.saga.engine.SagaSettings;
import org.fireflyframework.journal.saga.registry.SagaDefinition;
import org.fireflyframework.journal.saga.registry.SagaRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

/**
 * Auto-configuration for event-sourced sagas.
 *
 * <p>Activated when {@code firefly.journal.saga.enabled=true} (default). Every
 * {@link SagaDefinition} bean is registered with the {@link SagaRegistry}.
 */
@Slf4j
@AutoConfiguration(after = JournalAutoConfiguration.class)
@ConditionalOnProperty(name = "firefly.journal.saga.enabled", havingValue = "true", matchIfMissing = true)
public class SagaAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public SagaRegistry sagaRegistry(ObjectProvider<SagaDefinition> definitions) {
        SagaRegistry registry = new SagaRegistry(definitions.orderedStream().collect(Collectors.toList()));
        log.info("[saga] Saga registry initialized with {} definition(s)", registry.getAll().size());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaCoordinator sagaCoordinator(JournalRuntime runtime,
                                           SagaRegistry registry,
                                           JournalProperties properties,
                                           ObjectProvider<ResilienceDecorator> resilience) {
        JournalProperties.SagaProperties saga = properties.getSaga();
        return new SagaCoordinator(runtime, registry,
                new SagaSettings(saga.getStreamPrefix(), saga.getStepTimeout(), saga.getCompensationTimeout()),
                resilience.getIfAvailable());
    }
}
