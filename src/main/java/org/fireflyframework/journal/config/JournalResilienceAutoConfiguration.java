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

import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.fireflyframework.journal.core.resilience.ResilienceDecorator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for resilience4j circuit breakers around saga steps and event publication.
 *
 * <p>Opt-in: requires {@code firefly.journal.resilience.enabled=true} and a
 * {@code CircuitBreakerRegistry} bean.
 */
@Slf4j
@AutoConfiguration(before = {JournalAutoConfiguration.class, SagaAutoConfiguration.class})
@ConditionalOnClass(CircuitBreakerRegistry.class)
@ConditionalOnBean(CircuitBreakerRegistry.class)
@ConditionalOnProperty(name = "firefly.journal.resilience.enabled", havingValue = "true")
public class JournalResilienceAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public ResilienceDecorator resilienceDecorator(CircuitBreakerRegistry registry) {
        log.info("[journal] Resilience decorator initialized with circuit breaker support");
        return new ResilienceDecorator(registry);
    }
}
