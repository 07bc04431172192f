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

import io.micrometer.core.instrument.MeterRegistry;
import org.fireflyframework.journal.core.observability.JournalMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * Registers {@link JournalMetrics} as an additional journal event listener when a
 * Micrometer {@code MeterRegistry} is available.
 */
@Slf4j
@AutoConfiguration(before = JournalAutoConfiguration.class,
        afterName = "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration")
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(name = "firefly.journal.metrics.enabled", havingValue = "true", matchIfMissing = true)
public class JournalMetricsAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public JournalMetrics journalMetrics(MeterRegistry registry) {
        log.info("[journal] Micrometer metrics enabled");
        return new JournalMetrics(registry);
    }
}
