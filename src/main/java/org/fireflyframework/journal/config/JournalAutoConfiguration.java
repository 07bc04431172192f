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

import org.fireflyframework.journal.command.CommandDispatcher;
import org.fireflyframework.journal.core.context.JournalRuntime;
import org.fireflyframework.journal.core.dlq.DeadLetterService;
import org.fireflyframework.journal.core.dlq.DeadLetterStore;
import org.fireflyframework.journal.core.dlq.InMemoryDeadLetterStore;
import org.fireflyframework.journal.core.observability.CompositeJournalEvents;
import org.fireflyframework.journal.core.observability.JournalEvents;
import org.fireflyframework.journal.core.observability.JournalLoggerEvents;
import org.fireflyframework.journal.core.resilience.ResilienceDecorator;
import org.fireflyframework.journal.core.serialization.StateSerializer;
import org.fireflyframework.journal.core.validation.ConfigurationValidator;
import org.fireflyframework.journal.projection.CheckpointStore;
import org.fireflyframework.journal.projection.InMemoryCheckpointStore;
import org.fireflyframework.journal.projection.ProjectionDefinition;
import org.fireflyframework.journal.projection.ProjectionSettings;
import org.fireflyframework.journal.publication.EventPublisher;
import org.fireflyframework.journal.publication.NoOpEventPublisher;
import org.fireflyframework.journal.saga.registry.SagaRegistry;
import org.fireflyframework.journal.snapshot.InMemorySnapshotStore;
import org.fireflyframework.journal.snapshot.SnapshotPolicy;
import org.fireflyframework.journal.snapshot.SnapshotStore;
import org.fireflyframework.journal.store.EventStore;
import org.fireflyframework.journal.store.EventValidator;
import org.fireflyframework.journal.store.InMemoryEventStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Main auto-configuration for the journal runtime.
 *
 * <p>Wires the in-memory stores, observability, dead-letter queue and the
 * {@link JournalRuntime} that owns projection workers and the publication relay.
 * Every bean backs off when the application defines its own.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(JournalProperties.class)
public class JournalAutoConfiguration {

    static final String EVENTS_BEAN = "journalEvents";

    @Bean
    @ConditionalOnMissingBean
    public JournalLoggerEvents journalLoggerEvents() {
        return new JournalLoggerEvents();
    }

    /**
     * Fans out to every other {@link JournalEvents} bean. A single delegate is returned as is.
     */
    @Bean(EVENTS_BEAN)
    @Primary
    @ConditionalOnMissingBean(name = EVENTS_BEAN)
    public JournalEvents journalEvents(ListableBeanFactory beanFactory) {
        List<JournalEvents> delegates = new ArrayList<>();
        for (String name : beanFactory.getBeanNamesForType(JournalEvents.class)) {
            if (!EVENTS_BEAN.equals(name)) {
                delegates.add(beanFactory.getBean(name, JournalEvents.class));
            }
        }
        if (delegates.size() == 1) {
            return delegates.get(0);
        }
        log.info("[journal] Composing {} event listener(s)", delegates.size());
        return new CompositeJournalEvents(delegates);
    }

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore(JournalProperties properties, JournalEvents events) {
        log.info("[journal] Using in-memory event store (default)");
        return new InMemoryEventStore(new EventValidator(properties.getEventStore().getMaxBatchSize()),
                events, Clock.systemUTC());
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotStore snapshotStore() {
        return new InMemorySnapshotStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public CheckpointStore checkpointStore() {
        return new InMemoryCheckpointStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadLetterStore deadLetterStore() {
        return new InMemoryDeadLetterStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(name = "firefly.journal.dlq.enabled", havingValue = "true", matchIfMissing = true)
    public DeadLetterService deadLetterService(DeadLetterStore store, JournalEvents events) {
        log.info("[journal] Dead letter queue service initialized");
        return new DeadLetterService(store, events);
    }

    @Bean
    @ConditionalOnMissingBean
    public StateSerializer stateSerializer() {
        return new StateSerializer();
    }

    @Bean
    @ConditionalOnMissingBean(EventPublisher.class)
    public EventPublisher eventPublisher() {
        log.info("[journal] Using no-op event publisher (default)");
        return new NoOpEventPublisher();
    }

    @Bean
    @ConditionalOnMissingBean
    public ConfigurationValidator journalConfigurationValidator(JournalProperties properties,
                                                                ObjectProvider<SagaRegistry> sagaRegistry) {
        return new ConfigurationValidator(properties, sagaRegistry.getIfAvailable());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnMissingBean
    public JournalRuntime journalRuntime(JournalProperties properties,
                                         EventStore eventStore,
                                         SnapshotStore snapshotStore,
                                         CheckpointStore checkpointStore,
                                         JournalEvents events,
                                         StateSerializer serializer,
                                         EventPublisher publisher,
                                         ConfigurationValidator validator,
                                         ObjectProvider<DeadLetterService> deadLetters,
                                         ObjectProvider<ResilienceDecorator> resilience,
                                         ObjectProvider<ProjectionDefinition> projections) {
        if (properties.getValidation().isEnabled()) {
            ConfigurationValidator.ValidationResult result = validator.validate();
            if (!result.isValid()) {
                throw new IllegalStateException("Invalid journal configuration: " + result.errors());
            }
        }

        JournalProperties.ProjectionProperties projection = properties.getProjection();
        JournalRuntime.Builder builder = JournalRuntime.builder()
                .eventStore(eventStore)
                .snapshotStore(snapshotStore)
                .checkpointStore(checkpointStore)
                .events(events)
                .serializer(serializer)
                .snapshotPolicy(properties.getSnapshot().isEnabled()
                        ? SnapshotPolicy.everyNEvents(properties.getSnapshot().getInterval())
                        : SnapshotPolicy.never())
                .projectionSettings(new ProjectionSettings(projection.getBatchSize(), projection.getParallelism(),
                        projection.getPollInterval(), projection.getFailurePolicy()))
                .publicationRetry(properties.getPublication().getMaxRetries(), properties.getPublication().getBackoff())
                .resilience(resilience.getIfAvailable());

        DeadLetterService dlq = deadLetters.getIfAvailable();
        if (dlq != null) {
            builder.deadLetters(dlq);
        } else {
            builder.withoutDeadLetters();
        }
        if (properties.getPublication().isEnabled() && !(publisher instanceof NoOpEventPublisher)) {
            builder.publisher(publisher);
        }

        JournalRuntime runtime = builder.build();
        projections.orderedStream().forEach(runtime.projections()::subscribe);
        log.info("[journal] Runtime configured: snapshots={}, publication relay={}",
                properties.getSnapshot().isEnabled(), runtime.relay() != null);
        return runtime;
    }

    @Bean
    @ConditionalOnMissingBean
    public CommandDispatcher commandDispatcher() {
        return new CommandDispatcher();
    }
}
