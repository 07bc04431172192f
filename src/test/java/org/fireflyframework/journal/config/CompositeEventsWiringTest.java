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

import org.fireflyframework.journal.core.observability.CompositeJournalEvents;
import org.fireflyframework.journal.core.observability.JournalEvents;
import org.fireflyframework.journal.core.observability.JournalLoggerEvents;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that {@link JournalAutoConfiguration} composes every {@link JournalEvents}
 * bean into a {@link CompositeJournalEvents} and returns a lone listener directly.
 */
class CompositeEventsWiringTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JournalAutoConfiguration.class));

    @Test
    void singleImplementation_returnedDirectlyWithoutComposite() {
        contextRunner.run(context -> {
            JournalEvents events = context.getBean(JournalAutoConfiguration.EVENTS_BEAN, JournalEvents.class);
            assertThat(events).isInstanceOf(JournalLoggerEvents.class);
            assertThat(events).isNotInstanceOf(CompositeJournalEvents.class);
        });
    }

    @Test
    void multipleImplementations_allDelegatesReceiveEvents() {
        contextRunner
                .withUserConfiguration(TrackingEventsConfig.class)
                .run(context -> {
                    JournalEvents events = context.getBean(JournalAutoConfiguration.EVENTS_BEAN, JournalEvents.class);
                    assertThat(events).isInstanceOf(CompositeJournalEvents.class);
                    assertThat(((CompositeJournalEvents) events).delegates()).hasSize(3);

                    events.onVersionConflict("acc-1", 2, 3);

                    assertThat(context.getBean(TrackingEventsA.class).calls).containsExactly("acc-1:2:3");
                    assertThat(context.getBean(TrackingEventsB.class).calls).containsExactly("acc-1:2:3");
                });
    }

    @Test
    void runtimeStore_reportsThroughComposite() {
        contextRunner
                .withUserConfiguration(TrackingEventsConfig.class)
                .run(context -> {
                    long delegates = Arrays.stream(context.getBeanNamesForType(JournalEvents.class))
                            .map(n -> context.getBean(n, JournalEvents.class))
                            .filter(e -> !(e instanceof CompositeJournalEvents))
                            .count();
                    assertThat(delegates).as("logger + trackingA + trackingB").isEqualTo(3);
                    assertThat(context.getBean(JournalEvents.class)).isInstanceOf(CompositeJournalEvents.class);
                });
    }

    static class TrackingEventsA implements JournalEvents {
        final List<String> calls = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onVersionConflict(String streamId, long expectedVersion, long actualVersion) {
            calls.add(streamId + ":" + expectedVersion + ":" + actualVersion);
        }
    }

    static class TrackingEventsB implements JournalEvents {
        final List<String> calls = Collections.synchronizedList(new ArrayList<>());

        @Override
        public void onVersionConflict(String streamId, long expectedVersion, long actualVersion) {
            calls.add(streamId + ":" + expectedVersion + ":" + actualVersion);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class TrackingEventsConfig {
        @Bean
        TrackingEventsA trackingEventsA() {
            return new TrackingEventsA();
        }

        @Bean
        TrackingEventsB trackingEventsB() {
            return new TrackingEventsB();
        }
    }
}
