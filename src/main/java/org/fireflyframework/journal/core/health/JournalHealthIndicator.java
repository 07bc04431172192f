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

package org.fireflyframework.journal.core.health;

import org.fireflyframework.journal.core.context.JournalRuntime;
import org.fireflyframework.journal.core.model.ProjectionStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import reactor.core.publisher.Mono;

import java.util.Map;
import java.util.TreeMap;

/**
 * Reports DOWN when the event store is unhealthy or any projection has halted.
 */
public class JournalHealthIndicator implements ReactiveHealthIndicator {

    private final JournalRuntime runtime;

    public JournalHealthIndicator(JournalRuntime runtime) {
        this.runtime = runtime;
    }

    @Override
    public Mono<Health> health() {
        return runtime.eventStore().isHealthy()
                .zipWith(runtime.eventStore().headPosition())
                .map(t -> {
                    Map<String, ProjectionStatus> statuses = new TreeMap<>(runtime.projections().statuses());
                    boolean halted = statuses.containsValue(ProjectionStatus.FAILED);
                    Health.Builder builder = !t.getT1() ? Health.down().withDetail("reason", "Event store unhealthy")
                            : halted ? Health.down().withDetail("reason", "Projection halted")
                            : Health.up();
                    return builder
                            .withDetail("headPosition", t.getT2())
                            .withDetail("running", runtime.isRunning())
                            .withDetail("projections", statuses)
                            .build();
                })
                .onErrorResume(e -> Mono.just(Health.down().withException(e).build()));
    }
}
