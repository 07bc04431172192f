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

package org.fireflyframework.journal.publication;

import org.fireflyframework.journal.core.model.StoredEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.List;

/**
 * In-process event bus backed by a Reactor multicast sink. Events published before the
 * first subscriber arrives are buffered up to {@code bufferSize}.
 */
public class SinksEventPublisher implements EventPublisher {

    private final Sinks.Many<StoredEvent> sink;

    public SinksEventPublisher() {
        this(1024);
    }

    public SinksEventPublisher(int bufferSize) {
        this.sink = Sinks.many().multicast().onBackpressureBuffer(bufferSize, false);
    }

    @Override
    public Mono<Void> publish(List<StoredEvent> batch) {
        return Mono.defer(() -> {
            for (StoredEvent event : batch) {
                Sinks.EmitResult result = sink.tryEmitNext(event);
                if (result.isFailure()) {
                    return Mono.error(new IllegalStateException(
                            "Could not publish event " + event.eventId() + ": " + result));
                }
            }
            return Mono.empty();
        });
    }

    public Flux<StoredEvent> events() {
        return sink.asFlux();
    }
}
