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

package org.fireflyframework.journal.core.dlq;

import org.fireflyframework.journal.core.observability.JournalEvents;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;

public class DeadLetterService {
    private final DeadLetterStore store;
    private final JournalEvents events;

    public DeadLetterService(DeadLetterStore store, JournalEvents events) {
        this.store = store;
        this.events = events;
    }

    public Mono<Void> deadLetter(DeadLetterEntry entry) {
        return store.save(entry)
                .doOnSuccess(v -> events.onDeadLettered(entry.source(), entry.reference(), entry.errorMessage()));
    }

    public Flux<DeadLetterEntry> getAllEntries() { return store.findAll(); }
    public Mono<Optional<DeadLetterEntry>> getEntry(String id) { return store.findById(id); }
    public Flux<DeadLetterEntry> getBySource(String source) { return store.findBySource(source); }
    public Flux<DeadLetterEntry> getByReference(String reference) { return store.findByReference(reference); }
    public Mono<Void> deleteEntry(String id) { return store.delete(id); }
    public Mono<Long> count() { return store.count(); }

    public Mono<DeadLetterEntry> markRetried(String id) {
        return store.findById(id)
                .flatMap(opt -> {
                    if (opt.isEmpty()) {
                        return Mono.error(new IllegalArgumentException("No dead-letter entry with id " + id));
                    }
                    var updated = opt.get().withRetry();
                    return store.save(updated).thenReturn(updated);
                });
    }
}
