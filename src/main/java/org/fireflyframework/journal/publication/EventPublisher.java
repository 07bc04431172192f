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
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Outbound channel for committed events. Batches arrive in commit order and may be
 * offered more than once after a failure, so consumers on the other side must dedupe
 * on {@link StoredEvent#eventId()}.
 */
@FunctionalInterface
public interface EventPublisher {

    Mono<Void> publish(List<StoredEvent> batch);
}
