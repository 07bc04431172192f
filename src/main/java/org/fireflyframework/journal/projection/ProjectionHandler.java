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

package org.fireflyframework.journal.projection;

import org.fireflyframework.journal.core.model.StoredEvent;

/**
 * Applies committed events to a read model. Delivery is at-least-once, so
 * implementations must be idempotent or deduplicate on {@link StoredEvent#eventId()}.
 *
 * <p>With {@link ProjectionSettings#parallelism()} above 1, events of different streams are
 * handled concurrently on the same instance, so the read model must be thread-safe
 * (concurrent maps, atomic counters). Events of one stream are never handled concurrently.
 */
@FunctionalInterface
public interface ProjectionHandler {

    void handle(StoredEvent event) throws Exception;
}
