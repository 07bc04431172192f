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

package org.fireflyframework.journal.support;

import org.fireflyframework.journal.core.model.DomainEvent;

public sealed interface OrderEvent extends DomainEvent
        permits OrderEvent.OrderPlaced, OrderEvent.OrderShipped, OrderEvent.OrderCancelled {

    String orderId();

    record OrderPlaced(String orderId, String customerId, long amountCents) implements OrderEvent {}

    record OrderShipped(String orderId) implements OrderEvent {}

    record OrderCancelled(String orderId) implements OrderEvent {}
}
