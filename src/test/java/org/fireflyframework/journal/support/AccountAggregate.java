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

import org.fireflyframework.journal.aggregate.AggregateRoot;

/**
 * Bank account used across the test suite.
 */
public class AccountAggregate extends AggregateRoot<AccountState, AccountEvent> {

    public AccountAggregate(String streamId) {
        super(streamId, AccountState.empty(), AccountState.class, AccountEvent.class);
    }

    public void open(String owner, long initialBalance) {
        if (getState().open()) {
            throw new IllegalStateException("Account " + getStreamId() + " is already open");
        }
        raise(new AccountEvent.Opened(owner, initialBalance));
    }

    public void deposit(long amount) {
        requireOpen();
        if (amount <= 0) {
            throw new IllegalArgumentException("Deposit must be positive");
        }
        raise(new AccountEvent.Deposited(amount));
    }

    public void withdraw(long amount) {
        requireOpen();
        if (amount > getState().balance()) {
            throw new IllegalArgumentException("Insufficient funds");
        }
        raise(new AccountEvent.Withdrawn(amount));
    }

    @Override
    protected AccountState applyEvent(AccountState state, AccountEvent event) {
        if (event instanceof AccountEvent.Opened e) {
            return new AccountState(e.owner(), e.balance(), true);
        }
        if (event instanceof AccountEvent.Deposited e) {
            return new AccountState(state.owner(), state.balance() + e.amount(), true);
        }
        if (event instanceof AccountEvent.Withdrawn e) {
            return new AccountState(state.owner(), state.balance() - e.amount(), true);
        }
        throw new IllegalStateException("Unhandled account event " + event.getClass().getName());
    }

    private void requireOpen() {
        if (!getState().open()) {
            throw new IllegalStateException("Account " + getStreamId() + " is not open");
        }
    }
}
