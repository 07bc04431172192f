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

package org.fireflyframework.journal.unit.command;

import org.fireflyframework.journal.aggregate.AggregateRepository;
import org.fireflyframework.journal.command.CommandDispatcher;
import org.fireflyframework.journal.command.CommandResult;
import org.fireflyframework.journal.core.context.JournalRuntime;
import org.fireflyframework.journal.core.model.CommandMetadata;
import org.fireflyframework.journal.core.model.NewEvent;
import org.fireflyframework.journal.store.InMemoryEventStore;
import org.fireflyframework.journal.support.AccountAggregate;
import org.fireflyframework.journal.support.AccountEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class CommandDispatcherTest {

    private InMemoryEventStore eventStore;
    private AggregateRepository<AccountAggregate> repository;
    private final CommandDispatcher dispatcher = new CommandDispatcher();

    @BeforeEach
    void setUp() {
        eventStore = new InMemoryEventStore();
        JournalRuntime runtime = JournalRuntime.builder().eventStore(eventStore).build();
        repository = new AggregateRepository<>(runtime, AccountAggregate::new);
    }

    @Test
    void dispatch_appliesCommandAndSavesEvents() {
        StepVerifier.create(dispatcher.dispatch(repository, "acc-1",
                        CommandMetadata.of("cmd-1", "corr-1"), account -> {
                            account.open("ada", 1000);
                            account.withdraw(250);
                        }))
                .assertNext(result -> {
                    assertThat(result).isEqualTo(new CommandResult.Success("acc-1", 0, 2, 2));
                    assertThat(result.isSuccess()).isTrue();
                })
                .verifyComplete();

        StepVerifier.create(eventStore.readStream("acc-1", 0).collectList())
                .assertNext(events -> assertThat(events)
                        .allSatisfy(event -> assertThat(event.correlationId()).isEqualTo("corr-1")))
                .verifyComplete();
    }

    @Test
    void dispatch_domainRejection_writesNothing() {
        dispatcher.dispatch(repository, "acc-1", account -> account.open("ada", 100)).block();

        StepVerifier.create(dispatcher.dispatch(repository, "acc-1", account -> account.withdraw(500)))
                .assertNext(result -> {
                    assertThat(result).isInstanceOf(CommandResult.Rejected.class);
                    assertThat(((CommandResult.Rejected) result).reason()).isEqualTo("Insufficient funds");
                })
                .verifyComplete();
        StepVerifier.create(eventStore.currentVersion("acc-1")).expectNext(1L).verifyComplete();
    }

    @Test
    void dispatch_commandOnUnopenedAccount_isRejected() {
        StepVerifier.create(dispatcher.dispatch(repository, "acc-9", account -> account.deposit(10)))
                .assertNext(result -> assertThat(result).isInstanceOf(CommandResult.Rejected.class))
                .verifyComplete();
    }

    @Test
    void dispatch_concurrentWriter_reportsConflict() {
        dispatcher.dispatch(repository, "acc-1", account -> account.open("ada", 100)).block();

        StepVerifier.create(dispatcher.dispatch(repository, "acc-1", account -> {
                    eventStore.append("acc-1", 1, List.of(NewEvent.of(new AccountEvent.Deposited(5)))).block();
                    account.deposit(10);
                }))
                .assertNext(result -> assertThat(result).isEqualTo(new CommandResult.Conflict("acc-1", 1, 2)))
                .verifyComplete();
        StepVerifier.create(eventStore.currentVersion("acc-1")).expectNext(2L).verifyComplete();
    }

    @Test
    void dispatch_commandRaisingNothing_succeedsWithoutWriting() {
        dispatcher.dispatch(repository, "acc-1", account -> account.open("ada", 100)).block();

        StepVerifier.create(dispatcher.dispatch(repository, "acc-1", account -> { }))
                .assertNext(result -> assertThat(result).isEqualTo(new CommandResult.Success("acc-1", 1, 1, 0)))
                .verifyComplete();
    }
}
