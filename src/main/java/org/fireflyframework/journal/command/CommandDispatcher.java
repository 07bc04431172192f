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

package org.fireflyframework.journal.command;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.journal.aggregate.AggregateRepository;
import org.fireflyframework.journal.aggregate.AggregateRoot;
import org.fireflyframework.journal.core.exception.ValidationException;
import org.fireflyframework.journal.core.exception.VersionConflictException;
import org.fireflyframework.journal.core.model.CommandMetadata;
import reactor.core.publisher.Mono;

/**
 * Load, handle, save. Domain rejections and version conflicts become {@link CommandResult}
 * values; storage failures stay errors so callers can apply their own retry policy.
 */
@Slf4j
public class CommandDispatcher {

    public <A extends AggregateRoot<?, ?>> Mono<CommandResult> dispatch(AggregateRepository<A> repository,
                                                                       String streamId,
                                                                       CommandHandler<? super A> handler) {
        return dispatch(repository, streamId, CommandMetadata.empty(), handler);
    }

    public <A extends AggregateRoot<?, ?>> Mono<CommandResult> dispatch(AggregateRepository<A> repository,
                                                                       String streamId,
                                                                       CommandMetadata metadata,
                                                                       CommandHandler<? super A> handler) {
        return repository.load(streamId)
                .flatMap(aggregate -> {
                    long loaded = aggregate.getVersion();
                    try {
                        handler.handle(aggregate);
                    } catch (ValidationException | IllegalArgumentException | IllegalStateException e) {
                        log.debug("[journal] Command on '{}' rejected: {}", streamId, e.getMessage());
                        return Mono.<CommandResult>just(new CommandResult.Rejected(streamId, e.getMessage()));
                    }
                    return repository.save(aggregate, metadata)
                            .map(result -> (CommandResult) new CommandResult.Success(
                                    streamId, loaded, result.newVersion(), result.size()));
                })
                .onErrorResume(VersionConflictException.class, e -> Mono.just(
                        new CommandResult.Conflict(streamId, e.getExpectedVersion(), e.getActualVersion())))
                .onErrorResume(ValidationException.class, e -> Mono.just(
                        new CommandResult.Rejected(streamId, e.getMessage())));
    }
}
