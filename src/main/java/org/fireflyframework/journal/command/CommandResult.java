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

/**
 * Outcome of dispatching a command against one aggregate.
 */
public sealed interface CommandResult permits CommandResult.Success, CommandResult.Conflict, CommandResult.Rejected {

    String streamId();

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * The command was applied; {@code newVersion} equals the loaded version when it raised no events.
     */
    record Success(String streamId, long previousVersion, long newVersion, int eventCount) implements CommandResult {}

    /**
     * Another writer committed first. Reload and resubmit.
     */
    record Conflict(String streamId, long expectedVersion, long actualVersion) implements CommandResult {}

    /**
     * The command or the events it produced were invalid; nothing was written.
     */
    record Rejected(String streamId, String reason) implements CommandResult {}
}
