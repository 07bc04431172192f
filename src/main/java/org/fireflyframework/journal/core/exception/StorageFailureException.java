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

package org.fireflyframework.journal.core.exception;

/**
 * I/O or transport fault in a durable store. Retryable by the caller with backoff.
 */
public final class StorageFailureException extends JournalException {

    public StorageFailureException(String message) {
        super(message, "JOURNAL_STORAGE_FAILURE");
    }

    public StorageFailureException(String message, Throwable cause) {
        super(message, "JOURNAL_STORAGE_FAILURE", cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
