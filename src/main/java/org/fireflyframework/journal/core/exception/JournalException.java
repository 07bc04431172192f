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

import java.util.Map;

/**
 * Base class for every failure raised by the journal runtime.
 *
 * <p>Each subtype carries a stable error code so callers and operators can
 * classify failures without inspecting exception classes.
 */
public abstract sealed class JournalException extends RuntimeException permits
        ValidationException, VersionConflictException, StorageFailureException,
        ProjectionHandlerException, SagaStepException, SagaCompensationException {

    private final String errorCode;
    private final Map<String, Object> context;

    protected JournalException(String message, String errorCode) {
        this(message, errorCode, Map.of(), null);
    }

    protected JournalException(String message, String errorCode, Throwable cause) {
        this(message, errorCode, Map.of(), cause);
    }

    protected JournalException(String message, String errorCode, Map<String, Object> context, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.context = context != null ? Map.copyOf(context) : Map.of();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * Whether the caller may retry the same request unchanged.
     */
    public boolean isRetryable() {
        return false;
    }
}
