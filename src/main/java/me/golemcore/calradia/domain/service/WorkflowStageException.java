package me.golemcore.calradia.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.calradia.domain.model.WorkflowFailureKind;

/**
 * Wraps an error raised by one workflow stage so the stage that failed can be
 * reported in the {@link me.golemcore.calradia.domain.model.WorkflowResult}.
 */
public class WorkflowStageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final WorkflowFailureKind failureKind;

    public WorkflowStageException(WorkflowFailureKind failureKind, String message) {
        super(message);
        this.failureKind = failureKind;
    }

    public WorkflowStageException(WorkflowFailureKind failureKind, Throwable cause) {
        super(failureKind + ": " + describe(cause), cause);
        this.failureKind = failureKind;
    }

    public WorkflowFailureKind getFailureKind() {
        return failureKind;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown error";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }
}
