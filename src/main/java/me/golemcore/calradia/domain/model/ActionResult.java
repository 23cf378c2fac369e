package me.golemcore.calradia.domain.model;

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

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of executing one {@link AgentAction}.
 */
@Data
@Builder
public class ActionResult {

    @SuppressWarnings("PMD.AvoidFieldNameMatchingMethodName") // Lombok generates isSuccess()
    private boolean success;
    private String message;
    private Throwable error;
    private ActionFailureKind failureKind;

    public static ActionResult successful(String message) {
        return ActionResult.builder()
                .success(true)
                .message(message)
                .build();
    }

    public static ActionResult failed(String message) {
        return failed(message, null);
    }

    public static ActionResult failed(String message, Throwable error) {
        return ActionResult.builder()
                .success(false)
                .message(message)
                .error(error)
                .failureKind(ActionFailureKind.EXECUTION_FAILED)
                .build();
    }

    public static ActionResult unknownAction(String actionType) {
        return ActionResult.builder()
                .success(false)
                .message("Unknown action: " + actionType)
                .failureKind(ActionFailureKind.UNKNOWN_ACTION)
                .build();
    }
}
