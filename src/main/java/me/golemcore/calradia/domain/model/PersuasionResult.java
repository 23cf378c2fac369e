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
import lombok.Value;

/**
 * Outcome of a persuasion attempt. When the NPC accepts and names an action the
 * engine knows, {@code actionResult} holds the outcome of carrying it out.
 */
@Value
@Builder
public class PersuasionResult {

    @Builder.Default
    PersuasionVerdict verdict = PersuasionVerdict.REFUSE;
    String response;
    String actionType;
    String reasoning;
    ActionResult actionResult;

    public boolean isAccepted() {
        return verdict == PersuasionVerdict.ACCEPT;
    }

    public boolean isNegotiating() {
        return verdict == PersuasionVerdict.NEGOTIATE;
    }
}
