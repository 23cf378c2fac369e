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

import java.util.List;

/**
 * Result of one perceive-reason-act cycle. Either successful, carrying the
 * perception, the decision and one {@link ActionResult} per action in order, or
 * failed, carrying the error and its {@link WorkflowFailureKind}.
 */
@Data
@Builder
public class WorkflowResult {

    private boolean successful;
    private String agentId;
    private Perception perception;
    private AgentDecision decision;
    private List<ActionResult> actionResults;
    private Throwable error;
    private WorkflowFailureKind failureKind;

    public static WorkflowResult success(String agentId, Perception perception, AgentDecision decision,
            List<ActionResult> actionResults) {
        return WorkflowResult.builder()
                .successful(true)
                .agentId(agentId)
                .perception(perception)
                .decision(decision)
                .actionResults(List.copyOf(actionResults))
                .build();
    }

    public static WorkflowResult failure(String agentId, WorkflowFailureKind failureKind, Throwable error) {
        return WorkflowResult.builder()
                .successful(false)
                .agentId(agentId)
                .failureKind(failureKind)
                .error(error)
                .actionResults(List.of())
                .build();
    }
}
