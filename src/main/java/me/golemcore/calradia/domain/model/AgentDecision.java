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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Objects;

/**
 * Parsed output of one reasoning call: the raw reasoning text plus the ordered
 * list of actions to apply. Never carries an empty action list.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AgentDecision {

    private final String agentId;
    private final String reasoning;
    private final List<AgentAction> actions;

    public AgentDecision(String agentId, String reasoning, List<AgentAction> actions) {
        this.agentId = Objects.requireNonNull(agentId, "agentId");
        this.reasoning = Objects.requireNonNull(reasoning, "reasoning");
        this.actions = List.copyOf(Objects.requireNonNull(actions, "actions"));
        if (this.actions.isEmpty()) {
            throw new IllegalArgumentException("Decision must carry at least one action");
        }
    }

    public AgentAction getPrimaryAction() {
        return actions.get(0);
    }
}
