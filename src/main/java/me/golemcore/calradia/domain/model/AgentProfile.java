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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Roster view of one simulated actor, used by the proactive scheduler to decide
 * who is eligible to think.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentProfile {

    private String id;
    private String name;
    private String faction;
    private boolean factionLeader;
    @Builder.Default
    private boolean alive = true;
    private boolean playerControlled;

    public String getDisplayName() {
        String label = name != null && !name.isBlank() ? name : id;
        String factionLabel = faction != null && !faction.isBlank() ? faction : "Independent";
        return label + " (" + factionLabel + ")";
    }
}
