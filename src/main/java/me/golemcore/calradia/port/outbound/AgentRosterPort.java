package me.golemcore.calradia.port.outbound;

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

import me.golemcore.calradia.domain.model.AgentProfile;

import java.util.List;
import java.util.Optional;

/**
 * Port listing the actors currently present in the world.
 */
public interface AgentRosterPort {

    List<AgentProfile> listAgents();

    /**
     * Looks up one actor by id, ignoring case.
     */
    default Optional<AgentProfile> findAgent(String agentId) {
        if (agentId == null) {
            return Optional.empty();
        }
        return listAgents().stream()
                .filter(profile -> agentId.equalsIgnoreCase(profile.getId()))
                .findFirst();
    }
}
