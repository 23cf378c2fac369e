package me.golemcore.calradia.adapter.outbound.world;

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
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.port.outbound.AgentRosterPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Roster read from {@code calradia.roster.agents}. Entries without an id are
 * ignored.
 */
@Component
@RequiredArgsConstructor
public class StaticAgentRoster implements AgentRosterPort {

    private final CalradiaProperties properties;

    @Override
    public List<AgentProfile> listAgents() {
        return properties.getRoster().getAgents().stream()
                .filter(Objects::nonNull)
                .filter(entry -> entry.getId() != null && !entry.getId().isBlank())
                .map(StaticAgentRoster::toProfile)
                .toList();
    }

    private static AgentProfile toProfile(CalradiaProperties.AgentEntry entry) {
        return AgentProfile.builder()
                .id(entry.getId())
                .name(entry.getName())
                .faction(entry.getFaction())
                .factionLeader(entry.isLeader())
                .alive(entry.isAlive())
                .playerControlled(entry.isPlayer())
                .build();
    }
}
