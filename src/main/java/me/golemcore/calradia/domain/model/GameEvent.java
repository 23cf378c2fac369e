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

import java.util.List;

/**
 * World event published by the host application. Every affected agent gets its
 * own reaction request; {@code battleSize} is the total number of troops
 * involved and is only meaningful for battle events.
 */
public record GameEvent(GameEventType type, List<String> agentIds, String description, int battleSize) {

    public GameEvent {
        agentIds = agentIds == null ? List.of() : List.copyOf(agentIds);
    }

    public GameEvent(GameEventType type, List<String> agentIds, String description) {
        this(type, agentIds, description, 0);
    }
}
