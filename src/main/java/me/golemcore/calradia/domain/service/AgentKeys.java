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

import java.util.Locale;

/**
 * Canonical form of an agent id for per-agent bookkeeping. Agent ids are
 * compared case-insensitively everywhere state is keyed by agent.
 */
final class AgentKeys {

    private AgentKeys() {
    }

    static String normalize(String agentId) {
        return agentId == null ? "" : agentId.trim().toLowerCase(Locale.ROOT);
    }
}
