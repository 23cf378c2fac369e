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

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Marks agents that currently have a workflow cycle in flight.
 *
 * <p>
 * Shared by the event queue and the proactive scheduler so that the two
 * independent drivers never run overlapping cycles for the same agent. Every
 * successful {@link #tryAcquire(String)} must be paired with a
 * {@link #release(String)} in a finally block.
 */
@Component
@Slf4j
public class AgentDispatchGuard {

    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();

    public boolean tryAcquire(String agentId) {
        boolean acquired = inFlight.add(AgentKeys.normalize(agentId));
        if (!acquired) {
            log.debug("[Workflow] {} already has a cycle in flight", agentId);
        }
        return acquired;
    }

    public void release(String agentId) {
        inFlight.remove(AgentKeys.normalize(agentId));
    }

    public boolean isInFlight(String agentId) {
        return inFlight.contains(AgentKeys.normalize(agentId));
    }

    public int inFlightCount() {
        return inFlight.size();
    }
}
