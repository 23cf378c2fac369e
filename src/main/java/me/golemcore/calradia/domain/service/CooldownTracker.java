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

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-agent "last triggered at" timestamps shared by the event queue and the
 * proactive scheduler.
 *
 * <p>
 * {@link #tryAccept(String, Duration)} is a single atomic check-and-stamp per
 * agent: two near-simultaneous callers for the same agent can never both be
 * accepted within one period. Unrelated agents never contend on the same lock.
 * Agent ids are compared case-insensitively.
 *
 * @since 1.0
 */
@Component
public class CooldownTracker {

    private final Clock clock;
    private final Map<String, Instant> lastTriggers = new ConcurrentHashMap<>();

    public CooldownTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * Accepts the trigger and stamps the current time if the agent has never
     * been triggered or its last trigger is at least {@code period} ago.
     *
     * @return true if accepted; false if still cooling down (no state change)
     */
    public boolean tryAccept(String agentId, Duration period) {
        Instant now = clock.instant();
        boolean[] accepted = new boolean[1];
        lastTriggers.compute(AgentKeys.normalize(agentId), (id, last) -> {
            if (last == null || !now.isBefore(last.plus(period))) {
                accepted[0] = true;
                return now;
            }
            return last;
        });
        return accepted[0];
    }

    /**
     * Unconditionally records a trigger at the current time.
     */
    public void stamp(String agentId) {
        lastTriggers.put(AgentKeys.normalize(agentId), clock.instant());
    }

    public boolean isCoolingDown(String agentId, Duration period) {
        Instant last = lastTriggers.get(AgentKeys.normalize(agentId));
        return last != null && clock.instant().isBefore(last.plus(period));
    }

    public Optional<Instant> lastTrigger(String agentId) {
        return Optional.ofNullable(lastTriggers.get(AgentKeys.normalize(agentId)));
    }

    public void reset(String agentId) {
        lastTriggers.remove(AgentKeys.normalize(agentId));
    }

    public void clear() {
        lastTriggers.clear();
    }
}
