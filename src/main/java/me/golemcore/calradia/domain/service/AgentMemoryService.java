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

import me.golemcore.calradia.domain.model.MemoryEntry;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-agent decision history.
 *
 * <p>
 * Each agent keeps at most {@code capacity} entries; the oldest entry is evicted
 * when a new one would exceed it. Agent ids are compared case-insensitively.
 * The history is rendered into a compact numbered list that is fed back into
 * every reasoning call for the same agent.
 *
 * <p>
 * Safe for concurrent use: the event queue and the proactive scheduler may
 * record into the same memory at the same time.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AgentMemoryService {

    public static final String NO_HISTORY = "No previous decisions - this is your first decision.";

    private static final int DECISION_PREVIEW_LENGTH = 80;

    private final int capacity;
    private final Clock clock;
    private final Map<String, Deque<MemoryEntry>> histories = new ConcurrentHashMap<>();

    @Autowired
    public AgentMemoryService(CalradiaProperties properties, Clock clock) {
        this(properties.getMemory().getCapacity(), clock);
    }

    public AgentMemoryService(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Memory capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public void remember(String agentId, String situation, String decision, String action) {
        MemoryEntry entry = new MemoryEntry(clock.instant(), situation, decision, action);
        Deque<MemoryEntry> history = histories.computeIfAbsent(key(agentId), k -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(entry);
            while (history.size() > capacity) {
                history.removeFirst();
            }
        }
        log.debug("[Memory] Stored decision for {}: {}", agentId, action);
    }

    /**
     * Renders the agent's history, oldest first, for inclusion in a reasoning
     * prompt. Returns {@link #NO_HISTORY} when nothing was remembered yet.
     */
    public String getContext(String agentId) {
        List<MemoryEntry> entries = getEntries(agentId);
        if (entries.isEmpty()) {
            return NO_HISTORY;
        }

        Instant now = clock.instant();
        StringBuilder sb = new StringBuilder();
        sb.append("Your last ").append(entries.size()).append(" decisions:\n");
        int index = 1;
        for (MemoryEntry entry : entries) {
            sb.append("  ").append(index++).append(". [")
                    .append(formatAge(Duration.between(entry.timestamp(), now)))
                    .append("] ")
                    .append(entry.action())
                    .append(": ")
                    .append(truncate(entry.decision(), DECISION_PREVIEW_LENGTH))
                    .append('\n');
        }
        return sb.toString().stripTrailing();
    }

    public List<MemoryEntry> getEntries(String agentId) {
        Deque<MemoryEntry> history = histories.get(key(agentId));
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public void forget(String agentId) {
        histories.remove(key(agentId));
    }

    public void forgetAll() {
        histories.clear();
    }

    public int totalMemories() {
        int total = 0;
        for (Deque<MemoryEntry> history : histories.values()) {
            synchronized (history) {
                total += history.size();
            }
        }
        return total;
    }

    private static String key(String agentId) {
        return AgentKeys.normalize(agentId);
    }

    private static String formatAge(Duration age) {
        long minutes = Math.max(0, age.toMinutes());
        if (minutes < 1) {
            return "just now";
        }
        if (minutes == 1) {
            return "1 minute ago";
        }
        return minutes + " minutes ago";
    }

    private static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxLength ? text : text.substring(0, maxLength) + "...";
    }
}
