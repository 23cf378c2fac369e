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

import me.golemcore.calradia.domain.model.ConversationEntry;
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
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded per-NPC history of what the player said and how the NPC answered.
 * NPC ids are compared case-insensitively.
 */
@Service
@Slf4j
public class ConversationMemoryService {

    public static final String NO_HISTORY = "This is your first conversation with this player.";

    private static final int MESSAGE_PREVIEW_LENGTH = 100;

    private final int capacity;
    private final Clock clock;
    private final Map<String, Deque<ConversationEntry>> conversations = new ConcurrentHashMap<>();

    @Autowired
    public ConversationMemoryService(CalradiaProperties properties, Clock clock) {
        this(properties.getDialogue().getConversationCapacity(), clock);
    }

    public ConversationMemoryService(int capacity, Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Conversation capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.clock = clock;
    }

    public void remember(String npcId, String playerMessage, String npcResponse) {
        ConversationEntry entry = new ConversationEntry(clock.instant(), playerMessage, npcResponse);
        Deque<ConversationEntry> history = conversations.computeIfAbsent(AgentKeys.normalize(npcId),
                k -> new ArrayDeque<>());
        synchronized (history) {
            history.addLast(entry);
            while (history.size() > capacity) {
                history.removeFirst();
            }
        }
        log.debug("[Dialogue] Stored exchange with {}", npcId);
    }

    /**
     * Renders the exchanges with this NPC, oldest first, for a dialogue prompt.
     */
    public String getHistory(String npcId) {
        List<ConversationEntry> entries = getEntries(npcId);
        if (entries.isEmpty()) {
            return NO_HISTORY;
        }

        Instant now = clock.instant();
        StringBuilder sb = new StringBuilder();
        sb.append("Your last ").append(entries.size()).append(" conversations:\n");
        for (ConversationEntry entry : entries) {
            sb.append("  [").append(formatAge(Duration.between(entry.timestamp(), now))).append("]\n");
            sb.append("    Player: ").append(truncate(entry.playerMessage())).append('\n');
            sb.append("    You: ").append(truncate(entry.npcResponse())).append('\n');
        }
        return sb.toString().stripTrailing();
    }

    public List<ConversationEntry> getEntries(String npcId) {
        Deque<ConversationEntry> history = conversations.get(AgentKeys.normalize(npcId));
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    public Optional<String> getLastPlayerMessage(String npcId) {
        Deque<ConversationEntry> history = conversations.get(AgentKeys.normalize(npcId));
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            ConversationEntry last = history.peekLast();
            return last != null ? Optional.ofNullable(last.playerMessage()) : Optional.empty();
        }
    }

    public void forget(String npcId) {
        conversations.remove(AgentKeys.normalize(npcId));
    }

    public void forgetAll() {
        conversations.clear();
    }

    static String formatAge(Duration age) {
        long minutes = Math.max(0, age.toMinutes());
        if (minutes < 1) {
            return "just now";
        }
        if (minutes < 60) {
            return minutes + " minutes ago";
        }
        long hours = age.toHours();
        if (hours < 24) {
            return hours + " hours ago";
        }
        return age.toDays() + " days ago";
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MESSAGE_PREVIEW_LENGTH) {
            return text;
        }
        return text.substring(0, MESSAGE_PREVIEW_LENGTH - 3) + "...";
    }
}
