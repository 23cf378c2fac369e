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

import me.golemcore.calradia.domain.model.ThoughtRecord;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * In-memory journal of the most recent agent thoughts, newest first.
 */
@Service
public class ThoughtJournalService {

    public static final int DEFAULT_CAPACITY = 10;
    public static final int MAX_THOUGHT_LENGTH = 100;

    private final int capacity;
    private final Clock clock;
    private final Deque<ThoughtRecord> records = new ArrayDeque<>();

    @Autowired
    public ThoughtJournalService(Clock clock) {
        this(DEFAULT_CAPACITY, clock);
    }

    public ThoughtJournalService(int capacity, Clock clock) {
        this.capacity = capacity;
        this.clock = clock;
    }

    public void record(String agentId, String thought, String action) {
        ThoughtRecord entry = new ThoughtRecord(agentId, truncate(thought), action, clock.instant());
        synchronized (records) {
            records.addFirst(entry);
            while (records.size() > capacity) {
                records.removeLast();
            }
        }
    }

    public List<ThoughtRecord> getRecent() {
        synchronized (records) {
            return new ArrayList<>(records);
        }
    }

    public List<ThoughtRecord> getRecent(int limit) {
        List<ThoughtRecord> recent = getRecent();
        return recent.size() <= limit ? recent : new ArrayList<>(recent.subList(0, limit));
    }

    /**
     * Most recent thoughts of one agent, newest first.
     */
    public List<ThoughtRecord> getRecentFor(String agentId, int limit) {
        String key = AgentKeys.normalize(agentId);
        List<ThoughtRecord> matching = new ArrayList<>();
        for (ThoughtRecord entry : getRecent()) {
            if (matching.size() >= limit) {
                break;
            }
            if (key.equals(AgentKeys.normalize(entry.agentId()))) {
                matching.add(entry);
            }
        }
        return matching;
    }

    public int size() {
        synchronized (records) {
            return records.size();
        }
    }

    public void clear() {
        synchronized (records) {
            records.clear();
        }
    }

    private static String truncate(String thought) {
        if (thought == null) {
            return "";
        }
        return thought.length() <= MAX_THOUGHT_LENGTH
                ? thought
                : thought.substring(0, MAX_THOUGHT_LENGTH - 3) + "...";
    }
}
