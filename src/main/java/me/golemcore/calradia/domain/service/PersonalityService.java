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

import me.golemcore.calradia.domain.model.AgentPersonality;
import me.golemcore.calradia.domain.model.AgentProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Derives and caches a stable {@link AgentPersonality} per agent.
 *
 * <p>
 * Traits are drawn from a generator seeded with the agent id, so an agent gets
 * the same personality on every run. Rulers and faction leaders are pushed
 * towards ambition, and each kingdom's culture shifts a few traits.
 */
@Service
@Slf4j
public class PersonalityService {

    private static final int MAX_TRAIT = 100;

    private final Map<String, AgentPersonality> personalities = new ConcurrentHashMap<>();

    public AgentPersonality getPersonality(AgentProfile profile) {
        return getPersonality(profile.getId(), profile.getFaction(), profile.isFactionLeader(), isRuler(profile));
    }

    public AgentPersonality getPersonality(String agentId, String faction, boolean factionLeader, boolean ruler) {
        return personalities.computeIfAbsent(AgentKeys.normalize(agentId),
                key -> generate(key, faction, factionLeader, ruler));
    }

    public int size() {
        return personalities.size();
    }

    static boolean isRuler(AgentProfile profile) {
        String id = profile.getId() == null ? "" : profile.getId().toLowerCase(Locale.ROOT);
        return profile.isFactionLeader() && (id.contains("king") || id.contains("queen"));
    }

    private AgentPersonality generate(String key, String faction, boolean factionLeader, boolean ruler) {
        Random random = new Random(key.hashCode());
        AgentPersonality personality = AgentPersonality.builder()
                .valor(random.nextInt(20, 80))
                .honor(random.nextInt(20, 80))
                .mercy(random.nextInt(20, 80))
                .generosity(random.nextInt(20, 80))
                .calculating(random.nextInt(20, 80))
                .ambition(random.nextInt(20, 80))
                .loyalty(random.nextInt(30, 90))
                .aggression(random.nextInt(20, 80))
                .charm(random.nextInt(20, 80))
                .pride(random.nextInt(20, 80))
                .build();

        if (ruler) {
            personality.setAmbition(raise(personality.getAmbition(), 20));
            personality.setPride(raise(personality.getPride(), 15));
            personality.setCalculating(raise(personality.getCalculating(), 10));
        } else if (factionLeader) {
            personality.setAmbition(raise(personality.getAmbition(), 10));
            personality.setLoyalty(raise(personality.getLoyalty(), 10));
        }

        if (faction != null && !faction.isBlank()) {
            applyCulture(personality, faction.toLowerCase(Locale.ROOT));
        }
        log.debug("[Personality] Generated personality for {}", key);
        return personality;
    }

    private static void applyCulture(AgentPersonality p, String faction) {
        if (faction.contains("battania")) {
            p.setValor(raise(p.getValor(), 15));
            p.setPride(raise(p.getPride(), 10));
            p.setHonor(raise(p.getHonor(), 5));
        } else if (faction.contains("vlandia")) {
            p.setAmbition(raise(p.getAmbition(), 10));
            p.setCalculating(raise(p.getCalculating(), 10));
            p.setHonor(raise(p.getHonor(), 5));
        } else if (faction.contains("empire")) {
            p.setCalculating(raise(p.getCalculating(), 15));
            p.setCharm(raise(p.getCharm(), 10));
            p.setAggression(Math.max(0, p.getAggression() - 5));
        } else if (faction.contains("sturgia")) {
            p.setValor(raise(p.getValor(), 20));
            p.setAggression(raise(p.getAggression(), 15));
            p.setLoyalty(raise(p.getLoyalty(), 10));
        } else if (faction.contains("khuzait")) {
            p.setCalculating(raise(p.getCalculating(), 10));
            p.setAmbition(raise(p.getAmbition(), 10));
            p.setHonor(Math.max(0, p.getHonor() - 10));
        } else if (faction.contains("aserai")) {
            p.setCharm(raise(p.getCharm(), 15));
            p.setGenerosity(raise(p.getGenerosity(), 10));
            p.setCalculating(raise(p.getCalculating(), 5));
        }
    }

    private static int raise(int value, int amount) {
        return Math.min(MAX_TRAIT, value + amount);
    }
}
