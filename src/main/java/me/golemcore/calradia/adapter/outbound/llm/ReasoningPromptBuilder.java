package me.golemcore.calradia.adapter.outbound.llm;

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
import me.golemcore.calradia.domain.model.Perception;
import me.golemcore.calradia.domain.service.PersonalityService;
import me.golemcore.calradia.port.outbound.AgentRosterPort;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the system and user prompts sent to a chat-based reasoning backend.
 *
 * <p>
 * The system prompt is a persona picked from keywords in the agent id. Agents
 * sworn to a faction also get their personality traits and tendencies. The user
 * prompt lays out the perception, the agent's memory and the expected
 * THOUGHT/ACTION/DETAIL answer format.
 */
@Component
@RequiredArgsConstructor
public class ReasoningPromptBuilder {

    private static final DateTimeFormatter TIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm")
            .withZone(ZoneId.of("UTC"));
    private static final String CONSISTENCY_SUFFIX = " Consider your previous decisions. Be consistent.";

    private final PersonalityService personalityService;
    private final AgentRosterPort roster;

    public String buildSystemPrompt(String agentId) {
        String id = agentId == null ? "" : agentId.toLowerCase(Locale.ROOT);
        String persona;
        if (id.contains("king") || id.contains("caladog")) {
            persona = "You are King Caladog of Battania, a strong and honorable warrior king. "
                    + "Your decisions must serve your people and grow your realm.";
        } else if (id.contains("merchant") || id.contains("trader")) {
            persona = "You are a wealthy merchant. Profit and a wider trade network come first.";
        } else if (id.contains("commander") || id.contains("general")) {
            persona = "You are a seasoned commander with a gift for tactics. "
                    + "You value your soldiers' lives, but victory comes first.";
        } else if (id.contains("villager") || id.contains("peasant")) {
            persona = "You are a peasant. Life is hard and taxes are heavy. "
                    + "You fight to keep your family alive.";
        } else {
            persona = "You are a character living in the world of Calradia. Decide with logic and reason.";
        }
        String personality = personalitySection(agentId);
        return personality.isEmpty()
                ? persona + CONSISTENCY_SUFFIX
                : persona + personality + CONSISTENCY_SUFFIX.strip();
    }

    public String buildUserPrompt(String agentId, Perception perception, String memoryContext) {
        StringBuilder sb = new StringBuilder();
        sb.append("CURRENT SITUATION:\n");
        sb.append("Character: ").append(agentId).append('\n');
        sb.append("Location: ").append(perception.getLocation()).append('\n');
        if (perception.getTimestamp() != null) {
            sb.append("Time: ").append(TIME_FORMAT.format(perception.getTimestamp())).append('\n');
        }
        if (perception.getWeather() != null) {
            sb.append("Weather: ").append(perception.getWeather()).append('\n');
        }
        sb.append('\n');

        Perception.EconomicState economy = perception.getEconomy();
        if (economy != null) {
            sb.append("ECONOMY:\n");
            sb.append("Prosperity: ").append(economy.prosperity()).append('\n');
            sb.append("Food Supply: ").append(economy.foodSupply()).append('\n');
            sb.append("Tax Rate: ").append(economy.taxRate()).append("%\n");
            sb.append('\n');
        }

        sb.append("RELATIONS:\n");
        for (Map.Entry<String, Integer> relation : perception.getRelations().entrySet()) {
            int score = relation.getValue();
            sb.append("  ").append(relation.getKey()).append(": ").append(score)
                    .append(" (").append(relationStatus(score)).append(")\n");
        }
        sb.append('\n');

        sb.append("MEMORY:\n");
        sb.append(memoryContext != null ? memoryContext : "").append('\n');
        sb.append('\n');

        sb.append("QUESTION: What should you do in this situation?\n");
        sb.append('\n');
        sb.append("Format:\n");
        sb.append("THOUGHT: [Analysis]\n");
        sb.append("ACTION: [Wait/MoveArmy/Trade/Attack/Defend/Recruit]\n");
        sb.append("DETAIL: [Details]\n");
        return sb.toString();
    }

    private String personalitySection(String agentId) {
        Optional<AgentProfile> profile = roster.findAgent(agentId)
                .filter(agent -> agent.getFaction() != null && !agent.getFaction().isBlank());
        if (profile.isEmpty()) {
            return "";
        }
        AgentPersonality personality = personalityService.getPersonality(profile.get());
        return "\n\nYOUR PERSONALITY: " + personality.describeTraits()
                + "\nYOUR TENDENCIES: " + personality.describeTendencies() + "\n\n";
    }

    static String relationStatus(int score) {
        if (score >= 50) {
            return "Allied";
        }
        if (score >= 0) {
            return "Neutral";
        }
        if (score >= -50) {
            return "Tense";
        }
        return "Hostile";
    }
}
