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
import me.golemcore.calradia.domain.model.DialogueContext;
import me.golemcore.calradia.domain.model.ThoughtRecord;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Builds the prompts for NPC conversations and persuasion attempts.
 */
@Component
public class DialoguePromptBuilder {

    private static final String WORLD_LINE = "You live in the world of Mount & Blade II: Bannerlord.";

    public String buildDialogueSystemPrompt(String npcName, String npcRole, DialogueContext context) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are ").append(npcName).append(", a ").append(roleDescription(npcRole)).append(".\n");
        sb.append(WORLD_LINE).append("\n\n");
        sb.append(roleTraits(npcRole)).append("\n\n");

        sb.append(relationTone(context.getRelationWithPlayer())).append('\n');
        if (context.isAtWar()) {
            sb.append("WARNING: Your kingdoms are at war! Consider this situation.\n");
        }
        sb.append("Current mood: ").append(context.getNpcMood()).append("\n\n");

        sb.append("RULES:\n");
        sb.append("- Give short and concise answers (1-3 sentences)\n");
        sb.append("- Speak according to your character\n");
        sb.append("- Use medieval-style English\n");
        sb.append("- Stay true to the game world\n");
        return sb.toString();
    }

    public String buildDialogueUserPrompt(String playerMessage, DialogueContext context, String history,
            List<ThoughtRecord> recentThoughts) {
        StringBuilder sb = new StringBuilder();
        sb.append("SITUATION:\n");
        sb.append("Location: ").append(context.getLocation()).append('\n');
        sb.append("Player's Faction: ").append(context.getPlayerFaction()).append('\n');
        sb.append("Your Faction: ").append(context.getNpcFaction()).append('\n');
        sb.append("Relation Level: ").append(context.getRelationWithPlayer()).append("\n\n");

        if (!recentThoughts.isEmpty()) {
            sb.append("YOUR RECENT THOUGHTS:\n");
            for (ThoughtRecord thought : recentThoughts) {
                sb.append("- ").append(thought.thought()).append(" (").append(thought.action()).append(")\n");
            }
            sb.append('\n');
        }

        sb.append("PAST CONVERSATIONS:\n");
        sb.append(history).append("\n\n");
        sb.append("PLAYER NOW SAYS: \"").append(playerMessage).append("\"\n\n");
        sb.append("Give a short response fitting your character:\n");
        return sb.toString();
    }

    public String buildPersuasionSystemPrompt(String npcName, AgentPersonality personality, int relation) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are ").append(npcName)
                .append(", a noble lord in the medieval world of Mount & Blade II: Bannerlord.\n\n");
        sb.append("SPEECH STYLE - IMPORTANT:\n");
        sb.append("- Speak in a FORMAL, NOBLE manner befitting a medieval lord\n");
        sb.append("- Use dignified language but keep it UNDERSTANDABLE\n");
        sb.append("- You may use: 'Aye' (yes), 'Nay' (no), 'My lord', 'Indeed', 'Very well'\n");
        sb.append("- Avoid modern slang, keep sentences formal and authoritative\n\n");
        sb.append("YOUR PERSONALITY:\n").append(personality.describeTraits()).append("\n\n");
        sb.append("YOUR TENDENCIES:\n").append(personality.describeTendencies()).append("\n\n");
        sb.append("YOUR RELATIONSHIP WITH THE PLAYER: ").append(relation).append('\n');
        sb.append(persuasionStance(relation)).append("\n\n");
        sb.append("IMPORTANT RULES:\n");
        sb.append("- Evaluate the player's request based on YOUR personality\n");
        sb.append("- Consider if the request benefits YOU and YOUR kingdom\n");
        sb.append("- Your relationship with the player affects your willingness\n");
        sb.append("- If you ACCEPT, you will ACTUALLY perform the action\n");
        sb.append("- You can NEGOTIATE, ASK FOR SOMETHING IN RETURN, or REFUSE\n");
        sb.append("- Stay in character - proud lords don't like being ordered around\n");
        return sb.toString();
    }

    public String buildPersuasionUserPrompt(String playerRequest) {
        StringBuilder sb = new StringBuilder();
        sb.append("The player approaches you and says:\n");
        sb.append('"').append(playerRequest).append("\"\n\n");
        sb.append("How do you respond? Consider:\n");
        sb.append("1. Does this request align with your goals?\n");
        sb.append("2. Is this in your best interest?\n");
        sb.append("3. Do you trust the player enough?\n");
        sb.append("4. What would someone with YOUR personality do?\n\n");
        sb.append("FORMAT YOUR RESPONSE EXACTLY AS:\n");
        sb.append("DECISION: [ACCEPT/REFUSE/NEGOTIATE]\n");
        sb.append("RESPONSE: [What you say to the player - be formal and in character]\n");
        sb.append("ACTION: [If accepting, the action you take, e.g. Attack, MoveArmy, DeclareWar, MakePeace. ")
                .append("If refusing, write 'None']\n");
        sb.append("REASONING: [Your internal thoughts - why you decided this way]\n");
        return sb.toString();
    }

    static String roleDescription(String role) {
        String value = lower(role);
        if (value.contains("king")) {
            return "powerful and honorable king";
        }
        if (value.contains("lord")) {
            return "noble lord";
        }
        if (value.contains("merchant")) {
            return "cunning merchant";
        }
        if (value.contains("blacksmith")) {
            return "master blacksmith";
        }
        if (value.contains("tavern")) {
            return "cheerful tavern keeper";
        }
        if (value.contains("villager")) {
            return "simple villager";
        }
        if (value.contains("soldier")) {
            return "experienced soldier";
        }
        if (value.contains("commander")) {
            return "veteran commander";
        }
        if (value.contains("bandit")) {
            return "ruthless bandit";
        }
        return "resident of Calradia";
    }

    private static String roleTraits(String role) {
        String value = lower(role);
        if (value.contains("king")) {
            return "You are authoritative and wise. The kingdom's interests come above all else.";
        }
        if (value.contains("lord")) {
            return "You are honorable, proud, and a warrior. Your honor comes above all.";
        }
        if (value.contains("merchant")) {
            return "You are clever, calculating, and opportunistic. Money is everything.";
        }
        if (value.contains("villager")) {
            return "You are humble, timid, and respectful to lords. Life is hard.";
        }
        if (value.contains("bandit")) {
            return "You are dangerous, cunning, and ruthless. Power is everything.";
        }
        return "You are an ordinary person living in Calradia.";
    }

    static String relationTone(int relation) {
        if (relation >= 50) {
            return "You have an excellent relationship with this person. "
                    + "You trust them and speak in a friendly manner.";
        }
        if (relation >= 0) {
            return "You have a normal relationship with this person. You speak formally but politely.";
        }
        if (relation >= -50) {
            return "Your relationship with this person is tense. You speak coldly and distantly.";
        }
        return "You hate this person. You speak in a hostile and threatening manner.";
    }

    static String persuasionStance(int relation) {
        if (relation >= 50) {
            return "You consider the player a trusted friend and ally.";
        }
        if (relation >= 20) {
            return "You have a positive view of the player.";
        }
        if (relation >= 0) {
            return "You are neutral towards the player.";
        }
        if (relation >= -30) {
            return "You are wary of the player.";
        }
        return "You dislike the player and are suspicious of their motives.";
    }

    private static String lower(String value) {
        return value == null ? "" : value.toLowerCase(Locale.ROOT);
    }
}
