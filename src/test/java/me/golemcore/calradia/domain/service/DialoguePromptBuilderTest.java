package me.golemcore.calradia.domain.service;

import me.golemcore.calradia.domain.model.AgentPersonality;
import me.golemcore.calradia.domain.model.DialogueContext;
import me.golemcore.calradia.domain.model.ThoughtRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DialoguePromptBuilderTest {

    private final DialoguePromptBuilder builder = new DialoguePromptBuilder();

    private static DialogueContext context(int relation, boolean atWar) {
        return DialogueContext.builder()
                .location("Pravend")
                .relationWithPlayer(relation)
                .npcFaction("Vlandia")
                .playerFaction("Battania")
                .atWar(atWar)
                .build();
    }

    // ===== dialogue =====

    @Test
    void shouldDescribeRoleRelationAndWar() {
        String prompt = builder.buildDialogueSystemPrompt("Aldric", "Lord", context(-60, true));

        assertTrue(prompt.startsWith("You are Aldric, a noble lord.\n"));
        assertTrue(prompt.contains("Your honor comes above all."));
        assertTrue(prompt.contains("You hate this person."));
        assertTrue(prompt.contains("WARNING: Your kingdoms are at war!"));
        assertTrue(prompt.contains("Current mood: Neutral"));
    }

    @Test
    void shouldLeaveOutWarWarningInPeace() {
        String prompt = builder.buildDialogueSystemPrompt("Talia", "merchant", context(10, false));

        assertTrue(prompt.startsWith("You are Talia, a cunning merchant.\n"));
        assertFalse(prompt.contains("WARNING"));
    }

    @Test
    void shouldIncludeRecentThoughtsHistoryAndMessage() {
        List<ThoughtRecord> thoughts = List.of(
                new ThoughtRecord("Lord_Aldric_Vlandia", "Empire is hostile.", "DeclareWar",
                        Instant.parse("2026-03-01T10:00:00Z")));

        String prompt = builder.buildDialogueUserPrompt("Will you help me?", context(0, false),
                ConversationMemoryService.NO_HISTORY, thoughts);

        assertTrue(prompt.contains("Location: Pravend\n"));
        assertTrue(prompt.contains("Player's Faction: Battania\n"));
        assertTrue(prompt.contains("YOUR RECENT THOUGHTS:\n- Empire is hostile. (DeclareWar)\n"));
        assertTrue(prompt.contains("PAST CONVERSATIONS:\n" + ConversationMemoryService.NO_HISTORY));
        assertTrue(prompt.contains("PLAYER NOW SAYS: \"Will you help me?\""));
    }

    @Test
    void shouldSkipThoughtsSectionWithoutThoughts() {
        String prompt = builder.buildDialogueUserPrompt("Hello", context(0, false), "", List.of());

        assertFalse(prompt.contains("YOUR RECENT THOUGHTS"));
    }

    // ===== persuasion =====

    @Test
    void shouldRenderPersonalityAndStanceForPersuasion() {
        AgentPersonality personality = AgentPersonality.builder().pride(90).build();

        String prompt = builder.buildPersuasionSystemPrompt("Aldric", personality, 25);

        assertTrue(prompt.startsWith("You are Aldric, a noble lord"));
        assertTrue(prompt.contains("YOUR PERSONALITY:\nPROUD - sensitive to slights, values status\n"));
        assertTrue(prompt.contains("YOUR RELATIONSHIP WITH THE PLAYER: 25\nYou have a positive view of the player."));
    }

    @Test
    void shouldAskForStructuredVerdict() {
        String prompt = builder.buildPersuasionUserPrompt("Attack the Empire");

        assertTrue(prompt.contains("\"Attack the Empire\""));
        assertTrue(prompt.contains("DECISION: [ACCEPT/REFUSE/NEGOTIATE]"));
        assertTrue(prompt.contains("REASONING: ["));
    }

    // ===== bands =====

    @Test
    void shouldBandRelationIntoTone() {
        assertTrue(DialoguePromptBuilder.relationTone(50).contains("excellent"));
        assertTrue(DialoguePromptBuilder.relationTone(0).contains("normal"));
        assertTrue(DialoguePromptBuilder.relationTone(-50).contains("tense"));
        assertTrue(DialoguePromptBuilder.relationTone(-51).contains("hate"));
    }

    @Test
    void shouldBandRelationIntoPersuasionStance() {
        assertTrue(DialoguePromptBuilder.persuasionStance(50).contains("trusted friend"));
        assertTrue(DialoguePromptBuilder.persuasionStance(0).contains("neutral"));
        assertTrue(DialoguePromptBuilder.persuasionStance(-30).contains("wary"));
        assertTrue(DialoguePromptBuilder.persuasionStance(-31).contains("dislike"));
    }

    @Test
    void shouldFallBackToCommonerRole() {
        assertEquals("resident of Calradia", DialoguePromptBuilder.roleDescription(null));
        assertEquals("powerful and honorable king", DialoguePromptBuilder.roleDescription("King"));
    }
}
