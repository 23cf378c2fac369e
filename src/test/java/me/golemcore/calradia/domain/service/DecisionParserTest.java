package me.golemcore.calradia.domain.service;

import me.golemcore.calradia.domain.model.AgentAction;
import me.golemcore.calradia.domain.model.AgentDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class DecisionParserTest {

    private DecisionParser parser;

    @BeforeEach
    void setUp() {
        parser = new DecisionParser();
    }

    // ===== parse() =====

    @Test
    void shouldParseThoughtActionAndDetail() {
        AgentDecision decision = parser.parse("lord",
                "THOUGHT: Empire is hostile.\nACTION: DeclareWar\nDETAIL: Empire");

        assertEquals("lord", decision.getAgentId());
        assertEquals(1, decision.getActions().size());
        AgentAction action = decision.getPrimaryAction();
        assertEquals("DeclareWar", action.getType());
        assertEquals("Empire", action.getParameter(AgentAction.PARAM_DETAIL));
    }

    @Test
    void shouldKeepRawReasoningText() {
        String raw = "THOUGHT: Hold.\nACTION: Trade";

        assertEquals(raw, parser.parse("merchant", raw).getReasoning());
    }

    @Test
    void shouldCutActionTypeAtFirstComma() {
        AgentDecision decision = parser.parse("lord", "ACTION: Attack, something");

        assertEquals("Attack", decision.getPrimaryAction().getType());
    }

    @Test
    void shouldCutActionTypeAtFirstSpace() {
        AgentDecision decision = parser.parse("lord", "ACTION: MoveArmy to Pravend");

        assertEquals("MoveArmy", decision.getPrimaryAction().getType());
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "I think we should rest.", "THOUGHT: nothing to do", "ACTION:",
            "ACTION:   " })
    void shouldDefaultToWaitWhenNoRecognizableAction(String raw) {
        AgentDecision decision = parser.parse("lord", raw);

        assertEquals(1, decision.getActions().size());
        assertEquals(DecisionParser.WAIT_ACTION, decision.getPrimaryAction().getType());
        assertEquals(DecisionParser.DEFAULT_WAIT_SECONDS,
                decision.getPrimaryAction().getParameter(AgentAction.PARAM_DURATION));
    }

    @Test
    void shouldDefaultToWaitForNullText() {
        AgentDecision decision = parser.parse("lord", null);

        assertEquals(DecisionParser.WAIT_ACTION, decision.getPrimaryAction().getType());
        assertEquals("", decision.getReasoning());
    }

    @Test
    void shouldNormalizeWaitIgnoringCaseAndDropDetail() {
        AgentDecision decision = parser.parse("lord", "ACTION: wait\nDETAIL: for reinforcements");

        AgentAction action = decision.getPrimaryAction();
        assertEquals("Wait", action.getType());
        assertEquals(60, action.getParameter(AgentAction.PARAM_DURATION));
        assertNull(action.getParameter(AgentAction.PARAM_DETAIL));
    }

    @Test
    void shouldHonorOnlyFirstActionLine() {
        AgentDecision decision = parser.parse("lord", "ACTION: Trade\nACTION: Attack\nDETAIL: first\nDETAIL: second");

        assertEquals(1, decision.getActions().size());
        assertEquals("Trade", decision.getPrimaryAction().getType());
        assertEquals("first", decision.getPrimaryAction().getParameter(AgentAction.PARAM_DETAIL));
    }

    @Test
    void shouldMatchPrefixesCaseInsensitivelyWithIndentation() {
        AgentDecision decision = parser.parse("lord", "  thought: calm\n   action: Patrol\n detail: the road");

        assertEquals("Patrol", decision.getPrimaryAction().getType());
        assertEquals("the road", decision.getPrimaryAction().getParameter(AgentAction.PARAM_DETAIL));
    }

    @Test
    void shouldAcceptTurkishPrefixes() {
        AgentDecision decision = parser.parse("lord", "DUSUNCE: Savas yakin.\nAKSIYON: Defend\nDETAY: Kale");

        assertEquals("Defend", decision.getPrimaryAction().getType());
        assertEquals("Kale", decision.getPrimaryAction().getParameter(AgentAction.PARAM_DETAIL));
    }

    @Test
    void shouldOmitDetailParameterWhenDetailLineMissing() {
        AgentDecision decision = parser.parse("lord", "ACTION: Recruit");

        assertTrue(decision.getPrimaryAction().getParameters().isEmpty());
    }

    @Test
    void shouldIgnorePrefixesInsideSentences() {
        AgentDecision decision = parser.parse("lord", "My ACTION: Attack would be rash.");

        assertEquals("Wait", decision.getPrimaryAction().getType());
    }

    // ===== extractThought() =====

    @Test
    void shouldExtractThoughtLine() {
        assertEquals("Empire is hostile.",
                parser.extractThought("THOUGHT: Empire is hostile.\nACTION: DeclareWar", 100));
    }

    @Test
    void shouldTruncateLongThoughtWithEllipsis() {
        String thought = parser.extractThought("THOUGHT: " + "a".repeat(150), 100);

        assertEquals(100, thought.length());
        assertTrue(thought.endsWith("..."));
    }

    @Test
    void shouldFallBackToFlattenedRawTextWithoutThoughtLine() {
        assertEquals("We march at dawn. ACTION: MoveArmy",
                parser.extractThought("We march at dawn.\nACTION: MoveArmy", 80));
    }

    @Test
    void shouldReturnEmptyThoughtForBlankText() {
        assertEquals("", parser.extractThought("  ", 80));
        assertEquals("", parser.extractThought(null, 80));
    }
}
