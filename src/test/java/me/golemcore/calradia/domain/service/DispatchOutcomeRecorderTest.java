package me.golemcore.calradia.domain.service;

import me.golemcore.calradia.domain.model.ActionResult;
import me.golemcore.calradia.domain.model.AgentAction;
import me.golemcore.calradia.domain.model.AgentDecision;
import me.golemcore.calradia.domain.model.DispatchSource;
import me.golemcore.calradia.domain.model.Perception;
import me.golemcore.calradia.domain.model.ThoughtRecord;
import me.golemcore.calradia.domain.model.WorkflowFailureKind;
import me.golemcore.calradia.domain.model.WorkflowResult;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DispatchOutcomeRecorderTest {

    private ThoughtJournalService journal;
    private CalradiaProperties properties;
    private DispatchOutcomeRecorder recorder;

    @BeforeEach
    void setUp() {
        journal = new ThoughtJournalService(new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        properties = new CalradiaProperties();
        recorder = new DispatchOutcomeRecorder(new DecisionParser(), journal, properties);
    }

    @Test
    void shouldJournalSuccessfulCycle() {
        AgentDecision decision = new AgentDecision("lord", "THOUGHT: Time to trade.\nACTION: Trade",
                List.of(AgentAction.of("Trade")));
        WorkflowResult result = WorkflowResult.success("lord", Perception.builder().location("Pravend").build(),
                decision, List.of(ActionResult.successful("Trade completed")));

        recorder.record(DispatchSource.EVENT, "lord", result);

        ThoughtRecord recorded = journal.getRecent().get(0);
        assertEquals("lord", recorded.agentId());
        assertEquals("Time to trade.", recorded.thought());
        assertEquals("Trade", recorded.action());
    }

    @Test
    void shouldStillJournalWhenLogTogglesAreOff() {
        properties.getLogging().setThoughts(false);
        properties.getLogging().setActions(false);
        AgentDecision decision = new AgentDecision("lord", "ACTION: Attack", List.of(AgentAction.of("Attack")));

        recorder.record(DispatchSource.PROACTIVE, "lord", WorkflowResult.success("lord",
                Perception.builder().build(), decision, List.of(ActionResult.failed("boom"))));

        assertEquals(1, journal.size());
    }

    @Test
    void shouldNotJournalFailedCycle() {
        recorder.record(DispatchSource.EVENT, "lord",
                WorkflowResult.failure("lord", WorkflowFailureKind.SENSE_FAILED, new IllegalStateException("x")));
        recorder.record(DispatchSource.EVENT, "lord", null);

        assertEquals(0, journal.size());
    }
}
