package me.golemcore.calradia.domain.service;

import me.golemcore.calradia.domain.model.ActionFailureKind;
import me.golemcore.calradia.domain.model.ActionResult;
import me.golemcore.calradia.domain.model.AgentAction;
import me.golemcore.calradia.domain.model.AgentProfile;
import me.golemcore.calradia.domain.model.PersuasionResult;
import me.golemcore.calradia.domain.model.PersuasionVerdict;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.port.outbound.ActionExecutorPort;
import me.golemcore.calradia.port.outbound.TextGenerationPort;
import me.golemcore.calradia.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class PersuasionServiceTest {

    private static final String NPC = "Lord_Aldric_Vlandia";
    private static final String ACCEPT_REPLY = "DECISION: ACCEPT\n"
            + "RESPONSE: Aye, my lord. My men will ride at dawn.\n"
            + "ACTION: MoveArmy\n"
            + "REASONING: The player has been a loyal friend.";

    private TextGenerationPort textGeneration;
    private ActionExecutorPort executor;
    private AgentMemoryService memory;
    private CalradiaProperties properties;
    private PersuasionService service;

    @BeforeEach
    void setUp() {
        textGeneration = mock(TextGenerationPort.class);
        executor = mock(ActionExecutorPort.class);
        memory = new AgentMemoryService(5, new MutableClock(Instant.parse("2026-03-01T10:00:00Z")));
        properties = new CalradiaProperties();
        List<AgentProfile> agents = List.of(
                AgentProfile.builder().id(NPC).name("Aldric").faction("Vlandia").build());
        service = new PersuasionService(textGeneration, () -> agents, new PersonalityService(),
                new DialoguePromptBuilder(), executor, memory, properties);
    }

    private PersuasionResult persuade(String request) {
        return service.persuade(NPC, request, 40).orTimeout(5, TimeUnit.SECONDS).join();
    }

    private void reply(String raw) {
        when(textGeneration.generate(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture(raw));
    }

    // ===== persuade() =====

    @Test
    void shouldCarryOutAcceptedActionAndRememberIt() {
        reply(ACCEPT_REPLY);
        when(executor.canExecute("MoveArmy")).thenReturn(true);
        when(executor.execute(any(), any()))
                .thenReturn(CompletableFuture.completedFuture(ActionResult.successful("Army moving")));

        PersuasionResult result = persuade("Bring your army to Pravend");

        assertTrue(result.isAccepted());
        assertEquals("Aye, my lord. My men will ride at dawn.", result.getResponse());
        assertEquals("Army moving", result.getActionResult().getMessage());

        ArgumentCaptor<AgentAction> action = ArgumentCaptor.forClass(AgentAction.class);
        verify(executor).execute(action.capture(), any());
        assertEquals("MoveArmy", action.getValue().getType());
        assertEquals(NPC, action.getValue().getParameter(AgentAction.PARAM_AGENT_ID));
        assertEquals("Bring your army to Pravend", action.getValue().getParameter(AgentAction.PARAM_DETAIL));

        assertEquals(1, memory.getEntries(NPC).size());
        assertEquals(PersuasionService.MEMORY_SITUATION, memory.getEntries(NPC).get(0).situation());
        assertEquals("The player has been a loyal friend.", memory.getEntries(NPC).get(0).decision());
        assertEquals("MoveArmy", memory.getEntries(NPC).get(0).action());
    }

    @Test
    void shouldPromptWithRosterNameAndRelation() {
        reply("DECISION: REFUSE\nRESPONSE: Nay.\nACTION: None");

        persuade("Give me gold");

        ArgumentCaptor<String> systemPrompt = ArgumentCaptor.forClass(String.class);
        verify(textGeneration).generate(systemPrompt.capture(), anyString(), any());
        assertTrue(systemPrompt.getValue().startsWith("You are Aldric, a noble lord"));
        assertTrue(systemPrompt.getValue().contains("YOUR RELATIONSHIP WITH THE PLAYER: 40"));
    }

    @Test
    void shouldReportUnknownActionWithoutExecuting() {
        reply("DECISION: ACCEPT\nRESPONSE: Very well.\nACTION: Dance");
        when(executor.canExecute("Dance")).thenReturn(false);

        PersuasionResult result = persuade("Dance for me");

        assertTrue(result.isAccepted());
        assertEquals(ActionFailureKind.UNKNOWN_ACTION, result.getActionResult().getFailureKind());
        verify(executor, never()).execute(any(), any());
        assertEquals(0, memory.totalMemories());
    }

    @Test
    void shouldNotExecuteRefusal() {
        reply("DECISION: REFUSE\nRESPONSE: Nay, I will not.\nACTION: None\nREASONING: I distrust this one.");

        PersuasionResult result = persuade("Declare war on the Empire");

        assertEquals(PersuasionVerdict.REFUSE, result.getVerdict());
        assertNull(result.getActionType());
        assertNull(result.getActionResult());
        verifyNoInteractions(executor);
    }

    @Test
    void shouldOnlyAgreeWhenExecutionDisabled() {
        properties.getDialogue().setExecuteAcceptedActions(false);
        reply(ACCEPT_REPLY);

        PersuasionResult result = persuade("Bring your army");

        assertTrue(result.isAccepted());
        assertNull(result.getActionResult());
        verifyNoInteractions(executor);
    }

    @Test
    void shouldRememberAcceptedActionEvenWhenItFails() {
        reply(ACCEPT_REPLY);
        when(executor.canExecute("MoveArmy")).thenReturn(true);
        when(executor.execute(any(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("army routed")));

        PersuasionResult result = persuade("Bring your army");

        assertFalse(result.getActionResult().isSuccess());
        assertTrue(result.getActionResult().getMessage().contains("army routed"));
        assertEquals(1, memory.totalMemories());
    }

    @Test
    void shouldRefuseWhenBackendFails() {
        when(textGeneration.generate(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("backend down")));

        PersuasionResult result = persuade("Help me");

        assertEquals(PersuasionVerdict.REFUSE, result.getVerdict());
        assertEquals(PersuasionService.UNAVAILABLE_REPLY, result.getResponse());
        assertEquals("Backend error: backend down", result.getReasoning());
        verifyNoInteractions(executor);
    }

    // ===== parseReply() =====

    @Test
    void shouldParseNegotiation() {
        PersuasionResult result = PersuasionService.parseReply(
                "decision: Negotiate\nresponse: Perhaps, for 5000 denars.\naction: GiveGold, to me");

        assertTrue(result.isNegotiating());
        assertEquals("Perhaps, for 5000 denars.", result.getResponse());
        assertEquals("GiveGold", result.getActionType());
    }

    @Test
    void shouldShowRawTextWithoutResponseLine() {
        String raw = "x".repeat(250);

        PersuasionResult result = PersuasionService.parseReply(raw);

        assertEquals(PersuasionVerdict.REFUSE, result.getVerdict());
        assertEquals(200, result.getResponse().length());
    }
}
