package me.golemcore.calradia.domain.service;

import me.golemcore.calradia.domain.model.CancellationToken;
import me.golemcore.calradia.domain.model.DialogueContext;
import me.golemcore.calradia.domain.model.DialogueIntent;
import me.golemcore.calradia.domain.model.DialogueResponse;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.port.outbound.TextGenerationPort;
import me.golemcore.calradia.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DialogueServiceTest {

    private static final String NPC = "Lord_Aldric_Vlandia";

    private TextGenerationPort textGeneration;
    private ConversationMemoryService conversations;
    private ThoughtJournalService journal;
    private CalradiaProperties properties;
    private DialogueService service;
    private DialogueContext context;

    @BeforeEach
    void setUp() {
        MutableClock clock = new MutableClock(Instant.parse("2026-03-01T10:00:00Z"));
        textGeneration = mock(TextGenerationPort.class);
        conversations = new ConversationMemoryService(10, clock);
        journal = new ThoughtJournalService(clock);
        properties = new CalradiaProperties();
        service = new DialogueService(textGeneration, conversations, journal, new DialoguePromptBuilder(),
                properties);
        context = DialogueContext.builder()
                .location("Pravend")
                .relationWithPlayer(10)
                .npcFaction("Vlandia")
                .playerFaction("Battania")
                .build();
    }

    private DialogueResponse respond(String message) {
        return service.respond(NPC, "Aldric", "Lord", message, context).orTimeout(5, TimeUnit.SECONDS).join();
    }

    // ===== respond() =====

    @Test
    void shouldAnswerInCharacterAndRememberExchange() {
        when(textGeneration.generate(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture("*smiling* Welcome to Pravend, friend."));

        DialogueResponse response = respond("Hello, my lord.");

        assertEquals("Welcome to Pravend, friend.", response.getText());
        assertEquals("Happy", response.getEmotion());
        assertEquals(DialogueIntent.FRIENDLY, response.getIntent());
        assertEquals("Hello, my lord.", conversations.getLastPlayerMessage(NPC).orElseThrow());
        assertEquals("Welcome to Pravend, friend.", conversations.getEntries(NPC).get(0).npcResponse());
    }

    @Test
    void shouldPromptWithRecentThoughtsAndEarlierConversations() {
        journal.record(NPC, "Empire is hostile.", "DeclareWar");
        journal.record("Merchant_Talia", "Grain is cheap.", "Trade");
        conversations.remember(NPC, "Do you fear the Empire?", "Nay.");
        when(textGeneration.generate(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.completedFuture("We march soon."));

        respond("What are your plans?");

        ArgumentCaptor<String> userPrompt = ArgumentCaptor.forClass(String.class);
        verify(textGeneration).generate(anyString(), userPrompt.capture(), any());
        String prompt = userPrompt.getValue();
        assertTrue(prompt.contains("- Empire is hostile. (DeclareWar)"));
        assertFalse(prompt.contains("Grain is cheap."));
        assertTrue(prompt.contains("Player: Do you fear the Empire?"));
        assertTrue(prompt.contains("PLAYER NOW SAYS: \"What are your plans?\""));
    }

    @Test
    void shouldFallBackWhenGenerationFails() {
        when(textGeneration.generate(anyString(), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new IllegalStateException("backend down")));

        DialogueResponse response = respond("Hello");

        assertEquals(DialogueService.FAILURE_REPLY, response.getText());
        assertEquals(DialogueResponse.EMOTION_CONFUSED, response.getEmotion());
        assertTrue(conversations.getEntries(NPC).isEmpty());
    }

    @Test
    void shouldFallBackWhenGenerationThrows() {
        when(textGeneration.generate(anyString(), anyString(), any()))
                .thenThrow(new IllegalStateException("not initialized"));

        assertEquals(DialogueService.FAILURE_REPLY, respond("Hello").getText());
    }

    @Test
    void shouldStaySilentAndRaiseTokenOnTimeout() {
        properties.getDialogue().setResponseTimeout(Duration.ofMillis(50));
        AtomicReference<CancellationToken> token = new AtomicReference<>();
        when(textGeneration.generate(anyString(), anyString(), any())).thenAnswer(inv -> {
            token.set(inv.getArgument(2));
            return new CompletableFuture<String>();
        });

        DialogueResponse response = respond("Hello");

        assertEquals(DialogueService.SILENT_REPLY, response.getText());
        assertTrue(token.get().isCancellationRequested());
        assertTrue(conversations.getEntries(NPC).isEmpty());
    }

    // ===== parseReply() =====

    @Test
    void shouldReadEmotionMarkers() {
        DialogueResponse angry = DialogueService.parseReply("*angry* How dare you!");
        assertEquals("How dare you!", angry.getText());
        assertEquals("Angry", angry.getEmotion());
        assertEquals(DialogueIntent.HOSTILE, angry.getIntent());

        DialogueResponse cold = DialogueService.parseReply("*cold* Leave my hall.");
        assertEquals(DialogueIntent.THREATENING, cold.getIntent());

        DialogueResponse sad = DialogueService.parseReply("*sad* My son fell at Pravend.");
        assertEquals("Sad", sad.getEmotion());
        assertEquals(DialogueIntent.NEUTRAL, sad.getIntent());
    }

    @Test
    void shouldDetectFarewell() {
        assertTrue(DialogueService.parseReply("Farewell, traveller.").isEndsConversation());
        assertTrue(DialogueService.parseReply("Leave me be.").isEndsConversation());
        assertFalse(DialogueService.parseReply("Stay a while.").isEndsConversation());
    }

    @Test
    void shouldStripMarkersAndCollapseSpaces() {
        assertEquals("Aye, I will help.", DialogueService.parseReply("Aye, *nods slowly* I will help.").getText());
        assertEquals(DialogueService.SILENT_REPLY, DialogueService.parseReply("*stares*").getText());
        assertEquals(DialogueService.SILENT_REPLY, DialogueService.parseReply(null).getText());
    }

    @Test
    void shouldGreetByRelation() {
        assertTrue(DialogueService.greeting(50).startsWith("Ah, my friend!"));
        assertTrue(DialogueService.greeting(0).startsWith("Yes?"));
        assertTrue(DialogueService.greeting(-50).startsWith("What do you want?"));
        assertTrue(DialogueService.greeting(-51).startsWith("You dare approach me?"));
    }
}
