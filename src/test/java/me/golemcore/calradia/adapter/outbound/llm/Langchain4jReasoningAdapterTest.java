package me.golemcore.calradia.adapter.outbound.llm;

import me.golemcore.calradia.domain.model.CancellationToken;
import me.golemcore.calradia.domain.model.Perception;
import me.golemcore.calradia.domain.service.PersonalityService;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.test.util.ReflectionTestUtils;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class Langchain4jReasoningAdapterTest {

    private static final String IS_RATE_LIMIT_ERROR = "isRateLimitError";

    private CalradiaProperties properties;
    private ReasoningPromptBuilder promptBuilder;
    private Langchain4jReasoningAdapter adapter;
    private ChatModel chatModel;
    private Perception perception;

    @BeforeEach
    void setUp() {
        properties = new CalradiaProperties();
        promptBuilder = new ReasoningPromptBuilder(new PersonalityService(), List::of);
        adapter = new Langchain4jReasoningAdapter(properties, promptBuilder);
        chatModel = mock(ChatModel.class);
        ReflectionTestUtils.setField(adapter, "chatModel", chatModel);
        ReflectionTestUtils.setField(adapter, "initialized", true);
        ReflectionTestUtils.setField(adapter, "initialBackoffMs", 1L);
        perception = Perception.builder().location("Pravend").relation("Empire", -80).build();
    }

    private static ChatResponse response(String text) {
        return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
    }

    // ===== availability =====

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        properties.getReasoning().getLangchain4j().setApiKey("");
        assertFalse(adapter.isAvailable());

        properties.getReasoning().getLangchain4j().setApiKey("gsk-test");
        assertTrue(adapter.isAvailable());
        assertEquals("langchain4j", adapter.getProviderId());
    }

    @Test
    void shouldBuildGroqModelOnInitialize() {
        properties.getReasoning().getLangchain4j().setApiKey("gsk-test");
        Langchain4jReasoningAdapter fresh = new Langchain4jReasoningAdapter(properties, promptBuilder);

        fresh.initialize();

        assertNotNull(ReflectionTestUtils.getField(fresh, "chatModel"));
        assertTrue((boolean) ReflectionTestUtils.getField(fresh, "initialized"));
    }

    @Test
    void shouldBuildAnthropicModelOnInitialize() {
        properties.getReasoning().getLangchain4j().setProvider("anthropic");
        properties.getReasoning().getLangchain4j().setApiKey("sk-ant-test");
        properties.getReasoning().getLangchain4j().setModel("claude-3-5-haiku-latest");
        Langchain4jReasoningAdapter fresh = new Langchain4jReasoningAdapter(properties, promptBuilder);

        fresh.initialize();

        assertNotNull(ReflectionTestUtils.getField(fresh, "chatModel"));
    }

    // ===== reason() =====

    @Test
    void shouldSendSystemAndUserPromptAndReturnText() {
        when(chatModel.chat(anyList())).thenReturn(response("THOUGHT: Hostile.\nACTION: DeclareWar"));

        String text = adapter.reason("Lord_Aldric_Vlandia", perception, "No previous decisions",
                CancellationToken.NONE).join();

        assertEquals("THOUGHT: Hostile.\nACTION: DeclareWar", text);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        List<ChatMessage> messages = captor.getValue();
        assertEquals(2, messages.size());
        assertInstanceOf(SystemMessage.class, messages.get(0));
        UserMessage user = assertInstanceOf(UserMessage.class, messages.get(1));
        assertTrue(user.singleText().contains("Empire: -80 (Hostile)"));
        assertTrue(user.singleText().contains("No previous decisions"));
    }

    @Test
    void shouldRetryRateLimitErrors() {
        when(chatModel.chat(anyList()))
                .thenThrow(new RuntimeException("HTTP 429 Too Many Requests"))
                .thenReturn(response("ACTION: Wait"));

        assertEquals("ACTION: Wait", adapter.reason("lord", perception, "", CancellationToken.NONE).join());
        verify(chatModel, times(2)).chat(anyList());
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        properties.getReasoning().getLangchain4j().setMaxRetries(1);
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("rate_limit_exceeded"));

        assertThrows(CompletionException.class,
                () -> adapter.reason("lord", perception, "", CancellationToken.NONE).join());
        verify(chatModel, times(2)).chat(anyList());
    }

    @Test
    void shouldNotRetryOtherErrors() {
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("Connection refused"));

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.reason("lord", perception, "", CancellationToken.NONE).join());
        assertTrue(error.getCause().getMessage().contains("Connection refused"));
        verify(chatModel, times(1)).chat(anyList());
    }

    // ===== cancellation =====

    @Test
    void shouldStopRetryingOnceCancelled() {
        AtomicBoolean cancelled = new AtomicBoolean();
        when(chatModel.chat(anyList())).thenAnswer(inv -> {
            cancelled.set(true);
            throw new RuntimeException("HTTP 429 Too Many Requests");
        });

        CompletionException error = assertThrows(CompletionException.class,
                () -> adapter.reason("lord", perception, "", cancelled::get).join());

        assertInstanceOf(CancellationException.class, error.getCause());
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    void shouldWakeFromBackoffWhenCancelled() {
        ReflectionTestUtils.setField(adapter, "initialBackoffMs", 60_000L);
        AtomicBoolean cancelled = new AtomicBoolean();
        when(chatModel.chat(anyList())).thenThrow(new RuntimeException("rate_limit_exceeded"));

        CompletableFuture<String> future = adapter.reason("lord", perception, "", cancelled::get);
        CompletableFuture.runAsync(() -> cancelled.set(true),
                CompletableFuture.delayedExecutor(200, TimeUnit.MILLISECONDS));

        CompletionException error = assertThrows(CompletionException.class,
                () -> future.orTimeout(5, TimeUnit.SECONDS).join());
        assertInstanceOf(CancellationException.class, error.getCause());
        verify(chatModel, times(1)).chat(anyList());
    }

    @Test
    void shouldNotCallModelWhenCancelledUpFront() {
        assertThrows(CompletionException.class,
                () -> adapter.reason("lord", perception, "", () -> true).join());

        verifyNoInteractions(chatModel);
    }

    // ===== generate() =====

    @Test
    void shouldSendDialoguePromptsVerbatim() {
        when(chatModel.chat(anyList())).thenReturn(response("*nods* Welcome, traveller."));

        String text = adapter.generate("You are Lord Aldric.", "Player says: hello", CancellationToken.NONE).join();

        assertEquals("*nods* Welcome, traveller.", text);
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
        verify(chatModel).chat(captor.capture());
        SystemMessage system = assertInstanceOf(SystemMessage.class, captor.getValue().get(0));
        assertEquals("You are Lord Aldric.", system.text());
        assertEquals("Player says: hello",
                assertInstanceOf(UserMessage.class, captor.getValue().get(1)).singleText());
    }

    // ===== isRateLimitError() =====

    @Test
    void shouldDetectRateLimitInCauseChain() {
        RuntimeException nested = new RuntimeException("wrapper", new RuntimeException("Too Many Requests"));

        assertTrue((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR, nested));
        assertFalse((boolean) ReflectionTestUtils.invokeMethod(adapter, IS_RATE_LIMIT_ERROR,
                new RuntimeException((String) null)));
    }
}
