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

import me.golemcore.calradia.domain.model.CancellationToken;
import me.golemcore.calradia.domain.model.Perception;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.anthropic.AnthropicChatModel;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;

/**
 * Reasoning adapter backed by langchain4j chat models.
 *
 * <p>
 * Supports:
 * <ul>
 * <li>Groq through its OpenAI-compatible endpoint (default)</li>
 * <li>OpenAI</li>
 * <li>Anthropic</li>
 * </ul>
 *
 * <p>
 * The chat model is built once in {@link #initialize()}. Rate-limit errors are
 * retried with exponential backoff up to
 * {@code calradia.reasoning.langchain4j.max-retries} times; every other error
 * fails the returned future. Once the caller's {@link CancellationToken} is
 * raised no further request is sent and the pending backoff is cut short.
 *
 * <p>
 * Provider ID: {@code "langchain4j"}
 */
@Component
@Slf4j
public class Langchain4jReasoningAdapter implements ReasoningProviderAdapter {

    static final String GROQ_BASE_URL = "https://api.groq.com/openai/v1/";

    private static final long INITIAL_BACKOFF_MS = 2_000;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final long BACKOFF_POLL_MS = 100;
    private static final String PROVIDER_ANTHROPIC = "anthropic";
    private static final String PROVIDER_GROQ = "groq";

    private final CalradiaProperties properties;
    private final ReasoningPromptBuilder promptBuilder;

    private ChatModel chatModel;
    private volatile boolean initialized = false;
    private long initialBackoffMs = INITIAL_BACKOFF_MS;

    public Langchain4jReasoningAdapter(CalradiaProperties properties, ReasoningPromptBuilder promptBuilder) {
        this.properties = properties;
        this.promptBuilder = promptBuilder;
    }

    @Override
    public synchronized void initialize() {
        if (initialized) {
            return;
        }
        CalradiaProperties.Langchain4jProperties config = properties.getReasoning().getLangchain4j();
        try {
            this.chatModel = createModel(config);
            initialized = true;
            log.info("[Reasoning] Langchain4j adapter initialized: provider={}, model={}",
                    config.getProvider(), config.getModel());
        } catch (RuntimeException e) {
            log.warn("[Reasoning] Failed to initialize langchain4j adapter: {}", e.getMessage());
        }
    }

    @Override
    public String getProviderId() {
        return "langchain4j";
    }

    @Override
    public boolean isAvailable() {
        String apiKey = properties.getReasoning().getLangchain4j().getApiKey();
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public CompletableFuture<String> reason(String agentId, Perception perception, String memoryContext,
            CancellationToken cancellation) {
        return CompletableFuture.supplyAsync(() -> {
            String text = chat(List.of(
                    SystemMessage.from(promptBuilder.buildSystemPrompt(agentId)),
                    UserMessage.from(promptBuilder.buildUserPrompt(agentId, perception, memoryContext))),
                    cancellation);
            log.debug("[Reasoning] Response for {}: {}", agentId, text);
            return text;
        });
    }

    @Override
    public CompletableFuture<String> generate(String systemPrompt, String userPrompt,
            CancellationToken cancellation) {
        return CompletableFuture.supplyAsync(() -> chat(List.of(
                SystemMessage.from(systemPrompt),
                UserMessage.from(userPrompt)), cancellation));
    }

    /**
     * Sends one chat request, retrying rate-limit errors with exponential
     * backoff. The token is checked before every attempt and during every
     * backoff pause.
     */
    private String chat(List<ChatMessage> messages, CancellationToken cancellation) {
        ensureInitialized();
        if (chatModel == null) {
            throw new IllegalStateException("Langchain4j adapter not available");
        }

        int maxRetries = properties.getReasoning().getLangchain4j().getMaxRetries();
        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            cancellation.throwIfCancellationRequested();
            try {
                ChatResponse response = chatModel.chat(messages);
                String text = response.aiMessage() != null ? response.aiMessage().text() : null;
                return text != null ? text : "";
            } catch (RuntimeException e) {
                if (isRateLimitError(e) && attempt < maxRetries) {
                    long backoffMs = (long) (initialBackoffMs * Math.pow(BACKOFF_MULTIPLIER, attempt));
                    log.warn("[Reasoning] Rate limit hit (attempt {}/{}), retrying in {}ms...",
                            attempt + 1, maxRetries, backoffMs);
                    sleep(backoffMs, cancellation);
                } else {
                    log.error("[Reasoning] Call failed: {}", e.getMessage());
                    throw new IllegalStateException("Reasoning call failed: " + e.getMessage(), e);
                }
            }
        }
        throw new IllegalStateException("Reasoning call failed: max retries exhausted");
    }

    private void ensureInitialized() {
        if (!initialized) {
            initialize();
        }
    }

    private ChatModel createModel(CalradiaProperties.Langchain4jProperties config) {
        String provider = config.getProvider() != null
                ? config.getProvider().toLowerCase(Locale.ROOT)
                : PROVIDER_GROQ;
        if (PROVIDER_ANTHROPIC.equals(provider)) {
            return createAnthropicModel(config);
        }
        // Groq and OpenAI share the OpenAI-compatible API
        String baseUrl = config.getBaseUrl();
        if ((baseUrl == null || baseUrl.isBlank()) && PROVIDER_GROQ.equals(provider)) {
            baseUrl = GROQ_BASE_URL;
        }
        return createOpenAiModel(config, baseUrl);
    }

    private ChatModel createAnthropicModel(CalradiaProperties.Langchain4jProperties config) {
        var builder = AnthropicChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .timeout(config.getTimeout());

        if (config.getBaseUrl() != null && !config.getBaseUrl().isBlank()) {
            builder.baseUrl(config.getBaseUrl());
        }
        return builder.build();
    }

    private ChatModel createOpenAiModel(CalradiaProperties.Langchain4jProperties config, String baseUrl) {
        var builder = OpenAiChatModel.builder()
                .apiKey(config.getApiKey())
                .modelName(config.getModel())
                .maxRetries(0) // Retry handled by our backoff logic
                .maxTokens(config.getMaxTokens())
                .temperature(config.getTemperature())
                .timeout(config.getTimeout());

        if (baseUrl != null && !baseUrl.isBlank()) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }

    private boolean isRateLimitError(Throwable e) {
        Throwable current = e;
        while (current != null) {
            // langchain4j maps HTTP 429 to RateLimitException
            if (current instanceof dev.langchain4j.exception.RateLimitException) {
                return true;
            }
            String msg = current.getMessage();
            if (msg != null && (msg.contains("rate_limit") || msg.contains("Too Many Requests")
                    || msg.contains("429"))) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static void sleep(long backoffMs, CancellationToken cancellation) {
        long deadline = System.currentTimeMillis() + backoffMs;
        try {
            long remaining = backoffMs;
            while (remaining > 0) {
                cancellation.throwIfCancellationRequested();
                Thread.sleep(Math.min(remaining, BACKOFF_POLL_MS));
                remaining = deadline - System.currentTimeMillis();
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Reasoning call interrupted during retry backoff", ie);
        }
        cancellation.throwIfCancellationRequested();
    }
}
