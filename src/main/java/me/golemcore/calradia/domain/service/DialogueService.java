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

import me.golemcore.calradia.domain.model.CancellationToken;
import me.golemcore.calradia.domain.model.DialogueContext;
import me.golemcore.calradia.domain.model.DialogueIntent;
import me.golemcore.calradia.domain.model.DialogueResponse;
import me.golemcore.calradia.domain.model.ThoughtRecord;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.port.outbound.TextGenerationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

/**
 * Free-form conversations between the player and an NPC.
 *
 * <p>
 * The NPC answers in character: its role, its relation to the player, the
 * previous exchanges with the player and its own most recent thoughts all go
 * into the prompt. Emotion markers such as {@code *angry*} set the emotion and
 * intent of the reply and are stripped from the text. Every exchange is
 * remembered per NPC.
 *
 * <p>
 * The returned future always completes normally: a failed, timed out or
 * cancelled generation yields a short in-character fallback reply.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DialogueService {

    static final String FAILURE_REPLY = "Hmm... I was going to say something but I forgot.";
    static final String SILENT_REPLY = "...";
    static final int RECENT_THOUGHTS_IN_PROMPT = 3;

    private static final Pattern EMOTION_MARKER = Pattern.compile("\\*[^*]+\\*");
    private static final List<String> FAREWELLS = List.of("farewell", "goodbye", "leave me");

    private final TextGenerationPort textGeneration;
    private final ConversationMemoryService conversations;
    private final ThoughtJournalService thoughtJournal;
    private final DialoguePromptBuilder promptBuilder;
    private final CalradiaProperties properties;

    /**
     * Opening line of an NPC before the player says anything.
     */
    public static String greeting(int relationWithPlayer) {
        if (relationWithPlayer >= 50) {
            return "Ah, my friend! It's so good to see you. Please, let's talk.";
        }
        if (relationWithPlayer >= 0) {
            return "Yes? You wanted to speak with me. I'm listening.";
        }
        if (relationWithPlayer >= -50) {
            return "What do you want? I don't have much time.";
        }
        return "You dare approach me? Fine, speak your piece.";
    }

    public CompletableFuture<DialogueResponse> respond(String npcId, String npcName, String npcRole,
            String playerMessage, DialogueContext context) {
        List<ThoughtRecord> thoughts = thoughtJournal.getRecentFor(npcId, RECENT_THOUGHTS_IN_PROMPT);
        String systemPrompt = promptBuilder.buildDialogueSystemPrompt(npcName, npcRole, context);
        String userPrompt = promptBuilder.buildDialogueUserPrompt(playerMessage, context,
                conversations.getHistory(npcId), thoughts);

        AtomicBoolean abandoned = new AtomicBoolean();
        CancellationToken token = abandoned::get;
        CompletableFuture<String> call = startGeneration(systemPrompt, userPrompt, token);
        Duration timeout = properties.getDialogue().getResponseTimeout();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            call = call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return call.handle((raw, error) -> {
            if (error != null) {
                abandoned.set(true);
                return fallback(npcName, error);
            }
            DialogueResponse response = parseReply(raw);
            conversations.remember(npcId, playerMessage, response.getText());
            log.info("[Dialogue] {}: {}", npcName, response.getText());
            return response;
        });
    }

    /**
     * Reads emotion, intent and farewell cues from a raw reply and strips the
     * emotion markers.
     */
    static DialogueResponse parseReply(String raw) {
        String text = raw == null ? "" : raw.strip();
        String lower = text.toLowerCase(Locale.ROOT);

        String emotion = DialogueResponse.EMOTION_NEUTRAL;
        DialogueIntent intent = DialogueIntent.NEUTRAL;
        if (lower.contains("*angry*")) {
            emotion = "Angry";
            intent = DialogueIntent.HOSTILE;
        } else if (lower.contains("*smiling*")) {
            emotion = "Happy";
            intent = DialogueIntent.FRIENDLY;
        } else if (lower.contains("*sad*")) {
            emotion = "Sad";
        } else if (lower.contains("*threatening*") || lower.contains("*cold*")) {
            emotion = "Threatening";
            intent = DialogueIntent.THREATENING;
        }

        boolean ends = FAREWELLS.stream().anyMatch(lower::contains);
        String clean = EMOTION_MARKER.matcher(text).replaceAll("").replaceAll("\\s{2,}", " ").strip();

        return DialogueResponse.builder()
                .text(clean.isEmpty() ? SILENT_REPLY : clean)
                .emotion(emotion)
                .intent(intent)
                .endsConversation(ends)
                .build();
    }

    private CompletableFuture<String> startGeneration(String systemPrompt, String userPrompt,
            CancellationToken token) {
        try {
            CompletableFuture<String> future = textGeneration.generate(systemPrompt, userPrompt, token);
            return future != null
                    ? future
                    : CompletableFuture.failedFuture(new IllegalStateException("No reply generated"));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static DialogueResponse fallback(String npcName, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        if (cause instanceof TimeoutException || cause instanceof CancellationException) {
            log.warn("[Dialogue] No reply from {} in time", npcName);
            return DialogueResponse.error(SILENT_REPLY);
        }
        log.warn("[Dialogue] Reply generation failed for {}: {}", npcName, cause.getMessage());
        return DialogueResponse.error(FAILURE_REPLY);
    }
}
