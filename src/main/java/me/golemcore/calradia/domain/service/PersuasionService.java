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

import me.golemcore.calradia.domain.model.ActionResult;
import me.golemcore.calradia.domain.model.AgentAction;
import me.golemcore.calradia.domain.model.AgentPersonality;
import me.golemcore.calradia.domain.model.AgentProfile;
import me.golemcore.calradia.domain.model.CancellationToken;
import me.golemcore.calradia.domain.model.PersuasionResult;
import me.golemcore.calradia.domain.model.PersuasionVerdict;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.port.outbound.ActionExecutorPort;
import me.golemcore.calradia.port.outbound.AgentRosterPort;
import me.golemcore.calradia.port.outbound.TextGenerationPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lets the player ask an NPC to do something.
 *
 * <p>
 * The NPC weighs the request against its {@link AgentPersonality} and its
 * relation to the player, and answers ACCEPT, REFUSE or NEGOTIATE. An accepted
 * request naming an action the executor knows is carried out for that NPC and
 * remembered in its decision history, so its next reasoning cycle builds on it.
 *
 * <p>
 * The returned future always completes normally; a backend failure is a
 * refusal.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PersuasionService {

    static final String UNAVAILABLE_REPLY = "I cannot discuss this right now.";
    static final String MEMORY_SITUATION = "Conversation with the player";

    private static final int RESPONSE_FALLBACK_LENGTH = 200;

    private final TextGenerationPort textGeneration;
    private final AgentRosterPort roster;
    private final PersonalityService personalityService;
    private final DialoguePromptBuilder promptBuilder;
    private final ActionExecutorPort actionExecutor;
    private final AgentMemoryService memoryService;
    private final CalradiaProperties properties;

    public CompletableFuture<PersuasionResult> persuade(String npcId, String playerRequest, int relationWithPlayer) {
        AgentProfile profile = roster.findAgent(npcId)
                .orElseGet(() -> AgentProfile.builder().id(npcId).build());
        AgentPersonality personality = personalityService.getPersonality(profile);
        String npcName = profile.getName() != null && !profile.getName().isBlank() ? profile.getName() : npcId;

        String systemPrompt = promptBuilder.buildPersuasionSystemPrompt(npcName, personality, relationWithPlayer);
        String userPrompt = promptBuilder.buildPersuasionUserPrompt(playerRequest);

        AtomicBoolean abandoned = new AtomicBoolean();
        CancellationToken token = abandoned::get;
        CompletableFuture<String> call;
        try {
            call = textGeneration.generate(systemPrompt, userPrompt, token);
        } catch (RuntimeException e) {
            call = CompletableFuture.failedFuture(e);
        }
        if (call == null) {
            call = CompletableFuture.failedFuture(new IllegalStateException("No reply generated"));
        }
        Duration timeout = properties.getDialogue().getPersuasionTimeout();
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            call = call.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        return call
                .thenCompose(raw -> followThrough(npcId, playerRequest, parseReply(raw), token))
                .handle((result, error) -> {
                    if (error == null) {
                        return result;
                    }
                    abandoned.set(true);
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    log.warn("[Persuasion] Request to {} failed: {}", npcId, cause.toString());
                    return PersuasionResult.builder()
                            .verdict(PersuasionVerdict.REFUSE)
                            .response(UNAVAILABLE_REPLY)
                            .reasoning("Backend error: " + cause.getMessage())
                            .build();
                });
    }

    /**
     * Reads the DECISION, RESPONSE, ACTION and REASONING lines of a reply. A
     * reply without a RESPONSE line is shown as-is, cut to 200 characters.
     */
    static PersuasionResult parseReply(String raw) {
        String text = raw == null ? "" : raw;
        PersuasionVerdict verdict = PersuasionVerdict.REFUSE;
        String response = null;
        String actionType = null;
        String reasoning = null;

        for (String line : text.split("\n")) {
            String trimmed = line.strip();
            String upper = trimmed.toUpperCase(Locale.ROOT);
            if (upper.startsWith("DECISION:")) {
                String value = valueOf(trimmed).toUpperCase(Locale.ROOT);
                if (value.contains("ACCEPT")) {
                    verdict = PersuasionVerdict.ACCEPT;
                } else if (value.contains("NEGOTIATE")) {
                    verdict = PersuasionVerdict.NEGOTIATE;
                } else {
                    verdict = PersuasionVerdict.REFUSE;
                }
            } else if (upper.startsWith("RESPONSE:")) {
                response = valueOf(trimmed);
            } else if (upper.startsWith("ACTION:")) {
                String action = DecisionParser.normalizeActionType(valueOf(trimmed));
                if (!action.isEmpty() && !"none".equalsIgnoreCase(action)) {
                    actionType = action;
                }
            } else if (upper.startsWith("REASONING:")) {
                reasoning = valueOf(trimmed);
            }
        }

        if (response == null || response.isEmpty()) {
            String stripped = text.strip();
            response = stripped.length() > RESPONSE_FALLBACK_LENGTH
                    ? stripped.substring(0, RESPONSE_FALLBACK_LENGTH)
                    : stripped;
        }
        return PersuasionResult.builder()
                .verdict(verdict)
                .response(response)
                .actionType(actionType)
                .reasoning(reasoning)
                .build();
    }

    private CompletableFuture<PersuasionResult> followThrough(String npcId, String playerRequest,
            PersuasionResult result, CancellationToken token) {
        log.info("[Persuasion] {} answered {}: {}", npcId, result.getVerdict(), result.getResponse());
        String actionType = result.getActionType();
        if (!result.isAccepted() || actionType == null || !properties.getDialogue().isExecuteAcceptedActions()) {
            return CompletableFuture.completedFuture(result);
        }
        if (!actionExecutor.canExecute(actionType)) {
            log.debug("[Persuasion] {} agreed to unknown action {}", npcId, actionType);
            return CompletableFuture.completedFuture(withActionResult(result, ActionResult.unknownAction(actionType)));
        }

        AgentAction action = AgentAction.of(actionType,
                Map.of(AgentAction.PARAM_AGENT_ID, npcId,
                        AgentAction.PARAM_DETAIL, playerRequest != null ? playerRequest : ""));
        CompletableFuture<ActionResult> execution;
        try {
            execution = actionExecutor.execute(action, token);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        if (execution == null) {
            execution = CompletableFuture.completedFuture(ActionResult.failed(actionType + " returned no result"));
        }
        return execution.handle((actionResult, error) -> {
            ActionResult outcome;
            if (error != null) {
                outcome = ActionResult.failed(actionType + " failed: " + error.getMessage(), error);
            } else if (actionResult == null) {
                outcome = ActionResult.failed(actionType + " returned no result");
            } else {
                outcome = actionResult;
            }
            memoryService.remember(npcId, MEMORY_SITUATION,
                    result.getReasoning() != null ? result.getReasoning() : result.getResponse(), actionType);
            return withActionResult(result, outcome);
        });
    }

    private static PersuasionResult withActionResult(PersuasionResult result, ActionResult actionResult) {
        return PersuasionResult.builder()
                .verdict(result.getVerdict())
                .response(result.getResponse())
                .actionType(result.getActionType())
                .reasoning(result.getReasoning())
                .actionResult(actionResult)
                .build();
    }

    private static String valueOf(String line) {
        return line.substring(line.indexOf(':') + 1).strip();
    }
}
