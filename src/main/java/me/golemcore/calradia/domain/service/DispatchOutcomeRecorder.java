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
import me.golemcore.calradia.domain.model.AgentDecision;
import me.golemcore.calradia.domain.model.DispatchSource;
import me.golemcore.calradia.domain.model.WorkflowResult;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Logs and journals the outcome of a dispatched workflow cycle. Thought and
 * action log lines are gated by {@code calradia.logging.*}; failures are
 * always logged.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DispatchOutcomeRecorder {

    private static final int LOG_THOUGHT_LENGTH = 80;

    private final DecisionParser decisionParser;
    private final ThoughtJournalService thoughtJournal;
    private final CalradiaProperties properties;

    public void record(DispatchSource source, String agentId, WorkflowResult result) {
        String tag = source.getLogTag();
        if (result == null || !result.isSuccessful()) {
            Throwable error = result != null ? result.getError() : null;
            log.warn("[{}] Cycle failed for {} ({}): {}", tag, agentId,
                    result != null ? result.getFailureKind() : null,
                    error != null ? error.getMessage() : "no result");
            return;
        }

        AgentDecision decision = result.getDecision();
        String actionType = decision.getPrimaryAction().getType();

        if (properties.getLogging().isThoughts()) {
            log.info("[{}] {} thinks: {}", tag, agentId,
                    decisionParser.extractThought(decision.getReasoning(), LOG_THOUGHT_LENGTH));
        }
        if (properties.getLogging().isActions()) {
            logActions(tag, agentId, result.getActionResults(), actionType);
        }

        thoughtJournal.record(agentId,
                decisionParser.extractThought(decision.getReasoning(), ThoughtJournalService.MAX_THOUGHT_LENGTH),
                actionType);
    }

    private void logActions(String tag, String agentId, List<ActionResult> actionResults, String actionType) {
        long failed = actionResults.stream().filter(r -> !r.isSuccess()).count();
        if (failed == 0) {
            log.info("[{}] {} -> {}", tag, agentId, actionType);
            return;
        }
        for (ActionResult actionResult : actionResults) {
            if (!actionResult.isSuccess()) {
                log.info("[{}] {} -> {} failed: {}", tag, agentId, actionType, actionResult.getMessage());
            }
        }
    }
}
