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
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Reasoning adapter used when no backend is configured. Every agent waits and
 * every NPC gives the same non-committal reply.
 *
 * <p>
 * Provider ID: {@code "none"}
 *
 * @see ReasoningProviderAdapter
 */
@Component
@Slf4j
public class NoOpReasoningAdapter implements ReasoningProviderAdapter {

    static final String RESPONSE = "THOUGHT: No reasoning backend is configured, so I hold my position.\n"
            + "ACTION: Wait";
    static final String DIALOGUE_REPLY = "*looks at you thoughtfully* I have nothing to say right now.";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<String> reason(String agentId, Perception perception, String memoryContext,
            CancellationToken cancellation) {
        log.debug("[Reasoning] No backend configured, {} waits", agentId);
        return CompletableFuture.completedFuture(RESPONSE);
    }

    @Override
    public CompletableFuture<String> generate(String systemPrompt, String userPrompt,
            CancellationToken cancellation) {
        return CompletableFuture.completedFuture(DIALOGUE_REPLY);
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
