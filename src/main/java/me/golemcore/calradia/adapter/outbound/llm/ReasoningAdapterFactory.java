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
import me.golemcore.calradia.port.outbound.ReasoningPort;
import me.golemcore.calradia.port.outbound.TextGenerationPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Selects the active reasoning backend from {@code calradia.reasoning.provider}.
 *
 * <p>
 * Selection happens once in {@link #init()}:
 * <ul>
 * <li>langchain4j - OpenAI, Groq or Anthropic via the langchain4j library
 * <li>none - always answers with a Wait decision
 * </ul>
 * An unknown or unavailable provider (e.g. no API key) falls back to
 * {@code none}. Calls are then delegated to the selected adapter without any
 * further provider dispatch.
 *
 * @see ReasoningProviderAdapter
 * @see Langchain4jReasoningAdapter
 * @see NoOpReasoningAdapter
 */
@Component
@Primary
@RequiredArgsConstructor
@Slf4j
public class ReasoningAdapterFactory implements ReasoningPort, TextGenerationPort {

    private static final String PROVIDER_NONE = "none";

    private final CalradiaProperties properties;
    private final List<ReasoningProviderAdapter> adapters;

    private final Map<String, ReasoningProviderAdapter> adaptersByProvider = new ConcurrentHashMap<>();
    private ReasoningProviderAdapter activeAdapter;

    @PostConstruct
    public void init() {
        for (ReasoningProviderAdapter adapter : adapters) {
            adaptersByProvider.put(adapter.getProviderId(), adapter);
            log.debug("[Reasoning] Registered adapter: {}", adapter.getProviderId());
        }

        String provider = properties.getReasoning().getProvider();
        ReasoningProviderAdapter selected = adaptersByProvider.get(provider);

        if (selected == null) {
            log.warn("[Reasoning] Provider '{}' not found, falling back to '{}'", provider, PROVIDER_NONE);
            selected = fallback();
        } else if (!selected.isAvailable()) {
            log.warn("[Reasoning] Provider '{}' is not available (check API key), falling back to '{}'",
                    provider, PROVIDER_NONE);
            selected = fallback();
        }

        activeAdapter = selected;
        if (activeAdapter != null) {
            activeAdapter.initialize();
            log.info("[Reasoning] Active provider: {}", activeAdapter.getProviderId());
        }
    }

    public ReasoningPort getActiveAdapter() {
        return activeAdapter;
    }

    public ReasoningPort getAdapter(String providerId) {
        return adaptersByProvider.get(providerId);
    }

    private ReasoningProviderAdapter fallback() {
        ReasoningProviderAdapter none = adaptersByProvider.get(PROVIDER_NONE);
        if (none == null && !adapters.isEmpty()) {
            return adapters.get(0);
        }
        return none;
    }

    // ==================== Port delegation ====================

    @Override
    public String getProviderId() {
        return activeAdapter != null ? activeAdapter.getProviderId() : PROVIDER_NONE;
    }

    @Override
    public CompletableFuture<String> reason(String agentId, Perception perception, String memoryContext,
            CancellationToken cancellation) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No reasoning adapter configured"));
        }
        return activeAdapter.reason(agentId, perception, memoryContext, cancellation);
    }

    @Override
    public CompletableFuture<String> generate(String systemPrompt, String userPrompt,
            CancellationToken cancellation) {
        if (activeAdapter == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("No reasoning adapter configured"));
        }
        return activeAdapter.generate(systemPrompt, userPrompt, cancellation);
    }

    @Override
    public boolean isAvailable() {
        return activeAdapter != null && activeAdapter.isAvailable();
    }
}
