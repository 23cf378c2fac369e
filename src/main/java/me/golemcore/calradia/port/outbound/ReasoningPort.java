package me.golemcore.calradia.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for the text-generation backend that decides what an agent does next.
 * Provider-agnostic: the core only relies on the raw decision text returned
 * here.
 */
public interface ReasoningPort {

    /**
     * Returns the provider identifier (e.g., "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Asks the backend for a decision. The returned future may fail or time out.
     * Once {@code cancellation} is raised no further backend request is made.
     */
    CompletableFuture<String> reason(String agentId, Perception perception, String memoryContext,
            CancellationToken cancellation);

    /**
     * Checks if the backend is configured and operational.
     */
    boolean isAvailable();
}
