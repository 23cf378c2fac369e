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

import me.golemcore.calradia.port.outbound.ReasoningPort;
import me.golemcore.calradia.port.outbound.TextGenerationPort;

/**
 * A reasoning backend variant managed by {@link ReasoningAdapterFactory}. The
 * same backend serves agent decisions and free-form dialogue text.
 *
 * @see ReasoningAdapterFactory
 */
public interface ReasoningProviderAdapter extends ReasoningPort, TextGenerationPort {

    /**
     * Initialize the adapter. Called once, when the adapter is selected.
     */
    default void initialize() {
        // Default no-op
    }
}
