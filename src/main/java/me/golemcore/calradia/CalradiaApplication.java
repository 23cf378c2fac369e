package me.golemcore.calradia;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for Calradia Agents.
 *
 * <p>
 * Drives autonomous agents in a persistent world through a perceive, reason,
 * act loop backed by a remote reasoning service, keeping the call volume to
 * that service bounded and fair.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Agent Workflow</b> - sense the world, ask the reasoning backend, apply
 * the parsed actions</li>
 * <li><b>Decision Memory</b> - bounded per-agent history fed back into every
 * reasoning call</li>
 * <li><b>Event Reactions</b> - cooldown-gated FIFO queue drained one agent at a
 * time</li>
 * <li><b>World AI</b> - tick-based proactive selection that prioritizes
 * important agents</li>
 * <li><b>Dialogue</b> - in-character replies and persuasion shaped by a stable
 * per-noble personality</li>
 * <li><b>Multi-Provider</b> - Groq, OpenAI and Anthropic via langchain4j</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Triggers           → EventReactionQueue, ProactiveScheduler
 * Player Interaction → DialogueService, PersuasionService
 * Domain Layer       → AgentWorkflowService, AgentMemoryService, DecisionParser
 * Infrastructure     → Reasoning/Sensor/Executor Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code calradia.*} prefix.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CalradiaApplication {

    public static void main(String[] args) {
        SpringApplication.run(CalradiaApplication.class, args);
    }

}
