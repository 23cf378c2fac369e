package me.golemcore.calradia.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code calradia.*} prefix:
 * <ul>
 * <li>{@link ReasoningProperties} - reasoning backend selection and model
 * settings</li>
 * <li>{@link MemoryProperties} - per-agent decision history</li>
 * <li>{@link WorkflowProperties} - perceive/reason/act step budgets</li>
 * <li>{@link EventProperties} - event reaction queue</li>
 * <li>{@link SchedulerProperties} - proactive world AI</li>
 * <li>{@link DialogueProperties} - NPC conversations and persuasion</li>
 * <li>{@link LoggingProperties} - thought and action log toggles</li>
 * <li>{@link RosterProperties} - simulated roster</li>
 * </ul>
 *
 * <p>
 * The same instance is injected into every component that needs it, so toggles
 * changed at runtime are seen consistently by the queue, the scheduler and the
 * workflow.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "calradia")
@Data
public class CalradiaProperties {

    private ReasoningProperties reasoning = new ReasoningProperties();
    private MemoryProperties memory = new MemoryProperties();
    private WorkflowProperties workflow = new WorkflowProperties();
    private EventProperties events = new EventProperties();
    private SchedulerProperties scheduler = new SchedulerProperties();
    private DialogueProperties dialogue = new DialogueProperties();
    private LoggingProperties logging = new LoggingProperties();
    private RosterProperties roster = new RosterProperties();

    // ==================== REASONING ====================

    @Data
    public static class ReasoningProperties {
        /** Adapter id: "langchain4j" or "none". */
        private String provider = "langchain4j";
        private Langchain4jProperties langchain4j = new Langchain4jProperties();
    }

    @Data
    public static class Langchain4jProperties {
        /** Backend behind langchain4j: "groq", "openai" or "anthropic". */
        private String provider = "groq";
        private String apiKey = "";
        private String baseUrl;
        private String model = "llama-3.1-8b-instant";
        private double temperature = 0.7;
        private int maxTokens = 600;
        private Duration timeout = Duration.ofSeconds(60);

        /** Retries on rate-limit errors only. */
        private int maxRetries = 2;
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        /** Max remembered decisions per agent. */
        private int capacity = 5;
    }

    // ==================== WORKFLOW ====================

    @Data
    public static class WorkflowProperties {
        /** Budget for each awaited step: sense, reason, and every single action. */
        private Duration stepTimeout = Duration.ofSeconds(60);
    }

    // ==================== EVENT REACTIONS ====================

    @Data
    public static class EventProperties {
        private boolean enabled = true;
        private Duration cooldown = Duration.ofMinutes(15);

        /** Pause between two drained reactions. */
        private Duration drainDelay = Duration.ofSeconds(1);
        private boolean skipMinorBattles = true;
        private int minimumBattleSize = 100;
    }

    // ==================== PROACTIVE SCHEDULER ====================

    @Data
    public static class SchedulerProperties {
        private boolean enabled = true;
        private Duration tickInterval = Duration.ofSeconds(60);
        private int agentsPerTick = 2;

        /**
         * Minimum interval between two proactive thoughts of the same agent. When
         * unset, derived as max(5 minutes, 2 x event cooldown).
         */
        private Duration cooldown;

        /** Pause between two agents of the same pass. */
        private Duration dispatchDelay = Duration.ofSeconds(2);
        private boolean prioritizeImportant = true;

        /** Drive ticks from an internal 1s clock instead of the host application. */
        private boolean hostClockEnabled = false;
    }

    // ==================== DIALOGUE ====================

    @Data
    public static class DialogueProperties {
        /** Remembered exchanges per NPC. */
        private int conversationCapacity = 10;
        private Duration responseTimeout = Duration.ofSeconds(10);
        private Duration persuasionTimeout = Duration.ofSeconds(60);

        /** Carry out the action an NPC agreed to. */
        private boolean executeAcceptedActions = true;
    }

    // ==================== LOGGING ====================

    @Data
    public static class LoggingProperties {
        private boolean thoughts = true;
        private boolean actions = true;
    }

    // ==================== ROSTER ====================

    @Data
    public static class RosterProperties {
        private List<AgentEntry> agents = new ArrayList<>();
    }

    @Data
    public static class AgentEntry {
        private String id;
        private String name;
        private String faction;
        private boolean leader = false;
        private boolean alive = true;
        private boolean player = false;
    }
}
