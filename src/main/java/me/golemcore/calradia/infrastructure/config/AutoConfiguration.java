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

import me.golemcore.calradia.auto.ImportantAgentPolicy;
import me.golemcore.calradia.domain.model.AgentProfile;
import me.golemcore.calradia.port.outbound.ReasoningPort;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Spring configuration wiring the orchestration engine.
 *
 * <p>
 * Provides the shared clock, the random source used for agent selection, and
 * the two single-thread executors that run the event drain loop and the
 * proactive dispatch passes. Each driver owns its executor so that neither can
 * starve the other.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final CalradiaProperties properties;
    private final ReasoningPort reasoningPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static Random agentSelectionRandom() {
        return new Random();
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService eventReactionExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "event-reaction-drain");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean(destroyMethod = "shutdownNow")
    public static ExecutorService worldAiExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "world-ai-dispatch");
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public static ImportantAgentPolicy importantAgentPolicy() {
        return AgentProfile::isFactionLeader;
    }

    @PostConstruct
    public void init() {
        log.info("Calradia agents starting...");
        log.info("Reasoning provider: {} (available: {})", reasoningPort.getProviderId(),
                reasoningPort.isAvailable());
        log.info("Memory capacity per agent: {}", properties.getMemory().getCapacity());
        log.info("Event reactions: enabled={}, cooldown={}", properties.getEvents().isEnabled(),
                properties.getEvents().getCooldown());
        log.info("World AI: enabled={}, tick={}, agents/tick={}", properties.getScheduler().isEnabled(),
                properties.getScheduler().getTickInterval(), properties.getScheduler().getAgentsPerTick());
    }
}
