package me.golemcore.calradia.auto;

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

import me.golemcore.calradia.domain.model.AgentProfile;
import me.golemcore.calradia.domain.model.DispatchSource;
import me.golemcore.calradia.domain.model.WorkflowResult;
import me.golemcore.calradia.domain.service.AgentDispatchGuard;
import me.golemcore.calradia.domain.service.AgentWorkflowService;
import me.golemcore.calradia.domain.service.CooldownTracker;
import me.golemcore.calradia.domain.service.DispatchOutcomeRecorder;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.port.outbound.AgentRosterPort;
import me.golemcore.calradia.port.outbound.WorldStatePort;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tick-driven proactive world AI that lets a few agents think on their own.
 *
 * <p>
 * The host calls {@link #tick(Duration)} once per clock tick. Elapsed time is
 * accumulated; once {@code calradia.scheduler.tick-interval} is reached the
 * accumulator resets and one selection-and-dispatch pass is submitted to the
 * world AI executor:
 * <ul>
 * <li>Eligible agents: alive, not player-controlled, with a faction, not
 * cooling down and not already thinking</li>
 * <li>Important agents are drawn first, then the regular pool fills the rest of
 * the quota, both uniformly at random without replacement</li>
 * <li>Selected agents are dispatched one at a time with a fixed delay in
 * between</li>
 * </ul>
 *
 * <p>
 * Passes are non-reentrant: a tick that falls due while a pass is still running
 * is skipped.
 *
 * @since 1.0
 * @see AgentWorkflowService
 * @see ImportantAgentPolicy
 */
@Component
@Slf4j
public class ProactiveScheduler {

    private static final Duration MIN_SCHEDULER_COOLDOWN = Duration.ofMinutes(5);
    private static final int HOST_CLOCK_INTERVAL_SECONDS = 1;

    private final AgentWorkflowService workflowService;
    private final AgentRosterPort agentRoster;
    private final CooldownTracker cooldownTracker;
    private final AgentDispatchGuard dispatchGuard;
    private final WorldStatePort worldState;
    private final DispatchOutcomeRecorder outcomeRecorder;
    private final ImportantAgentPolicy importantAgentPolicy;
    private final CalradiaProperties properties;
    private final Random random;
    private final Executor dispatchExecutor;

    private final Object accumulatorLock = new Object();
    private final AtomicBoolean dispatching = new AtomicBoolean(false);
    private Duration accumulated = Duration.ZERO;

    private ScheduledExecutorService hostClock;
    private ScheduledFuture<?> hostClockTask;

    public ProactiveScheduler(AgentWorkflowService workflowService, AgentRosterPort agentRoster,
            CooldownTracker cooldownTracker, AgentDispatchGuard dispatchGuard, WorldStatePort worldState,
            DispatchOutcomeRecorder outcomeRecorder, ImportantAgentPolicy importantAgentPolicy,
            CalradiaProperties properties, Random random,
            @Qualifier("worldAiExecutor") Executor dispatchExecutor) {
        this.workflowService = workflowService;
        this.agentRoster = agentRoster;
        this.cooldownTracker = cooldownTracker;
        this.dispatchGuard = dispatchGuard;
        this.worldState = worldState;
        this.outcomeRecorder = outcomeRecorder;
        this.importantAgentPolicy = importantAgentPolicy;
        this.properties = properties;
        this.random = random;
        this.dispatchExecutor = dispatchExecutor;
    }

    @PostConstruct
    public void init() {
        CalradiaProperties.SchedulerProperties config = properties.getScheduler();
        if (!config.isEnabled()) {
            log.info("[WorldAI] Proactive scheduler disabled");
            return;
        }
        log.info("[WorldAI] Proactive scheduler ready: interval={}, agents/tick={}, cooldown={}",
                config.getTickInterval(), config.getAgentsPerTick(), getSchedulerCooldown());
        if (!config.isHostClockEnabled()) {
            return;
        }

        hostClock = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "world-ai-clock");
            t.setDaemon(true);
            return t;
        });
        hostClockTask = hostClock.scheduleAtFixedRate(
                () -> tick(Duration.ofSeconds(HOST_CLOCK_INTERVAL_SECONDS)),
                HOST_CLOCK_INTERVAL_SECONDS,
                HOST_CLOCK_INTERVAL_SECONDS,
                TimeUnit.SECONDS);
        log.info("[WorldAI] Internal clock started ({}s)", HOST_CLOCK_INTERVAL_SECONDS);
    }

    @PreDestroy
    public void shutdown() {
        if (hostClockTask != null) {
            hostClockTask.cancel(false);
        }
        if (hostClock != null) {
            hostClock.shutdown();
            try {
                if (!hostClock.awaitTermination(5, TimeUnit.SECONDS)) {
                    hostClock.shutdownNow();
                }
            } catch (InterruptedException e) {
                hostClock.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[WorldAI] Proactive scheduler stopped");
    }

    public boolean tick(double elapsedSeconds) {
        return tick(Duration.ofMillis(Math.round(elapsedSeconds * 1000)));
    }

    /**
     * Advances the scheduler clock. Never blocks on a workflow cycle.
     *
     * @return true if a dispatch pass was submitted by this tick
     */
    public boolean tick(Duration elapsed) {
        CalradiaProperties.SchedulerProperties config = properties.getScheduler();
        if (!config.isEnabled() || elapsed == null || elapsed.isNegative()) {
            return false;
        }

        synchronized (accumulatorLock) {
            accumulated = accumulated.plus(elapsed);
            if (accumulated.compareTo(config.getTickInterval()) < 0) {
                return false;
            }
            accumulated = Duration.ZERO;
        }

        if (!dispatching.compareAndSet(false, true)) {
            log.debug("[WorldAI] Tick skipped: previous pass still in progress");
            return false;
        }
        try {
            dispatchExecutor.execute(this::runPass);
            return true;
        } catch (RejectedExecutionException e) {
            dispatching.set(false);
            log.error("[WorldAI] Pass rejected by executor", e);
            return false;
        }
    }

    public boolean isDispatching() {
        return dispatching.get();
    }

    /**
     * Picks up to {@code quota} eligible agents, important ones first.
     */
    public List<AgentProfile> selectAgents(int quota) {
        if (quota <= 0) {
            return List.of();
        }
        Duration cooldown = getSchedulerCooldown();
        boolean prioritize = properties.getScheduler().isPrioritizeImportant();

        List<AgentProfile> important = new ArrayList<>();
        List<AgentProfile> regular = new ArrayList<>();
        for (AgentProfile agent : agentRoster.listAgents()) {
            if (!isEligible(agent) || cooldownTracker.isCoolingDown(agent.getId(), cooldown)
                    || dispatchGuard.isInFlight(agent.getId())) {
                continue;
            }
            if (prioritize && importantAgentPolicy.isImportant(agent)) {
                important.add(agent);
            } else {
                regular.add(agent);
            }
        }

        List<AgentProfile> selected = new ArrayList<>(Math.min(quota, important.size() + regular.size()));
        drawWithoutReplacement(important, quota, selected);
        drawWithoutReplacement(regular, quota, selected);
        return selected;
    }

    public Duration getSchedulerCooldown() {
        Duration configured = properties.getScheduler().getCooldown();
        if (configured != null) {
            return configured;
        }
        Duration doubledEventCooldown = properties.getEvents().getCooldown().multipliedBy(2);
        return doubledEventCooldown.compareTo(MIN_SCHEDULER_COOLDOWN) > 0
                ? doubledEventCooldown
                : MIN_SCHEDULER_COOLDOWN;
    }

    // ==================== PASS ====================

    private void runPass() {
        try {
            if (!worldState.isAcceptingResults()) {
                log.debug("[WorldAI] World busy, skipping pass");
                return;
            }
            List<AgentProfile> selected = selectAgents(properties.getScheduler().getAgentsPerTick());
            if (selected.isEmpty()) {
                log.debug("[WorldAI] No eligible agents this tick");
                return;
            }
            log.info("[WorldAI] {} agent(s) thinking this tick", selected.size());

            for (int i = 0; i < selected.size(); i++) {
                if (!worldState.isAcceptingResults()) {
                    log.debug("[WorldAI] World became busy, stopping pass");
                    return;
                }
                dispatch(selected.get(i));
                if (i < selected.size() - 1 && !pause()) {
                    return;
                }
            }
        } catch (RuntimeException e) { // NOSONAR - must not kill executor thread
            log.error("[WorldAI] Pass failed", e);
        } finally {
            dispatching.set(false);
        }
    }

    private void dispatch(AgentProfile agent) {
        String agentId = agent.getId();
        if (!dispatchGuard.tryAcquire(agentId)) {
            return;
        }
        try {
            cooldownTracker.stamp(agentId);
            log.debug("[WorldAI] {} is thinking...", agent.getDisplayName());
            WorkflowResult result = workflowService.execute(agentId).join();
            outcomeRecorder.record(DispatchSource.PROACTIVE, agentId, result);
        } catch (RuntimeException e) { // NOSONAR - one agent must not stop the pass
            log.error("[WorldAI] Cycle failed for {}", agentId, e);
        } finally {
            dispatchGuard.release(agentId);
        }
    }

    private boolean pause() {
        Duration delay = properties.getScheduler().getDispatchDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean isEligible(AgentProfile agent) {
        return agent != null
                && agent.getId() != null
                && agent.isAlive()
                && !agent.isPlayerControlled()
                && agent.getFaction() != null
                && !agent.getFaction().isBlank();
    }

    private void drawWithoutReplacement(List<AgentProfile> pool, int quota, List<AgentProfile> selected) {
        while (selected.size() < quota && !pool.isEmpty()) {
            selected.add(pool.remove(random.nextInt(pool.size())));
        }
    }
}
