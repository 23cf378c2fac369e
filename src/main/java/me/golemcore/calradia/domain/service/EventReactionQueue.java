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

import me.golemcore.calradia.domain.model.DispatchSource;
import me.golemcore.calradia.domain.model.EventWorkItem;
import me.golemcore.calradia.domain.model.GameEvent;
import me.golemcore.calradia.domain.model.GameEventType;
import me.golemcore.calradia.domain.model.WorkflowResult;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.port.outbound.WorldStatePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cooldown-gated FIFO of event reactions, drained one agent at a time.
 *
 * <p>
 * {@link #enqueue(String, GameEventType, String)} stamps the agent's cooldown
 * at acceptance time, so a burst of events for one agent yields a single
 * reaction. Rejected events are dropped silently; that is backpressure, not an
 * error.
 *
 * <p>
 * A single drain loop (guarded by a running flag) runs on the injected
 * executor: it pops one item, runs the workflow for it, records the outcome,
 * pauses {@code calradia.events.drain-delay} and continues until the queue is
 * empty. A failing item never stops the loop.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class EventReactionQueue {

    private final AgentWorkflowService workflowService;
    private final CooldownTracker cooldownTracker;
    private final AgentDispatchGuard dispatchGuard;
    private final WorldStatePort worldState;
    private final DispatchOutcomeRecorder outcomeRecorder;
    private final CalradiaProperties properties;
    private final Clock clock;
    private final Executor drainExecutor;

    private final Queue<EventWorkItem> queue = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);
    private final AtomicLong acceptedCount = new AtomicLong();
    private final AtomicLong droppedCount = new AtomicLong();

    public EventReactionQueue(AgentWorkflowService workflowService, CooldownTracker cooldownTracker,
            AgentDispatchGuard dispatchGuard, WorldStatePort worldState, DispatchOutcomeRecorder outcomeRecorder,
            CalradiaProperties properties, Clock clock,
            @Qualifier("eventReactionExecutor") Executor drainExecutor) {
        this.workflowService = workflowService;
        this.cooldownTracker = cooldownTracker;
        this.dispatchGuard = dispatchGuard;
        this.worldState = worldState;
        this.outcomeRecorder = outcomeRecorder;
        this.properties = properties;
        this.clock = clock;
        this.drainExecutor = drainExecutor;
    }

    /**
     * Fans a published {@link GameEvent} out to one reaction per affected agent.
     */
    @EventListener
    public void onGameEvent(GameEvent event) {
        if (event == null || event.type() == null) {
            return;
        }
        CalradiaProperties.EventProperties config = properties.getEvents();
        if (config.isSkipMinorBattles() && event.type().isBattle()
                && event.battleSize() < config.getMinimumBattleSize()) {
            log.debug("[EventQueue] Skipping minor battle ({} troops < {}): {}", event.battleSize(),
                    config.getMinimumBattleSize(), event.description());
            return;
        }
        for (String agentId : event.agentIds()) {
            enqueue(agentId, event.type(), event.description());
        }
    }

    /**
     * Submits an event reaction for one agent.
     *
     * @return true if accepted; false if dropped (disabled or cooling down)
     */
    public boolean enqueue(String agentId, GameEventType eventType, String description) {
        if (!properties.getEvents().isEnabled()) {
            log.debug("[EventQueue] Event reactions disabled, dropping {} for {}", eventType, agentId);
            droppedCount.incrementAndGet();
            return false;
        }
        if (agentId == null || agentId.isBlank()) {
            droppedCount.incrementAndGet();
            return false;
        }

        Duration cooldown = properties.getEvents().getCooldown();
        if (!cooldownTracker.tryAccept(agentId, cooldown)) {
            log.debug("[EventQueue] {} is cooling down, dropping {}", agentId, eventType);
            droppedCount.incrementAndGet();
            return false;
        }

        queue.add(new EventWorkItem(agentId, eventType, description, clock.instant()));
        acceptedCount.incrementAndGet();
        log.debug("[EventQueue] Queued {} for {} ({} pending)", eventType, agentId, queue.size());
        wakeDrainLoop();
        return true;
    }

    public int getPendingCount() {
        return queue.size();
    }

    public boolean isDraining() {
        return draining.get();
    }

    public long getAcceptedCount() {
        return acceptedCount.get();
    }

    public long getDroppedCount() {
        return droppedCount.get();
    }

    private void wakeDrainLoop() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            drainExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.error("[EventQueue] Drain loop rejected by executor, {} item(s) left pending", queue.size(), e);
        }
    }

    private void drain() {
        try {
            EventWorkItem item;
            while ((item = queue.poll()) != null) {
                process(item);
                if (!queue.isEmpty() && !pause()) {
                    return;
                }
            }
        } finally {
            draining.set(false);
            if (!queue.isEmpty() && !Thread.currentThread().isInterrupted()) {
                wakeDrainLoop();
            }
        }
    }

    private void process(EventWorkItem item) {
        String agentId = item.agentId();
        if (!worldState.isAcceptingResults()) {
            log.debug("[EventQueue] World busy, discarding {} for {}", item.eventType(), agentId);
            return;
        }
        if (!dispatchGuard.tryAcquire(agentId)) {
            log.debug("[EventQueue] {} already thinking, discarding {}", agentId, item.eventType());
            return;
        }
        try {
            log.debug("[EventQueue] Reacting: {} -> {} ({})", agentId, item.eventType(), item.description());
            WorkflowResult result = workflowService.execute(agentId).join();
            outcomeRecorder.record(DispatchSource.EVENT, agentId, result);
        } catch (RuntimeException e) { // NOSONAR - must not kill the drain loop
            log.error("[EventQueue] Reaction failed for {}", agentId, e);
        } finally {
            dispatchGuard.release(agentId);
        }
    }

    private boolean pause() {
        Duration delay = properties.getEvents().getDrainDelay();
        if (delay == null || delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("[EventQueue] Drain loop interrupted, {} item(s) left pending", queue.size());
            return false;
        }
    }
}
