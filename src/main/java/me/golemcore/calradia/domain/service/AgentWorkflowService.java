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
import me.golemcore.calradia.domain.model.AgentAction;
import me.golemcore.calradia.domain.model.AgentDecision;
import me.golemcore.calradia.domain.model.CancellationToken;
import me.golemcore.calradia.domain.model.Perception;
import me.golemcore.calradia.domain.model.WorkflowFailureKind;
import me.golemcore.calradia.domain.model.WorkflowResult;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.port.outbound.ActionExecutorPort;
import me.golemcore.calradia.port.outbound.ReasoningPort;
import me.golemcore.calradia.port.outbound.WorldSensorPort;
import me.golemcore.calradia.port.outbound.WorldStatePort;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * Runs one perceive, reason, act cycle for an agent.
 *
 * <p>
 * Stages, in strict order:
 * <ol>
 * <li>Sense - fresh {@link Perception} from the {@link WorldSensorPort}</li>
 * <li>Reason - raw text from the {@link ReasoningPort}, given the perception and
 * the agent's memory context, parsed by {@link DecisionParser}</li>
 * <li>Act - every action in order through the {@link ActionExecutorPort}; an
 * unknown or failing action is recorded and the loop continues</li>
 * <li>Remember - exactly one memory entry per successful cycle</li>
 * </ol>
 *
 * <p>
 * The returned future always completes normally. Sense and reasoning errors,
 * timeouts and cancellations surface as a failed {@link WorkflowResult}. Each
 * awaited step is bounded by {@code calradia.workflow.step-timeout}. Before
 * acting and before writing memory the world state is re-checked, and a cycle
 * computed against a context that is no longer valid is discarded.
 *
 * <p>
 * This is the single entry point used by every trigger source: the event
 * queue, the proactive scheduler, and manual calls.
 *
 * @since 1.0
 */
@Service
@Slf4j
public class AgentWorkflowService {

    public static final int MEMORY_SUMMARY_LENGTH = 100;

    private final WorldSensorPort worldSensor;
    private final ReasoningPort reasoningPort;
    private final ActionExecutorPort actionExecutor;
    private final WorldStatePort worldState;
    private final AgentMemoryService memoryService;
    private final DecisionParser decisionParser;
    private final CalradiaProperties properties;
    private final Map<String, InFlightCycle> inFlightCycles = new ConcurrentHashMap<>();

    public AgentWorkflowService(WorldSensorPort worldSensor, ReasoningPort reasoningPort,
            ActionExecutorPort actionExecutor, WorldStatePort worldState, AgentMemoryService memoryService,
            DecisionParser decisionParser, CalradiaProperties properties) {
        this.worldSensor = worldSensor;
        this.reasoningPort = reasoningPort;
        this.actionExecutor = actionExecutor;
        this.worldState = worldState;
        this.memoryService = memoryService;
        this.decisionParser = decisionParser;
        this.properties = properties;
    }

    public CompletableFuture<WorkflowResult> execute(String agentId) {
        return execute(agentId, properties.getWorkflow().getStepTimeout());
    }

    public CompletableFuture<WorkflowResult> execute(String agentId, Duration stepTimeout) {
        if (agentId == null || agentId.isBlank()) {
            log.warn("[Workflow] Refusing cycle without an agent id");
            return CompletableFuture.completedFuture(WorkflowResult.failure(agentId, WorkflowFailureKind.INTERNAL,
                    new IllegalArgumentException("Agent id must not be blank")));
        }

        String key = AgentKeys.normalize(agentId);
        InFlightCycle cycle = new InFlightCycle(stepTimeout);
        InFlightCycle running = inFlightCycles.putIfAbsent(key, cycle);
        if (running != null) {
            log.debug("[Workflow] Refusing overlapping cycle for {}", agentId);
            return CompletableFuture.completedFuture(WorkflowResult.failure(agentId,
                    WorkflowFailureKind.ALREADY_IN_FLIGHT,
                    new IllegalStateException("A cycle for " + agentId + " is already running")));
        }
        log.debug("[Workflow] Starting cycle for {}", agentId);

        CompletableFuture<WorkflowResult> pipeline;
        try {
            pipeline = sense(agentId, cycle)
                    .thenCompose(perception -> reason(agentId, perception, cycle)
                            .thenCompose(decision -> act(agentId, decision, cycle)
                                    .thenApply(results -> complete(agentId, perception, decision, results))));
        } catch (RuntimeException e) { // NOSONAR - converted to a failed result below
            pipeline = CompletableFuture.failedFuture(e);
        }

        return pipeline.handle((result, error) -> {
            inFlightCycles.remove(key, cycle);
            if (error == null) {
                return result;
            }
            return toFailure(agentId, error);
        });
    }

    /**
     * Cancels the agent's current cycle. The awaited step's future is cancelled
     * and its cancellation token raised; the cycle resolves to a failed result
     * for the stage that was cancelled.
     *
     * @return true if a cycle was in flight
     */
    public boolean cancel(String agentId) {
        InFlightCycle cycle = inFlightCycles.get(AgentKeys.normalize(agentId));
        if (cycle == null) {
            return false;
        }
        log.info("[Workflow] Cancelling cycle for {}", agentId);
        cycle.cancel();
        return true;
    }

    @PreDestroy
    public void shutdown() {
        if (!inFlightCycles.isEmpty()) {
            log.info("[Workflow] Cancelling {} in-flight cycle(s)", inFlightCycles.size());
        }
        inFlightCycles.values().forEach(InFlightCycle::cancel);
    }

    public boolean isInFlight(String agentId) {
        return inFlightCycles.containsKey(AgentKeys.normalize(agentId));
    }

    // ==================== STAGES ====================

    private CompletableFuture<Perception> sense(String agentId, InFlightCycle cycle) {
        return stage(cycle, WorkflowFailureKind.SENSE_FAILED, token -> worldSensor.perceive(agentId, token))
                .thenApply(perception -> {
                    if (perception == null) {
                        throw new WorkflowStageException(WorkflowFailureKind.SENSE_FAILED,
                                "No perception for " + agentId);
                    }
                    return perception;
                });
    }

    private CompletableFuture<AgentDecision> reason(String agentId, Perception perception, InFlightCycle cycle) {
        return stage(cycle, WorkflowFailureKind.REASONING_FAILED, token -> {
            String memoryContext = memoryService.getContext(agentId);
            return reasoningPort.reason(agentId, perception, memoryContext, token);
        }).thenApply(rawText -> {
            try {
                return decisionParser.parse(agentId, rawText);
            } catch (RuntimeException e) {
                throw new WorkflowStageException(WorkflowFailureKind.REASONING_FAILED, e);
            }
        });
    }

    private CompletableFuture<List<ActionResult>> act(String agentId, AgentDecision decision, InFlightCycle cycle) {
        ensureAcceptingResults(agentId, "act");

        CompletableFuture<List<ActionResult>> chain = CompletableFuture.completedFuture(new ArrayList<>());
        for (AgentAction decided : decision.getActions()) {
            AgentAction action = decided.withParameterIfAbsent(AgentAction.PARAM_AGENT_ID, agentId);
            chain = chain.thenCompose(results -> executeAction(action, cycle).thenApply(actionResult -> {
                results.add(actionResult);
                return results;
            }));
        }
        return chain;
    }

    private CompletableFuture<ActionResult> executeAction(AgentAction action, InFlightCycle cycle) {
        String type = action.getType();
        try {
            if (!actionExecutor.canExecute(type)) {
                log.debug("[Workflow] Unknown action: {}", type);
                return CompletableFuture.completedFuture(ActionResult.unknownAction(type));
            }
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(ActionResult.failed("Executor rejected " + type, e));
        }

        return stage(cycle, WorkflowFailureKind.INTERNAL, token -> actionExecutor.execute(action, token))
                .handle((actionResult, error) -> {
                    if (error != null) {
                        Throwable cause = rootCause(error);
                        if (cause instanceof WorkflowStageException && cause.getCause() != null) {
                            cause = cause.getCause();
                        }
                        log.debug("[Workflow] Action {} failed: {}", type, cause.getMessage());
                        return ActionResult.failed(type + " failed: " + describe(cause), cause);
                    }
                    return actionResult != null ? actionResult : ActionResult.failed(type + " returned no result");
                });
    }

    private WorkflowResult complete(String agentId, Perception perception, AgentDecision decision,
            List<ActionResult> results) {
        ensureAcceptingResults(agentId, "remember");

        String actionType = decision.getPrimaryAction().getType();
        memoryService.remember(agentId,
                perception.getLocation(),
                decisionParser.extractThought(decision.getReasoning(), MEMORY_SUMMARY_LENGTH),
                actionType != null ? actionType : DecisionParser.WAIT_ACTION);

        log.debug("[Workflow] Cycle for {} completed: {} ({} action result(s))", agentId, actionType,
                results.size());
        return WorkflowResult.success(agentId, perception, decision, results);
    }

    // ==================== HELPERS ====================

    /**
     * Invokes one async step, bounds it by the cycle's step timeout and tags any
     * error with the stage's failure kind. The step's token is raised when the
     * step times out or the cycle is cancelled.
     */
    private <T> CompletableFuture<T> stage(InFlightCycle cycle, WorkflowFailureKind kind,
            Function<CancellationToken, CompletableFuture<T>> step) {
        if (cycle.isCancelled()) {
            return CompletableFuture.failedFuture(
                    new WorkflowStageException(kind, new CancellationException("Cycle cancelled")));
        }

        AtomicBoolean abandoned = new AtomicBoolean();
        CancellationToken token = () -> abandoned.get() || cycle.isCancelled();
        CompletableFuture<T> future;
        try {
            future = step.apply(token);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(new WorkflowStageException(kind, e));
        }
        if (future == null) {
            return CompletableFuture.failedFuture(new WorkflowStageException(kind, "Step returned no result"));
        }

        cycle.track(future);
        CompletableFuture<T> bounded = future.thenApply(value -> value);
        if (cycle.hasTimeout()) {
            bounded = bounded.orTimeout(cycle.timeoutMillis(), TimeUnit.MILLISECONDS);
        }
        return bounded.handle((value, error) -> {
            cycle.untrack(future);
            if (error != null) {
                abandoned.set(true);
                future.cancel(true);
                throw new WorkflowStageException(kind, rootCause(error));
            }
            return value;
        });
    }

    private void ensureAcceptingResults(String agentId, String step) {
        if (!worldState.isAcceptingResults()) {
            log.debug("[Workflow] Discarding cycle for {} before {}: world not accepting results", agentId, step);
            throw new WorkflowStageException(WorkflowFailureKind.STALE_CONTEXT,
                    "World stopped accepting results before " + step);
        }
    }

    private WorkflowResult toFailure(String agentId, Throwable error) {
        Throwable cause = unwrap(error);
        WorkflowFailureKind kind = cause instanceof WorkflowStageException
                ? ((WorkflowStageException) cause).getFailureKind()
                : WorkflowFailureKind.INTERNAL;
        log.warn("[Workflow] Cycle failed for {} ({}): {}", agentId, kind, describe(cause));
        return WorkflowResult.failure(agentId, kind, cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static Throwable rootCause(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return new TimeoutException("Step timed out");
        }
        return cause;
    }

    private static String describe(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
    }

    /**
     * Tracks the step future currently awaited by one cycle so it can be
     * cancelled from outside.
     */
    private static final class InFlightCycle {

        private final Duration stepTimeout;
        private volatile boolean cancelled;
        private volatile CompletableFuture<?> current;

        InFlightCycle(Duration stepTimeout) {
            this.stepTimeout = stepTimeout;
        }

        boolean hasTimeout() {
            return stepTimeout != null && !stepTimeout.isZero() && !stepTimeout.isNegative();
        }

        long timeoutMillis() {
            return stepTimeout.toMillis();
        }

        boolean isCancelled() {
            return cancelled;
        }

        void track(CompletableFuture<?> future) {
            current = future;
            if (cancelled) {
                future.cancel(true);
            }
        }

        void untrack(CompletableFuture<?> future) {
            if (current == future) {
                current = null;
            }
        }

        void cancel() {
            cancelled = true;
            CompletableFuture<?> step = current;
            if (step != null) {
                step.cancel(true);
            }
        }
    }
}
