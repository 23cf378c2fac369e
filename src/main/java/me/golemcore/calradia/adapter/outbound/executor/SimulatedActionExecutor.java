package me.golemcore.calradia.adapter.outbound.executor;

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
import me.golemcore.calradia.domain.model.CancellationToken;
import me.golemcore.calradia.port.outbound.ActionExecutorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that applies decided actions to a simulated world by logging them.
 * Only the registered action types are executable; anything else is reported
 * as unknown by the workflow.
 */
@Component
@Slf4j
public class SimulatedActionExecutor implements ActionExecutorPort {

    private final DelegatingActionExecutor delegate = new DelegatingActionExecutor();
    private final AtomicInteger executedCount = new AtomicInteger();

    public SimulatedActionExecutor() {
        registerHandlers();
    }

    @Override
    public boolean canExecute(String actionType) {
        return delegate.canExecute(actionType);
    }

    @Override
    public CompletableFuture<ActionResult> execute(AgentAction action, CancellationToken cancellation) {
        executedCount.incrementAndGet();
        return delegate.execute(action, cancellation);
    }

    public int getExecutedCount() {
        return executedCount.get();
    }

    private void registerHandlers() {
        delegate.registerSyncHandler("Wait", action -> {
            Object duration = param(action, AgentAction.PARAM_DURATION, 60);
            log.info("[Executor] {} waits for {}s", agent(action), duration);
            return ActionResult.successful("Agent waiting for " + duration + " seconds");
        });
        delegate.registerSyncHandler("LogReasoning", action -> {
            log.info("[Executor] {} logged reasoning", agent(action));
            return ActionResult.successful("Reasoning logged");
        });
        delegate.registerSyncHandler("StartSiege", action -> {
            Object target = param(action, "settlementId", detail(action));
            log.info("[Executor] {} starts a siege on {}", agent(action), target);
            return ActionResult.successful("Siege started on " + target);
        });
        delegate.registerSyncHandler("GiveGold", action -> {
            Object amount = param(action, "amount", 1000);
            log.info("[Executor] {} gives {} gold", agent(action), amount);
            return ActionResult.successful("Transferred " + amount + " gold");
        });
        delegate.registerSyncHandler("ChangeRelation", action -> {
            log.info("[Executor] {} changes relation: {}", agent(action), detail(action));
            return ActionResult.successful("Relation changed");
        });
        delegate.registerSyncHandler("MoveArmy", action -> {
            Object target = param(action, "target", detail(action));
            log.info("[Executor] {} moves army to {}", agent(action), target);
            return ActionResult.successful("Army moving to " + target);
        });
        delegate.registerSyncHandler("RecruitTroops", this::recruit);
        delegate.registerSyncHandler("Recruit", this::recruit);
        delegate.registerSyncHandler("Trade", action -> simple(action, "trades", "Trade completed"));
        delegate.registerSyncHandler("Patrol", action -> simple(action, "patrols", "Patrol completed"));
        delegate.registerSyncHandler("Retreat", action -> simple(action, "retreats", "Retreated successfully"));
        delegate.registerSyncHandler("Attack", action -> simple(action, "attacks", "Attack initiated"));
        delegate.registerSyncHandler("Defend", action -> simple(action, "defends", "Defense position taken"));
        delegate.registerSyncHandler("Hide", action -> simple(action, "hides", "Hidden successfully"));
        delegate.registerSyncHandler("Work", action -> simple(action, "works", "Work completed"));
        delegate.registerSyncHandler("DeclareWar", action -> {
            Object target = detail(action);
            log.info("[Executor] {} declares war on {}", agent(action), target);
            return ActionResult.successful("War declared on " + target);
        });
        delegate.registerSyncHandler("MakePeace", action -> {
            Object target = detail(action);
            log.info("[Executor] {} makes peace with {}", agent(action), target);
            return ActionResult.successful("Peace made with " + target);
        });
    }

    private ActionResult recruit(AgentAction action) {
        Object count = param(action, "count", 50);
        log.info("[Executor] {} recruits {} troops", agent(action), count);
        return ActionResult.successful("Recruited " + count + " troops");
    }

    private ActionResult simple(AgentAction action, String verb, String message) {
        log.info("[Executor] {} {}: {}", agent(action), verb, detail(action));
        return ActionResult.successful(message);
    }

    private static Object agent(AgentAction action) {
        return param(action, AgentAction.PARAM_AGENT_ID, "unknown");
    }

    private static Object detail(AgentAction action) {
        return param(action, AgentAction.PARAM_DETAIL, "-");
    }

    private static Object param(AgentAction action, String name, Object defaultValue) {
        Object value = action.getParameter(name);
        return value != null ? value : defaultValue;
    }
}
