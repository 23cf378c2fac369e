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

import me.golemcore.calradia.domain.model.ActionResult;
import me.golemcore.calradia.domain.model.AgentAction;
import me.golemcore.calradia.domain.model.CancellationToken;

import java.util.concurrent.CompletableFuture;

/**
 * Port for applying decided actions to the simulation.
 */
public interface ActionExecutorPort {

    /**
     * Checks if an action type is registered.
     */
    boolean canExecute(String actionType);

    /**
     * Applies a single action. On timeout the workflow raises
     * {@code cancellation} and cancels the returned future.
     */
    CompletableFuture<ActionResult> execute(AgentAction action, CancellationToken cancellation);
}
