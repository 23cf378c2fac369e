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

import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Action executor that delegates to handlers registered per action type.
 * Action types are matched case-insensitively. A handler that throws, or whose
 * future fails, yields a failed {@link ActionResult} instead of an error.
 */
public class DelegatingActionExecutor implements ActionExecutorPort {

    private final Map<String, Function<AgentAction, CompletableFuture<ActionResult>>> handlers =
            new ConcurrentHashMap<>();

    public void registerHandler(String actionType, Function<AgentAction, CompletableFuture<ActionResult>> handler) {
        if (actionType == null || actionType.isBlank()) {
            throw new IllegalArgumentException("Action type cannot be empty");
        }
        Objects.requireNonNull(handler, "handler");
        handlers.put(key(actionType), handler);
    }

    public void registerSyncHandler(String actionType, Function<AgentAction, ActionResult> handler) {
        Objects.requireNonNull(handler, "handler");
        registerHandler(actionType, action -> CompletableFuture.completedFuture(handler.apply(action)));
    }

    public Set<String> getRegisteredTypes() {
        return Set.copyOf(handlers.keySet());
    }

    @Override
    public boolean canExecute(String actionType) {
        return actionType != null && handlers.containsKey(key(actionType));
    }

    @Override
    public CompletableFuture<ActionResult> execute(AgentAction action, CancellationToken cancellation) {
        Objects.requireNonNull(action, "action");
        Function<AgentAction, CompletableFuture<ActionResult>> handler = handlers.get(key(action.getType()));
        if (handler == null) {
            return CompletableFuture.completedFuture(
                    ActionResult.failed("No handler registered for action type: " + action.getType()));
        }
        if (cancellation.isCancellationRequested()) {
            return CompletableFuture.completedFuture(ActionResult.failed("Action " + action.getType() + " cancelled"));
        }

        CompletableFuture<ActionResult> future;
        try {
            future = handler.apply(action);
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture(failure(action, e));
        }
        if (future == null) {
            return CompletableFuture.completedFuture(
                    ActionResult.failed("Handler for " + action.getType() + " returned no result"));
        }
        return future.handle((result, error) -> {
            if (error != null) {
                Throwable cause = error.getCause() != null ? error.getCause() : error;
                return failure(action, cause);
            }
            return result;
        });
    }

    private static ActionResult failure(AgentAction action, Throwable error) {
        return ActionResult.failed("Error executing action " + action.getType() + ": " + error.getMessage(), error);
    }

    private static String key(String actionType) {
        return actionType.toLowerCase(Locale.ROOT);
    }
}
