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

import me.golemcore.calradia.domain.model.CancellationToken;
import me.golemcore.calradia.domain.model.Perception;

import java.util.concurrent.CompletableFuture;

/**
 * Port for reading the simulation state into a {@link Perception} snapshot.
 *
 * <p>
 * Implementations may perform long-latency I/O and must not block the caller.
 * When the cycle is aborted or the step times out, the workflow raises the
 * {@link CancellationToken} and cancels the returned future; implementations
 * should stop work at that point.
 */
public interface WorldSensorPort {

    /**
     * Produces a fresh perception for the given agent.
     */
    CompletableFuture<Perception> perceive(String agentId, CancellationToken cancellation);
}
