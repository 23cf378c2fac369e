package me.golemcore.calradia.domain.model;

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

/**
 * Why a workflow cycle was aborted.
 */
public enum WorkflowFailureKind {

    /**
     * The world sensor threw, failed, timed out or was cancelled.
     */
    SENSE_FAILED,

    /**
     * The reasoning backend failed, timed out or was cancelled.
     */
    REASONING_FAILED,

    /**
     * The world stopped accepting results while the cycle was in flight; the
     * decision was discarded without being applied.
     */
    STALE_CONTEXT,

    /**
     * Another cycle for the same agent was still running; this one never
     * started.
     */
    ALREADY_IN_FLIGHT,

    /**
     * Unexpected failure inside the workflow itself, or a request it cannot
     * run (no agent id).
     */
    INTERNAL
}
