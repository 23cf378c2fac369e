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
 * Kinds of world events that may trigger an agent reaction.
 */
public enum GameEventType {

    // War and peace
    WAR_DECLARED,
    PEACE_MADE,

    // Battles
    BATTLE_WON,
    BATTLE_LOST,

    // Sieges and settlements
    SIEGE_STARTED,
    SETTLEMENT_UNDER_SIEGE,
    SETTLEMENT_CAPTURED,
    SETTLEMENT_LOST,
    VILLAGE_RAIDED,

    // Heroes
    ALLY_DIED,
    ENEMY_CAPTURED,
    ALLY_CAPTURED,
    RELEASED,

    // Politics
    VASSAL_DEFECTED,
    NEW_VASSAL;

    public boolean isBattle() {
        return this == BATTLE_WON || this == BATTLE_LOST;
    }
}
