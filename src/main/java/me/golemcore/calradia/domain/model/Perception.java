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

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable snapshot of the world state relevant to one agent at one instant.
 * A fresh perception is produced for every workflow cycle and is owned by that
 * cycle only.
 */
@Getter
@Builder
@ToString
@EqualsAndHashCode
public class Perception {

    private final Instant timestamp;
    private final String location;
    private final WeatherCondition weather;
    private final EconomicState economy;

    /**
     * Faction or entity name mapped to a relation score, typically in the range
     * -100..100.
     */
    @Singular
    private final Map<String, Integer> relations;

    /**
     * Weather at the agent's location.
     */
    public record WeatherCondition(String type, int temperature) {

        public WeatherCondition {
            if (type == null || type.isBlank()) {
                type = "Clear";
            }
        }

        @Override
        public String toString() {
            return type + " (" + temperature + "°C)";
        }
    }

    /**
     * Economic summary of the agent's surroundings.
     */
    public record EconomicState(int prosperity, int foodSupply, int taxRate) {
    }
}
