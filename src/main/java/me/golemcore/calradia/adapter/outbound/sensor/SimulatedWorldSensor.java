package me.golemcore.calradia.adapter.outbound.sensor;

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
import me.golemcore.calradia.port.outbound.WorldSensorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;

/**
 * World sensor that fabricates plausible perceptions without a running game.
 *
 * <p>
 * The scenario is picked from keywords in the agent id:
 * <ul>
 * <li>lord / king - political scene, rivals across the five great factions</li>
 * <li>merchant / trader - rich market town</li>
 * <li>commander / general - front line under siege</li>
 * <li>villager / peasant - poor village, heavy taxes</li>
 * <li>archer / soldier - steppe patrol, no taxes</li>
 * <li>anything else - random weather and economy</li>
 * </ul>
 */
@Component
@Slf4j
public class SimulatedWorldSensor implements WorldSensorPort {

    private static final String[] WEATHER_TYPES = { "Clear", "Sunny", "Cloudy", "Rainy", "Stormy", "Windy",
            "Foggy" };

    private final Random random;
    private final Clock clock;

    public SimulatedWorldSensor(Random random, Clock clock) {
        this.random = random;
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Perception> perceive(String agentId, CancellationToken cancellation) {
        if (agentId == null || agentId.isBlank()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Agent id is required"));
        }
        if (cancellation.isCancellationRequested()) {
            return CompletableFuture.failedFuture(new CancellationException("Perception cancelled"));
        }
        Perception perception = generate(agentId);
        log.debug("[Sensor] {} perceives {} ({})", agentId, perception.getLocation(), perception.getWeather());
        return CompletableFuture.completedFuture(perception);
    }

    private Perception generate(String agentId) {
        String id = agentId.toLowerCase(Locale.ROOT);
        if (id.contains("king") || id.contains("lord")) {
            return lordScenario(agentId);
        }
        if (id.contains("merchant") || id.contains("trader")) {
            return merchantScenario();
        }
        if (id.contains("commander") || id.contains("general")) {
            return commanderScenario();
        }
        if (id.contains("villager") || id.contains("peasant")) {
            return villagerScenario();
        }
        if (id.contains("archer") || id.contains("soldier")) {
            return soldierScenario();
        }
        return defaultScenario();
    }

    private Perception lordScenario(String agentId) {
        return Perception.builder()
                .timestamp(clock.instant())
                .location(locationForFaction(agentId))
                .weather(new Perception.WeatherCondition("Clear", 18))
                .economy(new Perception.EconomicState(between(3000, 6000), between(100, 300), between(10, 25)))
                .relation("Empire", between(-80, -20))
                .relation("Vlandia", between(-50, 30))
                .relation("Sturgia", between(20, 80))
                .relation("Aserai", between(-30, 50))
                .relation("Khuzait", between(-100, -50))
                .build();
    }

    private Perception merchantScenario() {
        return Perception.builder()
                .timestamp(clock.instant())
                .location("Pravend Market")
                .weather(new Perception.WeatherCondition("Sunny", 22))
                .economy(new Perception.EconomicState(between(4000, 8000), between(50, 150), between(5, 15)))
                .relation("LocalGuild", between(50, 100))
                .relation("Nobility", between(20, 60))
                .relation("CommonFolk", between(60, 90))
                .relation("Bandits", between(-100, -70))
                .build();
    }

    private Perception commanderScenario() {
        return Perception.builder()
                .timestamp(clock.instant())
                .location("Front Line - Under Siege")
                .weather(new Perception.WeatherCondition("Stormy", 12))
                .economy(new Perception.EconomicState(between(1000, 3000), between(20, 80), between(20, 40)))
                .relation("EnemyArmy", -100)
                .relation("AlliedForces", between(70, 100))
                .relation("LocalPopulation", between(-20, 40))
                .relation("Mercenaries", between(30, 70))
                .build();
    }

    private Perception villagerScenario() {
        return Perception.builder()
                .timestamp(clock.instant())
                .location("Omor Village")
                .weather(new Perception.WeatherCondition("Rainy", 8))
                .economy(new Perception.EconomicState(between(500, 1500), between(30, 70), between(25, 40)))
                .relation("VillageLord", between(-30, 20))
                .relation("OtherVillagers", between(50, 80))
                .relation("TaxCollector", between(-80, -40))
                .relation("Bandits", between(-100, -60))
                .build();
    }

    private Perception soldierScenario() {
        return Perception.builder()
                .timestamp(clock.instant())
                .location("Khuzait Steppe - Patrol")
                .weather(new Perception.WeatherCondition("Windy", 5))
                .economy(new Perception.EconomicState(between(2000, 4000), between(40, 100), 0))
                .relation("Commander", between(60, 100))
                .relation("FellowSoldiers", between(70, 95))
                .relation("Enemy", -100)
                .relation("Civilians", between(20, 50))
                .build();
    }

    private Perception defaultScenario() {
        return Perception.builder()
                .timestamp(clock.instant())
                .location("Unknown Location")
                .weather(new Perception.WeatherCondition(WEATHER_TYPES[random.nextInt(WEATHER_TYPES.length)],
                        between(-5, 30)))
                .economy(new Perception.EconomicState(between(1000, 5000), between(50, 200), between(5, 30)))
                .relation("Faction1", between(-100, 100))
                .relation("Faction2", between(-100, 100))
                .relation("Faction3", between(-100, 100))
                .build();
    }

    static String locationForFaction(String agentId) {
        if (agentId.contains("Battania")) {
            return "Marunath Castle";
        }
        if (agentId.contains("Vlandia")) {
            return "Pravend";
        }
        if (agentId.contains("Empire")) {
            return "Epicrotea";
        }
        if (agentId.contains("Sturgia")) {
            return "Balgard";
        }
        if (agentId.contains("Aserai")) {
            return "Qasira";
        }
        if (agentId.contains("Khuzait")) {
            return "Makeb";
        }
        return "Calradia";
    }

    /** Uniform in [min, max). */
    private int between(int min, int max) {
        return min + random.nextInt(max - min);
    }
}
