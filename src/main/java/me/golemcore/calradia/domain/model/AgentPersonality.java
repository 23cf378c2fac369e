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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Character traits of a noble on a 0-100 scale. Rendered into prompts so the
 * backend decides and argues in character.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgentPersonality {

    private static final int STRONG_HIGH = 75;
    private static final int MILD_HIGH = 60;
    private static final int MILD_LOW = 40;
    private static final int STRONG_LOW = 25;

    // Core
    @Builder.Default
    private int valor = 50;
    @Builder.Default
    private int honor = 50;
    @Builder.Default
    private int mercy = 50;
    @Builder.Default
    private int generosity = 50;
    @Builder.Default
    private int calculating = 50;

    // Behavioral
    @Builder.Default
    private int ambition = 50;
    @Builder.Default
    private int loyalty = 50;
    @Builder.Default
    private int aggression = 50;

    // Social
    @Builder.Default
    private int charm = 50;
    @Builder.Default
    private int pride = 50;

    public String describeTraits() {
        List<String> traits = new ArrayList<>();
        band(traits, valor, "BRAVE and FEARLESS - never backs down from a fight", "courageous in battle",
                "prefers to fight only when odds are favorable",
                "CAUTIOUS and RISK-AVERSE - avoids unnecessary danger");
        band(traits, honor, "HONORABLE - keeps promises, fights fairly, values reputation",
                "respects tradition and oaths", "flexible with moral boundaries",
                "PRAGMATIC - will break promises if beneficial");
        band(traits, mercy, "MERCIFUL - spares enemies, releases prisoners", "shows compassion when possible",
                "harsh but not cruel", "RUTHLESS - shows no mercy to enemies");
        band(traits, generosity, "GENEROUS - shares wealth, rewards followers well", "fair with gold distribution",
                "careful with money", "GREEDY - hoards gold, reluctant to spend");
        band(traits, calculating, "CALCULATING - thinks ahead, strategic", "plans before acting",
                "sometimes acts rashly", "IMPULSIVE - acts on emotion");
        band(traits, ambition, "AMBITIOUS - desires power and glory", "seeks advancement", "modest goals",
                "CONTENT - happy with current position");
        band(traits, loyalty, "LOYAL - devoted to kingdom and liege", "generally faithful",
                "loyalty can be bought", "SELF-SERVING - will defect if beneficial");
        band(traits, aggression, "WARLIKE - prefers military solutions", "favors strength",
                "avoids conflict when possible", "PEACEFUL - prefers diplomacy");
        band(traits, charm, "CHARISMATIC - skilled diplomat, persuasive", "socially adept",
                "straightforward speaker", "BLUNT - poor with words, direct");
        band(traits, pride, "PROUD - sensitive to slights, values status", "conscious of reputation",
                "modest demeanor", "HUMBLE - doesn't seek glory");

        if (traits.isEmpty()) {
            return "balanced personality with no extreme traits";
        }
        return String.join(", ", traits);
    }

    public String describeTendencies() {
        List<String> tendencies = new ArrayList<>();

        if (valor >= 70 && aggression >= 70) {
            tendencies.add("Prefers ATTACK over defense");
        } else if (valor <= 30 || aggression <= 30) {
            tendencies.add("Prefers DEFEND and RETREAT over risky attacks");
        }

        if (generosity <= 30) {
            tendencies.add("Reluctant to GIVE GOLD or PAY RANSOM");
        } else if (generosity >= 70) {
            tendencies.add("Willing to spend gold for allies and causes");
        }

        if (honor >= 70 && loyalty >= 70) {
            tendencies.add("Will NOT DEFECT from kingdom easily");
        } else if (loyalty <= 30 && ambition >= 70) {
            tendencies.add("May DEFECT if offered better position");
        }

        if (mercy >= 70) {
            tendencies.add("Prefers to release prisoners");
        } else if (mercy <= 30) {
            tendencies.add("May execute or ransom prisoners");
        }

        if (calculating >= 70) {
            tendencies.add("MARRIAGE decisions based on strategic value");
        } else if (calculating <= 30) {
            tendencies.add("May marry for love or impulse");
        }

        if (tendencies.isEmpty()) {
            return "No strong action preferences";
        }
        return String.join(". ", tendencies);
    }

    private static void band(List<String> traits, int value, String strongHigh, String mildHigh, String mildLow,
            String strongLow) {
        if (value >= STRONG_HIGH) {
            traits.add(strongHigh);
        } else if (value >= MILD_HIGH) {
            traits.add(mildHigh);
        } else if (value <= STRONG_LOW) {
            traits.add(strongLow);
        } else if (value <= MILD_LOW) {
            traits.add(mildLow);
        }
    }
}
