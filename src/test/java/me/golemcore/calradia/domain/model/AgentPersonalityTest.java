package me.golemcore.calradia.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentPersonalityTest {

    @Test
    void shouldDescribeAverageNobleAsBalanced() {
        AgentPersonality personality = AgentPersonality.builder().build();

        assertEquals("balanced personality with no extreme traits", personality.describeTraits());
        assertEquals("No strong action preferences", personality.describeTendencies());
    }

    @Test
    void shouldBandEachTraitIntoStrongAndMildDescriptions() {
        assertEquals("BRAVE and FEARLESS - never backs down from a fight",
                AgentPersonality.builder().valor(75).build().describeTraits());
        assertEquals("courageous in battle", AgentPersonality.builder().valor(60).build().describeTraits());
        assertEquals("prefers to fight only when odds are favorable",
                AgentPersonality.builder().valor(40).build().describeTraits());
        assertEquals("CAUTIOUS and RISK-AVERSE - avoids unnecessary danger",
                AgentPersonality.builder().valor(25).build().describeTraits());
    }

    @Test
    void shouldJoinSeveralTraitsInFixedOrder() {
        AgentPersonality personality = AgentPersonality.builder()
                .pride(90)
                .generosity(10)
                .build();

        assertEquals("GREEDY - hoards gold, reluctant to spend, PROUD - sensitive to slights, values status",
                personality.describeTraits());
    }

    @Test
    void shouldDeriveTendenciesFromTraitCombinations() {
        AgentPersonality warlord = AgentPersonality.builder()
                .valor(80)
                .aggression(80)
                .generosity(20)
                .build();
        assertEquals("Prefers ATTACK over defense. Reluctant to GIVE GOLD or PAY RANSOM",
                warlord.describeTendencies());

        AgentPersonality turncoat = AgentPersonality.builder()
                .loyalty(20)
                .ambition(80)
                .build();
        assertTrue(turncoat.describeTendencies().contains("May DEFECT if offered better position"));

        AgentPersonality steadfast = AgentPersonality.builder()
                .honor(75)
                .loyalty(75)
                .build();
        assertTrue(steadfast.describeTendencies().contains("Will NOT DEFECT from kingdom easily"));
    }
}
