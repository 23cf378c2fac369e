package me.golemcore.calradia.domain.service;

import me.golemcore.calradia.domain.model.AgentPersonality;
import me.golemcore.calradia.domain.model.AgentProfile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PersonalityServiceTest {

    private static final String LORD = "Lord_Aldric_Vlandia";

    private PersonalityService service;

    @BeforeEach
    void setUp() {
        service = new PersonalityService();
    }

    @Test
    void shouldGenerateSamePersonalityOnEveryRun() {
        AgentPersonality first = service.getPersonality(LORD, null, false, false);
        AgentPersonality second = new PersonalityService().getPersonality(LORD, null, false, false);

        assertEquals(first, second);
    }

    @Test
    void shouldCacheByAgentIdIgnoringCase() {
        AgentPersonality first = service.getPersonality(LORD, "Vlandia", false, false);

        assertSame(first, service.getPersonality("LORD_ALDRIC_VLANDIA", "Vlandia", false, false));
        assertEquals(1, service.size());
    }

    @Test
    void shouldKeepTraitsWithinScale() {
        for (String id : new String[] { "King_Caladog_Battania", "Lord_Monchug_Khuzait", "Merchant_Talia" }) {
            AgentPersonality p = service.getPersonality(id, "Sturgia", true, true);
            for (int trait : new int[] { p.getValor(), p.getHonor(), p.getMercy(), p.getGenerosity(),
                    p.getCalculating(), p.getAmbition(), p.getLoyalty(), p.getAggression(), p.getCharm(),
                    p.getPride() }) {
                assertTrue(trait >= 0 && trait <= 100, id + " trait " + trait);
            }
        }
    }

    @Test
    void shouldPushRulersTowardsAmbitionAndPride() {
        AgentPersonality base = new PersonalityService().getPersonality(LORD, null, false, false);
        AgentPersonality ruler = service.getPersonality(LORD, null, true, true);

        assertEquals(Math.min(100, base.getAmbition() + 20), ruler.getAmbition());
        assertEquals(Math.min(100, base.getPride() + 15), ruler.getPride());
        assertEquals(Math.min(100, base.getCalculating() + 10), ruler.getCalculating());
        assertEquals(base.getLoyalty(), ruler.getLoyalty());
    }

    @Test
    void shouldMakeFactionLeadersMoreLoyal() {
        AgentPersonality base = new PersonalityService().getPersonality(LORD, null, false, false);
        AgentPersonality leader = service.getPersonality(LORD, null, true, false);

        assertEquals(Math.min(100, base.getAmbition() + 10), leader.getAmbition());
        assertEquals(Math.min(100, base.getLoyalty() + 10), leader.getLoyalty());
    }

    @Test
    void shouldApplyCultureOfFaction() {
        AgentPersonality base = new PersonalityService().getPersonality(LORD, null, false, false);
        AgentPersonality sturgian = service.getPersonality(LORD, "Sturgia", false, false);

        assertEquals(Math.min(100, base.getValor() + 20), sturgian.getValor());
        assertEquals(Math.min(100, base.getAggression() + 15), sturgian.getAggression());
        assertEquals(base.getCharm(), sturgian.getCharm());
    }

    @Test
    void shouldTreatCrownedFactionLeadersAsRulers() {
        assertTrue(PersonalityService.isRuler(
                AgentProfile.builder().id("King_Caladog_Battania").factionLeader(true).build()));
        assertFalse(PersonalityService.isRuler(
                AgentProfile.builder().id("King_Caladog_Battania").factionLeader(false).build()));
        assertFalse(PersonalityService.isRuler(
                AgentProfile.builder().id(LORD).factionLeader(true).build()));
    }
}
