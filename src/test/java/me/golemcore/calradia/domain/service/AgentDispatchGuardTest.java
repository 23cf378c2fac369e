package me.golemcore.calradia.domain.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AgentDispatchGuardTest {

    @Test
    void shouldAllowOneHolderPerAgent() {
        AgentDispatchGuard guard = new AgentDispatchGuard();

        assertTrue(guard.tryAcquire("lord"));
        assertFalse(guard.tryAcquire("lord"));
        assertTrue(guard.tryAcquire("merchant"));
        assertTrue(guard.isInFlight("lord"));
        assertEquals(2, guard.inFlightCount());

        guard.release("lord");

        assertFalse(guard.isInFlight("lord"));
        assertTrue(guard.tryAcquire("lord"));
    }

    @Test
    void shouldTreatAgentIdsCaseInsensitively() {
        AgentDispatchGuard guard = new AgentDispatchGuard();

        assertTrue(guard.tryAcquire("Lord_Aldric_Vlandia"));
        assertFalse(guard.tryAcquire("LORD_ALDRIC_VLANDIA"));
        assertTrue(guard.isInFlight("lord_aldric_vlandia"));

        guard.release("lord_ALDRIC_vlandia");

        assertEquals(0, guard.inFlightCount());
    }
}
