package me.golemcore.calradia.domain.service;

import me.golemcore.calradia.domain.model.MemoryEntry;
import me.golemcore.calradia.infrastructure.config.CalradiaProperties;
import me.golemcore.calradia.testsupport.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AgentMemoryServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T10:00:00Z");

    private MutableClock clock;
    private AgentMemoryService memory;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        memory = new AgentMemoryService(5, clock);
    }

    // ===== remember() =====

    @Test
    void shouldNeverHoldMoreThanCapacityAndEvictOldestFirst() {
        for (int i = 1; i <= 8; i++) {
            memory.remember("lord", "Pravend", "decision " + i, "Action" + i);
        }

        List<MemoryEntry> entries = memory.getEntries("lord");
        assertEquals(5, entries.size());
        assertEquals("Action4", entries.get(0).action());
        assertEquals("Action8", entries.get(4).action());
    }

    @Test
    void shouldUseConfiguredCapacity() {
        CalradiaProperties properties = new CalradiaProperties();
        properties.getMemory().setCapacity(2);
        AgentMemoryService configured = new AgentMemoryService(properties, clock);

        configured.remember("lord", "A", "one", "Wait");
        configured.remember("lord", "A", "two", "Trade");
        configured.remember("lord", "A", "three", "Attack");

        assertEquals(2, configured.getEntries("lord").size());
        assertEquals("Trade", configured.getEntries("lord").get(0).action());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new AgentMemoryService(0, clock));
    }

    @Test
    void shouldTreatAgentIdsCaseInsensitively() {
        memory.remember("Lord_Aldric", "Pravend", "hold", "Wait");

        assertEquals(1, memory.getEntries("lord_aldric").size());
    }

    // ===== getContext() =====

    @Test
    void shouldReturnSentinelWhenNoHistory() {
        assertEquals(AgentMemoryService.NO_HISTORY, memory.getContext("nobody"));
    }

    @Test
    void shouldRenderNumberedListWithRelativeAge() {
        memory.remember("lord", "Pravend", "Raise taxes for the war", "Trade");
        clock.advance(Duration.ofMinutes(10));
        memory.remember("lord", "Pravend", "Empire is hostile", "DeclareWar");
        clock.advance(Duration.ofSeconds(30));

        String context = memory.getContext("lord");

        assertTrue(context.startsWith("Your last 2 decisions:"));
        assertTrue(context.contains("  1. [10 minutes ago] Trade: Raise taxes for the war"));
        assertTrue(context.contains("  2. [just now] DeclareWar: Empire is hostile"));
    }

    @Test
    void shouldUseSingularMinute() {
        memory.remember("lord", "Pravend", "wait", "Wait");
        clock.advance(Duration.ofSeconds(90));

        assertTrue(memory.getContext("lord").contains("[1 minute ago]"));
    }

    @Test
    void shouldTruncateLongDecisionsInContext() {
        String longDecision = "x".repeat(200);
        memory.remember("lord", "Pravend", longDecision, "Wait");

        String context = memory.getContext("lord");

        assertTrue(context.contains("x".repeat(80) + "..."));
        assertFalse(context.contains("x".repeat(81)));
    }

    // ===== forget() / forgetAll() =====

    @Test
    void shouldForgetSingleAgent() {
        memory.remember("a", "X", "d", "Wait");
        memory.remember("b", "X", "d", "Wait");

        memory.forget("A");

        assertEquals(AgentMemoryService.NO_HISTORY, memory.getContext("a"));
        assertEquals(1, memory.totalMemories());
    }

    @Test
    void shouldForgetAll() {
        memory.remember("a", "X", "d", "Wait");
        memory.remember("b", "X", "d", "Wait");

        memory.forgetAll();

        assertEquals(0, memory.totalMemories());
    }

    // ===== concurrency =====

    @Test
    void shouldStayBoundedUnderConcurrentWrites() throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        try {
            for (int t = 0; t < 4; t++) {
                int thread = t;
                executor.execute(() -> {
                    for (int i = 0; i < 200; i++) {
                        memory.remember("shared", "X", "d" + thread + "-" + i, "Wait");
                        memory.getContext("shared");
                    }
                    done.countDown();
                });
            }
            assertTrue(done.await(10, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }

        assertEquals(5, memory.getEntries("shared").size());
        assertEquals(5, memory.totalMemories());
    }
}
