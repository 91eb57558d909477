package com.tableadvisor.advisor.session;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SessionRegistryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    /** Clock that only moves when told to. */
    private static final class SteppedClock extends Clock {
        private Instant now = Instant.parse("2026-01-01T00:00:00Z");

        void advance(Duration d) {
            now = now.plus(d);
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }
        @Override public Instant instant() { return now; }
    }

    private final SteppedClock clock = new SteppedClock();
    private final SessionRegistry registry = new SessionRegistry(clock, 60_000L);

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    @Test
    void idleSessionIsEvictedAndItsStreamCompletes() {
        AdvisorSession idle = registry.start();

        clock.advance(Duration.ofSeconds(61));
        List<String> evicted = registry.evictIdle();

        assertEquals(List.of(idle.getId()), evicted);
        assertTrue(registry.find(idle.getId()).isEmpty());
        assertEquals(1, idle.states().collectList().block(TIMEOUT).size());
    }

    @Test
    void recentActivityKeepsSessionAlive() {
        AdvisorSession active = registry.start();
        AdvisorSession stale = registry.start();

        clock.advance(Duration.ofSeconds(45));
        active.touch(clock.instant());
        clock.advance(Duration.ofSeconds(30));

        List<String> evicted = registry.evictIdle();

        assertEquals(List.of(stale.getId()), evicted);
        assertTrue(registry.find(active.getId()).isPresent());
        assertEquals(1, registry.size());
    }

    @Test
    void nothingIsEvictedInsideTheTimeout() {
        registry.start();
        clock.advance(Duration.ofSeconds(60));

        assertTrue(registry.evictIdle().isEmpty());
        assertEquals(1, registry.size());
    }
}
