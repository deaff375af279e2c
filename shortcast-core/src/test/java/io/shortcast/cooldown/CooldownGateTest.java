package io.shortcast.cooldown;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CooldownGateTest {
    private static final Instant LAST = Instant.parse("2024-05-01T00:10:00Z");

    @Test
    void forceAlwaysFetches() {
        assertTrue(CooldownGate.shouldFetch(LAST, Optional.of(LAST), 24, true));
        assertTrue(CooldownGate.shouldFetch(LAST.plusSeconds(1), Optional.of(LAST), 24, true));
    }

    @Test
    void firstRunFetches() {
        assertTrue(CooldownGate.shouldFetch(LAST, Optional.empty(), 24, false));
    }

    @Test
    void strictlyBeforeBoundaryDoesNotFetch() {
        Instant justBefore = LAST.plus(Duration.ofHours(24)).minusNanos(1);

        assertFalse(CooldownGate.shouldFetch(justBefore, Optional.of(LAST), 24, false));
    }

    @Test
    void exactlyAtBoundaryFetches() {
        assertTrue(CooldownGate.shouldFetch(LAST.plus(Duration.ofHours(24)), Optional.of(LAST), 24, false));
        assertTrue(CooldownGate.shouldFetch(LAST.plus(Duration.ofHours(6)), Optional.of(LAST), 6, false));
    }

    @Test
    void afterBoundaryFetches() {
        assertTrue(CooldownGate.shouldFetch(LAST.plus(Duration.ofDays(3)), Optional.of(LAST), 24, false));
    }

    @Test
    void remainingCountsDownToZero() {
        Instant now = LAST.plus(Duration.ofHours(20).plusMinutes(15));

        assertEquals(Duration.ofHours(3).plusMinutes(45), CooldownGate.remaining(now, Optional.of(LAST), 24));
        assertEquals(Duration.ZERO, CooldownGate.remaining(LAST.plus(Duration.ofDays(2)), Optional.of(LAST), 24));
        assertEquals(Duration.ZERO, CooldownGate.remaining(now, Optional.empty(), 24));
    }
}
