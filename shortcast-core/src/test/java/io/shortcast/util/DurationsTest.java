package io.shortcast.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;

class DurationsTest {

    @Test
    void formatsElapsedTime() {
        assertEquals("42s", Durations.format(Duration.ofSeconds(42)));
        assertEquals("3m 5s", Durations.format(Duration.ofSeconds(185)));
        assertEquals("1h 0m 12s", Durations.format(Duration.ofSeconds(3612)));
        assertEquals("0s", Durations.format(Duration.ofSeconds(-5)));
    }

    @Test
    void formatsRemainingCooldown() {
        assertEquals("3h 45m", Durations.formatHoursMinutes(Duration.ofMinutes(225)));
        assertEquals("0h 0m", Durations.formatHoursMinutes(Duration.ofSeconds(59)));
    }
}
