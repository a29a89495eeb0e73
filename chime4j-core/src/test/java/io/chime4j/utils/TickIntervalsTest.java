package io.chime4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TickIntervalsTest {

    private static final ZoneId UTC = ZoneOffset.UTC;

    @Test
    void everyMinuteShouldFireAtTheNextFullMinute() {
        Instant next = TickIntervals.nextTick(TickIntervals.EVERY_MINUTE, UTC, Instant.parse("2025-03-10T21:00:12Z"));
        assertEquals(Instant.parse("2025-03-10T21:01:00Z"), next);
    }

    @Test
    void everyMinuteShouldBeStrictlyAfterAFullMinute() {
        Instant next = TickIntervals.nextTick(TickIntervals.EVERY_MINUTE, UTC, Instant.parse("2025-03-10T21:00:00Z"));
        assertEquals(Instant.parse("2025-03-10T21:01:00Z"), next);
    }

    @Test
    void fiveFieldCronShouldBeSupported() {
        Duration d = TickIntervals.untilNextTick("*/5 * * * *", UTC, Instant.parse("2026-01-01T00:01:00Z"));
        assertEquals(Duration.ofMinutes(4), d);
    }

    @Test
    void humanIntervalsShouldBeParsed() {
        assertEquals(Duration.ofMinutes(1), TickIntervals.parseInterval("1 minute"));
        assertEquals(Duration.ofSeconds(90), TickIntervals.parseInterval("1 minute 30 seconds"));
        assertEquals(Duration.ofSeconds(30), TickIntervals.parseInterval("30s"));
        assertEquals(Duration.ofHours(2), TickIntervals.parseInterval("2h"));
    }

    @Test
    void zeroOrUnknownIntervalsShouldBeRejected() {
        assertThrows(IllegalArgumentException.class, () -> TickIntervals.parseInterval("0 minutes"));
        assertThrows(IllegalArgumentException.class, () -> TickIntervals.parseInterval("3 fortnights"));
        assertThrows(IllegalArgumentException.class, () -> TickIntervals.untilNextTick(" ", UTC, Instant.EPOCH));
    }

    @Test
    void looksLikeCronShouldTellCronFromIntervals() {
        assertTrue(TickIntervals.looksLikeCron("0 * * * * ?"));
        assertTrue(TickIntervals.looksLikeCron("* * * * *"));
        assertFalse(TickIntervals.looksLikeCron("1 minute"));
    }
}
