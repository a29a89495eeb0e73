package io.chime4j.internal;

import io.chime4j.core.TickReport;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class MinuteNotificationSchedulerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2025-03-10T21:00:00Z"), ZoneOffset.UTC);

    @Test
    void startAndStopShouldBeIdempotent() {
        MinuteNotificationScheduler scheduler = new MinuteNotificationScheduler(mock(NotificationTick.class), null, clock);

        scheduler.start();
        scheduler.start();
        assertTrue(scheduler.isRunning());

        scheduler.stop();
        scheduler.stop();
        assertFalse(scheduler.isRunning());
    }

    @Test
    void manualTickShouldRunTheTick() {
        NotificationTick tick = mock(NotificationTick.class);
        TickReport report = TickReport.skipped(clock.instant(), false);
        when(tick.run()).thenReturn(report);

        assertSame(report, new MinuteNotificationScheduler(tick, "1 minute", clock).tick());
    }

    @Test
    void invalidTickSpecShouldFailFast() {
        NotificationTick tick = mock(NotificationTick.class);
        assertThrows(IllegalArgumentException.class, () -> new MinuteNotificationScheduler(tick, "every now and then", clock));
    }

    @Test
    void backoffShouldGrowAndCap() {
        assertEquals(Duration.ofSeconds(2), MinuteNotificationScheduler.backoff(1));
        assertEquals(Duration.ofSeconds(8), MinuteNotificationScheduler.backoff(3));
        assertEquals(Duration.ofSeconds(60), MinuteNotificationScheduler.backoff(50));
    }
}
