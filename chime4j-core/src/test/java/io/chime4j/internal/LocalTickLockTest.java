package io.chime4j.internal;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class LocalTickLockTest {

    private static final Duration LIFETIME = Duration.ofSeconds(55);

    @Test
    void secondOwnerShouldNotAcquireAHeldLock() {
        LocalTickLock lock = new LocalTickLock(Clock.fixed(Instant.parse("2025-03-10T21:00:00Z"), ZoneOffset.UTC));

        assertTrue(lock.tryAcquire("chime.notify", "worker-A", LIFETIME));
        assertFalse(lock.tryAcquire("chime.notify", "worker-B", LIFETIME));
        assertTrue(lock.tryAcquire("other", "worker-B", LIFETIME));
    }

    @Test
    void releaseShouldOnlyWorkForTheOwner() {
        LocalTickLock lock = new LocalTickLock(Clock.fixed(Instant.parse("2025-03-10T21:00:00Z"), ZoneOffset.UTC));
        lock.tryAcquire("chime.notify", "worker-A", LIFETIME);

        lock.release("chime.notify", "worker-B");
        assertFalse(lock.tryAcquire("chime.notify", "worker-B", LIFETIME));

        lock.release("chime.notify", "worker-A");
        assertTrue(lock.tryAcquire("chime.notify", "worker-B", LIFETIME));
    }

    @Test
    void expiredLeaseShouldBeTakenOver() {
        Instant start = Instant.parse("2025-03-10T21:00:00Z");
        Clock clock = mock(Clock.class);
        when(clock.instant()).thenReturn(start, start.plusSeconds(30), start.plusSeconds(56));
        LocalTickLock lock = new LocalTickLock(clock);

        assertTrue(lock.tryAcquire("chime.notify", "worker-A", LIFETIME));
        assertFalse(lock.tryAcquire("chime.notify", "worker-B", LIFETIME));
        assertTrue(lock.tryAcquire("chime.notify", "worker-B", LIFETIME));
    }
}
