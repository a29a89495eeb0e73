package io.chime4j.internal;

import io.chime4j.spi.TickLock;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tick lock for a single JVM. An expired lease can be taken over by another owner.
 */
public class LocalTickLock implements TickLock {

    private record Lease(String owner, Instant lockUntil) {
    }

    private final Map<String, Lease> leases = new ConcurrentHashMap<>();
    private final Clock clock;

    public LocalTickLock(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public boolean tryAcquire(String name, String owner, Duration lifetime) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(owner, "owner must not be null");
        Objects.requireNonNull(lifetime, "lifetime must not be null");

        Instant now = clock.instant();
        Lease wanted = new Lease(owner, now.plus(lifetime));
        Lease result = leases.compute(name, (n, current) -> {
            if (current == null || !current.lockUntil().isAfter(now)) {
                return wanted;
            }
            return current;
        });
        return result == wanted;
    }

    @Override
    public void release(String name, String owner) {
        leases.computeIfPresent(name, (n, current) -> current.owner().equals(owner) ? null : current);
    }
}
