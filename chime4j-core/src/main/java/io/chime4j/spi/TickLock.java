package io.chime4j.spi;

import java.time.Duration;

/**
 * Lease preventing two ticks from running at the same time.
 */
public interface TickLock {

    /**
     * @return true if {@code owner} now holds the lease named {@code name} for {@code lifetime}
     */
    boolean tryAcquire(String name, String owner, Duration lifetime);

    void release(String name, String owner);
}
