package io.chime4j;

import io.chime4j.core.TickReport;

/**
 * Main notification API.
 *
 * <p>Either let it poll by itself ({@link #start()}/{@link #stop()}), or drive it from an external
 * once-a-minute trigger through {@link #tick()}.
 */
public interface NotificationScheduler {
    void start();

    void stop();

    boolean isRunning();

    /**
     * Run one notification tick for the current minute. Safe to call repeatedly within the same minute.
     */
    TickReport tick();
}
