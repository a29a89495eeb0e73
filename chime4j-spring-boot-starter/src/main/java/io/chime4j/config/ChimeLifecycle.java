package io.chime4j.config;

import io.chime4j.NotificationScheduler;
import org.springframework.context.SmartLifecycle;

/**
 * Bridges the notification poller with the Spring container lifecycle.
 */
public class ChimeLifecycle implements SmartLifecycle {
    private final NotificationScheduler scheduler;
    private final boolean autoStart;

    public ChimeLifecycle(NotificationScheduler scheduler, boolean autoStart) {
        this.scheduler = scheduler;
        this.autoStart = autoStart;
    }

    @Override
    public void start() {
        scheduler.start();
    }

    @Override
    public void stop() {
        scheduler.stop();
    }

    @Override
    public boolean isRunning() {
        return scheduler.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    @Override
    public boolean isAutoStartup() {
        return autoStart;
    }
}
