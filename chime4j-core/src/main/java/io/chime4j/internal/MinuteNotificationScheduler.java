package io.chime4j.internal;

import io.chime4j.NotificationScheduler;
import io.chime4j.core.TickReport;
import io.chime4j.utils.TickIntervals;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a {@link NotificationTick} on its own daemon thread, by default once per minute at :00.
 *
 * <p>Ticks never overlap within one scheduler: the poller thread runs them one after another.
 * Overlap across processes is prevented by the tick's {@link io.chime4j.spi.TickLock}.
 *
 * <pre>{@code
 * scheduler.start();
 * ...
 * scheduler.stop();
 * }</pre>
 */
public class MinuteNotificationScheduler implements NotificationScheduler {
    private static final Logger log = LoggerFactory.getLogger(MinuteNotificationScheduler.class);

    private static final int MAX_BACKOFF_FAILURES = 10;

    private final NotificationTick tick;
    private final String tickSpec;
    private final Clock clock;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private Thread pollerThread;
    private int systemErrorCount = 0;

    public MinuteNotificationScheduler(NotificationTick tick, String tickSpec, Clock clock) {
        this.tick = Objects.requireNonNull(tick, "tick must not be null");
        this.tickSpec = tickSpec == null || tickSpec.isBlank() ? TickIntervals.EVERY_MINUTE : tickSpec;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        // fail fast on a bad tick-every value
        TickIntervals.untilNextTick(this.tickSpec, clock.getZone(), clock.instant());
    }

    /**
     * Start polling. Idempotent.
     */
    @Override
    public synchronized void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        log.info("chime notification scheduler starting with tickEvery={} zone={}", tickSpec, clock.getZone());

        pollerThread = new Thread(this::pollerLoop);
        pollerThread.setName("chime.poller");
        pollerThread.setDaemon(true);
        pollerThread.start();
    }

    /**
     * Stop polling. Idempotent. A tick in progress is allowed to finish.
     */
    @Override
    public synchronized void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }
        log.info("chime notification scheduler stopping...");
        if (pollerThread != null) {
            pollerThread.interrupt();
            pollerThread = null;
        }
        log.info("chime notification scheduler stopped.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public TickReport tick() {
        return tick.run();
    }

    private void pollerLoop() {
        while (started.get()) {
            try {
                Thread.sleep(delayUntilNextTick().toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            if (!started.get()) {
                break;
            }

            try {
                TickReport report = tick.run();
                systemErrorCount = 0;
                if (report.hasFailures()) {
                    log.warn("chime tick had failures minute={} deliveryFailures={} ledgerFailures={}",
                            report.minute(), report.deliveryFailures(), report.ledgerFailures());
                }
            } catch (Exception e) {
                systemErrorCount++;
                log.error("chime tick failed consecutiveFailures={} msg={}", systemErrorCount, e.getMessage(), e);
                try {
                    Thread.sleep(backoff(systemErrorCount).toMillis());
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    private Duration delayUntilNextTick() {
        Instant now = clock.instant();
        Duration delay = TickIntervals.untilNextTick(tickSpec, clock.getZone(), now);
        return delay.isNegative() ? Duration.ZERO : delay;
    }

    // Exponential backoff for repeated tick failures, on top of the regular tick delay.
    static Duration backoff(int failCount) {
        int exp = Math.max(0, Math.min(failCount, MAX_BACKOFF_FAILURES));
        long ms = Math.min(1000L * (1L << exp), 60_000L);
        return Duration.ofMillis(ms);
    }
}
