package io.chime4j.internal;

import io.chime4j.core.CandidatePeriod;
import io.chime4j.core.DeliveryResult;
import io.chime4j.core.NotificationSettings;
import io.chime4j.core.NotificationType;
import io.chime4j.core.TickReport;
import io.chime4j.spi.NotificationLedger;
import io.chime4j.spi.TickLock;
import io.chime4j.utils.OffsetCalculator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Objects;

/**
 * One notification tick: sends every before/after notification whose notify-at instant is the
 * current minute, each at most once per (period, type, notify-at).
 *
 * <p>Failures are contained per instant: a failed delivery or ledger access is logged and the
 * tick moves on to the next instant and period.
 */
public class NotificationTick {
    private static final Logger log = LoggerFactory.getLogger(NotificationTick.class);

    public static final String LOCK_NAME = "chime.notify";

    private final RecurrenceMatcher matcher;
    private final NotificationDispatcher dispatcher;
    private final NotificationLedger ledger;
    private final TickLock tickLock;
    private final Clock clock;
    private final String owner;
    private final Duration lockLifetime;

    public NotificationTick(RecurrenceMatcher matcher,
                            NotificationDispatcher dispatcher,
                            NotificationLedger ledger,
                            TickLock tickLock,
                            Clock clock,
                            String owner,
                            Duration lockLifetime) {
        this.matcher = Objects.requireNonNull(matcher, "matcher must not be null");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.ledger = Objects.requireNonNull(ledger, "ledger must not be null");
        this.tickLock = Objects.requireNonNull(tickLock, "tickLock must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.owner = Objects.requireNonNull(owner, "owner must not be null");
        this.lockLifetime = Objects.requireNonNull(lockLifetime, "lockLifetime must not be null");
        if (lockLifetime.isZero() || lockLifetime.isNegative()) {
            throw new IllegalArgumentException("lockLifetime must be a positive duration");
        }
    }

    public TickReport run() {
        Instant minute = clock.instant().truncatedTo(ChronoUnit.MINUTES);
        NotificationSettings settings = dispatcher.settings();

        if (!settings.enabled()) {
            log.debug("chime tick skipped, notifications disabled minute={}", minute);
            return TickReport.skipped(minute, false);
        }

        if (!tickLock.tryAcquire(LOCK_NAME, owner, lockLifetime)) {
            log.warn("chime tick skipped, lock held by another run minute={} owner={}", minute, owner);
            return TickReport.skipped(minute, true);
        }

        try {
            Counters counters = new Counters();
            LocalDate today = LocalDate.ofInstant(minute, clock.getZone());
            for (LocalDate date : occurrenceDates(today, settings.crossMidnight())) {
                matcher.candidatePeriods(date).forEach(candidate -> {
                    counters.candidates++;
                    process(candidate, minute, counters);
                });
            }

            TickReport report = counters.toReport(minute);
            log.debug("chime tick finished minute={} candidates={} sent={} duplicates={} deliveryFailures={} ledgerFailures={}",
                    minute, report.candidates(), report.sent(), report.duplicates(),
                    report.deliveryFailures(), report.ledgerFailures());
            return report;
        } finally {
            tickLock.release(LOCK_NAME, owner);
        }
    }

    private static List<LocalDate> occurrenceDates(LocalDate today, boolean crossMidnight) {
        if (!crossMidnight) {
            return List.of(today);
        }
        return List.of(today.minusDays(1), today, today.plusDays(1));
    }

    private void process(CandidatePeriod candidate, Instant minute, Counters counters) {
        for (NotificationType type : NotificationType.values()) {
            if (!dispatcher.shouldNotify(candidate.schedule(), type)) {
                continue;
            }
            List<Instant> instants = OffsetCalculator.notifyInstants(
                    type.anchorDate(candidate.date(), candidate.period()),
                    type.anchor(candidate.period()),
                    type.hookOf(candidate.schedule()).offsets(),
                    type,
                    clock.getZone()
            );
            for (Instant notifyAt : instants) {
                if (notifyAt.equals(minute)) {
                    fireOnce(candidate, type, notifyAt, counters);
                }
            }
        }
    }

    private void fireOnce(CandidatePeriod candidate, NotificationType type, Instant notifyAt, Counters counters) {
        String scheduleId = candidate.schedule().id();
        String periodId = candidate.period().id();

        boolean alreadySent;
        try {
            alreadySent = ledger.alreadySent(periodId, type, notifyAt);
        } catch (RuntimeException e) {
            counters.ledgerFailures++;
            log.error("chime ledger lookup failed scheduleId={} periodId={} type={} notifyAt={} msg={}",
                    scheduleId, periodId, type.value(), notifyAt, e.getMessage(), e);
            return;
        }
        if (alreadySent) {
            counters.duplicates++;
            log.debug("chime {} notification already sent periodId={} notifyAt={}", type.value(), periodId, notifyAt);
            return;
        }

        DeliveryResult result = dispatcher.send(candidate.schedule(), periodId, type, null);
        if (result.isFailed()) {
            counters.deliveryFailures++;
        }

        // recorded even when delivery failed, so a failing notification is not retried every minute
        try {
            if (!ledger.recordSent(periodId, type, notifyAt, clock.instant())) {
                log.warn("chime {} notification already recorded by a concurrent run periodId={} notifyAt={}",
                        type.value(), periodId, notifyAt);
            }
        } catch (RuntimeException e) {
            counters.ledgerFailures++;
            log.error("chime ledger write failed, notification may be sent again scheduleId={} periodId={} type={} notifyAt={} msg={}",
                    scheduleId, periodId, type.value(), notifyAt, e.getMessage(), e);
            return;
        }

        if (result.sent()) {
            counters.sent++;
            log.info("chime sent {} notification scheduleId={} periodId={} notifyAt={}",
                    type.value(), scheduleId, periodId, notifyAt);
        }
    }

    private static final class Counters {
        int candidates;
        int sent;
        int duplicates;
        int deliveryFailures;
        int ledgerFailures;

        TickReport toReport(Instant minute) {
            return new TickReport(minute, candidates, sent, duplicates, deliveryFailures, ledgerFailures, false);
        }
    }
}
