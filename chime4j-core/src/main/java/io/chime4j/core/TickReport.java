package io.chime4j.core;

import java.time.Instant;

/**
 * Summary of one notification tick.
 *
 * candidates      : (schedule, period, occurrence date) tuples evaluated
 * sent            : notifications delivered for this minute
 * duplicates      : instants skipped because the ledger already had them
 * deliveryFailures: handled instants whose resolution or delivery failed
 * ledgerFailures  : instants whose ledger read or write failed
 * lockContended   : the tick did not run because another run held the tick lock
 */
public record TickReport(
        Instant minute,
        int candidates,
        int sent,
        int duplicates,
        int deliveryFailures,
        int ledgerFailures,
        boolean lockContended
) {

    public static TickReport skipped(Instant minute, boolean lockContended) {
        return new TickReport(minute, 0, 0, 0, 0, 0, lockContended);
    }

    public boolean hasFailures() {
        return deliveryFailures > 0 || ledgerFailures > 0;
    }
}
