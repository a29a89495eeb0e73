package io.chime4j.spi;

import io.chime4j.core.NotificationType;

import java.time.Instant;

/**
 * Persistent record of handled (period, type, notify-at) triples. The authority for sending
 * each notification at most once.
 *
 * <p>{@code notifyAt} is always truncated to the minute.
 */
public interface NotificationLedger {

    boolean alreadySent(String periodId, NotificationType type, Instant notifyAt);

    /**
     * Record a handled triple, whether delivery succeeded or not.
     *
     * @return true if recorded, false if the triple was already present (recorded concurrently)
     * @throws io.chime4j.core.LedgerWriteException if the record could not be written
     */
    boolean recordSent(String periodId, NotificationType type, Instant notifyAt, Instant sentAt);
}
