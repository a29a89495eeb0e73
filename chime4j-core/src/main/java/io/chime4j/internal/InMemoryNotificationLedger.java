package io.chime4j.internal;

import io.chime4j.core.NotificationType;
import io.chime4j.spi.NotificationLedger;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ledger kept in memory. Suitable for a single process and for tests; lost on restart.
 */
public class InMemoryNotificationLedger implements NotificationLedger {

    private record Key(String periodId, NotificationType type, Instant notifyAt) {
    }

    private final Map<Key, Instant> entries = new ConcurrentHashMap<>();

    @Override
    public boolean alreadySent(String periodId, NotificationType type, Instant notifyAt) {
        return entries.containsKey(key(periodId, type, notifyAt));
    }

    @Override
    public boolean recordSent(String periodId, NotificationType type, Instant notifyAt, Instant sentAt) {
        Objects.requireNonNull(sentAt, "sentAt must not be null");
        return entries.putIfAbsent(key(periodId, type, notifyAt), sentAt) == null;
    }

    public int size() {
        return entries.size();
    }

    private static Key key(String periodId, NotificationType type, Instant notifyAt) {
        Objects.requireNonNull(periodId, "periodId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(notifyAt, "notifyAt must not be null");
        return new Key(periodId, type, notifyAt.truncatedTo(ChronoUnit.MINUTES));
    }
}
