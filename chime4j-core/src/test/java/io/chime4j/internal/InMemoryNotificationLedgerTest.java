package io.chime4j.internal;

import io.chime4j.core.NotificationType;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryNotificationLedgerTest {

    private static final Instant NOTIFY_AT = Instant.parse("2025-03-10T21:00:00Z");

    @Test
    void recordShouldSucceedOnlyOncePerKey() {
        InMemoryNotificationLedger ledger = new InMemoryNotificationLedger();

        assertFalse(ledger.alreadySent("p-1", NotificationType.BEFORE, NOTIFY_AT));
        assertTrue(ledger.recordSent("p-1", NotificationType.BEFORE, NOTIFY_AT, NOTIFY_AT));
        assertFalse(ledger.recordSent("p-1", NotificationType.BEFORE, NOTIFY_AT.plusSeconds(20), NOTIFY_AT));

        assertTrue(ledger.alreadySent("p-1", NotificationType.BEFORE, NOTIFY_AT));
        assertEquals(1, ledger.size());
    }

    @Test
    void typeAndPeriodShouldBePartOfTheKey() {
        InMemoryNotificationLedger ledger = new InMemoryNotificationLedger();
        ledger.recordSent("p-1", NotificationType.BEFORE, NOTIFY_AT, NOTIFY_AT);

        assertFalse(ledger.alreadySent("p-1", NotificationType.AFTER, NOTIFY_AT));
        assertFalse(ledger.alreadySent("p-2", NotificationType.BEFORE, NOTIFY_AT));
        assertFalse(ledger.alreadySent("p-1", NotificationType.BEFORE, NOTIFY_AT.plusSeconds(60)));
    }
}
