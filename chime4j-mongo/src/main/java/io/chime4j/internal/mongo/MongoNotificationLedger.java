package io.chime4j.internal.mongo;

import io.chime4j.core.LedgerWriteException;
import io.chime4j.core.NotificationType;
import io.chime4j.spi.NotificationLedger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Dedup ledger in the {@code schedule_notifications} collection.
 *
 * <p>Exactly-once across concurrent runs relies on the unique index
 * {@code ux_period_type_notify_at}: the second insert of a triple fails with a duplicate key and
 * {@link #recordSent} reports {@code false}.
 */
public class MongoNotificationLedger implements NotificationLedger {

    private final MongoTemplate mongoTemplate;

    public MongoNotificationLedger(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public boolean alreadySent(String periodId, NotificationType type, Instant notifyAt) {
        return mongoTemplate.exists(keyQuery(periodId, type, notifyAt), NotificationLedgerDocument.class);
    }

    @Override
    public boolean recordSent(String periodId, NotificationType type, Instant notifyAt, Instant sentAt) {
        Objects.requireNonNull(sentAt, "sentAt must not be null");

        NotificationLedgerDocument doc = new NotificationLedgerDocument();
        doc.setSchedulePeriodId(Objects.requireNonNull(periodId, "periodId must not be null"));
        doc.setType(Objects.requireNonNull(type, "type must not be null").value());
        doc.setNotifyAt(minute(notifyAt));
        doc.setCreatedAt(sentAt);

        try {
            mongoTemplate.insert(doc);
            return true;
        } catch (DuplicateKeyException e) {
            return false;
        } catch (DataAccessException e) {
            throw new LedgerWriteException(
                    "Failed to record " + type.value() + " notification for period " + periodId + " at " + doc.getNotifyAt(), e);
        }
    }

    private static Query keyQuery(String periodId, NotificationType type, Instant notifyAt) {
        Objects.requireNonNull(periodId, "periodId must not be null");
        Objects.requireNonNull(type, "type must not be null");
        return new Query(Criteria.where("schedulePeriodId").is(periodId)
                .and("type").is(type.value())
                .and("notifyAt").is(minute(notifyAt)));
    }

    private static Instant minute(Instant notifyAt) {
        return Objects.requireNonNull(notifyAt, "notifyAt must not be null").truncatedTo(ChronoUnit.MINUTES);
    }
}
