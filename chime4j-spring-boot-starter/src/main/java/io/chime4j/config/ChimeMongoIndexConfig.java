package io.chime4j.config;

import io.chime4j.internal.mongo.NotificationLedgerDocument;
import io.chime4j.internal.mongo.ScheduleDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for schedule notifications.
 *
 * <p><b>Important:</b> indexes are only created at startup when
 * {@code chime.ensure-indexes-on-startup=true}. Otherwise manage them with your migrations.
 * The ledger's unique index is what makes concurrent ticks safe: without it two overlapping runs
 * may both send the same notification.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>ux_period_type_notify_at</b> (unique, collection {@code schedule_notifications}):
 *       { schedulePeriodId: 1, type: 1, notifyAt: 1 }</li>
 *   <li><b>idx_active_frequency_dates</b> (collection {@code schedules}):
 *       { active: 1, frequency: 1, startDate: 1, endDate: 1 }
 *       <br/>Used by the per-tick candidate query.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.schedule_notifications.createIndex(
 *   { schedulePeriodId: 1, type: 1, notifyAt: 1 },
 *   { name: "ux_period_type_notify_at", unique: true }
 * );
 * db.schedules.createIndex(
 *   { active: 1, frequency: 1, startDate: 1, endDate: 1 },
 *   { name: "idx_active_frequency_dates" }
 * );
 * </pre>
 */
public class ChimeMongoIndexConfig {

    public static final String UX_PERIOD_TYPE_NOTIFY_AT = "ux_period_type_notify_at";
    public static final String IDX_ACTIVE_FREQUENCY_DATES = "idx_active_frequency_dates";

    private final MongoTemplate mongoTemplate;

    public ChimeMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(NotificationLedgerDocument.class).ensureIndex(ledgerUniqueIndex());
        mongoTemplate.indexOps(ScheduleDocument.class).ensureIndex(candidateIndex());
    }

    public static Index ledgerUniqueIndex() {
        return new Index()
                .on("schedulePeriodId", Sort.Direction.ASC)
                .on("type", Sort.Direction.ASC)
                .on("notifyAt", Sort.Direction.ASC)
                .unique()
                .named(UX_PERIOD_TYPE_NOTIFY_AT);
    }

    public static Index candidateIndex() {
        return new Index()
                .on("active", Sort.Direction.ASC)
                .on("frequency", Sort.Direction.ASC)
                .on("startDate", Sort.Direction.ASC)
                .on("endDate", Sort.Direction.ASC)
                .named(IDX_ACTIVE_FREQUENCY_DATES);
    }
}
