package io.chime4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * One handled notification. Unique on (schedulePeriodId, type, notifyAt), see
 * {@code ux_period_type_notify_at}.
 */
@Document(collection = "schedule_notifications")
public class NotificationLedgerDocument {

    @Id
    private String id;

    private String schedulePeriodId;
    private String type;
    private Instant notifyAt;
    private Instant createdAt;

    public NotificationLedgerDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getSchedulePeriodId() {
        return schedulePeriodId;
    }

    public void setSchedulePeriodId(String schedulePeriodId) {
        this.schedulePeriodId = schedulePeriodId;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public Instant getNotifyAt() {
        return notifyAt;
    }

    public void setNotifyAt(Instant notifyAt) {
        this.notifyAt = notifyAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
