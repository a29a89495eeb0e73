package io.chime4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Mongo document model for schedules, with their periods embedded.
 *
 * <p>{@code beforeNotificationTime}/{@code afterNotificationTime} hold either a single minute value
 * or a list of them. The notification class fields hold {@link io.chime4j.NotificationFactory} names.
 */
@Document(collection = "schedules")
public class ScheduleDocument {

    @Id
    private String id;

    private String name;
    private String description;
    private String schedulableType;
    private String schedulableId;
    private String schedulableName;
    private String scheduleType;

    private LocalDate startDate;
    private LocalDate endDate;
    private boolean recurring;
    private String frequency;
    private Map<String, Object> frequencyConfig;
    private Map<String, Object> metadata;
    private boolean active = true;

    private boolean notifyBefore;
    private boolean notifyAfter;
    private Object beforeNotificationTime;
    private Object afterNotificationTime;
    private String beforeNotificationClass;
    private String afterNotificationClass;
    private Map<String, Object> beforeNotificationData;
    private Map<String, Object> afterNotificationData;

    private List<SchedulePeriodDocument> periods = new ArrayList<>();

    public ScheduleDocument() {
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSchedulableType() {
        return schedulableType;
    }

    public void setSchedulableType(String schedulableType) {
        this.schedulableType = schedulableType;
    }

    public String getSchedulableId() {
        return schedulableId;
    }

    public void setSchedulableId(String schedulableId) {
        this.schedulableId = schedulableId;
    }

    public String getSchedulableName() {
        return schedulableName;
    }

    public void setSchedulableName(String schedulableName) {
        this.schedulableName = schedulableName;
    }

    public String getScheduleType() {
        return scheduleType;
    }

    public void setScheduleType(String scheduleType) {
        this.scheduleType = scheduleType;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public void setStartDate(LocalDate startDate) {
        this.startDate = startDate;
    }

    public LocalDate getEndDate() {
        return endDate;
    }

    public void setEndDate(LocalDate endDate) {
        this.endDate = endDate;
    }

    public boolean isRecurring() {
        return recurring;
    }

    public void setRecurring(boolean recurring) {
        this.recurring = recurring;
    }

    public String getFrequency() {
        return frequency;
    }

    public void setFrequency(String frequency) {
        this.frequency = frequency;
    }

    public Map<String, Object> getFrequencyConfig() {
        return frequencyConfig;
    }

    public void setFrequencyConfig(Map<String, Object> frequencyConfig) {
        this.frequencyConfig = frequencyConfig;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public boolean isNotifyBefore() {
        return notifyBefore;
    }

    public void setNotifyBefore(boolean notifyBefore) {
        this.notifyBefore = notifyBefore;
    }

    public boolean isNotifyAfter() {
        return notifyAfter;
    }

    public void setNotifyAfter(boolean notifyAfter) {
        this.notifyAfter = notifyAfter;
    }

    public Object getBeforeNotificationTime() {
        return beforeNotificationTime;
    }

    public void setBeforeNotificationTime(Object beforeNotificationTime) {
        this.beforeNotificationTime = beforeNotificationTime;
    }

    public Object getAfterNotificationTime() {
        return afterNotificationTime;
    }

    public void setAfterNotificationTime(Object afterNotificationTime) {
        this.afterNotificationTime = afterNotificationTime;
    }

    public String getBeforeNotificationClass() {
        return beforeNotificationClass;
    }

    public void setBeforeNotificationClass(String beforeNotificationClass) {
        this.beforeNotificationClass = beforeNotificationClass;
    }

    public String getAfterNotificationClass() {
        return afterNotificationClass;
    }

    public void setAfterNotificationClass(String afterNotificationClass) {
        this.afterNotificationClass = afterNotificationClass;
    }

    public Map<String, Object> getBeforeNotificationData() {
        return beforeNotificationData;
    }

    public void setBeforeNotificationData(Map<String, Object> beforeNotificationData) {
        this.beforeNotificationData = beforeNotificationData;
    }

    public Map<String, Object> getAfterNotificationData() {
        return afterNotificationData;
    }

    public void setAfterNotificationData(Map<String, Object> afterNotificationData) {
        this.afterNotificationData = afterNotificationData;
    }

    public List<SchedulePeriodDocument> getPeriods() {
        return periods;
    }

    public void setPeriods(List<SchedulePeriodDocument> periods) {
        this.periods = periods;
    }
}
