package io.chime4j.internal.mongo;

/**
 * Embedded period of a {@link ScheduleDocument}. Times are stored as "HH:mm" or "HH:mm:ss".
 */
public class SchedulePeriodDocument {

    private String id;
    private String startTime;
    private String endTime;

    public SchedulePeriodDocument() {
    }

    public SchedulePeriodDocument(String id, String startTime, String endTime) {
        this.id = id;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getStartTime() {
        return startTime;
    }

    public void setStartTime(String startTime) {
        this.startTime = startTime;
    }

    public String getEndTime() {
        return endTime;
    }

    public void setEndTime(String endTime) {
        this.endTime = endTime;
    }
}
