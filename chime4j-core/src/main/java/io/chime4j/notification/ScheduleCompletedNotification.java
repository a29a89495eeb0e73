package io.chime4j.notification;

import io.chime4j.core.ExecutionResult;
import io.chime4j.core.Schedule;

import java.util.List;
import java.util.Map;

/**
 * Default after-notification: the scheduled task has finished.
 *
 * <p>When produced by the executor it carries the {@link ExecutionResult}; when produced by the
 * notification tick there are no execution details.
 */
public class ScheduleCompletedNotification extends ScheduleNotification implements ExecutionAwareNotification {

    public static final String NAME = "chime.completed";

    private volatile ExecutionResult executionResult;

    public ScheduleCompletedNotification(Schedule schedule, List<NotificationChannel> channels) {
        super(schedule, channels);
    }

    @Override
    public void attachExecutionResult(ExecutionResult result) {
        this.executionResult = result;
    }

    public ExecutionResult getExecutionResult() {
        return executionResult;
    }

    @Override
    protected String kind() {
        return "schedule_completed";
    }

    @Override
    protected String subject() {
        if (executionResult != null && executionResult.isFailed()) {
            return "Schedule Failed: " + scheduleName();
        }
        return "Schedule Completed: " + scheduleName();
    }

    @Override
    protected String headline() {
        if (executionResult != null && executionResult.isFailed()) {
            return "Your scheduled task \"" + scheduleName() + "\" has failed.";
        }
        return "Your scheduled task \"" + scheduleName() + "\" has been completed.";
    }

    @Override
    protected void appendMailLines(List<String> lines) {
        lines.add("Started at: " + schedule.startDate());
        ExecutionResult r = executionResult;
        if (r != null) {
            Map<String, Object> details = r.toDetails();
            lines.add("Duration: " + details.get("duration"));
            lines.add("Status: " + details.get("status"));
            if (r.isFailed()) {
                lines.add("Error: " + r.error());
            }
        }
    }

    @Override
    protected void appendData(Map<String, Object> data) {
        data.put("end_date", schedule.endDate() == null ? null : schedule.endDate().toString());
        ExecutionResult r = executionResult;
        data.put("execution_details", r == null ? null : r.toDetails());
    }
}
