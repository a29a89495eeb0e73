package io.chime4j;

import io.chime4j.core.BatchOutcome;
import io.chime4j.core.Schedule;

import java.util.Collection;
import java.util.Map;

/**
 * Runs work tied to a schedule, wrapped in the schedule's before/after notifications.
 *
 * <p>Notifications sent here do not go through the dedup ledger.
 */
public interface ScheduleExecutor {

    /**
     * Send the before-notification, run {@code task}, then send the after-notification with the
     * execution details. A failure of the task is re-thrown after the after-notification went out;
     * notification failures are logged only.
     *
     * @param task work to run; null runs nothing
     * @return the task's result, or null without a task
     */
    <T> T execute(Schedule schedule, ScheduleTask<T> task) throws Exception;

    default Object execute(Schedule schedule) throws Exception {
        return execute(schedule, null);
    }

    /**
     * Execute every schedule independently. A failing schedule is recorded and does not stop the rest.
     *
     * @return outcome per schedule id, in iteration order
     */
    <T> Map<String, BatchOutcome<T>> executeBatch(Collection<Schedule> schedules, ScheduleTask<T> task);
}
