package io.chime4j.internal;

import io.chime4j.ScheduleExecutor;
import io.chime4j.ScheduleTask;
import io.chime4j.core.BatchOutcome;
import io.chime4j.core.ExecutionResult;
import io.chime4j.core.NotificationType;
import io.chime4j.core.Schedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Wraps schedule work in before/after notifications.
 *
 * <p>Holds no per-call state; concurrent executions only share what the tasks themselves touch.
 */
public class DefaultScheduleExecutor implements ScheduleExecutor {
    private static final Logger log = LoggerFactory.getLogger(DefaultScheduleExecutor.class);

    private final NotificationDispatcher dispatcher;
    private final Clock clock;

    public DefaultScheduleExecutor(NotificationDispatcher dispatcher, Clock clock) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public <T> T execute(Schedule schedule, ScheduleTask<T> task) throws Exception {
        Objects.requireNonNull(schedule, "schedule must not be null");

        Instant startedAt = clock.instant();
        dispatcher.send(schedule, NotificationType.BEFORE, null);

        T result;
        try {
            result = task == null ? null : task.run(schedule);
        } catch (Exception e) {
            Instant failedAt = clock.instant();
            log.error("chime schedule execution failed scheduleId={} msg={}", schedule.id(), e.getMessage(), e);
            dispatcher.send(schedule, NotificationType.AFTER, ExecutionResult.failed(errorMessage(e), startedAt, failedAt));
            throw e;
        }

        dispatcher.send(schedule, NotificationType.AFTER, ExecutionResult.completed(startedAt, clock.instant()));
        return result;
    }

    @Override
    public <T> Map<String, BatchOutcome<T>> executeBatch(Collection<Schedule> schedules, ScheduleTask<T> task) {
        Objects.requireNonNull(schedules, "schedules must not be null");

        Map<String, BatchOutcome<T>> results = new LinkedHashMap<>();
        for (Schedule schedule : schedules) {
            try {
                results.put(schedule.id(), BatchOutcome.success(execute(schedule, task)));
            } catch (Exception e) {
                results.put(schedule.id(), BatchOutcome.failed(errorMessage(e)));
            }
        }
        return results;
    }

    private static String errorMessage(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getName();
    }
}
