package io.chime4j;

import io.chime4j.core.Schedule;

/**
 * Work executed for a schedule between its before and after notifications.
 */
@FunctionalInterface
public interface ScheduleTask<T> {
    T run(Schedule schedule) throws Exception;
}
