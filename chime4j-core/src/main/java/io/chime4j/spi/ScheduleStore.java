package io.chime4j.spi;

import io.chime4j.core.Schedule;

import java.time.LocalDate;
import java.util.List;

/**
 * Read access to schedules and their periods.
 */
public interface ScheduleStore {

    /**
     * Schedules that may be due on {@code date}: active, within date bounds, with a recurrence
     * selecting that date. Implementations may return a superset; callers filter again.
     */
    List<Schedule> findCandidates(LocalDate date);
}
