package io.chime4j.core;

import java.time.Duration;
import java.time.LocalTime;
import java.util.Objects;

/**
 * A time-of-day slot of a schedule. Carries no date; it recurs on every day the schedule matches.
 */
public record SchedulePeriod(String id, LocalTime startTime, LocalTime endTime) {

    public SchedulePeriod {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(startTime, "startTime must not be null");
        Objects.requireNonNull(endTime, "endTime must not be null");
    }

    /**
     * True when the slot ends after midnight, on the day after it starts.
     */
    public boolean endsNextDay() {
        return endTime.isBefore(startTime);
    }

    public long durationMinutes() {
        Duration d = Duration.between(startTime, endTime);
        if (endsNextDay()) {
            d = d.plusDays(1);
        }
        return d.toMinutes();
    }
}
