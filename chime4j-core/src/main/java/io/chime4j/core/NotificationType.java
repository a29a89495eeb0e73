package io.chime4j.core;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Direction of a schedule notification relative to its period.
 */
public enum NotificationType {
    /**
     * Fires {@code m} minutes before the period starts.
     */
    BEFORE("before") {
        @Override
        public LocalTime anchor(SchedulePeriod period) {
            return period.startTime();
        }

        @Override
        public LocalDate anchorDate(LocalDate occurrence, SchedulePeriod period) {
            return occurrence;
        }

        @Override
        public ZonedDateTime shift(ZonedDateTime anchor, int minutes) {
            return anchor.minusMinutes(minutes);
        }

        @Override
        public NotificationHook hookOf(Schedule schedule) {
            return schedule.beforeHook();
        }
    },
    /**
     * Fires {@code m} minutes after the period ends.
     */
    AFTER("after") {
        @Override
        public LocalTime anchor(SchedulePeriod period) {
            return period.endTime();
        }

        @Override
        public LocalDate anchorDate(LocalDate occurrence, SchedulePeriod period) {
            return period.endsNextDay() ? occurrence.plusDays(1) : occurrence;
        }

        @Override
        public ZonedDateTime shift(ZonedDateTime anchor, int minutes) {
            return anchor.plusMinutes(minutes);
        }

        @Override
        public NotificationHook hookOf(Schedule schedule) {
            return schedule.afterHook();
        }
    };

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    /**
     * Persisted value ("before" / "after").
     */
    public String value() {
        return value;
    }

    public abstract LocalTime anchor(SchedulePeriod period);

    /**
     * Date {@link #anchor(SchedulePeriod)} falls on for the occurrence of {@code period} starting on {@code occurrence}.
     */
    public abstract LocalDate anchorDate(LocalDate occurrence, SchedulePeriod period);

    public abstract ZonedDateTime shift(ZonedDateTime anchor, int minutes);

    public abstract NotificationHook hookOf(Schedule schedule);

    public static NotificationType fromValue(String value) {
        for (NotificationType t : values()) {
            if (t.value.equalsIgnoreCase(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown notification type: " + value);
    }
}
