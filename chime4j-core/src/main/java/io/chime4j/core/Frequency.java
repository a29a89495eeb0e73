package io.chime4j.core;

import java.time.LocalDate;
import java.time.format.TextStyle;
import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/**
 * Recurrence rule of a schedule.
 *
 * <p>Only {@link #DAILY} and {@link #WEEKLY} schedules take part in the notification tick.
 */
public enum Frequency {
    NONE {
        @Override
        public boolean matches(LocalDate date, Map<String, Object> config) {
            return false;
        }
    },
    DAILY {
        @Override
        public boolean matches(LocalDate date, Map<String, Object> config) {
            return true;
        }
    },
    /**
     * Matches when the lower-cased English weekday name of the date is listed under
     * {@code config.days}, e.g. {@code {"days": ["monday", "friday"]}}.
     */
    WEEKLY {
        @Override
        public boolean matches(LocalDate date, Map<String, Object> config) {
            if (config == null || !(config.get(DAYS_KEY) instanceof Collection<?> days)) {
                return false;
            }
            String today = weekdayName(date);
            for (Object day : days) {
                if (day != null && today.equals(day.toString().trim().toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
            return false;
        }
    };

    public static final String DAYS_KEY = "days";

    public abstract boolean matches(LocalDate date, Map<String, Object> config);

    /**
     * Lower-cased English weekday name, e.g. "monday".
     */
    public static String weekdayName(LocalDate date) {
        return date.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse of a stored frequency value; blank or null means {@link #NONE}.
     */
    public static Frequency fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        return Frequency.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
