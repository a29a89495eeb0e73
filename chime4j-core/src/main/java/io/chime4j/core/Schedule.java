package io.chime4j.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read-only view of a schedule as consumed by the notification engine.
 *
 * <p>Schedules are created and updated elsewhere; this engine never writes them.
 */
public record Schedule(

        // identity
        String id,
        String name,
        String description,
        Schedulable schedulable,
        ScheduleType scheduleType,

        // recurrence
        LocalDate startDate,
        LocalDate endDate,
        boolean recurring,
        Frequency frequency,
        Map<String, Object> frequencyConfig,
        boolean active,

        // notifications
        NotificationHook beforeHook,
        NotificationHook afterHook,

        List<SchedulePeriod> periods
) {

    public Schedule {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(startDate, "startDate must not be null");
        scheduleType = scheduleType == null ? ScheduleType.CUSTOM : scheduleType;
        frequency = frequency == null ? Frequency.NONE : frequency;
        frequencyConfig = frequencyConfig == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(frequencyConfig));
        beforeHook = beforeHook == null ? NotificationHook.disabled() : beforeHook;
        afterHook = afterHook == null ? NotificationHook.disabled() : afterHook;
        periods = periods == null ? List.of() : List.copyOf(periods);
    }

    /**
     * True when the schedule is active and {@code date} lies within its date bounds (both inclusive).
     */
    public boolean isActiveOn(LocalDate date) {
        if (!active) {
            return false;
        }
        return !date.isBefore(startDate) && (endDate == null || !date.isAfter(endDate));
    }

    /**
     * True when the recurrence rule selects {@code date}. Date bounds are not checked.
     */
    public boolean recursOn(LocalDate date) {
        return frequency.matches(date, frequencyConfig);
    }

    public long totalDurationMinutes() {
        return periods.stream().mapToLong(SchedulePeriod::durationMinutes).sum();
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description;
        private Schedulable schedulable;
        private ScheduleType scheduleType = ScheduleType.CUSTOM;
        private LocalDate startDate;
        private LocalDate endDate;
        private boolean recurring;
        private Frequency frequency = Frequency.NONE;
        private Map<String, Object> frequencyConfig = Map.of();
        private boolean active = true;
        private NotificationHook beforeHook = NotificationHook.disabled();
        private NotificationHook afterHook = NotificationHook.disabled();
        private final List<SchedulePeriod> periods = new ArrayList<>();

        private Builder(String id) {
            this.id = Objects.requireNonNull(id, "id must not be null");
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder schedulable(Schedulable schedulable) {
            this.schedulable = schedulable;
            return this;
        }

        public Builder type(ScheduleType scheduleType) {
            this.scheduleType = scheduleType;
            return this;
        }

        public Builder from(LocalDate startDate) {
            this.startDate = startDate;
            return this;
        }

        public Builder to(LocalDate endDate) {
            this.endDate = endDate;
            return this;
        }

        public Builder daily() {
            this.recurring = true;
            this.frequency = Frequency.DAILY;
            this.frequencyConfig = Map.of();
            return this;
        }

        /**
         * Weekly recurrence on the given lower-cased weekday names.
         */
        public Builder weekly(List<String> days) {
            Objects.requireNonNull(days, "days must not be null");
            this.recurring = true;
            this.frequency = Frequency.WEEKLY;
            this.frequencyConfig = Map.of(Frequency.DAYS_KEY, List.copyOf(days));
            return this;
        }

        public Builder frequency(Frequency frequency, Map<String, Object> config) {
            this.frequency = frequency;
            this.frequencyConfig = config;
            this.recurring = frequency != null && frequency != Frequency.NONE;
            return this;
        }

        public Builder active(boolean active) {
            this.active = active;
            return this;
        }

        public Builder notifyBefore(NotificationHook hook) {
            this.beforeHook = hook;
            return this;
        }

        public Builder notifyAfter(NotificationHook hook) {
            this.afterHook = hook;
            return this;
        }

        public Builder period(SchedulePeriod period) {
            this.periods.add(Objects.requireNonNull(period, "period must not be null"));
            return this;
        }

        public Schedule build() {
            if (startDate == null) {
                throw new IllegalStateException("Schedule " + id + " must have a start date");
            }
            if (endDate != null && endDate.isBefore(startDate)) {
                throw new IllegalStateException("Schedule " + id + " ends before it starts");
            }
            return new Schedule(id, name, description, schedulable, scheduleType, startDate, endDate,
                    recurring, frequency, frequencyConfig, active, beforeHook, afterHook, periods);
        }
    }
}
