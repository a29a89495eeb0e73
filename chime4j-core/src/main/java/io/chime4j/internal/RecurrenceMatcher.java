package io.chime4j.internal;

import io.chime4j.core.CandidatePeriod;
import io.chime4j.core.Frequency;
import io.chime4j.core.Schedule;
import io.chime4j.spi.ScheduleStore;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Objects;
import java.util.stream.Stream;

/**
 * Selects the schedule periods that are candidates for notification on a given day.
 *
 * <p>A schedule qualifies when it is active, the day lies within its date bounds, and its
 * frequency is {@link Frequency#DAILY}, or {@link Frequency#WEEKLY} with the day's weekday listed.
 * Nothing is cached; every call queries the store again.
 */
public class RecurrenceMatcher {

    private final ScheduleStore store;
    private final ZoneId zone;

    public RecurrenceMatcher(ScheduleStore store, ZoneId zone) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
    }

    public Stream<CandidatePeriod> candidatePeriods(Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        return candidatePeriods(LocalDate.ofInstant(now, zone));
    }

    public Stream<CandidatePeriod> candidatePeriods(LocalDate date) {
        Objects.requireNonNull(date, "date must not be null");
        return store.findCandidates(date).stream()
                .filter(schedule -> matches(schedule, date))
                .flatMap(schedule -> schedule.periods().stream()
                        .map(period -> new CandidatePeriod(schedule, period, date)));
    }

    public static boolean matches(Schedule schedule, LocalDate date) {
        if (schedule.frequency() != Frequency.DAILY && schedule.frequency() != Frequency.WEEKLY) {
            return false;
        }
        return schedule.isActiveOn(date) && schedule.recursOn(date);
    }
}
