package io.chime4j.utils;

import io.chime4j.core.NotificationType;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Turns a period's time of day plus minute offsets into absolute notify-at instants.
 *
 * <p>Periods carry no date, so the time of day is placed onto an occurrence date (today, unless
 * stated otherwise) in the clock's zone. Results are truncated to the minute.
 */
public final class OffsetCalculator {

    private final Clock clock;

    public OffsetCalculator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Notify-at instants for today's occurrence of {@code periodTime}.
     *
     * @param offsets a single minute value or a sequence of them (see {@link #normalize(Object)})
     */
    public List<Instant> notifyInstants(LocalTime periodTime, Object offsets, NotificationType direction) {
        LocalDate today = LocalDate.now(clock);
        return notifyInstants(today, periodTime, normalize(offsets), direction, clock.getZone());
    }

    /**
     * Notify-at instants for the occurrence of {@code periodTime} on {@code date}.
     * A before-offset larger than the minutes since midnight lands on the previous day,
     * an after-offset past midnight on the next one.
     */
    public static List<Instant> notifyInstants(LocalDate date,
                                               LocalTime periodTime,
                                               List<Integer> offsets,
                                               NotificationType direction,
                                               ZoneId zone) {
        Objects.requireNonNull(date, "date must not be null");
        Objects.requireNonNull(periodTime, "periodTime must not be null");
        Objects.requireNonNull(direction, "direction must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        if (offsets == null || offsets.isEmpty()) {
            return List.of();
        }

        ZonedDateTime anchor = ZonedDateTime.of(date, periodTime, zone);
        List<Instant> instants = new ArrayList<>(offsets.size());
        for (Integer minutes : offsets) {
            instants.add(direction.shift(anchor, minutes).truncatedTo(ChronoUnit.MINUTES).toInstant());
        }
        return instants;
    }

    /**
     * Normalize a stored offset setting into an ordered list of non-negative minute values.
     * <ul>
     *   <li>null: empty list</li>
     *   <li>number or numeric string: singleton list</li>
     *   <li>collection, or a string like "[15, 30]" / "15,30": one entry per element</li>
     * </ul>
     *
     * @throws IllegalArgumentException on negative or non-numeric values
     */
    public static List<Integer> normalize(Object offsets) {
        if (offsets == null) {
            return List.of();
        }
        List<Integer> result = new ArrayList<>();
        if (offsets instanceof Collection<?> values) {
            for (Object v : values) {
                result.add(toMinutes(v));
            }
        } else if (offsets instanceof String s) {
            String trimmed = s.trim();
            if (trimmed.startsWith("[") && trimmed.endsWith("]")) {
                trimmed = trimmed.substring(1, trimmed.length() - 1);
            }
            if (!trimmed.isBlank()) {
                for (String part : trimmed.split(",")) {
                    result.add(toMinutes(part));
                }
            }
        } else {
            result.add(toMinutes(offsets));
        }
        return List.copyOf(result);
    }

    private static int toMinutes(Object value) {
        int minutes;
        if (value instanceof Number n) {
            minutes = n.intValue();
        } else if (value instanceof String s) {
            try {
                minutes = Integer.parseInt(s.trim());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid offset minutes: " + s);
            }
        } else {
            throw new IllegalArgumentException("Invalid offset minutes: " + value);
        }
        if (minutes < 0) {
            throw new IllegalArgumentException("Offset minutes must be non-negative: " + minutes);
        }
        return minutes;
    }
}
