package io.chime4j.utils;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.TimeZone;

/**
 * Computes when the next notification tick is due.
 * <p>
 * Supported specs:
 * <ul>
 *   <li>Cron expressions, 5-field, 6-field or Quartz (e.g. "0 * * * * ?", the default: every minute at :00)</li>
 *   <li>Human-readable intervals: "1 minute", "30 seconds", "1m"</li>
 * </ul>
 */
public final class TickIntervals {

    public static final String EVERY_MINUTE = "0 * * * * ?";

    private TickIntervals() {
    }

    /**
     * Next tick strictly after {@code from}.
     */
    public static Instant nextTick(String spec, ZoneId zone, Instant from) {
        Objects.requireNonNull(from, "from must not be null");
        return from.plus(untilNextTick(spec, zone, from));
    }

    /**
     * Time from {@code from} to the next tick. For interval specs this is the interval itself.
     */
    public static Duration untilNextTick(String spec, ZoneId zone, Instant from) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("tick spec must not be blank");
        }
        Objects.requireNonNull(from, "from must not be null");
        ZoneId z = zone == null ? ZoneId.systemDefault() : zone;

        if (looksLikeCron(spec)) {
            return untilNextCron(normalizeCron(spec), z, from);
        }
        return parseInterval(spec);
    }

    /**
     * Normalize cron expressions to Quartz syntax:
     * - 5-field cron gets a leading seconds field "0".
     * - "*" in both day fields becomes "?" for day-of-week.
     */
    public static String normalizeCron(String spec) {
        String s = spec.trim();
        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron("0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        return s;
    }

    private static String toQuartzCron(String sec, String min, String hour, String dayOfMonth, String month, String dayOfWeek) {
        String dow = dayOfWeek;
        if ("*".equals(dayOfMonth) && "*".equals(dayOfWeek)) {
            dow = "?";
        }
        return String.join(" ", sec, min, hour, dayOfMonth, month, dow);
    }

    public static boolean looksLikeCron(String spec) {
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (Exception ignored) {
            return false;
        }
    }

    private static Duration untilNextCron(String cron, ZoneId zone, Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(cron);
        } catch (ParseException ex) {
            throw new IllegalArgumentException("Invalid cron expression: " + cron, ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date next = exp.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            throw new IllegalArgumentException("Cron expression produced no next tick: " + cron);
        }
        return Duration.between(from, next.toInstant());
    }

    /**
     * Parse "N unit" pairs ("1 minute", "1 minute 30 seconds") or a compact "Ns"/"Nm"/"Nh".
     */
    public static Duration parseInterval(String input) {
        String s = input.trim().toLowerCase();

        if (s.matches("^\\d+\\s*[smh]$")) {
            long n = Long.parseLong(s.replaceAll("[^0-9]", ""));
            char unit = s.charAt(s.length() - 1);
            return positive(switch (unit) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                default -> Duration.ofHours(n);
            }, input);
        }

        String[] parts = s.split("\\s+");
        if (parts.length % 2 != 0) {
            throw new IllegalArgumentException("Invalid tick interval. Expected pairs like '1 minute': " + input);
        }

        Duration total = Duration.ZERO;
        for (int i = 0; i < parts.length; i += 2) {
            long n;
            try {
                n = Long.parseLong(parts[i]);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid number in tick interval: " + parts[i]);
            }
            String unit = parts[i + 1];
            if (unit.endsWith("s")) {
                unit = unit.substring(0, unit.length() - 1);
            }
            total = total.plus(switch (unit) {
                case "hour" -> Duration.ofHours(n);
                case "minute" -> Duration.ofMinutes(n);
                case "second" -> Duration.ofSeconds(n);
                default -> throw new IllegalArgumentException("Unsupported tick interval unit: " + parts[i + 1]);
            });
        }
        return positive(total, input);
    }

    private static Duration positive(Duration d, String input) {
        if (d.isZero() || d.isNegative()) {
            throw new IllegalArgumentException("Tick interval must be positive: " + input);
        }
        return d;
    }
}
