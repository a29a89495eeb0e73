package io.chime4j.core;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one orchestrated schedule execution, handed to the after-notification.
 *
 * <p>Not persisted.
 */
public record ExecutionResult(
        ExecutionStatus status,
        Duration duration,
        String error,
        Instant startedAt,
        Instant finishedAt
) {

    public ExecutionResult {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(duration, "duration must not be null");
        Objects.requireNonNull(finishedAt, "finishedAt must not be null");
    }

    public static ExecutionResult completed(Instant startedAt, Instant completedAt) {
        return new ExecutionResult(ExecutionStatus.COMPLETED, between(startedAt, completedAt), null,
                startedAt, completedAt);
    }

    public static ExecutionResult failed(String error, Instant startedAt, Instant failedAt) {
        return new ExecutionResult(ExecutionStatus.FAILED, between(startedAt, failedAt), error,
                startedAt, failedAt);
    }

    public boolean isFailed() {
        return status == ExecutionStatus.FAILED;
    }

    /**
     * Flat representation used in notification payloads:
     * {@code status}, {@code duration}, {@code completed_at} or {@code failed_at}, and {@code error} on failure.
     */
    public Map<String, Object> toDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", status.value());
        if (isFailed()) {
            details.put("error", error);
        }
        details.put("duration", shortDuration(duration));
        details.put(isFailed() ? "failed_at" : "completed_at", finishedAt.toString());
        return details;
    }

    private static Duration between(Instant from, Instant to) {
        if (from == null || to == null || to.isBefore(from)) {
            return Duration.ZERO;
        }
        return Duration.between(from, to);
    }

    /**
     * Compact human form: "850ms", "12s", "3m 5s", "1h 2m".
     */
    static String shortDuration(Duration d) {
        long millis = d.toMillis();
        if (millis < 1000) {
            return millis + "ms";
        }
        long seconds = d.toSeconds();
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        }
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }
}
