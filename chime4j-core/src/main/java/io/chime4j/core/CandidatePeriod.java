package io.chime4j.core;

import java.time.LocalDate;

/**
 * A schedule period selected for notification on a given occurrence date.
 */
public record CandidatePeriod(Schedule schedule, SchedulePeriod period, LocalDate date) {
}
