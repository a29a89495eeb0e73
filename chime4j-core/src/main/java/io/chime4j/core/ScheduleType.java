package io.chime4j.core;

/**
 * Kind of schedule, as stored. Informational only; the notification engine treats all kinds alike.
 */
public enum ScheduleType {
    AVAILABILITY,
    APPOINTMENT,
    BLOCKED,
    CUSTOM
}
