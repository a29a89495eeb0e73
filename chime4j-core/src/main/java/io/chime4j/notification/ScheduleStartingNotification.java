package io.chime4j.notification;

import io.chime4j.core.Schedule;

import java.util.List;

/**
 * Default before-notification: the scheduled task is about to start.
 */
public class ScheduleStartingNotification extends ScheduleNotification {

    public static final String NAME = "chime.starting";

    public ScheduleStartingNotification(Schedule schedule, List<NotificationChannel> channels) {
        super(schedule, channels);
    }

    @Override
    protected String kind() {
        return "schedule_starting";
    }

    @Override
    protected String subject() {
        return "Schedule Starting: " + scheduleName();
    }

    @Override
    protected String headline() {
        return "Your scheduled task \"" + scheduleName() + "\" is about to start.";
    }

    @Override
    protected void appendMailLines(List<String> lines) {
        lines.add("Scheduled for: " + schedule.startDate());
    }
}
