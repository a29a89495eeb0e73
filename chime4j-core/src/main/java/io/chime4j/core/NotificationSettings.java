package io.chime4j.core;

import io.chime4j.notification.NotificationChannel;

import java.util.List;
import java.util.Objects;

/**
 * Notification options handed to every engine component at construction.
 *
 * @param enabled         global kill switch for before/after sends
 * @param queue           deliver through the queued path instead of immediately
 * @param defaultChannels channels the built-in notifications report via
 * @param crossMidnight   evaluate yesterday's and tomorrow's occurrences so offsets may cross a day boundary
 */
public record NotificationSettings(
        boolean enabled,
        boolean queue,
        List<NotificationChannel> defaultChannels,
        boolean crossMidnight
) {

    public NotificationSettings {
        Objects.requireNonNull(defaultChannels, "defaultChannels must not be null");
        defaultChannels = List.copyOf(defaultChannels);
    }

    public static NotificationSettings defaults() {
        return new NotificationSettings(
                true,
                true,
                List.of(NotificationChannel.MAIL, NotificationChannel.DATABASE),
                true
        );
    }

    public NotificationSettings withEnabled(boolean enabled) {
        return new NotificationSettings(enabled, queue, defaultChannels, crossMidnight);
    }

    public NotificationSettings withQueue(boolean queue) {
        return new NotificationSettings(enabled, queue, defaultChannels, crossMidnight);
    }

    public NotificationSettings withCrossMidnight(boolean crossMidnight) {
        return new NotificationSettings(enabled, queue, defaultChannels, crossMidnight);
    }
}
