package io.chime4j.notification;

import io.chime4j.core.Schedulable;

import java.util.Set;

/**
 * A message about a schedule that the delivery subsystem can send over one or more channels.
 */
public interface Notification {

    /**
     * Channels this notification should go out on for the given addressee.
     */
    Set<NotificationChannel> via(Schedulable notifiable);

    /**
     * Render the content for one of the channels returned by {@link #via(Schedulable)}.
     *
     * @throws IllegalArgumentException if the channel is not supported
     */
    ChannelPayload renderFor(NotificationChannel channel, Schedulable notifiable);
}
