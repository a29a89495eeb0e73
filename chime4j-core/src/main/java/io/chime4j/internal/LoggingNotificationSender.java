package io.chime4j.internal;

import io.chime4j.NotificationSender;
import io.chime4j.core.Schedulable;
import io.chime4j.notification.ChannelPayload;
import io.chime4j.notification.Notification;
import io.chime4j.notification.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fallback delivery subsystem that renders every channel and writes it to the log.
 * Queued and immediate delivery behave the same.
 */
public class LoggingNotificationSender implements NotificationSender {
    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSender.class);

    @Override
    public void sendNow(Schedulable notifiable, Notification notification) {
        deliver(notifiable, notification, false);
    }

    @Override
    public void sendQueued(Schedulable notifiable, Notification notification) {
        deliver(notifiable, notification, true);
    }

    private void deliver(Schedulable notifiable, Notification notification, boolean queued) {
        for (NotificationChannel channel : notification.via(notifiable)) {
            ChannelPayload payload = notification.renderFor(channel, notifiable);
            log.info("chime notification to={} channel={} queued={} content={}",
                    notifiable, channel, queued, payload.content());
        }
    }
}
