package io.chime4j;

import io.chime4j.core.Schedulable;
import io.chime4j.notification.Notification;

/**
 * Delivery subsystem. Implementations render the notification for each of its channels and
 * hand it to the transport.
 */
public interface NotificationSender {

    /**
     * Deliver on the calling thread.
     */
    void sendNow(Schedulable notifiable, Notification notification);

    /**
     * Hand over for deferred delivery.
     */
    void sendQueued(Schedulable notifiable, Notification notification);
}
