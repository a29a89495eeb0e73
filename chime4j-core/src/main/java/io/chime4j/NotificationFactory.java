package io.chime4j;

import io.chime4j.core.Schedule;
import io.chime4j.notification.Notification;

/**
 * Named, typed factory for one kind of notification. Schedules refer to factories by
 * {@link #name()} instead of storing a class to construct.
 *
 * @param <P> type the stored {@code constructor_params} mapping is converted into
 */
public interface NotificationFactory<P> {
    String name();

    Class<P> paramsClass();

    /**
     * @param schedule the schedule the notification is about
     * @param params   converted {@code constructor_params}, or null when the schedule stores none;
     *                 fields missing from the stored mapping are null
     */
    Notification create(Schedule schedule, P params);
}
