package io.chime4j.notification;

import io.chime4j.NotificationFactory;
import io.chime4j.core.NotificationSettings;
import io.chime4j.core.Schedule;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Factories for {@link ScheduleStartingNotification} and {@link ScheduleCompletedNotification}.
 * Both report via {@link NotificationSettings#defaultChannels()} and take no params.
 */
public final class BuiltInNotificationFactories {
    private BuiltInNotificationFactories() {
    }

    public static List<NotificationFactory<?>> all(NotificationSettings settings) {
        return List.of(starting(settings), completed(settings));
    }

    public static NotificationFactory<Map<String, Object>> starting(NotificationSettings settings) {
        return new Simple(ScheduleStartingNotification.NAME, settings, ScheduleStartingNotification::new);
    }

    public static NotificationFactory<Map<String, Object>> completed(NotificationSettings settings) {
        return new Simple(ScheduleCompletedNotification.NAME, settings, ScheduleCompletedNotification::new);
    }

    private static final class Simple implements NotificationFactory<Map<String, Object>> {
        private final String name;
        private final NotificationSettings settings;
        private final BiFunction<Schedule, List<NotificationChannel>, Notification> constructor;

        private Simple(String name,
                       NotificationSettings settings,
                       BiFunction<Schedule, List<NotificationChannel>, Notification> constructor) {
            this.name = name;
            this.settings = Objects.requireNonNull(settings, "settings must not be null");
            this.constructor = constructor;
        }

        @Override
        public String name() {
            return name;
        }

        @Override
        @SuppressWarnings("unchecked")
        public Class<Map<String, Object>> paramsClass() {
            return (Class<Map<String, Object>>) (Class<?>) Map.class;
        }

        @Override
        public Notification create(Schedule schedule, Map<String, Object> params) {
            return constructor.apply(schedule, settings.defaultChannels());
        }
    }
}
