package io.chime4j.internal;

import io.chime4j.NotificationSender;
import io.chime4j.core.DeliveryResult;
import io.chime4j.core.ExecutionResult;
import io.chime4j.core.NotificationDeliveryException;
import io.chime4j.core.NotificationFactoryNotFoundException;
import io.chime4j.core.NotificationFactoryRegistry;
import io.chime4j.core.NotificationHook;
import io.chime4j.core.NotificationSettings;
import io.chime4j.core.NotificationType;
import io.chime4j.core.Schedulable;
import io.chime4j.core.Schedule;
import io.chime4j.notification.ExecutionAwareNotification;
import io.chime4j.notification.Notification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Resolves a schedule's before/after notification and hands it to the delivery subsystem.
 */
public class NotificationDispatcher {
    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private final NotificationFactoryRegistry registry;
    private final NotificationSender sender;
    private final NotificationSettings settings;

    public NotificationDispatcher(NotificationFactoryRegistry registry,
                                  NotificationSender sender,
                                  NotificationSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.sender = Objects.requireNonNull(sender, "sender must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public NotificationSettings settings() {
        return settings;
    }

    /**
     * True when the schedule's hook for {@code type} is enabled and notifications are switched on globally.
     */
    public boolean shouldNotify(Schedule schedule, NotificationType type) {
        return settings.enabled() && type.hookOf(schedule).enabled();
    }

    /**
     * The notification configured for {@code type}, or empty when the hook is disabled or names no factory.
     *
     * @throws NotificationFactoryNotFoundException if the named factory is not registered
     */
    public Optional<Notification> resolve(Schedule schedule, NotificationType type) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(type, "type must not be null");

        NotificationHook hook = type.hookOf(schedule);
        if (!hook.enabled() || !hook.hasFactory()) {
            return Optional.empty();
        }
        return Optional.of(registry.create(schedule, hook));
    }

    /**
     * Deliver through the queued or the immediate path, as configured.
     *
     * @throws NotificationDeliveryException if the delivery subsystem fails
     */
    public void dispatch(Schedulable notifiable, Notification notification) {
        Objects.requireNonNull(notification, "notification must not be null");
        try {
            if (settings.queue()) {
                sender.sendQueued(notifiable, notification);
            } else {
                sender.sendNow(notifiable, notification);
            }
        } catch (RuntimeException e) {
            throw new NotificationDeliveryException("Delivery failed: " + e.getMessage(), e);
        }
    }

    /**
     * Resolve and dispatch in one step, never throwing. Failures are logged and returned.
     *
     * @param execution details attached to execution-aware notifications; may be null
     */
    public DeliveryResult send(Schedule schedule, NotificationType type, ExecutionResult execution) {
        return send(schedule, null, type, execution);
    }

    /**
     * As {@link #send(Schedule, NotificationType, ExecutionResult)}, for one period of the schedule.
     *
     * @param periodId period the notification belongs to, for logging; may be null
     */
    public DeliveryResult send(Schedule schedule, String periodId, NotificationType type, ExecutionResult execution) {
        if (!shouldNotify(schedule, type)) {
            return DeliveryResult.skippedResult();
        }
        try {
            Optional<Notification> resolved = resolve(schedule, type);
            if (resolved.isEmpty()) {
                return DeliveryResult.skippedResult();
            }
            Notification notification = resolved.get();
            if (execution != null && notification instanceof ExecutionAwareNotification aware) {
                aware.attachExecutionResult(execution);
            }
            dispatch(schedule.schedulable(), notification);
            return DeliveryResult.sentResult();
        } catch (RuntimeException e) {
            log.error("chime failed to send {} notification scheduleId={} periodId={} msg={}",
                    type.value(), schedule.id(), periodId, e.getMessage(), e);
            return DeliveryResult.failed(e);
        }
    }
}
