package io.chime4j.config;

import io.chime4j.core.NotificationSettings;
import io.chime4j.notification.NotificationChannel;
import io.chime4j.utils.TickIntervals;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Runtime configuration for schedule notifications.
 */
@ConfigurationProperties(prefix = "chime")
public class ChimeProperties {
    private boolean enabled = true;
    private boolean autoStart = true;
    private String workerId;
    private String timezone; // IANA id, null means system default
    private String tickEvery = TickIntervals.EVERY_MINUTE;
    private Duration tickLockLifetime = Duration.ofSeconds(55);
    private boolean ensureIndexesOnStartup = false;
    private final Notifications notifications = new Notifications();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public String getTickEvery() {
        return tickEvery;
    }

    public void setTickEvery(String tickEvery) {
        this.tickEvery = tickEvery;
    }

    public Duration getTickLockLifetime() {
        return tickLockLifetime;
    }

    public void setTickLockLifetime(Duration tickLockLifetime) {
        this.tickLockLifetime = tickLockLifetime;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Notifications getNotifications() {
        return notifications;
    }

    public NotificationSettings toSettings() {
        return new NotificationSettings(
                notifications.isEnabled(),
                notifications.isQueue(),
                notifications.getDefaultChannels(),
                notifications.isCrossMidnight()
        );
    }

    public static class Notifications {
        private boolean enabled = true;
        private boolean queue = true;
        private List<NotificationChannel> defaultChannels =
                new ArrayList<>(List.of(NotificationChannel.MAIL, NotificationChannel.DATABASE));
        private boolean crossMidnight = true;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isQueue() {
            return queue;
        }

        public void setQueue(boolean queue) {
            this.queue = queue;
        }

        public List<NotificationChannel> getDefaultChannels() {
            return defaultChannels;
        }

        public void setDefaultChannels(List<NotificationChannel> defaultChannels) {
            this.defaultChannels = defaultChannels;
        }

        public boolean isCrossMidnight() {
            return crossMidnight;
        }

        public void setCrossMidnight(boolean crossMidnight) {
            this.crossMidnight = crossMidnight;
        }
    }
}
