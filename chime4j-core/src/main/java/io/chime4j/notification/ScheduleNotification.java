package io.chime4j.notification;

import io.chime4j.core.Schedulable;
import io.chime4j.core.Schedule;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Shared rendering of the built-in schedule notifications.
 */
abstract class ScheduleNotification implements Notification {

    protected final Schedule schedule;
    private final EnumSet<NotificationChannel> channels;

    protected ScheduleNotification(Schedule schedule, List<NotificationChannel> channels) {
        this.schedule = Objects.requireNonNull(schedule, "schedule must not be null");
        this.channels = channels == null || channels.isEmpty()
                ? EnumSet.noneOf(NotificationChannel.class)
                : EnumSet.copyOf(channels);
    }

    @Override
    public Set<NotificationChannel> via(Schedulable notifiable) {
        return channels.clone();
    }

    @Override
    public ChannelPayload renderFor(NotificationChannel channel, Schedulable notifiable) {
        Objects.requireNonNull(channel, "channel must not be null");
        return switch (channel) {
            case MAIL -> new ChannelPayload(channel, mail(notifiable));
            case DATABASE -> new ChannelPayload(channel, data());
            case BROADCAST -> {
                Map<String, Object> content = data();
                content.put("message", headline());
                yield new ChannelPayload(channel, content);
            }
        };
    }

    /**
     * Value of the {@code type} field, e.g. "schedule_starting".
     */
    protected abstract String kind();

    protected abstract String subject();

    protected abstract String headline();

    protected void appendMailLines(List<String> lines) {
    }

    protected void appendData(Map<String, Object> data) {
    }

    protected String scheduleName() {
        String name = schedule.name();
        return name == null || name.isBlank() ? "Unnamed Schedule" : name;
    }

    private Map<String, Object> mail(Schedulable notifiable) {
        String who = notifiable != null && notifiable.name() != null ? notifiable.name() : "there";

        List<String> lines = new ArrayList<>();
        lines.add(headline());
        appendMailLines(lines);
        if (schedule.description() != null && !schedule.description().isBlank()) {
            lines.add("Description: " + schedule.description());
        }

        Map<String, Object> content = new LinkedHashMap<>();
        content.put("subject", subject());
        content.put("greeting", "Hello " + who + "!");
        content.put("lines", List.copyOf(lines));
        content.put("schedule_id", schedule.id());
        return content;
    }

    private Map<String, Object> data() {
        Map<String, Object> content = new LinkedHashMap<>();
        content.put("schedule_id", schedule.id());
        content.put("schedule_name", schedule.name());
        content.put("type", kind());
        content.put("start_date", schedule.startDate().toString());
        content.put("description", schedule.description());
        appendData(content);
        return content;
    }
}
