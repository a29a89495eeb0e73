package io.chime4j.notification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Rendered content of a notification for one channel.
 */
public record ChannelPayload(NotificationChannel channel, Map<String, Object> content) {

    public ChannelPayload {
        Objects.requireNonNull(channel, "channel must not be null");
        content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
    }

    public Object get(String key) {
        return content.get(key);
    }
}
