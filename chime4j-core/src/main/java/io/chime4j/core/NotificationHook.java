package io.chime4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One side (before or after) of a schedule's notification configuration.
 *
 * @param enabled     the {@code notify_before}/{@code notify_after} flag
 * @param offsets     normalized minute offsets, in configured order
 * @param factoryName name of the {@link io.chime4j.NotificationFactory} to build the notification with; may be null
 * @param data        stored payload; may contain {@value #CONSTRUCTOR_PARAMS}
 */
public record NotificationHook(
        boolean enabled,
        List<Integer> offsets,
        String factoryName,
        Map<String, Object> data
) {

    public static final String CONSTRUCTOR_PARAMS = "constructor_params";

    public NotificationHook {
        offsets = offsets == null ? List.of() : List.copyOf(offsets);
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    public static NotificationHook disabled() {
        return new NotificationHook(false, List.of(), null, Map.of());
    }

    public boolean hasFactory() {
        return factoryName != null && !factoryName.isBlank();
    }

    /**
     * The stored {@value #CONSTRUCTOR_PARAMS} mapping, or null when the payload has none.
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> constructorParams() {
        Object raw = data.get(CONSTRUCTOR_PARAMS);
        if (raw instanceof Map<?, ?> map) {
            return (Map<String, Object>) map;
        }
        return null;
    }
}
