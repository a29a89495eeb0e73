package io.chime4j.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.chime4j.NotificationFactory;
import io.chime4j.notification.Notification;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

public class NotificationFactoryRegistry {

    private final Map<String, NotificationFactory<?>> factoriesByName;
    private final ObjectMapper objectMapper;

    public NotificationFactoryRegistry(List<NotificationFactory<?>> factories, ObjectMapper objectMapper) {
        this.factoriesByName = factories.stream()
                .collect(Collectors.toUnmodifiableMap(
                        NotificationFactory::name,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate NotificationFactory name: " + a.name());
                        }
                ));
        // stored params may carry keys the factory does not declare
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null")
                .copy()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public NotificationFactory<?> getRequired(String name) {
        NotificationFactory<?> factory = factoriesByName.get(name);
        if (factory == null) {
            throw new NotificationFactoryNotFoundException(name);
        }
        return factory;
    }

    public boolean contains(String name) {
        return factoriesByName.containsKey(name);
    }

    /**
     * Build the notification configured by {@code hook} for {@code schedule}.
     *
     * @throws NotificationFactoryNotFoundException if the hook names an unknown factory
     */
    public Notification create(Schedule schedule, NotificationHook hook) {
        Objects.requireNonNull(schedule, "schedule must not be null");
        Objects.requireNonNull(hook, "hook must not be null");
        return createWith(getRequired(hook.factoryName()), schedule, hook.constructorParams());
    }

    private <P> Notification createWith(NotificationFactory<P> factory, Schedule schedule, Map<String, Object> rawParams) {
        P params = rawParams == null ? null : objectMapper.convertValue(rawParams, factory.paramsClass());
        return factory.create(schedule, params);
    }
}
