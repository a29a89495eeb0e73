package io.chime4j.core;

/**
 * A schedule names a notification factory that is not registered.
 */
public class NotificationFactoryNotFoundException extends RuntimeException {

    private final String factoryName;

    public NotificationFactoryNotFoundException(String factoryName) {
        super("No NotificationFactory registered for name: " + factoryName);
        this.factoryName = factoryName;
    }

    public String getFactoryName() {
        return factoryName;
    }
}
