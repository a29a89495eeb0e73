package io.chime4j.core;

/**
 * The delivery subsystem rejected or failed a send.
 */
public class NotificationDeliveryException extends RuntimeException {

    public NotificationDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
