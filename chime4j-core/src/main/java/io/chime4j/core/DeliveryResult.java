package io.chime4j.core;

/**
 * Result channel for one notification send. Delivery errors end up here instead of being thrown.
 *
 * sent    : the notification was handed to the delivery subsystem
 * skipped : nothing to send (hook disabled, no factory configured, or notifications switched off)
 * error   : resolution or delivery failure, null otherwise
 */
public record DeliveryResult(
        boolean sent,
        boolean skipped,
        RuntimeException error
) {

    public static DeliveryResult sentResult() {
        return new DeliveryResult(true, false, null);
    }

    public static DeliveryResult skippedResult() {
        return new DeliveryResult(false, true, null);
    }

    public static DeliveryResult failed(RuntimeException error) {
        return new DeliveryResult(false, false, error);
    }

    public boolean isFailed() {
        return error != null;
    }
}
