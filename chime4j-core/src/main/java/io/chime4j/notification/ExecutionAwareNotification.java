package io.chime4j.notification;

import io.chime4j.core.ExecutionResult;

/**
 * A notification that reports on a finished execution. The executor attaches the
 * {@link ExecutionResult} before handing it to the delivery subsystem.
 */
public interface ExecutionAwareNotification extends Notification {

    void attachExecutionResult(ExecutionResult result);
}
