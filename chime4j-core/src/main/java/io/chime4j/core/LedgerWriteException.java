package io.chime4j.core;

/**
 * Recording a sent notification failed. Unlike a delivery failure this may lead to a
 * duplicate send on the next run, so it is reported separately.
 */
public class LedgerWriteException extends RuntimeException {

    public LedgerWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
