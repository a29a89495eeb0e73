package io.chime4j.core;

public enum ExecutionStatus {
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
