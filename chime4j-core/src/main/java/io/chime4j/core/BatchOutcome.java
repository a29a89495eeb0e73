package io.chime4j.core;

/**
 * Per-schedule entry of a batch execution.
 *
 * @param status "success" or "failed"
 * @param result value returned by the task on success
 * @param error  message of the task failure
 */
public record BatchOutcome<T>(
        String status,
        T result,
        String error
) {
    public static final String SUCCESS = "success";
    public static final String FAILED = "failed";

    public static <T> BatchOutcome<T> success(T result) {
        return new BatchOutcome<>(SUCCESS, result, null);
    }

    public static <T> BatchOutcome<T> failed(String error) {
        return new BatchOutcome<>(FAILED, null, error);
    }

    public boolean isSuccess() {
        return SUCCESS.equals(status);
    }
}
