package com.umitunal.beeq.exception;

import java.time.Duration;

/**
 * A store operation did not finish within its deadline.
 * The whole operation may be retried by the caller.
 */
public class StoreTimeoutException extends StoreException {
    private final Duration deadline;

    public StoreTimeoutException(String operation, Duration deadline) {
        super(operation + " timed out after " + deadline.toMillis() + " ms");
        this.deadline = deadline;
    }

    public Duration getDeadline() {
        return deadline;
    }
}
