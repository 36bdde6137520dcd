package com.umitunal.beeq.core;

/**
 * Represents a unit of work as seen by a job handler.
 *
 * @param <T> the type of the decoded job payload
 */
public interface Job<T> {

    /**
     * Gets the unique identifier for this job.
     */
    String getId();

    /**
     * Gets the decoded job payload.
     */
    T getPayload();

    /**
     * Gets the current status.
     */
    Status getStatus();

    /**
     * Gets the number of times a worker has claimed this job, including the current claim.
     */
    int getAttempts();

    /**
     * Gets the maximum number of attempts before the job fails permanently.
     */
    int getMaxRetries();

    /**
     * Gets the handler deadline in milliseconds.
     */
    long getTimeoutMillis();

    /**
     * Checks if another attempt is allowed after a failure.
     */
    boolean canRetry();

    /**
     * Possible statuses of a job. Advisory only: list membership decides scheduling.
     */
    enum Status {
        WAITING,     // In the waiting list
        PROCESSING,  // Claimed by a worker
        COMPLETED,   // Handler succeeded
        FAILED,      // Retries exhausted
        RETRYING;    // Failed, will be re-queued after backoff

        public boolean isTerminal() {
            return this == COMPLETED || this == FAILED;
        }
    }
}
