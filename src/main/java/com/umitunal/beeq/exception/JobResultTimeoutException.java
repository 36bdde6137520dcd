package com.umitunal.beeq.exception;

import java.time.Duration;

/**
 * The job did not reach a terminal state before the caller's deadline.
 */
public class JobResultTimeoutException extends QueueException {
    private final String jobId;

    public JobResultTimeoutException(String jobId, Duration waited) {
        super("Job " + jobId + " not finished after " + waited.toMillis() + " ms");
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
