package com.umitunal.beeq.exception;

/**
 * No record exists for the job id, either because it never existed or because its key expired.
 */
public class JobNotFoundException extends QueueException {
    private final String jobId;

    public JobNotFoundException(String jobId) {
        super("Job not found: " + jobId);
        this.jobId = jobId;
    }

    public String getJobId() {
        return jobId;
    }
}
