package com.umitunal.beeq.core;

/**
 * Terminal outcome of a job as returned by a result lookup.
 */
public class JobResult {
    private final String jobId;
    private final Job.Status status;
    private final String result;
    private final String error;

    private JobResult(String jobId, Job.Status status, String result, String error) {
        this.jobId = jobId;
        this.status = status;
        this.result = result;
        this.error = error;
    }

    public static JobResult success(String jobId, String result) {
        return new JobResult(jobId, Job.Status.COMPLETED, result, null);
    }

    public static JobResult failed(String jobId, String error) {
        return new JobResult(jobId, Job.Status.FAILED, null, error);
    }

    public String getJobId() { return jobId; }
    public Job.Status getStatus() { return status; }
    public String getResult() { return result; }
    public String getError() { return error; }

    public boolean isSuccess() {
        return status == Job.Status.COMPLETED;
    }

    @Override
    public String toString() {
        return String.format("JobResult{jobId='%s', status=%s, result='%s', error='%s'}",
                jobId, status, result, error);
    }
}
