package com.umitunal.beeq.model;

import com.umitunal.beeq.core.Job;

import java.util.UUID;

/**
 * Stored envelope of a job: opaque payload plus retry and timing metadata.
 * <p>All mutators are pure state transitions. Each one moves {@code updatedAt} strictly
 * forward and none of them lowers {@code attempts}.
 */
public class JobRecord {
    public static final long DEFAULT_TIMEOUT_MILLIS = 60_000;
    public static final long DEFAULT_BACKOFF_BASE_MILLIS = 2_000;

    private final String id;
    private final byte[] payload;
    private final int maxRetries;
    private final long timeoutMillis;
    private final long backoffBaseMillis;
    private final long createdAt;

    private Job.Status status;
    private int attempts;
    private long updatedAt;
    private String error;
    private String result;

    JobRecord(String id, byte[] payload, int maxRetries, long timeoutMillis, long backoffBaseMillis, long createdAt) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.id = id;
        this.payload = payload;
        this.maxRetries = maxRetries;
        this.timeoutMillis = timeoutMillis;
        this.backoffBaseMillis = backoffBaseMillis;
        this.createdAt = createdAt;
        this.status = Job.Status.WAITING;
        this.attempts = 0;
        this.updatedAt = createdAt;
    }

    public static JobRecord create(byte[] payload, int maxRetries) {
        return create(payload, maxRetries, DEFAULT_TIMEOUT_MILLIS, DEFAULT_BACKOFF_BASE_MILLIS);
    }

    public static JobRecord create(byte[] payload, int maxRetries, long timeoutMillis, long backoffBaseMillis) {
        return new JobRecord(UUID.randomUUID().toString(), payload, maxRetries,
                timeoutMillis, backoffBaseMillis, System.currentTimeMillis());
    }

    public String getId() { return id; }
    public byte[] getPayload() { return payload; }
    public Job.Status getStatus() { return status; }
    public int getAttempts() { return attempts; }
    public int getMaxRetries() { return maxRetries; }
    public long getTimeoutMillis() { return timeoutMillis; }
    public long getBackoffBaseMillis() { return backoffBaseMillis; }
    public long getCreatedAt() { return createdAt; }
    public long getUpdatedAt() { return updatedAt; }
    public String getError() { return error; }
    public String getResult() { return result; }

    public boolean canRetry() {
        return attempts < maxRetries;
    }

    /**
     * Count a new attempt without changing the status. Called when a worker claims the job.
     */
    public void incrementAttempts() {
        this.attempts++;
        touch();
    }

    /**
     * Count an attempt and flag the job for retry.
     */
    public void incrementRetry() {
        this.attempts++;
        this.status = Job.Status.RETRYING;
        touch();
    }

    public void markProcessing() {
        this.status = Job.Status.PROCESSING;
        touch();
    }

    /**
     * Record a retryable failure. The attempt was already counted at claim time.
     */
    public void markRetrying(String error) {
        this.error = error;
        this.status = Job.Status.RETRYING;
        touch();
    }

    public void markCompleted(String result) {
        this.result = result;
        this.status = Job.Status.COMPLETED;
        touch();
    }

    public void markFailed(String error) {
        this.error = error;
        this.status = Job.Status.FAILED;
        touch();
    }

    /**
     * Storage key of this record inside a queue namespace.
     */
    public String storageKey(String queueKey) {
        return storageKey(queueKey, id);
    }

    public static String storageKey(String queueKey, String jobId) {
        return queueKey + ":job:" + jobId;
    }

    // Package-private setters for deserialization
    void setStatus(Job.Status status) {
        this.status = status;
    }

    void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }

    void setError(String error) {
        this.error = error;
    }

    void setResult(String result) {
        this.result = result;
    }

    private void touch() {
        this.updatedAt = Math.max(System.currentTimeMillis(), updatedAt + 1);
    }

    @Override
    public String toString() {
        return String.format("JobRecord{id='%s', status=%s, attempt=%d/%d, timeout=%dms, error='%s'}",
                id, status, attempts, maxRetries, timeoutMillis, error);
    }
}
