package com.umitunal.beeq.model;

import com.umitunal.beeq.core.Job;

/**
 * Read-only view of a {@link JobRecord} with its payload decoded, handed to job handlers.
 *
 * @param <T> the type of the decoded payload
 */
public class DecodedJob<T> implements Job<T> {
    private final JobRecord record;
    private final T payload;

    public DecodedJob(JobRecord record, T payload) {
        this.record = record;
        this.payload = payload;
    }

    @Override
    public String getId() {
        return record.getId();
    }

    @Override
    public T getPayload() {
        return payload;
    }

    @Override
    public Status getStatus() {
        return record.getStatus();
    }

    @Override
    public int getAttempts() {
        return record.getAttempts();
    }

    @Override
    public int getMaxRetries() {
        return record.getMaxRetries();
    }

    @Override
    public long getTimeoutMillis() {
        return record.getTimeoutMillis();
    }

    @Override
    public boolean canRetry() {
        return record.canRetry();
    }

    @Override
    public String toString() {
        return "DecodedJob{" + record + "}";
    }
}
