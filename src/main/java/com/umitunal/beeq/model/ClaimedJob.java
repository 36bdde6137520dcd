package com.umitunal.beeq.model;

/**
 * A job a worker has moved into the processing list.
 * <p>{@code rawValue} is the exact list element that was moved; it is what gets removed from
 * the processing list when the claim is released, so it must never be re-serialized.
 */
public class ClaimedJob {
    private final String rawValue;
    private final JobRecord record;

    public ClaimedJob(String rawValue, JobRecord record) {
        this.rawValue = rawValue;
        this.record = record;
    }

    public String getRawValue() {
        return rawValue;
    }

    public JobRecord getRecord() {
        return record;
    }

    @Override
    public String toString() {
        return "ClaimedJob{" + record + "}";
    }
}
