package com.umitunal.beeq.core;

/**
 * Lengths of a queue's four lists.
 */
public class QueueStats {
    private final long waiting;
    private final long processing;
    private final long succeeded;
    private final long failed;

    public QueueStats(long waiting, long processing, long succeeded, long failed) {
        this.waiting = waiting;
        this.processing = processing;
        this.succeeded = succeeded;
        this.failed = failed;
    }

    public long getWaiting() { return waiting; }
    public long getProcessing() { return processing; }
    public long getSucceeded() { return succeeded; }
    public long getFailed() { return failed; }

    @Override
    public String toString() {
        return String.format(
            "QueueStats{waiting=%d, processing=%d, succeeded=%d, failed=%d}",
            waiting, processing, succeeded, failed
        );
    }
}
