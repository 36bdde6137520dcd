package com.umitunal.beeq.queue;

import com.umitunal.beeq.config.QueueConfig;
import com.umitunal.beeq.core.BackoffPolicy;
import com.umitunal.beeq.core.Deadlines;
import com.umitunal.beeq.core.Job;
import com.umitunal.beeq.core.JobResult;
import com.umitunal.beeq.core.QueueStats;
import com.umitunal.beeq.core.QueueStore;
import com.umitunal.beeq.exception.JobNotFoundException;
import com.umitunal.beeq.exception.JobResultTimeoutException;
import com.umitunal.beeq.exception.QueueException;
import com.umitunal.beeq.exception.SerializationException;
import com.umitunal.beeq.exception.StoreException;
import com.umitunal.beeq.exception.StoreUnavailableException;
import com.umitunal.beeq.health.HealthMonitor;
import com.umitunal.beeq.model.ClaimedJob;
import com.umitunal.beeq.model.JobRecord;
import com.umitunal.beeq.model.JobRecordSerializer;
import com.umitunal.beeq.serialization.ByteArrayCodec;
import com.umitunal.beeq.serialization.PayloadCodec;
import com.umitunal.beeq.worker.JobHandler;
import com.umitunal.beeq.worker.QueueWorker;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One named queue: producers enqueue into it, its worker claims from it.
 * <p>Storage layout under the queue key {@code <environment>_<name>_queue}:
 * <ul>
 *     <li>{@code :waiting} FIFO of serialized records (append right, claim from the left)</li>
 *     <li>{@code :processing} records claimed by a worker</li>
 *     <li>{@code :succeeded} / {@code :failed} archives, newest first, when archival is on</li>
 *     <li>{@code :job:<id>} latest record state with a TTL, for lookups by id</li>
 * </ul>
 * <p>A record in the processing list belongs to the worker that moved it there; only that
 * worker releases it through {@link #acknowledge}, {@link #reject} or {@link #fail}.
 */
public class QueueService {

    private static final Logger log = LogManager.getLogger(QueueService.class);
    private static final String ABANDONED_ERROR = "Worker stopped responding";

    private final String queueKey;
    private final int maxRetries;
    private final QueueStore store;
    private final HealthMonitor health;
    private final ExecutorService storeExecutor;
    private final QueueConfig config;
    private final JobRecordSerializer serializer;
    private final BackoffPolicy backoff;
    private final AtomicReference<QueueWorker<?>> worker = new AtomicReference<>();

    private final String waitingKey;
    private final String processingKey;
    private final String succeededKey;
    private final String failedKey;

    QueueService(String queueKey, int maxRetries, QueueStore store, HealthMonitor health,
                 ExecutorService storeExecutor, QueueConfig config) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.queueKey = queueKey;
        this.maxRetries = maxRetries;
        this.store = store;
        this.health = health;
        this.storeExecutor = storeExecutor;
        this.config = config;
        this.serializer = new JobRecordSerializer();
        this.backoff = BackoffPolicy.capped(config.getMaxBackoff());

        this.waitingKey = queueKey + ":waiting";
        this.processingKey = queueKey + ":processing";
        this.succeededKey = queueKey + ":succeeded";
        this.failedKey = queueKey + ":failed";
    }

    /**
     * Add a job with an already serialized payload.
     *
     * @return the generated job id, immediately usable with {@link #getJob(String)}
     * @throws StoreUnavailableException if the health check fails; nothing is written
     * @throws StoreException if the store fails or the enqueue deadline passes
     */
    public String enqueue(byte[] payload) throws QueueException {
        if (!health.isHealthy()) {
            throw new StoreUnavailableException("Store is not available. Job cannot be added to queue '" + queueKey + "'");
        }

        JobRecord record = JobRecord.create(payload == null ? new byte[0] : payload, maxRetries,
                config.getDefaultJobTimeout().toMillis(), config.getDefaultBackoffBase().toMillis());
        String json = serializer.serialize(record);
        String jobKey = record.storageKey(queueKey);

        Deadlines.call(storeExecutor, "enqueue job " + record.getId(), config.getEnqueueTimeout(), () -> {
            store.setAndAppendRight(jobKey, waitingKey, json, ttlSeconds());
            return null;
        });

        log.debug("Job {} added to queue '{}'", record.getId(), queueKey);
        return record.getId();
    }

    /**
     * Encode a payload with {@code codec} and add it as a job.
     */
    public <T> String enqueue(T payload, PayloadCodec<T> codec) throws QueueException {
        return enqueue(codec.encode(payload));
    }

    /**
     * Latest stored state of a job.
     *
     * @return empty if the id is unknown or its record expired
     */
    public Optional<JobRecord> getJob(String jobId) throws QueueException {
        String json = timed("get job " + jobId, () -> store.get(JobRecord.storageKey(queueKey, jobId)));
        if (json == null) {
            return Optional.empty();
        }
        return Optional.of(serializer.deserialize(json));
    }

    /**
     * Start this queue's worker with a handler for raw payloads.
     */
    public QueueWorker<byte[]> runWorker(JobHandler<byte[]> handler) {
        return runWorker(ByteArrayCodec.INSTANCE, handler);
    }

    /**
     * Start this queue's worker. A queue has exactly one worker for its lifetime.
     *
     * @throws IllegalStateException if a worker was already started
     */
    public <T> QueueWorker<T> runWorker(PayloadCodec<T> codec, JobHandler<T> handler) {
        QueueWorker<T> candidate = QueueWorker.builder(this, codec, handler)
                .withUnhealthyPause(config.getUnhealthyPause())
                .withErrorPause(config.getErrorPause())
                .build();

        if (!worker.compareAndSet(null, candidate)) {
            candidate.close();
            throw new IllegalStateException("Worker already started for queue '" + queueKey + "'");
        }
        candidate.start();
        return candidate;
    }

    /**
     * Stop the worker if one is running. The queue cannot get a new worker afterwards.
     */
    public void stopWorker() {
        QueueWorker<?> current = worker.get();
        if (current != null) {
            current.stop();
        }
    }

    /**
     * Block up to the configured block timeout for the next waiting job and claim it.
     * The claim counts as an attempt and the record is persisted as PROCESSING.
     *
     * @return the claimed job, or null if none arrived or the entry was undecodable
     */
    public ClaimedJob acquire() throws QueueException {
        int blockSeconds = (int) Math.max(1, (config.getBlockTimeout().toMillis() + 999) / 1000);
        Duration deadline = Duration.ofSeconds(blockSeconds).plus(config.getOperationTimeout());

        String raw = Deadlines.call(storeExecutor, "claim from " + waitingKey, deadline,
                () -> store.moveBlocking(waitingKey, processingKey, blockSeconds));
        if (raw == null) {
            return null;
        }

        JobRecord record;
        try {
            record = serializer.deserialize(raw);
        } catch (SerializationException e) {
            log.error("Parking undecodable entry from queue '{}' on the failed list: {}", queueKey, e.getMessage());
            timed("park undecodable entry", () -> {
                store.removeOne(processingKey, raw);
                store.appendLeft(failedKey, raw);
                return null;
            });
            return null;
        }

        record.incrementAttempts();
        record.markProcessing();
        persist(record);
        return new ClaimedJob(raw, record);
    }

    /**
     * Release a claimed job after its handler succeeded. The record is deleted, or archived
     * to the succeeded list when archival is on.
     */
    public void acknowledge(ClaimedJob claim, String result) throws QueueException {
        JobRecord record = claim.getRecord();
        record.markCompleted(result);
        String jobKey = record.storageKey(queueKey);

        if (config.isRemoveOnSuccess()) {
            timed("acknowledge job " + record.getId(), () -> {
                store.removeOne(processingKey, claim.getRawValue());
                store.delete(jobKey);
                return null;
            });
        } else {
            String json = serializer.serialize(record);
            timed("acknowledge job " + record.getId(), () -> {
                store.removeOne(processingKey, claim.getRawValue());
                store.setWithExpiry(jobKey, json, ttlSeconds());
                store.appendLeft(succeededKey, json);
                return null;
            });
        }
        log.debug("Job {} completed in queue '{}' after {} attempt(s)", record.getId(), queueKey, record.getAttempts());
    }

    /**
     * Release a claimed job after a failed attempt. If retries remain, the RETRYING record is
     * persisted first, then the worker sleeps for the backoff delay while still holding the
     * claim and re-appends the job to the tail of the waiting list. Otherwise the job fails
     * permanently.
     * <p>If the claim was taken over by {@link #recoverAbandoned()} during the sleep, the job
     * is not appended a second time.
     */
    public void reject(ClaimedJob claim, String error) throws QueueException, InterruptedException {
        JobRecord record = claim.getRecord();
        if (!record.canRetry()) {
            fail(claim, error);
            return;
        }

        long delay = retryDelay(record);
        record.markRetrying(error);
        persist(record);
        log.debug("Retrying job {} (attempt {}/{}) after {} ms", record.getId(), record.getAttempts(), record.getMaxRetries(), delay);

        if (delay > 0) {
            Thread.sleep(delay);
        }

        String json = serializer.serialize(record);
        boolean requeued = timed("requeue job " + record.getId(), () -> {
            if (!store.removeOne(processingKey, claim.getRawValue())) {
                return false;
            }
            store.appendRight(waitingKey, json);
            return true;
        });
        if (!requeued) {
            log.warn("Job {} was no longer claimed by this worker, skipping requeue", record.getId());
        }
    }

    /**
     * Fail a claimed job permanently, without retry. The record is deleted, or archived to
     * the failed list when archival is on.
     */
    public void fail(ClaimedJob claim, String error) throws QueueException {
        JobRecord record = claim.getRecord();
        record.markFailed(error);
        String jobKey = record.storageKey(queueKey);

        if (config.isRemoveOnFailure()) {
            timed("fail job " + record.getId(), () -> {
                store.removeOne(processingKey, claim.getRawValue());
                store.delete(jobKey);
                return null;
            });
        } else {
            String json = serializer.serialize(record);
            timed("fail job " + record.getId(), () -> {
                store.removeOne(processingKey, claim.getRawValue());
                store.setWithExpiry(jobKey, json, ttlSeconds());
                store.appendLeft(failedKey, json);
                return null;
            });
        }
        log.debug("Job {} failed permanently after {} attempt(s): {}", record.getId(), record.getAttempts(), error);
    }

    /**
     * Wait for a job to reach COMPLETED or FAILED, polling its record.
     *
     * @throws JobNotFoundException if the record does not exist or expired
     * @throws JobResultTimeoutException if the job is still running when {@code timeout} elapses
     */
    public JobResult getJobResult(String jobId, Duration timeout) throws QueueException, InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        long pollMillis = config.getResultPollInterval().toMillis();

        while (true) {
            JobRecord record = getJob(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
            if (record.getStatus() == Job.Status.COMPLETED) {
                return JobResult.success(jobId, record.getResult());
            }
            if (record.getStatus() == Job.Status.FAILED) {
                return JobResult.failed(jobId, record.getError());
            }

            long remainingMillis = (deadline - System.nanoTime()) / 1_000_000;
            if (remainingMillis <= 0) {
                throw new JobResultTimeoutException(jobId, timeout);
            }
            Thread.sleep(Math.min(pollMillis, remainingMillis));
        }
    }

    /**
     * Lengths of the four lists, read under one operation deadline. A count that cannot be
     * read is reported as 0.
     *
     * @throws StoreUnavailableException if the health check fails or the deadline passes
     */
    public QueueStats stats() throws StoreUnavailableException {
        if (!health.isHealthy()) {
            throw new StoreUnavailableException("Store is not available. Cannot get stats for queue '" + queueKey + "'");
        }
        try {
            return Deadlines.call(storeExecutor, "stats of " + queueKey, config.getOperationTimeout(),
                    () -> new QueueStats(
                            lengthOrZero(waitingKey),
                            lengthOrZero(processingKey),
                            lengthOrZero(succeededKey),
                            lengthOrZero(failedKey)));
        } catch (StoreException e) {
            throw new StoreUnavailableException("Cannot get stats for queue '" + queueKey + "': " + e.getMessage(), e);
        }
    }

    /**
     * Return jobs stuck in the processing list to the tail of the waiting list.
     * <p>An entry is stuck when its latest record is not terminal and was last updated longer
     * ago than the job's timeout plus the configured grace period, which is what a worker
     * that died mid-job leaves behind. A record in its backoff sleep also gets the backoff
     * delay before it counts as stuck.
     * <p>The requeued entry carries the latest record, so attempts made before the crash
     * still count. A job with no attempts left fails instead of going back to waiting.
     * <p>Safe to run from any process: an entry is handled only if this call was the one
     * that removed it from processing.
     *
     * @return number of jobs returned to waiting or failed
     */
    public int recoverAbandoned() throws QueueException {
        long now = System.currentTimeMillis();
        long grace = config.getRecoveryGrace().toMillis();
        int recovered = 0;

        for (String raw : timed("scan " + processingKey, () -> store.range(processingKey))) {
            JobRecord claimed;
            try {
                claimed = serializer.deserialize(raw);
            } catch (SerializationException e) {
                log.warn("Skipping undecodable entry in '{}': {}", processingKey, e.getMessage());
                continue;
            }

            JobRecord latest = getJob(claimed.getId()).orElse(claimed);
            if (latest.getStatus().isTerminal()) {
                continue;
            }
            long allowed = latest.getTimeoutMillis() + grace;
            if (latest.getStatus() == Job.Status.RETRYING) {
                allowed += retryDelay(latest);
            }
            if (now <= latest.getUpdatedAt() + allowed) {
                continue;
            }

            if (latest.canRetry()) {
                if (requeueAbandoned(raw, latest)) {
                    log.info("Recovered abandoned job {} in queue '{}' (attempt {}/{})",
                            latest.getId(), queueKey, latest.getAttempts(), latest.getMaxRetries());
                    recovered++;
                }
            } else if (failAbandoned(raw, latest)) {
                log.warn("Abandoned job {} in queue '{}' has no attempts left, failing it", latest.getId(), queueKey);
                recovered++;
            }
        }
        return recovered;
    }

    private boolean requeueAbandoned(String raw, JobRecord record) throws QueueException {
        record.markRetrying(ABANDONED_ERROR);
        String json = serializer.serialize(record);
        String jobKey = record.storageKey(queueKey);
        return timed("recover job " + record.getId(), () -> {
            if (!store.removeOne(processingKey, raw)) {
                return false;
            }
            store.setWithExpiry(jobKey, json, ttlSeconds());
            store.appendRight(waitingKey, json);
            return true;
        });
    }

    private boolean failAbandoned(String raw, JobRecord record) throws QueueException {
        record.markFailed(ABANDONED_ERROR);
        String json = serializer.serialize(record);
        String jobKey = record.storageKey(queueKey);
        return timed("fail abandoned job " + record.getId(), () -> {
            if (!store.removeOne(processingKey, raw)) {
                return false;
            }
            if (config.isRemoveOnFailure()) {
                store.delete(jobKey);
            } else {
                store.setWithExpiry(jobKey, json, ttlSeconds());
                store.appendLeft(failedKey, json);
            }
            return true;
        });
    }

    /**
     * Drop the failed archive.
     */
    public void purgeFailed() throws QueueException {
        timed("purge " + failedKey, () -> {
            store.delete(failedKey);
            return null;
        });
    }

    public boolean isHealthy() {
        return health.isHealthy();
    }

    /**
     * Namespaced queue key, {@code <environment>_<name>_queue}.
     */
    public String getName() {
        return queueKey;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private long retryDelay(JobRecord record) {
        return backoff.delay(record.getBackoffBaseMillis(), Math.max(0, record.getAttempts() - 1));
    }

    private void persist(JobRecord record) throws QueueException {
        String json = serializer.serialize(record);
        String jobKey = record.storageKey(queueKey);
        timed("persist job " + record.getId(), () -> {
            store.setWithExpiry(jobKey, json, ttlSeconds());
            return null;
        });
    }

    private long lengthOrZero(String listKey) {
        try {
            return store.length(listKey);
        } catch (StoreException e) {
            log.debug("Could not read length of '{}': {}", listKey, e.getMessage());
            return 0;
        }
    }

    private <V> V timed(String operation, Deadlines.StoreCall<V> call) throws StoreException {
        return Deadlines.call(storeExecutor, operation, config.getOperationTimeout(), call);
    }

    private long ttlSeconds() {
        return Math.max(1, config.getJobTtl().toSeconds());
    }

    @Override
    public String toString() {
        return "QueueService{" + queueKey + ", maxRetries=" + maxRetries + "}";
    }
}
