package com.umitunal.beeq.worker;

import com.umitunal.beeq.core.Job;
import com.umitunal.beeq.exception.QueueException;
import com.umitunal.beeq.exception.SerializationException;
import com.umitunal.beeq.model.ClaimedJob;
import com.umitunal.beeq.model.DecodedJob;
import com.umitunal.beeq.model.JobRecord;
import com.umitunal.beeq.queue.QueueService;
import com.umitunal.beeq.serialization.PayloadCodec;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The single worker loop of a queue: claims jobs, runs the handler under the job's timeout
 * and reports the outcome back to the queue.
 * <p>Job failures and store outages never end the loop; it only stops on {@link #stop()}.
 *
 * @param <T> the type of job payload
 */
public class QueueWorker<T> implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(QueueWorker.class);

    private final QueueService queue;
    private final PayloadCodec<T> codec;
    private final JobHandler<T> handler;
    private final Duration unhealthyPause;
    private final Duration errorPause;
    private final ExecutorService handlerExecutor;
    private final AtomicBoolean running;
    private final AtomicLong processedCount;
    private final AtomicLong failedCount;

    private volatile Thread workerThread;

    private QueueWorker(Builder<T> builder) {
        this.queue = builder.queue;
        this.codec = builder.codec;
        this.handler = builder.handler;
        this.unhealthyPause = builder.unhealthyPause;
        this.errorPause = builder.errorPause;
        this.running = new AtomicBoolean(false);
        this.processedCount = new AtomicLong(0);
        this.failedCount = new AtomicLong(0);

        AtomicInteger threadCount = new AtomicInteger();
        String prefix = "beeq-handler-" + queue.getName() + "-";
        this.handlerExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, prefix + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Start the worker in the background. Has no effect if already started.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            workerThread = new Thread(this::run, "beeq-worker-" + queue.getName());
            workerThread.setDaemon(true);
            workerThread.start();
        }
    }

    /**
     * Stop the worker. A job caught mid-flight stays in the processing list
     * until {@link QueueService#recoverAbandoned()} returns it.
     */
    public void stop() {
        running.set(false);
        if (workerThread != null) {
            workerThread.interrupt();
            try {
                workerThread.join(5000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        handlerExecutor.shutdownNow();
    }

    /**
     * Claim and process a single job synchronously.
     *
     * @return false if no job arrived within the queue's block timeout
     */
    public boolean processOne() throws QueueException, InterruptedException {
        ClaimedJob claim = queue.acquire();
        if (claim == null) {
            return false;
        }

        JobRecord record = claim.getRecord();
        T payload;
        try {
            payload = codec.decode(record.getPayload());
        } catch (SerializationException e) {
            log.warn("Job {} in queue '{}' has an undecodable payload: {}", record.getId(), queue.getName(), e.getMessage());
            queue.fail(claim, "Payload decode failed: " + e.getMessage());
            failedCount.incrementAndGet();
            return true;
        }

        log.debug("Processing job {} in queue '{}' (attempt {}/{})",
                record.getId(), queue.getName(), record.getAttempts(), record.getMaxRetries());

        Outcome outcome = invoke(new DecodedJob<>(record, payload), record.getTimeoutMillis());
        if (outcome.success) {
            queue.acknowledge(claim, outcome.message);
            processedCount.incrementAndGet();
        } else {
            log.debug("Job {} failed: {}", record.getId(), outcome.message);
            queue.reject(claim, outcome.message);
            failedCount.incrementAndGet();
        }
        return true;
    }

    /**
     * Run the handler on the handler pool and wait at most {@code timeoutMillis}.
     */
    private Outcome invoke(Job<T> job, long timeoutMillis) throws InterruptedException {
        Future<JobHandler.ProcessingResult> future = handlerExecutor.submit(() -> handler.process(job));
        try {
            JobHandler.ProcessingResult result = future.get(timeoutMillis, TimeUnit.MILLISECONDS);
            if (result == null) {
                return Outcome.success(null);
            }
            if (result.isSuccess()) {
                return Outcome.success(result.getMessage());
            }
            return Outcome.failure(result.getMessage() != null ? result.getMessage() : "Handler reported failure");
        } catch (TimeoutException e) {
            // Interrupt the handler; it stops only if it honours interruption
            future.cancel(true);
            return Outcome.failure("Job timed out after " + timeoutMillis + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            return Outcome.failure(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private void run() {
        log.info("Worker started for queue: {}", queue.getName());

        while (running.get()) {
            try {
                if (!queue.isHealthy()) {
                    log.warn("Queue {} store health check failed, waiting {} ms", queue.getName(), unhealthyPause.toMillis());
                    Thread.sleep(unhealthyPause.toMillis());
                    continue;
                }
                processOne();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (QueueException | RuntimeException e) {
                if (!running.get()) {
                    break;
                }
                log.error("Worker for queue {} hit an error: {}", queue.getName(), e.getMessage(), e);
                if (!pause(errorPause)) {
                    break;
                }
            }
        }

        log.info("Worker stopped for queue: {}", queue.getName());
    }

    private boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public String getQueueName() { return queue.getName(); }
    public long getProcessedCount() { return processedCount.get(); }
    public long getFailedCount() { return failedCount.get(); }
    public boolean isRunning() { return running.get(); }

    @Override
    public void close() {
        stop();
    }

    private static final class Outcome {
        private final boolean success;
        private final String message;

        private Outcome(boolean success, String message) {
            this.success = success;
            this.message = message;
        }

        static Outcome success(String result) {
            return new Outcome(true, result);
        }

        static Outcome failure(String error) {
            return new Outcome(false, error);
        }
    }

    public static <T> Builder<T> builder(QueueService queue, PayloadCodec<T> codec, JobHandler<T> handler) {
        return new Builder<>(queue, codec, handler);
    }

    public static class Builder<T> {
        private final QueueService queue;
        private final PayloadCodec<T> codec;
        private final JobHandler<T> handler;
        private Duration unhealthyPause = Duration.ofSeconds(10);
        private Duration errorPause = Duration.ofSeconds(5);

        private Builder(QueueService queue, PayloadCodec<T> codec, JobHandler<T> handler) {
            this.queue = queue;
            this.codec = codec;
            this.handler = handler;
        }

        /**
         * Pause between health checks while the store is down.
         */
        public Builder<T> withUnhealthyPause(Duration pause) {
            this.unhealthyPause = pause;
            return this;
        }

        /**
         * Pause after a store error inside the loop.
         */
        public Builder<T> withErrorPause(Duration pause) {
            this.errorPause = pause;
            return this;
        }

        public QueueWorker<T> build() {
            return new QueueWorker<>(this);
        }
    }
}
