package com.umitunal.examples;

import com.umitunal.beeq.config.QueueConfig;
import com.umitunal.beeq.model.JobRecord;
import com.umitunal.beeq.queue.QueueRegistry;
import com.umitunal.beeq.queue.QueueService;
import com.umitunal.beeq.serialization.StringCodec;
import com.umitunal.beeq.worker.JobHandler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retry mechanism example - a flaky handler fails twice before it succeeds.
 */
public class RetryExample {

    public static void main(String[] args) {
        System.out.println("=== Retry Mechanism Example ===\n");

        QueueConfig config = QueueConfig.fromEnvironment(System.getenv())
                .withRemoveOnSuccess(false)
                .withDefaultBackoffBase(Duration.ofMillis(500))
                .build();

        try (QueueRegistry registry = new QueueRegistry(config)) {
            registry.init();
            run(registry);
        } catch (Exception e) {
            e.printStackTrace();
        }
    }

    /**
     * Run one flaky job to completion.
     *
     * @return the job's final record
     */
    public static JobRecord run(QueueRegistry registry) throws Exception {
        QueueService queue = registry.createQueue("flaky", 3);
        AtomicInteger calls = new AtomicInteger();

        queue.runWorker(new StringCodec(), job -> {
            int attempt = calls.incrementAndGet();
            System.out.println("Attempt " + attempt + ": " + job.getPayload());
            if (attempt < 3) {
                System.out.println("  Failed - will retry");
                throw new IllegalStateException("Connection timeout");
            }
            System.out.println("  Success!");
            return JobHandler.ProcessingResult.success();
        });

        String jobId = queue.enqueue("Unreliable API call", new StringCodec());
        System.out.println("Submitted job with max 3 attempts");

        System.out.println("\n" + queue.getJobResult(jobId, Duration.ofSeconds(30)));
        JobRecord record = queue.getJob(jobId).orElseThrow();
        System.out.println(record);

        queue.stopWorker();
        return record;
    }
}
