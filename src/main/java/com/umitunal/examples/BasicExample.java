package com.umitunal.examples;

import com.umitunal.beeq.config.QueueConfig;
import com.umitunal.beeq.core.JobResult;
import com.umitunal.beeq.queue.QueueRegistry;
import com.umitunal.beeq.queue.QueueService;
import com.umitunal.beeq.serialization.StringCodec;
import com.umitunal.beeq.worker.JobHandler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Basic usage example - enqueue jobs and let a background worker process them.
 * Connects to Redis using the REDIS_* environment variables.
 */
public class BasicExample {

    public static void main(String[] args) {
        System.out.println("=== Basic Queue Example ===\n");

        QueueConfig config = QueueConfig.fromEnvironment(System.getenv())
                .withRemoveOnSuccess(false)
                .build();

        try (QueueRegistry registry = new QueueRegistry(config)) {
            registry.init();
            run(registry);
        } catch (Exception e) {
            e.printStackTrace();
        }
    }

    /**
     * Enqueue three jobs and wait for their results.
     * Results stay readable only if the registry archives successful jobs.
     */
    public static List<JobResult> run(QueueRegistry registry) throws Exception {
        QueueService queue = registry.createQueue("emails", 3);
        StringCodec codec = new StringCodec();

        queue.runWorker(codec, job -> {
            System.out.println("  Sending email to " + job.getPayload());
            return JobHandler.ProcessingResult.success("delivered to " + job.getPayload());
        });

        List<String> jobIds = new ArrayList<>();
        for (String recipient : List.of("alice@example.com", "bob@example.com", "carol@example.com")) {
            jobIds.add(queue.enqueue(recipient, codec));
        }
        System.out.println("Submitted " + jobIds.size() + " jobs");

        List<JobResult> results = new ArrayList<>();
        for (String jobId : jobIds) {
            JobResult result = queue.getJobResult(jobId, Duration.ofSeconds(10));
            System.out.println("  " + result);
            results.add(result);
        }

        System.out.println("\n" + queue.stats());
        queue.stopWorker();
        return results;
    }
}
