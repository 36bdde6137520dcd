package com.umitunal.beeq.worker;

import com.umitunal.beeq.core.Job;

/**
 * Application code run for each claimed job.
 * <p>May be called several times for the same job id across retries, so side effects
 * must be idempotent. Throwing, returning a failure, or overrunning the job's timeout all
 * count as a failed attempt.
 *
 * @param <T> the type of job payload
 */
@FunctionalInterface
public interface JobHandler<T> {

    /**
     * Process a job and return the result.
     *
     * @param job the job to process
     * @return processing result
     * @throws Exception if processing fails
     */
    ProcessingResult process(Job<T> job) throws Exception;

    /**
     * Result of job processing.
     */
    class ProcessingResult {
        private final boolean success;
        private final String message;

        private ProcessingResult(boolean success, String message) {
            this.success = success;
            this.message = message;
        }

        public boolean isSuccess() { return success; }
        public String getMessage() { return message; }

        public static ProcessingResult success() {
            return new ProcessingResult(true, null);
        }

        public static ProcessingResult success(String message) {
            return new ProcessingResult(true, message);
        }

        public static ProcessingResult failure(String message) {
            return new ProcessingResult(false, message);
        }
    }
}
