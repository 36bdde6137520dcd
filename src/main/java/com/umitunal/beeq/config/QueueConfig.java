package com.umitunal.beeq.config;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for a queue registry: where the store lives, which environment the
 * queues belong to, archival behaviour and the deadlines applied to store calls.
 */
public class QueueConfig {
    private final String host;
    private final int port;
    private final String username;
    private final String password;
    private final int database;
    private final int poolSize;
    private final String environment;
    private final boolean removeOnSuccess;
    private final boolean removeOnFailure;
    private final Duration jobTtl;
    private final Duration defaultJobTimeout;
    private final Duration defaultBackoffBase;
    private final Duration maxBackoff;
    private final Duration healthCheckTimeout;
    private final Duration connectTimeout;
    private final Duration enqueueTimeout;
    private final Duration operationTimeout;
    private final Duration blockTimeout;
    private final Duration unhealthyPause;
    private final Duration errorPause;
    private final Duration resultPollInterval;
    private final Duration recoveryGrace;

    private QueueConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.username = builder.username;
        this.password = builder.password;
        this.database = builder.database;
        this.poolSize = builder.poolSize;
        this.environment = builder.environment;
        this.removeOnSuccess = builder.removeOnSuccess;
        this.removeOnFailure = builder.removeOnFailure;
        this.jobTtl = builder.jobTtl;
        this.defaultJobTimeout = builder.defaultJobTimeout;
        this.defaultBackoffBase = builder.defaultBackoffBase;
        this.maxBackoff = builder.maxBackoff;
        this.healthCheckTimeout = builder.healthCheckTimeout;
        this.connectTimeout = builder.connectTimeout;
        this.enqueueTimeout = builder.enqueueTimeout;
        this.operationTimeout = builder.operationTimeout;
        this.blockTimeout = builder.blockTimeout;
        this.unhealthyPause = builder.unhealthyPause;
        this.errorPause = builder.errorPause;
        this.resultPollInterval = builder.resultPollInterval;
        this.recoveryGrace = builder.recoveryGrace;
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getUsername() { return username; }
    public String getPassword() { return password; }
    public int getDatabase() { return database; }
    public int getPoolSize() { return poolSize; }
    public String getEnvironment() { return environment; }
    public boolean isRemoveOnSuccess() { return removeOnSuccess; }
    public boolean isRemoveOnFailure() { return removeOnFailure; }
    public Duration getJobTtl() { return jobTtl; }
    public Duration getDefaultJobTimeout() { return defaultJobTimeout; }
    public Duration getDefaultBackoffBase() { return defaultBackoffBase; }
    public Duration getMaxBackoff() { return maxBackoff; }
    public Duration getHealthCheckTimeout() { return healthCheckTimeout; }
    public Duration getConnectTimeout() { return connectTimeout; }
    public Duration getEnqueueTimeout() { return enqueueTimeout; }
    public Duration getOperationTimeout() { return operationTimeout; }
    public Duration getBlockTimeout() { return blockTimeout; }
    public Duration getUnhealthyPause() { return unhealthyPause; }
    public Duration getErrorPause() { return errorPause; }
    public Duration getResultPollInterval() { return resultPollInterval; }
    public Duration getRecoveryGrace() { return recoveryGrace; }

    public static Builder newBuilder(String environment) {
        return new Builder(environment);
    }

    /**
     * Build a configuration from environment variables.
     * Reads REDIS_HOST, REDIS_PORT, REDIS_USERNAME, REDIS_PASSWORD, REDIS_DB,
     * REDIS_POOL_SIZE and ENVIRONMENT; blank credentials are treated as absent.
     *
     * @param env variables, usually {@code System.getenv()}
     * @return builder pre-populated from the variables
     */
    public static Builder fromEnvironment(Map<String, String> env) {
        Builder builder = new Builder(env.getOrDefault("ENVIRONMENT", "development"))
                .withHost(env.getOrDefault("REDIS_HOST", "localhost"))
                .withPort(parseInt(env, "REDIS_PORT", 6379))
                .withDatabase(parseInt(env, "REDIS_DB", 0))
                .withPoolSize(parseInt(env, "REDIS_POOL_SIZE", 10));

        String username = env.get("REDIS_USERNAME");
        String password = env.get("REDIS_PASSWORD");
        if (username != null && !username.isBlank()) {
            builder.withUsername(username);
        }
        if (password != null && !password.isBlank()) {
            builder.withPassword(password);
        }
        return builder;
    }

    private static int parseInt(Map<String, String> env, String name, int fallback) {
        String value = env.get(name);
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + value, e);
        }
    }

    @Override
    public String toString() {
        return String.format("QueueConfig{host='%s', port=%d, db=%d, environment='%s', removeOnSuccess=%s, removeOnFailure=%s}",
                host, port, database, environment, removeOnSuccess, removeOnFailure);
    }

    public static class Builder {
        private final String environment;
        private String host = "localhost";
        private int port = 6379;
        private String username;
        private String password;
        private int database = 0;
        private int poolSize = 10;
        private boolean removeOnSuccess = true;
        private boolean removeOnFailure = false;
        private Duration jobTtl = Duration.ofHours(24);
        private Duration defaultJobTimeout = Duration.ofSeconds(60);
        private Duration defaultBackoffBase = Duration.ofSeconds(2);
        private Duration maxBackoff = Duration.ofMinutes(5);
        private Duration healthCheckTimeout = Duration.ofSeconds(2);
        private Duration connectTimeout = Duration.ofSeconds(3);
        private Duration enqueueTimeout = Duration.ofSeconds(5);
        private Duration operationTimeout = Duration.ofSeconds(3);
        private Duration blockTimeout = Duration.ofSeconds(5);
        private Duration unhealthyPause = Duration.ofSeconds(10);
        private Duration errorPause = Duration.ofSeconds(5);
        private Duration resultPollInterval = Duration.ofMillis(500);
        private Duration recoveryGrace = Duration.ofSeconds(30);

        private Builder(String environment) {
            if (environment == null || environment.isBlank()) {
                throw new IllegalArgumentException("environment must not be blank");
            }
            this.environment = environment;
        }

        public Builder withHost(String host) {
            this.host = host;
            return this;
        }

        public Builder withPort(int port) {
            this.port = port;
            return this;
        }

        public Builder withUsername(String username) {
            this.username = username;
            return this;
        }

        public Builder withPassword(String password) {
            this.password = password;
            return this;
        }

        public Builder withDatabase(int database) {
            this.database = database;
            return this;
        }

        /**
         * Maximum number of pooled store connections.
         * Default: 10
         */
        public Builder withPoolSize(int poolSize) {
            this.poolSize = poolSize;
            return this;
        }

        /**
         * Delete a job's record as soon as it succeeds instead of archiving it.
         * Default: true
         */
        public Builder withRemoveOnSuccess(boolean remove) {
            this.removeOnSuccess = remove;
            return this;
        }

        /**
         * Delete a job's record once it fails permanently instead of archiving it.
         * Default: false
         */
        public Builder withRemoveOnFailure(boolean remove) {
            this.removeOnFailure = remove;
            return this;
        }

        /**
         * Expiry of the per-job record key.
         * Default: 24 hours
         */
        public Builder withJobTtl(Duration ttl) {
            this.jobTtl = ttl;
            return this;
        }

        /**
         * Handler deadline given to newly enqueued jobs.
         * Default: 60 seconds
         */
        public Builder withDefaultJobTimeout(Duration timeout) {
            this.defaultJobTimeout = timeout;
            return this;
        }

        /**
         * Base delay given to newly enqueued jobs.
         * Default: 2 seconds
         */
        public Builder withDefaultBackoffBase(Duration base) {
            this.defaultBackoffBase = base;
            return this;
        }

        /**
         * Upper bound for a single backoff sleep. {@code null} or zero disables the cap.
         * Default: 5 minutes
         */
        public Builder withMaxBackoff(Duration max) {
            this.maxBackoff = max;
            return this;
        }

        public Builder withHealthCheckTimeout(Duration timeout) {
            this.healthCheckTimeout = timeout;
            return this;
        }

        /**
         * How long to wait for a pooled connection.
         * Default: 3 seconds
         */
        public Builder withConnectTimeout(Duration timeout) {
            this.connectTimeout = timeout;
            return this;
        }

        public Builder withEnqueueTimeout(Duration timeout) {
            this.enqueueTimeout = timeout;
            return this;
        }

        public Builder withOperationTimeout(Duration timeout) {
            this.operationTimeout = timeout;
            return this;
        }

        /**
         * How long a worker blocks waiting for a job before looping.
         * Rounded up to whole seconds by the store. Default: 5 seconds
         */
        public Builder withBlockTimeout(Duration timeout) {
            this.blockTimeout = timeout;
            return this;
        }

        public Builder withUnhealthyPause(Duration pause) {
            this.unhealthyPause = pause;
            return this;
        }

        public Builder withErrorPause(Duration pause) {
            this.errorPause = pause;
            return this;
        }

        public Builder withResultPollInterval(Duration interval) {
            this.resultPollInterval = interval;
            return this;
        }

        /**
         * Extra time past a job's own timeout before recovery treats it as abandoned.
         * Default: 30 seconds
         */
        public Builder withRecoveryGrace(Duration grace) {
            this.recoveryGrace = grace;
            return this;
        }

        public QueueConfig build() {
            return new QueueConfig(this);
        }
    }
}
