package com.umitunal.beeq.health;

import com.umitunal.beeq.core.Deadlines;
import com.umitunal.beeq.core.QueueStore;
import com.umitunal.beeq.exception.StoreException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.concurrent.ExecutorService;

/**
 * Liveness probe for the backing store.
 * <p>Checked before enqueue, before stats and before each worker iteration, so that a dead
 * store produces a quick failure instead of a slow timeout on every list operation.
 */
public class HealthMonitor {

    private static final Logger log = LogManager.getLogger(HealthMonitor.class);

    private final QueueStore store;
    private final ExecutorService executor;
    private final Duration timeout;

    public HealthMonitor(QueueStore store, ExecutorService executor, Duration timeout) {
        this.store = store;
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Ping the store once. Never throws.
     *
     * @return false if the ping failed or did not answer within the timeout
     */
    public boolean isHealthy() {
        try {
            return Deadlines.call(executor, "health check", timeout, store::ping);
        } catch (StoreException e) {
            log.debug("Store health check failed: {}", e.getMessage());
            return false;
        }
    }

    public Duration getTimeout() {
        return timeout;
    }
}
