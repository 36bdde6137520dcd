package com.umitunal.beeq.queue;

import com.umitunal.beeq.config.QueueConfig;
import com.umitunal.beeq.core.QueueStore;
import com.umitunal.beeq.exception.AlreadyInitializedException;
import com.umitunal.beeq.exception.NotInitializedException;
import com.umitunal.beeq.health.HealthMonitor;
import com.umitunal.beeq.storage.RedisQueueStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Binds queue names to one shared store connection.
 * <p>Pass the registry to the components that need queues instead of reaching for a global.
 * Within a registry each name maps to exactly one {@link QueueService}, and queue keys are
 * prefixed with the environment so deployments sharing a store do not collide.
 */
public class QueueRegistry implements AutoCloseable {

    private static final Logger log = LogManager.getLogger(QueueRegistry.class);

    private final QueueConfig config;
    private final Function<QueueConfig, QueueStore> storeFactory;
    private final ConcurrentMap<String, QueueService> queues = new ConcurrentHashMap<>();

    private volatile QueueStore store;
    private volatile HealthMonitor health;
    private volatile ExecutorService storeExecutor;

    /**
     * Registry backed by Redis.
     */
    public QueueRegistry(QueueConfig config) {
        this(config, RedisQueueStore::new);
    }

    /**
     * Registry backed by whatever store {@code storeFactory} builds on {@link #init()}.
     */
    public QueueRegistry(QueueConfig config, Function<QueueConfig, QueueStore> storeFactory) {
        this.config = config;
        this.storeFactory = storeFactory;
    }

    /**
     * Open the shared store connection.
     *
     * @throws AlreadyInitializedException if called more than once
     */
    public synchronized void init() {
        if (store != null) {
            throw new AlreadyInitializedException("Queue registry already initialized");
        }

        AtomicInteger threadCount = new AtomicInteger();
        this.storeExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "beeq-store-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.store = storeFactory.apply(config);
        this.health = new HealthMonitor(store, storeExecutor, config.getHealthCheckTimeout());

        log.info("Queue registry initialized: {}", config);
    }

    /**
     * Get the queue for {@code name}, creating it on first use.
     *
     * @throws NotInitializedException if {@link #init()} has not been called
     * @throws IllegalArgumentException if the queue exists with a different retry limit
     */
    public QueueService createQueue(String name, int maxRetries) {
        if (store == null) {
            throw new NotInitializedException("Queue registry not initialized. Call init() first");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Queue name must not be blank");
        }

        String queueKey = queueKey(config.getEnvironment(), name);
        QueueService queue = queues.computeIfAbsent(queueKey,
                key -> new QueueService(key, maxRetries, store, health, storeExecutor, config));

        if (queue.getMaxRetries() != maxRetries) {
            throw new IllegalArgumentException("Queue '" + queueKey + "' already exists with maxRetries="
                    + queue.getMaxRetries());
        }
        return queue;
    }

    public static String queueKey(String environment, String name) {
        return environment + "_" + name + "_queue";
    }

    public boolean isInitialized() {
        return store != null;
    }

    public HealthMonitor getHealthMonitor() {
        return health;
    }

    public QueueConfig getConfig() {
        return config;
    }

    /**
     * Stop every worker, then release the store connection.
     */
    @Override
    public synchronized void close() {
        queues.values().forEach(QueueService::stopWorker);
        if (storeExecutor != null) {
            storeExecutor.shutdownNow();
        }
        if (store != null) {
            store.close();
        }
        log.info("Queue registry closed ({} queue(s))", queues.size());
    }
}
