package com.umitunal.beeq.health;

import com.umitunal.beeq.storage.FaultyQueueStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.*;

class HealthMonitorTest {

    private FaultyQueueStore store;
    private ExecutorService executor;
    private HealthMonitor monitor;

    @BeforeEach
    void setUp() {
        store = new FaultyQueueStore();
        executor = Executors.newCachedThreadPool();
        monitor = new HealthMonitor(store, executor, Duration.ofMillis(300));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
        store.close();
    }

    @Test
    @DisplayName("Should report a responsive store as healthy")
    void testHealthy() {
        assertThat(monitor.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Should report a refusing store as unhealthy without throwing")
    void testRefused() {
        store.setDown(true);

        assertThat(monitor.isHealthy()).isFalse();
    }

    @Test
    @DisplayName("Should give up on a hanging store within the timeout")
    void testHanging() {
        // Given
        store.setHanging(true);
        long start = System.nanoTime();

        // When
        boolean healthy = monitor.isHealthy();

        // Then
        assertThat(healthy).isFalse();
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("Should recover once the store is back")
    void testRecovery() {
        store.setDown(true);
        assertThat(monitor.isHealthy()).isFalse();

        store.setDown(false);
        assertThat(monitor.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Should report unhealthy when the store is closed")
    void testClosed() {
        store.close();

        assertThat(monitor.isHealthy()).isFalse();
    }
}
