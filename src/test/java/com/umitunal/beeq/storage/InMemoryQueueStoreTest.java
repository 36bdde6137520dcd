package com.umitunal.beeq.storage;

import com.umitunal.beeq.exception.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class InMemoryQueueStoreTest {

    private InMemoryQueueStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryQueueStore();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    @DisplayName("Should keep FIFO order with append right and pop left")
    void testFifo() throws Exception {
        // Given
        store.appendRight("q", "a");
        store.appendRight("q", "b");
        store.appendLeft("q", "first");

        // Then
        assertThat(store.range("q")).containsExactly("first", "a", "b");
        assertThat(store.popLeft("q")).isEqualTo("first");
        assertThat(store.popLeft("q")).isEqualTo("a");
        assertThat(store.length("q")).isEqualTo(1);
    }

    @Test
    @DisplayName("Should return null when popping an empty list")
    void testPopEmpty() throws Exception {
        assertThat(store.popLeft("missing")).isNull();
        assertThat(store.length("missing")).isZero();
        assertThat(store.range("missing")).isEmpty();
    }

    @Test
    @DisplayName("Should move the head of the source to the tail of the destination")
    void testMove() throws Exception {
        // Given
        store.appendRight("waiting", "job-1");
        store.appendRight("waiting", "job-2");
        store.appendRight("processing", "job-0");

        // When
        String moved = store.moveBlocking("waiting", "processing", 1);

        // Then
        assertThat(moved).isEqualTo("job-1");
        assertThat(store.range("waiting")).containsExactly("job-2");
        assertThat(store.range("processing")).containsExactly("job-0", "job-1");
    }

    @Test
    @DisplayName("Should give up after the block timeout when nothing arrives")
    void testMoveTimeout() throws Exception {
        long start = System.nanoTime();

        String moved = store.moveBlocking("waiting", "processing", 1);

        assertThat(moved).isNull();
        assertThat(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start)).isGreaterThanOrEqualTo(900);
    }

    @Test
    @DisplayName("Should wake a blocked move when an item is appended")
    void testMoveWakesUp() throws Exception {
        // Given
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> future = executor.submit(() -> store.moveBlocking("waiting", "processing", 5));
            Thread.sleep(100);

            // When
            store.appendRight("waiting", "late-job");

            // Then
            assertThat(future.get(2, TimeUnit.SECONDS)).isEqualTo("late-job");
            assertThat(store.range("processing")).containsExactly("late-job");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should deliver each item to exactly one of several consumers")
    void testConcurrentConsumers() throws Exception {
        // Given
        int items = 200;
        for (int i = 0; i < items; i++) {
            store.appendRight("waiting", "job-" + i);
        }
        Set<String> received = ConcurrentHashMap.newKeySet();
        AtomicInteger duplicates = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(4);
        ExecutorService executor = Executors.newFixedThreadPool(4);

        // When
        for (int c = 0; c < 4; c++) {
            executor.submit(() -> {
                try {
                    String value;
                    while ((value = store.moveBlocking("waiting", "processing", 1)) != null) {
                        if (!received.add(value)) {
                            duplicates.incrementAndGet();
                        }
                    }
                } catch (StoreException e) {
                    duplicates.incrementAndGet();
                } finally {
                    done.countDown();
                }
                return null;
            });
        }

        // Then
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdownNow();
        assertThat(duplicates.get()).isZero();
        assertThat(received).hasSize(items);
        assertThat(store.length("waiting")).isZero();
        assertThat(store.length("processing")).isEqualTo(items);
    }

    @Test
    @DisplayName("Should remove only the first matching element")
    void testRemoveOne() throws Exception {
        // Given
        store.appendRight("processing", "x");
        store.appendRight("processing", "y");
        store.appendRight("processing", "x");

        // When / Then
        assertThat(store.removeOne("processing", "x")).isTrue();
        assertThat(store.range("processing")).containsExactly("y", "x");
        assertThat(store.removeOne("processing", "z")).isFalse();
    }

    @Test
    @DisplayName("Should expire keys after their TTL")
    void testExpiry() throws Exception {
        // Given
        store.setWithExpiry("job:1", "value", 1);

        // Then
        assertThat(store.get("job:1")).isEqualTo("value");
        Thread.sleep(1100);
        assertThat(store.get("job:1")).isNull();
    }

    @Test
    @DisplayName("Should evict expired keys on demand")
    void testEvictExpired() throws Exception {
        store.setWithExpiry("short", "v", 0);
        store.setWithExpiry("long", "v", 60);

        assertThat(store.evictExpired()).isEqualTo(1);
        assertThat(store.get("long")).isEqualTo("v");
    }

    @Test
    @DisplayName("Should set a key and append to a list in one step")
    void testSetAndAppendRight() throws Exception {
        // Given
        store.appendRight("waiting", "older");

        // When
        store.setAndAppendRight("job:1", "waiting", "record", 60);

        // Then
        assertThat(store.get("job:1")).isEqualTo("record");
        assertThat(store.range("waiting")).containsExactly("older", "record");
    }

    @Test
    @DisplayName("Should delete values and lists")
    void testDelete() throws Exception {
        store.setWithExpiry("job:1", "value", 60);
        store.appendRight("failed", "x");

        store.delete("job:1");
        store.delete("failed");

        assertThat(store.get("job:1")).isNull();
        assertThat(store.length("failed")).isZero();
    }

    @Test
    @DisplayName("Should fail every call once closed")
    void testClosed() throws Exception {
        assertThat(store.ping()).isTrue();

        store.close();

        assertThatThrownBy(() -> store.ping()).isInstanceOf(StoreException.class);
        assertThatThrownBy(() -> store.appendRight("q", "v")).isInstanceOf(StoreException.class);
    }

    @Test
    @DisplayName("Should release a blocked move when closed")
    void testCloseWakesMove() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<String> future = executor.submit(() -> store.moveBlocking("waiting", "processing", 10));
            Thread.sleep(100);

            store.close();

            assertThatThrownBy(() -> future.get(2, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(StoreException.class);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should return a copy from range")
    void testRangeIsCopy() throws Exception {
        store.appendRight("q", "a");
        List<String> snapshot = store.range("q");

        store.appendRight("q", "b");

        assertThat(snapshot).containsExactly("a");
    }
}
