package com.umitunal.beeq.storage;

import com.umitunal.beeq.core.QueueStore;
import com.umitunal.beeq.exception.StoreException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process implementation of QueueStore with the same list and expiry semantics as Redis.
 * <p>Everything is guarded by one lock, so the blocking move is atomic with respect to every
 * other call. Expired keys are dropped lazily when read. Data does not survive the process.
 */
public class InMemoryQueueStore implements QueueStore {

    private final Map<String, Deque<String>> lists = new HashMap<>();
    private final Map<String, Entry> values = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition itemAdded = lock.newCondition();
    private boolean closed;

    @Override
    public void appendRight(String listKey, String value) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            lists.computeIfAbsent(listKey, k -> new ArrayDeque<>()).addLast(value);
            itemAdded.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void appendLeft(String listKey, String value) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            lists.computeIfAbsent(listKey, k -> new ArrayDeque<>()).addFirst(value);
            itemAdded.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String popLeft(String listKey) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            return pollFirst(listKey);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String moveBlocking(String sourceKey, String destKey, int timeoutSeconds) throws StoreException {
        long remaining = TimeUnit.SECONDS.toNanos(Math.max(timeoutSeconds, 0));
        lock.lock();
        try {
            ensureOpen();
            while (isEmpty(sourceKey)) {
                if (remaining <= 0) {
                    return null;
                }
                try {
                    remaining = itemAdded.awaitNanos(remaining);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new StoreException("Interrupted while waiting on " + sourceKey, e);
                }
                ensureOpen();
            }
            String value = pollFirst(sourceKey);
            lists.computeIfAbsent(destKey, k -> new ArrayDeque<>()).addLast(value);
            return value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean removeOne(String listKey, String value) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            Deque<String> list = lists.get(listKey);
            if (list == null) {
                return false;
            }
            boolean removed = list.removeFirstOccurrence(value);
            if (list.isEmpty()) {
                lists.remove(listKey);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long length(String listKey) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            Deque<String> list = lists.get(listKey);
            return list == null ? 0 : list.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<String> range(String listKey) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            Deque<String> list = lists.get(listKey);
            return list == null ? new ArrayList<>() : new ArrayList<>(list);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setWithExpiry(String key, String value, long ttlSeconds) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            long expiresAt = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(ttlSeconds);
            values.put(key, new Entry(value, expiresAt));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setAndAppendRight(String key, String listKey, String value, long ttlSeconds) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            long expiresAt = System.currentTimeMillis() + TimeUnit.SECONDS.toMillis(ttlSeconds);
            values.put(key, new Entry(value, expiresAt));
            lists.computeIfAbsent(listKey, k -> new ArrayDeque<>()).addLast(value);
            itemAdded.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String get(String key) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            Entry entry = values.get(key);
            if (entry == null) {
                return null;
            }
            if (entry.isExpired()) {
                values.remove(key);
                return null;
            }
            return entry.value;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void delete(String key) throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            values.remove(key);
            lists.remove(key);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean ping() throws StoreException {
        lock.lock();
        try {
            ensureOpen();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every expired key now instead of waiting for it to be read.
     *
     * @return number of keys dropped
     */
    public int evictExpired() {
        lock.lock();
        try {
            int evicted = 0;
            Iterator<Entry> it = values.values().iterator();
            while (it.hasNext()) {
                if (it.next().isExpired()) {
                    it.remove();
                    evicted++;
                }
            }
            return evicted;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        lock.lock();
        try {
            closed = true;
            lists.clear();
            values.clear();
            itemAdded.signalAll();
        } finally {
            lock.unlock();
        }
    }

    private boolean isEmpty(String listKey) {
        Deque<String> list = lists.get(listKey);
        return list == null || list.isEmpty();
    }

    private String pollFirst(String listKey) {
        Deque<String> list = lists.get(listKey);
        if (list == null) {
            return null;
        }
        String value = list.pollFirst();
        if (list.isEmpty()) {
            lists.remove(listKey);
        }
        return value;
    }

    private void ensureOpen() throws StoreException {
        if (closed) {
            throw new StoreException("Store is closed");
        }
    }

    private static final class Entry {
        private final String value;
        private final long expiresAt;

        private Entry(String value, long expiresAt) {
            this.value = value;
            this.expiresAt = expiresAt;
        }

        private boolean isExpired() {
            return System.currentTimeMillis() >= expiresAt;
        }
    }
}
