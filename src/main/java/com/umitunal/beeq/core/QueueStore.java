package com.umitunal.beeq.core;

import com.umitunal.beeq.exception.StoreException;

import java.util.List;

/**
 * Capabilities the queue engine needs from a key/value store with list semantics.
 * Every call may fail with a {@link StoreException}.
 */
public interface QueueStore extends AutoCloseable {

    /**
     * Append a value to the tail of a list.
     */
    void appendRight(String listKey, String value) throws StoreException;

    /**
     * Prepend a value to the head of a list.
     */
    void appendLeft(String listKey, String value) throws StoreException;

    /**
     * Remove and return the head of a list.
     *
     * @return the head, or null if the list is empty
     */
    String popLeft(String listKey) throws StoreException;

    /**
     * Block up to {@code timeoutSeconds} for an item on {@code sourceKey}, then atomically
     * remove it from the head of the source and append it to the tail of {@code destKey}.
     * No two callers can receive the same item, and no observer can see the item in
     * neither list.
     *
     * @return the moved value, or null if nothing arrived in time
     */
    String moveBlocking(String sourceKey, String destKey, int timeoutSeconds) throws StoreException;

    /**
     * Delete the first occurrence of {@code value} from a list.
     *
     * @return true if an element was removed
     */
    boolean removeOne(String listKey, String value) throws StoreException;

    /**
     * Number of elements in a list; 0 for a missing key.
     */
    long length(String listKey) throws StoreException;

    /**
     * All elements of a list, head first.
     */
    List<String> range(String listKey) throws StoreException;

    void setWithExpiry(String key, String value, long ttlSeconds) throws StoreException;

    /**
     * Set {@code key} with an expiry and append the same value to the tail of {@code listKey}
     * as one atomic step: either both writes happen or neither does.
     */
    void setAndAppendRight(String key, String listKey, String value, long ttlSeconds) throws StoreException;

    /**
     * @return the value, or null if the key is missing or expired
     */
    String get(String key) throws StoreException;

    void delete(String key) throws StoreException;

    /**
     * Lightweight round trip used by health checks.
     *
     * @return true if the store answered
     */
    boolean ping() throws StoreException;

    @Override
    void close();
}
