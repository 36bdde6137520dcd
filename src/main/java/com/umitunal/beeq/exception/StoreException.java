package com.umitunal.beeq.exception;

/**
 * A call to the backing store failed (connection refused, protocol error, pool exhausted).
 */
public class StoreException extends QueueException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
