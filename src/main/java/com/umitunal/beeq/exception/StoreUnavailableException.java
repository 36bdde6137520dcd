package com.umitunal.beeq.exception;

/**
 * The health check reported the store as down; the operation was not attempted.
 */
public class StoreUnavailableException extends QueueException {

    public StoreUnavailableException(String message) {
        super(message);
    }

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
