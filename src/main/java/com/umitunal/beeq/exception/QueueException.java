package com.umitunal.beeq.exception;

/**
 * Base type for every error the queue engine reports to its callers.
 */
public class QueueException extends Exception {

    public QueueException(String message) {
        super(message);
    }

    public QueueException(String message, Throwable cause) {
        super(message, cause);
    }
}
