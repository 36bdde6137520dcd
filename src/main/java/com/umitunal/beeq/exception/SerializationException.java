package com.umitunal.beeq.exception;

/**
 * A payload or job record could not be encoded or decoded. Never retried.
 */
public class SerializationException extends QueueException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
