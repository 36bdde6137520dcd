package com.umitunal.beeq.exception;

/**
 * Thrown when a registry is initialized a second time.
 */
public class AlreadyInitializedException extends IllegalStateException {

    public AlreadyInitializedException(String message) {
        super(message);
    }
}
