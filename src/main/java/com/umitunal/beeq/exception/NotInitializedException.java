package com.umitunal.beeq.exception;

/**
 * Thrown when a registry is used before {@code init()}.
 */
public class NotInitializedException extends IllegalStateException {

    public NotInitializedException(String message) {
        super(message);
    }
}
