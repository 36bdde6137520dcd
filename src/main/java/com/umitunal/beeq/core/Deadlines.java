package com.umitunal.beeq.core;

import com.umitunal.beeq.exception.StoreException;
import com.umitunal.beeq.exception.StoreTimeoutException;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs store calls on an executor so a deadline can fire while the call is still blocked.
 */
public final class Deadlines {

    private Deadlines() {
    }

    /**
     * A store call that may fail with a store error.
     */
    @FunctionalInterface
    public interface StoreCall<V> {
        V call() throws StoreException;
    }

    /**
     * Run {@code call} and wait at most {@code deadline} for it.
     * On timeout the call is interrupted and a {@link StoreTimeoutException} is thrown.
     */
    public static <V> V call(ExecutorService executor, String operation, Duration deadline, StoreCall<V> call)
            throws StoreException {
        Future<V> future;
        try {
            Callable<V> task = call::call;
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            throw new StoreException(operation + " rejected: executor is shut down", e);
        }

        try {
            return future.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new StoreTimeoutException(operation, deadline);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new StoreException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StoreException) {
                throw (StoreException) cause;
            }
            throw new StoreException(operation + " failed: " + cause, cause);
        }
    }
}
