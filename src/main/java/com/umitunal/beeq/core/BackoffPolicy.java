package com.umitunal.beeq.core;

import java.time.Duration;

/**
 * Exponential backoff: {@code delay = base * 2^attempts}.
 * <p>Growth is unbounded unless a cap is set; past roughly twenty attempts the raw value
 * exceeds any practical wait, so queues are built with a cap by default.
 */
public final class BackoffPolicy {
    private final long maxDelayMillis;

    private BackoffPolicy(long maxDelayMillis) {
        this.maxDelayMillis = maxDelayMillis;
    }

    /**
     * Policy without a cap. The result saturates at {@code Long.MAX_VALUE} instead of overflowing.
     */
    public static BackoffPolicy unbounded() {
        return new BackoffPolicy(Long.MAX_VALUE);
    }

    /**
     * Policy whose delays never exceed {@code maxDelay}. A null or non-positive cap means unbounded.
     */
    public static BackoffPolicy capped(Duration maxDelay) {
        if (maxDelay == null || maxDelay.isZero() || maxDelay.isNegative()) {
            return unbounded();
        }
        return new BackoffPolicy(maxDelay.toMillis());
    }

    /**
     * Delay in milliseconds for the given attempt count.
     *
     * @param baseMillis base delay, must not be negative
     * @param attempts number of attempts, must not be negative
     */
    public long delay(long baseMillis, int attempts) {
        if (baseMillis < 0 || attempts < 0) {
            throw new IllegalArgumentException("base and attempts must be >= 0");
        }
        if (baseMillis == 0) {
            return 0;
        }
        long raw;
        if (attempts >= Long.SIZE - 1 || baseMillis > (Long.MAX_VALUE >> attempts)) {
            raw = Long.MAX_VALUE;
        } else {
            raw = baseMillis << attempts;
        }
        return Math.min(raw, maxDelayMillis);
    }

    public long getMaxDelayMillis() {
        return maxDelayMillis;
    }
}
