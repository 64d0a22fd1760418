package com.contractradar.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with symmetric jitter, capped at {@code maxDelayMs}. Shared by the chain RPC
 * client and the provider clients.
 */
public final class RetryPolicy {

    private static final long DEFAULT_MAX_DELAY_MS = 8_000L;

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;
    private final long maxDelayMs;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        this(baseDelayMs, jitterFactor, maxAttempts, DEFAULT_MAX_DELAY_MS);
    }

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts, long maxDelayMs) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.baseDelayMs = baseDelayMs;
        this.jitterFactor = jitterFactor;
        this.maxAttempts = maxAttempts;
        this.maxDelayMs = Math.max(baseDelayMs, maxDelayMs);
    }

    /**
     * Delay before retry number {@code attempt + 1}: baseDelay * 2^attempt, capped, then jittered.
     */
    public long delayMs(int attempt) {
        int shift = Math.max(0, Math.min(attempt, 20));
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor <= 0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * 500ms base, ±20% jitter, 3 attempts. Analysis is interactive, so retries stay short.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3);
    }
}
