package com.contractradar.common;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-minute throttle for third-party HTTP providers (Birdeye, RugCheck, SolanaFM).
 * Spaces permits evenly; callers on analysis threads block until their slot.
 */
public class TokenBucketLimiter {

    private final String name;
    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos;

    public TokenBucketLimiter(String name, int permitsPerMinute) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive for " + name);
        }
        this.name = name;
        this.minIntervalNanos = 60_000_000_000L / permitsPerMinute;
        // nanoTime has an arbitrary origin, so the first slot is relative to construction
        this.nextFreeAtNanos = new AtomicLong(System.nanoTime());
    }

    public String getName() {
        return name;
    }

    /**
     * Blocks until a permit is available.
     *
     * @throws IllegalStateException if the waiting thread is interrupted (run cancelled)
     */
    public void acquire() {
        while (true) {
            long now = System.nanoTime();
            long next = nextFreeAtNanos.get();
            if (now - next >= 0) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return;
                }
                continue;
            }
            long sleepNanos = next - now;
            try {
                Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Rate limiter " + name + " interrupted", e);
            }
        }
    }

    /**
     * Takes a permit only if one is free right now.
     */
    public boolean tryAcquire() {
        long now = System.nanoTime();
        long next = nextFreeAtNanos.get();
        return now - next >= 0 && nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos);
    }
}
