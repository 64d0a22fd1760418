package com.contractradar.detection;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Set when the stream subscriber goes away. Detectors poll it at step boundaries.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
