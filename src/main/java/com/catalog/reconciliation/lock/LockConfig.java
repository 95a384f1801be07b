package com.catalog.reconciliation.lock;

import java.time.Duration;

/**
 * Lock acquisition settings.
 *
 * @param timeoutMs maximum time to wait for a held lock
 */
public record LockConfig(long timeoutMs) {

    public LockConfig {
        if (timeoutMs < 0) {
            throw new IllegalArgumentException("timeoutMs must be >= 0");
        }
    }

    /**
     * Default configuration: 5s timeout.
     */
    public static LockConfig defaults() {
        return new LockConfig(5000);
    }

    /**
     * Fails at once when the lock is held; used for run leases.
     */
    public static LockConfig noWait() {
        return new LockConfig(0);
    }

    public static LockConfig of(Duration timeout) {
        return new LockConfig(timeout.toMillis());
    }
}
