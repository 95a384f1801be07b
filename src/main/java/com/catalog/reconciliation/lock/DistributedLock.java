package com.catalog.reconciliation.lock;

/**
 * Single-owner lock per key. Backs the reconciliation lease (one run per snapshot
 * target) and the single-writer rule for override edits.
 */
public interface DistributedLock {

    /**
     * Acquires the lock on {@code key}, waiting at most the configured timeout.
     *
     * @throws LockAcquisitionException if the lock is held by another owner, or already
     *                                  held by the caller
     */
    void lock(String key);

    /**
     * Releases the lock on {@code key} if the caller holds it.
     */
    void unlock(String key);

    boolean isLocked(String key);
}
