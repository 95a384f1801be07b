package com.catalog.reconciliation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process {@link DistributedLock} using one {@link ReentrantLock} per key.
 * Re-entry is refused, so one thread cannot own the same lease twice.
 */
public class LocalDistributedLock implements DistributedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalDistributedLock.class);

    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final LockConfig config;

    public LocalDistributedLock() {
        this(LockConfig.defaults());
    }

    public LocalDistributedLock(LockConfig config) {
        this.config = config;
    }

    @Override
    public void lock(String key) {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        if (lock.isHeldByCurrentThread()) {
            throw new LockAcquisitionException(key, "Lock '" + key + "' is already held by this owner");
        }
        try {
            boolean acquired = lock.tryLock(config.timeoutMs(), TimeUnit.MILLISECONDS);
            if (!acquired) {
                throw new LockAcquisitionException(key,
                        "Failed to acquire lock '" + key + "' within " + config.timeoutMs() + "ms");
            }
            log.debug("lock.acquired key={}", key);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException(key, "Interrupted while acquiring lock '" + key + "'", e);
        }
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locks.get(key);
        if (lock != null && lock.isHeldByCurrentThread()) {
            lock.unlock();
            log.debug("lock.released key={}", key);
        }
    }

    @Override
    public boolean isLocked(String key) {
        ReentrantLock lock = locks.get(key);
        return lock != null && lock.isLocked();
    }
}
