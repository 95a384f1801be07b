package com.catalog.reconciliation.lock;

/**
 * Thrown when a run lease or an override write lock cannot be taken.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String key;

    public LockAcquisitionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public LockAcquisitionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
