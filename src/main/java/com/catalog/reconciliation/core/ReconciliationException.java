package com.catalog.reconciliation.core;

/**
 * Unexpected failure inside a run, such as a merge shard throwing. The run aborts
 * and nothing is published.
 */
public class ReconciliationException extends RuntimeException {

    public ReconciliationException(String message) {
        super(message);
    }

    public ReconciliationException(String message, Throwable cause) {
        super(message, cause);
    }
}
