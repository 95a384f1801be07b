package com.catalog.reconciliation.core.model;

/**
 * Terminal status of one reconciliation run.
 */
public enum RunStatus {
    /** Staged set swapped in; production view promoted. */
    PUBLISHED,
    /** Preview swapped in with known violations; production view left untouched. */
    PUBLISHED_PREVIEW_ONLY,
    /** Guards failed in strict mode; nothing swapped in. */
    BLOCKED_BY_GUARDS,
    /** Another run holds the lease for the same target. */
    REFUSED_LEASE_HELD,
    CANCELLED,
    TIMED_OUT,
    FAILED;

    public boolean isPublished() {
        return this == PUBLISHED || this == PUBLISHED_PREVIEW_ONLY;
    }
}
