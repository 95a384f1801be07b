package com.catalog.reconciliation.publish;

/**
 * What to do with a staged set when guards report violations.
 */
public enum PublishMode {
    /** Publish nothing. */
    STRICT,
    /** Swap in the preview view; leave production on the last promoted snapshot. */
    PREVIEW_ON_VIOLATION
}
