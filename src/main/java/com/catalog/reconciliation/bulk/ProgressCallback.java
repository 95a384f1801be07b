package com.catalog.reconciliation.bulk;

/**
 * Callback interface for tracking progress of bulk imports and exports.
 */
@FunctionalInterface
public interface ProgressCallback {

    /**
     * Called to report progress.
     *
     * @param processed the number of rows processed so far
     * @param total     the total number of rows (may be -1 if unknown)
     * @param message   optional progress message
     */
    void onProgress(long processed, long total, String message);

    /**
     * A no-op progress callback.
     */
    ProgressCallback NOOP = (processed, total, message) -> {};
}
