package com.catalog.reconciliation.bulk;

/**
 * Result of a catalog export.
 *
 * @param totalProducts products written
 * @param runId         run that produced the exported snapshot, null for an empty view
 */
public record ExportResult(long totalProducts, String runId) {

    @Override
    public String toString() {
        return "ExportResult{products=" + totalProducts + ", runId=" + runId + '}';
    }
}
