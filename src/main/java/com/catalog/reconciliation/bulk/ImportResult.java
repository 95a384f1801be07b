package com.catalog.reconciliation.bulk;

import java.util.List;

/**
 * Result of a candidate import.
 *
 * @param totalRecords number of non-blank rows in the input
 * @param imported     rows appended to the raw record store
 * @param duplicates   rows already stored under the same {@code (source_id, last_seen_at)}
 * @param errors       rows that could not be read
 */
public record ImportResult(
        long totalRecords,
        long imported,
        long duplicates,
        List<ImportError> errors
) {
    public ImportResult {
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * A row that failed to import.
     *
     * @param lineNumber the line number in the input (1-based, 0 for stream failures)
     * @param sourceId   the row's source id when it could be read, else empty
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String sourceId, String message) {}

    @Override
    public String toString() {
        return "ImportResult{total=" + totalRecords +
                ", imported=" + imported +
                ", duplicates=" + duplicates +
                ", errors=" + errors.size() + '}';
    }
}
