package com.catalog.reconciliation.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One line of the audit trail.
 *
 * @param sequence position in the trail, starting at 1
 * @param subject  what was acted on: a product key, brand slug, override id or run id
 * @param actorId  who or what performed the action
 * @param runId    reconciliation run in progress when the entry was written, or null
 */
public record AuditEntry(
        long sequence,
        AuditAction action,
        String subject,
        String actorId,
        String runId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be positive");
        }
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public boolean belongsTo(String run) {
        return run != null && run.equals(runId);
    }
}
