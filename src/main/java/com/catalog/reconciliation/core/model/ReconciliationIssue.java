package com.catalog.reconciliation.core.model;

import java.util.Objects;

/**
 * A recoverable problem observed during a run. Issues are reported on the run
 * result; none of them stops the run on its own.
 *
 * @param type    issue category
 * @param subject what the issue is about (product key, source id, guard name or lease target)
 * @param message human-readable detail
 */
public record ReconciliationIssue(IssueType type, String subject, String message) {

    public ReconciliationIssue {
        Objects.requireNonNull(type, "type is required");
        Objects.requireNonNull(subject, "subject is required");
    }

    public static ReconciliationIssue of(IssueType type, String subject, String message) {
        return new ReconciliationIssue(type, subject, message);
    }
}
