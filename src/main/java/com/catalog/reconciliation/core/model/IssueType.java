package com.catalog.reconciliation.core.model;

/**
 * Recoverable conditions reported by a reconciliation run.
 */
public enum IssueType {
    ALIAS_UNRESOLVED,
    KEY_COLLISION_DETECTED,
    GUARD_VIOLATION,
    OVERRIDE_CONFLICT,
    SNAPSHOT_RACE
}
