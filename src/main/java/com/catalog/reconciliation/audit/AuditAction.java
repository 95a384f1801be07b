package com.catalog.reconciliation.audit;

/**
 * Auditable actions of the reconciliation system.
 */
public enum AuditAction {
    RUN_STARTED,
    RUN_COMPLETED,
    RUN_REFUSED,
    CATALOG_PUBLISHED,
    PROMOTION_BLOCKED,
    OVERRIDE_CREATED,
    OVERRIDE_REVOKED,
    OVERRIDE_SKIPPED,
    KEY_COLLISION_SUBMITTED,
    KEY_MERGE_APPROVED,
    KEY_SPLIT_CONFIRMED,
    BRAND_ALLOWLIST_ADDED,
    BRAND_STATUS_CHANGED
}
