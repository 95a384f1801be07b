package com.catalog.reconciliation.review;

/**
 * State of a collision review item. APPROVED means merge, REJECTED means split.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED
}
