package com.catalog.reconciliation.guard;

import java.util.Objects;

/**
 * One product that breaks a guard.
 */
public record GuardViolation(String guardName, String productKey, String message) {

    public GuardViolation {
        Objects.requireNonNull(guardName, "guardName is required");
        Objects.requireNonNull(productKey, "productKey is required");
    }
}
