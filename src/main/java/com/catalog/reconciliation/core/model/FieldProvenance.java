package com.catalog.reconciliation.core.model;

import java.util.Objects;

/**
 * Provenance of a single published field.
 *
 * @param kind     origin of the value
 * @param sourceId contributing source for SOURCE values, the record a DERIVED value
 *                 was computed from (may be null), or the override id for OVERRIDE values
 */
public record FieldProvenance(ProvenanceKind kind, String sourceId) {

    public FieldProvenance {
        Objects.requireNonNull(kind, "kind is required");
        if (kind == ProvenanceKind.SOURCE && sourceId == null) {
            throw new IllegalArgumentException("SOURCE provenance requires a sourceId");
        }
    }

    public static FieldProvenance source(String sourceId) {
        return new FieldProvenance(ProvenanceKind.SOURCE, sourceId);
    }

    public static FieldProvenance override(String overrideId) {
        return new FieldProvenance(ProvenanceKind.OVERRIDE, overrideId);
    }

    public static FieldProvenance derived(String fromSourceId) {
        return new FieldProvenance(ProvenanceKind.DERIVED, fromSourceId);
    }

    public static FieldProvenance derived() {
        return new FieldProvenance(ProvenanceKind.DERIVED, null);
    }

    /**
     * Label used in exports: the source id, {@code "override"} or {@code "derived"}.
     */
    public String label() {
        return switch (kind) {
            case SOURCE -> sourceId;
            case OVERRIDE -> "override";
            case DERIVED -> "derived";
        };
    }

    public boolean isOverride() {
        return kind == ProvenanceKind.OVERRIDE;
    }

    public boolean isDerived() {
        return kind == ProvenanceKind.DERIVED;
    }
}
