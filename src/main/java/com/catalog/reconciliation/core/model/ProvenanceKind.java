package com.catalog.reconciliation.core.model;

/**
 * Where a published field value came from.
 */
public enum ProvenanceKind {
    /** Copied from a contributing raw candidate record. */
    SOURCE,
    /** Supplied by a manually curated override. */
    OVERRIDE,
    /** Computed from other fields (estimates, buckets, name-based inference). */
    DERIVED
}
