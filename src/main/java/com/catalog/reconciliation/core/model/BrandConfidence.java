package com.catalog.reconciliation.core.model;

/**
 * Confidence of a brand canonicalization. {@code LOW} means no alias matched
 * and the slug was generated from the raw brand text.
 */
public enum BrandConfidence {
    HIGH,
    LOW
}
