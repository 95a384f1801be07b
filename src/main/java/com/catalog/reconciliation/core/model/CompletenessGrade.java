package com.catalog.reconciliation.core.model;

/**
 * Completeness tier of a canonical product, best first.
 */
public enum CompletenessGrade {
    A_PLUS("A+"),
    A("A"),
    B("B"),
    C("C");

    private final String label;

    CompletenessGrade(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
