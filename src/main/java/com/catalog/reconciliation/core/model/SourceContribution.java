package com.catalog.reconciliation.core.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Audit entry for one record that took part in a merge.
 *
 * @param sourceId           the contributing record's source id
 * @param fieldsContributed  fields whose published value came from this record
 * @param score              the record's quality score
 */
public record SourceContribution(String sourceId, Set<CatalogField> fieldsContributed, int score) {

    public SourceContribution {
        Objects.requireNonNull(sourceId, "sourceId is required");
        fieldsContributed = fieldsContributed == null || fieldsContributed.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(CatalogField.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(fieldsContributed));
    }

    public boolean contributed(CatalogField field) {
        return fieldsContributed.contains(field);
    }
}
