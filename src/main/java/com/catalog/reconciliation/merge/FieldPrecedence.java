package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.model.CatalogField;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.catalog.reconciliation.merge.ResolutionStep.BEST_AVAILABLE;
import static com.catalog.reconciliation.merge.ResolutionStep.BEST_SCORED_BASE;
import static com.catalog.reconciliation.merge.ResolutionStep.DERIVED;
import static com.catalog.reconciliation.merge.ResolutionStep.OVERRIDE;
import static com.catalog.reconciliation.merge.ResolutionStep.UNION_ALL;

/**
 * Ordered resolution chain for every published field, evaluated left to right.
 * {@link ResolutionStep#OVERRIDE} may only come first and {@link ResolutionStep#DERIVED}
 * only last.
 */
public final class FieldPrecedence {

    private final Map<CatalogField, List<ResolutionStep>> chains;

    private FieldPrecedence(Map<CatalogField, List<ResolutionStep>> chains) {
        for (CatalogField field : CatalogField.values()) {
            List<ResolutionStep> chain = chains.get(field);
            if (chain == null || chain.isEmpty()) {
                throw new IllegalArgumentException("No resolution chain for field " + field.wireName());
            }
            int override = chain.indexOf(OVERRIDE);
            int derived = chain.indexOf(DERIVED);
            if (override > 0) {
                throw new IllegalArgumentException("override must lead the chain of " + field.wireName());
            }
            if (derived >= 0 && derived != chain.size() - 1) {
                throw new IllegalArgumentException("derived-default must end the chain of " + field.wireName());
            }
        }
        EnumMap<CatalogField, List<ResolutionStep>> copy = new EnumMap<>(CatalogField.class);
        chains.forEach((field, chain) -> copy.put(field, List.copyOf(chain)));
        this.chains = Collections.unmodifiableMap(copy);
    }

    public static FieldPrecedence defaults() {
        Map<CatalogField, List<ResolutionStep>> chains = new EnumMap<>(CatalogField.class);
        chains.put(CatalogField.BRAND, List.of(OVERRIDE, BEST_SCORED_BASE));
        chains.put(CatalogField.BRAND_LINE, List.of(OVERRIDE, BEST_SCORED_BASE));
        chains.put(CatalogField.PRODUCT_NAME, List.of(OVERRIDE, BEST_SCORED_BASE));
        chains.put(CatalogField.FORM, List.of(OVERRIDE, BEST_SCORED_BASE, DERIVED));
        chains.put(CatalogField.LIFE_STAGE, List.of(OVERRIDE, BEST_SCORED_BASE, DERIVED));
        chains.put(CatalogField.KCAL_PER_100G, List.of(OVERRIDE, BEST_SCORED_BASE, DERIVED));
        chains.put(CatalogField.PROTEIN_PERCENT, List.of(OVERRIDE, BEST_SCORED_BASE));
        chains.put(CatalogField.FAT_PERCENT, List.of(OVERRIDE, BEST_SCORED_BASE));
        chains.put(CatalogField.FIBER_PERCENT, List.of(OVERRIDE, BEST_SCORED_BASE));
        chains.put(CatalogField.ASH_PERCENT, List.of(OVERRIDE, BEST_SCORED_BASE));
        chains.put(CatalogField.MOISTURE_PERCENT, List.of(OVERRIDE, BEST_SCORED_BASE));
        chains.put(CatalogField.INGREDIENTS_RAW, List.of(OVERRIDE, BEST_SCORED_BASE));
        chains.put(CatalogField.INGREDIENTS_TOKENS, List.of(OVERRIDE, DERIVED));
        chains.put(CatalogField.PACK_SIZES, List.of(OVERRIDE, BEST_SCORED_BASE, BEST_AVAILABLE));
        chains.put(CatalogField.PRICE_PER_KG, List.of(OVERRIDE, BEST_AVAILABLE));
        chains.put(CatalogField.PRICE_BUCKET, List.of(OVERRIDE, DERIVED));
        chains.put(CatalogField.IMAGE_URL, List.of(OVERRIDE, BEST_AVAILABLE));
        chains.put(CatalogField.AVAILABLE_COUNTRIES, List.of(OVERRIDE, UNION_ALL));
        return new FieldPrecedence(chains);
    }

    /**
     * Copy of this table with one chain replaced.
     */
    public FieldPrecedence with(CatalogField field, List<ResolutionStep> chain) {
        Map<CatalogField, List<ResolutionStep>> copy = new EnumMap<>(chains);
        copy.put(Objects.requireNonNull(field, "field is required"), chain);
        return new FieldPrecedence(copy);
    }

    public List<ResolutionStep> chainFor(CatalogField field) {
        return chains.get(field);
    }

    public boolean isOverridable(CatalogField field) {
        return chains.get(field).contains(OVERRIDE);
    }

    public boolean isDerivable(CatalogField field) {
        return chains.get(field).contains(DERIVED);
    }

    public Map<CatalogField, List<ResolutionStep>> asMap() {
        return chains;
    }
}
