package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogField;
import com.catalog.reconciliation.core.model.FieldProvenance;
import com.catalog.reconciliation.core.model.ProvenanceKind;
import com.catalog.reconciliation.derive.EnergyEstimator;
import com.catalog.reconciliation.derive.FormClassifier;
import com.catalog.reconciliation.derive.IngredientTokenizer;
import com.catalog.reconciliation.derive.LifeStageClassifier;
import com.catalog.reconciliation.derive.PriceBuckets;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The {@link ResolutionStep#DERIVED} step: values computed from other fields of the
 * same product. Used by the merge and again after overrides, since an override can
 * change a derived field's inputs.
 */
public class DerivedFields {

    private final FieldPrecedence precedence;
    private final PriceBuckets priceBuckets;
    private final FormClassifier formClassifier = new FormClassifier();
    private final LifeStageClassifier lifeStageClassifier = new LifeStageClassifier();
    private final EnergyEstimator energyEstimator = new EnergyEstimator();
    private final IngredientTokenizer tokenizer = new IngredientTokenizer();

    public DerivedFields(FieldPrecedence precedence, PriceBuckets priceBuckets) {
        this.precedence = precedence;
        this.priceBuckets = priceBuckets;
    }

    /**
     * Fills derivable fields that are absent, and with {@code recompute} also refreshes
     * fields that already hold a derived value. Fields in {@code frozen} are left alone.
     */
    public void fill(CanonicalProduct.Builder builder, Set<CatalogField> frozen, boolean recompute) {
        for (CatalogField field : CatalogField.values()) {
            if (!precedence.isDerivable(field) || frozen.contains(field)) {
                continue;
            }
            FieldProvenance current = builder.peekProvenance(field);
            boolean refill = current == null || (recompute && current.kind() == ProvenanceKind.DERIVED);
            if (!refill) {
                continue;
            }
            Optional<Object> value = derive(field, builder);
            if (value.isPresent()) {
                builder.value(field, value.get(), provenanceFrom(builder.peekProvenance(inputOf(field))));
            } else if (current != null) {
                builder.clear(field);
            }
        }
    }

    Optional<Object> derive(CatalogField field, CanonicalProduct.Builder b) {
        return switch (field) {
            case FORM -> formClassifier.classify(null, (String) b.peek(CatalogField.PRODUCT_NAME)).map(v -> v);
            case LIFE_STAGE -> lifeStageClassifier.classify(null, (String) b.peek(CatalogField.PRODUCT_NAME)).map(v -> v);
            case KCAL_PER_100G -> energyEstimator.estimateKcalPer100g(
                    (Double) b.peek(CatalogField.PROTEIN_PERCENT),
                    (Double) b.peek(CatalogField.FAT_PERCENT),
                    (Double) b.peek(CatalogField.FIBER_PERCENT),
                    (Double) b.peek(CatalogField.ASH_PERCENT),
                    (Double) b.peek(CatalogField.MOISTURE_PERCENT)).map(v -> v);
            case INGREDIENTS_TOKENS -> {
                List<String> tokens = tokenizer.tokenize((String) b.peek(CatalogField.INGREDIENTS_RAW));
                yield tokens.isEmpty() ? Optional.empty() : Optional.of(tokens);
            }
            case PRICE_BUCKET -> Optional.ofNullable((BigDecimal) b.peek(CatalogField.PRICE_PER_KG))
                    .map(priceBuckets::bucketOf);
            default -> Optional.empty();
        };
    }

    static CatalogField inputOf(CatalogField field) {
        return switch (field) {
            case FORM, LIFE_STAGE -> CatalogField.PRODUCT_NAME;
            case KCAL_PER_100G -> CatalogField.PROTEIN_PERCENT;
            case INGREDIENTS_TOKENS -> CatalogField.INGREDIENTS_RAW;
            case PRICE_BUCKET -> CatalogField.PRICE_PER_KG;
            default -> field;
        };
    }

    private static FieldProvenance provenanceFrom(FieldProvenance input) {
        if (input != null && input.kind() == ProvenanceKind.SOURCE) {
            return FieldProvenance.derived(input.sourceId());
        }
        return FieldProvenance.derived();
    }
}
