package com.catalog.reconciliation.derive;

import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogField;
import com.catalog.reconciliation.core.model.CompletenessGrade;

/**
 * Grades how complete a canonical product is.
 * <ul>
 *   <li>A+: energy, protein, fat, ingredients, price per kg, form and life stage</li>
 *   <li>A: energy, ingredients, form and life stage</li>
 *   <li>B: energy or ingredients</li>
 *   <li>C: anything less</li>
 * </ul>
 */
public class CompletenessGrader {

    public CompletenessGrade grade(CanonicalProduct product) {
        boolean kcal = product.has(CatalogField.KCAL_PER_100G);
        boolean ingredients = !product.getIngredientsTokens().isEmpty();
        boolean form = product.has(CatalogField.FORM);
        boolean lifeStage = product.has(CatalogField.LIFE_STAGE);

        if (kcal && ingredients && form && lifeStage
                && product.has(CatalogField.PROTEIN_PERCENT)
                && product.has(CatalogField.FAT_PERCENT)
                && product.has(CatalogField.PRICE_PER_KG)) {
            return CompletenessGrade.A_PLUS;
        }
        if (kcal && ingredients && form && lifeStage) {
            return CompletenessGrade.A;
        }
        if (kcal || ingredients) {
            return CompletenessGrade.B;
        }
        return CompletenessGrade.C;
    }
}
