package com.catalog.reconciliation.scoring;

import com.catalog.reconciliation.core.model.RawCandidateRecord;
import com.catalog.reconciliation.derive.IngredientTokenizer;

import java.util.Objects;

/**
 * Scores a candidate record from its own fields only: field-presence weights plus
 * the trust bonus of its source domain. Other records in the group play no part,
 * so winner selection does not depend on processing order.
 */
public class QualityScorer {

    private final ScoringWeights weights;
    private final SourceTrustTable trustTable;
    private final IngredientTokenizer tokenizer;

    public QualityScorer() {
        this(ScoringWeights.defaults(), SourceTrustTable.defaults());
    }

    public QualityScorer(ScoringWeights weights, SourceTrustTable trustTable) {
        this.weights = Objects.requireNonNull(weights, "weights is required");
        this.trustTable = Objects.requireNonNull(trustTable, "trustTable is required");
        this.tokenizer = new IngredientTokenizer();
    }

    public int score(RawCandidateRecord record) {
        Objects.requireNonNull(record, "record is required");
        int score = 0;
        if (record.getKcalPer100g() != null) {
            score += weights.energy();
        }
        if (record.getProteinPercent() != null) {
            score += weights.protein();
        }
        if (record.getFatPercent() != null) {
            score += weights.fat();
        }
        if (!tokenizer.tokenize(record.getIngredientsRaw()).isEmpty()) {
            score += weights.ingredients();
        }
        if (record.hasImage()) {
            score += weights.image();
        }
        return score + trustTable.bonusFor(record.getSourceDomain());
    }

    public ScoringWeights getWeights() {
        return weights;
    }

    public SourceTrustTable getTrustTable() {
        return trustTable;
    }
}
