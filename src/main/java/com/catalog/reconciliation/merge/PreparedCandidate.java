package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.model.CanonicalKey;
import com.catalog.reconciliation.core.model.RawCandidateRecord;
import com.catalog.reconciliation.rules.BrandResolution;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A raw record after canonicalization, keying, scoring and per-record derivation.
 *
 * @param record        the raw observation
 * @param brand         brand canonicalization outcome
 * @param key           canonical key the record groups under
 * @param score         quality score
 * @param formFromField form normalized from the record's own form field, if any
 * @param lifeStageFromField life stage normalized from the record's own field, if any
 * @param pricePerKg    price per kg from the record's price and first parsable pack size
 */
public record PreparedCandidate(RawCandidateRecord record,
                                BrandResolution brand,
                                CanonicalKey key,
                                int score,
                                String formFromField,
                                String lifeStageFromField,
                                BigDecimal pricePerKg) {

    public PreparedCandidate {
        Objects.requireNonNull(record, "record is required");
        Objects.requireNonNull(brand, "brand is required");
        Objects.requireNonNull(key, "key is required");
    }

    public String sourceId() {
        return record.getSourceId();
    }

    public String cleanedName() {
        return brand.cleanedName();
    }
}
