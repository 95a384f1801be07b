package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.cache.CanonicalizationCache;
import com.catalog.reconciliation.cache.NoOpCanonicalizationCache;
import com.catalog.reconciliation.core.model.CanonicalKey;
import com.catalog.reconciliation.core.model.RawCandidateRecord;
import com.catalog.reconciliation.derive.FormClassifier;
import com.catalog.reconciliation.derive.LifeStageClassifier;
import com.catalog.reconciliation.derive.PackSizeParser;
import com.catalog.reconciliation.derive.PriceCalculator;
import com.catalog.reconciliation.key.ProductKeyBuilder;
import com.catalog.reconciliation.rules.BrandAliasMap;
import com.catalog.reconciliation.rules.BrandCanonicalizer;
import com.catalog.reconciliation.rules.BrandResolution;
import com.catalog.reconciliation.scoring.QualityScorer;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Runs the per-record stages in flow order: brand canonicalization, key derivation,
 * scoring and per-record attribute normalization. Pure apart from the cache.
 */
public class CandidatePreparer {

    private final BrandCanonicalizer canonicalizer;
    private final ProductKeyBuilder keyBuilder;
    private final QualityScorer scorer;
    private final CanonicalizationCache cache;
    private final FormClassifier formClassifier = new FormClassifier();
    private final LifeStageClassifier lifeStageClassifier = new LifeStageClassifier();
    private final PackSizeParser packSizeParser = new PackSizeParser();
    private final PriceCalculator priceCalculator = new PriceCalculator();

    public CandidatePreparer(ProductKeyBuilder keyBuilder, QualityScorer scorer) {
        this(new BrandCanonicalizer(), keyBuilder, scorer, new NoOpCanonicalizationCache());
    }

    public CandidatePreparer(BrandCanonicalizer canonicalizer, ProductKeyBuilder keyBuilder,
                             QualityScorer scorer, CanonicalizationCache cache) {
        this.canonicalizer = Objects.requireNonNull(canonicalizer, "canonicalizer is required");
        this.keyBuilder = Objects.requireNonNull(keyBuilder, "keyBuilder is required");
        this.scorer = Objects.requireNonNull(scorer, "scorer is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
    }

    public PreparedCandidate prepare(RawCandidateRecord record, BrandAliasMap aliasMap) {
        BrandResolution brand = cache.get(aliasMap.getVersion(), record.getBrandRaw(), record.getProductNameRaw(),
                () -> canonicalizer.canonicalize(record.getBrandRaw(), record.getProductNameRaw(), aliasMap));

        String formFromField = formClassifier.normalize(record.getFormRaw()).orElse(null);
        String keyForm = formFromField != null
                ? formFromField
                : formClassifier.classify(null, brand.cleanedName()).orElse(null);
        CanonicalKey key = keyBuilder.buildKey(brand.brandSlug(), brand.cleanedName(), keyForm);

        String lifeStage = lifeStageClassifier.classify(record.getLifeStageRaw(), null).orElse(null);
        BigDecimal pricePerKg = packSizeParser.firstParsable(record.getPackSizes(), record.getProductNameRaw())
                .flatMap(size -> priceCalculator.pricePerKg(record.getPrice(), size))
                .orElse(null);

        return new PreparedCandidate(record, brand, key, scorer.score(record), formFromField, lifeStage, pricePerKg);
    }
}
