package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.model.BrandConfidence;
import com.catalog.reconciliation.core.model.CanonicalKey;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogField;
import com.catalog.reconciliation.core.model.FieldProvenance;
import com.catalog.reconciliation.core.model.ProvenanceKind;
import com.catalog.reconciliation.core.model.SourceContribution;
import com.catalog.reconciliation.derive.CompletenessGrader;
import com.catalog.reconciliation.derive.PriceBuckets;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Merges the candidates of one product group into a {@link CanonicalProduct}.
 *
 * <p>Every field is resolved by walking its {@link FieldPrecedence} chain left to right:
 * the best-scored record supplies the base values, price/image/pack sizes fall back to
 * the best non-null value of any member, countries are the union of all members, and
 * derived values fill what is still missing. Overrides are not applied here; see
 * {@code OverrideResolver}.</p>
 *
 * <p>The result depends only on the set of candidates, never on their order.</p>
 */
public class MergeEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeEngine.class);

    /**
     * Picks the observation kept when one source appears more than once in a group.
     */
    static final Comparator<PreparedCandidate> SAME_SOURCE_PREFERENCE = Comparator
            .comparing((PreparedCandidate c) -> c.record().getLastSeenAt(),
                    Comparator.<Instant>nullsFirst(Comparator.naturalOrder()))
            .thenComparingInt(PreparedCandidate::score)
            .thenComparing(c -> Objects.toString(c.record().getProductNameRaw(), ""))
            .thenComparing(c -> c.record().getPrice(), Comparator.<BigDecimal>nullsFirst(Comparator.naturalOrder()))
            .thenComparing(c -> c.record().getImageUrl(), Comparator.<String>nullsFirst(Comparator.naturalOrder()))
            .thenComparing(c -> c.record().contentFingerprint());

    private final FieldPrecedence precedence;
    private final DerivedFields derivedFields;
    private final CompletenessGrader grader = new CompletenessGrader();

    public MergeEngine() {
        this(FieldPrecedence.defaults(), PriceBuckets.defaults());
    }

    public MergeEngine(FieldPrecedence precedence, PriceBuckets priceBuckets) {
        this.precedence = Objects.requireNonNull(precedence, "precedence is required");
        this.derivedFields = new DerivedFields(precedence, Objects.requireNonNull(priceBuckets, "priceBuckets is required"));
    }

    /**
     * Merges a non-empty group.
     *
     * @param key        canonical key shared by the group
     * @param productKey published key, differs from the canonical key for split collisions
     * @param members    group members in any order
     */
    public CanonicalProduct merge(CanonicalKey key, String productKey, Collection<PreparedCandidate> members) {
        Objects.requireNonNull(key, "key is required");
        if (members == null || members.isEmpty()) {
            throw new IllegalArgumentException("Cannot merge an empty group for " + key.productKey());
        }

        List<PreparedCandidate> ranked = RecordRanking.rank(latestPerSource(members));
        PreparedCandidate base = ranked.get(0);
        log.debug("merge.group productKey={} members={} base={} baseScore={}",
                productKey, ranked.size(), base.sourceId(), base.score());

        CanonicalProduct.Builder builder = CanonicalProduct.builder()
                .canonicalKey(key)
                .productKey(productKey)
                .brandSlug(key.brandSlug())
                .brandConfidence(confidenceOf(ranked));

        Map<String, Set<CatalogField>> unionContributors = new LinkedHashMap<>();
        for (CatalogField field : CatalogField.values()) {
            resolve(field, ranked, builder, unionContributors);
        }
        derivedFields.fill(builder, Set.of(), false);

        builder.sources(contributions(ranked, builder, unionContributors));
        CanonicalProduct merged = builder.build();
        return merged.toBuilder().completenessGrade(grader.grade(merged)).build();
    }

    private void resolve(CatalogField field, List<PreparedCandidate> ranked, CanonicalProduct.Builder builder,
                         Map<String, Set<CatalogField>> unionContributors) {
        for (ResolutionStep step : precedence.chainFor(field)) {
            if (builder.peek(field) != null) {
                return;
            }
            switch (step) {
                case BEST_SCORED_BASE -> {
                    PreparedCandidate base = ranked.get(0);
                    Object value = valueOf(field, base);
                    if (value != null) {
                        builder.value(field, value, FieldProvenance.source(base.sourceId()));
                    }
                }
                case BEST_AVAILABLE -> {
                    for (PreparedCandidate candidate : ranked) {
                        Object value = valueOf(field, candidate);
                        if (value != null) {
                            builder.value(field, value, FieldProvenance.source(candidate.sourceId()));
                            break;
                        }
                    }
                }
                case UNION_ALL -> union(field, ranked, builder, unionContributors);
                // overrides are layered later, derived values in the second pass
                case OVERRIDE, DERIVED -> {
                }
            }
        }
    }

    private void union(CatalogField field, List<PreparedCandidate> ranked, CanonicalProduct.Builder builder,
                       Map<String, Set<CatalogField>> unionContributors) {
        Set<String> union = new TreeSet<>();
        String first = null;
        for (PreparedCandidate candidate : ranked) {
            Object value = valueOf(field, candidate);
            if (value instanceof Collection<?> items && !items.isEmpty()) {
                items.forEach(item -> union.add(item.toString()));
                if (first == null) {
                    first = candidate.sourceId();
                }
                unionContributors.computeIfAbsent(candidate.sourceId(), id -> EnumSet.noneOf(CatalogField.class))
                        .add(field);
            }
        }
        if (!union.isEmpty()) {
            builder.value(field, union, FieldProvenance.source(first));
        }
    }

    /**
     * Value a single candidate offers for a field, or null.
     */
    static Object valueOf(CatalogField field, PreparedCandidate candidate) {
        var record = candidate.record();
        return switch (field) {
            case BRAND -> candidate.brand().brandDisplay();
            case BRAND_LINE -> candidate.brand().brandLine();
            case PRODUCT_NAME -> blankToNull(candidate.cleanedName());
            case FORM -> candidate.formFromField();
            case LIFE_STAGE -> candidate.lifeStageFromField();
            case KCAL_PER_100G -> record.getKcalPer100g();
            case PROTEIN_PERCENT -> record.getProteinPercent();
            case FAT_PERCENT -> record.getFatPercent();
            case FIBER_PERCENT -> record.getFiberPercent();
            case ASH_PERCENT -> record.getAshPercent();
            case MOISTURE_PERCENT -> record.getMoisturePercent();
            case INGREDIENTS_RAW -> blankToNull(record.getIngredientsRaw());
            case PACK_SIZES -> record.getPackSizes().isEmpty() ? null : record.getPackSizes();
            case PRICE_PER_KG -> candidate.pricePerKg();
            case IMAGE_URL -> record.hasImage() ? record.getImageUrl() : null;
            case AVAILABLE_COUNTRIES -> record.getAvailableCountries().isEmpty() ? null : record.getAvailableCountries();
            case INGREDIENTS_TOKENS, PRICE_BUCKET -> null;
        };
    }

    static List<PreparedCandidate> latestPerSource(Collection<PreparedCandidate> members) {
        Map<String, PreparedCandidate> latest = new LinkedHashMap<>();
        for (PreparedCandidate candidate : members) {
            latest.merge(candidate.sourceId(), candidate,
                    (a, b) -> SAME_SOURCE_PREFERENCE.compare(a, b) >= 0 ? a : b);
        }
        return new ArrayList<>(latest.values());
    }

    private static BrandConfidence confidenceOf(List<PreparedCandidate> ranked) {
        for (PreparedCandidate candidate : ranked) {
            if (candidate.brand().confidence() == BrandConfidence.HIGH) {
                return BrandConfidence.HIGH;
            }
        }
        return BrandConfidence.LOW;
    }

    private static List<SourceContribution> contributions(List<PreparedCandidate> ranked,
                                                          CanonicalProduct.Builder builder,
                                                          Map<String, Set<CatalogField>> unionContributors) {
        List<SourceContribution> result = new ArrayList<>(ranked.size());
        for (PreparedCandidate candidate : ranked) {
            Set<CatalogField> fields = EnumSet.noneOf(CatalogField.class);
            for (CatalogField field : CatalogField.values()) {
                FieldProvenance origin = builder.peekProvenance(field);
                if (origin != null && origin.kind() == ProvenanceKind.SOURCE
                        && candidate.sourceId().equals(origin.sourceId())) {
                    fields.add(field);
                }
            }
            fields.addAll(unionContributors.getOrDefault(candidate.sourceId(), Set.of()));
            result.add(new SourceContribution(candidate.sourceId(), fields, candidate.score()));
        }
        return result;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
