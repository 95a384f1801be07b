package com.catalog.reconciliation.override;

import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogField;
import com.catalog.reconciliation.core.model.FieldProvenance;
import com.catalog.reconciliation.core.model.IssueType;
import com.catalog.reconciliation.core.model.ReconciliationIssue;
import com.catalog.reconciliation.core.model.SourceContribution;
import com.catalog.reconciliation.derive.CompletenessGrader;
import com.catalog.reconciliation.derive.PriceBuckets;
import com.catalog.reconciliation.logging.LogContext;
import com.catalog.reconciliation.merge.DerivedFields;
import com.catalog.reconciliation.merge.FieldPrecedence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layers overrides on merged products.
 *
 * <p>A non-null override value always wins and is published with {@code override}
 * provenance. A field is only blanked by an explicit {@link OverrideValue#cleared()}.
 * Brand-wide overrides apply before product overrides, older before newer, so the most
 * specific and most recent value wins. Derived fields and the completeness grade are
 * recomputed afterwards since overrides can change their inputs.</p>
 */
public class OverrideResolver {
    private static final Logger log = LoggerFactory.getLogger(OverrideResolver.class);

    static final Comparator<CatalogOverride> APPLICATION_ORDER = Comparator
            .comparing((CatalogOverride o) -> o.getScope() == OverrideScope.PRODUCT_KEY)
            .thenComparing(CatalogOverride::getCreatedAt)
            .thenComparing(CatalogOverride::getId);

    private final FieldPrecedence precedence;
    private final DerivedFields derivedFields;
    private final CompletenessGrader grader = new CompletenessGrader();
    private final AuditService auditService;

    public OverrideResolver() {
        this(FieldPrecedence.defaults(), PriceBuckets.defaults(), new AuditService());
    }

    public OverrideResolver(FieldPrecedence precedence, PriceBuckets priceBuckets, AuditService auditService) {
        this.precedence = precedence;
        this.derivedFields = new DerivedFields(precedence, priceBuckets);
        this.auditService = auditService;
    }

    /**
     * Applies every override in the snapshot to the products it targets. Overrides whose
     * product key or brand no longer exists are skipped and reported as OVERRIDE_CONFLICT.
     */
    public OverrideResult applyAll(List<CanonicalProduct> products, Collection<CatalogOverride> overrides) {
        Map<String, List<CatalogOverride>> byProduct = new HashMap<>();
        Map<String, List<CatalogOverride>> byBrand = new HashMap<>();
        for (CatalogOverride override : overrides) {
            Map<String, List<CatalogOverride>> index =
                    override.getScope() == OverrideScope.PRODUCT_KEY ? byProduct : byBrand;
            index.computeIfAbsent(override.getTarget(), k -> new ArrayList<>()).add(override);
        }

        Set<String> productKeys = new HashSet<>();
        Set<String> brandSlugs = new HashSet<>();
        List<CanonicalProduct> result = new ArrayList<>(products.size());
        int applied = 0;
        for (CanonicalProduct product : products) {
            productKeys.add(product.getProductKey());
            brandSlugs.add(product.getBrandSlug());
            List<CatalogOverride> forKey = new ArrayList<>(byBrand.getOrDefault(product.getBrandSlug(), List.of()));
            forKey.addAll(byProduct.getOrDefault(product.getProductKey(), List.of()));
            if (forKey.isEmpty()) {
                result.add(product);
            } else {
                result.add(apply(product, forKey));
                applied += forKey.size();
            }
        }

        List<ReconciliationIssue> issues = new ArrayList<>();
        byProduct.forEach((target, list) -> {
            if (!productKeys.contains(target)) {
                list.forEach(o -> issues.add(conflict(o, "product key no longer exists")));
            }
        });
        byBrand.forEach((target, list) -> {
            if (!brandSlugs.contains(target)) {
                list.forEach(o -> issues.add(conflict(o, "brand has no products")));
            }
        });
        issues.sort(Comparator.comparing(ReconciliationIssue::subject).thenComparing(ReconciliationIssue::message));
        log.info("overrides.applied applications={} conflicts={}", applied, issues.size());
        return new OverrideResult(result, issues, applied);
    }

    /**
     * Applies the overrides targeting one product.
     */
    public CanonicalProduct apply(CanonicalProduct product, List<CatalogOverride> overridesForKey) {
        try (LogContext ctx = LogContext.forOverride(product.getProductKey())) {
            List<CatalogOverride> ordered = new ArrayList<>(overridesForKey);
            ordered.sort(APPLICATION_ORDER);

            CanonicalProduct.Builder builder = product.toBuilder();
            Set<CatalogField> frozen = EnumSet.noneOf(CatalogField.class);
            for (CatalogOverride override : ordered) {
                for (Map.Entry<CatalogField, OverrideValue> entry : override.getValues().entrySet()) {
                    CatalogField field = entry.getKey();
                    if (!precedence.isOverridable(field)) {
                        log.warn("override.field_ignored overrideId={} field={}", override.getId(), field.wireName());
                        continue;
                    }
                    if (entry.getValue().isCleared()) {
                        builder.clear(field);
                    } else {
                        builder.value(field, entry.getValue().getValue(), FieldProvenance.override(override.getId()));
                    }
                    frozen.add(field);
                }
                if (!product.getAppliedOverrideIds().contains(override.getId())) {
                    builder.addAppliedOverrideId(override.getId());
                }
                log.debug("override.applied overrideId={} fields={}", override.getId(), override.getValues().size());
            }

            derivedFields.fill(builder, frozen, true);
            builder.sources(withoutOverridden(product.getSources(), frozen));
            CanonicalProduct overridden = builder.build();
            return overridden.toBuilder().completenessGrade(grader.grade(overridden)).build();
        }
    }

    private ReconciliationIssue conflict(CatalogOverride override, String why) {
        log.warn("override.conflict overrideId={} scope={} target={} reason={}",
                override.getId(), override.getScope(), override.getTarget(), why);
        auditService.record(AuditAction.OVERRIDE_SKIPPED, override.getTarget(), "reconciliation",
                Map.of("overrideId", override.getId(), "reason", why));
        return ReconciliationIssue.of(IssueType.OVERRIDE_CONFLICT, override.getTarget(),
                "Override " + override.getId() + " skipped: " + why);
    }

    private static List<SourceContribution> withoutOverridden(List<SourceContribution> sources,
                                                             Set<CatalogField> overridden) {
        if (overridden.isEmpty()) {
            return sources;
        }
        List<SourceContribution> result = new ArrayList<>(sources.size());
        for (SourceContribution contribution : sources) {
            Set<CatalogField> fields = EnumSet.noneOf(CatalogField.class);
            fields.addAll(contribution.fieldsContributed());
            fields.removeAll(overridden);
            result.add(new SourceContribution(contribution.sourceId(), fields, contribution.score()));
        }
        return result;
    }
}
