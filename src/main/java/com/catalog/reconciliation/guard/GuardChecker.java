package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.audit.KeyDecisionLog;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.logging.LogContext;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Runs a fixed, ordered set of {@link GuardRule}s over a product set and collects a
 * {@link GuardReport}. Violations are reported, never thrown.
 */
public class GuardChecker {
    private static final Logger log = LoggerFactory.getLogger(GuardChecker.class);

    private final List<GuardRule> rules;
    private final MetricsService metrics;

    public GuardChecker(List<GuardRule> rules) {
        this(rules, new NoOpMetricsService());
    }

    public GuardChecker(List<GuardRule> rules, MetricsService metrics) {
        this.rules = List.copyOf(rules);
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * The standard guard set: orphan fragment, incomplete slug, split brand, key collision
     * and non-canonical slug.
     */
    public static GuardChecker standard(BrandKnowledge knowledge, KeyDecisionLog decisions, MetricsService metrics) {
        return new GuardChecker(List.of(
                new OrphanFragmentGuard(knowledge),
                new IncompleteSlugGuard(knowledge),
                new SplitBrandGuard(knowledge),
                new KeyCollisionGuard(decisions),
                new NonCanonicalSlugGuard(knowledge)), metrics);
    }

    public GuardReport checkAll(Collection<CanonicalProduct> products) {
        List<GuardResult> results = new ArrayList<>(rules.size());
        for (GuardRule rule : rules) {
            results.add(check(rule, products));
        }
        GuardReport report = new GuardReport(results);
        log.info("guards.completed products={} guards={} violations={} passed={}",
                products.size(), rules.size(), report.totalViolations(), report.passed());
        return report;
    }

    public GuardResult check(GuardRule rule, Collection<CanonicalProduct> products) {
        try (LogContext ctx = LogContext.forGuard(rule.getName())) {
            List<GuardViolation> violations = rule.check(products);
            metrics.recordGuardViolations(rule.getName(), violations.size());
            if (!violations.isEmpty()) {
                log.warn("guard.violations guard={} count={} first={}",
                        rule.getName(), violations.size(), violations.get(0).productKey());
            }
            return new GuardResult(rule.getName(), violations);
        }
    }

    public List<GuardRule> getRules() {
        return rules;
    }
}
