package com.catalog.reconciliation.guard;

import com.catalog.reconciliation.CanonicalProducts;
import com.catalog.reconciliation.audit.KeyDecisionLog;
import com.catalog.reconciliation.audit.KeyDecisionType;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.rules.DefaultBrandAliases;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Guard Tests")
class GuardCheckerTest {

    private BrandKnowledge knowledge;
    private KeyDecisionLog decisions;
    private GuardChecker checker;

    @BeforeEach
    void setUp() {
        knowledge = BrandKnowledge.from(DefaultBrandAliases.create());
        decisions = new KeyDecisionLog();
        checker = GuardChecker.standard(knowledge, decisions, new NoOpMetricsService());
    }

    /**
     * What a naive pipeline publishes for brand "Royal", name "Canin Adult 15kg".
     */
    private static CanonicalProduct unrepairedSplit() {
        return CanonicalProducts.product("royal", "canin-adult-15kg", "dry", "Royal", "Canin Adult 15kg").build();
    }

    @Test
    @DisplayName("Reconciled product passes every guard")
    void reconciledPasses() {
        GuardReport report = checker.checkAll(List.of(CanonicalProducts.royalCaninAdult()));

        assertTrue(report.passed());
        assertEquals(0, report.totalViolations());
        assertEquals(5, report.results().size());
    }

    @Test
    @DisplayName("Unrepaired split brand fails split-brand, orphan-fragment and incomplete-slug")
    void unrepairedSplitFails() {
        GuardReport report = checker.checkAll(List.of(unrepairedSplit()));

        assertFalse(report.passed());
        assertEquals(1, report.resultFor(SplitBrandGuard.NAME).orElseThrow().violationCount());
        assertEquals(1, report.resultFor(OrphanFragmentGuard.NAME).orElseThrow().violationCount());
        assertEquals(1, report.resultFor(IncompleteSlugGuard.NAME).orElseThrow().violationCount());
        assertTrue(report.resultFor(KeyCollisionGuard.NAME).orElseThrow().passed());
        assertEquals(List.of("royal::canin-adult-15kg::dry"), List.copyOf(report.violatingProductKeys()));
    }

    @Test
    @DisplayName("Violation counts are reported to metrics")
    void metricsRecorded() {
        MetricsService metrics = mock(MetricsService.class);
        GuardChecker instrumented = GuardChecker.standard(knowledge, decisions, metrics);

        instrumented.checkAll(List.of(unrepairedSplit()));

        verify(metrics).recordGuardViolations(SplitBrandGuard.NAME, 1);
        verify(metrics).recordGuardViolations(KeyCollisionGuard.NAME, 0);
    }

    @Nested
    @DisplayName("BrandKnowledge")
    class Knowledge {

        @Test
        @DisplayName("Multi-word aliases give split patterns")
        void splitPatterns() {
            assertTrue(knowledge.getSplitPatterns().stream()
                    .anyMatch(p -> p.stem().equals("Royal") && p.fragment().equals("Canin")
                            && p.brandSlug().equals("royal_canin")));
        }

        @Test
        @DisplayName("Stems of multi-word brands are incomplete")
        void incompleteStems() {
            assertTrue(knowledge.getIncompleteStems().contains("royal"));
            assertFalse(knowledge.getIncompleteStems().contains("royal_canin"));
        }

        @Test
        @DisplayName("Fragment must match as a whole word")
        void wholeWordFragment() {
            BrandKnowledge.SplitPattern pattern = knowledge.getSplitPatterns().stream()
                    .filter(p -> p.brandSlug().equals("royal_canin"))
                    .findFirst()
                    .orElseThrow();

            assertTrue(knowledge.nameStartsWithFragment(pattern, "Canin Adult"));
            assertFalse(knowledge.nameStartsWithFragment(pattern, "Canine Adult"));
        }
    }

    @Nested
    @DisplayName("Individual guards")
    class Individual {

        @Test
        @DisplayName("Brand+line composite slug is flagged")
        void compositeSlug() {
            CanonicalProduct composite = CanonicalProducts.product("purina_pro_plan", "medium-adult", "dry",
                    "Purina Pro Plan", "Medium Adult").build();

            List<GuardViolation> violations = new NonCanonicalSlugGuard(knowledge).check(List.of(composite));

            assertEquals(1, violations.size());
            assertEquals(NonCanonicalSlugGuard.NAME, violations.get(0).guardName());
        }

        @Test
        @DisplayName("Suffixed keys fail until the split is confirmed")
        void suffixedKeys() {
            CanonicalProduct first = CanonicalProducts.product("royal_canin", "adult", "any",
                    "Royal Canin", "Adult").build();
            CanonicalProduct second = CanonicalProducts.product("royal_canin", "adult", "any",
                    "Royal Canin", "New Improved Formula Adult").productKey("royal_canin::adult::any~2").build();
            KeyCollisionGuard guard = new KeyCollisionGuard(decisions);

            assertEquals(2, guard.check(List.of(first, second)).size());

            decisions.record("royal_canin::adult::any", KeyDecisionType.SPLIT, "reviewer", "different recipes");

            assertTrue(guard.check(List.of(first, second)).isEmpty());
        }

        @Test
        @DisplayName("Duplicate product keys are flagged")
        void duplicateKeys() {
            CanonicalProduct product = CanonicalProducts.royalCaninAdult();

            List<GuardViolation> violations = new KeyCollisionGuard(decisions).check(List.of(product, product));

            assertEquals(1, violations.size());
            assertTrue(violations.get(0).message().contains("share product_key"));
        }

        @Test
        @DisplayName("A duplicated key next to a suffixed one counts each key once")
        void duplicateAndSuffixedKeys() {
            CanonicalProduct first = CanonicalProducts.product("royal_canin", "adult", "any",
                    "Royal Canin", "Adult").build();
            CanonicalProduct second = CanonicalProducts.product("royal_canin", "adult", "any",
                    "Royal Canin", "New Improved Formula Adult").productKey("royal_canin::adult::any~2").build();

            List<GuardViolation> violations = new KeyCollisionGuard(decisions).check(List.of(first, first, second));

            assertEquals(3, violations.size());
            assertEquals(1, violations.stream().filter(v -> v.message().contains("share product_key")).count());
            assertTrue(violations.stream().filter(v -> v.message().contains("collide"))
                    .allMatch(v -> v.message().startsWith("2 products collide")));
        }

        @Test
        @DisplayName("Brand slug matching the fragment owner passes the orphan check")
        void ownFragment() {
            CanonicalProduct product = CanonicalProducts.product("royal_canin", "canin-club", "dry",
                    "Royal Canin", "Canin Club").build();

            assertTrue(new OrphanFragmentGuard(knowledge).check(List.of(product)).isEmpty());
        }
    }

    @Test
    @DisplayName("Sample is capped at the requested size")
    void sample() {
        GuardResult result = new GuardResult("g", List.of(
                new GuardViolation("g", "a", "m"),
                new GuardViolation("g", "b", "m"),
                new GuardViolation("g", "c", "m")));

        assertEquals(2, result.sample(2).size());
        assertEquals(3, result.sample(10).size());
    }
}
