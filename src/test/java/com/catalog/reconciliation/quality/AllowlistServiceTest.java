package com.catalog.reconciliation.quality;

import com.catalog.reconciliation.CanonicalProducts;
import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.core.model.AllowlistStatus;
import com.catalog.reconciliation.core.model.BrandConfidence;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogField;
import com.catalog.reconciliation.core.model.FieldProvenance;
import com.catalog.reconciliation.core.model.PriceBucket;
import com.catalog.reconciliation.quality.AllowlistService.AllowlistChange;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AllowlistService Tests")
class AllowlistServiceTest {

    private AuditService auditService;
    private AllowlistService service;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
        service = new AllowlistService(auditService);
    }

    private static CanonicalProduct complete(String brandSlug, String nameSlug, double kcal) {
        FieldProvenance origin = FieldProvenance.source(CanonicalProducts.SOURCE_ID);
        return CanonicalProducts.product(brandSlug, nameSlug, "dry", "Brand", "Adult " + nameSlug)
                .value(CatalogField.LIFE_STAGE, "adult", origin)
                .value(CatalogField.INGREDIENTS_TOKENS, List.of("chicken", "rice"), FieldProvenance.derived())
                .value(CatalogField.PRICE_BUCKET, PriceBucket.MID, FieldProvenance.derived())
                .value(CatalogField.KCAL_PER_100G, kcal, origin)
                .build();
    }

    private static CanonicalProduct bare(String brandSlug, String nameSlug) {
        return CanonicalProducts.product(brandSlug, nameSlug, "dry", "Brand", "Adult " + nameSlug).build();
    }

    @Nested
    @DisplayName("Adding brands")
    class Adding {

        @Test
        @DisplayName("Brand meeting the gate is added ACTIVE")
        void addActive() {
            AllowlistChange change = service.add("acana", List.of(complete("acana", "a", 380.0)), "curator");

            assertEquals(AllowlistStatus.ACTIVE, change.to());
            assertTrue(change.applied());
            assertEquals(1, change.version());
            assertTrue(service.current().isActive("acana"));
        }

        @Test
        @DisplayName("Brand missing the gate is added PENDING with the reasons")
        void addPending() {
            AllowlistChange change = service.add("acana", List.of(bare("acana", "a")), "curator");

            assertEquals(AllowlistStatus.PENDING, change.to());
            assertFalse(change.failures().isEmpty());
        }

        @Test
        @DisplayName("Brand with no products is added PENDING")
        void addWithoutProducts() {
            AllowlistChange change = service.add("acana", List.of(), "curator");

            assertEquals(AllowlistStatus.PENDING, change.to());
            assertEquals(List.of("no products with a resolved brand"), change.failures());
        }

        @Test
        @DisplayName("Brand already listed cannot be added again")
        void addTwice() {
            service.add("acana", List.of(), "curator");

            assertThrows(IllegalStateException.class, () -> service.add("acana", List.of(), "curator"));
        }
    }

    @Nested
    @DisplayName("Transitions")
    class Transitions {

        @Test
        @DisplayName("Promotion is refused while the gate fails")
        void promotionRefused() {
            service.add("acana", List.of(bare("acana", "a")), "curator");

            AllowlistChange change = service.promote("acana", List.of(bare("acana", "a")), "curator");

            assertFalse(change.applied());
            assertEquals(AllowlistStatus.PENDING, service.current().statusOf("acana").orElseThrow());
        }

        @Test
        @DisplayName("Promotion succeeds once the gate passes")
        void promotionApplied() {
            service.add("acana", List.of(), "curator");

            AllowlistChange change = service.promote("acana", List.of(complete("acana", "a", 380.0)), "curator");

            assertTrue(change.applied());
            assertEquals(AllowlistStatus.ACTIVE, change.to());
            assertEquals(2, service.current().getVersion());
        }

        @Test
        @DisplayName("Pause, reactivate, remove and reactivate again")
        void lifecycle() {
            service.add("acana", List.of(complete("acana", "a", 380.0)), "curator");

            assertEquals(AllowlistStatus.PAUSED, service.pause("acana", "curator", "recall").to());
            assertEquals(AllowlistStatus.ACTIVE, service.reactivate("acana", "curator").to());
            assertEquals(AllowlistStatus.REMOVED, service.remove("acana", "curator", "delisted").to());
            assertEquals(AllowlistStatus.PENDING, service.reactivate("acana", "curator").to());
            assertEquals(4, auditService.getEntriesByAction(AuditAction.BRAND_STATUS_CHANGED).size());
        }

        @Test
        @DisplayName("Illegal transitions fail")
        void illegal() {
            service.add("acana", List.of(), "curator");

            assertThrows(IllegalStateException.class, () -> service.pause("acana", "curator", "x"));
            assertThrows(IllegalStateException.class, () -> service.reactivate("acana", "curator"));
            assertThrows(IllegalStateException.class, () -> service.pause("orijen", "curator", "x"));
        }
    }

    @Nested
    @DisplayName("Quality metrics")
    class Metrics {

        private final BrandQualityCalculator calculator = new BrandQualityCalculator();

        @Test
        @DisplayName("Coverage is a rounded percentage")
        void coverage() {
            BrandQualityMetrics metrics = calculator.calculate("acana", List.of(
                    complete("acana", "a", 380.0),
                    complete("acana", "b", 390.0),
                    bare("acana", "c"))).orElseThrow();

            assertEquals(3, metrics.skuCount());
            assertEquals(100.0, metrics.formCoverage());
            assertEquals(66.7, metrics.lifeStageCoverage());
            assertEquals(0, metrics.kcalOutliers());
        }

        @Test
        @DisplayName("Implausible energy counts as an outlier and blocks the gate")
        void outliers() {
            BrandQualityMetrics metrics = calculator.calculate("acana",
                    List.of(complete("acana", "a", 36.5))).orElseThrow();

            assertEquals(1, metrics.kcalOutliers());
            assertFalse(QualityGate.defaults().passes(metrics));
        }

        @Test
        @DisplayName("Low-confidence brands are left out")
        void lowConfidence() {
            CanonicalProduct unresolved = bare("happy_dog", "a").toBuilder()
                    .brandConfidence(BrandConfidence.LOW)
                    .build();

            assertTrue(calculator.calculate("happy_dog", List.of(unresolved)).isEmpty());
            assertTrue(calculator.calculateAll(List.of(unresolved)).isEmpty());
        }
    }
}
