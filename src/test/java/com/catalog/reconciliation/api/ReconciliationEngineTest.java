package com.catalog.reconciliation.api;

import com.catalog.reconciliation.CandidateRecords;
import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.audit.KeyDecisionType;
import com.catalog.reconciliation.core.model.AllowlistStatus;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.CatalogField;
import com.catalog.reconciliation.core.model.CatalogView;
import com.catalog.reconciliation.core.model.IssueType;
import com.catalog.reconciliation.core.model.RawCandidateRecord;
import com.catalog.reconciliation.core.model.ReconciliationIssue;
import com.catalog.reconciliation.core.model.RunStatus;
import com.catalog.reconciliation.lock.LocalDistributedLock;
import com.catalog.reconciliation.lock.LockConfig;
import com.catalog.reconciliation.override.CatalogOverride;
import com.catalog.reconciliation.publish.BrandAllowlist;
import com.catalog.reconciliation.quality.AllowlistService;
import com.catalog.reconciliation.quality.BrandQualityCalculator;
import com.catalog.reconciliation.quality.QualityGate;
import com.catalog.reconciliation.review.CollisionReviewItem;
import com.catalog.reconciliation.store.InMemoryRawRecordStore;
import com.catalog.reconciliation.store.RawRecordStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.StreamSupport;

import static com.catalog.reconciliation.CandidateRecords.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("ReconciliationEngine Tests")
class ReconciliationEngineTest {

    private static final Instant WATERMARK = Instant.parse("2024-06-01T00:00:00Z");
    private static final String ROYAL_ADULT = "royal_canin::adult-15kg::dry";
    private static final String COLLIDING = "royal_canin::adult::any";

    private final List<ReconciliationEngine> engines = new ArrayList<>();
    private InMemoryRawRecordStore store;
    private AuditService auditService;
    private AllowlistService allowlistService;

    @BeforeEach
    void setUp() {
        store = new InMemoryRawRecordStore();
        auditService = new AuditService();
        allowlistService = new AllowlistService(BrandAllowlist.of(1, Map.of("royal_canin", AllowlistStatus.ACTIVE)),
                new BrandQualityCalculator(), QualityGate.defaults(), auditService);
    }

    @AfterEach
    void tearDown() {
        engines.forEach(ReconciliationEngine::close);
    }

    private ReconciliationEngine engine(ReconciliationOptions options) {
        return engine(ReconciliationEngine.builder().recordStore(store).options(options));
    }

    private ReconciliationEngine engine(ReconciliationEngine.Builder builder) {
        ReconciliationEngine engine = builder
                .auditService(auditService)
                .allowlistService(allowlistService)
                .build();
        engines.add(engine);
        return engine;
    }

    private void loadCleanCatalog() {
        store.appendAll(List.of(
                CandidateRecords.splitRoyalCanin(),
                CandidateRecords.fullRoyalCanin(),
                record("shop-a.example", "/p/3", "Acana", "Wild Prairie").formRaw("dry").build(),
                record("shop-b.example", "/p/4", "Hills", "Science Plan Adult Lamb").formRaw("dry").build(),
                record("shop-c.example", "/p/5", "Happy Dog", "Adult Lamb").build()));
    }

    private void loadCollidingRecords() {
        store.appendAll(List.of(
                record("shop-c.example", "/p/6", "Royal Canin", "New Improved Formula Adult").build(),
                record("shop-d.example", "/p/7", "Royal Canin", "Adult").build()));
    }

    @Nested
    @DisplayName("Clean run")
    class CleanRun {

        @Test
        @DisplayName("Should merge the split-brand records and publish both views")
        void publishes() {
            loadCleanCatalog();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());

            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(RunStatus.PUBLISHED, result.getStatus());
            assertTrue(result.isPublished());
            assertEquals(5, result.getRecordsRead());
            assertEquals(4, result.getProductsStaged());
            assertEquals(4, result.getPreviewCount());
            assertEquals(1, result.getProductionCount());
            assertTrue(result.getGuardReport().orElseThrow().passed());

            CanonicalProduct royal = engine.getPublishedCatalog().find(CatalogView.PREVIEW, ROYAL_ADULT).orElseThrow();
            assertEquals(365.0, royal.getKcalPer100g().doubleValue());
            assertEquals(AllowlistStatus.ACTIVE, royal.getAllowlistStatus());
        }

        @Test
        @DisplayName("Production only carries allowlisted brands")
        void productionGated() {
            loadCleanCatalog();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());

            engine.run(WATERMARK);

            List<CanonicalProduct> production = engine.getPublishedCatalog()
                    .list(CatalogView.PRODUCTION, PageRequest.of(0, 10)).content();
            assertEquals(1, production.size());
            assertEquals(ROYAL_ADULT, production.get(0).getProductKey());
            assertTrue(engine.getPublishedCatalog().find(CatalogView.PRODUCTION, "acana::wild-prairie::dry").isEmpty());
        }

        @Test
        @DisplayName("Pausing a brand empties its production entries on the next run")
        void pausedBrand() {
            loadCleanCatalog();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());
            engine.run(WATERMARK);

            allowlistService.pause("royal_canin", "editor", "label dispute");
            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(0, result.getProductionCount());
            assertEquals(2, result.getAllowlistVersion());
        }

        @Test
        @DisplayName("Unresolved brands are reported but do not block")
        void unresolvedBrand() {
            loadCleanCatalog();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());

            ReconciliationResult result = engine.run(WATERMARK);

            List<ReconciliationIssue> unresolved = result.getIssues(IssueType.ALIAS_UNRESOLVED);
            assertEquals(1, unresolved.size());
            assertEquals("shop-c.example|/p/5", unresolved.get(0).subject());
        }

        @Test
        @DisplayName("Records seen after the watermark are ignored")
        void watermark() {
            loadCleanCatalog();
            store.append(record("shop-e.example", "/p/9", "Orijen", "Original")
                    .lastSeenAt(WATERMARK.plusSeconds(60)).build());
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());

            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(5, result.getRecordsRead());
            assertEquals(WATERMARK, result.getWatermark());
        }

        @Test
        @DisplayName("Result records the input versions and the run is audited")
        void versionsAndAudit() {
            loadCleanCatalog();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());

            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(engine.getAliasMap().getVersion(), result.getAliasMapVersion());
            assertEquals(1, result.getAllowlistVersion());
            assertEquals(0, result.getOverrideVersion());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RUN_STARTED).size());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.RUN_COMPLETED).size());
            assertEquals(1, auditService.getEntriesByAction(AuditAction.CATALOG_PUBLISHED).size());
            assertEquals(result.getRunId(),
                    engine.getPublishedCatalog().current(CatalogView.PREVIEW).getRunId());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("Override visible at the watermark wins over merged data")
        void applied() {
            loadCleanCatalog();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());
            engine.getOverrideStore().save(CatalogOverride.forProduct(ROYAL_ADULT)
                    .id("ov-1")
                    .set(CatalogField.KCAL_PER_100G, 380.0)
                    .createdAt(WATERMARK.minusSeconds(3600))
                    .build(), "editor");

            ReconciliationResult result = engine.run(WATERMARK);

            CanonicalProduct royal = engine.getPublishedCatalog().find(CatalogView.PREVIEW, ROYAL_ADULT).orElseThrow();
            assertEquals(380.0, royal.getKcalPer100g().doubleValue());
            assertEquals(List.of("ov-1"), royal.getAppliedOverrideIds());
            assertEquals(1, result.getOverrideVersion());
        }

        @Test
        @DisplayName("Override created after the watermark is not applied")
        void future() {
            loadCleanCatalog();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());
            engine.getOverrideStore().save(CatalogOverride.forProduct(ROYAL_ADULT)
                    .id("ov-late")
                    .set(CatalogField.KCAL_PER_100G, 380.0)
                    .createdAt(WATERMARK.plusSeconds(3600))
                    .build(), "editor");

            engine.run(WATERMARK);

            CanonicalProduct royal = engine.getPublishedCatalog().find(CatalogView.PREVIEW, ROYAL_ADULT).orElseThrow();
            assertEquals(365.0, royal.getKcalPer100g().doubleValue());
            assertTrue(royal.getAppliedOverrideIds().isEmpty());
        }

        @Test
        @DisplayName("Override for a missing product is reported as a conflict")
        void missingTarget() {
            loadCleanCatalog();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());
            engine.getOverrideStore().save(CatalogOverride.forProduct("burns::original::dry")
                    .set(CatalogField.KCAL_PER_100G, 350.0)
                    .createdAt(WATERMARK.minusSeconds(60))
                    .build(), "editor");

            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(RunStatus.PUBLISHED, result.getStatus());
            assertEquals(1, result.getIssues(IssueType.OVERRIDE_CONFLICT).size());
        }
    }

    @Nested
    @DisplayName("Key collisions")
    class Collisions {

        @Test
        @DisplayName("Strict mode blocks both views and queues a review")
        void strictBlocks() {
            loadCleanCatalog();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());
            ReconciliationResult first = engine.run(WATERMARK);
            loadCollidingRecords();

            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(RunStatus.BLOCKED_BY_GUARDS, result.getStatus());
            assertFalse(result.isPublished());
            assertEquals(1, result.getCollisions().size());
            assertEquals(1, result.getIssues(IssueType.KEY_COLLISION_DETECTED).size());
            assertEquals(2, result.getIssues(IssueType.GUARD_VIOLATION).size());
            assertEquals(1, engine.getReviewService().getPendingCount());
            assertEquals(first.getRunId(), engine.getPublishedCatalog().current(CatalogView.PREVIEW).getRunId());
            assertEquals(first.getRunId(), engine.getPublishedCatalog().current(CatalogView.PRODUCTION).getRunId());
        }

        @Test
        @DisplayName("Preview-only mode refreshes preview and keeps production")
        void previewOnly() {
            loadCleanCatalog();
            loadCollidingRecords();
            ReconciliationEngine engine = engine(ReconciliationOptions.previewOnViolation());

            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(RunStatus.PUBLISHED_PREVIEW_ONLY, result.getStatus());
            assertEquals(6, result.getPreviewCount());
            assertTrue(engine.getPublishedCatalog().find(CatalogView.PREVIEW, COLLIDING).isPresent());
            assertTrue(engine.getPublishedCatalog().find(CatalogView.PREVIEW, COLLIDING + "~2").isPresent());
            assertTrue(engine.getPublishedCatalog().current(CatalogView.PRODUCTION).isEmpty());
        }

        @Test
        @DisplayName("Approved merge folds the records under one key on the next run")
        void approvedMerge() {
            loadCleanCatalog();
            loadCollidingRecords();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());
            engine.run(WATERMARK);
            CollisionReviewItem item = engine.getReviewService()
                    .getPendingReviews(PageRequest.of(0, 10)).content().get(0);
            assertEquals(COLLIDING, item.getProductKey());

            engine.getReviewService().approveMerge(item.getId(), "reviewer-1", "same recipe");
            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(RunStatus.PUBLISHED, result.getStatus());
            assertEquals(5, result.getPreviewCount());
            assertTrue(engine.getPublishedCatalog().find(CatalogView.PREVIEW, COLLIDING).isPresent());
            assertTrue(engine.getPublishedCatalog().find(CatalogView.PREVIEW, COLLIDING + "~2").isEmpty());
            assertTrue(engine.getKeyDecisionLog().isApproved(COLLIDING, KeyDecisionType.MERGE));
        }

        @Test
        @DisplayName("Override on a suffixed key stays on its product when scores change")
        void suffixedOverrideFollowsProduct() {
            loadCleanCatalog();
            loadCollidingRecords();
            ReconciliationEngine engine = engine(ReconciliationOptions.previewOnViolation());
            engine.getOverrideStore().save(CatalogOverride.forProduct(COLLIDING + "~2")
                    .id("ov-2")
                    .set(CatalogField.KCAL_PER_100G, 300.0)
                    .createdAt(WATERMARK.minusSeconds(3600))
                    .build(), "editor");

            engine.run(WATERMARK);
            CanonicalProduct suffixed = engine.getPublishedCatalog().find(CatalogView.PREVIEW, COLLIDING + "~2")
                    .orElseThrow();
            assertEquals("Adult", suffixed.getProductName());
            assertEquals(List.of("ov-2"), suffixed.getAppliedOverrideIds());

            store.append(record("shop-d.example", "/p/7", "Royal Canin", "Adult")
                    .kcalPer100g(350.0)
                    .lastSeenAt(CandidateRecords.SEEN.plusSeconds(60))
                    .build());
            engine.run(WATERMARK);

            CanonicalProduct base = engine.getPublishedCatalog().find(CatalogView.PREVIEW, COLLIDING).orElseThrow();
            suffixed = engine.getPublishedCatalog().find(CatalogView.PREVIEW, COLLIDING + "~2").orElseThrow();
            assertEquals("Adult", suffixed.getProductName());
            assertEquals(300.0, suffixed.getKcalPer100g().doubleValue());
            assertEquals(List.of("ov-2"), suffixed.getAppliedOverrideIds());
            assertTrue(base.getAppliedOverrideIds().isEmpty());
        }

        @Test
        @DisplayName("Confirmed split keeps both keys and lets the run publish")
        void confirmedSplit() {
            loadCleanCatalog();
            loadCollidingRecords();
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());
            engine.run(WATERMARK);
            CollisionReviewItem item = engine.getReviewService()
                    .getPendingReviews(PageRequest.of(0, 10)).content().get(0);

            engine.getReviewService().confirmSplit(item.getId(), "reviewer-1", "different recipes");
            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(RunStatus.PUBLISHED, result.getStatus());
            assertEquals(6, result.getPreviewCount());
            assertTrue(result.getIssues(IssueType.KEY_COLLISION_DETECTED).isEmpty());
            assertEquals(0, engine.getReviewService().getPendingCount());
            assertTrue(engine.getPublishedCatalog().find(CatalogView.PREVIEW, COLLIDING + "~2").isPresent());
        }
    }

    @Nested
    @DisplayName("Run control")
    class RunControl {

        @Test
        @DisplayName("Run is refused while the lease is held")
        void leaseHeld() {
            loadCleanCatalog();
            LocalDistributedLock lease = new LocalDistributedLock(LockConfig.noWait());
            ReconciliationEngine engine = engine(ReconciliationEngine.builder()
                    .recordStore(store)
                    .leaseLock(lease));
            lease.lock(ReconciliationEngine.LEASE_PREFIX + "catalog");
            try {
                ReconciliationResult result = engine.run(WATERMARK);

                assertEquals(RunStatus.REFUSED_LEASE_HELD, result.getStatus());
                assertEquals(1, result.getIssues(IssueType.SNAPSHOT_RACE).size());
                assertTrue(result.getGuardReport().isEmpty());
                assertTrue(engine.getPublishedCatalog().current(CatalogView.PREVIEW).isEmpty());
                assertEquals(1, auditService.getEntriesByAction(AuditAction.RUN_REFUSED).size());
            } finally {
                lease.unlock(ReconciliationEngine.LEASE_PREFIX + "catalog");
            }

            assertEquals(RunStatus.PUBLISHED, engine.run(WATERMARK).getStatus());
        }

        @Test
        @DisplayName("Run that exceeds its timeout ends TIMED_OUT without publishing")
        void timeout() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            RawRecordStore slowStore = mock(RawRecordStore.class);
            when(slowStore.snapshot(any())).thenAnswer(invocation -> {
                release.await(5, TimeUnit.SECONDS);
                return List.<RawCandidateRecord>of();
            });
            ReconciliationEngine engine = engine(ReconciliationEngine.builder()
                    .recordStore(slowStore)
                    .options(ReconciliationOptions.builder().runTimeout(Duration.ofMillis(100)).build()));
            try {
                ReconciliationResult result = engine.run(WATERMARK);

                assertEquals(RunStatus.TIMED_OUT, result.getStatus());
                assertEquals(0, result.getPreviewCount());
                assertTrue(engine.getPublishedCatalog().current(CatalogView.PREVIEW).isEmpty());
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("Cancelled run ends CANCELLED without publishing")
        void cancel() throws Exception {
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            RawRecordStore slowStore = mock(RawRecordStore.class);
            when(slowStore.snapshot(any())).thenAnswer(invocation -> {
                entered.countDown();
                release.await(5, TimeUnit.SECONDS);
                return List.of(CandidateRecords.fullRoyalCanin());
            });
            ReconciliationEngine engine = engine(ReconciliationEngine.builder().recordStore(slowStore));
            ExecutorService caller = Executors.newSingleThreadExecutor();
            try {
                Future<ReconciliationResult> running = caller.submit(() -> engine.run(WATERMARK));
                assertTrue(entered.await(5, TimeUnit.SECONDS));

                assertTrue(engine.cancel());
                release.countDown();
                ReconciliationResult result = running.get(5, TimeUnit.SECONDS);

                assertEquals(RunStatus.CANCELLED, result.getStatus());
                assertTrue(engine.getPublishedCatalog().current(CatalogView.PREVIEW).isEmpty());
            } finally {
                release.countDown();
                caller.shutdownNow();
            }
        }

        @Test
        @DisplayName("Cancel without an active run does nothing")
        void cancelIdle() {
            ReconciliationEngine engine = engine(ReconciliationOptions.defaults());

            assertFalse(engine.cancel());
        }

        @Test
        @DisplayName("Store failure ends the run FAILED")
        void failure() {
            RawRecordStore brokenStore = mock(RawRecordStore.class);
            when(brokenStore.snapshot(any())).thenThrow(new IllegalStateException("store offline"));
            ReconciliationEngine engine = engine(ReconciliationEngine.builder().recordStore(brokenStore));

            ReconciliationResult result = engine.run(WATERMARK);

            assertEquals(RunStatus.FAILED, result.getStatus());
            assertEquals("store offline", result.getFailureMessage());
        }
    }

    @Test
    @DisplayName("Builder requires a record store")
    void requiresStore() {
        assertThrows(IllegalStateException.class, () -> ReconciliationEngine.builder().build());
    }

    @Test
    @DisplayName("Guard report writer uses the configured sample size")
    void guardReportWriter() {
        ReconciliationEngine engine = engine(ReconciliationOptions.builder().guardSampleSize(1).build());
        loadCleanCatalog();
        loadCollidingRecords();

        ReconciliationResult result = engine.run(WATERMARK);

        var tree = engine.guardReportWriter().toTree(result.getGuardReport().orElseThrow());
        var keyCollision = StreamSupport.stream(tree.spliterator(), false)
                .filter(n -> n.get("guard_name").asText().equals("key-collision"))
                .findFirst().orElseThrow();
        assertEquals(2, keyCollision.get("violation_count").asInt());
        assertEquals(1, keyCollision.get("sample_violations").size());
    }
}
