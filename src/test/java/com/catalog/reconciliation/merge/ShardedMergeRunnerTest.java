package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.CandidateRecords;
import com.catalog.reconciliation.audit.KeyDecisionLog;
import com.catalog.reconciliation.core.model.IssueType;
import com.catalog.reconciliation.core.model.RawCandidateRecord;
import com.catalog.reconciliation.key.ProductKeyBuilder;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.rules.BrandAliasMap;
import com.catalog.reconciliation.rules.DefaultBrandAliases;
import com.catalog.reconciliation.scoring.QualityScorer;
import com.catalog.reconciliation.similarity.ProductNameSimilarity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.catalog.reconciliation.CandidateRecords.record;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ShardedMergeRunner Tests")
class ShardedMergeRunnerTest {

    private final BrandAliasMap aliases = DefaultBrandAliases.create();
    private ShardedMergeRunner runner;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        runner = new ShardedMergeRunner(
                new CandidatePreparer(new ProductKeyBuilder(), new QualityScorer()),
                new MergeEngine(),
                new KeyCollisionDetector(new ProductNameSimilarity(), KeyCollisionDetector.DEFAULT_THRESHOLD,
                        new KeyDecisionLog()),
                new NoOpMetricsService());
        executor = Executors.newFixedThreadPool(4);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private List<RawCandidateRecord> catalog() {
        List<RawCandidateRecord> records = new ArrayList<>();
        records.add(CandidateRecords.splitRoyalCanin());
        records.add(CandidateRecords.fullRoyalCanin());
        records.add(record("shop-a.example", "/p/3", "Acana", "Wild Prairie").formRaw("dry").build());
        records.add(record("shop-b.example", "/p/4", "Hills", "Science Plan Adult Lamb").formRaw("dry").build());
        records.add(record("shop-c.example", "/p/5", "Happy Dog", "Adult Lamb").build());
        records.add(record("shop-c.example", "/p/6", "Royal Canin", "New Improved Formula Adult").build());
        records.add(record("shop-d.example", "/p/7", "Royal Canin", "Adult").build());
        return records;
    }

    @Test
    @DisplayName("Groups records by key and merges each group")
    void mergesGroups() {
        MergeOutcome outcome = runner.run("run-1", catalog(), aliases, 1, executor, () -> false);

        assertEquals(7, outcome.recordsRead());
        assertEquals(6, outcome.products().size());
        assertEquals(1, outcome.collisions().size());
        assertTrue(outcome.products().stream()
                .anyMatch(p -> p.getProductKey().equals("royal_canin::adult-15kg::dry")));
    }

    @Test
    @DisplayName("Unresolved brands are reported")
    void unresolvedBrand() {
        MergeOutcome outcome = runner.run("run-1", catalog(), aliases, 1, executor, () -> false);

        assertEquals(1, outcome.issues().size());
        assertEquals(IssueType.ALIAS_UNRESOLVED, outcome.issues().get(0).type());
        assertEquals("shop-c.example|/p/5", outcome.issues().get(0).subject());
    }

    @Test
    @DisplayName("Parallelism and record order do not change the result")
    void deterministic() {
        List<RawCandidateRecord> shuffled = catalog();
        Collections.reverse(shuffled);

        MergeOutcome serial = runner.run("run-1", catalog(), aliases, 1, executor, () -> false);
        MergeOutcome parallel = runner.run("run-2", shuffled, aliases, 4, executor, () -> false);

        assertEquals(serial.products(), parallel.products());
        assertEquals(serial.collisions(), parallel.collisions());
    }

    @Test
    @DisplayName("Stop signal aborts the stage")
    void stop() {
        assertThrows(CancellationException.class,
                () -> runner.run("run-1", catalog(), aliases, 2, executor, () -> true));
    }

    @Test
    @DisplayName("Parallelism below one is rejected")
    void invalidParallelism() {
        assertThrows(IllegalArgumentException.class,
                () -> runner.run("run-1", catalog(), aliases, 0, executor, () -> false));
    }
}
