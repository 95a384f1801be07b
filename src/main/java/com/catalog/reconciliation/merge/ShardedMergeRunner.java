package com.catalog.reconciliation.merge;

import com.catalog.reconciliation.core.ReconciliationException;
import com.catalog.reconciliation.core.model.CanonicalProduct;
import com.catalog.reconciliation.core.model.IssueType;
import com.catalog.reconciliation.core.model.RawCandidateRecord;
import com.catalog.reconciliation.core.model.ReconciliationIssue;
import com.catalog.reconciliation.logging.LogContext;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.rules.BrandAliasMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.BooleanSupplier;

/**
 * Runs the merge stage: prepares every record, groups candidates by canonical key and
 * merges the groups on {@code parallelism} independent shards.
 *
 * <p>Shards share nothing, and the output is sorted by product key, so the result is
 * the same for any parallelism and any record order.</p>
 */
public class ShardedMergeRunner {
    private static final Logger log = LoggerFactory.getLogger(ShardedMergeRunner.class);

    private final CandidatePreparer preparer;
    private final MergeEngine mergeEngine;
    private final KeyCollisionDetector collisionDetector;
    private final MetricsService metrics;

    public ShardedMergeRunner(CandidatePreparer preparer, MergeEngine mergeEngine,
                              KeyCollisionDetector collisionDetector, MetricsService metrics) {
        this.preparer = preparer;
        this.mergeEngine = mergeEngine;
        this.collisionDetector = collisionDetector;
        this.metrics = metrics;
    }

    /**
     * @param stop checked between groups; when it returns true the stage throws
     *             {@link CancellationException}
     * @throws ReconciliationException if a shard fails
     */
    public MergeOutcome run(String runId, Collection<RawCandidateRecord> records, BrandAliasMap aliasMap,
                            int parallelism, Executor executor, BooleanSupplier stop) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("parallelism must be >= 1");
        }
        List<ReconciliationIssue> issues = new ArrayList<>();
        Map<String, List<PreparedCandidate>> groups = new TreeMap<>();
        for (RawCandidateRecord record : records) {
            PreparedCandidate candidate = preparer.prepare(record, aliasMap);
            if (!candidate.brand().isResolved()) {
                issues.add(ReconciliationIssue.of(IssueType.ALIAS_UNRESOLVED, record.getSourceId(),
                        "No alias matched brand '" + record.getBrandRaw() + "'; using '"
                                + candidate.brand().brandSlug() + "'"));
            }
            groups.computeIfAbsent(candidate.key().productKey(), k -> new ArrayList<>()).add(candidate);
        }

        List<List<List<PreparedCandidate>>> shards = new ArrayList<>(parallelism);
        for (int i = 0; i < parallelism; i++) {
            shards.add(new ArrayList<>());
        }
        for (Map.Entry<String, List<PreparedCandidate>> group : groups.entrySet()) {
            shards.get(Math.floorMod(group.getKey().hashCode(), parallelism)).add(group.getValue());
        }
        log.info("merge.starting records={} groups={} shards={}", records.size(), groups.size(), parallelism);

        List<CompletableFuture<ShardResult>> futures = new ArrayList<>(parallelism);
        for (int i = 0; i < parallelism; i++) {
            int shard = i;
            List<List<PreparedCandidate>> shardGroups = shards.get(i);
            metrics.recordShardSize(shardGroups.size());
            futures.add(CompletableFuture.supplyAsync(() -> mergeShard(runId, shard, shardGroups, stop), executor));
        }

        List<CanonicalProduct> products = new ArrayList<>();
        List<KeyCollision> collisions = new ArrayList<>();
        for (CompletableFuture<ShardResult> future : futures) {
            ShardResult result = join(future);
            products.addAll(result.products());
            collisions.addAll(result.collisions());
        }
        products.sort(Comparator.comparing(CanonicalProduct::getProductKey));
        collisions.sort(Comparator.comparing(KeyCollision::productKey));
        log.info("merge.completed products={} collisions={} issues={}",
                products.size(), collisions.size(), issues.size());
        return new MergeOutcome(products, collisions, issues, records.size());
    }

    private ShardResult mergeShard(String runId, int shard, List<List<PreparedCandidate>> groups,
                                   BooleanSupplier stop) {
        try (LogContext ctx = LogContext.forShard(runId, shard)) {
            List<CanonicalProduct> products = new ArrayList<>();
            List<KeyCollision> collisions = new ArrayList<>();
            for (List<PreparedCandidate> group : groups) {
                if (stop.getAsBoolean()) {
                    throw new CancellationException("Run " + runId + " stopped during merge");
                }
                List<KeyCluster> clusters = collisionDetector.cluster(group.get(0).key(), group);
                for (KeyCluster cluster : clusters) {
                    products.add(mergeEngine.merge(cluster.key(), cluster.productKey(), cluster.members()));
                }
                collisionDetector.describe(clusters).ifPresent(collisions::add);
            }
            log.debug("merge.shard_completed shard={} groups={} products={}", shard, groups.size(), products.size());
            return new ShardResult(products, collisions);
        }
    }

    private static ShardResult join(CompletableFuture<ShardResult> future) {
        try {
            return future.join();
        } catch (CancellationException e) {
            throw e;
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CancellationException cancellation) {
                throw cancellation;
            }
            throw new ReconciliationException("Merge shard failed: " + cause.getMessage(), cause);
        }
    }

    private record ShardResult(List<CanonicalProduct> products, List<KeyCollision> collisions) {
    }
}
