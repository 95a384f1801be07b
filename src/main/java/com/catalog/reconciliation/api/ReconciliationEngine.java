package com.catalog.reconciliation.api;

import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.audit.KeyDecisionLog;
import com.catalog.reconciliation.bulk.GuardReportWriter;
import com.catalog.reconciliation.cache.CacheStats;
import com.catalog.reconciliation.cache.CanonicalizationCache;
import com.catalog.reconciliation.core.model.IssueType;
import com.catalog.reconciliation.core.model.RawCandidateRecord;
import com.catalog.reconciliation.core.model.ReconciliationIssue;
import com.catalog.reconciliation.core.model.RunStatus;
import com.catalog.reconciliation.guard.BrandKnowledge;
import com.catalog.reconciliation.guard.GuardChecker;
import com.catalog.reconciliation.guard.GuardReport;
import com.catalog.reconciliation.guard.GuardResult;
import com.catalog.reconciliation.guard.GuardViolation;
import com.catalog.reconciliation.key.ProductKeyBuilder;
import com.catalog.reconciliation.lock.DistributedLock;
import com.catalog.reconciliation.lock.LocalDistributedLock;
import com.catalog.reconciliation.lock.LockAcquisitionException;
import com.catalog.reconciliation.lock.LockConfig;
import com.catalog.reconciliation.logging.LogContext;
import com.catalog.reconciliation.merge.CandidatePreparer;
import com.catalog.reconciliation.merge.FieldPrecedence;
import com.catalog.reconciliation.merge.KeyCollision;
import com.catalog.reconciliation.merge.KeyCollisionDetector;
import com.catalog.reconciliation.merge.MergeEngine;
import com.catalog.reconciliation.merge.MergeOutcome;
import com.catalog.reconciliation.merge.ShardedMergeRunner;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.override.CatalogOverride;
import com.catalog.reconciliation.override.InMemoryOverrideStore;
import com.catalog.reconciliation.override.OverrideResolver;
import com.catalog.reconciliation.override.OverrideResult;
import com.catalog.reconciliation.override.OverrideStore;
import com.catalog.reconciliation.publish.BrandAllowlist;
import com.catalog.reconciliation.publish.CatalogSnapshot;
import com.catalog.reconciliation.publish.PublishDecision;
import com.catalog.reconciliation.publish.PublishedCatalog;
import com.catalog.reconciliation.publish.Publisher;
import com.catalog.reconciliation.quality.AllowlistService;
import com.catalog.reconciliation.review.InMemoryReviewQueue;
import com.catalog.reconciliation.review.ReviewQueue;
import com.catalog.reconciliation.review.ReviewService;
import com.catalog.reconciliation.rules.BrandAliasMap;
import com.catalog.reconciliation.rules.BrandCanonicalizer;
import com.catalog.reconciliation.rules.DefaultBrandAliases;
import com.catalog.reconciliation.scoring.QualityScorer;
import com.catalog.reconciliation.similarity.ProductNameSimilarity;
import com.catalog.reconciliation.store.RawRecordStore;
import com.catalog.reconciliation.tracing.NoOpTracingService;
import com.catalog.reconciliation.tracing.Span;
import com.catalog.reconciliation.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Main entry point of the reconciliation library.
 *
 * <p>A run reads every raw record and override as of one watermark, merges, applies
 * overrides, checks guards and publishes both views in one atomic swap. Only one run
 * per lease target executes at a time; a run that finds the lease held is refused.
 * A cancelled, timed-out or failed run never publishes anything.</p>
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ReconciliationEngine engine = ReconciliationEngine.builder()
 *     .recordStore(store)
 *     .aliasMap(aliasMap)
 *     .build();
 *
 * ReconciliationResult result = engine.run(Instant.now());
 * Optional&lt;CanonicalProduct&gt; product = engine.getPublishedCatalog()
 *     .find(CatalogView.PREVIEW, "royal_canin::adult-15kg::dry");
 * </pre>
 */
public class ReconciliationEngine implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    static final String ACTOR = "reconciliation";
    static final String LEASE_PREFIX = "lease:";

    private final ReconciliationOptions options;
    private final RawRecordStore recordStore;
    private final OverrideStore overrideStore;
    private final AllowlistService allowlistService;
    private final DistributedLock leaseLock;
    private final MetricsService metrics;
    private final TracingService tracing;
    private final CanonicalizationCache cache;
    private final KeyDecisionLog decisions;
    private final ReviewService reviewService;
    private final AuditService auditService;
    private final PublishedCatalog catalog;
    private final Publisher publisher;
    private final ShardedMergeRunner mergeRunner;
    private final OverrideResolver overrideResolver;
    private final Clock clock;
    private final ExecutorService runExecutor;
    private final ExecutorService shardExecutor;
    private final boolean ownsShardExecutor;
    private final AtomicReference<RunControl> activeRun = new AtomicReference<>();

    private volatile BrandAliasMap aliasMap;
    private volatile BrandKnowledge brandKnowledge;

    private ReconciliationEngine(Builder builder) {
        this.options = builder.options;
        this.recordStore = builder.recordStore;
        this.clock = builder.clock;
        this.metrics = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
        this.tracing = builder.tracingService != null ? builder.tracingService : new NoOpTracingService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService(clock);
        this.decisions = builder.keyDecisionLog != null ? builder.keyDecisionLog : new KeyDecisionLog(clock);
        this.leaseLock = builder.leaseLock != null
                ? builder.leaseLock : new LocalDistributedLock(LockConfig.of(options.getLeaseTimeout()));
        this.overrideStore = builder.overrideStore != null
                ? builder.overrideStore : new InMemoryOverrideStore(new LocalDistributedLock(), auditService);
        this.allowlistService = builder.allowlistService != null
                ? builder.allowlistService : new AllowlistService(auditService);
        this.cache = builder.cache != null ? builder.cache : CanonicalizationCache.create(options.getCacheConfig());
        this.catalog = builder.catalog != null ? builder.catalog : new PublishedCatalog();
        this.publisher = new Publisher(catalog, auditService, metrics);

        ReviewQueue reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        this.reviewService = new ReviewService(reviewQueue, decisions, auditService);

        // Initialize the pipeline stages
        CandidatePreparer preparer = new CandidatePreparer(
                new BrandCanonicalizer(),
                new ProductKeyBuilder(options.getStopList(), options.getPackSizeStripping()),
                new QualityScorer(options.getScoringWeights(), options.getTrustTable()),
                cache);
        KeyCollisionDetector detector = new KeyCollisionDetector(
                new ProductNameSimilarity(), options.getCollisionThreshold(), decisions);
        this.mergeRunner = new ShardedMergeRunner(preparer,
                new MergeEngine(builder.precedence, options.getPriceBuckets()), detector, metrics);
        this.overrideResolver = new OverrideResolver(builder.precedence, options.getPriceBuckets(), auditService);

        this.runExecutor = Executors.newCachedThreadPool(daemonThreads("catalog-reconcile-run"));
        this.ownsShardExecutor = builder.shardExecutor == null;
        this.shardExecutor = builder.shardExecutor != null
                ? builder.shardExecutor
                : Executors.newFixedThreadPool(options.getParallelism(), daemonThreads("catalog-merge-shard"));

        useAliasMap(builder.aliasMap != null ? builder.aliasMap : DefaultBrandAliases.create());
        log.info("ReconciliationEngine initialized options={}", options);
    }

    // ========== Runs ==========

    /**
     * Reconciles every record and override visible at {@code watermark} and publishes the
     * result. Never throws for the recoverable conditions; they are reported on the result.
     */
    public ReconciliationResult run(Instant watermark) {
        Objects.requireNonNull(watermark, "watermark is required");
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();
        BrandAliasMap aliases = this.aliasMap;
        BrandKnowledge knowledge = this.brandKnowledge;
        String leaseKey = LEASE_PREFIX + options.getLeaseTarget();

        try (LogContext ctx = LogContext.forRun(runId, watermark);
             Span span = tracing.startStage(TracingService.RUN, runId)) {
            try {
                leaseLock.lock(leaseKey);
            } catch (LockAcquisitionException e) {
                span.setAttribute("status", RunStatus.REFUSED_LEASE_HELD.name());
                return refused(runId, watermark, aliases, e, start);
            }
            try {
                ReconciliationResult result = runLeased(runId, watermark, aliases, knowledge, start);
                span.setAttribute("status", result.getStatus().name());
                span.setStatus(result.getStatus() == RunStatus.FAILED ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);
                return result;
            } finally {
                leaseLock.unlock(leaseKey);
            }
        }
    }

    /**
     * Asks the active run to stop. It ends as CANCELLED without publishing, unless it has
     * already started its atomic publish.
     *
     * @return true if a running run was asked to stop
     */
    public boolean cancel() {
        RunControl control = activeRun.get();
        boolean stopped = control != null && control.stop(RunStatus.CANCELLED);
        if (stopped) {
            log.info("reconcile.cancel_requested");
        }
        return stopped;
    }

    private ReconciliationResult runLeased(String runId, Instant watermark, BrandAliasMap aliases,
                                           BrandKnowledge knowledge, long start) {
        BrandAllowlist allowlist = allowlistService.current();
        long overrideVersion = overrideStore.getVersion();
        List<CatalogOverride> overrides = overrideStore.snapshot(watermark);

        Map<String, Object> startDetails = new LinkedHashMap<>();
        startDetails.put("watermark", watermark.toString());
        startDetails.put("aliasMapVersion", aliases.getVersion());
        startDetails.put("allowlistVersion", allowlist.getVersion());
        startDetails.put("overrideVersion", overrideVersion);
        auditService.record(AuditAction.RUN_STARTED, runId, ACTOR, startDetails);
        log.info("reconcile.started runId={} aliasMapVersion={} allowlistVersion={} overrideVersion={} overrides={}",
                runId, aliases.getVersion(), allowlist.getVersion(), overrideVersion, overrides.size());

        RunControl control = new RunControl();
        activeRun.set(control);
        CacheStats cacheBefore = cache.getStats();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        ReconciliationResult.Builder result = ReconciliationResult.builder(runId, watermark)
                .versions(aliases.getVersion(), allowlist.getVersion(), overrideVersion);
        try {
            CompletableFuture<Staged> future = CompletableFuture.supplyAsync(() -> {
                if (mdc != null) {
                    MDC.setContextMap(mdc);
                }
                try {
                    return execute(runId, watermark, aliases, knowledge, allowlist, overrides, overrideVersion, control);
                } finally {
                    MDC.clear();
                }
            }, runExecutor);

            Outcome outcome = await(future, control);
            if (outcome.staged() != null) {
                Staged staged = outcome.staged();
                result.status(staged.decision().status())
                        .recordsRead(staged.recordsRead())
                        .productsStaged(staged.productsStaged())
                        .published(staged.decision().previewCount(), staged.decision().productionCount())
                        .issues(staged.issues())
                        .collisions(staged.collisions())
                        .guardReport(staged.guardReport());
            } else if (outcome.failure() != null) {
                log.error("reconcile.failed runId={} error={}", runId, outcome.failure().getMessage(), outcome.failure());
                result.status(RunStatus.FAILED).failureMessage(String.valueOf(outcome.failure().getMessage()));
            } else {
                log.warn("reconcile.stopped runId={} status={}", runId, outcome.stoppedWith());
                result.status(outcome.stoppedWith());
            }
        } finally {
            activeRun.compareAndSet(control, null);
            CacheStats cacheAfter = cache.getStats();
            metrics.recordCacheHits(Math.max(0, cacheAfter.hits() - cacheBefore.hits()));
            metrics.recordCacheMisses(Math.max(0, cacheAfter.misses() - cacheBefore.misses()));
        }

        return complete(result.duration(elapsed(start)).build());
    }

    private Staged execute(String runId, Instant watermark, BrandAliasMap aliases, BrandKnowledge knowledge,
                           BrandAllowlist allowlist, List<CatalogOverride> overrides, long overrideVersion,
                           RunControl control) {
        List<RawCandidateRecord> records = recordStore.snapshot(watermark);
        metrics.recordRecordsRead(records.size());
        List<ReconciliationIssue> issues = new ArrayList<>();

        MergeOutcome merged;
        try (Span span = tracing.startStage(TracingService.MERGE, runId)) {
            merged = mergeRunner.run(runId, records, aliases, options.getParallelism(), shardExecutor,
                    control::isStopped);
            span.setAttribute("products", merged.products().size());
        }
        issues.addAll(merged.issues());
        for (KeyCollision collision : merged.collisions()) {
            if (!collision.splitConfirmed()) {
                issues.add(ReconciliationIssue.of(IssueType.KEY_COLLISION_DETECTED, collision.productKey(),
                        "Published as " + collision.productKeys() + " pending review (similarity "
                                + String.format(Locale.ROOT, "%.2f", collision.similarity()) + ")"));
                reviewService.submit(collision);
            }
        }
        checkStopped(control, runId, "overrides");

        OverrideResult overridden;
        try (Span span = tracing.startStage(TracingService.OVERRIDES, runId)) {
            overridden = overrideResolver.applyAll(merged.products(), overrides);
            span.setAttribute("applied", overridden.appliedCount());
        }
        issues.addAll(overridden.issues());
        checkStopped(control, runId, "guards");

        GuardReport report;
        try (Span span = tracing.startStage(TracingService.GUARDS, runId)) {
            report = GuardChecker.standard(knowledge, decisions, metrics).checkAll(overridden.products());
            span.setAttribute("violations", report.totalViolations());
        }
        for (GuardResult guard : report.results()) {
            for (GuardViolation violation : guard.violations()) {
                issues.add(ReconciliationIssue.of(IssueType.GUARD_VIOLATION, violation.productKey(),
                        violation.guardName() + ": " + violation.message()));
            }
        }
        issues.forEach(issue -> metrics.incrementIssue(issue.type()));

        if (!control.beginPublish()) {
            throw new CancellationException("Run " + runId + " stopped before publish");
        }
        PublishDecision decision;
        try (Span span = tracing.startStage(TracingService.PUBLISH, runId)) {
            CatalogSnapshot staged = new CatalogSnapshot(runId, watermark, aliases.getVersion(),
                    allowlist.getVersion(), overrideVersion, overridden.products(), clock.instant());
            decision = publisher.publish(staged, report, allowlist, options.getPublishMode());
            span.setAttribute("status", decision.status().name());
        }
        return new Staged(merged.recordsRead(), overridden.products().size(), issues, merged.collisions(),
                report, decision);
    }

    private Outcome await(CompletableFuture<Staged> future, RunControl control) {
        try {
            return Outcome.completed(future.get(options.getRunTimeout().toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            if (control.stop(RunStatus.TIMED_OUT)) {
                return Outcome.stopped(RunStatus.TIMED_OUT);
            }
            return awaitPublish(future, control);
        } catch (ExecutionException e) {
            return unwrap(e.getCause(), control);
        } catch (CancellationException e) {
            return Outcome.stopped(control.stopReason());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (control.stop(RunStatus.CANCELLED)) {
                return Outcome.stopped(RunStatus.CANCELLED);
            }
            return awaitPublish(future, control);
        }
    }

    /**
     * The run was stopped too late: its publish had already started, so it is waited for.
     */
    private static Outcome awaitPublish(CompletableFuture<Staged> future, RunControl control) {
        try {
            return Outcome.completed(future.join());
        } catch (CompletionException e) {
            return unwrap(e.getCause(), control);
        }
    }

    private static Outcome unwrap(Throwable cause, RunControl control) {
        if (cause instanceof CancellationException) {
            return Outcome.stopped(control.stopReason());
        }
        return Outcome.failed(cause);
    }

    private static void checkStopped(RunControl control, String runId, String nextStage) {
        if (control.isStopped()) {
            throw new CancellationException("Run " + runId + " stopped before " + nextStage);
        }
    }

    private ReconciliationResult refused(String runId, Instant watermark, BrandAliasMap aliases,
                                         LockAcquisitionException e, long start) {
        ReconciliationIssue issue = ReconciliationIssue.of(IssueType.SNAPSHOT_RACE, options.getLeaseTarget(),
                "Lease already held: " + e.getMessage());
        metrics.incrementIssue(IssueType.SNAPSHOT_RACE);
        auditService.record(AuditAction.RUN_REFUSED, runId, ACTOR,
                Map.of("leaseTarget", options.getLeaseTarget(), "watermark", watermark.toString()));
        log.warn("reconcile.refused runId={} leaseTarget={} reason={}", runId, options.getLeaseTarget(), e.getMessage());
        ReconciliationResult result = ReconciliationResult.builder(runId, watermark)
                .status(RunStatus.REFUSED_LEASE_HELD)
                .versions(aliases.getVersion(), allowlistService.current().getVersion(), overrideStore.getVersion())
                .issues(List.of(issue))
                .duration(elapsed(start))
                .build();
        metrics.recordRunDuration(result.getStatus(), result.getDuration());
        return result;
    }

    private ReconciliationResult complete(ReconciliationResult result) {
        metrics.recordRunDuration(result.getStatus(), result.getDuration());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", result.getStatus().name());
        details.put("recordsRead", result.getRecordsRead());
        details.put("preview", result.getPreviewCount());
        details.put("production", result.getProductionCount());
        details.put("issues", result.getIssues().size());
        details.put("durationMs", result.getDuration().toMillis());
        auditService.record(AuditAction.RUN_COMPLETED, result.getRunId(), ACTOR, details);
        log.info("reconcile.completed runId={} status={} records={} staged={} preview={} production={} issues={} durationMs={}",
                result.getRunId(), result.getStatus(), result.getRecordsRead(), result.getProductsStaged(),
                result.getPreviewCount(), result.getProductionCount(), result.getIssues().size(),
                result.getDuration().toMillis());
        return result;
    }

    private static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    // ========== Inputs and collaborators ==========

    /**
     * Switches the alias map used by subsequent runs. A run in progress keeps the
     * version it started with.
     */
    public void useAliasMap(BrandAliasMap aliasMap) {
        Objects.requireNonNull(aliasMap, "aliasMap is required");
        this.brandKnowledge = BrandKnowledge.from(aliasMap);
        this.aliasMap = aliasMap;
        log.info("aliasmap.activated version={} entries={}", aliasMap.getVersion(), aliasMap.getEntries().size());
    }

    public BrandAliasMap getAliasMap() {
        return aliasMap;
    }

    public PublishedCatalog getPublishedCatalog() {
        return catalog;
    }

    public OverrideStore getOverrideStore() {
        return overrideStore;
    }

    public AllowlistService getAllowlistService() {
        return allowlistService;
    }

    public ReviewService getReviewService() {
        return reviewService;
    }

    public KeyDecisionLog getKeyDecisionLog() {
        return decisions;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public RawRecordStore getRecordStore() {
        return recordStore;
    }

    public ReconciliationOptions getOptions() {
        return options;
    }

    public CacheStats getCacheStats() {
        return cache.getStats();
    }

    public GuardReportWriter guardReportWriter() {
        return new GuardReportWriter(options.getGuardSampleSize());
    }

    @Override
    public void close() {
        runExecutor.shutdownNow();
        if (ownsShardExecutor) {
            shardExecutor.shutdownNow();
        }
        log.info("ReconciliationEngine closed");
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Stop/publish handshake between the caller and the run thread: whichever of
     * {@link #stop} and {@link #beginPublish} comes first wins.
     */
    private static final class RunControl {
        private boolean stopped;
        private boolean publishing;
        private RunStatus stopReason = RunStatus.CANCELLED;

        synchronized boolean stop(RunStatus reason) {
            if (stopped || publishing) {
                return false;
            }
            stopped = true;
            stopReason = reason;
            return true;
        }

        synchronized boolean beginPublish() {
            if (stopped) {
                return false;
            }
            publishing = true;
            return true;
        }

        synchronized boolean isStopped() {
            return stopped;
        }

        synchronized RunStatus stopReason() {
            return stopReason;
        }
    }

    private record Staged(int recordsRead, int productsStaged, List<ReconciliationIssue> issues,
                          List<KeyCollision> collisions, GuardReport guardReport, PublishDecision decision) {
    }

    private record Outcome(Staged staged, RunStatus stoppedWith, Throwable failure) {

        static Outcome completed(Staged staged) {
            return new Outcome(staged, null, null);
        }

        static Outcome stopped(RunStatus status) {
            return new Outcome(null, status, null);
        }

        static Outcome failed(Throwable failure) {
            return new Outcome(null, null, failure);
        }
    }

    public static class Builder {
        private RawRecordStore recordStore;
        private OverrideStore overrideStore;
        private BrandAliasMap aliasMap;
        private AllowlistService allowlistService;
        private DistributedLock leaseLock;
        private MetricsService metricsService;
        private TracingService tracingService;
        private CanonicalizationCache cache;
        private KeyDecisionLog keyDecisionLog;
        private ReviewQueue reviewQueue;
        private AuditService auditService;
        private PublishedCatalog catalog;
        private ExecutorService shardExecutor;
        private FieldPrecedence precedence = FieldPrecedence.defaults();
        private ReconciliationOptions options = ReconciliationOptions.defaults();
        private Clock clock = Clock.systemUTC();

        public Builder recordStore(RawRecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        public Builder overrideStore(OverrideStore overrideStore) {
            this.overrideStore = overrideStore;
            return this;
        }

        public Builder aliasMap(BrandAliasMap aliasMap) {
            this.aliasMap = aliasMap;
            return this;
        }

        public Builder allowlistService(AllowlistService allowlistService) {
            this.allowlistService = allowlistService;
            return this;
        }

        /**
         * Lock used for run leases. Share one instance between engines that publish to the
         * same target.
         */
        public Builder leaseLock(DistributedLock leaseLock) {
            this.leaseLock = leaseLock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        public Builder cache(CanonicalizationCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder keyDecisionLog(KeyDecisionLog keyDecisionLog) {
            this.keyDecisionLog = keyDecisionLog;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder publishedCatalog(PublishedCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        /**
         * Executor for merge shards. When not set the engine creates and owns one.
         */
        public Builder shardExecutor(ExecutorService shardExecutor) {
            this.shardExecutor = shardExecutor;
            return this;
        }

        public Builder precedence(FieldPrecedence precedence) {
            this.precedence = Objects.requireNonNull(precedence, "precedence is required");
            return this;
        }

        public Builder options(ReconciliationOptions options) {
            this.options = Objects.requireNonNull(options, "options is required");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock is required");
            return this;
        }

        public ReconciliationEngine build() {
            if (recordStore == null) {
                throw new IllegalStateException("RawRecordStore is required");
            }
            return new ReconciliationEngine(this);
        }
    }
}
