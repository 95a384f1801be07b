package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CatalogView;
import com.catalog.reconciliation.core.model.IssueType;
import com.catalog.reconciliation.core.model.RunStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code catalog.reconcile.duration}: Timer (tag: status)</li>
 *   <li>{@code catalog.records.read}: Counter</li>
 *   <li>{@code catalog.products.published}: Counter (tag: view)</li>
 *   <li>{@code catalog.issues}: Counter (tag: type)</li>
 *   <li>{@code catalog.guard.violations}: Counter (tag: guard)</li>
 *   <li>{@code catalog.shard.size}: DistributionSummary</li>
 *   <li>{@code catalog.cache.hit} and {@code catalog.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter recordsReadCounter;
    private final DistributionSummary shardSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.recordsReadCounter = Counter.builder("catalog.records.read")
                .description("Raw candidate records read below the run watermark")
                .register(registry);
        this.shardSizeSummary = DistributionSummary.builder("catalog.shard.size")
                .description("Number of product groups per merge shard")
                .register(registry);
        this.cacheHitCounter = Counter.builder("catalog.cache.hit")
                .description("Brand canonicalization cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("catalog.cache.miss")
                .description("Brand canonicalization cache misses")
                .register(registry);
    }

    @Override
    public void recordRunDuration(RunStatus status, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(status.name(), k ->
                Timer.builder("catalog.reconcile.duration")
                        .description("Duration of reconciliation runs")
                        .tag("status", status.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordRecordsRead(int count) {
        recordsReadCounter.increment(count);
    }

    @Override
    public void recordProductsPublished(CatalogView view, int count) {
        counter("published:" + view.name(), "catalog.products.published",
                "Products swapped into a published view", "view", view.name()).increment(count);
    }

    @Override
    public void incrementIssue(IssueType type) {
        counter("issue:" + type.name(), "catalog.issues",
                "Recoverable issues reported by runs", "type", type.name()).increment();
    }

    @Override
    public void recordGuardViolations(String guardName, int count) {
        counter("guard:" + guardName, "catalog.guard.violations",
                "Guard violations found in staged product sets", "guard", guardName).increment(count);
    }

    @Override
    public void recordShardSize(int size) {
        shardSizeSummary.record(size);
    }

    @Override
    public void recordCacheHits(long hits) {
        cacheHitCounter.increment(hits);
    }

    @Override
    public void recordCacheMisses(long misses) {
        cacheMissCounter.increment(misses);
    }

    private Counter counter(String cacheKey, String name, String description, String tagKey, String tagValue) {
        return counterCache.computeIfAbsent(cacheKey, k ->
                Counter.builder(name)
                        .description(description)
                        .tag(tagKey, tagValue)
                        .register(registry));
    }
}
