package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CatalogView;
import com.catalog.reconciliation.core.model.IssueType;
import com.catalog.reconciliation.core.model.RunStatus;

import java.time.Duration;

/**
 * Records reconciliation metrics. The default {@link NoOpMetricsService} does nothing,
 * so the library runs without a metrics backend.
 */
public interface MetricsService {

    void recordRunDuration(RunStatus status, Duration duration);

    void recordRecordsRead(int count);

    void recordProductsPublished(CatalogView view, int count);

    void incrementIssue(IssueType type);

    void recordGuardViolations(String guardName, int count);

    void recordShardSize(int size);

    void recordCacheHits(long hits);

    void recordCacheMisses(long misses);
}
