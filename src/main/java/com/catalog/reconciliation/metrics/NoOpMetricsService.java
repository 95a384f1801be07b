package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.CatalogView;
import com.catalog.reconciliation.core.model.IssueType;
import com.catalog.reconciliation.core.model.RunStatus;

import java.time.Duration;

/**
 * {@link MetricsService} that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRunDuration(RunStatus status, Duration duration) {
    }

    @Override
    public void recordRecordsRead(int count) {
    }

    @Override
    public void recordProductsPublished(CatalogView view, int count) {
    }

    @Override
    public void incrementIssue(IssueType type) {
    }

    @Override
    public void recordGuardViolations(String guardName, int count) {
    }

    @Override
    public void recordShardSize(int size) {
    }

    @Override
    public void recordCacheHits(long hits) {
    }

    @Override
    public void recordCacheMisses(long misses) {
    }
}
