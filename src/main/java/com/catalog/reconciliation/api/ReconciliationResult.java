package com.catalog.reconciliation.api;

import com.catalog.reconciliation.core.model.IssueType;
import com.catalog.reconciliation.core.model.ReconciliationIssue;
import com.catalog.reconciliation.core.model.RunStatus;
import com.catalog.reconciliation.guard.GuardReport;
import com.catalog.reconciliation.merge.KeyCollision;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Outcome of one reconciliation run, with the input versions it was computed from.
 */
public final class ReconciliationResult {

    private final String runId;
    private final RunStatus status;
    private final Instant watermark;
    private final String aliasMapVersion;
    private final long allowlistVersion;
    private final long overrideVersion;
    private final int recordsRead;
    private final int productsStaged;
    private final int previewCount;
    private final int productionCount;
    private final List<ReconciliationIssue> issues;
    private final List<KeyCollision> collisions;
    private final GuardReport guardReport;
    private final Duration duration;
    private final String failureMessage;

    private ReconciliationResult(Builder builder) {
        this.runId = builder.runId;
        this.status = builder.status;
        this.watermark = builder.watermark;
        this.aliasMapVersion = builder.aliasMapVersion;
        this.allowlistVersion = builder.allowlistVersion;
        this.overrideVersion = builder.overrideVersion;
        this.recordsRead = builder.recordsRead;
        this.productsStaged = builder.productsStaged;
        this.previewCount = builder.previewCount;
        this.productionCount = builder.productionCount;
        this.issues = List.copyOf(builder.issues);
        this.collisions = List.copyOf(builder.collisions);
        this.guardReport = builder.guardReport;
        this.duration = builder.duration;
        this.failureMessage = builder.failureMessage;
    }

    public String getRunId() {
        return runId;
    }

    public RunStatus getStatus() {
        return status;
    }

    public boolean isPublished() {
        return status.isPublished();
    }

    public Instant getWatermark() {
        return watermark;
    }

    public String getAliasMapVersion() {
        return aliasMapVersion;
    }

    public long getAllowlistVersion() {
        return allowlistVersion;
    }

    public long getOverrideVersion() {
        return overrideVersion;
    }

    public int getRecordsRead() {
        return recordsRead;
    }

    public int getProductsStaged() {
        return productsStaged;
    }

    public int getPreviewCount() {
        return previewCount;
    }

    public int getProductionCount() {
        return productionCount;
    }

    public List<ReconciliationIssue> getIssues() {
        return issues;
    }

    public List<ReconciliationIssue> getIssues(IssueType type) {
        return issues.stream().filter(i -> i.type() == type).toList();
    }

    public List<KeyCollision> getCollisions() {
        return collisions;
    }

    /**
     * Empty when the run stopped before the guards ran.
     */
    public Optional<GuardReport> getGuardReport() {
        return Optional.ofNullable(guardReport);
    }

    public Duration getDuration() {
        return duration;
    }

    /**
     * Cause of a FAILED run, else null.
     */
    public String getFailureMessage() {
        return failureMessage;
    }

    @Override
    public String toString() {
        return "ReconciliationResult{runId='" + runId + '\'' +
                ", status=" + status +
                ", records=" + recordsRead +
                ", staged=" + productsStaged +
                ", preview=" + previewCount +
                ", production=" + productionCount +
                ", issues=" + issues.size() +
                ", duration=" + duration + '}';
    }

    static Builder builder(String runId, Instant watermark) {
        return new Builder(runId, watermark);
    }

    static final class Builder {
        private final String runId;
        private final Instant watermark;
        private RunStatus status;
        private String aliasMapVersion;
        private long allowlistVersion = -1;
        private long overrideVersion = -1;
        private int recordsRead;
        private int productsStaged;
        private int previewCount;
        private int productionCount;
        private List<ReconciliationIssue> issues = List.of();
        private List<KeyCollision> collisions = List.of();
        private GuardReport guardReport;
        private Duration duration = Duration.ZERO;
        private String failureMessage;

        private Builder(String runId, Instant watermark) {
            this.runId = runId;
            this.watermark = watermark;
        }

        Builder status(RunStatus status) {
            this.status = status;
            return this;
        }

        Builder versions(String aliasMapVersion, long allowlistVersion, long overrideVersion) {
            this.aliasMapVersion = aliasMapVersion;
            this.allowlistVersion = allowlistVersion;
            this.overrideVersion = overrideVersion;
            return this;
        }

        Builder recordsRead(int recordsRead) {
            this.recordsRead = recordsRead;
            return this;
        }

        Builder productsStaged(int productsStaged) {
            this.productsStaged = productsStaged;
            return this;
        }

        Builder published(int previewCount, int productionCount) {
            this.previewCount = previewCount;
            this.productionCount = productionCount;
            return this;
        }

        Builder issues(List<ReconciliationIssue> issues) {
            this.issues = issues;
            return this;
        }

        Builder collisions(List<KeyCollision> collisions) {
            this.collisions = collisions;
            return this;
        }

        Builder guardReport(GuardReport guardReport) {
            this.guardReport = guardReport;
            return this;
        }

        Builder duration(Duration duration) {
            this.duration = duration;
            return this;
        }

        Builder failureMessage(String failureMessage) {
            this.failureMessage = failureMessage;
            return this;
        }

        ReconciliationResult build() {
            if (status == null) {
                throw new IllegalStateException("status is required");
            }
            return new ReconciliationResult(this);
        }
    }
}
