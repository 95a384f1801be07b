package com.catalog.reconciliation.api;

import com.catalog.reconciliation.cache.CacheConfig;
import com.catalog.reconciliation.derive.PriceBuckets;
import com.catalog.reconciliation.merge.KeyCollisionDetector;
import com.catalog.reconciliation.publish.PublishMode;
import com.catalog.reconciliation.rules.DefaultNameRules;
import com.catalog.reconciliation.rules.PackSizeStripping;
import com.catalog.reconciliation.scoring.ScoringWeights;
import com.catalog.reconciliation.scoring.SourceTrustTable;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Tunables of a reconciliation run. Everything that influences the published output
 * (weights, thresholds, stop-list) is fixed for the whole run.
 */
public class ReconciliationOptions {

    private static final int DEFAULT_PARALLELISM = 4;
    private static final Duration DEFAULT_RUN_TIMEOUT = Duration.ofMinutes(10);
    private static final String DEFAULT_LEASE_TARGET = "catalog";
    private static final int DEFAULT_GUARD_SAMPLE_SIZE = 10;

    private final int parallelism;
    private final Duration runTimeout;
    private final String leaseTarget;
    private final Duration leaseTimeout;
    private final PublishMode publishMode;
    private final double collisionThreshold;
    private final ScoringWeights scoringWeights;
    private final SourceTrustTable trustTable;
    private final PriceBuckets priceBuckets;
    private final PackSizeStripping packSizeStripping;
    private final List<String> stopList;
    private final int guardSampleSize;
    private final CacheConfig cacheConfig;

    private ReconciliationOptions(Builder builder) {
        this.parallelism = builder.parallelism;
        this.runTimeout = builder.runTimeout;
        this.leaseTarget = builder.leaseTarget;
        this.leaseTimeout = builder.leaseTimeout;
        this.publishMode = builder.publishMode;
        this.collisionThreshold = builder.collisionThreshold;
        this.scoringWeights = builder.scoringWeights;
        this.trustTable = builder.trustTable;
        this.priceBuckets = builder.priceBuckets;
        this.packSizeStripping = builder.packSizeStripping;
        this.stopList = List.copyOf(builder.stopList);
        this.guardSampleSize = builder.guardSampleSize;
        this.cacheConfig = builder.cacheConfig;
    }

    public int getParallelism() {
        return parallelism;
    }

    public Duration getRunTimeout() {
        return runTimeout;
    }

    /**
     * Name of the snapshot target the run lease is taken on.
     */
    public String getLeaseTarget() {
        return leaseTarget;
    }

    /**
     * How long a run waits for a held lease before refusing; zero refuses at once.
     */
    public Duration getLeaseTimeout() {
        return leaseTimeout;
    }

    public PublishMode getPublishMode() {
        return publishMode;
    }

    public double getCollisionThreshold() {
        return collisionThreshold;
    }

    public ScoringWeights getScoringWeights() {
        return scoringWeights;
    }

    public SourceTrustTable getTrustTable() {
        return trustTable;
    }

    public PriceBuckets getPriceBuckets() {
        return priceBuckets;
    }

    public PackSizeStripping getPackSizeStripping() {
        return packSizeStripping;
    }

    public List<String> getStopList() {
        return stopList;
    }

    public int getGuardSampleSize() {
        return guardSampleSize;
    }

    public CacheConfig getCacheConfig() {
        return cacheConfig;
    }

    public Builder toBuilder() {
        return new Builder()
                .parallelism(parallelism)
                .runTimeout(runTimeout)
                .leaseTarget(leaseTarget)
                .leaseTimeout(leaseTimeout)
                .publishMode(publishMode)
                .collisionThreshold(collisionThreshold)
                .scoringWeights(scoringWeights)
                .trustTable(trustTable)
                .priceBuckets(priceBuckets)
                .packSizeStripping(packSizeStripping)
                .stopList(stopList)
                .guardSampleSize(guardSampleSize)
                .cacheConfig(cacheConfig);
    }

    /**
     * Creates default options.
     */
    public static ReconciliationOptions defaults() {
        return builder().build();
    }

    /**
     * Default options, except that preview is still published when guards fail.
     */
    public static ReconciliationOptions previewOnViolation() {
        return builder().publishMode(PublishMode.PREVIEW_ON_VIOLATION).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "ReconciliationOptions{parallelism=" + parallelism +
                ", runTimeout=" + runTimeout +
                ", leaseTarget='" + leaseTarget + '\'' +
                ", publishMode=" + publishMode +
                ", collisionThreshold=" + collisionThreshold +
                ", packSizeStripping=" + packSizeStripping + '}';
    }

    public static class Builder {
        private int parallelism = DEFAULT_PARALLELISM;
        private Duration runTimeout = DEFAULT_RUN_TIMEOUT;
        private String leaseTarget = DEFAULT_LEASE_TARGET;
        private Duration leaseTimeout = Duration.ZERO;
        private PublishMode publishMode = PublishMode.STRICT;
        private double collisionThreshold = KeyCollisionDetector.DEFAULT_THRESHOLD;
        private ScoringWeights scoringWeights = ScoringWeights.defaults();
        private SourceTrustTable trustTable = SourceTrustTable.defaults();
        private PriceBuckets priceBuckets = PriceBuckets.defaults();
        private PackSizeStripping packSizeStripping = PackSizeStripping.MULTIPACK_ONLY;
        private List<String> stopList = DefaultNameRules.DEFAULT_STOP_LIST;
        private int guardSampleSize = DEFAULT_GUARD_SAMPLE_SIZE;
        private CacheConfig cacheConfig = CacheConfig.disabled();

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder runTimeout(Duration runTimeout) {
            Objects.requireNonNull(runTimeout, "runTimeout is required");
            if (runTimeout.isNegative() || runTimeout.isZero()) {
                throw new IllegalArgumentException("runTimeout must be positive");
            }
            this.runTimeout = runTimeout;
            return this;
        }

        public Builder leaseTarget(String leaseTarget) {
            if (leaseTarget == null || leaseTarget.isBlank()) {
                throw new IllegalArgumentException("leaseTarget must not be blank");
            }
            this.leaseTarget = leaseTarget;
            return this;
        }

        public Builder leaseTimeout(Duration leaseTimeout) {
            Objects.requireNonNull(leaseTimeout, "leaseTimeout is required");
            if (leaseTimeout.isNegative()) {
                throw new IllegalArgumentException("leaseTimeout must be >= 0");
            }
            this.leaseTimeout = leaseTimeout;
            return this;
        }

        public Builder publishMode(PublishMode publishMode) {
            this.publishMode = Objects.requireNonNull(publishMode, "publishMode is required");
            return this;
        }

        public Builder collisionThreshold(double collisionThreshold) {
            if (collisionThreshold < 0.0 || collisionThreshold > 1.0) {
                throw new IllegalArgumentException("collisionThreshold must be between 0.0 and 1.0");
            }
            this.collisionThreshold = collisionThreshold;
            return this;
        }

        public Builder scoringWeights(ScoringWeights scoringWeights) {
            this.scoringWeights = Objects.requireNonNull(scoringWeights, "scoringWeights is required");
            return this;
        }

        public Builder trustTable(SourceTrustTable trustTable) {
            this.trustTable = Objects.requireNonNull(trustTable, "trustTable is required");
            return this;
        }

        public Builder priceBuckets(PriceBuckets priceBuckets) {
            this.priceBuckets = Objects.requireNonNull(priceBuckets, "priceBuckets is required");
            return this;
        }

        public Builder packSizeStripping(PackSizeStripping packSizeStripping) {
            this.packSizeStripping = Objects.requireNonNull(packSizeStripping, "packSizeStripping is required");
            return this;
        }

        public Builder stopList(List<String> stopList) {
            this.stopList = Objects.requireNonNull(stopList, "stopList is required");
            return this;
        }

        public Builder guardSampleSize(int guardSampleSize) {
            if (guardSampleSize < 0) {
                throw new IllegalArgumentException("guardSampleSize must be >= 0");
            }
            this.guardSampleSize = guardSampleSize;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = Objects.requireNonNull(cacheConfig, "cacheConfig is required");
            return this;
        }

        public ReconciliationOptions build() {
            return new ReconciliationOptions(this);
        }
    }
}
