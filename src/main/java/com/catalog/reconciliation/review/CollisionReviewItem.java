package com.catalog.reconciliation.review;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A key collision waiting for a human to confirm a merge or a permanent split.
 */
public class CollisionReviewItem {

    private final String id;
    private final String productKey;
    private final List<String> productKeys;
    private final List<String> sourceIds;
    private final List<String> names;
    private final double similarity;
    private final Instant submittedAt;
    private volatile ReviewStatus status;
    private volatile Instant reviewedAt;
    private volatile String reviewerId;
    private volatile String notes;

    private CollisionReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.productKey = Objects.requireNonNull(builder.productKey, "productKey is required");
        this.productKeys = builder.productKeys != null ? List.copyOf(builder.productKeys) : List.of();
        this.sourceIds = builder.sourceIds != null ? List.copyOf(builder.sourceIds) : List.of();
        this.names = builder.names != null ? List.copyOf(builder.names) : List.of();
        this.similarity = builder.similarity;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.status = ReviewStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    /**
     * Contested key, without collision suffix.
     */
    public String getProductKey() {
        return productKey;
    }

    public List<String> getProductKeys() {
        return productKeys;
    }

    public List<String> getSourceIds() {
        return sourceIds;
    }

    public List<String> getNames() {
        return names;
    }

    public double getSimilarity() {
        return similarity;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewerId() {
        return reviewerId;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void markApproved(String reviewerId, String notes) {
        mark(ReviewStatus.APPROVED, reviewerId, notes);
    }

    synchronized void markRejected(String reviewerId, String notes) {
        mark(ReviewStatus.REJECTED, reviewerId, notes);
    }

    private void mark(ReviewStatus newStatus, String reviewerId, String notes) {
        if (status != ReviewStatus.PENDING) {
            throw new IllegalStateException("Review item is not pending: " + id);
        }
        this.reviewedAt = Instant.now();
        this.reviewerId = reviewerId;
        this.notes = notes;
        this.status = newStatus;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CollisionReviewItem that = (CollisionReviewItem) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "CollisionReviewItem{" +
                "id='" + id + '\'' +
                ", productKey='" + productKey + '\'' +
                ", sources=" + sourceIds +
                ", similarity=" + similarity +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String productKey;
        private List<String> productKeys;
        private List<String> sourceIds;
        private List<String> names;
        private double similarity;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder productKey(String productKey) {
            this.productKey = productKey;
            return this;
        }

        public Builder productKeys(List<String> productKeys) {
            this.productKeys = productKeys;
            return this;
        }

        public Builder sourceIds(List<String> sourceIds) {
            this.sourceIds = sourceIds;
            return this;
        }

        public Builder names(List<String> names) {
            this.names = names;
            return this;
        }

        public Builder similarity(double similarity) {
            this.similarity = similarity;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public CollisionReviewItem build() {
            return new CollisionReviewItem(this);
        }
    }
}
