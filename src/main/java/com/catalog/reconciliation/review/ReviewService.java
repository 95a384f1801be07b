package com.catalog.reconciliation.review;

import com.catalog.reconciliation.api.Page;
import com.catalog.reconciliation.api.PageRequest;
import com.catalog.reconciliation.audit.AuditAction;
import com.catalog.reconciliation.audit.AuditService;
import com.catalog.reconciliation.audit.KeyDecisionLog;
import com.catalog.reconciliation.audit.KeyDecisionType;
import com.catalog.reconciliation.merge.KeyCollision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Collision review workflow. Approving an item records a MERGE decision so the next run
 * merges the group; rejecting it records a permanent SPLIT that the key-collision guard
 * accepts. Both are audited.
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final KeyDecisionLog decisions;
    private final AuditService auditService;

    public ReviewService(ReviewQueue reviewQueue, KeyDecisionLog decisions, AuditService auditService) {
        this.reviewQueue = reviewQueue;
        this.decisions = decisions;
        this.auditService = auditService;
    }

    /**
     * Queues a collision unless it is already pending or its split was already confirmed.
     */
    public Optional<CollisionReviewItem> submit(KeyCollision collision) {
        if (collision.splitConfirmed()) {
            return Optional.empty();
        }
        Optional<CollisionReviewItem> pending = reviewQueue.findPending(collision.productKey());
        if (pending.isPresent()) {
            return pending;
        }
        CollisionReviewItem item = reviewQueue.submit(CollisionReviewItem.builder()
                .productKey(collision.productKey())
                .productKeys(collision.productKeys())
                .sourceIds(collision.sourceIds())
                .names(collision.names())
                .similarity(collision.similarity())
                .build());
        auditService.record(AuditAction.KEY_COLLISION_SUBMITTED, collision.productKey(), "reconciliation",
                Map.of("reviewId", item.getId(),
                        "sourceIds", collision.sourceIds(),
                        "similarity", collision.similarity()));
        log.info("review.submitted reviewId={} productKey={} clusters={} similarity={}",
                item.getId(), collision.productKey(), collision.productKeys().size(), collision.similarity());
        return Optional.of(item);
    }

    /**
     * The records are the same product: future runs merge them under one key.
     */
    public void approveMerge(String reviewId, String reviewerId, String notes) {
        CollisionReviewItem item = requirePending(reviewId);
        reviewQueue.approve(reviewId, reviewerId, notes);
        decisions.record(item.getProductKey(), KeyDecisionType.MERGE, reviewerId, notes);
        auditService.record(AuditAction.KEY_MERGE_APPROVED, item.getProductKey(), reviewerId,
                Map.of("reviewId", reviewId, "notes", notes != null ? notes : ""));
        log.info("review.merge_approved reviewId={} productKey={}", reviewId, item.getProductKey());
    }

    /**
     * The records are distinct products: their suffixed keys stay.
     */
    public void confirmSplit(String reviewId, String reviewerId, String notes) {
        CollisionReviewItem item = requirePending(reviewId);
        reviewQueue.reject(reviewId, reviewerId, notes);
        decisions.record(item.getProductKey(), KeyDecisionType.SPLIT, reviewerId, notes);
        auditService.record(AuditAction.KEY_SPLIT_CONFIRMED, item.getProductKey(), reviewerId,
                Map.of("reviewId", reviewId, "notes", notes != null ? notes : ""));
        log.info("review.split_confirmed reviewId={} productKey={}", reviewId, item.getProductKey());
    }

    public Page<CollisionReviewItem> getPendingReviews(PageRequest page) {
        return reviewQueue.getPending(page);
    }

    public long getPendingCount() {
        return reviewQueue.countPending();
    }

    public ReviewQueue getReviewQueue() {
        return reviewQueue;
    }

    private CollisionReviewItem requirePending(String reviewId) {
        CollisionReviewItem item = reviewQueue.get(reviewId)
                .orElseThrow(() -> new IllegalArgumentException("Review item not found: " + reviewId));
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }
}
