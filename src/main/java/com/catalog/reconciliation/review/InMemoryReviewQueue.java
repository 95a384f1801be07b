package com.catalog.reconciliation.review;

import com.catalog.reconciliation.api.Page;
import com.catalog.reconciliation.api.PageRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory {@link ReviewQueue} for tests and single-JVM deployments.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, CollisionReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public CollisionReviewItem submit(CollisionReviewItem item) {
        items.put(item.getId(), item);
        log.debug("review.item_queued reviewId={} productKey={} similarity={}",
                item.getId(), item.getProductKey(), item.getSimilarity());
        return item;
    }

    @Override
    public Page<CollisionReviewItem> getPending(PageRequest page) {
        List<CollisionReviewItem> pending = items.values().stream()
                .filter(CollisionReviewItem::isPending)
                .sorted(Comparator.comparing(CollisionReviewItem::getSubmittedAt)
                        .thenComparing(CollisionReviewItem::getProductKey))
                .toList();
        return Page.of(pending, page);
    }

    @Override
    public Page<CollisionReviewItem> getPendingBySimilarity(double minSimilarity, double maxSimilarity,
                                                            PageRequest page) {
        List<CollisionReviewItem> filtered = items.values().stream()
                .filter(CollisionReviewItem::isPending)
                .filter(item -> item.getSimilarity() >= minSimilarity && item.getSimilarity() <= maxSimilarity)
                .sorted(Comparator.comparingDouble(CollisionReviewItem::getSimilarity).reversed()
                        .thenComparing(CollisionReviewItem::getProductKey))
                .toList();
        return Page.of(filtered, page);
    }

    @Override
    public Optional<CollisionReviewItem> findPending(String productKey) {
        return items.values().stream()
                .filter(CollisionReviewItem::isPending)
                .filter(item -> item.getProductKey().equals(productKey))
                .findFirst();
    }

    @Override
    public void approve(String reviewId, String reviewerId, String notes) {
        require(reviewId).markApproved(reviewerId, notes);
        log.info("review.item_approved reviewId={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public void reject(String reviewId, String reviewerId, String notes) {
        require(reviewId).markRejected(reviewerId, notes);
        log.info("review.item_rejected reviewId={} reviewer={}", reviewId, reviewerId);
    }

    @Override
    public Optional<CollisionReviewItem> get(String reviewId) {
        return Optional.ofNullable(items.get(reviewId));
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(CollisionReviewItem::isPending).count();
    }

    private CollisionReviewItem require(String reviewId) {
        CollisionReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }
}
