package com.catalog.reconciliation.review;

import com.catalog.reconciliation.api.Page;
import com.catalog.reconciliation.api.PageRequest;

import java.util.Optional;

/**
 * Queue of key collisions awaiting a merge-or-split decision.
 */
public interface ReviewQueue {

    CollisionReviewItem submit(CollisionReviewItem item);

    /**
     * Pending items, oldest first.
     */
    Page<CollisionReviewItem> getPending(PageRequest page);

    /**
     * Pending items with similarity in {@code [minSimilarity, maxSimilarity]}, most similar first.
     */
    Page<CollisionReviewItem> getPendingBySimilarity(double minSimilarity, double maxSimilarity, PageRequest page);

    Optional<CollisionReviewItem> findPending(String productKey);

    /**
     * @throws IllegalArgumentException if no item has that id
     * @throws IllegalStateException    if the item was already decided
     */
    void approve(String reviewId, String reviewerId, String notes);

    /**
     * @throws IllegalArgumentException if no item has that id
     * @throws IllegalStateException    if the item was already decided
     */
    void reject(String reviewId, String reviewerId, String notes);

    Optional<CollisionReviewItem> get(String reviewId);

    long countPending();
}
