package com.product.resolution.review;

import com.product.resolution.api.Page;
import com.product.resolution.api.PageRequest;
import com.product.resolution.decision.ConfidenceTier;

import java.util.Optional;

/**
 * Queue of candidates whose match score fell in a review band.
 */
public interface ReviewQueue {

    ReviewItem submit(ReviewItem item);

    /**
     * Pending items, oldest first.
     */
    Page<ReviewItem> getPending(PageRequest page);

    Page<ReviewItem> getPendingByTier(ConfidenceTier tier, PageRequest page);

    /**
     * Pending items with a score in {@code [minScore, maxScore]}, highest score first.
     */
    Page<ReviewItem> getPendingByScoreRange(double minScore, double maxScore, PageRequest page);

    /**
     * Marks an item approved.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is no longer pending
     */
    ReviewItem markApproved(String reviewId, String reviewer, String notes);

    /**
     * Marks an item rejected.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item is no longer pending
     */
    ReviewItem markRejected(String reviewId, String reviewer, String notes);

    Optional<ReviewItem> get(String reviewId);

    long countPending();
}
