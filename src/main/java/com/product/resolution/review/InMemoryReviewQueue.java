package com.product.resolution.review;

import com.product.resolution.api.Page;
import com.product.resolution.api.PageRequest;
import com.product.resolution.decision.ConfidenceTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;

/**
 * In-memory {@link ReviewQueue} for single-JVM deployments and tests.
 */
public class InMemoryReviewQueue implements ReviewQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReviewQueue.class);

    private final ConcurrentMap<String, ReviewItem> items = new ConcurrentHashMap<>();

    @Override
    public ReviewItem submit(ReviewItem item) {
        items.put(item.getId(), item);
        log.debug("review.submitted id={} candidate={} parent={} score={} tier={}",
                item.getId(), item.getCandidateKey(), item.getProposedParentKey(),
                item.getScore(), item.getTier());
        return item;
    }

    @Override
    public Page<ReviewItem> getPending(PageRequest page) {
        return pending(item -> true, Comparator.comparing(ReviewItem::getSubmittedAt), page);
    }

    @Override
    public Page<ReviewItem> getPendingByTier(ConfidenceTier tier, PageRequest page) {
        return pending(item -> item.getTier() == tier, Comparator.comparing(ReviewItem::getSubmittedAt), page);
    }

    @Override
    public Page<ReviewItem> getPendingByScoreRange(double minScore, double maxScore, PageRequest page) {
        return pending(item -> item.getScore() >= minScore && item.getScore() <= maxScore,
                Comparator.comparingDouble(ReviewItem::getScore).reversed(), page);
    }

    @Override
    public ReviewItem markApproved(String reviewId, String reviewer, String notes) {
        ReviewItem item = require(reviewId);
        item.resolve(ReviewStatus.APPROVED, reviewer, notes);
        log.info("review.approved id={} reviewer={}", reviewId, reviewer);
        return item;
    }

    @Override
    public ReviewItem markRejected(String reviewId, String reviewer, String notes) {
        ReviewItem item = require(reviewId);
        item.resolve(ReviewStatus.REJECTED, reviewer, notes);
        log.info("review.rejected id={} reviewer={}", reviewId, reviewer);
        return item;
    }

    @Override
    public Optional<ReviewItem> get(String reviewId) {
        return Optional.ofNullable(items.get(reviewId));
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReviewItem::isPending).count();
    }

    private Page<ReviewItem> pending(Predicate<ReviewItem> filter, Comparator<ReviewItem> order,
                                     PageRequest page) {
        List<ReviewItem> matching = items.values().stream()
                .filter(ReviewItem::isPending)
                .filter(filter)
                .sorted(order)
                .toList();
        return Page.slice(matching, page);
    }

    private ReviewItem require(String reviewId) {
        ReviewItem item = items.get(reviewId);
        if (item == null) {
            throw new IllegalArgumentException("Review item not found: " + reviewId);
        }
        return item;
    }
}
