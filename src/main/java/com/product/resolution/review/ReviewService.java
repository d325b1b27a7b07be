package com.product.resolution.review;

import com.product.resolution.api.Page;
import com.product.resolution.api.PageRequest;
import com.product.resolution.api.RunStatistics;
import com.product.resolution.audit.AuditAction;
import com.product.resolution.audit.AuditService;
import com.product.resolution.decision.ResolutionDecision;
import com.product.resolution.merge.AppliedChange;
import com.product.resolution.merge.DecisionApplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves review items. Approval merges the candidate into its proposed parent (fill gaps only);
 * rejection inserts it as a new product. Both go through the single catalog writer.
 */
public class ReviewService {
    private static final Logger log = LoggerFactory.getLogger(ReviewService.class);

    private final ReviewQueue reviewQueue;
    private final DecisionApplier applier;
    private final AuditService auditService;
    private final RunStatistics statistics;

    public ReviewService(ReviewQueue reviewQueue, DecisionApplier applier, AuditService auditService,
                         RunStatistics statistics) {
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue is required");
        this.applier = Objects.requireNonNull(applier, "applier is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.statistics = Objects.requireNonNull(statistics, "statistics is required");
    }

    public Page<ReviewItem> getPending(PageRequest page) {
        return reviewQueue.getPending(page);
    }

    /**
     * Confirms the proposed parent and merges the candidate into it.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item was already resolved
     */
    public AppliedChange approve(String reviewId, String reviewer, String notes) {
        ReviewItem item = requirePending(reviewId);
        AppliedChange change = applier.apply(new ResolutionDecision.AutoMerge(
                item.getCandidate(), item.getProposedParentKey(), item.getScore(), false, Map.of()), statistics);
        reviewQueue.markApproved(reviewId, reviewer, notes);

        Map<String, Object> details = details(item, notes);
        details.put("fieldsWritten", change.fieldsWritten().size());
        auditService.record(AuditAction.REVIEW_APPROVED, change.productKey(), reviewer, details);
        log.info("review.approved reviewId={} parent={} fields={}",
                reviewId, change.productKey(), change.fieldsWritten());
        return change;
    }

    /**
     * Refutes the proposed parent and inserts the candidate as its own product.
     *
     * @throws IllegalArgumentException if the item does not exist
     * @throws IllegalStateException    if the item was already resolved
     */
    public AppliedChange reject(String reviewId, String reviewer, String notes) {
        ReviewItem item = requirePending(reviewId);
        AppliedChange change = applier.apply(new ResolutionDecision.NewProduct(
                item.getCandidate(), item.getCandidateKey()), statistics);
        reviewQueue.markRejected(reviewId, reviewer, notes);

        auditService.record(AuditAction.REVIEW_REJECTED, change.productKey(), reviewer, details(item, notes));
        log.info("review.rejected reviewId={} key={} inserted={}", reviewId, change.productKey(), change.inserted());
        return change;
    }

    public long countPending() {
        return reviewQueue.countPending();
    }

    private ReviewItem requirePending(String reviewId) {
        ReviewItem item = reviewQueue.get(reviewId)
                .orElseThrow(() -> new IllegalArgumentException("Review item not found: " + reviewId));
        if (!item.isPending()) {
            throw new IllegalStateException("Review item is not pending: " + reviewId);
        }
        return item;
    }

    private static Map<String, Object> details(ReviewItem item, String notes) {
        Map<String, Object> details = new HashMap<>();
        details.put("reviewId", item.getId());
        details.put("candidateKey", item.getCandidateKey());
        details.put("proposedParentKey", item.getProposedParentKey());
        details.put("score", item.getScore());
        details.put("notes", notes);
        return details;
    }
}
