package com.product.resolution.review;

/**
 * Status of a review item.
 */
public enum ReviewStatus {
    PENDING,
    /** Candidate confirmed as the proposed parent and merged into it. */
    APPROVED,
    /** Candidate confirmed as a different product and inserted on its own. */
    REJECTED
}
