package com.product.resolution.decision;

/**
 * How confident the matcher was about a candidate sent to review.
 */
public enum ConfidenceTier {
    /** Score between the review and auto-merge thresholds, or auto-merge disabled. */
    REVIEW,
    /** Score between the manual-review and review thresholds. */
    MANUAL_REVIEW_REQUIRED
}
