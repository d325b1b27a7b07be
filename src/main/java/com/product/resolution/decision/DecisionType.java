package com.product.resolution.decision;

/**
 * Kind of a {@link ResolutionDecision}, used for counting and metric tags.
 */
public enum DecisionType {
    AUTO_MERGE,
    CONSOLIDATE_VARIANT,
    REVIEW_QUEUE,
    NEW_PRODUCT
}
