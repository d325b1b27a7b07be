package com.product.resolution.audit;

/**
 * Catalog changes and review events that are written to the audit log.
 */
public enum AuditAction {
    PRODUCT_CREATED,
    PRODUCT_ENRICHED,
    VARIANT_CONSOLIDATED,
    DUPLICATE_PREVENTED,
    REVIEW_REQUESTED,
    REVIEW_APPROVED,
    REVIEW_REJECTED
}
