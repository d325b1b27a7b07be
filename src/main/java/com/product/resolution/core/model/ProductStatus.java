package com.product.resolution.core.model;

/**
 * Lifecycle status of a catalog product. Products are never deleted, only superseded.
 */
public enum ProductStatus {
    /**
     * Product is live and takes part in matching.
     */
    ACTIVE,

    /**
     * Product has been folded into another catalog entry and is kept for traceability.
     */
    SUPERSEDED
}
