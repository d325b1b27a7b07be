package com.product.resolution.catalog;

/**
 * Thrown by {@link CatalogSource#insert} when the product key already exists.
 * Existing products are never overwritten.
 */
public class KeyConflictException extends RuntimeException {

    private final String productKey;

    public KeyConflictException(String productKey) {
        super("Product key already exists: " + productKey);
        this.productKey = productKey;
    }

    public String getProductKey() {
        return productKey;
    }
}
