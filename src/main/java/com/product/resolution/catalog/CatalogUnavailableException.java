package com.product.resolution.catalog;

/**
 * Thrown when the canonical catalog cannot be read or written.
 * Resolution never falls back to inserting a new product when this happens.
 */
public class CatalogUnavailableException extends RuntimeException {

    public CatalogUnavailableException(String message) {
        super(message);
    }

    public CatalogUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
