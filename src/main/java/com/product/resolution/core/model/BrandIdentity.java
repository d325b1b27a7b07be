package com.product.resolution.core.model;

import java.util.Objects;

/**
 * Canonical display brand and its slug.
 */
public record BrandIdentity(String canonicalBrand, String brandSlug) {

    public static final BrandIdentity UNKNOWN = new BrandIdentity("Unknown", "unknown");

    public BrandIdentity {
        Objects.requireNonNull(canonicalBrand, "canonicalBrand is required");
        Objects.requireNonNull(brandSlug, "brandSlug is required");
        if (brandSlug.isBlank()) {
            throw new IllegalArgumentException("brandSlug must not be blank");
        }
    }

    public boolean isUnknown() {
        return UNKNOWN.equals(this);
    }
}
