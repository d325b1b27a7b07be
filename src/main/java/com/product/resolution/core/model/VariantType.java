package com.product.resolution.core.model;

/**
 * What distinguishes a recorded variant from its parent product.
 */
public enum VariantType {
    SIZE,
    PACK,
    SIZE_AND_PACK;

    public static VariantType of(boolean hasSize, boolean hasPack) {
        if (hasSize && hasPack) {
            return SIZE_AND_PACK;
        }
        if (hasPack) {
            return PACK;
        }
        if (hasSize) {
            return SIZE;
        }
        throw new IllegalArgumentException("A variant needs a size or pack token");
    }
}
