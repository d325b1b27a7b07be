package com.product.resolution.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A size or pack variant folded into a parent product instead of becoming its own catalog entry.
 *
 * @param variantKey key the variant would have had as a standalone product
 */
public record VariantRecord(
        String parentKey,
        String variantKey,
        VariantType variantType,
        String sizeValue,
        String packValue,
        String productName,
        String productUrl,
        Instant recordedAt
) {
    public VariantRecord {
        Objects.requireNonNull(parentKey, "parentKey is required");
        Objects.requireNonNull(variantKey, "variantKey is required");
        Objects.requireNonNull(variantType, "variantType is required");
        Objects.requireNonNull(productName, "productName is required");
        recordedAt = recordedAt != null ? recordedAt : Instant.now();
    }
}
