package com.product.resolution.cache;

import com.product.resolution.core.model.ProductForm;

import java.util.Objects;

/**
 * Everything a fuzzy match result depends on within one snapshot.
 *
 * @param snapshotVersion version of the snapshot the result was computed against
 * @param bucket          identifies the brand bucket that was scanned
 * @param productKey      the candidate's generated key
 * @param matchName       the candidate name as compared, lowercased with punctuation stripped
 * @param form            the candidate's form, which decides the form bonus
 */
public record MatchKey(long snapshotVersion, String bucket, String productKey, String matchName, ProductForm form) {
    public MatchKey {
        Objects.requireNonNull(bucket, "bucket is required");
        Objects.requireNonNull(productKey, "productKey is required");
        Objects.requireNonNull(matchName, "matchName is required");
        form = form != null ? form : ProductForm.UNKNOWN;
    }
}
