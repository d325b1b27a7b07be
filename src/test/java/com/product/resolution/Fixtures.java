package com.product.resolution;

import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.core.model.RawCandidateRecord;
import com.product.resolution.rules.ProductNormalizer;

/**
 * Shared builders for candidate records and catalog entries used across tests.
 */
public final class Fixtures {

    private static final ProductNormalizer NORMALIZER = new ProductNormalizer();

    private Fixtures() {
    }

    public static RawCandidateRecord raw(String brand, String productName) {
        return raw(brand, productName, null);
    }

    public static RawCandidateRecord raw(String brand, String productName, String formHint) {
        return RawCandidateRecord.builder()
                .brand(brand)
                .productName(productName)
                .formHint(formHint)
                .source("test-feed")
                .build();
    }

    public static NormalizedCandidate candidate(String brand, String productName, String formHint) {
        return NORMALIZER.normalize(raw(brand, productName, formHint));
    }

    public static NormalizedCandidate candidate(RawCandidateRecord raw) {
        return NORMALIZER.normalize(raw);
    }

    /**
     * A catalog entry built the same way an inserted candidate would be.
     */
    public static CanonicalProduct entry(String brand, String productName, String formHint) {
        return candidate(brand, productName, formHint).toCanonicalProduct();
    }
}
