package com.product.resolution.core.model;

import java.util.Set;

/**
 * Variant tokens found in a product name and whether the record should be folded into a parent.
 *
 * @param sizeValue first size token found, e.g. "12kg", or null
 * @param packValue first pack token found, e.g. "12x400g", or null
 */
public record VariantInfo(
        boolean hasSizeToken,
        boolean hasPackToken,
        boolean hasLifeStageToken,
        boolean hasBreedSizeToken,
        boolean shouldConsolidate,
        Set<String> lifeStageTokens,
        Set<String> breedSizeTokens,
        String sizeValue,
        String packValue
) {
    public VariantInfo {
        lifeStageTokens = lifeStageTokens != null ? Set.copyOf(lifeStageTokens) : Set.of();
        breedSizeTokens = breedSizeTokens != null ? Set.copyOf(breedSizeTokens) : Set.of();
    }

    public boolean hasSizeOrPack() {
        return hasSizeToken || hasPackToken;
    }

    /**
     * Copy with a different consolidation verdict.
     */
    public VariantInfo withShouldConsolidate(boolean consolidate) {
        return new VariantInfo(hasSizeToken, hasPackToken, hasLifeStageToken, hasBreedSizeToken,
                consolidate, lifeStageTokens, breedSizeTokens, sizeValue, packValue);
    }
}
