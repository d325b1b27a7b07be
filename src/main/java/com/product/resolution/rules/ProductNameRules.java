package com.product.resolution.rules;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Built-in rules that strip size and pack tokens from product names.
 * The same patterns drive variant classification, so a token removed from a key is always a token the
 * classifier can see.
 */
public final class ProductNameRules {

    public static final String UNIT = "(?:kg|g|lb|oz|ml|l)";

    /** "12 x 400g", "6x85g pouches", "24 x 1". */
    public static final Pattern PACK_PATTERN = Pattern.compile(
            "\\b\\d+\\s*x\\s*\\d+(?:\\.\\d+)?(?:\\s*(?:kg|g|lb|oz|ml|l|cans?|pouches?|tins?))?\\b",
            Pattern.CASE_INSENSITIVE);

    /** "12kg", "1.5 kg", "400g". */
    public static final Pattern SIZE_PATTERN = Pattern.compile(
            "\\b\\d+(?:\\.\\d+)?\\s*" + UNIT + "\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern LIFE_STAGE_PATTERN = Pattern.compile(
            "\\b(?:puppy|junior|adult|senior|mature)\\b",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern BREED_SIZE_PATTERN = Pattern.compile(
            "\\b(?:small|medium|large|mini|maxi|giant|toy)\\s*(?:breed|dog|size)?\\b",
            Pattern.CASE_INSENSITIVE);

    private ProductNameRules() {
        // Utility class
    }

    /**
     * Creates an engine with the pack and size rules. Pack runs first so "12 x 400g" is removed as a
     * whole instead of leaving "12 x".
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getVariantTokenRules());
    }

    public static List<NormalizationRule> getVariantTokenRules() {
        return List.of(
                NormalizationRule.builder()
                        .name("pack-count")
                        .pattern(PACK_PATTERN.pattern())
                        .replacement(" ")
                        .priority(10)
                        .build(),

                NormalizationRule.builder()
                        .name("size-weight")
                        .pattern(SIZE_PATTERN.pattern())
                        .replacement(" ")
                        .priority(20)
                        .build(),

                // Separator left dangling at the end once a trailing size is gone: "Adult Lamb -"
                NormalizationRule.builder()
                        .name("trailing-separator")
                        .pattern("\\s*[,\\-]\\s*$")
                        .replacement("")
                        .priority(90)
                        .build()
        );
    }

    /**
     * Returns the name with pack and size tokens removed, original casing kept.
     */
    public static String stripVariantTokens(String name) {
        if (name == null) {
            return "";
        }
        String result = name;
        for (NormalizationRule rule : getVariantTokenRules()) {
            result = rule.apply(result);
        }
        return result.replaceAll("\\s+", " ").trim();
    }
}
