package com.product.resolution.core.model;

import com.product.resolution.matching.AmbiguousMatchWarning;

import java.util.Optional;

/**
 * Outcome of matching a candidate against the catalog snapshot.
 *
 * @param bestMatch highest-scoring active catalog entry, or null when nothing was scored
 * @param score similarity of the best match, 0.0 when there is none
 * @param exactKeyMatch true when the candidate key was found directly
 * @param warning set when a second entry scored within the ambiguity delta of the best
 */
public record MatchResult(
        CanonicalProduct bestMatch,
        double score,
        boolean exactKeyMatch,
        AmbiguousMatchWarning warning
) {
    public MatchResult {
        if (score < 0.0 || score > 1.0) {
            throw new IllegalArgumentException("Score must be between 0.0 and 1.0");
        }
        if (exactKeyMatch && (bestMatch == null || score != 1.0)) {
            throw new IllegalArgumentException("An exact key match must carry its entry and score 1.0");
        }
    }

    /**
     * Creates a no-match result.
     */
    public static MatchResult noMatch() {
        return new MatchResult(null, 0.0, false, null);
    }

    public static MatchResult exact(CanonicalProduct product) {
        return new MatchResult(product, 1.0, true, null);
    }

    /**
     * A hit on the candidate's normalized product URL. Scored as certain but not flagged as an exact key match,
     * so variant classification still applies.
     */
    public static MatchResult byUrl(CanonicalProduct product) {
        return new MatchResult(product, 1.0, false, null);
    }

    public static MatchResult fuzzy(CanonicalProduct product, double score, AmbiguousMatchWarning warning) {
        return new MatchResult(product, score, false, warning);
    }

    public boolean hasMatch() {
        return bestMatch != null;
    }

    public Optional<AmbiguousMatchWarning> ambiguity() {
        return Optional.ofNullable(warning);
    }
}
