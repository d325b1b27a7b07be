package com.product.resolution.matching;

import java.util.Objects;

/**
 * Non-fatal note that a candidate's best match was nearly tied with another catalog entry.
 * The best match is still used; the warning is surfaced in the batch result for follow-up.
 */
public record AmbiguousMatchWarning(
        String candidateKey,
        String bestMatchKey,
        double bestScore,
        String runnerUpKey,
        double runnerUpScore
) {
    public AmbiguousMatchWarning {
        Objects.requireNonNull(candidateKey, "candidateKey is required");
        Objects.requireNonNull(bestMatchKey, "bestMatchKey is required");
        Objects.requireNonNull(runnerUpKey, "runnerUpKey is required");
    }

    public double delta() {
        return bestScore - runnerUpScore;
    }

    public String message() {
        return String.format("Candidate %s matched %s (%.3f) but %s scored %.3f",
                candidateKey, bestMatchKey, bestScore, runnerUpKey, runnerUpScore);
    }
}
