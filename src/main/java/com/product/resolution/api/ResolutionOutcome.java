package com.product.resolution.api;

import com.product.resolution.decision.DecisionType;
import com.product.resolution.decision.ResolutionDecision;
import com.product.resolution.matching.AmbiguousMatchWarning;
import com.product.resolution.merge.AppliedChange;

import java.util.Objects;
import java.util.Optional;

/**
 * The decision taken for one candidate and, once written, what was written.
 *
 * @param index   position of the candidate in its batch (0 for single resolutions)
 * @param warning ambiguity warning from matching, or null
 * @param change  result of applying the decision, or null for a dry run
 */
public record ResolutionOutcome(
        int index,
        ResolutionDecision decision,
        AmbiguousMatchWarning warning,
        AppliedChange change
) {
    public ResolutionOutcome {
        Objects.requireNonNull(decision, "decision is required");
    }

    public DecisionType type() {
        return decision.type();
    }

    public String candidateKey() {
        return decision.candidate().productKey();
    }

    public boolean isApplied() {
        return change != null;
    }

    public Optional<AmbiguousMatchWarning> ambiguity() {
        return Optional.ofNullable(warning);
    }

    ResolutionOutcome withChange(AppliedChange applied) {
        return new ResolutionOutcome(index, decision, warning, applied);
    }
}
