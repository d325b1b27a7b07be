package com.product.resolution.api;

import com.product.resolution.decision.DecisionType;
import com.product.resolution.matching.AmbiguousMatchWarning;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Summary of one batch: every decision in input order, failed candidates and warnings.
 *
 * @param unprocessed candidates never looked at because the batch stopped early or was aborted
 */
public record BatchResult(
        String batchId,
        int totalCandidates,
        List<ResolutionOutcome> outcomes,
        List<CandidateError> errors,
        List<AmbiguousMatchWarning> warnings,
        int duplicatesPrevented,
        boolean stoppedEarly,
        int unprocessed,
        Duration duration
) {
    public BatchResult {
        outcomes = outcomes != null ? List.copyOf(outcomes) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        duration = duration != null ? duration : Duration.ZERO;
    }

    /**
     * Decision counts by type. Every type is present, with zero where nothing was decided.
     */
    public Map<DecisionType, Integer> decisionCounts() {
        Map<DecisionType, Integer> counts = new EnumMap<>(DecisionType.class);
        for (DecisionType type : DecisionType.values()) {
            counts.put(type, 0);
        }
        outcomes.forEach(o -> counts.merge(o.type(), 1, Integer::sum));
        return counts;
    }

    public int count(DecisionType type) {
        return (int) outcomes.stream().filter(o -> o.type() == type).count();
    }

    /**
     * Returns true if every candidate was resolved.
     */
    public boolean isSuccess() {
        return errors.isEmpty() && !stoppedEarly && unprocessed == 0;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    @Override
    public String toString() {
        return "BatchResult{" +
                "batchId='" + batchId + '\'' +
                ", total=" + totalCandidates +
                ", decisions=" + decisionCounts() +
                ", errors=" + errors.size() +
                ", warnings=" + warnings.size() +
                ", duplicatesPrevented=" + duplicatesPrevented +
                ", stoppedEarly=" + stoppedEarly +
                ", unprocessed=" + unprocessed +
                '}';
    }
}
