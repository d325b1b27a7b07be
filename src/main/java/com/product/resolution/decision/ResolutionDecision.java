package com.product.resolution.decision;

import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.EnrichableField;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.core.model.VariantRecord;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * What to do with one candidate record. Exactly one of four outcomes.
 *
 * <p>Merge payloads hold only the fields that were empty on the target when the decision was made; the
 * applier recomputes them against the current parent before writing.</p>
 */
public sealed interface ResolutionDecision
        permits ResolutionDecision.AutoMerge, ResolutionDecision.ConsolidateVariant,
        ResolutionDecision.ReviewQueue, ResolutionDecision.NewProduct {

    NormalizedCandidate candidate();

    DecisionType type();

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive handler over the four decision kinds.
     */
    interface Visitor<R> {
        R visitAutoMerge(AutoMerge decision);

        R visitConsolidateVariant(ConsolidateVariant decision);

        R visitReviewQueue(ReviewQueue decision);

        R visitNewProduct(NewProduct decision);
    }

    /**
     * Fold the candidate into an existing product.
     */
    record AutoMerge(
            NormalizedCandidate candidate,
            String targetKey,
            double score,
            boolean exactKeyMatch,
            Map<EnrichableField, Object> mergeFields
    ) implements ResolutionDecision {
        public AutoMerge {
            Objects.requireNonNull(candidate, "candidate is required");
            Objects.requireNonNull(targetKey, "targetKey is required");
            mergeFields = copy(mergeFields);
        }

        @Override
        public DecisionType type() {
            return DecisionType.AUTO_MERGE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAutoMerge(this);
        }
    }

    /**
     * Record the candidate as a size or pack variant of a parent and fill the parent's gaps.
     */
    record ConsolidateVariant(
            NormalizedCandidate candidate,
            String parentKey,
            double score,
            VariantRecord variantRecord,
            Map<EnrichableField, Object> mergeFields
    ) implements ResolutionDecision {
        public ConsolidateVariant {
            Objects.requireNonNull(candidate, "candidate is required");
            Objects.requireNonNull(parentKey, "parentKey is required");
            Objects.requireNonNull(variantRecord, "variantRecord is required");
            mergeFields = copy(mergeFields);
        }

        @Override
        public DecisionType type() {
            return DecisionType.CONSOLIDATE_VARIANT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitConsolidateVariant(this);
        }
    }

    /**
     * Hold the candidate for a human decision.
     */
    record ReviewQueue(
            NormalizedCandidate candidate,
            CanonicalProduct bestMatch,
            double score,
            ConfidenceTier tier
    ) implements ResolutionDecision {
        public ReviewQueue {
            Objects.requireNonNull(candidate, "candidate is required");
            Objects.requireNonNull(bestMatch, "bestMatch is required");
            Objects.requireNonNull(tier, "tier is required");
        }

        @Override
        public DecisionType type() {
            return DecisionType.REVIEW_QUEUE;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReviewQueue(this);
        }
    }

    /**
     * Insert the candidate as a new catalog entry.
     */
    record NewProduct(
            NormalizedCandidate candidate,
            String generatedKey
    ) implements ResolutionDecision {
        public NewProduct {
            Objects.requireNonNull(candidate, "candidate is required");
            Objects.requireNonNull(generatedKey, "generatedKey is required");
        }

        @Override
        public DecisionType type() {
            return DecisionType.NEW_PRODUCT;
        }

        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitNewProduct(this);
        }
    }

    private static Map<EnrichableField, Object> copy(Map<EnrichableField, Object> fields) {
        if (fields == null || fields.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new EnumMap<>(fields));
    }
}
