package com.product.resolution.decision;

import com.product.resolution.api.ResolutionOptions;
import com.product.resolution.catalog.CatalogSnapshot;
import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.EnrichableField;
import com.product.resolution.core.model.MatchResult;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.core.model.VariantInfo;
import com.product.resolution.matching.CandidateMatcher;
import com.product.resolution.merge.FieldMerger;
import com.product.resolution.variant.VariantClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * Turns a match result into one of four decisions.
 *
 * <p>Rules, first match wins:</p>
 * <ol>
 *   <li>Exact key match: merge into the entry. Labelled a variant consolidation when the raw names differ
 *       only by size or pack tokens.</li>
 *   <li>Fuzzy match whose name is a size or pack variant of the entry: consolidate.</li>
 *   <li>Score at or above the auto-merge threshold with auto-merge enabled: merge.</li>
 *   <li>Score at or above the review threshold (or above auto-merge with auto-merge off): review.</li>
 *   <li>Score at or above the manual-review threshold: manual review.</li>
 *   <li>Otherwise: new product.</li>
 * </ol>
 *
 * <p>Decisions are pure: nothing is written here.</p>
 */
public class ResolutionDecisionEngine {
    private static final Logger log = LoggerFactory.getLogger(ResolutionDecisionEngine.class);

    private final CandidateMatcher matcher;
    private final VariantClassifier variantClassifier;
    private final FieldMerger fieldMerger;
    private final ResolutionOptions options;

    public ResolutionDecisionEngine(CandidateMatcher matcher, VariantClassifier variantClassifier,
                                    FieldMerger fieldMerger, ResolutionOptions options) {
        this.matcher = Objects.requireNonNull(matcher, "matcher is required");
        this.variantClassifier = Objects.requireNonNull(variantClassifier, "variantClassifier is required");
        this.fieldMerger = Objects.requireNonNull(fieldMerger, "fieldMerger is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    /**
     * Matches the candidate against the snapshot and decides.
     *
     * @throws com.product.resolution.catalog.CatalogUnavailableException if the snapshot is missing
     */
    public ResolutionDecision decide(NormalizedCandidate candidate, CatalogSnapshot snapshot) {
        return decide(candidate, matcher.match(candidate, snapshot));
    }

    public ResolutionDecision decide(NormalizedCandidate candidate, MatchResult match) {
        Objects.requireNonNull(candidate, "candidate is required");
        Objects.requireNonNull(match, "match is required");

        ResolutionDecision decision = match.exactKeyMatch()
                ? decideExact(candidate, match.bestMatch())
                : decideFuzzy(candidate, match);
        log.debug("decision.made key={} decision={} score={}",
                candidate.productKey(), decision.type(), match.score());
        return decision;
    }

    private ResolutionDecision decideExact(NormalizedCandidate candidate, CanonicalProduct target) {
        Map<EnrichableField, Object> mergeFields = fieldMerger.fillGaps(target, candidate);
        if (variantClassifier.differsOnlyByVariantTokens(candidate.productName(), target.getProductName())) {
            VariantInfo info = variantClassifier.classify(candidate.productName());
            if (info.hasSizeOrPack()) {
                return new ResolutionDecision.ConsolidateVariant(candidate, target.getProductKey(), 1.0,
                        variantClassifier.toVariantRecord(target.getProductKey(), candidate, info), mergeFields);
            }
        }
        return new ResolutionDecision.AutoMerge(candidate, target.getProductKey(), 1.0, true, mergeFields);
    }

    private ResolutionDecision decideFuzzy(NormalizedCandidate candidate, MatchResult match) {
        if (!match.hasMatch()) {
            return new ResolutionDecision.NewProduct(candidate, candidate.productKey());
        }
        CanonicalProduct best = match.bestMatch();
        double score = match.score();

        VariantInfo info = variantClassifier.classifyAgainst(candidate.productName(), best.getProductName());
        if (info.shouldConsolidate()) {
            return new ResolutionDecision.ConsolidateVariant(candidate, best.getProductKey(), score,
                    variantClassifier.toVariantRecord(best.getProductKey(), candidate, info),
                    fieldMerger.fillGaps(best, candidate));
        }

        if (score >= options.getAutoMergeThreshold()) {
            if (options.isAutoMergeEnabled()) {
                return new ResolutionDecision.AutoMerge(candidate, best.getProductKey(), score, false,
                        fieldMerger.fillGaps(best, candidate));
            }
            return new ResolutionDecision.ReviewQueue(candidate, best, score, ConfidenceTier.REVIEW);
        }
        if (score >= options.getReviewThreshold()) {
            return new ResolutionDecision.ReviewQueue(candidate, best, score, ConfidenceTier.REVIEW);
        }
        if (score >= options.getManualReviewThreshold()) {
            return new ResolutionDecision.ReviewQueue(candidate, best, score, ConfidenceTier.MANUAL_REVIEW_REQUIRED);
        }
        return new ResolutionDecision.NewProduct(candidate, candidate.productKey());
    }

    public CandidateMatcher getMatcher() {
        return matcher;
    }
}
