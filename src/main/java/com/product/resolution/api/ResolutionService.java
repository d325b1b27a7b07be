package com.product.resolution.api;

import com.product.resolution.cache.MatchCache;
import com.product.resolution.catalog.CatalogSnapshot;
import com.product.resolution.catalog.CatalogSource;
import com.product.resolution.core.model.MatchResult;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.core.model.RawCandidateRecord;
import com.product.resolution.decision.ResolutionDecision;
import com.product.resolution.decision.ResolutionDecisionEngine;
import com.product.resolution.logging.LogContext;
import com.product.resolution.merge.AppliedChange;
import com.product.resolution.merge.DecisionApplier;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.rules.CandidateInputException;
import com.product.resolution.rules.ProductNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Core resolution service: normalize, match, decide and write one candidate at a time.
 * Batches are driven by {@link BatchProcessor}, which uses the same steps.
 */
public class ResolutionService {
    private static final Logger log = LoggerFactory.getLogger(ResolutionService.class);

    private final CatalogSource catalog;
    private final ProductNormalizer normalizer;
    private final ResolutionDecisionEngine decisionEngine;
    private final DecisionApplier applier;
    private final MatchCache cache;
    private final MetricsService metrics;

    public ResolutionService(CatalogSource catalog, ProductNormalizer normalizer,
                             ResolutionDecisionEngine decisionEngine, DecisionApplier applier,
                             MatchCache cache, MetricsService metrics) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.decisionEngine = Objects.requireNonNull(decisionEngine, "decisionEngine is required");
        this.applier = Objects.requireNonNull(applier, "applier is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Reads the catalog once and resets cached match results from older reads.
     *
     * @throws com.product.resolution.catalog.CatalogUnavailableException if the catalog cannot be read
     */
    public CatalogSnapshot snapshot() {
        CatalogSnapshot snapshot = CatalogSnapshot.load(catalog);
        cache.onSnapshot(snapshot.version());
        log.debug("catalog.snapshot version={} size={}", snapshot.version(), snapshot.size());
        return snapshot;
    }

    /**
     * Normalizes, matches and decides a candidate without writing anything.
     *
     * @throws CandidateInputException if the candidate has no usable brand or product name
     */
    public ResolutionOutcome decide(int index, RawCandidateRecord raw, CatalogSnapshot snapshot) {
        NormalizedCandidate candidate;
        try {
            candidate = normalizer.normalize(raw);
        } catch (CandidateInputException e) {
            metrics.incrementInputError(e.getField());
            throw e;
        }
        try (LogContext ctx = LogContext.forCandidate(LogContext.generateCorrelationId(), candidate.productKey())) {
            MatchResult match = decisionEngine.getMatcher().match(candidate, snapshot);
            ResolutionDecision decision = decisionEngine.decide(candidate, match);
            log.debug("candidate.decided decision={} score={}", decision.type(), match.score());
            return new ResolutionOutcome(index, decision, match.warning(), null);
        }
    }

    /**
     * Writes a decided candidate through the single catalog writer.
     */
    public ResolutionOutcome apply(ResolutionOutcome outcome, RunStatistics stats) {
        AppliedChange change = applier.apply(outcome.decision(), stats);
        return outcome.withChange(change);
    }

    /**
     * Resolves one candidate against a fresh catalog read and writes the result.
     */
    public ResolutionOutcome resolve(RawCandidateRecord raw, RunStatistics stats) {
        CatalogSnapshot snapshot = snapshot();
        stats.incrementProductsProcessed();
        ResolutionOutcome decided;
        try {
            decided = decide(0, raw, snapshot);
        } catch (CandidateInputException e) {
            stats.incrementErrors();
            throw e;
        }
        ResolutionOutcome applied = apply(decided, stats);
        log.info("candidate.resolved key={} decision={} target={}",
                decided.candidateKey(), decided.type(), applied.change().productKey());
        return applied;
    }

    /**
     * Decides a candidate against a fresh catalog read without writing it.
     */
    public ResolutionOutcome preview(RawCandidateRecord raw) {
        return decide(0, raw, snapshot());
    }

    public ProductNormalizer getNormalizer() {
        return normalizer;
    }

    public ResolutionDecisionEngine getDecisionEngine() {
        return decisionEngine;
    }
}
