package com.product.resolution.api;

import com.product.resolution.audit.AuditService;
import com.product.resolution.cache.CacheConfig;
import com.product.resolution.cache.MatchCache;
import com.product.resolution.catalog.CatalogSource;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.core.model.RawCandidateRecord;
import com.product.resolution.decision.ResolutionDecisionEngine;
import com.product.resolution.matching.CandidateMatcher;
import com.product.resolution.merge.DecisionApplier;
import com.product.resolution.merge.FieldMerger;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.metrics.NoOpMetricsService;
import com.product.resolution.review.InMemoryReviewQueue;
import com.product.resolution.review.ReviewQueue;
import com.product.resolution.review.ReviewService;
import com.product.resolution.rules.BrandAliasMap;
import com.product.resolution.rules.ProductNameRules;
import com.product.resolution.rules.ProductNormalizer;
import com.product.resolution.similarity.SequenceRatioSimilarity;
import com.product.resolution.similarity.SimilarityAlgorithm;
import com.product.resolution.variant.VariantClassifier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Main entry point for product resolution.
 *
 * <h2>Example usage:</h2>
 * <pre>
 * ProductResolver resolver = ProductResolver.builder()
 *     .catalogSource(catalog)
 *     .brandAliases(BrandAliasMap.fromResource("brand-aliases.json"))
 *     .build();
 *
 * // One candidate
 * ResolutionOutcome outcome = resolver.resolve(record);
 *
 * // A whole feed
 * BatchResult result = resolver.resolveBatch(records);
 *
 * // Human review of uncertain matches
 * resolver.getReviewService().approve(reviewId, "alice", "same recipe");
 * </pre>
 */
public class ProductResolver {
    private static final Logger log = LoggerFactory.getLogger(ProductResolver.class);

    private final CatalogSource catalog;
    private final ResolutionOptions options;
    private final ResolutionService service;
    private final BatchProcessor batchProcessor;
    private final ReviewService reviewService;
    private final AuditService auditService;
    private final MetricsService metricsService;
    private final RunStatistics statistics;
    private final MatchCache cache;

    private ProductResolver(Builder builder) {
        this.catalog = builder.catalogSource;
        this.options = builder.options;
        this.metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        this.auditService = builder.auditService != null ? builder.auditService : new AuditService();
        this.statistics = builder.statistics != null ? builder.statistics : new RunStatistics();

        if (builder.matchCache != null) {
            this.cache = builder.matchCache;
        } else {
            CacheConfig cacheConfig = builder.cacheConfig != null ? builder.cacheConfig : CacheConfig.defaults();
            this.cache = cacheConfig.createCache();
        }

        BrandAliasMap aliases = builder.brandAliases != null ? builder.brandAliases : BrandAliasMap.empty();
        ProductNormalizer normalizer = new ProductNormalizer(aliases, ProductNameRules.createDefaultEngine());

        SimilarityAlgorithm similarity = builder.similarity != null
                ? builder.similarity : new SequenceRatioSimilarity();
        CandidateMatcher matcher = new CandidateMatcher(similarity, options, cache, metricsService);

        FieldMerger fieldMerger = new FieldMerger();
        ResolutionDecisionEngine decisionEngine =
                new ResolutionDecisionEngine(matcher, new VariantClassifier(), fieldMerger, options);

        ReviewQueue reviewQueue = builder.reviewQueue != null ? builder.reviewQueue : new InMemoryReviewQueue();
        DecisionApplier applier = new DecisionApplier(catalog, fieldMerger, reviewQueue, auditService,
                metricsService, options.getSourceSystem());

        this.service = new ResolutionService(catalog, normalizer, decisionEngine, applier, cache, metricsService);
        this.batchProcessor = new BatchProcessor(service, options, metricsService);
        this.reviewService = new ReviewService(reviewQueue, applier, auditService, statistics);

        log.info("ProductResolver initialized aliases={} options={}", aliases.size(), options);
    }

    // ========== Resolution API ==========

    /**
     * Resolves one candidate against the current catalog and writes the decision.
     *
     * @throws com.product.resolution.rules.CandidateInputException if brand or product name is unusable
     * @throws com.product.resolution.catalog.CatalogUnavailableException if the catalog cannot be read or written
     */
    public ResolutionOutcome resolve(RawCandidateRecord candidate) {
        return service.resolve(candidate, statistics);
    }

    /**
     * Resolves a batch. Decisions are taken against one catalog snapshot and written in input order.
     *
     * @throws BatchAbortedException if the catalog fails while decisions are being written
     */
    public BatchResult resolveBatch(List<RawCandidateRecord> candidates) {
        return batchProcessor.process(candidates, statistics);
    }

    /**
     * Returns the decision that would be taken for a candidate without writing anything.
     */
    public ResolutionOutcome preview(RawCandidateRecord candidate) {
        return service.preview(candidate);
    }

    /**
     * Normalizes a candidate only. Useful to see which key a record would get.
     */
    public NormalizedCandidate normalize(RawCandidateRecord candidate) {
        return service.getNormalizer().normalize(candidate);
    }

    // ========== Accessors ==========

    public ReviewService getReviewService() {
        return reviewService;
    }

    public AuditService getAuditService() {
        return auditService;
    }

    public MetricsService getMetricsService() {
        return metricsService;
    }

    public RunStatistics getStatistics() {
        return statistics;
    }

    public CatalogSource getCatalog() {
        return catalog;
    }

    public ResolutionOptions getOptions() {
        return options;
    }

    public MatchCache getCache() {
        return cache;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private CatalogSource catalogSource;
        private ResolutionOptions options = ResolutionOptions.defaults();
        private BrandAliasMap brandAliases;
        private SimilarityAlgorithm similarity;
        private CacheConfig cacheConfig;
        private MatchCache matchCache;
        private MetricsService metricsService;
        private ReviewQueue reviewQueue;
        private AuditService auditService;
        private RunStatistics statistics;

        public Builder catalogSource(CatalogSource catalogSource) {
            this.catalogSource = catalogSource;
            return this;
        }

        public Builder options(ResolutionOptions options) {
            this.options = options;
            return this;
        }

        public Builder brandAliases(BrandAliasMap brandAliases) {
            this.brandAliases = brandAliases;
            return this;
        }

        /**
         * Replaces the name similarity. Defaults to {@link SequenceRatioSimilarity}.
         */
        public Builder similarity(SimilarityAlgorithm similarity) {
            this.similarity = similarity;
            return this;
        }

        public Builder cacheConfig(CacheConfig cacheConfig) {
            this.cacheConfig = cacheConfig;
            return this;
        }

        /**
         * Uses the given cache instead of building one from {@link #cacheConfig(CacheConfig)}.
         */
        public Builder matchCache(MatchCache matchCache) {
            this.matchCache = matchCache;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder reviewQueue(ReviewQueue reviewQueue) {
            this.reviewQueue = reviewQueue;
            return this;
        }

        public Builder auditService(AuditService auditService) {
            this.auditService = auditService;
            return this;
        }

        public Builder statistics(RunStatistics statistics) {
            this.statistics = statistics;
            return this;
        }

        public ProductResolver build() {
            Objects.requireNonNull(catalogSource, "catalogSource is required");
            Objects.requireNonNull(options, "options is required");
            return new ProductResolver(this);
        }
    }
}
