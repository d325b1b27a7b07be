package com.product.resolution.matching;

import com.product.resolution.api.ResolutionOptions;
import com.product.resolution.cache.MatchCache;
import com.product.resolution.cache.MatchKey;
import com.product.resolution.cache.NoOpMatchCache;
import com.product.resolution.catalog.CatalogSnapshot;
import com.product.resolution.catalog.CatalogUnavailableException;
import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.MatchResult;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.metrics.NoOpMetricsService;
import com.product.resolution.rules.Slugs;
import com.product.resolution.similarity.SequenceRatioSimilarity;
import com.product.resolution.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Finds the catalog entry that best matches a normalized candidate.
 *
 * <p>An exact key hit short-circuits with score 1.0. A candidate whose normalized product URL is already
 * listed in the catalog matches that entry with score 1.0 but without the exact-key flag. Otherwise every active entry of the candidate's brand
 * bucket is scored by name similarity, with a bonus when both sides have the same known form. Only the
 * brand bucket is searched, so cost is linear in the bucket size rather than the catalog size.</p>
 *
 * <p>Thread-safe: the matcher keeps no per-call state and snapshots are immutable.</p>
 */
public class CandidateMatcher {
    private static final Logger log = LoggerFactory.getLogger(CandidateMatcher.class);
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    private final SimilarityAlgorithm similarity;
    private final ResolutionOptions options;
    private final MatchCache cache;
    private final MetricsService metrics;

    public CandidateMatcher(ResolutionOptions options) {
        this(new SequenceRatioSimilarity(), options, new NoOpMatchCache(), new NoOpMetricsService());
    }

    public CandidateMatcher(SimilarityAlgorithm similarity, ResolutionOptions options,
                            MatchCache cache, MetricsService metrics) {
        this.similarity = Objects.requireNonNull(similarity, "similarity is required");
        this.options = Objects.requireNonNull(options, "options is required");
        this.cache = Objects.requireNonNull(cache, "cache is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
    }

    /**
     * Matches a candidate against a snapshot.
     *
     * @throws CatalogUnavailableException if no snapshot is given
     */
    public MatchResult match(NormalizedCandidate candidate, CatalogSnapshot snapshot) {
        Objects.requireNonNull(candidate, "candidate is required");
        if (snapshot == null) {
            throw new CatalogUnavailableException("No catalog snapshot available for matching");
        }

        Optional<CanonicalProduct> exact = snapshot.findActive(candidate.productKey());
        if (exact.isPresent()) {
            log.debug("match.exact key={} target={}", candidate.productKey(), exact.get().getProductKey());
            return MatchResult.exact(exact.get());
        }

        Optional<CanonicalProduct> byUrl = snapshot.findByUrl(candidate.productUrl());
        if (byUrl.isPresent()) {
            log.debug("match.url key={} target={} url={}",
                    candidate.productKey(), byUrl.get().getProductKey(), candidate.productUrl());
            metrics.recordMatchScore(1.0);
            return MatchResult.byUrl(byUrl.get());
        }

        Bucket bucket = findBucket(candidate, snapshot);
        MatchKey key = new MatchKey(snapshot.version(), bucket.id(), candidate.productKey(),
                clean(candidate.productName()), candidate.form());
        Optional<MatchResult> cached = cache.get(key);
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            return cached.get();
        }
        metrics.recordCacheMiss();

        MatchResult result = fuzzyMatch(candidate, bucket.entries());
        cache.put(key, result);
        return result;
    }

    /**
     * Similarity of two product names after lowercasing and stripping punctuation.
     */
    public double nameSimilarity(String name1, String name2) {
        return clamp(similarity.compute(clean(name1), clean(name2)));
    }

    private Bucket findBucket(NormalizedCandidate candidate, CatalogSnapshot snapshot) {
        List<CanonicalProduct> entries = snapshot.bucket(candidate.brandSlug());
        if (!entries.isEmpty()) {
            return new Bucket("slug:" + candidate.brandSlug(), entries);
        }
        String displayBrand = candidate.brand().canonicalBrand();
        entries = snapshot.bucketByDisplayBrand(displayBrand);
        if (!entries.isEmpty()) {
            return new Bucket("brand:" + displayBrand.trim().toLowerCase(Locale.ROOT), entries);
        }
        String rawSlug = Slugs.slugify(candidate.raw().getBrand());
        return new Bucket("slug:" + rawSlug, snapshot.bucket(rawSlug));
    }

    private MatchResult fuzzyMatch(NormalizedCandidate candidate, List<CanonicalProduct> bucket) {
        if (bucket.isEmpty()) {
            log.debug("match.noBucket key={} brand={}", candidate.productKey(), candidate.brandSlug());
            return MatchResult.noMatch();
        }

        double[] scores = new double[bucket.size()];
        int best = -1;
        for (int i = 0; i < bucket.size(); i++) {
            scores[i] = score(candidate, bucket.get(i));
            // Strict comparison: the first-seen entry wins a tie.
            if (best < 0 || scores[i] > scores[best]) {
                best = i;
            }
        }

        AmbiguousMatchWarning warning = null;
        for (int i = 0; i < bucket.size(); i++) {
            if (i != best && scores[best] - scores[i] < options.getAmbiguityDelta()) {
                warning = new AmbiguousMatchWarning(candidate.productKey(),
                        bucket.get(best).getProductKey(), scores[best],
                        bucket.get(i).getProductKey(), scores[i]);
                metrics.incrementAmbiguousMatch();
                log.debug("match.ambiguous {}", warning.message());
                break;
            }
        }

        metrics.recordMatchScore(scores[best]);
        log.debug("match.fuzzy key={} best={} score={} bucketSize={}",
                candidate.productKey(), bucket.get(best).getProductKey(), scores[best], bucket.size());
        return MatchResult.fuzzy(bucket.get(best), scores[best], warning);
    }

    private double score(NormalizedCandidate candidate, CanonicalProduct entry) {
        double score = nameSimilarity(candidate.productName(), entry.getProductName());
        if (candidate.form().isKnown() && candidate.form() == entry.getForm()) {
            score = Math.min(1.0, score * options.getFormMatchBonus());
        }
        return score;
    }

    private static String clean(String name) {
        if (name == null) {
            return "";
        }
        return PUNCTUATION.matcher(name.toLowerCase(Locale.ROOT)).replaceAll("").trim();
    }

    private record Bucket(String id, List<CanonicalProduct> entries) {}

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
