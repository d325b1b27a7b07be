package com.product.resolution.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.product.resolution.api.ResolutionOptions;
import com.product.resolution.cache.CacheConfig;
import com.product.resolution.rules.BrandAliasMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Resolver settings read from a JSON document. Every section and every value is optional; missing
 * values keep the defaults of {@link ResolutionOptions}, {@link CacheConfig} and an empty alias map.
 *
 * <pre>
 * {
 *   "thresholds": {"autoMerge": 0.9, "review": 0.8, "manualReview": 0.7, "formMatchBonus": 1.1},
 *   "batch": {"parallelism": 4, "maxConsecutiveFailures": 5, "sourceSystem": "zooplus-feed"},
 *   "aliasResource": "brand-aliases.json",
 *   "aliases": {"royalcanin": "Royal Canin"},
 *   "cache": {"maxSize": 50000, "ttlSeconds": 3600, "enabled": true}
 * }
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResolverConfig(
        Thresholds thresholds,
        Batch batch,
        Map<String, String> aliases,
        String aliasResource,
        Cache cache
) {
    private static final Logger log = LoggerFactory.getLogger(ResolverConfig.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Thresholds(
            Double autoMerge,
            Double review,
            Double manualReview,
            Double formMatchBonus,
            Double ambiguityDelta
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Batch(
            Integer maxConsecutiveFailures,
            Integer parallelism,
            Integer maxBatchSize,
            Boolean autoMergeEnabled,
            String sourceSystem
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Cache(Integer maxSize, Integer ttlSeconds, Boolean enabled) {}

    /**
     * Reads a configuration document.
     *
     * @throws UncheckedIOException if the stream cannot be read or is not valid JSON
     */
    public static ResolverConfig fromStream(InputStream input) {
        try {
            ResolverConfig config = MAPPER.readValue(input, ResolverConfig.class);
            log.info("config.loaded thresholds={} batch={} cache={}",
                    config.thresholds() != null, config.batch() != null, config.cache() != null);
            return config;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read resolver configuration", e);
        }
    }

    /**
     * Reads a configuration document from the classpath.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static ResolverConfig fromResource(String resource) {
        InputStream in = ResolverConfig.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Resolver configuration not found: " + resource);
        }
        try (in) {
            return fromStream(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close resolver configuration " + resource, e);
        }
    }

    /**
     * Builds resolution options. Threshold ordering is validated by the options builder.
     *
     * @throws IllegalArgumentException if the configured values are inconsistent
     */
    public ResolutionOptions toOptions() {
        ResolutionOptions.Builder builder = ResolutionOptions.builder();
        if (thresholds != null) {
            if (thresholds.autoMerge() != null) builder.autoMergeThreshold(thresholds.autoMerge());
            if (thresholds.review() != null) builder.reviewThreshold(thresholds.review());
            if (thresholds.manualReview() != null) builder.manualReviewThreshold(thresholds.manualReview());
            if (thresholds.formMatchBonus() != null) builder.formMatchBonus(thresholds.formMatchBonus());
            if (thresholds.ambiguityDelta() != null) builder.ambiguityDelta(thresholds.ambiguityDelta());
        }
        if (batch != null) {
            if (batch.maxConsecutiveFailures() != null) builder.maxConsecutiveFailures(batch.maxConsecutiveFailures());
            if (batch.parallelism() != null) builder.parallelism(batch.parallelism());
            if (batch.maxBatchSize() != null) builder.maxBatchSize(batch.maxBatchSize());
            if (batch.autoMergeEnabled() != null) builder.autoMergeEnabled(batch.autoMergeEnabled());
            if (batch.sourceSystem() != null) builder.sourceSystem(batch.sourceSystem());
        }
        return builder.build();
    }

    /**
     * Aliases from {@code aliasResource}, overridden by the inline {@code aliases}.
     */
    public BrandAliasMap toAliasMap() {
        BrandAliasMap fromResource = aliasResource != null
                ? BrandAliasMap.fromResource(aliasResource) : BrandAliasMap.empty();
        if (aliases == null || aliases.isEmpty()) {
            return fromResource;
        }
        return fromResource.merge(BrandAliasMap.of(aliases));
    }

    public CacheConfig toCacheConfig() {
        CacheConfig defaults = CacheConfig.defaults();
        if (cache == null) {
            return defaults;
        }
        return new CacheConfig(
                cache.maxSize() != null ? cache.maxSize() : defaults.maxSize(),
                cache.ttlSeconds() != null ? cache.ttlSeconds() : defaults.ttlSeconds(),
                cache.enabled() != null ? cache.enabled() : defaults.enabled());
    }
}
