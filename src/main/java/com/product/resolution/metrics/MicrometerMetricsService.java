package com.product.resolution.metrics;

import com.product.resolution.decision.DecisionType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code product.resolution.decision} Counter (tag: decision)</li>
 *   <li>{@code product.match.score} DistributionSummary</li>
 *   <li>{@code product.batch.size} DistributionSummary</li>
 *   <li>{@code product.batch.duration} Timer (tag: stoppedEarly)</li>
 *   <li>{@code product.input.error} Counter (tag: field)</li>
 *   <li>{@code product.duplicate.prevented} Counter</li>
 *   <li>{@code product.match.ambiguous} Counter</li>
 *   <li>{@code product.cache.hit} and {@code product.cache.miss} Counters</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Map<Boolean, Timer> batchTimers = new ConcurrentHashMap<>();
    private final DistributionSummary matchScoreSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter duplicatePreventedCounter;
    private final Counter ambiguousMatchCounter;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.matchScoreSummary = DistributionSummary.builder("product.match.score")
                .description("Best fuzzy match score per candidate")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("product.batch.size")
                .description("Number of candidates per batch")
                .register(registry);
        this.duplicatePreventedCounter = Counter.builder("product.duplicate.prevented")
                .description("Inserts turned into merges because the key already existed")
                .register(registry);
        this.ambiguousMatchCounter = Counter.builder("product.match.ambiguous")
                .description("Candidates whose two best matches scored within the ambiguity delta")
                .register(registry);
        this.cacheHitCounter = Counter.builder("product.cache.hit")
                .description("Number of match cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("product.cache.miss")
                .description("Number of match cache misses")
                .register(registry);
    }

    @Override
    public void incrementDecision(DecisionType type) {
        counterCache.computeIfAbsent("decision:" + type.name(), k ->
                Counter.builder("product.resolution.decision")
                        .description("Resolution decisions by type")
                        .tag("decision", type.name())
                        .register(registry)).increment();
    }

    @Override
    public void recordMatchScore(double score) {
        matchScoreSummary.record(score);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordBatchDuration(Duration duration, boolean stoppedEarly) {
        batchTimers.computeIfAbsent(stoppedEarly, early ->
                Timer.builder("product.batch.duration")
                        .description("Wall time of batch resolution")
                        .tag("stoppedEarly", String.valueOf(early))
                        .register(registry)).record(duration);
    }

    @Override
    public void incrementInputError(String field) {
        String tag = field != null ? field : "unknown";
        counterCache.computeIfAbsent("inputError:" + tag, k ->
                Counter.builder("product.input.error")
                        .description("Candidates rejected for unusable input")
                        .tag("field", tag)
                        .register(registry)).increment();
    }

    @Override
    public void incrementDuplicatePrevented() {
        duplicatePreventedCounter.increment();
    }

    @Override
    public void incrementAmbiguousMatch() {
        ambiguousMatchCounter.increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
