package com.product.resolution.metrics;

import com.product.resolution.decision.DecisionType;

import java.time.Duration;

/**
 * Records product resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library works without a metrics backend.
 */
public interface MetricsService {

    void incrementDecision(DecisionType type);

    void recordMatchScore(double score);

    void recordBatchSize(int size);

    void recordBatchDuration(Duration duration, boolean stoppedEarly);

    void incrementInputError(String field);

    void incrementDuplicatePrevented();

    void incrementAmbiguousMatch();

    void recordCacheHit();

    void recordCacheMiss();
}
