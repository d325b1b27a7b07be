package com.product.resolution.metrics;

import com.product.resolution.decision.DecisionType;

import java.time.Duration;

/**
 * Metrics service that discards everything.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void incrementDecision(DecisionType type) {
    }

    @Override
    public void recordMatchScore(double score) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordBatchDuration(Duration duration, boolean stoppedEarly) {
    }

    @Override
    public void incrementInputError(String field) {
    }

    @Override
    public void incrementDuplicatePrevented() {
    }

    @Override
    public void incrementAmbiguousMatch() {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
