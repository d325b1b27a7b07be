package com.product.resolution.api;

/**
 * Options for product resolution: confidence thresholds, matching tweaks and batch limits.
 */
public class ResolutionOptions {

    private static final double DEFAULT_AUTO_MERGE_THRESHOLD = 0.90;
    private static final double DEFAULT_REVIEW_THRESHOLD = 0.80;
    private static final double DEFAULT_MANUAL_REVIEW_THRESHOLD = 0.70;
    private static final double DEFAULT_FORM_MATCH_BONUS = 1.1;
    private static final double DEFAULT_AMBIGUITY_DELTA = 0.02;
    private static final int DEFAULT_MAX_CONSECUTIVE_FAILURES = 5;
    private static final int DEFAULT_MAX_BATCH_SIZE = 10_000;

    private final double autoMergeThreshold;
    private final double reviewThreshold;
    private final double manualReviewThreshold;
    private final double formMatchBonus;
    private final double ambiguityDelta;
    private final int maxConsecutiveFailures;
    private final int parallelism;
    private final int maxBatchSize;
    private final boolean autoMergeEnabled;
    private final String sourceSystem;

    private ResolutionOptions(Builder builder) {
        this.autoMergeThreshold = builder.autoMergeThreshold;
        this.reviewThreshold = builder.reviewThreshold;
        this.manualReviewThreshold = builder.manualReviewThreshold;
        this.formMatchBonus = builder.formMatchBonus;
        this.ambiguityDelta = builder.ambiguityDelta;
        this.maxConsecutiveFailures = builder.maxConsecutiveFailures;
        this.parallelism = builder.parallelism;
        this.maxBatchSize = builder.maxBatchSize;
        this.autoMergeEnabled = builder.autoMergeEnabled;
        this.sourceSystem = builder.sourceSystem;
    }

    public double getAutoMergeThreshold() {
        return autoMergeThreshold;
    }

    public double getReviewThreshold() {
        return reviewThreshold;
    }

    public double getManualReviewThreshold() {
        return manualReviewThreshold;
    }

    /**
     * Multiplier applied to a fuzzy score when candidate and entry have the same known form.
     */
    public double getFormMatchBonus() {
        return formMatchBonus;
    }

    /**
     * A runner-up closer than this to the best score makes the match ambiguous. The bound is exclusive, so zero
     * disables the warning.
     */
    public double getAmbiguityDelta() {
        return ambiguityDelta;
    }

    /**
     * Failed candidates in a row after which a batch stops. Zero disables the limit.
     */
    public int getMaxConsecutiveFailures() {
        return maxConsecutiveFailures;
    }

    public int getParallelism() {
        return parallelism;
    }

    public int getMaxBatchSize() {
        return maxBatchSize;
    }

    public boolean isAutoMergeEnabled() {
        return autoMergeEnabled;
    }

    public String getSourceSystem() {
        return sourceSystem;
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Higher thresholds and no auto-merge: every fuzzy match goes through review.
     */
    public static ResolutionOptions conservative() {
        return builder()
                .autoMergeThreshold(0.95)
                .reviewThreshold(0.85)
                .manualReviewThreshold(0.75)
                .autoMergeEnabled(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder pre-filled with the values of an existing options object.
     */
    public static Builder builder(ResolutionOptions options) {
        return new Builder()
                .autoMergeThreshold(options.autoMergeThreshold)
                .reviewThreshold(options.reviewThreshold)
                .manualReviewThreshold(options.manualReviewThreshold)
                .formMatchBonus(options.formMatchBonus)
                .ambiguityDelta(options.ambiguityDelta)
                .maxConsecutiveFailures(options.maxConsecutiveFailures)
                .parallelism(options.parallelism)
                .maxBatchSize(options.maxBatchSize)
                .autoMergeEnabled(options.autoMergeEnabled)
                .sourceSystem(options.sourceSystem);
    }

    public static class Builder {
        private double autoMergeThreshold = DEFAULT_AUTO_MERGE_THRESHOLD;
        private double reviewThreshold = DEFAULT_REVIEW_THRESHOLD;
        private double manualReviewThreshold = DEFAULT_MANUAL_REVIEW_THRESHOLD;
        private double formMatchBonus = DEFAULT_FORM_MATCH_BONUS;
        private double ambiguityDelta = DEFAULT_AMBIGUITY_DELTA;
        private int maxConsecutiveFailures = DEFAULT_MAX_CONSECUTIVE_FAILURES;
        private int parallelism = 1;
        private int maxBatchSize = DEFAULT_MAX_BATCH_SIZE;
        private boolean autoMergeEnabled = true;
        private String sourceSystem = "SYSTEM";

        public Builder autoMergeThreshold(double autoMergeThreshold) {
            validateThreshold(autoMergeThreshold, "autoMergeThreshold");
            this.autoMergeThreshold = autoMergeThreshold;
            return this;
        }

        public Builder reviewThreshold(double reviewThreshold) {
            validateThreshold(reviewThreshold, "reviewThreshold");
            this.reviewThreshold = reviewThreshold;
            return this;
        }

        public Builder manualReviewThreshold(double manualReviewThreshold) {
            validateThreshold(manualReviewThreshold, "manualReviewThreshold");
            this.manualReviewThreshold = manualReviewThreshold;
            return this;
        }

        public Builder formMatchBonus(double formMatchBonus) {
            if (formMatchBonus < 1.0) {
                throw new IllegalArgumentException("formMatchBonus must be >= 1.0");
            }
            this.formMatchBonus = formMatchBonus;
            return this;
        }

        public Builder ambiguityDelta(double ambiguityDelta) {
            validateThreshold(ambiguityDelta, "ambiguityDelta");
            this.ambiguityDelta = ambiguityDelta;
            return this;
        }

        public Builder maxConsecutiveFailures(int maxConsecutiveFailures) {
            if (maxConsecutiveFailures < 0) {
                throw new IllegalArgumentException("maxConsecutiveFailures must not be negative");
            }
            this.maxConsecutiveFailures = maxConsecutiveFailures;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism <= 0) {
                throw new IllegalArgumentException("parallelism must be positive");
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder maxBatchSize(int maxBatchSize) {
            if (maxBatchSize <= 0) {
                throw new IllegalArgumentException("maxBatchSize must be positive");
            }
            this.maxBatchSize = maxBatchSize;
            return this;
        }

        public Builder autoMergeEnabled(boolean autoMergeEnabled) {
            this.autoMergeEnabled = autoMergeEnabled;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public ResolutionOptions build() {
            if (autoMergeThreshold < reviewThreshold) {
                throw new IllegalArgumentException("autoMergeThreshold must be >= reviewThreshold");
            }
            if (reviewThreshold < manualReviewThreshold) {
                throw new IllegalArgumentException("reviewThreshold must be >= manualReviewThreshold");
            }
            return new ResolutionOptions(this);
        }

        private void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "ResolutionOptions{" +
                "autoMergeThreshold=" + autoMergeThreshold +
                ", reviewThreshold=" + reviewThreshold +
                ", manualReviewThreshold=" + manualReviewThreshold +
                ", formMatchBonus=" + formMatchBonus +
                ", ambiguityDelta=" + ambiguityDelta +
                ", maxConsecutiveFailures=" + maxConsecutiveFailures +
                ", parallelism=" + parallelism +
                ", maxBatchSize=" + maxBatchSize +
                ", autoMergeEnabled=" + autoMergeEnabled +
                ", sourceSystem='" + sourceSystem + '\'' +
                '}';
    }
}
