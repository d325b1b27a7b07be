package com.product.resolution.api;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running totals for an import run. Pass the same instance to several batches to accumulate across a feed.
 * Thread-safe.
 */
public class RunStatistics {

    private final AtomicLong productsProcessed = new AtomicLong();
    private final AtomicLong newProducts = new AtomicLong();
    private final AtomicLong autoMerges = new AtomicLong();
    private final AtomicLong variantsDetected = new AtomicLong();
    private final AtomicLong dataConsolidated = new AtomicLong();
    private final AtomicLong duplicatesPrevented = new AtomicLong();
    private final AtomicLong reviewsQueued = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public void incrementProductsProcessed() {
        productsProcessed.incrementAndGet();
    }

    public void incrementNewProducts() {
        newProducts.incrementAndGet();
    }

    public void incrementAutoMerges() {
        autoMerges.incrementAndGet();
    }

    public void incrementVariantsDetected() {
        variantsDetected.incrementAndGet();
    }

    /**
     * Counted once per catalog write that filled at least one empty field.
     */
    public void incrementDataConsolidated() {
        dataConsolidated.incrementAndGet();
    }

    public void incrementDuplicatesPrevented() {
        duplicatesPrevented.incrementAndGet();
    }

    public void incrementReviewsQueued() {
        reviewsQueued.incrementAndGet();
    }

    public void incrementErrors() {
        errors.incrementAndGet();
    }

    public long getProductsProcessed() {
        return productsProcessed.get();
    }

    public long getNewProducts() {
        return newProducts.get();
    }

    public long getAutoMerges() {
        return autoMerges.get();
    }

    public long getVariantsDetected() {
        return variantsDetected.get();
    }

    public long getDataConsolidated() {
        return dataConsolidated.get();
    }

    public long getDuplicatesPrevented() {
        return duplicatesPrevented.get();
    }

    public long getReviewsQueued() {
        return reviewsQueued.get();
    }

    public long getErrors() {
        return errors.get();
    }

    /**
     * Point-in-time copy of all counters, keyed by counter name.
     */
    public Map<String, Long> snapshot() {
        Map<String, Long> values = new LinkedHashMap<>();
        values.put("products_processed", getProductsProcessed());
        values.put("new_products", getNewProducts());
        values.put("auto_merges", getAutoMerges());
        values.put("variants_detected", getVariantsDetected());
        values.put("data_consolidated", getDataConsolidated());
        values.put("duplicates_prevented", getDuplicatesPrevented());
        values.put("reviews_queued", getReviewsQueued());
        values.put("errors", getErrors());
        return values;
    }

    @Override
    public String toString() {
        return "RunStatistics" + snapshot();
    }
}
