package com.product.resolution.cache;

/**
 * Match cache counters.
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long size) {

    public long requestCount() {
        return hitCount + missCount;
    }

    /**
     * Returns the hit rate (0.0 to 1.0).
     */
    public double hitRate() {
        long total = requestCount();
        return total == 0 ? 0.0 : (double) hitCount / total;
    }

    public static CacheStats empty() {
        return new CacheStats(0, 0, 0, 0);
    }
}
