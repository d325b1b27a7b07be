package com.product.resolution.cache;

import com.product.resolution.core.model.MatchResult;

import java.util.Optional;

/**
 * Cache that stores nothing. Used when caching is disabled.
 */
public class NoOpMatchCache implements MatchCache {

    @Override
    public Optional<MatchResult> get(MatchKey key) {
        return Optional.empty();
    }

    @Override
    public void put(MatchKey key, MatchResult result) {
        // no-op
    }

    @Override
    public void onSnapshot(long snapshotVersion) {
        // no-op
    }

    @Override
    public void invalidateAll() {
        // no-op
    }

    @Override
    public CacheStats getStats() {
        return CacheStats.empty();
    }
}
