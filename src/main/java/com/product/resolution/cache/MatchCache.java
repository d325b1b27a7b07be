package com.product.resolution.cache;

import com.product.resolution.core.model.MatchResult;

import java.util.Optional;

/**
 * Memoizes match results within one catalog snapshot.
 * Entries are keyed by a {@link MatchKey}: the snapshot version plus every input the score depends on.
 * A result computed against an older snapshot is never returned for a newer one.
 */
public interface MatchCache {

    /**
     * Gets a cached match result.
     *
     * @return the cached result, or empty if not cached
     */
    Optional<MatchResult> get(MatchKey key);

    void put(MatchKey key, MatchResult result);

    /**
     * Called when a new snapshot is taken. Drops entries computed against any other version.
     */
    void onSnapshot(long snapshotVersion);

    /**
     * Invalidates all cache entries.
     */
    void invalidateAll();

    CacheStats getStats();
}
