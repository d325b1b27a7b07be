package com.product.resolution.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.product.resolution.core.model.MatchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Caffeine-backed match cache. Holds results for the current snapshot version only.
 */
public class CaffeineMatchCache implements MatchCache {
    private static final Logger log = LoggerFactory.getLogger(CaffeineMatchCache.class);

    private final Cache<MatchKey, MatchResult> cache;
    private final AtomicLong currentVersion = new AtomicLong(-1);

    public CaffeineMatchCache(CacheConfig config) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfterWrite(Duration.ofSeconds(config.ttlSeconds()))
                .recordStats()
                .build();
        log.info("matchCache.initialized maxSize={} ttl={}s", config.maxSize(), config.ttlSeconds());
    }

    @Override
    public Optional<MatchResult> get(MatchKey key) {
        return Optional.ofNullable(cache.getIfPresent(key));
    }

    @Override
    public void put(MatchKey key, MatchResult result) {
        if (key.snapshotVersion() != currentVersion.get()) {
            // Late writer from a previous snapshot; drop it.
            return;
        }
        cache.put(key, result);
    }

    @Override
    public void onSnapshot(long snapshotVersion) {
        long previous = currentVersion.getAndSet(snapshotVersion);
        if (previous != snapshotVersion) {
            cache.invalidateAll();
            log.debug("matchCache.reset previousVersion={} version={}", previous, snapshotVersion);
        }
    }

    @Override
    public void invalidateAll() {
        cache.invalidateAll();
        log.debug("matchCache.invalidated");
    }

    @Override
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.estimatedSize()
        );
    }
}
