package com.product.resolution.catalog;

import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.rules.UrlNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable, read-only view of the catalog taken at the start of a batch.
 *
 * <p>Entries are indexed by product key and grouped into brand buckets keyed by brand slug. Buckets hold
 * active entries only, in catalog order, so the first-seen entry wins ties during matching. A second index
 * keys the same buckets by lowercased display brand. Active entries with a product URL are also indexed by
 * normalized URL; when two entries share one, the first in catalog order keeps it.</p>
 */
public final class CatalogSnapshot {
    private static final Logger log = LoggerFactory.getLogger(CatalogSnapshot.class);
    private static final AtomicLong VERSIONS = new AtomicLong();
    private static final int MAX_SUPERSEDE_HOPS = 32;

    private final long version;
    private final Map<String, CanonicalProduct> byKey;
    private final Map<String, List<CanonicalProduct>> bucketsBySlug;
    private final Map<String, List<CanonicalProduct>> bucketsByDisplayBrand;
    private final Map<String, CanonicalProduct> byUrl;

    private CatalogSnapshot(long version, List<CanonicalProduct> products) {
        this.version = version;
        Map<String, CanonicalProduct> keys = new LinkedHashMap<>();
        Map<String, List<CanonicalProduct>> slugBuckets = new LinkedHashMap<>();
        Map<String, List<CanonicalProduct>> displayBuckets = new LinkedHashMap<>();
        Map<String, CanonicalProduct> urls = new LinkedHashMap<>();
        for (CanonicalProduct product : products) {
            keys.put(product.getProductKey(), product);
            if (product.isActive()) {
                slugBuckets.computeIfAbsent(product.getBrandSlug(), k -> new ArrayList<>()).add(product);
                displayBuckets.computeIfAbsent(product.getBrand().toLowerCase(Locale.ROOT), k -> new ArrayList<>())
                        .add(product);
                String url = UrlNormalizer.normalize(product.getProductUrl());
                if (url != null) {
                    urls.putIfAbsent(url, product);
                }
            }
        }
        this.byKey = Collections.unmodifiableMap(keys);
        this.bucketsBySlug = freeze(slugBuckets);
        this.bucketsByDisplayBrand = freeze(displayBuckets);
        this.byUrl = Collections.unmodifiableMap(urls);
    }

    /**
     * Builds a snapshot with a fresh version number.
     */
    public static CatalogSnapshot of(List<CanonicalProduct> products) {
        return new CatalogSnapshot(VERSIONS.incrementAndGet(), products);
    }

    /**
     * Reads the whole catalog from a source.
     *
     * @throws CatalogUnavailableException if the source is missing or fails
     */
    public static CatalogSnapshot load(CatalogSource source) {
        if (source == null) {
            throw new CatalogUnavailableException("No catalog source configured");
        }
        List<CanonicalProduct> products;
        try {
            products = source.fetchAll();
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new CatalogUnavailableException("Failed to fetch catalog: " + e.getMessage(), e);
        }
        if (products == null) {
            throw new CatalogUnavailableException("Catalog source returned no product list");
        }
        CatalogSnapshot snapshot = of(products);
        log.info("catalog.snapshot version={} products={} brands={}",
                snapshot.version, snapshot.size(), snapshot.bucketsBySlug.size());
        return snapshot;
    }

    public long version() {
        return version;
    }

    public int size() {
        return byKey.size();
    }

    public Optional<CanonicalProduct> findByKey(String productKey) {
        return Optional.ofNullable(byKey.get(productKey));
    }

    /**
     * Finds an entry by key and, if it has been superseded, follows the chain to the active entry.
     * Returns empty when the key is unknown or the chain does not end at an active entry.
     */
    public Optional<CanonicalProduct> findActive(String productKey) {
        CanonicalProduct current = byKey.get(productKey);
        Set<String> seen = new HashSet<>();
        while (current != null && !current.isActive()) {
            if (!seen.add(current.getProductKey()) || seen.size() > MAX_SUPERSEDE_HOPS
                    || current.getSupersededBy() == null) {
                log.warn("catalog.supersedeChainBroken key={} at={}", productKey, current.getProductKey());
                return Optional.empty();
            }
            current = byKey.get(current.getSupersededBy());
        }
        return Optional.ofNullable(current);
    }

    /**
     * Active entry listed under a product URL. The URL is normalized before the lookup.
     */
    public Optional<CanonicalProduct> findByUrl(String productUrl) {
        String url = UrlNormalizer.normalize(productUrl);
        return url == null ? Optional.empty() : Optional.ofNullable(byUrl.get(url));
    }

    /**
     * Active entries for a brand slug, or an empty list.
     */
    public List<CanonicalProduct> bucket(String brandSlug) {
        return brandSlug == null ? List.of() : bucketsBySlug.getOrDefault(brandSlug, List.of());
    }

    /**
     * Active entries whose display brand equals the given name, ignoring case.
     */
    public List<CanonicalProduct> bucketByDisplayBrand(String brand) {
        return brand == null ? List.of()
                : bucketsByDisplayBrand.getOrDefault(brand.trim().toLowerCase(Locale.ROOT), List.of());
    }

    public Set<String> brandSlugs() {
        return bucketsBySlug.keySet();
    }

    private static Map<String, List<CanonicalProduct>> freeze(Map<String, List<CanonicalProduct>> buckets) {
        Map<String, List<CanonicalProduct>> frozen = new LinkedHashMap<>();
        buckets.forEach((k, v) -> frozen.put(k, List.copyOf(v)));
        return Collections.unmodifiableMap(frozen);
    }
}
