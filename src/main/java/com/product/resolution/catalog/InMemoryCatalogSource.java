package com.product.resolution.catalog;

import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.EnrichableField;
import com.product.resolution.core.model.VariantRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory catalog for single-JVM use and tests. Keeps insertion order.
 */
public class InMemoryCatalogSource implements CatalogSource {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogSource.class);

    private final Map<String, CanonicalProduct> products = new LinkedHashMap<>();
    private final Map<String, List<VariantRecord>> variants = new ConcurrentHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public InMemoryCatalogSource() {
    }

    public InMemoryCatalogSource(Collection<CanonicalProduct> initial) {
        initial.forEach(this::insert);
    }

    @Override
    public List<CanonicalProduct> fetchAll() {
        lock.readLock().lock();
        try {
            return List.copyOf(products.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<CanonicalProduct> findByKey(String productKey) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(products.get(productKey));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public CanonicalProduct applyUpdate(String productKey, Map<EnrichableField, Object> fields) {
        Objects.requireNonNull(fields, "fields is required");
        lock.writeLock().lock();
        try {
            CanonicalProduct current = require(productKey);
            CanonicalProduct updated = current.withFields(fields);
            products.put(productKey, updated);
            log.debug("catalog.updated key={} fields={}", productKey, fields.keySet());
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public CanonicalProduct insert(CanonicalProduct product) {
        Objects.requireNonNull(product, "product is required");
        lock.writeLock().lock();
        try {
            if (products.containsKey(product.getProductKey())) {
                throw new KeyConflictException(product.getProductKey());
            }
            products.put(product.getProductKey(), product);
            log.debug("catalog.inserted key={}", product.getProductKey());
            return product;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void recordVariant(VariantRecord variant) {
        Objects.requireNonNull(variant, "variant is required");
        variants.computeIfAbsent(variant.parentKey(), k -> new CopyOnWriteArrayList<>()).add(variant);
        log.debug("catalog.variantRecorded parent={} variant={}", variant.parentKey(), variant.variantKey());
    }

    @Override
    public CanonicalProduct markSuperseded(String productKey, String supersededBy) {
        lock.writeLock().lock();
        try {
            require(supersededBy);
            CanonicalProduct updated = require(productKey).supersededBy(supersededBy);
            products.put(productKey, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<VariantRecord> variantsOf(String parentKey) {
        return List.copyOf(variants.getOrDefault(parentKey, List.of()));
    }

    public int size() {
        lock.readLock().lock();
        try {
            return products.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All recorded variants across parents.
     */
    public List<VariantRecord> allVariants() {
        List<VariantRecord> all = new ArrayList<>();
        variants.values().forEach(all::addAll);
        return all;
    }

    private CanonicalProduct require(String productKey) {
        CanonicalProduct product = products.get(productKey);
        if (product == null) {
            throw new IllegalArgumentException("Unknown product key: " + productKey);
        }
        return product;
    }
}
