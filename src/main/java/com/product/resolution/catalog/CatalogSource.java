package com.product.resolution.catalog;

import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.EnrichableField;
import com.product.resolution.core.model.VariantRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Storage for the canonical product catalog.
 *
 * <p>Implementations throw {@link CatalogUnavailableException} when the backing store cannot be reached.
 * Products are never deleted; the only lifecycle change is {@link #markSuperseded}.</p>
 */
public interface CatalogSource {

    /**
     * Returns every catalog entry, superseded ones included, in insertion order.
     */
    List<CanonicalProduct> fetchAll();

    Optional<CanonicalProduct> findByKey(String productKey);

    /**
     * Writes the given fields onto an existing product and returns the updated entry.
     *
     * @throws IllegalArgumentException if no product has the key
     */
    CanonicalProduct applyUpdate(String productKey, Map<EnrichableField, Object> fields);

    /**
     * Inserts a new product.
     *
     * @throws KeyConflictException if a product with the same key already exists
     */
    CanonicalProduct insert(CanonicalProduct product);

    /**
     * Records a size or pack variant against its parent product.
     */
    void recordVariant(VariantRecord variant);

    /**
     * Flags a product as superseded by another entry.
     *
     * @throws IllegalArgumentException if either key is unknown
     */
    CanonicalProduct markSuperseded(String productKey, String supersededBy);

    /**
     * Variants recorded against a parent product.
     */
    List<VariantRecord> variantsOf(String parentKey);
}
