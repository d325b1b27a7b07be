package com.product.resolution.core.model;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A raw record after normalization: resolved brand, slugs, form, life stage and the generated key.
 */
public record NormalizedCandidate(
        RawCandidateRecord raw,
        BrandIdentity brand,
        String nameSlug,
        ProductForm form,
        LifeStage lifeStage,
        String productUrl,
        String productKey
) {
    public NormalizedCandidate {
        Objects.requireNonNull(raw, "raw is required");
        Objects.requireNonNull(brand, "brand is required");
        Objects.requireNonNull(nameSlug, "nameSlug is required");
        Objects.requireNonNull(productKey, "productKey is required");
        form = form != null ? form : ProductForm.UNKNOWN;
        lifeStage = lifeStage != null ? lifeStage : LifeStage.UNKNOWN;
    }

    public String productName() {
        return raw.getProductName();
    }

    public String brandSlug() {
        return brand.brandSlug();
    }

    /**
     * Reads an enrichable value using the resolved form, life stage and URL.
     */
    public Object get(EnrichableField field) {
        return switch (field) {
            case INGREDIENTS -> raw.getIngredientsRaw();
            case PROTEIN_PERCENT -> raw.getProteinPercent();
            case FAT_PERCENT -> raw.getFatPercent();
            case FIBER_PERCENT -> raw.getFiberPercent();
            case ASH_PERCENT -> raw.getAshPercent();
            case MOISTURE_PERCENT -> raw.getMoisturePercent();
            case FORM -> form;
            case LIFE_STAGE -> lifeStage;
            case PRICE_PER_KG -> raw.getPricePerKg();
            case PRODUCT_URL -> productUrl;
        };
    }

    /**
     * Builds the catalog entry this candidate becomes when it is inserted as a new product.
     */
    public CanonicalProduct toCanonicalProduct() {
        CanonicalProduct.Builder builder = CanonicalProduct.builder()
                .productKey(productKey)
                .brand(brand.canonicalBrand())
                .brandSlug(brand.brandSlug())
                .productName(raw.getProductName().trim())
                .nameSlug(nameSlug);
        Map<EnrichableField, Object> values = new EnumMap<>(EnrichableField.class);
        for (EnrichableField field : EnrichableField.values()) {
            Object value = get(field);
            if (!EnrichableField.isEmpty(value)) {
                values.put(field, value);
            }
        }
        return builder.build().withFields(values);
    }
}
