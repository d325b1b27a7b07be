package com.product.resolution.core.model;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of the canonical catalog.
 *
 * <p>Instances are immutable. Enrichment produces a new instance through {@link #withFields(Map)}
 * and consolidation flags a product through {@link #supersededBy(String)}; products are never
 * removed from the catalog.</p>
 */
public final class CanonicalProduct {
    private final String productKey;
    private final String brand;
    private final String brandSlug;
    private final String productName;
    private final String nameSlug;
    private final ProductForm form;
    private final LifeStage lifeStage;
    private final String productUrl;
    private final String ingredientsRaw;
    private final Double proteinPercent;
    private final Double fatPercent;
    private final Double fiberPercent;
    private final Double ashPercent;
    private final Double moisturePercent;
    private final Double pricePerKg;
    private final ProductStatus status;
    private final String supersededBy;
    private final Instant updatedAt;

    private CanonicalProduct(Builder builder) {
        this.productKey = builder.productKey;
        this.brand = builder.brand;
        this.brandSlug = builder.brandSlug;
        this.productName = builder.productName;
        this.nameSlug = builder.nameSlug;
        this.form = builder.form != null ? builder.form : ProductForm.UNKNOWN;
        this.lifeStage = builder.lifeStage != null ? builder.lifeStage : LifeStage.UNKNOWN;
        this.productUrl = builder.productUrl;
        this.ingredientsRaw = builder.ingredientsRaw;
        this.proteinPercent = builder.proteinPercent;
        this.fatPercent = builder.fatPercent;
        this.fiberPercent = builder.fiberPercent;
        this.ashPercent = builder.ashPercent;
        this.moisturePercent = builder.moisturePercent;
        this.pricePerKg = builder.pricePerKg;
        this.status = builder.status != null ? builder.status : ProductStatus.ACTIVE;
        this.supersededBy = builder.supersededBy;
        this.updatedAt = builder.updatedAt != null ? builder.updatedAt : Instant.now();
    }

    public String getProductKey() {
        return productKey;
    }

    public String getBrand() {
        return brand;
    }

    public String getBrandSlug() {
        return brandSlug;
    }

    public String getProductName() {
        return productName;
    }

    public String getNameSlug() {
        return nameSlug;
    }

    public ProductForm getForm() {
        return form;
    }

    public LifeStage getLifeStage() {
        return lifeStage;
    }

    public String getProductUrl() {
        return productUrl;
    }

    public String getIngredientsRaw() {
        return ingredientsRaw;
    }

    public Double getProteinPercent() {
        return proteinPercent;
    }

    public Double getFatPercent() {
        return fatPercent;
    }

    public Double getFiberPercent() {
        return fiberPercent;
    }

    public Double getAshPercent() {
        return ashPercent;
    }

    public Double getMoisturePercent() {
        return moisturePercent;
    }

    public Double getPricePerKg() {
        return pricePerKg;
    }

    public ProductStatus getStatus() {
        return status;
    }

    public String getSupersededBy() {
        return supersededBy;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public boolean isActive() {
        return status == ProductStatus.ACTIVE;
    }

    /**
     * Reads an enrichable field.
     */
    public Object get(EnrichableField field) {
        return switch (field) {
            case INGREDIENTS -> ingredientsRaw;
            case PROTEIN_PERCENT -> proteinPercent;
            case FAT_PERCENT -> fatPercent;
            case FIBER_PERCENT -> fiberPercent;
            case ASH_PERCENT -> ashPercent;
            case MOISTURE_PERCENT -> moisturePercent;
            case FORM -> form;
            case LIFE_STAGE -> lifeStage;
            case PRICE_PER_KG -> pricePerKg;
            case PRODUCT_URL -> productUrl;
        };
    }

    /**
     * Returns the populated enrichable fields as a map. Used by catalog stores and tests.
     */
    public Map<EnrichableField, Object> enrichableValues() {
        Map<EnrichableField, Object> values = new EnumMap<>(EnrichableField.class);
        for (EnrichableField field : EnrichableField.values()) {
            Object value = get(field);
            if (!EnrichableField.isEmpty(value)) {
                values.put(field, value);
            }
        }
        return values;
    }

    /**
     * Returns a copy with the given fields replaced. The caller decides which fields may be written;
     * fill-gaps policy is enforced by the merge layer, not here.
     */
    public CanonicalProduct withFields(Map<EnrichableField, Object> fields) {
        Builder b = builder(this).updatedAt(Instant.now());
        fields.forEach((field, value) -> {
            field.checkValue(value);
            b.set(field, value);
        });
        return b.build();
    }

    /**
     * Returns a copy flagged as superseded by another catalog entry.
     */
    public CanonicalProduct supersededBy(String parentKey) {
        Objects.requireNonNull(parentKey, "parentKey is required");
        return builder(this)
                .status(ProductStatus.SUPERSEDED)
                .supersededBy(parentKey)
                .updatedAt(Instant.now())
                .build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalProduct that = (CanonicalProduct) o;
        return Objects.equals(productKey, that.productKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productKey);
    }

    @Override
    public String toString() {
        return "CanonicalProduct{" +
                "productKey='" + productKey + '\'' +
                ", brand='" + brand + '\'' +
                ", productName='" + productName + '\'' +
                ", form=" + form +
                ", lifeStage=" + lifeStage +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Builder builder(CanonicalProduct product) {
        return new Builder()
                .productKey(product.productKey)
                .brand(product.brand)
                .brandSlug(product.brandSlug)
                .productName(product.productName)
                .nameSlug(product.nameSlug)
                .form(product.form)
                .lifeStage(product.lifeStage)
                .productUrl(product.productUrl)
                .ingredientsRaw(product.ingredientsRaw)
                .proteinPercent(product.proteinPercent)
                .fatPercent(product.fatPercent)
                .fiberPercent(product.fiberPercent)
                .ashPercent(product.ashPercent)
                .moisturePercent(product.moisturePercent)
                .pricePerKg(product.pricePerKg)
                .status(product.status)
                .supersededBy(product.supersededBy)
                .updatedAt(product.updatedAt);
    }

    public static class Builder {
        private String productKey;
        private String brand;
        private String brandSlug;
        private String productName;
        private String nameSlug;
        private ProductForm form;
        private LifeStage lifeStage;
        private String productUrl;
        private String ingredientsRaw;
        private Double proteinPercent;
        private Double fatPercent;
        private Double fiberPercent;
        private Double ashPercent;
        private Double moisturePercent;
        private Double pricePerKg;
        private ProductStatus status;
        private String supersededBy;
        private Instant updatedAt;

        public Builder productKey(String productKey) {
            this.productKey = productKey;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder brandSlug(String brandSlug) {
            this.brandSlug = brandSlug;
            return this;
        }

        public Builder productName(String productName) {
            this.productName = productName;
            return this;
        }

        public Builder nameSlug(String nameSlug) {
            this.nameSlug = nameSlug;
            return this;
        }

        public Builder form(ProductForm form) {
            this.form = form;
            return this;
        }

        public Builder lifeStage(LifeStage lifeStage) {
            this.lifeStage = lifeStage;
            return this;
        }

        public Builder productUrl(String productUrl) {
            this.productUrl = productUrl;
            return this;
        }

        public Builder ingredientsRaw(String ingredientsRaw) {
            this.ingredientsRaw = ingredientsRaw;
            return this;
        }

        public Builder proteinPercent(Double proteinPercent) {
            this.proteinPercent = proteinPercent;
            return this;
        }

        public Builder fatPercent(Double fatPercent) {
            this.fatPercent = fatPercent;
            return this;
        }

        public Builder fiberPercent(Double fiberPercent) {
            this.fiberPercent = fiberPercent;
            return this;
        }

        public Builder ashPercent(Double ashPercent) {
            this.ashPercent = ashPercent;
            return this;
        }

        public Builder moisturePercent(Double moisturePercent) {
            this.moisturePercent = moisturePercent;
            return this;
        }

        public Builder pricePerKg(Double pricePerKg) {
            this.pricePerKg = pricePerKg;
            return this;
        }

        public Builder status(ProductStatus status) {
            this.status = status;
            return this;
        }

        public Builder supersededBy(String supersededBy) {
            this.supersededBy = supersededBy;
            return this;
        }

        public Builder updatedAt(Instant updatedAt) {
            this.updatedAt = updatedAt;
            return this;
        }

        Builder set(EnrichableField field, Object value) {
            switch (field) {
                case INGREDIENTS -> ingredientsRaw((String) value);
                case PROTEIN_PERCENT -> proteinPercent((Double) value);
                case FAT_PERCENT -> fatPercent((Double) value);
                case FIBER_PERCENT -> fiberPercent((Double) value);
                case ASH_PERCENT -> ashPercent((Double) value);
                case MOISTURE_PERCENT -> moisturePercent((Double) value);
                case FORM -> form((ProductForm) value);
                case LIFE_STAGE -> lifeStage((LifeStage) value);
                case PRICE_PER_KG -> pricePerKg((Double) value);
                case PRODUCT_URL -> productUrl((String) value);
            }
            return this;
        }

        public CanonicalProduct build() {
            Objects.requireNonNull(productKey, "productKey is required");
            Objects.requireNonNull(brand, "brand is required");
            Objects.requireNonNull(brandSlug, "brandSlug is required");
            Objects.requireNonNull(productName, "productName is required");
            Objects.requireNonNull(nameSlug, "nameSlug is required");
            return new CanonicalProduct(this);
        }
    }
}
