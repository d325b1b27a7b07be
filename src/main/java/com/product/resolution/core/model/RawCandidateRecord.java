package com.product.resolution.core.model;

import java.util.Objects;

/**
 * An incoming product record as scraped or imported, before normalization.
 * Only brand and product name are required; everything else is optional enrichment data.
 */
public final class RawCandidateRecord {
    private final String brand;
    private final String productName;
    private final String productUrl;
    private final String formHint;
    private final String lifeStageHint;
    private final String ingredientsRaw;
    private final Double proteinPercent;
    private final Double fatPercent;
    private final Double fiberPercent;
    private final Double ashPercent;
    private final Double moisturePercent;
    private final Double pricePerKg;
    private final String source;

    private RawCandidateRecord(Builder builder) {
        this.brand = builder.brand;
        this.productName = builder.productName;
        this.productUrl = builder.productUrl;
        this.formHint = builder.formHint;
        this.lifeStageHint = builder.lifeStageHint;
        this.ingredientsRaw = builder.ingredientsRaw;
        this.proteinPercent = builder.proteinPercent;
        this.fatPercent = builder.fatPercent;
        this.fiberPercent = builder.fiberPercent;
        this.ashPercent = builder.ashPercent;
        this.moisturePercent = builder.moisturePercent;
        this.pricePerKg = builder.pricePerKg;
        this.source = builder.source;
    }

    public String getBrand() {
        return brand;
    }

    public String getProductName() {
        return productName;
    }

    public String getProductUrl() {
        return productUrl;
    }

    public String getFormHint() {
        return formHint;
    }

    public String getLifeStageHint() {
        return lifeStageHint;
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

    public String getSource() {
        return source;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RawCandidateRecord that = (RawCandidateRecord) o;
        return Objects.equals(brand, that.brand)
                && Objects.equals(productName, that.productName)
                && Objects.equals(productUrl, that.productUrl)
                && Objects.equals(source, that.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(brand, productName, productUrl, source);
    }

    @Override
    public String toString() {
        return "RawCandidateRecord{" +
                "brand='" + brand + '\'' +
                ", productName='" + productName + '\'' +
                ", source='" + source + '\'' +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String brand;
        private String productName;
        private String productUrl;
        private String formHint;
        private String lifeStageHint;
        private String ingredientsRaw;
        private Double proteinPercent;
        private Double fatPercent;
        private Double fiberPercent;
        private Double ashPercent;
        private Double moisturePercent;
        private Double pricePerKg;
        private String source;

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder productName(String productName) {
            this.productName = productName;
            return this;
        }

        public Builder productUrl(String productUrl) {
            this.productUrl = productUrl;
            return this;
        }

        public Builder formHint(String formHint) {
            this.formHint = formHint;
            return this;
        }

        public Builder lifeStageHint(String lifeStageHint) {
            this.lifeStageHint = lifeStageHint;
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

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        /**
         * Builds the record. Missing brand or name is not rejected here; the normalizer
         * reports unusable input per candidate so one bad row does not fail a whole feed.
         */
        public RawCandidateRecord build() {
            return new RawCandidateRecord(this);
        }
    }
}
