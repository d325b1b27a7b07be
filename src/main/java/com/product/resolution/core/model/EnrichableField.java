package com.product.resolution.core.model;

/**
 * Catalog fields that may be filled from an incoming record when a candidate is merged
 * into an existing product. Identity fields (key, brand, name, slugs) are never enrichable.
 */
public enum EnrichableField {
    INGREDIENTS("ingredients_raw", String.class),
    PROTEIN_PERCENT("protein_percent", Double.class),
    FAT_PERCENT("fat_percent", Double.class),
    FIBER_PERCENT("fiber_percent", Double.class),
    ASH_PERCENT("ash_percent", Double.class),
    MOISTURE_PERCENT("moisture_percent", Double.class),
    FORM("form", ProductForm.class),
    LIFE_STAGE("life_stage", LifeStage.class),
    PRICE_PER_KG("price_per_kg", Double.class),
    PRODUCT_URL("product_url", String.class);

    private final String column;
    private final Class<?> valueType;

    EnrichableField(String column, Class<?> valueType) {
        this.column = column;
        this.valueType = valueType;
    }

    /**
     * Column name used by catalog stores.
     */
    public String column() {
        return column;
    }

    public Class<?> valueType() {
        return valueType;
    }

    /**
     * Returns true when the value counts as missing: null, blank text, or an UNKNOWN enum constant.
     */
    public static boolean isEmpty(Object value) {
        if (value == null) {
            return true;
        }
        if (value instanceof String s) {
            return s.isBlank();
        }
        if (value instanceof ProductForm form) {
            return !form.isKnown();
        }
        if (value instanceof LifeStage stage) {
            return !stage.isKnown();
        }
        return false;
    }

    /**
     * Checks that a value is assignable to this field.
     *
     * @throws IllegalArgumentException if the value has the wrong type
     */
    public void checkValue(Object value) {
        if (value != null && !valueType.isInstance(value)) {
            throw new IllegalArgumentException("Field " + name() + " expects " + valueType.getSimpleName()
                    + " but got " + value.getClass().getSimpleName());
        }
    }
}
