package com.product.resolution.core.model;

import java.util.Locale;

/**
 * Physical form of a catalog product.
 * The {@link #key()} is the lowercase token used as the third product-key segment.
 */
public enum ProductForm {
    DRY("dry"),
    WET("wet"),
    RAW("raw"),
    TREAT("treat"),
    FREEZE_DRIED("freeze_dried"),
    UNKNOWN("unknown");

    private final String key;

    ProductForm(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Parses a stored or hinted form value. Accepts the key ("freeze_dried"), the enum name
     * and common spellings ("freeze-dried", "Freeze Dried"). Anything else is {@link #UNKNOWN}.
     */
    public static ProductForm fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String cleaned = value.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s-]+", "_");
        for (ProductForm form : values()) {
            if (form.key.equals(cleaned)) {
                return form;
            }
        }
        return UNKNOWN;
    }
}
