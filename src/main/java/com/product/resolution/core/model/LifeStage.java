package com.product.resolution.core.model;

import java.util.Locale;

/**
 * Life stage a product is formulated for.
 */
public enum LifeStage {
    PUPPY("puppy"),
    ADULT("adult"),
    SENIOR("senior"),
    ALL("all"),
    UNKNOWN("unknown");

    private final String key;

    LifeStage(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    public static LifeStage fromValue(String value) {
        if (value == null || value.isBlank()) {
            return UNKNOWN;
        }
        String cleaned = value.trim().toLowerCase(Locale.ROOT);
        for (LifeStage stage : values()) {
            if (stage.key.equals(cleaned)) {
                return stage;
            }
        }
        return UNKNOWN;
    }
}
