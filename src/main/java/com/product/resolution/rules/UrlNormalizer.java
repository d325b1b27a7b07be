package com.product.resolution.rules;

import java.util.regex.Pattern;

/**
 * Canonicalizes retailer product URLs so variant links of the same product compare equal.
 */
public final class UrlNormalizer {

    public static final String VARIANT_SELECTOR = "?activeVariant=";

    private static final Pattern TRAILING_ID = Pattern.compile("/\\d{6,}$");

    private UrlNormalizer() {
    }

    /**
     * Drops an {@code ?activeVariant=} selector and everything after it, trailing slashes and a
     * trailing numeric id of six or more digits. Null or blank input yields null.
     */
    public static String normalize(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        String result = url.trim();
        int selector = result.indexOf(VARIANT_SELECTOR);
        if (selector >= 0) {
            result = result.substring(0, selector);
        }
        while (result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        result = TRAILING_ID.matcher(result).replaceFirst("");
        return result.isEmpty() ? null : result;
    }

    public static boolean hasVariantSelector(String url) {
        return url != null && url.contains(VARIANT_SELECTOR);
    }
}
