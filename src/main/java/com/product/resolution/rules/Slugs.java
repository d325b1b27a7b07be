package com.product.resolution.rules;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Slug and display-case helpers shared by brand and name normalization.
 */
public final class Slugs {

    public static final int MAX_NAME_SLUG_LENGTH = 100;

    private static final Pattern APOSTROPHES = Pattern.compile("['’`]");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private Slugs() {
    }

    /**
     * Lowercases and turns every run of characters outside {@code [a-z0-9]} into one underscore,
     * with no leading or trailing underscore. Apostrophes are dropped so "Hill's" becomes "hills".
     * Accented letters count as separators.
     */
    public static String slugify(String value) {
        if (value == null) {
            return "";
        }
        String lowered = APOSTROPHES.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
        return stripUnderscores(NON_ALNUM.matcher(lowered).replaceAll("_"));
    }

    /**
     * Truncates a slug to {@code maxLength} characters without leaving a trailing underscore.
     */
    public static String truncate(String slug, int maxLength) {
        if (slug.length() <= maxLength) {
            return slug;
        }
        return stripUnderscores(slug.substring(0, maxLength));
    }

    /**
     * Capitalizes the first letter of each whitespace-separated word and lowercases the rest.
     */
    public static String titleCase(String value) {
        if (value == null || value.isBlank()) {
            return "";
        }
        String[] words = value.trim().split("\\s+");
        StringBuilder sb = new StringBuilder();
        for (String word : words) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT))
                    .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return sb.toString();
    }

    private static String stripUnderscores(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && value.charAt(start) == '_') {
            start++;
        }
        while (end > start && value.charAt(end - 1) == '_') {
            end--;
        }
        return value.substring(start, end);
    }
}
