package com.product.resolution.rules;

import com.product.resolution.core.model.ProductForm;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves a product's form from an explicit hint or, failing that, from keywords in its name.
 * Keywords are matched as whole words so "Royal Canin" does not read as canned food.
 */
public class FormDetector {

    private static final Map<ProductForm, Pattern> KEYWORDS = new LinkedHashMap<>();

    static {
        // Checked in order; the first hit wins.
        KEYWORDS.put(ProductForm.FREEZE_DRIED, keywords("freeze[\\s-]?dried"));
        KEYWORDS.put(ProductForm.TREAT, keywords("treats?", "toppers?", "supplements?", "boosters?", "chews?"));
        KEYWORDS.put(ProductForm.WET, keywords("wet", "canned", "cans?", "tins?", "pouch(?:es)?", "trays?",
                "pate", "pâté", "chunks", "jelly", "gravy", "stew", "sauce", "loaf"));
        KEYWORDS.put(ProductForm.DRY, keywords("dry", "kibble", "biscuits?", "crunchy", "pellets?"));
        KEYWORDS.put(ProductForm.RAW, keywords("raw", "frozen", "fresh"));
    }

    /**
     * Returns the hinted form when it parses to a known value, else the form implied by the name,
     * else {@link ProductForm#UNKNOWN}.
     */
    public ProductForm detect(String formHint, String productName) {
        ProductForm hinted = ProductForm.fromValue(formHint);
        if (hinted.isKnown()) {
            return hinted;
        }
        ProductForm fromHintText = fromText(formHint);
        if (fromHintText.isKnown()) {
            return fromHintText;
        }
        return fromText(productName);
    }

    /**
     * Keyword detection only.
     */
    public ProductForm fromText(String text) {
        if (text == null || text.isBlank()) {
            return ProductForm.UNKNOWN;
        }
        for (Map.Entry<ProductForm, Pattern> entry : KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return entry.getKey();
            }
        }
        return ProductForm.UNKNOWN;
    }

    private static Pattern keywords(String... words) {
        return Pattern.compile("\\b(?:" + String.join("|", words) + ")\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }
}
