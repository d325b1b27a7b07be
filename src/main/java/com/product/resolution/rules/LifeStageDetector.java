package com.product.resolution.rules;

import com.product.resolution.core.model.LifeStage;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Resolves a product's life stage from a hint or from name keywords.
 * Senior is checked before adult so "Adult 7+" reads as senior.
 */
public class LifeStageDetector {

    private static final Map<LifeStage, Pattern> KEYWORDS = new LinkedHashMap<>();

    static {
        KEYWORDS.put(LifeStage.ALL, Pattern.compile("\\ball\\s+(?:life\\s*stages?|stages?|ages)\\b",
                Pattern.CASE_INSENSITIVE));
        KEYWORDS.put(LifeStage.PUPPY, Pattern.compile("\\b(?:puppy|puppies|junior|growth)\\b",
                Pattern.CASE_INSENSITIVE));
        KEYWORDS.put(LifeStage.SENIOR, Pattern.compile("\\b(?:senior|mature|aged|aging|ageing)\\b|\\b(?:7|8|11)\\+",
                Pattern.CASE_INSENSITIVE));
        KEYWORDS.put(LifeStage.ADULT, Pattern.compile("\\b(?:adult|maintenance)\\b",
                Pattern.CASE_INSENSITIVE));
    }

    public LifeStage detect(String lifeStageHint, String productName) {
        LifeStage hinted = LifeStage.fromValue(lifeStageHint);
        if (hinted.isKnown()) {
            return hinted;
        }
        LifeStage fromHintText = fromText(lifeStageHint);
        if (fromHintText.isKnown()) {
            return fromHintText;
        }
        return fromText(productName);
    }

    public LifeStage fromText(String text) {
        if (text == null || text.isBlank()) {
            return LifeStage.UNKNOWN;
        }
        for (Map.Entry<LifeStage, Pattern> entry : KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(text).find()) {
                return entry.getKey();
            }
        }
        return LifeStage.UNKNOWN;
    }
}
