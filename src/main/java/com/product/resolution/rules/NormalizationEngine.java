package com.product.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies {@link NormalizationRule}s to product names.
 * Rules run in priority order (lower number first). The rule list is fixed at construction, so one engine
 * can be shared across threads.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::getPriority));
        this.rules = List.copyOf(sorted);
    }

    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Runs every rule over the name, then lowercases, trims and collapses whitespace.
     * Null or blank input yields the empty string.
     */
    public String normalize(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("rule.applied rule={} before='{}' after='{}'", rule.getName(), before, result);
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }
}
