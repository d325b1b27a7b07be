package com.product.resolution.rules;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = ProductNameRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
    }

    @ParameterizedTest
    @DisplayName("Should strip size and pack tokens")
    @CsvSource({
            "Royal Canin Maxi Adult 15kg,royal canin maxi adult",
            "Royal Canin Maxi Adult 1.5 kg,royal canin maxi adult",
            "Acana Adult Dog Recipe 12 x 400g,acana adult dog recipe",
            "Felix Pouches 24x100g in Jelly,felix pouches in jelly",
            "'Lily''s Kitchen Chicken - 1.5kg','lily''s kitchen chicken'",
            "Senior 7+ Chicken,senior 7+ chicken"
    })
    void testVariantTokenStripping(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Pack rule should run before size rule")
    void testRuleOrdering() {
        assertEquals("pack-count", engine.getRules().get(0).getName());
        assertEquals("size-weight", engine.getRules().get(1).getName());
        assertEquals("trailing-separator", engine.getRules().get(2).getName());
    }

    @Test
    @DisplayName("Custom rules should run in priority order alongside the defaults")
    void testCustomRules() {
        List<NormalizationRule> rules = new ArrayList<>(ProductNameRules.getVariantTokenRules());
        rules.add(NormalizationRule.builder()
                .name("strip-dog-food")
                .pattern("\\bdog food\\b")
                .priority(1)
                .build());
        NormalizationEngine custom = new NormalizationEngine(rules);

        assertEquals("strip-dog-food", custom.getRules().get(0).getName());
        assertEquals("acana adult", custom.normalize("Acana Adult Dog Food 2kg"));
        assertEquals("acana adult dog food", engine.normalize("Acana Adult Dog Food 2kg"));
        assertThrows(UnsupportedOperationException.class, () -> custom.getRules().clear());
    }

    @Test
    @DisplayName("stripVariantTokens should keep original casing")
    void testStripVariantTokens() {
        assertEquals("Royal Canin Maxi Adult", ProductNameRules.stripVariantTokens("Royal Canin Maxi Adult 15kg"));
        assertEquals("", ProductNameRules.stripVariantTokens(null));
    }
}
