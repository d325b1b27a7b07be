package com.product.resolution.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class SlugsTest {

    @ParameterizedTest
    @DisplayName("Should slugify names into lowercase underscore form")
    @CsvSource({
            "Royal Canin,royal_canin",
            "Hill's Science Plan,hills_science_plan",
            "'  --Royal   Canin--  ',royal_canin",
            "Purina ONE,purina_one",
            "Café Crème,caf_cr_me",
            "Lily’s Kitchen,lilys_kitchen"
    })
    void testSlugify(String input, String expected) {
        assertEquals(expected, Slugs.slugify(input));
    }

    @Test
    @DisplayName("Should return empty slug for null or punctuation-only input")
    void testEmptySlug() {
        assertEquals("", Slugs.slugify(null));
        assertEquals("", Slugs.slugify("!!! ---"));
    }

    @Test
    @DisplayName("Truncation should not leave a trailing underscore")
    void testTruncate() {
        assertEquals("abc", Slugs.truncate("abc_def", 4));
        assertEquals("abc_def", Slugs.truncate("abc_def", 100));
        assertEquals(Slugs.MAX_NAME_SLUG_LENGTH,
                Slugs.truncate("a".repeat(150), Slugs.MAX_NAME_SLUG_LENGTH).length());
    }

    @Test
    @DisplayName("Should title-case each word")
    void testTitleCase() {
        assertEquals("Royal Canin", Slugs.titleCase("rOYAL   canin"));
        assertEquals("", Slugs.titleCase("  "));
    }
}
