package com.product.resolution.rules;

import com.product.resolution.core.model.LifeStage;
import com.product.resolution.core.model.ProductForm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class DetectorsTest {

    @Nested
    @DisplayName("FormDetector")
    class FormTests {

        private final FormDetector detector = new FormDetector();

        @ParameterizedTest
        @DisplayName("Should detect form from name keywords")
        @CsvSource({
                "Freeze-Dried Liver Treats,FREEZE_DRIED",
                "Dental Chews Medium,TREAT",
                "Chicken Casserole Tins 6 x 400g,WET",
                "Adult Chunks in Gravy,WET",
                "Adult Lamb Kibble 12kg,DRY",
                "Frozen Complete Chicken,RAW",
                "Royal Canin Mini Adult,UNKNOWN"
        })
        void testFromName(String name, ProductForm expected) {
            assertEquals(expected, detector.detect(null, name));
        }

        @Test
        @DisplayName("A parseable hint should win over the name")
        void testHintWins() {
            assertEquals(ProductForm.WET, detector.detect("wet", "Adult Dry Food"));
            assertEquals(ProductForm.FREEZE_DRIED, detector.detect("Freeze Dried", "Adult"));
            assertEquals(ProductForm.WET, detector.detect("Canned food", "Adult"));
        }

        @Test
        @DisplayName("An unusable hint should fall back to the name")
        void testUnusableHint() {
            assertEquals(ProductForm.DRY, detector.detect("n/a", "Adult Dry"));
            assertEquals(ProductForm.UNKNOWN, detector.fromText(null));
        }
    }

    @Nested
    @DisplayName("LifeStageDetector")
    class LifeStageTests {

        private final LifeStageDetector detector = new LifeStageDetector();

        @ParameterizedTest
        @DisplayName("Should detect life stage from name keywords")
        @CsvSource({
                "Puppy Large Breed Chicken,PUPPY",
                "Junior Medium,PUPPY",
                "Senior Small Breed,SENIOR",
                "Adult 7+ Chicken,SENIOR",
                "Mature Adult Lamb,SENIOR",
                "All Life Stages Salmon,ALL",
                "Adult Lamb and Rice,ADULT",
                "Chicken Recipe,UNKNOWN"
        })
        void testFromName(String name, LifeStage expected) {
            assertEquals(expected, detector.detect(null, name));
        }

        @Test
        @DisplayName("Hint should win over the name")
        void testHint() {
            assertEquals(LifeStage.PUPPY, detector.detect("puppy", "Adult Lamb"));
            assertEquals(LifeStage.SENIOR, detector.detect("for senior dogs", "Adult Lamb"));
        }
    }

    @Nested
    @DisplayName("UrlNormalizer")
    class UrlTests {

        @ParameterizedTest
        @DisplayName("Should canonicalize retailer URLs")
        @CsvSource({
                "https://shop.example/p/maxi-adult/?activeVariant=123,https://shop.example/p/maxi-adult",
                "https://shop.example/p/maxi-adult/,https://shop.example/p/maxi-adult",
                "https://shop.example/p/maxi-adult/1234567,https://shop.example/p/maxi-adult",
                "https://shop.example/p/maxi-adult/12345,https://shop.example/p/maxi-adult/12345"
        })
        void testNormalize(String url, String expected) {
            assertEquals(expected, UrlNormalizer.normalize(url));
        }

        @Test
        @DisplayName("Blank URLs should become null")
        void testBlank() {
            assertNull(UrlNormalizer.normalize(null));
            assertNull(UrlNormalizer.normalize("  "));
            assertTrue(UrlNormalizer.hasVariantSelector("https://x/p?activeVariant=1"));
            assertFalse(UrlNormalizer.hasVariantSelector(null));
        }
    }
}
