package com.product.resolution.matching;

import com.product.resolution.api.ResolutionOptions;
import com.product.resolution.cache.CacheConfig;
import com.product.resolution.cache.CaffeineMatchCache;
import com.product.resolution.cache.NoOpMatchCache;
import com.product.resolution.catalog.CatalogSnapshot;
import com.product.resolution.catalog.CatalogUnavailableException;
import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.MatchResult;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.core.model.RawCandidateRecord;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.similarity.SequenceRatioSimilarity;
import com.product.resolution.similarity.SimilarityAlgorithm;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.product.resolution.Fixtures.candidate;
import static com.product.resolution.Fixtures.entry;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CandidateMatcher Tests")
@ExtendWith(MockitoExtension.class)
class CandidateMatcherTest {

    @Mock
    private MetricsService metrics;

    private CandidateMatcher matcher(SimilarityAlgorithm similarity) {
        return new CandidateMatcher(similarity, ResolutionOptions.defaults(), new NoOpMatchCache(), metrics);
    }

    @Nested
    @DisplayName("Exact key")
    class ExactKeyTests {

        @Test
        @DisplayName("A size variant of a catalog entry should hit its key directly")
        void testExactKey() {
            CanonicalProduct prairie = entry("Acana", "Wild Prairie Dog", "dry");
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(prairie));

            MatchResult result = matcher((a, b) -> 0.0)
                    .match(candidate("ACANA", "Wild Prairie Dog 11.4kg", "Dry Food"), snapshot);

            assertTrue(result.exactKeyMatch());
            assertEquals(1.0, result.score());
            assertEquals(prairie, result.bestMatch());
            verifyNoInteractions(metrics);
        }

        @Test
        @DisplayName("A superseded key should resolve to its active parent")
        void testSupersededKey() {
            CanonicalProduct parent = entry("Acana", "Wild Prairie Dog", "dry");
            CanonicalProduct standalone = entry("Acana", "Wild Prairie", "dry")
                    .supersededBy(parent.getProductKey());
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(parent, standalone));

            MatchResult result = matcher((a, b) -> 0.0).match(candidate("Acana", "Wild Prairie 2kg", "dry"), snapshot);

            assertTrue(result.exactKeyMatch());
            assertEquals(parent, result.bestMatch());
        }
    }

    @Nested
    @DisplayName("Fuzzy")
    class FuzzyTests {

        @Test
        @DisplayName("No brand bucket should give no match")
        void testNoBucket() {
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(entry("Acana", "Wild Prairie Dog", "dry")));

            MatchResult result = matcher((a, b) -> 1.0).match(candidate("Orijen", "Original Dog", "dry"), snapshot);

            assertFalse(result.hasMatch());
            assertEquals(0.0, result.score());
            assertNull(result.bestMatch());
        }

        @Test
        @DisplayName("Same known form should earn the form bonus, capped at 1.0")
        void testFormBonus() {
            NormalizedCandidate dry = candidate("Acana", "Wild Prairie Puppy", "dry");

            MatchResult sameForm = matcher((a, b) -> 0.8)
                    .match(dry, CatalogSnapshot.of(List.of(entry("Acana", "Wild Prairie Adult", "dry"))));
            MatchResult otherForm = matcher((a, b) -> 0.8)
                    .match(dry, CatalogSnapshot.of(List.of(entry("Acana", "Wild Prairie Adult", "wet"))));
            MatchResult capped = matcher((a, b) -> 0.95)
                    .match(dry, CatalogSnapshot.of(List.of(entry("Acana", "Wild Prairie Adult", "dry"))));

            assertEquals(0.88, sameForm.score(), 0.0001);
            assertEquals(0.8, otherForm.score(), 0.0001);
            assertEquals(1.0, capped.score());
            assertFalse(capped.exactKeyMatch());
        }

        @Test
        @DisplayName("Near-tied entries should pick the first seen and warn")
        void testAmbiguity() {
            CanonicalProduct first = entry("Acana", "Wild Prairie Adult", "dry");
            CanonicalProduct second = entry("Acana", "Wild Prairie Senior", "dry");
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(first, second));

            MatchResult result = matcher((a, b) -> 0.8)
                    .match(candidate("Acana", "Wild Prairie Puppy", "dry"), snapshot);

            assertEquals(first, result.bestMatch());
            AmbiguousMatchWarning warning = result.ambiguity().orElseThrow();
            assertEquals(second.getProductKey(), warning.runnerUpKey());
            assertEquals(0.0, warning.delta(), 0.0001);
            verify(metrics).incrementAmbiguousMatch();
            verify(metrics).recordMatchScore(result.score());
        }

        @Test
        @DisplayName("A runner-up exactly at the ambiguity delta should not warn")
        void testAmbiguityBoundIsExclusive() {
            CanonicalProduct adult = entry("Acana", "Wild Prairie Adult", null);
            CanonicalProduct senior = entry("Acana", "Wild Prairie Senior", null);
            ResolutionOptions options = ResolutionOptions.builder().ambiguityDelta(0.25).build();
            CandidateMatcher matcher = new CandidateMatcher((a, b) -> b.contains("adult") ? 0.75 : 0.5,
                    options, new NoOpMatchCache(), metrics);

            MatchResult result = matcher.match(candidate("Acana", "Wild Prairie Puppy", null),
                    CatalogSnapshot.of(List.of(adult, senior)));

            assertEquals(adult, result.bestMatch());
            assertTrue(result.ambiguity().isEmpty());
            verify(metrics, never()).incrementAmbiguousMatch();
        }

        @Test
        @DisplayName("A clear winner should not warn")
        void testClearWinner() {
            CanonicalProduct prairie = entry("Acana", "Wild Prairie Adult", "dry");
            CanonicalProduct pacifica = entry("Acana", "Pacifica Dog", "dry");
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(pacifica, prairie));

            MatchResult result = new CandidateMatcher(ResolutionOptions.defaults())
                    .match(candidate("Acana", "Wild Prairie Adult Dog", "dry"), snapshot);

            assertEquals(prairie, result.bestMatch());
            assertTrue(result.ambiguity().isEmpty());
        }

        @Test
        @DisplayName("Display brand should be used when slugs differ")
        void testDisplayBrandFallback() {
            CanonicalProduct legacy = CanonicalProduct.builder()
                    .productKey("legacy-1")
                    .brand("Acana")
                    .brandSlug("acana_pet")
                    .productName("Wild Prairie Adult")
                    .nameSlug("wild_prairie_adult")
                    .build();
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(legacy));

            MatchResult result = matcher((a, b) -> 0.9).match(candidate("Acana", "Wild Prairie Puppy", null), snapshot);

            assertEquals(legacy, result.bestMatch());
        }
    }

    @Nested
    @DisplayName("Product URL")
    class UrlTests {

        private CanonicalProduct listed(String name, String url) {
            return candidate(RawCandidateRecord.builder()
                    .brand("Acme")
                    .productName(name)
                    .productUrl(url)
                    .source("test-feed")
                    .build()).toCanonicalProduct();
        }

        private NormalizedCandidate incoming(String name, String url) {
            return candidate(RawCandidateRecord.builder()
                    .brand("Acme")
                    .productName(name)
                    .productUrl(url)
                    .source("test-feed")
                    .build());
        }

        @Test
        @DisplayName("A known product URL should match before the name scan")
        void testUrlMatch() {
            CanonicalProduct lamb = listed("Lamb Feast", "https://shop.example/p/lamb-feast");
            CanonicalProduct tuna = listed("Tuna Supper", "https://shop.example/p/tuna-supper");
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(tuna, lamb));

            MatchResult result = matcher((a, b) -> 0.1).match(
                    incoming("Gourmet Lamb Dinner", "https://shop.example/p/lamb-feast/?activeVariant=9"), snapshot);

            assertEquals(lamb, result.bestMatch());
            assertEquals(1.0, result.score());
            assertFalse(result.exactKeyMatch());
            verify(metrics, never()).recordCacheMiss();
        }

        @Test
        @DisplayName("An exact key should win over a URL listed on another entry")
        void testExactKeyBeforeUrl() {
            CanonicalProduct lamb = listed("Lamb Feast", "https://shop.example/p/lamb-feast");
            CanonicalProduct tuna = listed("Tuna Supper", "https://shop.example/p/tuna-supper");

            MatchResult result = matcher((a, b) -> 0.0).match(
                    incoming("Tuna Supper", "https://shop.example/p/lamb-feast"),
                    CatalogSnapshot.of(List.of(lamb, tuna)));

            assertTrue(result.exactKeyMatch());
            assertEquals(tuna, result.bestMatch());
        }

        @Test
        @DisplayName("An unknown URL should fall back to name matching")
        void testUnknownUrl() {
            CanonicalProduct lamb = listed("Lamb Feast", "https://shop.example/p/lamb-feast");

            MatchResult result = matcher((a, b) -> 0.72).match(
                    incoming("Lamb Dinner", "https://shop.example/p/lamb-dinner"), CatalogSnapshot.of(List.of(lamb)));

            assertEquals(lamb, result.bestMatch());
            assertEquals(0.72, result.score(), 0.0001);
        }
    }

    @Nested
    @DisplayName("Caching and failures")
    class CacheTests {

        @Test
        @DisplayName("A repeated lookup on the same snapshot should be served from cache")
        void testCacheHit() {
            AtomicInteger calls = new AtomicInteger();
            CaffeineMatchCache cache = new CaffeineMatchCache(CacheConfig.defaults());
            CandidateMatcher matcher = new CandidateMatcher((a, b) -> {
                calls.incrementAndGet();
                return 0.7;
            }, ResolutionOptions.defaults(), cache, metrics);
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(entry("Acana", "Wild Prairie Adult", "dry")));
            cache.onSnapshot(snapshot.version());
            NormalizedCandidate puppy = candidate("Acana", "Wild Prairie Puppy", "dry");

            MatchResult first = matcher.match(puppy, snapshot);
            MatchResult second = matcher.match(puppy, snapshot);

            assertEquals(first, second);
            assertEquals(1, calls.get());
            verify(metrics).recordCacheMiss();
            verify(metrics).recordCacheHit();
        }

        @Test
        @DisplayName("Candidates sharing a key but not a name should each be scored on their own name")
        void testSameKeyDifferentNames() {
            AtomicInteger calls = new AtomicInteger();
            SequenceRatioSimilarity ratio = new SequenceRatioSimilarity();
            CaffeineMatchCache cache = new CaffeineMatchCache(CacheConfig.defaults());
            CandidateMatcher matcher = new CandidateMatcher((a, b) -> {
                calls.incrementAndGet();
                return ratio.compute(a, b);
            }, ResolutionOptions.defaults(), cache, metrics);
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(entry("Acme", "Lamb Feast", null)));
            cache.onSnapshot(snapshot.version());
            NormalizedCandidate multipack = candidate("Acme", "Lamb Feasts 12 x 400g", null);
            NormalizedCandidate single = candidate("Acme", "Lamb Feasts", null);
            assertEquals(multipack.productKey(), single.productKey());

            MatchResult first = matcher.match(multipack, snapshot);
            MatchResult second = matcher.match(single, snapshot);

            assertEquals(2, calls.get());
            assertEquals(matcher.nameSimilarity("Lamb Feasts", "Lamb Feast"), second.score(), 0.0001);
            assertTrue(second.score() > first.score());
            verify(metrics, times(2)).recordCacheMiss();
            verify(metrics, never()).recordCacheHit();
        }

        @Test
        @DisplayName("Matching without a snapshot should fail as catalog unavailable")
        void testNullSnapshot() {
            assertThrows(CatalogUnavailableException.class,
                    () -> matcher((a, b) -> 0.0).match(candidate("Acana", "Wild Prairie", null), null));
        }

        @Test
        @DisplayName("Name similarity should ignore case and punctuation")
        void testNameSimilarity() {
            CandidateMatcher matcher = new CandidateMatcher(ResolutionOptions.defaults());

            assertEquals(1.0, matcher.nameSimilarity("Lily's Kitchen!", "lilys kitchen"), 0.0001);
            assertEquals(0.0, matcher.nameSimilarity(null, "abc"), 0.0001);
        }
    }
}
