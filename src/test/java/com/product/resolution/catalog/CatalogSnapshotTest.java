package com.product.resolution.catalog;

import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.ProductForm;
import com.product.resolution.core.model.ProductStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CatalogSnapshot Tests")
class CatalogSnapshotTest {

    private static final CanonicalProduct MAXI = product("royal_canin|maxi_adult|dry", "Maxi Adult");
    private static final CanonicalProduct MINI = product("royal_canin|mini_adult|dry", "Mini Adult");
    private static final CanonicalProduct OLD_MAXI = CanonicalProduct.builder(product("royal_canin|maxi_adult_15kg|dry",
            "Maxi Adult 15kg")).status(ProductStatus.SUPERSEDED).supersededBy(MAXI.getProductKey()).build();

    @Nested
    @DisplayName("Lookups")
    class LookupTests {

        @Test
        @DisplayName("Each snapshot should get a new version")
        void testVersions() {
            CatalogSnapshot first = CatalogSnapshot.of(List.of(MAXI));
            CatalogSnapshot second = CatalogSnapshot.of(List.of(MAXI));
            assertTrue(second.version() > first.version());
        }

        @Test
        @DisplayName("Buckets should hold active entries in catalog order")
        void testBuckets() {
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(MAXI, OLD_MAXI, MINI));

            assertEquals(List.of(MAXI, MINI), snapshot.bucket("royal_canin"));
            assertEquals(List.of(MAXI, MINI), snapshot.bucketByDisplayBrand("  ROYAL CANIN "));
            assertTrue(snapshot.bucket("purina").isEmpty());
            assertTrue(snapshot.bucket(null).isEmpty());
            assertEquals(3, snapshot.size());
            assertTrue(snapshot.brandSlugs().contains("royal_canin"));
        }

        @Test
        @DisplayName("findActive should follow supersede links")
        void testFindActive() {
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(MAXI, OLD_MAXI));

            assertEquals(MAXI, snapshot.findActive(OLD_MAXI.getProductKey()).orElseThrow());
            assertEquals(OLD_MAXI, snapshot.findByKey(OLD_MAXI.getProductKey()).orElseThrow());
            assertTrue(snapshot.findActive("unknown|key").isEmpty());
        }

        @Test
        @DisplayName("findByUrl should index active entries by normalized URL")
        void testFindByUrl() {
            CanonicalProduct maxi = CanonicalProduct.builder(MAXI)
                    .productUrl("https://shop.example/p/maxi-adult/").build();
            CanonicalProduct mini = CanonicalProduct.builder(MINI)
                    .productUrl("https://shop.example/p/maxi-adult").build();
            CanonicalProduct oldMaxi = CanonicalProduct.builder(OLD_MAXI)
                    .productUrl("https://shop.example/p/maxi-adult-15kg").build();
            CatalogSnapshot snapshot = CatalogSnapshot.of(List.of(oldMaxi, maxi, mini));

            assertEquals(maxi, snapshot.findByUrl("https://shop.example/p/maxi-adult?activeVariant=7").orElseThrow());
            assertTrue(snapshot.findByUrl("https://shop.example/p/maxi-adult-15kg").isEmpty());
            assertTrue(snapshot.findByUrl(null).isEmpty());
            assertTrue(snapshot.findByUrl("  ").isEmpty());
        }

        @Test
        @DisplayName("A supersede cycle should not resolve")
        void testSupersedeCycle() {
            CanonicalProduct a = CanonicalProduct.builder(product("b|a", "A"))
                    .status(ProductStatus.SUPERSEDED).supersededBy("b|b").build();
            CanonicalProduct b = CanonicalProduct.builder(product("b|b", "B"))
                    .status(ProductStatus.SUPERSEDED).supersededBy("b|a").build();

            assertTrue(CatalogSnapshot.of(List.of(a, b)).findActive("b|a").isEmpty());
        }
    }

    @Nested
    @DisplayName("Loading")
    @ExtendWith(MockitoExtension.class)
    class LoadTests {

        @Mock
        private CatalogSource source;

        @Test
        @DisplayName("Should wrap source failures")
        void testSourceFailure() {
            RuntimeException cause = new IllegalStateException("connection refused");
            when(source.fetchAll()).thenThrow(cause);

            CatalogUnavailableException e = assertThrows(CatalogUnavailableException.class,
                    () -> CatalogSnapshot.load(source));
            assertSame(cause, e.getCause());
        }

        @Test
        @DisplayName("Missing source or product list should be unavailable")
        void testMissing() {
            when(source.fetchAll()).thenReturn(null);

            assertThrows(CatalogUnavailableException.class, () -> CatalogSnapshot.load(source));
            assertThrows(CatalogUnavailableException.class, () -> CatalogSnapshot.load(null));
        }

        @Test
        @DisplayName("Should snapshot the source contents")
        void testLoad() {
            when(source.fetchAll()).thenReturn(List.of(MAXI, MINI));

            CatalogSnapshot snapshot = CatalogSnapshot.load(source);
            assertEquals(2, snapshot.size());
            verify(source).fetchAll();
        }
    }

    static CanonicalProduct product(String key, String name) {
        return CanonicalProduct.builder()
                .productKey(key)
                .brand("Royal Canin")
                .brandSlug(key.substring(0, key.indexOf('|')))
                .productName(name)
                .nameSlug(key.split("\\|")[1])
                .form(ProductForm.DRY)
                .build();
    }
}
