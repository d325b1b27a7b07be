package com.product.resolution.api;

import com.product.resolution.catalog.CatalogSource;
import com.product.resolution.catalog.CatalogUnavailableException;
import com.product.resolution.catalog.InMemoryCatalogSource;
import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.RawCandidateRecord;
import com.product.resolution.decision.DecisionType;
import com.product.resolution.metrics.MetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;

import static com.product.resolution.Fixtures.entry;
import static com.product.resolution.Fixtures.raw;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("BatchProcessor Tests")
class BatchProcessorTest {

    private static ProductResolver resolver(CatalogSource catalog, ResolutionOptions options) {
        return ProductResolver.builder()
                .catalogSource(catalog)
                .options(options)
                .build();
    }

    private static RawCandidateRecord bad() {
        return raw("", "Adult Chicken");
    }

    @Nested
    @DisplayName("Sequential")
    class SequentialTests {

        @Test
        @DisplayName("Errors should be reported without stopping the batch")
        void testErrorsReported() {
            InMemoryCatalogSource catalog = new InMemoryCatalogSource();
            ProductResolver resolver = resolver(catalog, ResolutionOptions.defaults());

            BatchResult result = resolver.resolveBatch(List.of(
                    raw("Acana", "Wild Prairie Dog 2kg", "dry"),
                    bad(),
                    raw("Acana", "Wild Prairie Dog 11.4kg", "dry"),
                    raw("Orijen", "Six Fish", "dry")));

            assertEquals(4, result.totalCandidates());
            assertEquals(3, result.outcomes().size());
            assertEquals(1, result.errors().size());
            CandidateError error = result.errors().get(0);
            assertEquals(1, error.index());
            assertEquals("brand", error.field());
            assertFalse(result.stoppedEarly());
            assertFalse(result.isSuccess());
            assertEquals(3, result.count(DecisionType.NEW_PRODUCT));
            assertEquals(0, result.count(DecisionType.AUTO_MERGE));
            // Both Wild Prairie bags were decided against an empty catalog and collapse on write.
            assertEquals(1, result.duplicatesPrevented());
            assertEquals(2, catalog.size());
            assertEquals(4, resolver.getStatistics().getProductsProcessed());
            assertEquals(1, resolver.getStatistics().getErrors());
        }

        @Test
        @DisplayName("Candidates sharing a key should be decided on their own names in any order")
        void testSharedKeyOrderIndependent() {
            List<RawCandidateRecord> batch = List.of(raw("Acme", "Lamb Feasts 12 x 400g"), raw("Acme", "Lamb Feasts"));
            List<RawCandidateRecord> reversed = List.of(batch.get(1), batch.get(0));

            BatchResult forward = resolver(new InMemoryCatalogSource(List.of(entry("Acme", "Lamb Feast", null))),
                    ResolutionOptions.defaults()).resolveBatch(batch);
            BatchResult backward = resolver(new InMemoryCatalogSource(List.of(entry("Acme", "Lamb Feast", null))),
                    ResolutionOptions.defaults()).resolveBatch(reversed);

            assertEquals(DecisionType.AUTO_MERGE, forward.outcomes().get(1).type());
            assertEquals(DecisionType.AUTO_MERGE, backward.outcomes().get(0).type());
            assertEquals(forward.outcomes().get(0).type(), backward.outcomes().get(1).type());
        }

        @Test
        @DisplayName("Consecutive failures should stop the batch and report the rest as unprocessed")
        void testEarlyStop() {
            ProductResolver resolver = resolver(new InMemoryCatalogSource(),
                    ResolutionOptions.builder().maxConsecutiveFailures(2).build());

            BatchResult result = resolver.resolveBatch(List.of(bad(), bad(),
                    raw("Acana", "Pacifica"), raw("Acana", "Grasslands")));

            assertTrue(result.stoppedEarly());
            assertEquals(2, result.errors().size());
            assertEquals(2, result.unprocessed());
            assertTrue(result.outcomes().isEmpty());
            assertEquals(2, resolver.getStatistics().getProductsProcessed());
        }

        @Test
        @DisplayName("A success should reset the failure streak")
        void testStreakReset() {
            ProductResolver resolver = resolver(new InMemoryCatalogSource(),
                    ResolutionOptions.builder().maxConsecutiveFailures(2).build());

            BatchResult result = resolver.resolveBatch(List.of(bad(), raw("Acana", "Pacifica"),
                    bad(), raw("Acana", "Grasslands")));

            assertFalse(result.stoppedEarly());
            assertEquals(2, result.errors().size());
            assertEquals(2, result.outcomes().size());
            assertEquals(0, result.unprocessed());
        }

        @Test
        @DisplayName("An empty batch should succeed")
        void testEmptyBatch() {
            BatchResult result = resolver(new InMemoryCatalogSource(), ResolutionOptions.defaults())
                    .resolveBatch(List.of());

            assertTrue(result.isSuccess());
            assertEquals(0, result.totalCandidates());
        }

        @Test
        @DisplayName("Oversized batches should be refused")
        void testOversized() {
            ProductResolver resolver = resolver(new InMemoryCatalogSource(),
                    ResolutionOptions.builder().maxBatchSize(2).build());

            assertThrows(IllegalArgumentException.class, () -> resolver.resolveBatch(List.of(
                    raw("Acana", "A"), raw("Acana", "B"), raw("Acana", "C"))));
        }
    }

    @Nested
    @DisplayName("Parallel")
    class ParallelTests {

        @Test
        @DisplayName("Outcomes should keep input order")
        void testOrderPreserved() {
            InMemoryCatalogSource catalog = new InMemoryCatalogSource();
            ProductResolver resolver = resolver(catalog, ResolutionOptions.builder().parallelism(4).build());
            List<RawCandidateRecord> candidates = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                candidates.add(raw("Brand " + i, "Recipe " + i, "dry"));
            }

            BatchResult result = resolver.resolveBatch(candidates);

            assertEquals(20, result.outcomes().size());
            for (int i = 0; i < 20; i++) {
                assertEquals(i, result.outcomes().get(i).index());
                assertEquals("brand_" + i + "|recipe_" + i + "|dry", result.outcomes().get(i).candidateKey());
            }
            assertEquals(20, catalog.size());
            assertTrue(result.isSuccess());
        }

        @Test
        @DisplayName("Same-key candidates should collapse even when decided in parallel")
        void testParallelCollapse() {
            InMemoryCatalogSource catalog = new InMemoryCatalogSource();
            ProductResolver resolver = resolver(catalog, ResolutionOptions.builder().parallelism(3).build());

            BatchResult result = resolver.resolveBatch(List.of(
                    raw("Acana", "Wild Prairie 2kg", "dry"),
                    raw("Acana", "Wild Prairie 6kg", "dry"),
                    raw("Acana", "Wild Prairie 11.4kg", "dry")));

            assertEquals(1, catalog.size());
            assertEquals(2, result.duplicatesPrevented());
        }

        @Test
        @DisplayName("The failure limit should apply in write order")
        void testParallelEarlyStop() {
            ProductResolver resolver = resolver(new InMemoryCatalogSource(),
                    ResolutionOptions.builder().parallelism(3).maxConsecutiveFailures(2).build());

            BatchResult result = resolver.resolveBatch(List.of(bad(), bad(), raw("Acana", "Pacifica")));

            assertTrue(result.stoppedEarly());
            assertEquals(1, result.unprocessed());
        }
    }

    @Nested
    @DisplayName("Catalog failures")
    @ExtendWith(MockitoExtension.class)
    class CatalogFailureTests {

        @Mock
        private CatalogSource catalog;

        @Mock
        private MetricsService metrics;

        @Test
        @DisplayName("An unreadable catalog should fail the batch before any write")
        void testSnapshotFailure() {
            when(catalog.fetchAll()).thenThrow(new IllegalStateException("timeout"));
            ProductResolver resolver = ProductResolver.builder().catalogSource(catalog).build();

            assertThrows(CatalogUnavailableException.class,
                    () -> resolver.resolveBatch(List.of(raw("Acana", "Pacifica"))));
            verify(catalog, never()).insert(any());
        }

        @Test
        @DisplayName("A write failure should abort with the partial result")
        void testWriteFailure() {
            when(catalog.fetchAll()).thenReturn(List.of(entry("Acme", "Adult Chicken", "dry")));
            when(catalog.insert(any(CanonicalProduct.class)))
                    .thenAnswer(invocation -> invocation.getArgument(0))
                    .thenThrow(new CatalogUnavailableException("write timed out"));
            ProductResolver resolver = ProductResolver.builder()
                    .catalogSource(catalog)
                    .metricsService(metrics)
                    .build();

            BatchAbortedException e = assertThrows(BatchAbortedException.class, () -> resolver.resolveBatch(List.of(
                    raw("Orijen", "Six Fish"),
                    raw("Orijen", "Original"),
                    raw("Orijen", "Regional Red"))));

            BatchResult partial = e.getPartialResult();
            assertEquals(1, partial.outcomes().size());
            assertEquals(2, partial.unprocessed());
            assertTrue(partial.stoppedEarly());
            assertInstanceOf(CatalogUnavailableException.class, e.getCause());
            assertEquals(1, resolver.getStatistics().getErrors());
            verify(metrics).recordBatchDuration(any(), eq(true));
        }
    }
}
