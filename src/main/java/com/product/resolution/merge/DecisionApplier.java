package com.product.resolution.merge;

import com.product.resolution.api.RunStatistics;
import com.product.resolution.audit.AuditAction;
import com.product.resolution.audit.AuditService;
import com.product.resolution.catalog.CatalogSource;
import com.product.resolution.catalog.CatalogUnavailableException;
import com.product.resolution.catalog.KeyConflictException;
import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.EnrichableField;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.core.model.VariantRecord;
import com.product.resolution.decision.ResolutionDecision;
import com.product.resolution.metrics.MetricsService;
import com.product.resolution.review.ReviewItem;
import com.product.resolution.review.ReviewQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single writer for the catalog. Applies decisions one at a time under a lock.
 *
 * <p>Merge payloads are recomputed against the parent as it is when the write happens, not as it was in
 * the snapshot the decision was made from. Two candidates targeting the same parent therefore fill each
 * gap at most once. An insert that hits an existing key becomes a fill-gaps merge into that key.</p>
 */
public class DecisionApplier {
    private static final Logger log = LoggerFactory.getLogger(DecisionApplier.class);
    private static final int MAX_SUPERSEDE_HOPS = 32;

    private final CatalogSource catalog;
    private final FieldMerger fieldMerger;
    private final ReviewQueue reviewQueue;
    private final AuditService auditService;
    private final MetricsService metrics;
    private final String actor;
    private final ReentrantLock writeLock = new ReentrantLock();

    public DecisionApplier(CatalogSource catalog, FieldMerger fieldMerger, ReviewQueue reviewQueue,
                           AuditService auditService, MetricsService metrics, String actor) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
        this.fieldMerger = Objects.requireNonNull(fieldMerger, "fieldMerger is required");
        this.reviewQueue = Objects.requireNonNull(reviewQueue, "reviewQueue is required");
        this.auditService = Objects.requireNonNull(auditService, "auditService is required");
        this.metrics = Objects.requireNonNull(metrics, "metrics is required");
        this.actor = actor != null ? actor : "SYSTEM";
    }

    /**
     * Writes one decision.
     *
     * @throws CatalogUnavailableException if the catalog fails or a merge target no longer exists
     */
    public AppliedChange apply(ResolutionDecision decision, RunStatistics stats) {
        Objects.requireNonNull(decision, "decision is required");
        Objects.requireNonNull(stats, "stats is required");
        writeLock.lock();
        try {
            AppliedChange change = decision.accept(new Writer(stats));
            metrics.incrementDecision(decision.type());
            return change;
        } catch (CatalogUnavailableException e) {
            throw e;
        } catch (KeyConflictException | IllegalArgumentException e) {
            throw new CatalogUnavailableException("Catalog rejected write for "
                    + decision.candidate().productKey() + ": " + e.getMessage(), e);
        } finally {
            writeLock.unlock();
        }
    }

    private final class Writer implements ResolutionDecision.Visitor<AppliedChange> {
        private final RunStatistics stats;

        private Writer(RunStatistics stats) {
            this.stats = stats;
        }

        @Override
        public AppliedChange visitAutoMerge(ResolutionDecision.AutoMerge decision) {
            CanonicalProduct target = requireActive(decision.targetKey());
            Set<EnrichableField> written = fillGaps(target, decision.candidate());
            stats.incrementAutoMerges();
            if (decision.exactKeyMatch()) {
                preventedDuplicate(target.getProductKey(), decision.candidate());
            }
            return AppliedChange.merged(target.getProductKey(), written, decision.exactKeyMatch());
        }

        @Override
        public AppliedChange visitConsolidateVariant(ResolutionDecision.ConsolidateVariant decision) {
            CanonicalProduct parent = requireActive(decision.parentKey());
            Set<EnrichableField> written = fillGaps(parent, decision.candidate());

            VariantRecord variant = decision.variantRecord();
            if (!variant.parentKey().equals(parent.getProductKey())) {
                variant = new VariantRecord(parent.getProductKey(), variant.variantKey(), variant.variantType(),
                        variant.sizeValue(), variant.packValue(), variant.productName(), variant.productUrl(),
                        variant.recordedAt());
            }
            catalog.recordVariant(variant);
            supersedeStandaloneVariant(variant.variantKey(), parent.getProductKey());

            stats.incrementVariantsDetected();
            stats.incrementDuplicatesPrevented();
            metrics.incrementDuplicatePrevented();
            auditService.record(AuditAction.VARIANT_CONSOLIDATED, parent.getProductKey(), actor, Map.of(
                    "variantKey", variant.variantKey(),
                    "variantType", variant.variantType().name(),
                    "productName", variant.productName()));
            log.debug("apply.variant parent={} variant={} type={}",
                    parent.getProductKey(), variant.variantKey(), variant.variantType());
            return AppliedChange.merged(parent.getProductKey(), written, true);
        }

        @Override
        public AppliedChange visitReviewQueue(ResolutionDecision.ReviewQueue decision) {
            ReviewItem item = reviewQueue.submit(ReviewItem.builder()
                    .candidate(decision.candidate())
                    .proposedParentKey(decision.bestMatch().getProductKey())
                    .proposedParentName(decision.bestMatch().getProductName())
                    .score(decision.score())
                    .tier(decision.tier())
                    .sourceSystem(actor)
                    .build());
            stats.incrementReviewsQueued();
            Map<String, Object> details = new HashMap<>();
            details.put("reviewId", item.getId());
            details.put("candidateKey", decision.candidate().productKey());
            details.put("score", decision.score());
            details.put("tier", decision.tier().name());
            auditService.record(AuditAction.REVIEW_REQUESTED, decision.bestMatch().getProductKey(), actor, details);
            return AppliedChange.queued(decision.bestMatch().getProductKey(), item.getId());
        }

        @Override
        public AppliedChange visitNewProduct(ResolutionDecision.NewProduct decision) {
            CanonicalProduct product = decision.candidate().toCanonicalProduct();
            try {
                catalog.insert(product);
            } catch (KeyConflictException e) {
                // Same key inserted earlier in this batch or by another writer since the snapshot.
                CanonicalProduct existing = requireActive(e.getProductKey());
                Set<EnrichableField> written = fillGaps(existing, decision.candidate());
                preventedDuplicate(existing.getProductKey(), decision.candidate());
                return AppliedChange.merged(existing.getProductKey(), written, true);
            }
            stats.incrementNewProducts();
            auditService.record(AuditAction.PRODUCT_CREATED, product.getProductKey(), actor, Map.of(
                    "brand", product.getBrand(),
                    "productName", product.getProductName()));
            log.debug("apply.inserted key={}", product.getProductKey());
            return AppliedChange.inserted(product.getProductKey());
        }

        private Set<EnrichableField> fillGaps(CanonicalProduct target, NormalizedCandidate candidate) {
            Map<EnrichableField, Object> updates = fieldMerger.fillGaps(target, candidate);
            if (updates.isEmpty()) {
                return Set.of();
            }
            catalog.applyUpdate(target.getProductKey(), updates);
            stats.incrementDataConsolidated();
            Set<EnrichableField> written = new HashSet<>(updates.keySet());
            auditService.record(AuditAction.PRODUCT_ENRICHED, target.getProductKey(), actor, Map.of(
                    "fields", written.stream().map(EnrichableField::column).sorted().toList(),
                    "fromCandidate", candidate.productKey()));
            log.debug("apply.enriched key={} fields={}", target.getProductKey(), written);
            return written;
        }

        private void preventedDuplicate(String productKey, NormalizedCandidate candidate) {
            stats.incrementDuplicatesPrevented();
            metrics.incrementDuplicatePrevented();
            auditService.record(AuditAction.DUPLICATE_PREVENTED, productKey, actor, Map.of(
                    "candidateName", candidate.productName()));
        }
    }

    /**
     * Reads the current state of a product, following supersede links to the active entry.
     */
    private CanonicalProduct requireActive(String productKey) {
        String key = productKey;
        for (int hop = 0; hop <= MAX_SUPERSEDE_HOPS; hop++) {
            Optional<CanonicalProduct> found = catalog.findByKey(key);
            if (found.isEmpty()) {
                throw new CatalogUnavailableException("Catalog entry disappeared: " + key);
            }
            CanonicalProduct product = found.get();
            if (product.isActive()) {
                return product;
            }
            key = product.getSupersededBy();
            if (key == null) {
                break;
            }
        }
        throw new CatalogUnavailableException("No active catalog entry reachable from " + productKey);
    }

    // An entry imported earlier under the variant's own key now lives on as a variant of the parent.
    private void supersedeStandaloneVariant(String variantKey, String parentKey) {
        if (variantKey.equals(parentKey)) {
            return;
        }
        catalog.findByKey(variantKey)
                .filter(CanonicalProduct::isActive)
                .ifPresent(standalone -> {
                    catalog.markSuperseded(standalone.getProductKey(), parentKey);
                    log.info("apply.superseded key={} parent={}", standalone.getProductKey(), parentKey);
                });
    }
}
