package com.product.resolution.merge;

import com.product.resolution.core.model.CanonicalProduct;
import com.product.resolution.core.model.EnrichableField;
import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.rules.UrlNormalizer;

import java.util.EnumMap;
import java.util.Map;

/**
 * Fill-gaps-only merge: a candidate value is taken only where the target has nothing.
 *
 * <p>Existing values are never overwritten, so computing and applying a merge a second time is a no-op.
 * A stored URL that still carries a variant selector counts as missing and may be replaced by a clean
 * one.</p>
 */
public class FieldMerger {

    /**
     * Fields the candidate can fill on the target, with the candidate's values.
     */
    public Map<EnrichableField, Object> fillGaps(CanonicalProduct target, NormalizedCandidate candidate) {
        Map<EnrichableField, Object> updates = new EnumMap<>(EnrichableField.class);
        for (EnrichableField field : EnrichableField.values()) {
            Object incoming = candidate.get(field);
            if (EnrichableField.isEmpty(incoming)) {
                continue;
            }
            if (isGap(field, target.get(field))) {
                updates.put(field, incoming);
            }
        }
        return updates;
    }

    /**
     * Applies the fill-gaps merge and returns the merged product. The target is not modified.
     */
    public CanonicalProduct merge(CanonicalProduct target, NormalizedCandidate candidate) {
        Map<EnrichableField, Object> updates = fillGaps(target, candidate);
        return updates.isEmpty() ? target : target.withFields(updates);
    }

    /**
     * Restricts a previously computed payload to the fields that are still empty on the target.
     */
    public Map<EnrichableField, Object> stillMissing(CanonicalProduct target, Map<EnrichableField, Object> payload) {
        Map<EnrichableField, Object> updates = new EnumMap<>(EnrichableField.class);
        payload.forEach((field, value) -> {
            if (!EnrichableField.isEmpty(value) && isGap(field, target.get(field))) {
                updates.put(field, value);
            }
        });
        return updates;
    }

    private static boolean isGap(EnrichableField field, Object current) {
        if (EnrichableField.isEmpty(current)) {
            return true;
        }
        return field == EnrichableField.PRODUCT_URL && UrlNormalizer.hasVariantSelector((String) current);
    }
}
