package com.product.resolution.merge;

import com.product.resolution.core.model.EnrichableField;

import java.util.Set;

/**
 * What the applier actually wrote for one decision.
 *
 * @param productKey          catalog entry that was inserted or updated (the parent for merges)
 * @param fieldsWritten       fields filled on an existing entry; empty for inserts and review submissions
 * @param inserted            true when a new catalog entry was created
 * @param duplicatePrevented  true when the candidate was folded into an entry that already existed
 * @param reviewItemId        id of the queued review item, or null
 */
public record AppliedChange(
        String productKey,
        Set<EnrichableField> fieldsWritten,
        boolean inserted,
        boolean duplicatePrevented,
        String reviewItemId
) {
    public AppliedChange {
        fieldsWritten = fieldsWritten != null ? Set.copyOf(fieldsWritten) : Set.of();
    }

    static AppliedChange inserted(String productKey) {
        return new AppliedChange(productKey, Set.of(), true, false, null);
    }

    static AppliedChange merged(String productKey, Set<EnrichableField> fields, boolean duplicatePrevented) {
        return new AppliedChange(productKey, fields, false, duplicatePrevented, null);
    }

    static AppliedChange queued(String productKey, String reviewItemId) {
        return new AppliedChange(productKey, Set.of(), false, false, reviewItemId);
    }
}
