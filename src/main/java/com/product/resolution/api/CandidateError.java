package com.product.resolution.api;

/**
 * A candidate that could not be resolved, with its position in the batch.
 *
 * @param field input field at fault for input errors, or null for other failures
 */
public record CandidateError(int index, String brand, String productName, String field, String message) {
}
