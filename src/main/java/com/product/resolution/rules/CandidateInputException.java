package com.product.resolution.rules;

/**
 * Thrown when a candidate record has no usable brand or product name.
 * Batch processing records the failure against the candidate and moves on.
 */
public class CandidateInputException extends RuntimeException {

    private final String field;

    public CandidateInputException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Name of the offending input field ("brand" or "productName").
     */
    public String getField() {
        return field;
    }
}
