package com.product.resolution.api;

/**
 * Thrown when a batch cannot continue because the catalog failed while decisions were being written.
 * Carries what had been written up to that point.
 */
public class BatchAbortedException extends RuntimeException {

    private final transient BatchResult partialResult;

    public BatchAbortedException(String message, Throwable cause, BatchResult partialResult) {
        super(message, cause);
        this.partialResult = partialResult;
    }

    public BatchResult getPartialResult() {
        return partialResult;
    }
}
