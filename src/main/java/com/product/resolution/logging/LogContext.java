package com.product.resolution.logging;

import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * AutoCloseable MDC wrapper. On close every key added through the context gets back the value it had
 * before, so contexts can be nested (a candidate inside a batch).
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCandidate(correlationId, productKey)) {
 *     log.info("candidate.decided decision={}", decision.type());
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final Map<String, String> previous = new LinkedHashMap<>();

    private LogContext() {
    }

    public static LogContext forBatch(String batchId) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("operation", "resolve-batch");
        return ctx;
    }

    /**
     * Context for matching and deciding one candidate.
     */
    public static LogContext forCandidate(String correlationId, String productKey) {
        LogContext ctx = new LogContext();
        ctx.put("correlationId", correlationId);
        ctx.put("productKey", productKey);
        ctx.put("operation", "decide");
        return ctx;
    }

    /**
     * Context for writing one decision to the catalog.
     */
    public static LogContext forApply(String batchId, String productKey) {
        LogContext ctx = new LogContext();
        ctx.put("batchId", batchId);
        ctx.put("productKey", productKey);
        ctx.put("operation", "apply");
        return ctx;
    }

    public static String generateCorrelationId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        if (value == null) {
            return;
        }
        if (!previous.containsKey(key)) {
            previous.put(key, MDC.get(key));
        }
        MDC.put(key, value);
    }

    @Override
    public void close() {
        previous.forEach((key, value) -> {
            if (value == null) {
                MDC.remove(key);
            } else {
                MDC.put(key, value);
            }
        });
        previous.clear();
    }
}
