package com.product.resolution.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class LogContextTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Closing should remove the keys it added")
    void testClose() {
        try (LogContext ctx = LogContext.forCandidate("corr-1", "acana|wild_prairie")) {
            assertEquals("corr-1", MDC.get("correlationId"));
            assertEquals("acana|wild_prairie", MDC.get("productKey"));
            assertEquals("decide", MDC.get("operation"));
        }
        assertNull(MDC.get("correlationId"));
        assertNull(MDC.get("productKey"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("A nested context should restore the outer values")
    void testNesting() {
        try (LogContext batch = LogContext.forBatch("batch-1")) {
            try (LogContext apply = LogContext.forApply("batch-1", "acme|adult_chicken|dry")) {
                assertEquals("apply", MDC.get("operation"));
            }
            assertEquals("batch-1", MDC.get("batchId"));
            assertEquals("resolve-batch", MDC.get("operation"));
            assertNull(MDC.get("productKey"));
        }
        assertNull(MDC.get("batchId"));
    }

    @Test
    @DisplayName("Null values should be skipped")
    void testNullValue() {
        try (LogContext ctx = LogContext.forBatch("batch-2").with("source", null).with("feed", "zooplus")) {
            assertNull(MDC.get("source"));
            assertEquals("zooplus", MDC.get("feed"));
        }
        assertNull(MDC.get("feed"));
    }

    @Test
    @DisplayName("Correlation ids should be unique")
    void testCorrelationId() {
        assertNotEquals(LogContext.generateCorrelationId(), LogContext.generateCorrelationId());
    }
}
