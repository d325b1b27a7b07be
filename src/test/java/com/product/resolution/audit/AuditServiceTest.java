package com.product.resolution.audit;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService();
    }

    @Test
    @DisplayName("Entries should be queryable by product and action")
    void testQueries() {
        auditService.record(AuditAction.PRODUCT_CREATED, "acana|pacifica", "feed");
        auditService.record(AuditAction.PRODUCT_ENRICHED, "acana|pacifica", "feed",
                Map.of("fields", List.of("fat_percent")));
        auditService.record(AuditAction.PRODUCT_CREATED, "orijen|six_fish", "feed");

        assertEquals(3, auditService.size());
        assertEquals(2, auditService.getEntriesForProduct("acana|pacifica").size());
        assertEquals(2, auditService.getEntriesByAction(AuditAction.PRODUCT_CREATED).size());
        List<AuditEntry> recent = auditService.getRecentEntries(1);
        assertEquals("orijen|six_fish", recent.get(0).productKey());
    }

    @Test
    @DisplayName("Null detail values should be dropped")
    void testNullDetails() {
        Map<String, Object> details = new HashMap<>();
        details.put("notes", null);
        details.put("score", 0.82);

        AuditEntry entry = auditService.record(AuditAction.REVIEW_APPROVED, "acana|pacifica", "alice", details);

        assertEquals(Map.of("score", 0.82), entry.details());
        assertNotNull(entry.id());
        assertNotNull(entry.timestamp());
    }

    @Test
    @DisplayName("The entry list should be read-only")
    void testImmutableView() {
        auditService.record(AuditAction.PRODUCT_CREATED, "acana|pacifica", "feed");

        assertThrows(UnsupportedOperationException.class, () -> auditService.getAllEntries().clear());
    }
}
