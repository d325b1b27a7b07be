package com.product.resolution.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only, in-memory audit log of catalog writes and review events.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("audit.recorded action={} productKey={} actor={}",
                entry.action(), entry.productKey(), entry.actor());
        return entry;
    }

    public AuditEntry record(AuditAction action, String productKey, String actor, Map<String, Object> details) {
        return record(AuditEntry.builder()
                .action(action)
                .productKey(productKey)
                .actor(actor)
                .details(details)
                .build());
    }

    public AuditEntry record(AuditAction action, String productKey, String actor) {
        return record(action, productKey, actor, null);
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForProduct(String productKey) {
        return entries.stream()
                .filter(e -> productKey.equals(e.productKey()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }

    /**
     * Gets the most recent entries, up to the specified limit.
     */
    public List<AuditEntry> getRecentEntries(int limit) {
        int size = entries.size();
        if (size <= limit) {
            return getAllEntries();
        }
        return Collections.unmodifiableList(new ArrayList<>(entries.subList(size - limit, size)));
    }
}
