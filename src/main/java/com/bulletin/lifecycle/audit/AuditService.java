package com.bulletin.lifecycle.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Append-only log of lifecycle operations.
 */
public class AuditService {
    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    private final List<AuditEntry> entries = new CopyOnWriteArrayList<>();
    private final Clock clock;

    public AuditService() {
        this(Clock.systemUTC());
    }

    public AuditService(Clock clock) {
        this.clock = clock;
    }

    public AuditEntry record(AuditEntry entry) {
        entries.add(entry);
        log.debug("Audit entry recorded: {} for entity {} by {}",
                entry.action(), entry.entityId(), entry.actorId());
        return entry;
    }

    public AuditEntry record(AuditAction action, String entityId, String actorId, Map<String, Object> details) {
        AuditEntry entry = AuditEntry.builder()
                .action(action)
                .entityId(entityId)
                .actorId(actorId)
                .details(details)
                .timestamp(clock.instant())
                .build();
        return record(entry);
    }

    public AuditEntry record(AuditAction action, String entityId, String actorId) {
        return record(action, entityId, actorId, null);
    }

    /**
     * Gets all audit entries (immutable view).
     */
    public List<AuditEntry> getAllEntries() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<AuditEntry> getEntriesForEntity(String entityId) {
        return entries.stream()
                .filter(e -> entityId.equals(e.entityId()))
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByAction(AuditAction action) {
        return entries.stream()
                .filter(e -> e.action() == action)
                .collect(Collectors.toList());
    }

    public List<AuditEntry> getEntriesByActor(String actorId) {
        return entries.stream()
                .filter(e -> actorId.equals(e.actorId()))
                .collect(Collectors.toList());
    }

    public int size() {
        return entries.size();
    }
}
