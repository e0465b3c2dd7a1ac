package com.bulletin.lifecycle.audit;

import com.bulletin.lifecycle.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditServiceTest {

    private MutableClock clock;
    private AuditService auditService;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-03-01T10:00:00Z");
        auditService = new AuditService(clock);
    }

    @Test
    @DisplayName("Should record audit entries with the clock's time")
    void testRecordEntry() {
        AuditEntry entry = auditService.record(AuditAction.STATUS_UPDATED, "user-1", "admin-key",
                Map.of("to", "accepted"));

        assertNotNull(entry.id());
        assertEquals(AuditAction.STATUS_UPDATED, entry.action());
        assertEquals("user-1", entry.entityId());
        assertEquals("admin-key", entry.actorId());
        assertEquals("accepted", entry.details().get("to"));
        assertEquals(Instant.parse("2024-03-01T10:00:00Z"), entry.timestamp());
    }

    @Test
    @DisplayName("Should filter by entity, action and actor")
    void testFilters() {
        auditService.record(AuditAction.STATUS_CREATED, "user-1", "user-1-key");
        auditService.record(AuditAction.STATUS_UPDATED, "user-1", "admin-key");
        auditService.record(AuditAction.STATUS_UPDATED, "user-2", "admin-key");
        auditService.record(AuditAction.INDEX_REBUILT, null, null);

        assertEquals(4, auditService.size());
        assertEquals(2, auditService.getEntriesForEntity("user-1").size());
        assertEquals(2, auditService.getEntriesByAction(AuditAction.STATUS_UPDATED).size());
        assertEquals(2, auditService.getEntriesByActor("admin-key").size());
    }

    @Test
    @DisplayName("Should not be affected by later changes to the details map")
    void testDetailsCopied() {
        Map<String, Object> details = new HashMap<>();
        details.put("reason", "spam");
        AuditEntry entry = auditService.record(AuditAction.STATUS_UPDATED, "user-1", "admin-key", details);

        details.put("reason", "changed");

        assertEquals("spam", entry.details().get("reason"));
        assertTrue(auditService.record(AuditAction.STATUS_CREATED, "user-2", "key").details().isEmpty());
    }

    @Test
    @DisplayName("Should return an immutable view of all entries")
    void testImmutableView() {
        auditService.record(AuditAction.STATUS_CREATED, "user-1", "key");

        assertThrows(UnsupportedOperationException.class,
                () -> auditService.getAllEntries().add(auditService.getAllEntries().get(0)));
    }

    @Test
    @DisplayName("Should require an action")
    void testBuilderValidation() {
        assertThrows(NullPointerException.class, () -> AuditEntry.builder().entityId("user-1").build());
    }
}
