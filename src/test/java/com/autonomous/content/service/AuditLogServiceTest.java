package com.autonomous.content.service;

import com.autonomous.content.exception.AuditWriteException;
import com.autonomous.content.model.AuditEntry;
import com.autonomous.content.model.AuditFilter;
import com.autonomous.content.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class AuditLogServiceTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-10-15T10:00:00Z"));
    private AuditLogService auditLog;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        auditLog = new AuditLogService(clock);
        auditLog.setDataPath(tempDir.toString());
        auditLog.init();
    }

    @Test
    void shouldAssignIncreasingSequenceNumbers() {
        AuditEntry first = auditLog.recordEvent("org-1", "u1", "pipeline.created", "pipeline", "p1", Map.of());
        AuditEntry second = auditLog.recordEvent("org-1", "u1", "pipeline.queued", "pipeline", "p1", Map.of());

        assertTrue(second.getSequence() > first.getSequence());
        assertNotNull(first.getId());
        assertEquals(clock.instant(), first.getCreatedAt());
    }

    @Test
    void shouldRecordChangedFields() {
        AuditEntry entry = auditLog.recordChange("org-1", "u1", "organization.updated", "organization", "org-1",
            Map.of("name", "Acme", "alertThreshold", 80),
            Map.of("name", "Acme", "alertThreshold", 90));

        assertEquals(List.of("alertThreshold"), entry.getChangedFields());
        assertEquals(80, entry.getOldValues().get("alertThreshold"));
        assertEquals(90, entry.getNewValues().get("alertThreshold"));
        assertTrue(entry.isSuccess());
    }

    @Test
    void shouldRecordFailures() {
        AuditEntry entry = auditLog.recordFailure("org-1", null, "rate_limit.exceeded", "api_endpoint", "/api/x", "too many");

        assertFalse(entry.isSuccess());
        assertEquals("too many", entry.getErrorMessage());
        assertNull(entry.getUserId());
    }

    @Test
    void shouldFilterByActionPrefixAndScopeByOrganization() {
        auditLog.recordEvent("org-1", "u1", "pipeline.created", "pipeline", "p1", Map.of());
        auditLog.recordEvent("org-1", "u1", "budget.threshold_alert", "organization", "org-1", Map.of());
        auditLog.recordEvent("org-2", "u2", "pipeline.created", "pipeline", "p2", Map.of());

        List<AuditEntry> pipelines = auditLog.query("org-1", AuditFilter.forAction("pipeline."));

        assertEquals(1, pipelines.size());
        assertEquals("p1", pipelines.get(0).getEntityId());
        assertEquals(2, auditLog.query("org-1", AuditFilter.all()).size());
    }

    @Test
    void shouldKeepMostRecentEntriesWhenLimited() {
        for (int i = 1; i <= 5; i++) {
            auditLog.recordEvent("org-1", "u1", "pipeline.updated", "pipeline", "p" + i, Map.of());
            clock.advance(Duration.ofSeconds(1));
        }

        List<AuditEntry> lastTwo = auditLog.query("org-1", new AuditFilter(null, null, null, null, null, null, 2));

        assertEquals(List.of("p4", "p5"), lastTwo.stream().map(AuditEntry::getEntityId).toList());
    }

    @Test
    void shouldFilterByTimeRange() {
        auditLog.recordEvent("org-1", "u1", "pipeline.created", "pipeline", "early", Map.of());
        clock.advance(Duration.ofHours(1));
        Instant from = clock.instant();
        auditLog.recordEvent("org-1", "u1", "pipeline.created", "pipeline", "late", Map.of());

        List<AuditEntry> entries = auditLog.query("org-1", new AuditFilter(null, null, null, null, from, null, null));

        assertEquals(1, entries.size());
        assertEquals("late", entries.get(0).getEntityId());
    }

    @Test
    void shouldContinueSequenceAfterReload() {
        auditLog.recordEvent("org-1", "u1", "pipeline.created", "pipeline", "p1", Map.of());
        AuditEntry last = auditLog.recordEvent("org-1", "u1", "pipeline.queued", "pipeline", "p1", Map.of());

        AuditLogService reloaded = new AuditLogService(clock);
        reloaded.setDataPath(tempDir.toString());
        reloaded.init();
        AuditEntry next = reloaded.recordEvent("org-1", "u1", "pipeline.running", "pipeline", "p1", Map.of());

        assertEquals(3, reloaded.query("org-1", AuditFilter.all()).size());
        assertEquals(last.getSequence() + 1, next.getSequence());
    }

    @Test
    void shouldRaiseAndCountWriteFailures() throws Exception {
        Path blocker = Files.createFile(tempDir.resolve("not-a-directory"));
        AuditLogService broken = new AuditLogService(clock);
        broken.setDataPath(blocker.toString());
        broken.init();

        assertThrows(AuditWriteException.class,
            () -> broken.recordEvent("org-1", "u1", "pipeline.created", "pipeline", "p1", Map.of()));
        assertEquals(1, broken.getFailedWriteCount());
        assertTrue(broken.query("org-1", AuditFilter.all()).isEmpty());
    }
}
