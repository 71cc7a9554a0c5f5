package com.cistrade.domain.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class AuditEntryTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void builderFillsDefaults() {
        AuditEntry entry = AuditEntry.builder(AuditAction.CREATE, "Portfolio").build();

        assertNotNull(entry.entryId());
        assertEquals(36, entry.entryId().length());
        assertNotNull(entry.eventTime());
        assertEquals(AuditEntry.ANONYMOUS, entry.username());
        assertNull(entry.userId());
        assertEquals(AuditSeverity.INFO, entry.severity());
        assertEquals("", entry.objectId());
        assertEquals("", entry.description());
        assertSame(RequestMetadata.none(), entry.request());
        assertTrue(entry.outcome().success());
        assertNull(entry.changes());
        assertFalse(entry.requiresApproval());
    }

    @Test
    void blankUsernameIsAnonymous() {
        AuditEntry entry = AuditEntry.builder(AuditAction.LOGIN, "Session")
            .actor(null, "  ")
            .build();

        assertEquals(AuditEntry.ANONYMOUS, entry.username());
    }

    @Test
    void partitionDateFollowsZone() {
        Instant lateUtc = Instant.parse("2026-02-03T18:30:00Z");

        AuditEntry utc = AuditEntry.builder(AuditAction.UPDATE, "Portfolio")
            .eventTime(lateUtc)
            .build();
        AuditEntry singapore = AuditEntry.builder(AuditAction.UPDATE, "Portfolio")
            .eventTime(lateUtc)
            .partitionZone(ZoneId.of("Asia/Singapore"))
            .build();

        assertEquals(LocalDate.of(2026, 2, 3), utc.partitionDate());
        assertEquals(LocalDate.of(2026, 2, 4), singapore.partitionDate());
    }

    @Test
    void snapshotsAreCopied() {
        ObjectNode before = MAPPER.createObjectNode().put("status", "DRAFT");
        ObjectNode after = MAPPER.createObjectNode().put("status", "SUBMITTED");

        AuditEntry entry = AuditEntry.builder(AuditAction.SUBMIT, "Portfolio")
            .objectId(42)
            .oldValue(before)
            .newValue(after)
            .build();

        after.put("status", "APPROVED");
        before.put("extra", 1);

        assertEquals("42", entry.objectId());
        assertEquals("SUBMITTED", entry.newValue().get("status").asText());
        assertFalse(entry.oldValue().has("extra"));
        assertEquals("DRAFT", entry.changes().get("status").get("old").asText());
        assertEquals("SUBMITTED", entry.changes().get("status").get("new").asText());
    }

    @Test
    void actionAndObjectTypeAreRequired() {
        assertThrows(NullPointerException.class, () -> AuditEntry.builder(null, "Portfolio"));
        assertThrows(NullPointerException.class, () -> AuditEntry.builder(AuditAction.READ, null));
    }

    @Test
    void userAgentIsTruncated() {
        RequestMetadata request = new RequestMetadata("GET", "/x", "10.0.0.1", "a".repeat(800));

        assertEquals(RequestMetadata.MAX_USER_AGENT_LENGTH, request.userAgent().length());
    }

    @Test
    void outcomeFromStatus() {
        assertTrue(AuditOutcome.fromStatus(302).success());
        assertFalse(AuditOutcome.fromStatus(403).success());
        assertEquals(403, AuditOutcome.fromStatus(403).statusCode());
        assertTrue(AuditOutcome.succeeded().success());
        assertEquals(0, AuditOutcome.succeeded().statusCode());
        assertFalse(AuditOutcome.failure("denied").success());
    }

    @Test
    void actionParsing() {
        assertEquals(AuditAction.ACCESS_DENIED, AuditAction.parse(" access_denied "));
        assertThrows(IllegalArgumentException.class, () -> AuditAction.parse("nope"));
        assertThrows(IllegalArgumentException.class, () -> AuditAction.parse(""));
    }

    @Test
    void actionParsingIgnoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertEquals(AuditAction.LOGIN, AuditAction.parse("login"));
            assertEquals(AuditAction.IMPORT, AuditAction.parse("import"));
        } finally {
            Locale.setDefault(saved);
        }
    }
}
