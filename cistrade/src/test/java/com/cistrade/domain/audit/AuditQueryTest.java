package com.cistrade.domain.audit;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class AuditQueryTest {

    @Test
    void limitIsDefaultedAndClamped() {
        assertEquals(AuditQuery.DEFAULT_LIMIT, AuditQuery.recent(0).limit());
        assertEquals(AuditQuery.DEFAULT_LIMIT, AuditQuery.recent(-5).limit());
        assertEquals(25, AuditQuery.recent(25).limit());
        assertEquals(AuditQuery.MAX_LIMIT, AuditQuery.recent(50_000).limit());
    }

    @Test
    void invertedDateRangeIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new AuditQuery(
            null, null, null, null, LocalDate.of(2026, 2, 5), LocalDate.of(2026, 2, 1), 10));
    }

    @Test
    void forObjectFiltersByTarget() {
        AuditQuery query = AuditQuery.forObject("Portfolio", "P-1", 20);

        assertEquals("Portfolio", query.objectType());
        assertEquals("P-1", query.objectId());
        assertNull(query.username());
    }
}
