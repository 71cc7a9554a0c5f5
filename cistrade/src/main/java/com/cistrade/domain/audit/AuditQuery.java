package com.cistrade.domain.audit;

import java.time.LocalDate;

/**
 * Filter for reading back recent audit entries. Null fields do not filter.
 */
public record AuditQuery(
    String username,
    String objectType,
    String objectId,
    AuditAction action,
    LocalDate fromDate,
    LocalDate toDate,
    int limit
) {
    public static final int DEFAULT_LIMIT = 100;
    public static final int MAX_LIMIT = 1000;

    public AuditQuery {
        if (limit <= 0) {
            limit = DEFAULT_LIMIT;
        }
        limit = Math.min(limit, MAX_LIMIT);
        if (fromDate != null && toDate != null && fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("fromDate " + fromDate + " is after toDate " + toDate);
        }
    }

    public static AuditQuery recent(int limit) {
        return new AuditQuery(null, null, null, null, null, null, limit);
    }

    public static AuditQuery forObject(String objectType, String objectId, int limit) {
        return new AuditQuery(null, objectType, objectId, null, null, null, limit);
    }
}
