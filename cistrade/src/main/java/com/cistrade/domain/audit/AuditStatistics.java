package com.cistrade.domain.audit;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Audit activity since {@code fromDate}: a total plus counts per action, object type and user.
 * Breakdown maps keep the order they were given in (largest count first when read from the database).
 */
public record AuditStatistics(
    int days,
    LocalDate fromDate,
    long totalCount,
    Map<String, Long> byAction,
    Map<String, Long> byObjectType,
    Map<String, Long> byUser
) {
    public static final int DEFAULT_DAYS = 30;
    public static final int MAX_DAYS = 366;

    public AuditStatistics {
        checkDays(days);
        byAction = copy(byAction);
        byObjectType = copy(byObjectType);
        byUser = copy(byUser);
    }

    /**
     * @throws IllegalArgumentException unless 1 &lt;= days &lt;= {@link #MAX_DAYS}
     */
    public static int checkDays(int days) {
        if (days < 1 || days > MAX_DAYS) {
            throw new IllegalArgumentException("days must be between 1 and " + MAX_DAYS + ", got " + days);
        }
        return days;
    }

    private static Map<String, Long> copy(Map<String, Long> counts) {
        return counts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }
}
