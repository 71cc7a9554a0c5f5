package com.cistrade.application.port.output;

import com.cistrade.domain.audit.AuditEntry;
import com.cistrade.domain.audit.AuditQuery;
import com.cistrade.domain.audit.AuditStatistics;
import com.cistrade.domain.common.DbResult;

import java.util.List;

/**
 * Repository port for audit entries.
 * Implementations never throw for database failures; they return a failed result.
 */
public interface AuditRepository {

    /**
     * Persist one entry.
     */
    DbResult<Void> save(AuditEntry entry);

    /**
     * Persist each entry in turn. One failed entry does not stop the rest.
     *
     * @return the number of entries saved; a failure only when there was at least one
     *         entry and none of them could be saved
     */
    default DbResult<Integer> saveAll(List<AuditEntry> entries) {
        if (entries == null || entries.isEmpty()) {
            return DbResult.ok(0);
        }
        int saved = 0;
        DbResult<Void> lastFailure = null;
        for (AuditEntry entry : entries) {
            DbResult<Void> result = save(entry);
            if (result.isSuccess()) {
                saved++;
            } else {
                lastFailure = result;
            }
        }
        if (saved == 0 && lastFailure != null) {
            return DbResult.fail(lastFailure.error(),
                "0/" + entries.size() + " entries saved: " + lastFailure.message());
        }
        return DbResult.ok(saved);
    }

    /**
     * Most recent entries matching {@code query}, newest first.
     */
    DbResult<List<AuditEntry>> findRecent(AuditQuery query);

    /**
     * Activity over the last {@code days} days.
     *
     * @throws IllegalArgumentException if {@code days} is outside 1..{@link AuditStatistics#MAX_DAYS}
     */
    DbResult<AuditStatistics> statistics(int days);
}
