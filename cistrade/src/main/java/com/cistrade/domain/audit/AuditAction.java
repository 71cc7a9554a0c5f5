package com.cistrade.domain.audit;

import java.util.Locale;

/**
 * Kind of action recorded in the audit log.
 */
public enum AuditAction {
    CREATE,
    READ,
    UPDATE,
    DELETE,
    APPROVE,
    REJECT,
    SUBMIT,
    LOGIN,
    LOGOUT,
    ACCESS_DENIED,
    EXPORT,
    IMPORT;

    /**
     * Parse an action name, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static AuditAction parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        return AuditAction.valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
