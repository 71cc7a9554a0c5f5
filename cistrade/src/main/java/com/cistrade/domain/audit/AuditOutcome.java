package com.cistrade.domain.audit;

/**
 * Whether the audited action succeeded.
 *
 * @param success    true when the action completed normally
 * @param message    failure reason or short confirmation, may be empty
 * @param statusCode HTTP status of the response, 0 when not an HTTP action
 */
public record AuditOutcome(boolean success, String message, int statusCode) {

    public AuditOutcome {
        message = message == null ? "" : message;
    }

    public static AuditOutcome succeeded() {
        return new AuditOutcome(true, "", 0);
    }

    public static AuditOutcome failure(String message) {
        return new AuditOutcome(false, message, 0);
    }

    /**
     * Outcome of an HTTP request: anything below 400 counts as success.
     */
    public static AuditOutcome fromStatus(int statusCode) {
        return new AuditOutcome(statusCode < 400, "", statusCode);
    }
}
