package com.cistrade.transport.http;

import com.cistrade.domain.audit.AuditAction;
import com.cistrade.domain.audit.AuditSeverity;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Decides which HTTP requests are audited and how they are labelled.
 *
 * Audited: modifying methods (POST, PUT, PATCH, DELETE) and anything under a login or
 * logout path. Static assets, the metrics scrape and the health check are never audited.
 */
public final class AuditRequestClassifier {

    private static final Set<String> AUDIT_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");

    private static final List<String> EXCLUDE_PREFIXES = List.of(
        "/static/",
        "/media/",
        "/metrics",
        "/api/health"
    );

    public boolean shouldAudit(String method, String path) {
        if (path == null) {
            return false;
        }
        for (String prefix : EXCLUDE_PREFIXES) {
            if (path.startsWith(prefix)) {
                return false;
            }
        }
        if (method != null && AUDIT_METHODS.contains(method.toUpperCase(Locale.ROOT))) {
            return true;
        }
        return isLogin(path) || isLogout(path);
    }

    public AuditAction actionFor(String method, String path) {
        if (isLogin(path)) {
            return AuditAction.LOGIN;
        }
        if (isLogout(path)) {
            return AuditAction.LOGOUT;
        }
        String m = method == null ? "" : method.toUpperCase(Locale.ROOT);
        return switch (m) {
            case "POST" -> AuditAction.CREATE;
            case "PUT", "PATCH" -> AuditAction.UPDATE;
            case "DELETE" -> AuditAction.DELETE;
            default -> AuditAction.READ;
        };
    }

    public AuditSeverity severityFor(int statusCode) {
        return statusCode < 400 ? AuditSeverity.INFO : AuditSeverity.WARNING;
    }

    /**
     * First hop of {@code X-Forwarded-For} if present, otherwise the peer address.
     */
    public String clientIp(String forwardedFor, String peerAddress) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return peerAddress;
    }

    private static boolean isLogin(String path) {
        return path != null && path.contains("/login/");
    }

    private static boolean isLogout(String path) {
        return path != null && path.contains("/logout/");
    }
}
