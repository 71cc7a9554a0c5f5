package com.cistrade.domain.audit;

/**
 * HTTP request details attached to an audit entry.
 */
public record RequestMetadata(
    String method,
    String path,
    String ipAddress,
    String userAgent
) {
    public static final int MAX_USER_AGENT_LENGTH = 500;

    private static final RequestMetadata NONE = new RequestMetadata("", "", null, "");

    public RequestMetadata {
        method = method == null ? "" : method;
        path = path == null ? "" : path;
        userAgent = userAgent == null ? "" : truncate(userAgent, MAX_USER_AGENT_LENGTH);
    }

    /**
     * Metadata for actions that did not originate from an HTTP request (batch jobs, system events).
     */
    public static RequestMetadata none() {
        return NONE;
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
