package com.cistrade.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Masks credentials before they reach an audit entry.
 *
 * Usage:
 * <pre>
 * AuditSanitizer sanitizer = new AuditSanitizer();
 *
 * sanitizer.sanitizeUrl("/login/?next=/home&amp;token=abc123");
 * // "/login/?next=/home&amp;token=****"
 *
 * sanitizer.sanitizeJson(body);
 * // {"username":"alice","password":"****"}
 * </pre>
 *
 * Sensitive keys are matched case-insensitively, either exactly (see
 * {@link #SENSITIVE_FIELDS}) or by containing one of the fragments password, secret,
 * token or apikey. Nested objects and arrays are walked.
 */
public class AuditSanitizer {
    public static final String MASK = "****";

    private static final Set<String> SENSITIVE_FIELDS = Set.of(
        "password", "passwd", "pwd", "secret",
        "api_key", "apikey", "api-key", "x-api-key",
        "token", "access_token", "refresh_token", "auth_token",
        "authorization", "bearer",
        "client_secret",
        "session", "sessionid", "jsessionid", "cookie", "csrfmiddlewaretoken",
        "cvv", "pin"
    );

    private static final List<String> SENSITIVE_FRAGMENTS = List.of("password", "secret", "token", "apikey", "api_key");

    private static final Pattern BEARER_TOKEN_PATTERN =
        Pattern.compile("Bearer\\s+[A-Za-z0-9\\-._~+/]+=*", Pattern.CASE_INSENSITIVE);

    private static final Pattern API_KEY_PATTERN =
        Pattern.compile("(api[_-]?key|apikey)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern TOKEN_PATTERN =
        Pattern.compile("((?:access[_-]?|refresh[_-]?|auth[_-]?)?token)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern PASSWORD_PATTERN =
        Pattern.compile("(password|passwd|pwd)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    private static final Pattern SECRET_PATTERN =
        Pattern.compile("((?:client[_-]?)?secret)=[^&\\s]+", Pattern.CASE_INSENSITIVE);

    /**
     * Mask bearer tokens and sensitive key=value pairs in free text.
     */
    public String sanitize(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }

        String result = input;
        result = BEARER_TOKEN_PATTERN.matcher(result).replaceAll("Bearer " + MASK);
        result = API_KEY_PATTERN.matcher(result).replaceAll("$1=" + MASK);
        result = TOKEN_PATTERN.matcher(result).replaceAll("$1=" + MASK);
        result = PASSWORD_PATTERN.matcher(result).replaceAll("$1=" + MASK);
        result = SECRET_PATTERN.matcher(result).replaceAll("$1=" + MASK);
        return result;
    }

    /**
     * Mask sensitive query parameters, leaving the path untouched.
     */
    public String sanitizeUrl(String url) {
        if (url == null || url.isBlank()) {
            return url;
        }

        int queryIndex = url.indexOf('?');
        if (queryIndex == -1) {
            return url;
        }

        return url.substring(0, queryIndex) + "?" + sanitize(url.substring(queryIndex + 1));
    }

    /**
     * Copy of {@code node} with the values of sensitive keys replaced by {@link #MASK}.
     * The input is not modified.
     */
    public JsonNode sanitizeJson(JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode copy = node.deepCopy();
        maskInPlace(copy);
        return copy;
    }

    public boolean isSensitiveField(String fieldName) {
        if (fieldName == null) {
            return false;
        }
        String lower = fieldName.toLowerCase(Locale.ROOT);
        if (SENSITIVE_FIELDS.contains(lower)) {
            return true;
        }
        for (String fragment : SENSITIVE_FRAGMENTS) {
            if (lower.contains(fragment)) {
                return true;
            }
        }
        return false;
    }

    private void maskInPlace(JsonNode node) {
        if (node instanceof ObjectNode) {
            ObjectNode obj = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            obj.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (isSensitiveField(name)) {
                    obj.put(name, MASK);
                } else {
                    maskInPlace(obj.get(name));
                }
            }
        } else if (node instanceof ArrayNode) {
            for (JsonNode element : node) {
                maskInPlace(element);
            }
        }
    }
}
