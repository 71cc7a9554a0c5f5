package com.cistrade.transport.http;

import com.cistrade.application.port.input.AuditRecorder;
import com.cistrade.domain.audit.AuditAction;
import com.cistrade.domain.audit.AuditEntry;
import com.cistrade.domain.audit.AuditOutcome;
import com.cistrade.domain.audit.RequestMetadata;
import com.cistrade.security.AuditSanitizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.HttpString;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.ZoneId;

/**
 * Wraps another handler and records an audit entry once the exchange completes.
 *
 * The entry is built from the finished response so the status code is known. Nothing
 * thrown while auditing reaches the client.
 */
public final class AuditHttpHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(AuditHttpHandler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String OBJECT_TYPE = "HTTP_REQUEST";
    public static final HttpString AUTH_USER_HEADER = HttpString.tryFromString("X-Auth-User");
    public static final HttpString FORWARDED_FOR_HEADER = HttpString.tryFromString("X-Forwarded-For");

    private final HttpHandler next;
    private final AuditRecorder recorder;
    private final AuditRequestClassifier classifier;
    private final AuditSanitizer sanitizer;
    private final ZoneId partitionZone;

    public AuditHttpHandler(
            HttpHandler next,
            AuditRecorder recorder,
            AuditRequestClassifier classifier,
            AuditSanitizer sanitizer,
            ZoneId partitionZone) {
        this.next = next;
        this.recorder = recorder;
        this.classifier = classifier;
        this.sanitizer = sanitizer;
        this.partitionZone = partitionZone;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) throws Exception {
        String method = exchange.getRequestMethod().toString();
        String path = exchange.getRequestPath();

        if (classifier.shouldAudit(method, path)) {
            exchange.addExchangeCompleteListener((ex, nextListener) -> {
                try {
                    recorder.record(toEntry(ex));
                } catch (RuntimeException e) {
                    log.error("[AuditHttp] Failed to create audit entry for {} {}: {}", method, path, e.getMessage());
                } finally {
                    nextListener.proceed();
                }
            });
        }

        next.handleRequest(exchange);
    }

    AuditEntry toEntry(HttpServerExchange exchange) {
        String method = exchange.getRequestMethod().toString();
        String path = exchange.getRequestPath();
        String query = exchange.getQueryString();
        String fullPath = query == null || query.isEmpty() ? path : path + "?" + query;
        String safePath = sanitizer.sanitizeUrl(fullPath);
        int status = exchange.getStatusCode();

        InetSocketAddress peer = exchange.getSourceAddress();
        String peerAddress = peer == null || peer.getAddress() == null ? null : peer.getAddress().getHostAddress();
        String ip = classifier.clientIp(exchange.getRequestHeaders().getFirst(FORWARDED_FOR_HEADER), peerAddress);
        String userAgent = exchange.getRequestHeaders().getFirst(Headers.USER_AGENT);
        String user = exchange.getRequestHeaders().getFirst(AUTH_USER_HEADER);

        AuditAction action = classifier.actionFor(method, path);

        ObjectNode additional = MAPPER.createObjectNode();
        additional.put("status_code", status);
        String contentType = exchange.getResponseHeaders().getFirst(Headers.CONTENT_TYPE);
        additional.put("content_type", contentType == null ? "" : contentType);

        return AuditEntry.builder(action, OBJECT_TYPE)
            .partitionZone(partitionZone)
            .actor(user, user)
            .severity(classifier.severityFor(status))
            .objectId(path)
            .objectRepr(method + " " + path)
            .description(method + " request to " + safePath)
            .request(new RequestMetadata(method, safePath, ip, userAgent))
            .outcome(AuditOutcome.fromStatus(status))
            .additionalData(additional)
            .build();
    }
}
