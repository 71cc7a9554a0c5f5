package com.cistrade.domain.audit;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Objects;
import java.util.UUID;

/**
 * One user or system action, as written to the audit table.
 *
 * Entries are built once when the action completes and are never modified afterwards.
 * JSON snapshots are deep-copied on construction, so later changes to the caller's
 * nodes do not leak into the entry.
 */
public record AuditEntry(
    String entryId,
    Instant eventTime,
    LocalDate partitionDate,

    // Actor
    String userId,           // null for anonymous and system actions
    String username,

    // Action
    AuditAction action,
    AuditSeverity severity,

    // Target
    String objectType,
    String objectId,
    String objectRepr,

    // Before / after
    JsonNode oldValue,
    JsonNode newValue,
    JsonNode changes,

    // Context
    RequestMetadata request,
    AuditOutcome outcome,
    String description,
    JsonNode additionalData,
    boolean requiresApproval
) {
    public static final String ANONYMOUS = "anonymous";

    public AuditEntry {
        Objects.requireNonNull(entryId, "entryId");
        Objects.requireNonNull(eventTime, "eventTime");
        Objects.requireNonNull(partitionDate, "partitionDate");
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(objectType, "objectType");
        username = username == null || username.isBlank() ? ANONYMOUS : username;
        severity = severity == null ? AuditSeverity.INFO : severity;
        objectId = objectId == null ? "" : objectId;
        objectRepr = objectRepr == null ? "" : objectRepr;
        oldValue = copy(oldValue);
        newValue = copy(newValue);
        changes = copy(changes);
        request = request == null ? RequestMetadata.none() : request;
        outcome = outcome == null ? AuditOutcome.succeeded() : outcome;
        description = description == null ? "" : description;
        additionalData = copy(additionalData);
    }

    public static Builder builder(AuditAction action, String objectType) {
        return new Builder(action, objectType);
    }

    private static JsonNode copy(JsonNode node) {
        return node == null || node.isNull() ? null : node.deepCopy();
    }

    public static final class Builder {
        private final AuditAction action;
        private final String objectType;
        private String entryId;
        private Instant eventTime;
        private ZoneId partitionZone = ZoneOffset.UTC;
        private String userId;
        private String username;
        private AuditSeverity severity = AuditSeverity.INFO;
        private String objectId;
        private String objectRepr;
        private JsonNode oldValue;
        private JsonNode newValue;
        private RequestMetadata request;
        private AuditOutcome outcome;
        private String description;
        private JsonNode additionalData;
        private boolean requiresApproval;

        private Builder(AuditAction action, String objectType) {
            this.action = Objects.requireNonNull(action, "action");
            this.objectType = Objects.requireNonNull(objectType, "objectType");
        }

        public Builder entryId(String entryId) { this.entryId = entryId; return this; }
        public Builder eventTime(Instant eventTime) { this.eventTime = eventTime; return this; }
        public Builder partitionZone(ZoneId zone) { this.partitionZone = zone; return this; }
        public Builder actor(String userId, String username) {
            this.userId = userId;
            this.username = username;
            return this;
        }
        public Builder severity(AuditSeverity severity) { this.severity = severity; return this; }
        public Builder objectId(Object objectId) {
            this.objectId = objectId == null ? null : String.valueOf(objectId);
            return this;
        }
        public Builder objectRepr(String objectRepr) { this.objectRepr = objectRepr; return this; }
        public Builder oldValue(JsonNode oldValue) { this.oldValue = oldValue; return this; }
        public Builder newValue(JsonNode newValue) { this.newValue = newValue; return this; }
        public Builder request(RequestMetadata request) { this.request = request; return this; }
        public Builder outcome(AuditOutcome outcome) { this.outcome = outcome; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder additionalData(JsonNode additionalData) { this.additionalData = additionalData; return this; }
        public Builder requiresApproval(boolean requiresApproval) { this.requiresApproval = requiresApproval; return this; }

        /**
         * Build the entry. Missing id and event time default to a random UUID and now;
         * the partition date is the event time's calendar date in the partition zone.
         */
        public AuditEntry build() {
            Instant ts = eventTime != null ? eventTime : Instant.now();
            String id = entryId != null ? entryId : UUID.randomUUID().toString();
            LocalDate partitionDate = LocalDate.ofInstant(ts, partitionZone);
            return new AuditEntry(
                id, ts, partitionDate,
                userId, username,
                action, severity,
                objectType, objectId, objectRepr,
                oldValue, newValue, FieldChanges.diff(oldValue, newValue),
                request, outcome, description, additionalData, requiresApproval
            );
        }
    }
}
