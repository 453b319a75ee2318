package com.autonomous.content.model;

import java.time.Instant;

/**
 * Query filter for the audit log. Every field is optional; null means no filter on that field.
 *
 * @param action action prefix, e.g. {@code "pipeline."} or {@code "budget.threshold_alert"}
 * @param limit maximum number of entries, keeping the most recent; null or non-positive for all
 */
public record AuditFilter(
    String action,
    String entityType,
    String entityId,
    String userId,
    Instant from,
    Instant to,
    Integer limit) {

    public static AuditFilter all() {
        return new AuditFilter(null, null, null, null, null, null, null);
    }

    public static AuditFilter forAction(String action) {
        return new AuditFilter(action, null, null, null, null, null, null);
    }

    public boolean matches(AuditEntry entry) {
        return (action == null || entry.getAction().startsWith(action))
            && (entityType == null || entityType.equals(entry.getEntityType()))
            && (entityId == null || entityId.equals(entry.getEntityId()))
            && (userId == null || userId.equals(entry.getUserId()))
            && (from == null || !entry.getCreatedAt().isBefore(from))
            && (to == null || entry.getCreatedAt().isBefore(to));
    }
}
