package com.autonomous.content.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Write-once record of one mutation. Snapshots hold the full entity value, not a diff.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEntry {
    private String id;
    private long sequence;
    private String organizationId;
    private String userId;
    private String action;
    private String entityType;
    private String entityId;
    private Map<String, Object> oldValues;
    private Map<String, Object> newValues;
    private List<String> changedFields;
    @Builder.Default
    private boolean success = true;
    private String errorMessage;
    private Instant createdAt;
}
