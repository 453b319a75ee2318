package com.autonomous.content.service;

import com.autonomous.content.exception.AuditWriteException;
import com.autonomous.content.model.AuditEntry;
import com.autonomous.content.model.AuditFilter;
import com.autonomous.content.storage.JsonLinesLog;
import com.autonomous.content.storage.JsonMappers;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only audit trail. {@link #append} returns only after the entry is durable, so the
 * operation that triggered it can be considered committed once the call returns.
 */
@Service
public class AuditLogService {

    private static final Logger log = LoggerFactory.getLogger(AuditLogService.class);

    private static final String SYSTEM_SCOPE = "_system";
    private static final TypeReference<Map<String, Object>> SNAPSHOT_TYPE = new TypeReference<>() {};

    @Value("${pipeline.data.path:data}")
    private String dataPath;

    private final Clock clock;
    private final ObjectMapper mapper = JsonMappers.json();
    private final Map<String, List<AuditEntry>> entriesByOrganization = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final AtomicLong failedWrites = new AtomicLong();
    private JsonLinesLog<AuditEntry> auditFile = JsonLinesLog.inMemory(AuditEntry.class);

    public AuditLogService(Clock clock) {
        this.clock = clock;
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    @PostConstruct
    public void init() {
        if (dataPath == null || dataPath.isBlank()) {
            return;
        }
        auditFile = new JsonLinesLog<>(Paths.get(dataPath, "audit.jsonl"), AuditEntry.class, mapper);
        try {
            for (AuditEntry entry : auditFile.readAll()) {
                scope(entry.getOrganizationId()).add(entry);
                sequence.accumulateAndGet(entry.getSequence(), Math::max);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load audit log from " + dataPath, e);
        }
    }

    public synchronized AuditEntry append(AuditEntry entry) {
        entry.setId(UUID.randomUUID().toString());
        entry.setSequence(sequence.incrementAndGet());
        if (entry.getCreatedAt() == null) {
            entry.setCreatedAt(clock.instant());
        }
        try {
            auditFile.append(entry);
        } catch (IOException e) {
            failedWrites.incrementAndGet();
            log.error("Audit write failed: action={}, entity={}/{}",
                entry.getAction(), entry.getEntityType(), entry.getEntityId(), e);
            throw new AuditWriteException(entry.getAction(), e);
        }
        scope(entry.getOrganizationId()).add(entry);
        log.debug("Recorded audit entry: action={}, entity={}/{}, user={}",
            entry.getAction(), entry.getEntityType(), entry.getEntityId(), entry.getUserId());
        return entry;
    }

    /**
     * Records a create, update or delete with full snapshots of both sides. Either side may be
     * null.
     */
    public AuditEntry recordChange(String organizationId, String userId, String action,
                                   String entityType, String entityId, Object before, Object after) {
        Map<String, Object> oldValues = snapshot(before);
        Map<String, Object> newValues = snapshot(after);
        return append(AuditEntry.builder()
            .organizationId(organizationId)
            .userId(userId)
            .action(action)
            .entityType(entityType)
            .entityId(entityId)
            .oldValues(oldValues)
            .newValues(newValues)
            .changedFields(changedFields(oldValues, newValues))
            .build());
    }

    public AuditEntry recordEvent(String organizationId, String userId, String action,
                                  String entityType, String entityId, Map<String, Object> details) {
        return append(AuditEntry.builder()
            .organizationId(organizationId)
            .userId(userId)
            .action(action)
            .entityType(entityType)
            .entityId(entityId)
            .newValues(details)
            .build());
    }

    public AuditEntry recordFailure(String organizationId, String userId, String action,
                                    String entityType, String entityId, String errorMessage) {
        return append(AuditEntry.builder()
            .organizationId(organizationId)
            .userId(userId)
            .action(action)
            .entityType(entityType)
            .entityId(entityId)
            .success(false)
            .errorMessage(errorMessage)
            .build());
    }

    /**
     * Entries for one organization in creation order. A filter limit keeps the most recent
     * entries.
     */
    public List<AuditEntry> query(String organizationId, AuditFilter filter) {
        List<AuditEntry> scoped = entriesByOrganization.getOrDefault(organizationId, List.of());
        List<AuditEntry> matches;
        synchronized (scoped) {
            matches = scoped.stream().filter(filter::matches).toList();
        }
        Integer limit = filter.limit();
        if (limit != null && limit > 0 && matches.size() > limit) {
            matches = matches.subList(matches.size() - limit, matches.size());
        }
        return List.copyOf(matches);
    }

    public Map<String, Object> snapshot(Object value) {
        if (value == null) {
            return null;
        }
        return mapper.convertValue(value, SNAPSHOT_TYPE);
    }

    public long getFailedWriteCount() {
        return failedWrites.get();
    }

    private List<AuditEntry> scope(String organizationId) {
        return entriesByOrganization.computeIfAbsent(
            organizationId != null ? organizationId : SYSTEM_SCOPE,
            k -> Collections.synchronizedList(new ArrayList<>()));
    }

    private static List<String> changedFields(Map<String, Object> oldValues, Map<String, Object> newValues) {
        Set<String> keys = new LinkedHashSet<>();
        if (oldValues != null) {
            keys.addAll(oldValues.keySet());
        }
        if (newValues != null) {
            keys.addAll(newValues.keySet());
        }
        List<String> changed = new ArrayList<>();
        for (String key : keys) {
            Object before = oldValues != null ? oldValues.get(key) : null;
            Object after = newValues != null ? newValues.get(key) : null;
            if (!Objects.equals(before, after)) {
                changed.add(key);
            }
        }
        return changed;
    }
}
