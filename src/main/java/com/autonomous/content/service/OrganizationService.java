package com.autonomous.content.service;

import com.autonomous.content.exception.ForbiddenException;
import com.autonomous.content.exception.InvalidRequestException;
import com.autonomous.content.exception.ResourceNotFoundException;
import com.autonomous.content.model.MemberRole;
import com.autonomous.content.model.Organization;
import com.autonomous.content.model.OrganizationMember;
import com.autonomous.content.model.PlanTier;
import com.autonomous.content.storage.JsonDocumentStore;
import com.autonomous.content.storage.JsonMappers;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/**
 * Tenant registry. Soft-deleted organizations are invisible to every lookup. Live instances are
 * only mutated through {@link #mutate}, which serializes changes per organization.
 */
@Service
public class OrganizationService {

    private static final Logger log = LoggerFactory.getLogger(OrganizationService.class);

    @Value("${pipeline.data.path:data}")
    private String dataPath;

    private final Clock clock;
    private final AuditLogService auditLog;
    private final ApplicationEventPublisher eventPublisher;
    private final Map<String, Organization> organizations = new ConcurrentHashMap<>();
    private JsonDocumentStore<Organization> documents = JsonDocumentStore.inMemory(Organization.class);

    public OrganizationService(Clock clock, AuditLogService auditLog, ApplicationEventPublisher eventPublisher) {
        this.clock = clock;
        this.auditLog = auditLog;
        this.eventPublisher = eventPublisher;
    }

    public void setDataPath(String path) {
        this.dataPath = path;
    }

    @PostConstruct
    public void init() {
        if (dataPath == null || dataPath.isBlank()) {
            return;
        }
        documents = new JsonDocumentStore<>(Paths.get(dataPath, "organizations"), Organization.class, JsonMappers.json());
        try {
            documents.loadAll().forEach(org -> organizations.put(org.getId(), org));
            log.info("Loaded {} organizations from {}", organizations.size(), dataPath);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load organizations from " + dataPath, e);
        }
    }

    /**
     * Registers a new tenant. Limits left unset are taken from the plan tier; the creator, when
     * given, becomes the owner.
     */
    public Organization create(Organization draft, String creatorUserId) {
        Organization org = draft.toBuilder()
            .members(new ArrayList<>(draft.getMembers() != null ? draft.getMembers() : List.of()))
            .build();
        if (org.getId() == null || org.getId().isBlank()) {
            org.setId(UUID.randomUUID().toString());
        }
        if (organizations.containsKey(org.getId())) {
            throw new InvalidRequestException("Organization " + org.getId() + " already exists");
        }
        applyPlanDefaults(org);
        validateLimits(org);
        org.setCurrentMonthSpend(BigDecimal.ZERO);
        org.setQuotaPeriod(YearMonth.now(clock.withZone(ZoneOffset.UTC)));
        org.setCreatedAt(clock.instant());
        org.setUpdatedAt(org.getCreatedAt());
        if (creatorUserId != null && org.getMembers().stream().noneMatch(m -> creatorUserId.equals(m.getUserId()))) {
            org.getMembers().add(new OrganizationMember(creatorUserId, MemberRole.OWNER));
        }

        if (organizations.putIfAbsent(org.getId(), org) != null) {
            throw new InvalidRequestException("Organization " + org.getId() + " already exists");
        }
        save(org);
        auditLog.recordChange(org.getId(), creatorUserId, "organization.created", "organization", org.getId(), null, org);
        eventPublisher.publishEvent(new OrganizationCreatedEvent(org.getId()));
        log.info("Created organization {} ({}, plan={})", org.getId(), org.getName(), org.getPlan().toValue());
        return copy(org);
    }

    public Organization get(String organizationId) {
        Organization org = live(organizationId);
        synchronized (org) {
            return copy(org);
        }
    }

    public boolean exists(String organizationId) {
        Organization org = organizations.get(organizationId);
        return org != null && !org.isDeleted();
    }

    public List<Organization> listActive() {
        return organizations.values().stream()
            .filter(org -> !org.isDeleted())
            .map(org -> {
                synchronized (org) {
                    return copy(org);
                }
            })
            .toList();
    }

    /**
     * Runs {@code action} against the live organization while holding its lock and persists the
     * result. Concurrent callers for the same organization are serialized.
     */
    public <T> T mutate(String organizationId, Function<Organization, T> action) {
        Organization org = live(organizationId);
        synchronized (org) {
            try {
                return action.apply(org);
            } finally {
                save(org);
            }
        }
    }

    public Organization updateLimits(String organizationId, OrganizationLimits limits, String actorId) {
        requireAdmin(organizationId, actorId);
        return mutate(organizationId, org -> {
            Organization before = copy(org);
            if (limits.plan() != null) {
                org.setPlan(limits.plan());
            }
            if (limits.monthlyBudget() != null) {
                org.setMonthlyBudget(limits.monthlyBudget());
            }
            if (limits.perArticleCostLimit() != null) {
                org.setPerArticleCostLimit(limits.perArticleCostLimit());
            }
            if (limits.articlesLimit() != null) {
                org.setArticlesLimit(limits.articlesLimit());
            }
            if (limits.alertThreshold() != null) {
                org.setAlertThreshold(limits.alertThreshold());
            }
            try {
                validateLimits(org);
            } catch (InvalidRequestException e) {
                restore(org, before);
                throw e;
            }
            org.setUpdatedAt(clock.instant());
            auditLog.recordChange(organizationId, actorId, "organization.updated", "organization", organizationId, before, org);
            return copy(org);
        });
    }

    public void softDelete(String organizationId, String actorId) {
        requireRole(organizationId, actorId, MemberRole.OWNER);
        mutate(organizationId, org -> {
            Organization before = copy(org);
            org.setDeletedAt(clock.instant());
            org.setUpdatedAt(org.getDeletedAt());
            auditLog.recordChange(organizationId, actorId, "organization.deleted", "organization", organizationId, before, org);
            return null;
        });
        log.info("Soft-deleted organization {}", organizationId);
    }

    public Organization addMember(String organizationId, String userId, MemberRole role, String actorId) {
        requireAdmin(organizationId, actorId);
        return mutate(organizationId, org -> {
            Organization before = copy(org);
            org.getMembers().removeIf(member -> member.getUserId().equals(userId));
            org.getMembers().add(new OrganizationMember(userId, role));
            org.setUpdatedAt(clock.instant());
            auditLog.recordChange(organizationId, actorId, "organization.member_added", "organization", organizationId, before, org);
            return copy(org);
        });
    }

    public Optional<MemberRole> roleOf(String organizationId, String userId) {
        if (userId == null) {
            return Optional.empty();
        }
        return get(organizationId).getMembers().stream()
            .filter(member -> userId.equals(member.getUserId()))
            .map(OrganizationMember::getRole)
            .findFirst();
    }

    public boolean isAdmin(String organizationId, String userId) {
        return roleOf(organizationId, userId).map(MemberRole::isAdmin).orElse(false);
    }

    public void requireMember(String organizationId, String actorId) {
        if (roleOf(organizationId, actorId).isEmpty()) {
            throw new ForbiddenException("User is not a member of organization " + organizationId);
        }
    }

    public void requireAdmin(String organizationId, String actorId) {
        if (!isAdmin(organizationId, actorId)) {
            throw new ForbiddenException("Organization owner or admin role required");
        }
    }

    private void requireRole(String organizationId, String actorId, MemberRole role) {
        if (roleOf(organizationId, actorId).filter(role::equals).isEmpty()) {
            throw new ForbiddenException("Organization " + role.toValue() + " role required");
        }
    }

    private Organization live(String organizationId) {
        Organization org = organizationId != null ? organizations.get(organizationId) : null;
        if (org == null || org.isDeleted()) {
            throw new ResourceNotFoundException("Organization", organizationId);
        }
        return org;
    }

    private void applyPlanDefaults(Organization org) {
        PlanTier plan = org.getPlan() != null ? org.getPlan() : PlanTier.FREE;
        org.setPlan(plan);
        if (org.getMonthlyBudget() == null) {
            org.setMonthlyBudget(plan.getMonthlyBudget());
        }
        if (org.getPerArticleCostLimit() == null) {
            org.setPerArticleCostLimit(plan.getPerArticleCostLimit());
        }
        if (org.getArticlesLimit() <= 0) {
            org.setArticlesLimit(plan.getArticlesLimit());
        }
        if (org.getAlertThreshold() <= 0) {
            org.setAlertThreshold(80);
        }
    }

    private static void validateLimits(Organization org) {
        if (org.getMonthlyBudget().signum() < 0) {
            throw new InvalidRequestException("Monthly budget must not be negative");
        }
        if (org.getPerArticleCostLimit() != null && org.getPerArticleCostLimit().signum() < 0) {
            throw new InvalidRequestException("Per-article cost limit must not be negative");
        }
        if (org.getArticlesLimit() < 0) {
            throw new InvalidRequestException("Article limit must not be negative");
        }
        if (org.getAlertThreshold() < 1 || org.getAlertThreshold() > 100) {
            throw new InvalidRequestException("Alert threshold must be between 1 and 100");
        }
    }

    private static void restore(Organization org, Organization before) {
        org.setPlan(before.getPlan());
        org.setMonthlyBudget(before.getMonthlyBudget());
        org.setPerArticleCostLimit(before.getPerArticleCostLimit());
        org.setArticlesLimit(before.getArticlesLimit());
        org.setAlertThreshold(before.getAlertThreshold());
    }

    private void save(Organization org) {
        try {
            documents.save(org.getId(), org);
        } catch (IOException e) {
            log.error("Failed to persist organization {}", org.getId(), e);
        }
    }

    private static Organization copy(Organization org) {
        return org.toBuilder().members(new ArrayList<>(org.getMembers())).build();
    }
}
