package com.autonomous.content.service;

import com.autonomous.content.model.CostEntry;
import com.autonomous.content.model.MemberRole;
import com.autonomous.content.model.Organization;
import com.autonomous.content.support.MutableClock;
import com.autonomous.content.support.RecordingNotifier;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The services below the orchestrator wired by hand, with events dispatched the way the
 * application context would.
 */
public class ServiceFixture {

    public static final String MASTER_KEY = "MDEyMzQ1Njc4OWFiY2RlZjAxMjM0NTY3ODlhYmNkZWY=";
    public static final Instant START = Instant.parse("2026-10-15T10:00:00Z");

    public final MutableClock clock = new MutableClock(START);
    public final List<Object> events = new CopyOnWriteArrayList<>();
    public final RecordingNotifier notifier = new RecordingNotifier();
    public final AuditLogService auditLog;
    public final CostLedgerService costLedger;
    public final OrganizationService organizations;
    public final AgentRegistryService agentRegistry;
    public final BudgetGuardService budgetGuard;
    public final RateLimiterService rateLimiter;
    public final CredentialVault vault;

    public ServiceFixture(Path dataDir) {
        String dataPath = dataDir.toString();
        auditLog = new AuditLogService(clock);
        auditLog.setDataPath(dataPath);
        auditLog.init();

        costLedger = new CostLedgerService(clock, this::dispatch);
        costLedger.setDataPath(dataPath);
        costLedger.init();

        organizations = new OrganizationService(clock, auditLog, this::dispatch);
        organizations.setDataPath(dataPath);
        organizations.init();

        agentRegistry = new AgentRegistryService(clock, organizations, auditLog);
        agentRegistry.setDataPath(dataPath);
        agentRegistry.init();

        budgetGuard = new BudgetGuardService(organizations, costLedger, auditLog, notifier);
        rateLimiter = new RateLimiterService(100, Duration.ofHours(1), clock, auditLog);
        vault = new CredentialVault(MASTER_KEY, organizations, auditLog);
        vault.setDataPath(dataPath);
        vault.init();
    }

    public Organization createOrganization(String id, String budget, int articlesLimit, String ownerId) {
        return organizations.create(Organization.builder()
            .id(id)
            .name(id)
            .monthlyBudget(new BigDecimal(budget))
            .articlesLimit(articlesLimit)
            .build(), ownerId);
    }

    public void addMember(String organizationId, String userId, MemberRole role, String ownerId) {
        organizations.addMember(organizationId, userId, role, ownerId);
    }

    public CostEntry spend(String organizationId, String amount) {
        return costLedger.record(CostEntry.builder()
            .organizationId(organizationId)
            .service("anthropic")
            .amount(new BigDecimal(amount))
            .build());
    }

    private void dispatch(Object event) {
        events.add(event);
        if (event instanceof OrganizationCreatedEvent created) {
            agentRegistry.onOrganizationCreated(created);
        } else if (event instanceof CostRecordedEvent recorded) {
            budgetGuard.onCostRecorded(recorded);
        }
    }
}
