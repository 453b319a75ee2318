package com.autonomous.content.controller;

import com.autonomous.content.exception.InvalidRequestException;
import com.autonomous.content.model.AgentConfig;
import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.AuditEntry;
import com.autonomous.content.model.AuditFilter;
import com.autonomous.content.model.CredentialHandle;
import com.autonomous.content.model.Organization;
import com.autonomous.content.model.PlanTier;
import com.autonomous.content.model.ServiceCostSummary;
import com.autonomous.content.model.SpendSummary;
import com.autonomous.content.service.AgentConfigUpdate;
import com.autonomous.content.service.AgentRegistryService;
import com.autonomous.content.service.AuditLogService;
import com.autonomous.content.service.BudgetGuardService;
import com.autonomous.content.service.CostLedgerService;
import com.autonomous.content.service.CredentialVault;
import com.autonomous.content.service.OrganizationLimits;
import com.autonomous.content.service.OrganizationService;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.time.YearMonth;
import java.util.List;

@RestController
@RequestMapping("/api/organizations")
public class OrganizationController {

    static final String USER_HEADER = "X-User-Id";

    private final OrganizationService organizations;
    private final BudgetGuardService budgetGuard;
    private final CostLedgerService costLedger;
    private final AuditLogService auditLog;
    private final AgentRegistryService agentRegistry;
    private final CredentialVault vault;

    public OrganizationController(OrganizationService organizations, BudgetGuardService budgetGuard,
                                  CostLedgerService costLedger, AuditLogService auditLog,
                                  AgentRegistryService agentRegistry, CredentialVault vault) {
        this.organizations = organizations;
        this.budgetGuard = budgetGuard;
        this.costLedger = costLedger;
        this.auditLog = auditLog;
        this.agentRegistry = agentRegistry;
        this.vault = vault;
    }

    @PostMapping
    public ResponseEntity<Organization> create(@RequestHeader(USER_HEADER) String userId,
                                               @RequestBody CreateOrganizationRequest request) {
        if (request.name() == null || request.name().isBlank()) {
            throw new InvalidRequestException("Organization name is required");
        }
        Organization draft = Organization.builder()
            .id(request.id())
            .name(request.name())
            .plan(request.plan() != null ? request.plan() : PlanTier.FREE)
            .monthlyBudget(request.monthlyBudget())
            .perArticleCostLimit(request.perArticleCostLimit())
            .articlesLimit(request.articlesLimit() != null ? request.articlesLimit() : 0)
            .alertThreshold(request.alertThreshold() != null ? request.alertThreshold() : 80)
            .build();
        return ResponseEntity.status(HttpStatus.CREATED).body(organizations.create(draft, userId));
    }

    @GetMapping("/{orgId}")
    public Organization get(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId) {
        organizations.requireMember(orgId, userId);
        return organizations.get(orgId);
    }

    @DeleteMapping("/{orgId}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId) {
        organizations.softDelete(orgId, userId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{orgId}/members")
    public Organization addMember(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId,
                                  @RequestBody AddMemberRequest request) {
        if (request.userId() == null || request.role() == null) {
            throw new InvalidRequestException("userId and role are required");
        }
        return organizations.addMember(orgId, request.userId(), request.role(), userId);
    }

    @PatchMapping("/{orgId}/limits")
    public Organization updateLimits(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId,
                                     @RequestBody OrganizationLimits limits) {
        return organizations.updateLimits(orgId, limits, userId);
    }

    @GetMapping("/{orgId}/spend")
    public SpendSummary spend(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId) {
        organizations.requireMember(orgId, userId);
        return budgetGuard.monthlySpend(orgId);
    }

    @GetMapping("/{orgId}/spend/services")
    public List<ServiceCostSummary> spendByService(@RequestHeader(USER_HEADER) String userId,
                                                   @PathVariable String orgId,
                                                   @RequestParam(required = false) String month) {
        organizations.requireMember(orgId, userId);
        YearMonth billingMonth = month != null ? YearMonth.parse(month) : costLedger.currentMonth();
        return costLedger.summaryByService(orgId, billingMonth);
    }

    @GetMapping("/{orgId}/audit")
    public List<AuditEntry> audit(@RequestHeader(USER_HEADER) String userId,
                                  @PathVariable String orgId,
                                  @RequestParam(required = false) String action,
                                  @RequestParam(required = false) String entityType,
                                  @RequestParam(required = false) String entityId,
                                  @RequestParam(name = "user", required = false) String actor,
                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                  @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to,
                                  @RequestParam(required = false) Integer limit) {
        organizations.requireAdmin(orgId, userId);
        return auditLog.query(orgId, new AuditFilter(action, entityType, entityId, actor, from, to, limit));
    }

    @GetMapping("/{orgId}/agents")
    public List<AgentConfig> agents(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId) {
        organizations.requireMember(orgId, userId);
        return agentRegistry.list(orgId);
    }

    @GetMapping("/{orgId}/agents/{kind}")
    public AgentConfig agent(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId,
                             @PathVariable String kind) {
        organizations.requireMember(orgId, userId);
        return agentRegistry.get(orgId, AgentKind.fromName(kind));
    }

    @PutMapping("/{orgId}/agents/{kind}")
    public AgentConfig updateAgent(@RequestHeader(USER_HEADER) String userId, @PathVariable String orgId,
                                   @PathVariable String kind, @RequestBody AgentConfigUpdate changes) {
        return agentRegistry.update(orgId, AgentKind.fromName(kind), changes, userId);
    }

    @PostMapping("/{orgId}/api-keys")
    public ResponseEntity<CredentialHandle> storeApiKey(@RequestHeader(USER_HEADER) String userId,
                                                        @PathVariable String orgId,
                                                        @RequestBody StoreApiKeyRequest request) {
        CredentialHandle handle = vault.store(orgId, request.service(), request.apiKey(), userId);
        return ResponseEntity.status(HttpStatus.CREATED).body(handle);
    }

    @DeleteMapping("/{orgId}/api-keys/{service}")
    public ResponseEntity<Void> revokeApiKey(@RequestHeader(USER_HEADER) String userId,
                                             @PathVariable String orgId, @PathVariable String service) {
        vault.revoke(orgId, service, userId);
        return ResponseEntity.noContent().build();
    }
}
