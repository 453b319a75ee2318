package com.autonomous.content.service;

import com.autonomous.content.exception.ForbiddenException;
import com.autonomous.content.exception.InvalidRequestException;
import com.autonomous.content.exception.ResourceNotFoundException;
import com.autonomous.content.model.AuditEntry;
import com.autonomous.content.model.AuditFilter;
import com.autonomous.content.model.MemberRole;
import com.autonomous.content.model.Organization;
import com.autonomous.content.model.PlanTier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.YearMonth;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OrganizationServiceTest {

    @TempDir
    Path tempDir;

    private ServiceFixture fixture;
    private OrganizationService organizations;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture(tempDir);
        organizations = fixture.organizations;
    }

    @Test
    void shouldApplyPlanDefaultsAndMakeCreatorOwner() {
        Organization org = organizations.create(Organization.builder().id("acme").name("Acme").build(), "alice");

        assertEquals(PlanTier.FREE, org.getPlan());
        assertEquals(2, org.getArticlesLimit());
        assertEquals(new BigDecimal("100.00"), org.getMonthlyBudget());
        assertEquals(new BigDecimal("5.00"), org.getPerArticleCostLimit());
        assertEquals(80, org.getAlertThreshold());
        assertEquals(YearMonth.of(2026, 10), org.getQuotaPeriod());
        assertEquals(MemberRole.OWNER, organizations.roleOf("acme", "alice").orElseThrow());
    }

    @Test
    void shouldUseExplicitLimitsOverPlan() {
        Organization org = organizations.create(Organization.builder()
            .id("acme").name("Acme").plan(PlanTier.PROFESSIONAL).monthlyBudget(new BigDecimal("42.00")).build(), "alice");

        assertEquals(new BigDecimal("42.00"), org.getMonthlyBudget());
        assertEquals(100, org.getArticlesLimit());
    }

    @Test
    void shouldAuditCreationAndPublishEvent() {
        organizations.create(Organization.builder().id("acme").name("Acme").build(), "alice");

        List<AuditEntry> entries = fixture.auditLog.query("acme", AuditFilter.forAction("organization.created"));
        assertEquals(1, entries.size());
        assertNull(entries.get(0).getOldValues());
        assertEquals("Acme", entries.get(0).getNewValues().get("name"));
        assertTrue(fixture.events.contains(new OrganizationCreatedEvent("acme")));
    }

    @Test
    void shouldRejectDuplicateIds() {
        organizations.create(Organization.builder().id("acme").name("Acme").build(), "alice");
        assertThrows(InvalidRequestException.class,
            () -> organizations.create(Organization.builder().id("acme").name("Other").build(), "bob"));
    }

    @Test
    void shouldHideSoftDeletedOrganizations() {
        organizations.create(Organization.builder().id("acme").name("Acme").build(), "alice");

        organizations.softDelete("acme", "alice");

        assertThrows(ResourceNotFoundException.class, () -> organizations.get("acme"));
        assertFalse(organizations.exists("acme"));
        assertTrue(organizations.listActive().isEmpty());
        assertEquals(1, fixture.auditLog.query("acme", AuditFilter.forAction("organization.deleted")).size());
    }

    @Test
    void shouldOnlyLetOwnerDelete() {
        organizations.create(Organization.builder().id("acme").name("Acme").build(), "alice");
        organizations.addMember("acme", "bob", MemberRole.ADMIN, "alice");

        assertThrows(ForbiddenException.class, () -> organizations.softDelete("acme", "bob"));
    }

    @Test
    void shouldRequireAdminToUpdateLimits() {
        organizations.create(Organization.builder().id("acme").name("Acme").build(), "alice");
        organizations.addMember("acme", "eve", MemberRole.EDITOR, "alice");
        OrganizationLimits limits = new OrganizationLimits(null, new BigDecimal("500.00"), null, null, null);

        assertThrows(ForbiddenException.class, () -> organizations.updateLimits("acme", limits, "eve"));

        Organization updated = organizations.updateLimits("acme", limits, "alice");
        assertEquals(new BigDecimal("500.00"), updated.getMonthlyBudget());
        AuditEntry entry = fixture.auditLog.query("acme", AuditFilter.forAction("organization.updated")).get(0);
        assertTrue(entry.getChangedFields().contains("monthlyBudget"));
        assertFalse(entry.getChangedFields().contains("articlesLimit"));
    }

    @Test
    void shouldKeepLimitsWhenValidationFails() {
        organizations.create(Organization.builder().id("acme").name("Acme").build(), "alice");

        assertThrows(InvalidRequestException.class, () -> organizations.updateLimits("acme",
            new OrganizationLimits(null, new BigDecimal("300.00"), null, null, 150), "alice"));

        Organization org = organizations.get("acme");
        assertEquals(new BigDecimal("100.00"), org.getMonthlyBudget());
        assertEquals(80, org.getAlertThreshold());
    }

    @Test
    void shouldReturnCopies() {
        organizations.create(Organization.builder().id("acme").name("Acme").build(), "alice");

        Organization copy = organizations.get("acme");
        copy.setArticlesUsed(99);
        copy.getMembers().clear();

        assertEquals(0, organizations.get("acme").getArticlesUsed());
        assertEquals(1, organizations.get("acme").getMembers().size());
    }

    @Test
    void shouldReloadFromDisk() {
        organizations.create(Organization.builder().id("acme").name("Acme").build(), "alice");

        OrganizationService reloaded = new OrganizationService(fixture.clock, fixture.auditLog, event -> { });
        reloaded.setDataPath(tempDir.toString());
        reloaded.init();

        assertEquals("Acme", reloaded.get("acme").getName());
        assertTrue(reloaded.isAdmin("acme", "alice"));
    }
}
