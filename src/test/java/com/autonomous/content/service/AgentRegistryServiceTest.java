package com.autonomous.content.service;

import com.autonomous.content.exception.ForbiddenException;
import com.autonomous.content.exception.InvalidRequestException;
import com.autonomous.content.model.AgentConfig;
import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.AuditFilter;
import com.autonomous.content.model.MemberRole;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AgentRegistryServiceTest {

    @TempDir
    Path tempDir;

    private ServiceFixture fixture;
    private AgentRegistryService registry;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture(tempDir);
        registry = fixture.agentRegistry;
        fixture.createOrganization("acme", "100.00", 10, "alice");
    }

    @Test
    void shouldSeedOneRowPerAgentOnCreation() {
        List<AgentConfig> configs = registry.list("acme");

        assertEquals(5, configs.size());
        assertEquals(List.of(AgentKind.values()), configs.stream().map(AgentConfig::getAgentKind).toList());
        AgentConfig topic = registry.get("acme", AgentKind.TOPIC_ANALYSIS);
        assertTrue(topic.isEnabled());
        assertEquals(300, topic.getTimeoutSeconds());
        assertEquals(3, topic.getMaxRetries());
        assertEquals(new BigDecimal("1.00"), topic.getMaxCost());
        assertEquals("gpt-4-turbo-preview", topic.getModel());
        assertEquals(100, topic.getRunsPerHour());
        assertEquals(1000, topic.getRunsPerDay());
        assertEquals("claude-3-5-sonnet-20241022", registry.get("acme", AgentKind.ARTICLE_GENERATION).getModel());
    }

    @Test
    void shouldSeedIdempotently() {
        assertTrue(registry.seedDefaults("acme").isEmpty());
        assertEquals(5, registry.list("acme").size());
    }

    @Test
    void shouldFailLoudlyForMissingRow() {
        assertThrows(IllegalStateException.class, () -> registry.get("unknown-org", AgentKind.PUBLISH));
    }

    @Test
    void shouldRestrictUpdatesToAdmins() {
        fixture.addMember("acme", "eve", MemberRole.EDITOR, "alice");
        AgentConfigUpdate disable = new AgentConfigUpdate(false, null, null, null, null, null, null);

        assertThrows(ForbiddenException.class, () -> registry.update("acme", AgentKind.PUBLISH, disable, "eve"));
        assertTrue(registry.get("acme", AgentKind.PUBLISH).isEnabled());
    }

    @Test
    void shouldApplyPartialUpdateAndAudit() {
        AgentConfig updated = registry.update("acme", AgentKind.LEGAL_FACT_CHECK,
            new AgentConfigUpdate(null, 60, 1, null, "claude-3-haiku", null, null), "alice");

        assertEquals(60, updated.getTimeoutSeconds());
        assertEquals(1, updated.getMaxRetries());
        assertEquals("claude-3-haiku", updated.getModel());
        assertTrue(updated.isEnabled());
        assertEquals(1, fixture.auditLog.query("acme", AuditFilter.forAction("agent_config.updated")).size());
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThrows(InvalidRequestException.class, () -> registry.update("acme", AgentKind.PUBLISH,
            new AgentConfigUpdate(null, 0, null, null, null, null, null), "alice"));
        assertEquals(300, registry.get("acme", AgentKind.PUBLISH).getTimeoutSeconds());
    }

    @Test
    void shouldEstimateFromEnabledAgents() {
        assertEquals(new BigDecimal("5.00"), registry.estimateCost("acme"));

        registry.update("acme", AgentKind.PUBLISH, new AgentConfigUpdate(false, null, null, null, null, null, null), "alice");

        assertEquals(new BigDecimal("4.00"), registry.estimateCost("acme"));
    }

    @Test
    void shouldDeriveProviderFromModel() {
        assertEquals("anthropic", registry.get("acme", AgentKind.ARTICLE_GENERATION).providerService());
        assertEquals("openai", registry.get("acme", AgentKind.TOPIC_ANALYSIS).providerService());
    }

    @Test
    void shouldReloadFromDisk() {
        registry.update("acme", AgentKind.PUBLISH, new AgentConfigUpdate(false, null, null, null, null, null, null), "alice");

        AgentRegistryService reloaded = new AgentRegistryService(fixture.clock, fixture.organizations, fixture.auditLog);
        reloaded.setDataPath(tempDir.toString());
        reloaded.init();

        assertFalse(reloaded.get("acme", AgentKind.PUBLISH).isEnabled());
        assertTrue(reloaded.get("acme", AgentKind.COMPETITOR_MONITORING).isEnabled());
    }
}
