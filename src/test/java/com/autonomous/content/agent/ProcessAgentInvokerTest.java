package com.autonomous.content.agent;

import com.autonomous.content.model.AgentInvocation;
import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.AgentResult;
import com.autonomous.content.model.CredentialHandle;
import com.autonomous.content.service.ServiceFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.env.MockEnvironment;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessAgentInvokerTest {

    @TempDir
    Path tempDir;

    private ServiceFixture fixture;
    private MockEnvironment environment;
    private ProcessAgentInvoker invoker;

    @BeforeEach
    void setUp() {
        fixture = new ServiceFixture(tempDir);
        environment = new MockEnvironment();
        invoker = new ProcessAgentInvoker(environment, fixture.vault);
    }

    @AfterEach
    void tearDown() {
        invoker.shutdown();
    }

    @Test
    void shouldParseResultFromStdout() {
        command(AgentKind.TOPIC_ANALYSIS, "cat >/dev/null; echo '{\"success\":true,\"output\":\"three angles\","
            + "\"usage\":{\"service\":\"openai\",\"model\":\"gpt-4\",\"inputTokens\":10,\"outputTokens\":5,\"amount\":0.01}}'");

        AgentResult result = invoker.invoke(invocation(AgentKind.TOPIC_ANALYSIS, null, Duration.ofSeconds(10)));

        assertTrue(result.success());
        assertEquals("three angles", result.output());
        assertEquals("openai", result.usage().service());
        assertEquals(10, result.usage().inputTokens());
        assertEquals(0, new BigDecimal("0.01").compareTo(result.usage().amount()));
    }

    @Test
    void shouldExposeCallContextAsEnvironment() {
        command(AgentKind.PUBLISH, "cat >/dev/null; printf '{\"success\":true,\"output\":\"%s|%s|%s|%s\"}' "
            + "\"$AGENT_KIND\" \"$AGENT_ATTEMPT\" \"$ORGANIZATION_ID\" \"$PIPELINE_ID\"");

        AgentResult result = invoker.invoke(invocation(AgentKind.PUBLISH, null, Duration.ofSeconds(10)));

        assertEquals("publish|2|acme|p-1", result.output());
    }

    @Test
    void shouldReadPayloadFromStdin() {
        command(AgentKind.ARTICLE_GENERATION, "grep -q '\"topic\":\"AI\"' && echo '{\"success\":true,\"output\":\"saw topic\"}'");

        AgentResult result = invoker.invoke(invocation(AgentKind.ARTICLE_GENERATION, null, Duration.ofSeconds(10)));

        assertEquals("saw topic", result.output());
    }

    @Test
    void shouldInjectApiKeyFromVault() {
        fixture.createOrganization("acme", "100.00", 10, "alice");
        CredentialHandle handle = fixture.vault.store("acme", "anthropic", "sk-ant-secret-9876", "alice");
        command(AgentKind.LEGAL_FACT_CHECK, "cat >/dev/null; printf '{\"success\":true,\"output\":\"%s\"}' \"$AGENT_API_KEY\"");

        AgentResult result = invoker.invoke(invocation(AgentKind.LEGAL_FACT_CHECK, handle, Duration.ofSeconds(10)));

        assertEquals("sk-ant-secret-9876", result.output());
    }

    @Test
    void shouldReportNonZeroExit() {
        command(AgentKind.COMPETITOR_MONITORING, "cat >/dev/null; exit 3");

        AgentResult result = invoker.invoke(invocation(AgentKind.COMPETITOR_MONITORING, null, Duration.ofSeconds(10)));

        assertFalse(result.success());
        assertEquals("Agent exited with code 3", result.error());
        assertNotNull(result.usage());
    }

    @Test
    void shouldKillAgentOnTimeout() {
        command(AgentKind.COMPETITOR_MONITORING, "cat >/dev/null; sleep 5");

        long started = System.nanoTime();
        AgentResult result = invoker.invoke(invocation(AgentKind.COMPETITOR_MONITORING, null, Duration.ofSeconds(1)));

        assertFalse(result.success());
        assertEquals("Agent timed out after 1s", result.error());
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toMillis() < 4000);
    }

    @Test
    void shouldFailWithoutConfiguredCommand() {
        AgentResult result = invoker.invoke(invocation(AgentKind.PUBLISH, null, Duration.ofSeconds(1)));

        assertFalse(result.success());
        assertEquals("No command configured for agent publish", result.error());
    }

    @Test
    void shouldIgnoreOutputThatIsNotJson() {
        assertNull(invoker.parse("Traceback (most recent call last)"));
        assertNull(invoker.parse("  "));
    }

    private void command(AgentKind kind, String command) {
        environment.setProperty("agents.commands." + kind.getWireName(), command);
    }

    private static AgentInvocation invocation(AgentKind kind, CredentialHandle credential, Duration timeout) {
        Map<String, Object> payload = Map.of("pipelineId", "p-1", "request", Map.of("topic", "AI"));
        return new AgentInvocation(kind, "acme", "p-1", 2, "gpt-4", payload, timeout, credential);
    }
}
