package com.autonomous.content.agent;

import com.autonomous.content.model.AgentInvocation;
import com.autonomous.content.model.AgentResult;
import com.autonomous.content.model.AgentUsage;
import com.autonomous.content.service.CredentialVault;
import com.autonomous.content.storage.JsonMappers;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.File;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs the command configured under {@code agents.commands.<agent>} for each call. The payload is
 * written to stdin as JSON and the command prints an {@link AgentResult} as JSON on stdout.
 */
@Service
public class ProcessAgentInvoker implements AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(ProcessAgentInvoker.class);

    @Value("${agents.working-dir:.}")
    private String workingDir = ".";

    private final Environment environment;
    private final CredentialVault vault;
    private final ObjectMapper mapper = JsonMappers.json();
    private final ExecutorService outputReaders = Executors.newCachedThreadPool();

    public ProcessAgentInvoker(Environment environment, CredentialVault vault) {
        this.environment = environment;
        this.vault = vault;
    }

    @Override
    public AgentResult invoke(AgentInvocation invocation) {
        String agent = invocation.agentKind().getWireName();
        AgentUsage noUsage = new AgentUsage(null, invocation.model(), 0, 0, null);
        String command = environment.getProperty("agents.commands." + agent);
        if (command == null || command.isBlank()) {
            return AgentResult.failure("No command configured for agent " + agent, noUsage);
        }

        ProcessBuilder pb = new ProcessBuilder("sh", "-c", command);
        pb.directory(new File(workingDir));
        pb.redirectError(ProcessBuilder.Redirect.INHERIT);
        Map<String, String> env = pb.environment();
        env.put("PIPELINE_ID", invocation.pipelineId());
        env.put("ORGANIZATION_ID", invocation.organizationId());
        env.put("AGENT_KIND", agent);
        env.put("AGENT_ATTEMPT", String.valueOf(invocation.attempt()));
        if (invocation.model() != null) {
            env.put("AGENT_MODEL", invocation.model());
        }
        if (invocation.credential() != null) {
            vault.withSecret(invocation.credential(), secret -> env.put("AGENT_API_KEY", new String(secret)));
        }

        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            log.error("Failed to start agent {} for pipeline {}", agent, invocation.pipelineId(), e);
            return AgentResult.failure("Failed to start agent: " + e.getMessage(), noUsage);
        }

        try {
            Future<String> stdout = outputReaders.submit(() ->
                new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8));
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(mapper.writeValueAsBytes(invocation.payload()));
            }

            boolean finished = process.waitFor(invocation.timeout().toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                stdout.cancel(true);
                return AgentResult.failure("Agent timed out after " + invocation.timeout().toSeconds() + "s", noUsage);
            }

            String output = stdout.get(5, TimeUnit.SECONDS);
            if (process.exitValue() != 0) {
                return withUsage(parse(output), noUsage, "Agent exited with code " + process.exitValue());
            }
            return withUsage(parse(output), noUsage, null);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            return AgentResult.failure("Agent call interrupted", noUsage);
        } catch (IOException | ExecutionException | TimeoutException e) {
            process.destroyForcibly();
            log.warn("Agent {} for pipeline {} failed", agent, invocation.pipelineId(), e);
            return AgentResult.failure("Agent I/O failed: " + e.getMessage(), noUsage);
        }
    }

    AgentResult parse(String output) {
        if (output == null || output.isBlank()) {
            return null;
        }
        try {
            return mapper.readValue(output.trim(), AgentResult.class);
        } catch (JsonProcessingException e) {
            log.warn("Agent output is not a valid result: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static AgentResult withUsage(AgentResult parsed, AgentUsage fallback, String exitError) {
        if (parsed == null) {
            return AgentResult.failure(exitError != null ? exitError : "Agent produced no result", fallback);
        }
        AgentUsage usage = parsed.usage() != null ? parsed.usage() : fallback;
        if (exitError != null) {
            return AgentResult.failure(parsed.error() != null ? parsed.error() : exitError, usage);
        }
        return new AgentResult(parsed.success(), parsed.output(), parsed.articleId(), usage, parsed.error());
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }
}
