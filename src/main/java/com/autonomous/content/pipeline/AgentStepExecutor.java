package com.autonomous.content.pipeline;

import com.autonomous.content.agent.AgentInvoker;
import com.autonomous.content.model.AgentConfig;
import com.autonomous.content.model.AgentInvocation;
import com.autonomous.content.model.AgentKind;
import com.autonomous.content.model.AgentResult;
import com.autonomous.content.model.AgentUsage;
import com.autonomous.content.model.CredentialHandle;
import com.autonomous.content.service.CredentialVault;
import com.autonomous.content.service.RateLimitDecision;
import com.autonomous.content.service.RateLimiterService;
import com.autonomous.content.service.WindowLimit;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one agent step with its retry policy. Calls go to a separate executor and are awaited up
 * to the configured timeout; a call that outlives its timeout keeps running and is still billed
 * when it finishes.
 */
@Component
public class AgentStepExecutor {

    private static final Logger log = LoggerFactory.getLogger(AgentStepExecutor.class);
    private static final long TIMEOUT_GRACE_MS = 500;
    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);

    @Value("${pipeline.retry.backoff-ms:1000}")
    private long backoffMillis = 1000;

    private final AgentInvoker invoker;
    private final RateLimiterService rateLimiter;
    private final CredentialVault vault;
    private final ExecutorService agentCalls;

    public AgentStepExecutor(AgentInvoker invoker, RateLimiterService rateLimiter, CredentialVault vault) {
        this.invoker = invoker;
        this.rateLimiter = rateLimiter;
        this.vault = vault;
        AtomicInteger threadCount = new AtomicInteger();
        this.agentCalls = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "agent-call-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void setBackoffMillis(long backoffMillis) {
        this.backoffMillis = backoffMillis;
    }

    StepOutcome execute(String pipelineId, AgentConfig config, Map<String, Object> payload, StepListener listener) {
        AgentKind kind = config.getAgentKind();
        String organizationId = config.getOrganizationId();
        Duration timeout = Duration.ofSeconds(config.getTimeoutSeconds());
        CredentialHandle credential = vault.handleFor(organizationId, config.providerService()).orElse(null);
        int maxAttempts = config.getMaxRetries() + 1;
        String lastError = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (listener.isCancelled()) {
                return StepOutcome.cancelled(attempt - 1);
            }
            String limited = checkRunLimits(config);
            if (limited != null) {
                return StepOutcome.failed("agent_rate_limited", limited, attempt - 1);
            }

            AgentInvocation invocation = new AgentInvocation(kind, organizationId, pipelineId, attempt,
                config.getModel(), payload, timeout, credential);
            AgentResult result;
            try {
                result = call(invocation, config, listener)
                    .get(timeout.toMillis() + TIMEOUT_GRACE_MS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                result = AgentResult.failure("Agent timed out after " + timeout.toSeconds() + "s", null);
            } catch (ExecutionException e) {
                result = AgentResult.failure("Agent call failed: " + e.getCause().getMessage(), null);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return StepOutcome.interrupted(attempt);
            }

            if (result.success()) {
                if (exceedsCostCeiling(config, result.usage())) {
                    return StepOutcome.failed("agent_cost_limit_exceeded",
                        String.format("%s cost %s exceeds the agent limit of %s",
                            kind.getWireName(), result.usage().amount(), config.getMaxCost()),
                        attempt);
                }
                log.info("Pipeline {} step {} completed on attempt {}", pipelineId, kind.getWireName(), attempt);
                return StepOutcome.completed(result.output(), result.articleId(), attempt);
            }

            lastError = result.error();
            log.warn("Pipeline {} step {} attempt {}/{} failed: {}",
                pipelineId, kind.getWireName(), attempt, maxAttempts, lastError);
            if (attempt < maxAttempts && backoffMillis > 0) {
                try {
                    Thread.sleep(backoffMillis);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return StepOutcome.interrupted(attempt);
                }
            }
        }
        return StepOutcome.failed("agent_failed",
            String.format("%s failed after %d attempts: %s", kind.getWireName(), maxAttempts, lastError),
            maxAttempts);
    }

    /**
     * Starts the call and bills it when it finishes. The returned future completes only after
     * billing, so a caller that sees the result also sees its cost.
     */
    private CompletableFuture<AgentResult> call(AgentInvocation invocation, AgentConfig config, StepListener listener) {
        return CompletableFuture.supplyAsync(() -> invoker.invoke(invocation), agentCalls)
            .handle((result, error) -> {
                AgentResult normalized = normalize(error == null ? result : failure(error), config);
                if (normalized.usage().isBillable()) {
                    listener.onBilled(invocation.agentKind(), normalized);
                }
                return normalized;
            });
    }

    private String checkRunLimits(AgentConfig config) {
        String agent = config.getAgentKind().getWireName();
        RateLimitDecision decision = rateLimiter.checkAndIncrementAll(config.getOrganizationId(), "agent:" + agent, "RUN",
            List.of(new WindowLimit(config.getRunsPerHour(), HOUR), new WindowLimit(config.getRunsPerDay(), DAY)));
        if (decision.allowed()) {
            return null;
        }
        String period = Duration.between(decision.windowStart(), decision.windowEnd()).equals(HOUR) ? "hour" : "day";
        return String.format("%s exceeded %d runs per %s", agent, decision.maxRequests(), period);
    }

    private static boolean exceedsCostCeiling(AgentConfig config, AgentUsage usage) {
        return config.getMaxCost() != null
            && usage.amount() != null
            && usage.amount().compareTo(config.getMaxCost()) > 0;
    }

    private static AgentResult failure(Throwable error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        return AgentResult.failure("Agent call failed: " + cause.getMessage(), null);
    }

    private static AgentResult normalize(AgentResult result, AgentConfig config) {
        if (result == null) {
            result = AgentResult.failure("Agent returned no result", null);
        }
        AgentUsage usage = result.usage();
        if (usage == null) {
            usage = new AgentUsage(config.providerService(), config.getModel(), 0, 0, null);
        } else if (usage.service() == null || usage.model() == null) {
            usage = new AgentUsage(
                usage.service() != null ? usage.service() : config.providerService(),
                usage.model() != null ? usage.model() : config.getModel(),
                usage.inputTokens(), usage.outputTokens(), usage.amount());
        }
        return new AgentResult(result.success(), result.output(), result.articleId(), usage, result.error());
    }

    @PreDestroy
    public void shutdown() {
        agentCalls.shutdownNow();
    }
}
