package com.autonomous.content.model;

import com.autonomous.content.exception.InvalidStateTransitionException;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One run of the five agent steps. Mutated only by {@code PipelineOrchestrator}, always under
 * the store's per-pipeline lock.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pipeline {
    private String id;
    private String organizationId;
    private String userId;
    private String articleId;
    private ArticleRequest request;

    @Builder.Default
    private PipelineStatus status = PipelineStatus.PENDING;
    @Builder.Default
    private int priority = 5;

    // Progress
    private AgentKind currentAgent;
    @Builder.Default
    private List<AgentKind> agentsCompleted = new ArrayList<>();
    @Builder.Default
    private Map<AgentKind, StepStatus> agentStatus = new EnumMap<>(AgentKind.class);
    @Builder.Default
    private Map<AgentKind, String> results = new EnumMap<>(AgentKind.class);

    // Cost
    @Builder.Default
    private BigDecimal estimatedCost = BigDecimal.ZERO;
    @Builder.Default
    private BigDecimal totalCost = BigDecimal.ZERO;
    @Builder.Default
    private Map<AgentKind, BigDecimal> costBreakdown = new EnumMap<>(AgentKind.class);

    private int retryCount;
    private String errorCode;
    private String errorMessage;

    private Instant createdAt;
    private Instant queuedAt;
    private Instant startedAt;
    private Instant completedAt;
    private Instant deletedAt;

    // Set while a worker owns the run loop; never persisted.
    @JsonIgnore
    private boolean workerAttached;

    public void transitionTo(PipelineStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new InvalidStateTransitionException(id, status, target);
        }
        this.status = target;
    }

    public void fail(String code, String message, Instant at) {
        transitionTo(PipelineStatus.FAILED);
        this.errorCode = code;
        this.errorMessage = message;
        this.completedAt = at;
        this.currentAgent = null;
    }

    public StepStatus stepStatus(AgentKind kind) {
        return agentStatus.getOrDefault(kind, StepStatus.PENDING);
    }

    /** First step that is neither completed nor skipped. */
    public Optional<AgentKind> nextStep() {
        for (AgentKind kind : AgentKind.values()) {
            if (!stepStatus(kind).isDone()) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    public boolean allStepsDone() {
        return nextStep().isEmpty();
    }

    /** Share of the five steps that are completed or skipped, 0 to 100. */
    public int progressPercentage() {
        if (status == PipelineStatus.COMPLETED) {
            return 100;
        }
        long done = Arrays.stream(AgentKind.values()).filter(kind -> stepStatus(kind).isDone()).count();
        return (int) (done * 100 / AgentKind.values().length);
    }

    public void markStepCompleted(AgentKind kind, String output) {
        agentStatus.put(kind, StepStatus.COMPLETED);
        if (!agentsCompleted.contains(kind)) {
            agentsCompleted.add(kind);
        }
        if (output != null) {
            results.put(kind, output);
        }
    }

    public void addCost(AgentKind kind, BigDecimal amount) {
        if (amount == null || amount.signum() == 0) {
            return;
        }
        totalCost = totalCost.add(amount);
        if (kind != null) {
            costBreakdown.merge(kind, amount, BigDecimal::add);
        }
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
