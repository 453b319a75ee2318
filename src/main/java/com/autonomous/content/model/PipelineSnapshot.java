package com.autonomous.content.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable copy of a pipeline handed to callers outside the orchestrator.
 */
public record PipelineSnapshot(
    String id,
    String organizationId,
    String userId,
    String articleId,
    PipelineStatus status,
    int priority,
    AgentKind currentAgent,
    List<AgentKind> agentsCompleted,
    Map<AgentKind, StepStatus> agentStatus,
    int progress,
    Map<AgentKind, String> results,
    BigDecimal estimatedCost,
    BigDecimal totalCost,
    Map<AgentKind, BigDecimal> costBreakdown,
    int retryCount,
    String errorCode,
    String errorMessage,
    Instant createdAt,
    Instant queuedAt,
    Instant startedAt,
    Instant completedAt) {

    public static PipelineSnapshot of(Pipeline pipeline) {
        return new PipelineSnapshot(
            pipeline.getId(),
            pipeline.getOrganizationId(),
            pipeline.getUserId(),
            pipeline.getArticleId(),
            pipeline.getStatus(),
            pipeline.getPriority(),
            pipeline.getCurrentAgent(),
            List.copyOf(pipeline.getAgentsCompleted()),
            copy(pipeline.getAgentStatus()),
            pipeline.progressPercentage(),
            copy(pipeline.getResults()),
            pipeline.getEstimatedCost(),
            pipeline.getTotalCost(),
            copy(pipeline.getCostBreakdown()),
            pipeline.getRetryCount(),
            pipeline.getErrorCode(),
            pipeline.getErrorMessage(),
            pipeline.getCreatedAt(),
            pipeline.getQueuedAt(),
            pipeline.getStartedAt(),
            pipeline.getCompletedAt());
    }

    private static <V> Map<AgentKind, V> copy(Map<AgentKind, V> source) {
        return source.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(source));
    }
}
