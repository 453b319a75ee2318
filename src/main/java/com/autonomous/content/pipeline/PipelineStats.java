package com.autonomous.content.pipeline;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Run counts and spend over an organization's pipelines.
 *
 * @param successRate completed runs as a percentage of finished runs
 * @param averageCost total cost divided by finished runs
 */
public record PipelineStats(
    int totalRuns,
    int completedRuns,
    int failedRuns,
    int cancelledRuns,
    int activeRuns,
    BigDecimal successRate,
    BigDecimal totalCost,
    BigDecimal averageCost,
    int articlesGenerated,
    int articlesPublished,
    Instant lastRunAt) {}
