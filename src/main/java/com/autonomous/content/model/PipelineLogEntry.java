package com.autonomous.content.model;

import java.time.Instant;
import java.util.Map;

/**
 * One line of a pipeline's execution log.
 *
 * @param agent the step the line belongs to, or {@code null} for pipeline-level lines
 */
public record PipelineLogEntry(
    Instant timestamp,
    PipelineLogLevel level,
    AgentKind agent,
    String message,
    Map<String, Object> data) {}
