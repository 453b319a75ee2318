package com.autonomous.content.service;

import java.math.BigDecimal;

/**
 * Partial update of one agent configuration. Null fields are left unchanged.
 */
public record AgentConfigUpdate(
    Boolean enabled,
    Integer timeoutSeconds,
    Integer maxRetries,
    BigDecimal maxCost,
    String model,
    Integer runsPerHour,
    Integer runsPerDay) {}
