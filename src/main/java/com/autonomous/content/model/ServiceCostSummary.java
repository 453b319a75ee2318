package com.autonomous.content.model;

import java.math.BigDecimal;

public record ServiceCostSummary(
    String service,
    long entryCount,
    BigDecimal totalCost,
    BigDecimal maxCost,
    BigDecimal minCost,
    long totalTokens) {}
