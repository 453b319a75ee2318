package com.autonomous.content.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CostEntry {
    private String id;
    private Instant timestamp;
    private YearMonth billingMonth;
    private String organizationId;
    private String pipelineId;
    private String articleId;
    private AgentKind agentKind;
    private String service;
    private String model;
    private long inputTokens;
    private long outputTokens;
    private BigDecimal amount;
}
