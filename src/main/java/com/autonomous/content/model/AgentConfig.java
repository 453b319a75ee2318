package com.autonomous.content.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AgentConfig {
    private String organizationId;
    private AgentKind agentKind;

    // Behavior
    private boolean enabled;
    private int timeoutSeconds;
    private int maxRetries;
    private BigDecimal maxCost;
    private String model;

    // Run limits
    private int runsPerHour;
    private int runsPerDay;

    private Instant updatedAt;

    /** Upstream provider billed for this agent's model calls. */
    public String providerService() {
        if (model != null) {
            String lower = model.toLowerCase();
            if (lower.startsWith("claude")) {
                return "anthropic";
            }
            if (lower.startsWith("gpt")) {
                return "openai";
            }
        }
        return agentKind != null ? agentKind.getShortName() : "unknown";
    }
}
