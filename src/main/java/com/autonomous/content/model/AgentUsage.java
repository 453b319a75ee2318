package com.autonomous.content.model;

import java.math.BigDecimal;

/**
 * What one agent call billed. {@code amount} may be null when the caller only knows token
 * counts; the ledger then prices the usage from the model table.
 */
public record AgentUsage(String service, String model, long inputTokens, long outputTokens, BigDecimal amount) {

    public static AgentUsage none(String service) {
        return new AgentUsage(service, null, 0, 0, BigDecimal.ZERO);
    }

    public boolean isBillable() {
        return (amount != null && amount.signum() > 0) || inputTokens > 0 || outputTokens > 0;
    }
}
