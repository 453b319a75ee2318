package com.autonomous.content.model;

import java.math.BigDecimal;
import java.time.YearMonth;

public record SpendSummary(
    String organizationId,
    YearMonth month,
    BigDecimal amount,
    BigDecimal monthlyBudget,
    BigDecimal percentageOfBudget,
    int alertThreshold) {

    public boolean isOverAlertThreshold() {
        return percentageOfBudget.compareTo(BigDecimal.valueOf(alertThreshold)) >= 0;
    }
}
