package com.autonomous.content.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Organization {
    private String id;
    private String name;

    @Builder.Default
    private PlanTier plan = PlanTier.FREE;

    // Limits
    private BigDecimal monthlyBudget;
    private BigDecimal perArticleCostLimit;
    private int articlesLimit;
    @Builder.Default
    private int alertThreshold = 80;

    // Maintained by BudgetGuardService only
    @Builder.Default
    private BigDecimal currentMonthSpend = BigDecimal.ZERO;
    private int articlesUsed;
    private YearMonth quotaPeriod;

    @Builder.Default
    private List<OrganizationMember> members = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;
    private Instant deletedAt;

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
