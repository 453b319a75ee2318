package com.autonomous.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

public enum PlanTier {
    FREE(2, new BigDecimal("100.00"), new BigDecimal("5.00")),
    STARTER(20, new BigDecimal("250.00"), new BigDecimal("10.00")),
    PROFESSIONAL(100, new BigDecimal("1000.00"), new BigDecimal("15.00")),
    ENTERPRISE(1000, new BigDecimal("10000.00"), new BigDecimal("25.00"));

    private final int articlesLimit;
    private final BigDecimal monthlyBudget;
    private final BigDecimal perArticleCostLimit;

    PlanTier(int articlesLimit, BigDecimal monthlyBudget, BigDecimal perArticleCostLimit) {
        this.articlesLimit = articlesLimit;
        this.monthlyBudget = monthlyBudget;
        this.perArticleCostLimit = perArticleCostLimit;
    }

    public int getArticlesLimit() {
        return articlesLimit;
    }

    public BigDecimal getMonthlyBudget() {
        return monthlyBudget;
    }

    public BigDecimal getPerArticleCostLimit() {
        return perArticleCostLimit;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PlanTier fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
