package com.autonomous.content.controller;

import com.autonomous.content.model.PlanTier;

import java.math.BigDecimal;

public record CreateOrganizationRequest(
    String id,
    String name,
    PlanTier plan,
    BigDecimal monthlyBudget,
    BigDecimal perArticleCostLimit,
    Integer articlesLimit,
    Integer alertThreshold) {}
