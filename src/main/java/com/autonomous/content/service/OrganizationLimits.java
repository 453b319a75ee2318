package com.autonomous.content.service;

import com.autonomous.content.model.PlanTier;

import java.math.BigDecimal;

/**
 * Partial update of an organization's limits. Null fields are left unchanged.
 */
public record OrganizationLimits(
    PlanTier plan,
    BigDecimal monthlyBudget,
    BigDecimal perArticleCostLimit,
    Integer articlesLimit,
    Integer alertThreshold) {}
