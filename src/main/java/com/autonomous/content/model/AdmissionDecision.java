package com.autonomous.content.model;

import java.math.BigDecimal;

/**
 * Outcome of a Budget Guard check.
 *
 * @param reason null when allowed
 * @param alert spend has reached the organization's alert threshold; never blocks on its own
 */
public record AdmissionDecision(
    boolean allowed,
    RejectionReason reason,
    String message,
    boolean alert,
    BigDecimal monthlySpend,
    BigDecimal monthlyBudget) {

    public static AdmissionDecision allow(boolean alert, BigDecimal spend, BigDecimal budget) {
        return new AdmissionDecision(true, null, null, alert, spend, budget);
    }

    public static AdmissionDecision reject(RejectionReason reason, String message,
                                           BigDecimal spend, BigDecimal budget) {
        return new AdmissionDecision(false, reason, message, false, spend, budget);
    }
}
