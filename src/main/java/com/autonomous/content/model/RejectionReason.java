package com.autonomous.content.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RejectionReason {
    ARTICLE_LIMIT_EXCEEDED("article_limit_exceeded"),
    BUDGET_EXCEEDED("budget_exceeded"),
    BUDGET_EXCEEDED_MID_RUN("budget_exceeded_mid_run"),
    ARTICLE_COST_LIMIT_EXCEEDED("article_cost_limit_exceeded"),
    RATE_LIMITED("rate_limited");

    private final String code;

    RejectionReason(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
