package com.autonomous.content.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationEvent {
    BUDGET_ALERT("budget.threshold_alert"),
    PIPELINE_COMPLETED("pipeline.completed"),
    PIPELINE_FAILED("pipeline.failed");

    private final String key;

    NotificationEvent(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }
}
