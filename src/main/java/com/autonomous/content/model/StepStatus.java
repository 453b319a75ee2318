package com.autonomous.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum StepStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    SKIPPED,
    FAILED;

    /** Completed and skipped steps are never executed again. */
    public boolean isDone() {
        return this == COMPLETED || this == SKIPPED;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static StepStatus fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
