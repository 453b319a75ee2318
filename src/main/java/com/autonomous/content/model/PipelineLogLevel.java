package com.autonomous.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum PipelineLogLevel {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    SUCCESS,
    /** Figures reported by a step, such as its cost. */
    METRIC;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static PipelineLogLevel fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
