package com.autonomous.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * The five pipeline steps. Declaration order is execution order.
 */
public enum AgentKind {
    COMPETITOR_MONITORING("competitor-monitoring", "competitor"),
    TOPIC_ANALYSIS("topic-analysis", "topic"),
    ARTICLE_GENERATION("article-generation", "article"),
    LEGAL_FACT_CHECK("legal-fact-check", "legal"),
    PUBLISH("publish", "wordpress");

    private final String wireName;
    private final String shortName;

    AgentKind(String wireName, String shortName) {
        this.wireName = wireName;
        this.shortName = shortName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getShortName() {
        return shortName;
    }

    public boolean isLast() {
        return ordinal() == values().length - 1;
    }

    @JsonCreator
    public static AgentKind fromName(String name) {
        return Arrays.stream(values())
            .filter(kind -> kind.wireName.equalsIgnoreCase(name)
                || kind.shortName.equalsIgnoreCase(name)
                || kind.name().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown agent kind: " + name));
    }
}
