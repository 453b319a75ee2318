package com.autonomous.content.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MemberRole {
    OWNER,
    ADMIN,
    EDITOR,
    MEMBER,
    VIEWER;

    public boolean isAdmin() {
        return this == OWNER || this == ADMIN;
    }

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MemberRole fromValue(String value) {
        return valueOf(value.toUpperCase());
    }
}
