package com.edustream.studio.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ContentType {
    PROBLEM("problem"), // quiz with answer options
    CONCEPT("concept"); // explainer

    private final String value;

    ContentType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ContentType fromValue(String value) {
        return "concept".equalsIgnoreCase(value) ? CONCEPT : PROBLEM;
    }
}
