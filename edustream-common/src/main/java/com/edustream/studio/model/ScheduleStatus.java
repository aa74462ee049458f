package com.edustream.studio.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ScheduleStatus {
    PENDING("pending"),
    PUBLISHED("published"),
    FAILED("failed");

    private final String value;

    ScheduleStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
