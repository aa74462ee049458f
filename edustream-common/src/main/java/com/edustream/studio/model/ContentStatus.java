package com.edustream.studio.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a generated content item.
 * <p>
 * Statuses only move forward, except that any status other than {@link #FAILED} may jump to
 * {@link #FAILED}. A published item may be queued or published again.
 */
public enum ContentStatus {
    DRAFT("draft"),
    GENERATING("generating"),
    READY("ready"),
    QUEUED("queued"),
    PUBLISHED("published"),
    FAILED("failed");

    private final String value;

    ContentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == FAILED;
    }

    public boolean canTransitionTo(ContentStatus next) {
        if (next == FAILED) {
            return !isTerminal();
        }
        return switch (this) {
            case DRAFT -> next == GENERATING;
            case GENERATING -> next == READY;
            case READY -> next == QUEUED || next == PUBLISHED;
            case QUEUED -> next == PUBLISHED;
            case PUBLISHED -> next == QUEUED || next == PUBLISHED;
            case FAILED -> false;
        };
    }
}
