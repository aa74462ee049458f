package com.edustream.studio.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum Platform {
    TWITTER("twitter", "Twitter/X"),
    YOUTUBE("youtube", "YouTube Shorts"),
    TIKTOK("tiktok", "TikTok"),
    INSTAGRAM("instagram", "Instagram Reels");

    private final String value;
    private final String displayName;

    Platform(String value, String displayName) {
        this.value = value;
        this.displayName = displayName;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<Platform> fromValue(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.value.equalsIgnoreCase(value.trim()))
                .findFirst();
    }
}
