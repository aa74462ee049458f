package com.edustream.studio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record GenerateResponse(
        @JsonProperty("content_id") Long contentId,
        String status,
        String message) {
}
