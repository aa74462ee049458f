package com.edustream.studio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PublishResponse(
        boolean success,
        String platform,
        @JsonProperty("post_url") String postUrl,
        @JsonProperty("post_id") String postId,
        String message) {
}
