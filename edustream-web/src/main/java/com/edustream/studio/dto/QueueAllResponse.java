package com.edustream.studio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QueueAllResponse(String message, @JsonProperty("queued_count") int queuedCount) {
}
