package com.edustream.studio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.LocalDateTime;

@Data
public class QueueRequest {
    @NotNull(message = "Content id is required")
    @JsonProperty("content_id")
    private Long contentId;

    private String platform = "twitter";

    // UTC; planned from the publish interval when absent
    @JsonProperty("scheduled_at")
    private LocalDateTime scheduledAt;
}
