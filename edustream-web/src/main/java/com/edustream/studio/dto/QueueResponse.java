package com.edustream.studio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record QueueResponse(
        String message,
        @JsonProperty("schedule_id") Long scheduleId,
        @JsonProperty("scheduled_at") LocalDateTime scheduledAt,
        @JsonProperty("sqs_message_id") String messageId) {
}
