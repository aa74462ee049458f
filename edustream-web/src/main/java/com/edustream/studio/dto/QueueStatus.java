package com.edustream.studio.dto;

import com.edustream.studio.model.ScheduleStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.List;

public record QueueStatus(
        @JsonProperty("pending_items") List<PendingItem> pendingItems,
        @JsonProperty("sqs_approximate_count") long approximateCount) {

    public record PendingItem(
            @JsonProperty("content_id") Long contentId,
            @JsonProperty("schedule_id") Long scheduleId,
            @JsonProperty("scheduled_at") LocalDateTime scheduledAt,
            ScheduleStatus status) {
    }
}
