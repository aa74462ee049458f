package com.edustream.studio.dto;

import com.edustream.studio.model.Platform;
import com.edustream.studio.model.ScheduleRecord;
import com.edustream.studio.model.ScheduleStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record PublishHistoryEntry(
        Long id,
        Platform platform,
        ScheduleStatus status,
        @JsonProperty("scheduled_at") LocalDateTime scheduledAt,
        @JsonProperty("published_at") LocalDateTime publishedAt,
        @JsonProperty("post_id") String postId,
        String error) {

    public static PublishHistoryEntry of(ScheduleRecord record) {
        return new PublishHistoryEntry(
                record.getId(),
                record.getPlatform(),
                record.getStatus(),
                record.getScheduledAt(),
                record.getPublishedAt(),
                record.getPlatformPostId(),
                record.getErrorMessage());
    }
}
