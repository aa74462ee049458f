package com.edustream.studio.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

/**
 * Message carried by the publish queue. Times are UTC without an offset.
 * {@code scheduleId} may be absent on messages produced before schedule ids were carried.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PublishJob(
        @JsonProperty("content_id") Long contentId,
        @JsonProperty("schedule_id") Long scheduleId,
        @JsonProperty("platform") String platform,
        @JsonProperty("caption") String caption,
        @JsonProperty("image_path") String imagePath,
        @JsonProperty("scheduled_at") LocalDateTime scheduledAt,
        @JsonProperty("enqueued_at") LocalDateTime enqueuedAt) {

    public boolean isDue(LocalDateTime now) {
        return scheduledAt == null || !scheduledAt.isAfter(now);
    }
}
