package com.edustream.studio.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * One publish attempt for a content item. Records are never deleted; a new queue operation
 * always appends a new record.
 */
@Data
@NoArgsConstructor
@Entity
@Table(name = "schedules", indexes = {
        @Index(name = "idx_schedules_status_scheduled_at", columnList = "status, scheduledAt"),
        @Index(name = "idx_schedules_content_id", columnList = "contentId")
})
public class ScheduleRecord {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long contentId;

    @Enumerated(EnumType.STRING)
    private Platform platform;

    private LocalDateTime scheduledAt;
    private LocalDateTime publishedAt;

    @Enumerated(EnumType.STRING)
    private ScheduleStatus status = ScheduleStatus.PENDING;

    @Column(length = 200)
    private String platformPostId;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private LocalDateTime createdAt;

    public ScheduleRecord(Long contentId, Platform platform, LocalDateTime scheduledAt, ScheduleStatus status) {
        this.contentId = contentId;
        this.platform = platform;
        this.scheduledAt = scheduledAt;
        this.status = status;
    }

    public static ScheduleRecord pending(Long contentId, Platform platform, LocalDateTime scheduledAt) {
        return new ScheduleRecord(contentId, platform, scheduledAt, ScheduleStatus.PENDING);
    }

    public boolean isPending() {
        return status == ScheduleStatus.PENDING;
    }

    public void markPublished(String postId, LocalDateTime at) {
        this.status = ScheduleStatus.PUBLISHED;
        this.platformPostId = postId;
        this.publishedAt = at;
    }

    public void markFailed(String message) {
        this.status = ScheduleStatus.FAILED;
        this.errorMessage = message;
    }

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now(ZoneOffset.UTC);
        }
    }
}
