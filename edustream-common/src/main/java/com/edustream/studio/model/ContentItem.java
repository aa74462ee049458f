package com.edustream.studio.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Data
@NoArgsConstructor
@Entity
@Table(name = "contents")
public class ContentItem {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private Long topicId;

    @Enumerated(EnumType.STRING)
    private ContentType contentType = ContentType.PROBLEM;

    @Enumerated(EnumType.STRING)
    private ContentStatus status = ContentStatus.DRAFT;

    @Column(columnDefinition = "TEXT")
    private String scriptText; // plain narration

    @Convert(converter = ScriptPayloadConverter.class)
    @Column(columnDefinition = "TEXT")
    private ScriptPayload scriptData;

    @Column(length = 500)
    private String diagramPath;

    @Column(length = 500)
    private String audioPath;

    @Column(length = 500)
    private String videoPath;

    private Integer durationSeconds;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public ContentItem(Long topicId, ContentType contentType) {
        this.topicId = topicId;
        this.contentType = contentType;
    }

    /**
     * Moves the item to {@code next}, enforcing the status order and the artifact
     * requirements of READY and PUBLISHED.
     *
     * @throws IllegalStateException if the transition is not allowed; the item is left unchanged
     */
    public void transitionTo(ContentStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Content " + id + " cannot move from " + status.getValue() + " to " + next.getValue());
        }
        if (next == ContentStatus.READY && (scriptText == null || diagramPath == null)) {
            throw new IllegalStateException("Content " + id + " needs both a script and a diagram to be ready");
        }
        if (next == ContentStatus.PUBLISHED && diagramPath == null) {
            throw new IllegalStateException("Content " + id + " has no diagram to publish");
        }
        this.status = next;
    }

    public void markFailed(String message) {
        transitionTo(ContentStatus.FAILED);
        this.errorMessage = message;
    }

    public boolean isPublishable() {
        return (status == ContentStatus.READY || status == ContentStatus.PUBLISHED) && diagramPath != null;
    }

    public boolean hasScript() {
        return scriptText != null;
    }

    public boolean hasDiagram() {
        return diagramPath != null;
    }

    public boolean hasAudio() {
        return audioPath != null;
    }

    public boolean hasVideo() {
        return videoPath != null;
    }

    @PrePersist
    void onCreate() {
        LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
        if (createdAt == null) {
            createdAt = now;
        }
        updatedAt = now;
    }

    @PreUpdate
    void onUpdate() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
