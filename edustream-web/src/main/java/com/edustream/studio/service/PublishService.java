package com.edustream.studio.service;

import com.edustream.studio.dto.PlatformStatus;
import com.edustream.studio.dto.PublishHistoryEntry;
import com.edustream.studio.dto.PublishRequest;
import com.edustream.studio.dto.PublishResponse;
import com.edustream.studio.dto.PublishResult;
import com.edustream.studio.exception.ContentNotFoundException;
import com.edustream.studio.exception.PublishFailedException;
import com.edustream.studio.model.ContentItem;
import com.edustream.studio.model.ContentStatus;
import com.edustream.studio.model.Platform;
import com.edustream.studio.model.ScheduleRecord;
import com.edustream.studio.model.ScheduleStatus;
import com.edustream.studio.repository.ContentItemRepository;
import com.edustream.studio.repository.ScheduleRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * Publishes ready content straight away, bypassing the queue. Every attempt appends a
 * schedule record, successful or not.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublishService {

    private final ContentItemRepository contentRepository;
    private final ScheduleRecordRepository scheduleRepository;
    private final SocialPublisherRegistry publisherRegistry;
    private final Clock clock;

    public PublishResponse publishNow(PublishRequest request) {
        ContentItem content = contentRepository.findById(request.getContentId())
                .orElseThrow(() -> new ContentNotFoundException(request.getContentId()));
        Platform platform = SchedulePlannerService.parsePlatform(request.getPlatform());

        if (content.getStatus() != ContentStatus.READY && content.getStatus() != ContentStatus.PUBLISHED) {
            throw new IllegalStateException(
                    "Content is not ready for publishing. Status: " + content.getStatus().getValue());
        }
        if (!content.hasDiagram()) {
            throw new IllegalStateException("Content has no image to publish");
        }
        SocialPublisher publisher = publisherRegistry.find(platform)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Platform '" + platform.getValue() + "' is not yet supported"));
        if (!publisher.isConfigured()) {
            throw new IllegalStateException(platform.getDisplayName() + " is not configured. Add its API credentials");
        }

        String caption = CaptionBuilder.build(content, request.getCaption());
        List<String> hashtags = request.getHashtags() == null || request.getHashtags().isEmpty()
                ? null : request.getHashtags();
        LocalDateTime now = LocalDateTime.now(clock);

        PublishResult result;
        try {
            result = publisher.postImage(content.getDiagramPath(), caption, hashtags);
        } catch (RuntimeException e) {
            log.error("Direct publish of content {} to {} failed", content.getId(), platform.getValue(), e);
            ScheduleRecord failed = new ScheduleRecord(content.getId(), platform, now, ScheduleStatus.FAILED);
            failed.setErrorMessage(e.getMessage());
            scheduleRepository.save(failed);
            throw new PublishFailedException(
                    "Failed to publish to " + platform.getDisplayName() + ": " + e.getMessage(), e);
        }

        ScheduleRecord published = new ScheduleRecord(content.getId(), platform, now, ScheduleStatus.PUBLISHED);
        published.setPublishedAt(now);
        published.setPlatformPostId(result.postId());
        scheduleRepository.save(published);

        content.transitionTo(ContentStatus.PUBLISHED);
        contentRepository.save(content);
        log.info("Published content {} to {} as {}", content.getId(), platform.getValue(), result.postId());

        return new PublishResponse(true, platform.getValue(), result.url(), result.postId(),
                "Successfully published to " + platform.getDisplayName() + "!");
    }

    public List<PublishHistoryEntry> history(Long contentId) {
        return scheduleRepository.findByContentIdOrderByCreatedAtDesc(contentId).stream()
                .map(PublishHistoryEntry::of)
                .toList();
    }

    public List<PlatformStatus> platforms() {
        return Arrays.stream(Platform.values())
                .map(p -> new PlatformStatus(p.getValue(), publisherRegistry.isConfigured(p), p.getDisplayName()))
                .toList();
    }
}
