package com.edustream.studio.service;

import com.edustream.studio.dto.PublishJob;
import com.edustream.studio.dto.QueueAllResponse;
import com.edustream.studio.dto.QueueResponse;
import com.edustream.studio.dto.QueueStatus;
import com.edustream.studio.exception.ContentNotFoundException;
import com.edustream.studio.model.ContentItem;
import com.edustream.studio.model.ContentStatus;
import com.edustream.studio.model.Platform;
import com.edustream.studio.model.ScheduleRecord;
import com.edustream.studio.model.ScheduleStatus;
import com.edustream.studio.repository.ContentItemRepository;
import com.edustream.studio.repository.ScheduleRecordRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Puts ready content on the publish queue, spacing posts by the configured interval.
 * <p>
 * Planned times follow the latest PENDING schedule across all content, so consecutive queue
 * operations never land closer together than the interval. Every check runs before the first
 * write; a rejected request leaves no schedule record and no message behind. Messages are sent
 * only after the schedule and content rows have committed.
 */
@Service
@Slf4j
public class SchedulePlannerService {

    static final Duration FIRST_SLOT_DELAY = Duration.ofMinutes(5);

    private final ContentItemRepository contentRepository;
    private final ScheduleRecordRepository scheduleRepository;
    private final PublishQueue publishQueue;
    private final AppConfigService appConfigService;
    private final PublishOutcomeService outcomeService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public SchedulePlannerService(ContentItemRepository contentRepository,
                                  ScheduleRecordRepository scheduleRepository,
                                  PublishQueue publishQueue,
                                  AppConfigService appConfigService,
                                  PublishOutcomeService outcomeService,
                                  PlatformTransactionManager transactionManager,
                                  Clock clock) {
        this.contentRepository = contentRepository;
        this.scheduleRepository = scheduleRepository;
        this.publishQueue = publishQueue;
        this.appConfigService = appConfigService;
        this.outcomeService = outcomeService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * The time the next queued item should go out: {@code explicit} when given, otherwise one
     * interval after the latest pending slot (or now, if that slot is already past), or five
     * minutes from now when nothing is pending.
     */
    public LocalDateTime planNext(LocalDateTime explicit) {
        if (explicit != null) {
            return explicit;
        }
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime lastPending = scheduleRepository.findLatestScheduledAt(ScheduleStatus.PENDING);
        if (lastPending == null) {
            return now.plus(FIRST_SLOT_DELAY);
        }
        return later(lastPending, now).plusMinutes(appConfigService.getPublishIntervalMinutes());
    }

    public QueueResponse queue(Long contentId, String platformValue, LocalDateTime explicitTime) {
        PublishJob job = transactionTemplate.execute(status -> {
            ContentItem content = contentRepository.findById(contentId)
                    .orElseThrow(() -> new ContentNotFoundException(contentId));
            Platform platform = parsePlatform(platformValue);
            checkQueueable(content);
            return reserve(content, platform, planNext(explicitTime));
        });
        String messageId = send(job);

        return new QueueResponse("Queued for publishing at " + job.scheduledAt(), job.scheduleId(),
                job.scheduledAt(), messageId);
    }

    /**
     * Queues every READY item that has a diagram, oldest first, one interval apart starting
     * one interval after {@code max(latest pending slot, now)}. An item the queue refuses is
     * failed; the rest of the batch still goes out.
     */
    public QueueAllResponse queueAllReady() {
        requireQueueConfigured();
        List<PublishJob> jobs = transactionTemplate.execute(status -> reserveAllReady());
        if (jobs == null || jobs.isEmpty()) {
            return new QueueAllResponse("No ready content to queue", 0);
        }

        int queued = 0;
        for (PublishJob job : jobs) {
            try {
                send(job);
                queued++;
            } catch (RuntimeException e) {
                log.error("Content {} could not be queued, continuing with the batch", job.contentId(), e);
            }
        }
        int failed = jobs.size() - queued;
        String message = "Queued " + queued + " items for publishing";
        return new QueueAllResponse(failed == 0 ? message : message + ", " + failed + " failed to enqueue", queued);
    }

    private List<PublishJob> reserveAllReady() {
        List<ContentItem> ready = contentRepository.findByStatusAndDiagramPathIsNotNullOrderByCreatedAtAsc(
                ContentStatus.READY);
        if (ready.isEmpty()) {
            return List.of();
        }

        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime lastPending = scheduleRepository.findLatestScheduledAt(ScheduleStatus.PENDING);
        LocalDateTime base = lastPending != null ? later(lastPending, now) : now;
        Duration interval = Duration.ofMinutes(appConfigService.getPublishIntervalMinutes());

        List<PublishJob> jobs = new ArrayList<>();
        for (ContentItem content : ready) {
            if (scheduleRepository.existsByContentIdAndStatus(content.getId(), ScheduleStatus.PENDING)) {
                log.warn("Content {} already has a pending schedule, skipping", content.getId());
                continue;
            }
            jobs.add(reserve(content, Platform.TWITTER, base.plus(interval.multipliedBy(jobs.size() + 1L))));
        }
        log.info("Reserved {} ready items at {} minute intervals", jobs.size(), interval.toMinutes());
        return jobs;
    }

    @Transactional(readOnly = true)
    public QueueStatus queueStatus() {
        List<QueueStatus.PendingItem> pending = scheduleRepository
                .findByStatusOrderByScheduledAtAsc(ScheduleStatus.PENDING)
                .stream()
                .map(s -> new QueueStatus.PendingItem(s.getContentId(), s.getId(), s.getScheduledAt(), s.getStatus()))
                .toList();

        long depth = 0;
        if (publishQueue.isConfigured()) {
            try {
                depth = publishQueue.approximateDepth();
            } catch (RuntimeException e) {
                log.warn("Failed to read publish queue depth", e);
            }
        }
        return new QueueStatus(pending, depth);
    }

    /** Writes the PENDING schedule and moves the content to QUEUED. Nothing is sent yet. */
    private PublishJob reserve(ContentItem content, Platform platform, LocalDateTime scheduledAt) {
        ScheduleRecord schedule = scheduleRepository.save(ScheduleRecord.pending(content.getId(), platform, scheduledAt));
        content.transitionTo(ContentStatus.QUEUED);
        contentRepository.save(content);

        return new PublishJob(
                content.getId(),
                schedule.getId(),
                platform.getValue(),
                CaptionBuilder.build(content, null),
                content.getDiagramPath(),
                scheduledAt,
                LocalDateTime.now(clock));
    }

    /**
     * Sends a job whose schedule is already committed, so a worker that receives it at once
     * finds the row. A refused send fails the schedule and the content.
     */
    private String send(PublishJob job) {
        try {
            String messageId = publishQueue.enqueue(job);
            log.info("Queued content {} for {} at {} (schedule {})", job.contentId(), job.platform(),
                    job.scheduledAt(), job.scheduleId());
            return messageId;
        } catch (RuntimeException e) {
            log.error("Failed to enqueue content {} (schedule {})", job.contentId(), job.scheduleId(), e);
            outcomeService.recordFailure(job, "Failed to enqueue: "
                    + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            throw e;
        }
    }

    private void checkQueueable(ContentItem content) {
        if (content.getStatus() != ContentStatus.READY && content.getStatus() != ContentStatus.PUBLISHED) {
            throw new IllegalStateException(
                    "Content is not ready for queuing. Status: " + content.getStatus().getValue());
        }
        if (!content.hasDiagram()) {
            throw new IllegalStateException("Content has no image to publish");
        }
        if (scheduleRepository.existsByContentIdAndStatus(content.getId(), ScheduleStatus.PENDING)) {
            throw new IllegalStateException("Content " + content.getId() + " already has a pending schedule");
        }
        requireQueueConfigured();
    }

    private void requireQueueConfigured() {
        if (!publishQueue.isConfigured()) {
            throw new IllegalStateException("Publish queue is not configured. Set app.queue.url");
        }
    }

    static Platform parsePlatform(String value) {
        return Platform.fromValue(value == null ? Platform.TWITTER.getValue() : value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown platform: " + value));
    }

    private static LocalDateTime later(LocalDateTime a, LocalDateTime b) {
        return a.isAfter(b) ? a : b;
    }
}
