package com.edustream.studio.service;

import com.edustream.studio.dto.PublishJob;
import com.edustream.studio.dto.PublishResult;
import com.edustream.studio.model.ContentItem;
import com.edustream.studio.model.ContentStatus;
import com.edustream.studio.model.ScheduleRecord;
import com.edustream.studio.model.ScheduleStatus;
import com.edustream.studio.repository.ContentItemRepository;
import com.edustream.studio.repository.ScheduleRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Writes the terminal outcome of a queued publish job to the content item and its schedule
 * record. Updates are idempotent: a schedule that is no longer pending is left alone, and a
 * content transition the state machine refuses is logged and skipped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublishOutcomeService {

    private final ContentItemRepository contentRepository;
    private final ScheduleRecordRepository scheduleRepository;
    private final Clock clock;

    /** Where the schedule record a job names stands, as seen by the worker. */
    public enum ScheduleState {
        /** Still waiting to be published, or the job names no schedule. */
        PENDING,
        /** Already published or failed; the delivery is a duplicate. */
        FINALIZED,
        /** Not visible (yet); the queue operation may not have committed. */
        MISSING
    }

    @Transactional(readOnly = true)
    public ScheduleState scheduleState(PublishJob job) {
        if (job.scheduleId() == null) {
            return ScheduleState.PENDING;
        }
        return scheduleRepository.findById(job.scheduleId())
                .map(schedule -> schedule.isPending() ? ScheduleState.PENDING : ScheduleState.FINALIZED)
                .orElse(ScheduleState.MISSING);
    }

    @Transactional
    public void recordSuccess(PublishJob job, PublishResult result) {
        Optional<ScheduleRecord> schedule = resolveSchedule(job);
        if (schedule.isPresent() && !schedule.get().isPending()) {
            log.warn("Schedule {} for content {} is already {}, skipping success update",
                    schedule.get().getId(), job.contentId(), schedule.get().getStatus().getValue());
            return;
        }

        updateContent(job.contentId(), ContentStatus.PUBLISHED, null);
        schedule.ifPresentOrElse(s -> {
            s.markPublished(result.postId(), LocalDateTime.now(clock));
            scheduleRepository.save(s);
            log.info("Schedule {} published as post {}", s.getId(), result.postId());
        }, () -> log.warn("No pending schedule found for content {}", job.contentId()));
    }

    @Transactional
    public void recordFailure(PublishJob job, String error) {
        Optional<ScheduleRecord> schedule = resolveSchedule(job);
        if (schedule.isPresent() && !schedule.get().isPending()) {
            log.warn("Schedule {} for content {} is already {}, skipping failure update",
                    schedule.get().getId(), job.contentId(), schedule.get().getStatus().getValue());
            return;
        }

        updateContent(job.contentId(), ContentStatus.FAILED, error);
        schedule.ifPresentOrElse(s -> {
            s.markFailed(error);
            scheduleRepository.save(s);
            log.info("Schedule {} marked failed", s.getId());
        }, () -> log.warn("No pending schedule found for content {}", job.contentId()));
    }

    private Optional<ScheduleRecord> resolveSchedule(PublishJob job) {
        if (job.scheduleId() != null) {
            return scheduleRepository.findById(job.scheduleId());
        }
        return scheduleRepository.findFirstByContentIdAndStatusOrderByCreatedAtDesc(
                job.contentId(), ScheduleStatus.PENDING);
    }

    private void updateContent(Long contentId, ContentStatus next, String error) {
        Optional<ContentItem> found = contentRepository.findById(contentId);
        if (found.isEmpty()) {
            log.warn("Content {} no longer exists, skipping status update", contentId);
            return;
        }
        ContentItem content = found.get();
        try {
            if (next == ContentStatus.FAILED) {
                content.markFailed(error);
            } else {
                content.transitionTo(next);
            }
            contentRepository.save(content);
        } catch (IllegalStateException e) {
            log.warn("Skipping content update: {}", e.getMessage());
        }
    }
}
