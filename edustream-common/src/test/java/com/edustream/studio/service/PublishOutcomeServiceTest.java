package com.edustream.studio.service;

import com.edustream.studio.dto.PublishJob;
import com.edustream.studio.dto.PublishResult;
import com.edustream.studio.model.ContentItem;
import com.edustream.studio.model.ContentStatus;
import com.edustream.studio.model.ContentType;
import com.edustream.studio.model.Platform;
import com.edustream.studio.model.ScheduleRecord;
import com.edustream.studio.model.ScheduleStatus;
import com.edustream.studio.repository.ContentItemRepository;
import com.edustream.studio.repository.ScheduleRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PublishOutcomeServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 8, 0);

    @Mock
    private ContentItemRepository contentRepository;
    @Mock
    private ScheduleRecordRepository scheduleRepository;

    private PublishOutcomeService outcomeService;

    private ContentItem content;
    private ScheduleRecord schedule;

    @BeforeEach
    void setUp() {
        outcomeService = new PublishOutcomeService(contentRepository, scheduleRepository,
                Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC));

        content = new ContentItem(1L, ContentType.PROBLEM);
        content.setId(4L);
        content.transitionTo(ContentStatus.GENERATING);
        content.setScriptText("hook");
        content.setDiagramPath("diagram-4.png");
        content.transitionTo(ContentStatus.READY);
        content.transitionTo(ContentStatus.QUEUED);

        schedule = ScheduleRecord.pending(4L, Platform.TWITTER, NOW.minusMinutes(1));
        schedule.setId(9L);
    }

    private static PublishJob job(Long scheduleId) {
        return new PublishJob(4L, scheduleId, "twitter", "caption", "diagram-4.png", NOW.minusMinutes(1), NOW.minusHours(2));
    }

    @Test
    void recordSuccess_shouldPublishContentAndSchedule() {
        when(scheduleRepository.findById(9L)).thenReturn(Optional.of(schedule));
        when(contentRepository.findById(4L)).thenReturn(Optional.of(content));

        outcomeService.recordSuccess(job(9L), new PublishResult("1801", "url", "text"));

        assertEquals(ContentStatus.PUBLISHED, content.getStatus());
        assertEquals(ScheduleStatus.PUBLISHED, schedule.getStatus());
        assertEquals("1801", schedule.getPlatformPostId());
        assertEquals(NOW, schedule.getPublishedAt());
        verify(contentRepository).save(content);
        verify(scheduleRepository).save(schedule);
    }

    @Test
    void recordFailure_shouldFailContentAndSchedule() {
        when(scheduleRepository.findById(9L)).thenReturn(Optional.of(schedule));
        when(contentRepository.findById(4L)).thenReturn(Optional.of(content));

        outcomeService.recordFailure(job(9L), "401 Unauthorized");

        assertEquals(ContentStatus.FAILED, content.getStatus());
        assertEquals("401 Unauthorized", content.getErrorMessage());
        assertEquals(ScheduleStatus.FAILED, schedule.getStatus());
        assertEquals("401 Unauthorized", schedule.getErrorMessage());
    }

    @Test
    void recordSuccess_shouldIgnoreDuplicateDelivery() {
        schedule.markPublished("1801", NOW.minusMinutes(1));
        when(scheduleRepository.findById(9L)).thenReturn(Optional.of(schedule));

        outcomeService.recordSuccess(job(9L), new PublishResult("1802", "url", "text"));

        assertEquals("1801", schedule.getPlatformPostId());
        verify(scheduleRepository, never()).save(any());
        verifyNoInteractions(contentRepository);
    }

    @Test
    void recordFailure_shouldFallBackToLatestPendingSchedule_WhenJobHasNoScheduleId() {
        when(scheduleRepository.findFirstByContentIdAndStatusOrderByCreatedAtDesc(4L, ScheduleStatus.PENDING))
                .thenReturn(Optional.of(schedule));
        when(contentRepository.findById(4L)).thenReturn(Optional.of(content));

        outcomeService.recordFailure(job(null), "timeout");

        assertEquals(ScheduleStatus.FAILED, schedule.getStatus());
    }

    @Test
    void recordSuccess_shouldStillSaveSchedule_WhenContentTransitionRefused() {
        ContentItem failed = new ContentItem(1L, ContentType.PROBLEM);
        failed.setId(4L);
        failed.markFailed("earlier failure");
        when(scheduleRepository.findById(9L)).thenReturn(Optional.of(schedule));
        when(contentRepository.findById(4L)).thenReturn(Optional.of(failed));

        outcomeService.recordSuccess(job(9L), new PublishResult("1801", "url", "text"));

        assertEquals(ContentStatus.FAILED, failed.getStatus());
        assertEquals(ScheduleStatus.PUBLISHED, schedule.getStatus());
        verify(contentRepository, never()).save(any());
    }

    @Test
    void recordSuccess_shouldSkipContentUpdate_WhenContentDeleted() {
        when(scheduleRepository.findById(9L)).thenReturn(Optional.of(schedule));
        when(contentRepository.findById(4L)).thenReturn(Optional.empty());

        outcomeService.recordSuccess(job(9L), new PublishResult("1801", "url", "text"));

        assertEquals(ScheduleStatus.PUBLISHED, schedule.getStatus());
    }

    @Test
    void scheduleState_shouldReflectScheduleRecord() {
        assertEquals(PublishOutcomeService.ScheduleState.PENDING, outcomeService.scheduleState(job(null)));

        when(scheduleRepository.findById(9L)).thenReturn(Optional.of(schedule));
        assertEquals(PublishOutcomeService.ScheduleState.PENDING, outcomeService.scheduleState(job(9L)));

        schedule.markFailed("boom");
        assertEquals(PublishOutcomeService.ScheduleState.FINALIZED, outcomeService.scheduleState(job(9L)));
    }

    @Test
    void scheduleState_shouldReportMissing_WhenScheduleIsNotVisible() {
        when(scheduleRepository.findById(77L)).thenReturn(Optional.empty());

        assertEquals(PublishOutcomeService.ScheduleState.MISSING, outcomeService.scheduleState(job(77L)));
        verify(scheduleRepository, never()).save(any());
        verifyNoInteractions(contentRepository);
    }
}
