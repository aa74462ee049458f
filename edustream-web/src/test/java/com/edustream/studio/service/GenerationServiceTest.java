package com.edustream.studio.service;

import com.edustream.studio.dto.GenerateRequest;
import com.edustream.studio.dto.GenerateResponse;
import com.edustream.studio.dto.GenerationStatus;
import com.edustream.studio.exception.ContentNotFoundException;
import com.edustream.studio.model.ContentItem;
import com.edustream.studio.model.ContentStatus;
import com.edustream.studio.model.ContentType;
import com.edustream.studio.model.Topic;
import com.edustream.studio.repository.ContentItemRepository;
import org.jobrunr.jobs.lambdas.JobLambda;
import org.jobrunr.scheduling.JobScheduler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GenerationServiceTest {

    @Mock
    private TopicService topicService;
    @Mock
    private ContentItemRepository contentItemRepository;
    @Mock
    private JobScheduler jobScheduler;
    @Mock
    private GenerationPipeline generationPipeline;

    private GenerationService generationService;

    @BeforeEach
    void setUp() {
        generationService = new GenerationService(topicService, contentItemRepository, jobScheduler, generationPipeline, 30);
    }

    private void stubPersistence() {
        Topic topic = new Topic("Beam Statics", "engineering", null);
        topic.setId(3L);
        when(topicService.findOrCreate(anyString(), anyString(), any())).thenReturn(topic);
        AtomicLong ids = new AtomicLong(100);
        when(contentItemRepository.save(any(ContentItem.class))).thenAnswer(invocation -> {
            ContentItem item = invocation.getArgument(0);
            item.setId(ids.incrementAndGet());
            return item;
        });
    }

    @Test
    void submit_shouldCreateGeneratingContentAndEnqueueJob() {
        stubPersistence();

        GenerateResponse response = generationService.submit(
                new GenerateRequest("Beam Statics", "engineering", null, "concept"));

        assertEquals(101L, response.contentId());
        assertEquals("generating", response.status());
        assertEquals("Started generation for: Beam Statics", response.message());

        ArgumentCaptor<ContentItem> saved = ArgumentCaptor.forClass(ContentItem.class);
        verify(contentItemRepository).save(saved.capture());
        assertEquals(ContentStatus.GENERATING, saved.getValue().getStatus());
        assertEquals(ContentType.CONCEPT, saved.getValue().getContentType());
        assertEquals(3L, saved.getValue().getTopicId());
        verify(jobScheduler).enqueue(any(JobLambda.class));
    }

    @Test
    void submit_shouldFailContent_WhenJobCannotBeQueued() {
        stubPersistence();
        when(jobScheduler.enqueue(any(JobLambda.class))).thenThrow(new IllegalStateException("job storage unavailable"));

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> generationService.submit(new GenerateRequest("Beam Statics", "engineering", null, "problem")));

        assertEquals("job storage unavailable", e.getMessage());
        ArgumentCaptor<ContentItem> saved = ArgumentCaptor.forClass(ContentItem.class);
        verify(contentItemRepository, times(2)).save(saved.capture());
        ContentItem content = saved.getAllValues().get(1);
        assertEquals(ContentStatus.FAILED, content.getStatus());
        assertEquals("Failed to start generation: job storage unavailable", content.getErrorMessage());
    }

    @Test
    void submit_shouldDefaultBlankCategoryToEngineering() {
        stubPersistence();

        generationService.submit(new GenerateRequest("Gears", " ", "ratios", null));

        verify(topicService).findOrCreate("Gears", "engineering", "ratios");
    }

    @Test
    void submit_shouldRejectBlankTopicName() {
        assertThrows(IllegalArgumentException.class,
                () -> generationService.submit(new GenerateRequest(" ", "engineering", null, "problem")));
        verifyNoInteractions(topicService, contentItemRepository, jobScheduler);
    }

    @Test
    void submitBatch_shouldReturnOneEntryPerTopic() {
        stubPersistence();
        List<GenerateRequest> requests = List.of(
                new GenerateRequest("Beams", "engineering", null, "problem"),
                new GenerateRequest("Gears", "engineering", null, "problem"),
                new GenerateRequest("Springs", "engineering", null, "problem"));

        List<GenerateResponse> responses = generationService.submitBatch(requests);

        assertEquals(3, responses.size());
        assertEquals(List.of(101L, 102L, 103L), responses.stream().map(GenerateResponse::contentId).toList());
        verify(jobScheduler, times(3)).enqueue(any(JobLambda.class));
    }

    @Test
    void submitBatch_shouldRejectOversizedBatchBeforeAnyWrite() {
        List<GenerateRequest> requests = new ArrayList<>();
        for (int i = 0; i < 31; i++) {
            requests.add(new GenerateRequest("Topic " + i, "engineering", null, "problem"));
        }

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> generationService.submitBatch(requests));

        assertEquals("Maximum 30 topics per batch", e.getMessage());
        verifyNoInteractions(topicService, contentItemRepository, jobScheduler);
    }

    @Test
    void submitBatch_shouldRejectBatchWithInvalidEntryBeforeAnyWrite() {
        List<GenerateRequest> requests = List.of(
                new GenerateRequest("Beams", "engineering", null, "problem"),
                new GenerateRequest(null, "engineering", null, "problem"));

        assertThrows(IllegalArgumentException.class, () -> generationService.submitBatch(requests));
        verifyNoInteractions(topicService, contentItemRepository, jobScheduler);
    }

    @Test
    void status_shouldReportArtifactFlags() {
        ContentItem content = new ContentItem(3L, ContentType.PROBLEM);
        content.setId(7L);
        content.transitionTo(ContentStatus.GENERATING);
        content.setScriptText("hook");
        when(contentItemRepository.findById(7L)).thenReturn(Optional.of(content));

        GenerationStatus status = generationService.status(7L);

        assertEquals(ContentStatus.GENERATING, status.status());
        assertTrue(status.hasScript());
        assertFalse(status.hasDiagram());
        assertFalse(status.hasAudio());
        assertFalse(status.hasVideo());
    }

    @Test
    void status_shouldThrowNotFound_WhenContentIsMissing() {
        when(contentItemRepository.findById(7L)).thenReturn(Optional.empty());

        assertThrows(ContentNotFoundException.class, () -> generationService.status(7L));
    }
}
