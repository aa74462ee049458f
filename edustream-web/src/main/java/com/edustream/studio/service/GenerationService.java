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
import lombok.extern.slf4j.Slf4j;
import org.jobrunr.jobs.JobId;
import org.jobrunr.scheduling.JobScheduler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Accepts generation requests. The topic and a GENERATING content item are written
 * synchronously; the rest runs in {@link GenerationPipeline} as a background job.
 */
@Service
@Slf4j
public class GenerationService {

    private final TopicService topicService;
    private final ContentItemRepository contentItemRepository;
    private final JobScheduler jobScheduler;
    private final GenerationPipeline generationPipeline;
    private final int maxBatchSize;

    public GenerationService(TopicService topicService,
                             ContentItemRepository contentItemRepository,
                             JobScheduler jobScheduler,
                             GenerationPipeline generationPipeline,
                             @Value("${app.generation.max-batch-size:30}") int maxBatchSize) {
        this.topicService = topicService;
        this.contentItemRepository = contentItemRepository;
        this.jobScheduler = jobScheduler;
        this.generationPipeline = generationPipeline;
        this.maxBatchSize = maxBatchSize;
    }

    public GenerateResponse submit(GenerateRequest request) {
        validate(request);
        return start(request);
    }

    /**
     * Submits every request of the batch. The whole batch is validated before anything is
     * written.
     */
    public List<GenerateResponse> submitBatch(List<GenerateRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new IllegalArgumentException("At least one topic is required");
        }
        if (requests.size() > maxBatchSize) {
            throw new IllegalArgumentException("Maximum " + maxBatchSize + " topics per batch");
        }
        requests.forEach(this::validate);
        return requests.stream().map(this::start).toList();
    }

    public GenerationStatus status(Long contentId) {
        ContentItem content = contentItemRepository.findById(contentId)
                .orElseThrow(() -> new ContentNotFoundException(contentId));
        return GenerationStatus.of(content);
    }

    private GenerateResponse start(GenerateRequest request) {
        String category = categoryOf(request);
        Topic topic = topicService.findOrCreate(request.getTopicName().trim(), category, request.getDescription());

        ContentItem content = new ContentItem(topic.getId(), ContentType.fromValue(request.getContentType()));
        content.transitionTo(ContentStatus.GENERATING);
        content = contentItemRepository.save(content);

        Long contentId = content.getId();
        String topicName = request.getTopicName().trim();
        String description = request.getDescription();
        JobId jobId;
        try {
            jobId = jobScheduler.enqueue(() -> generationPipeline.run(contentId, topicName, category, description));
        } catch (RuntimeException e) {
            log.error("Failed to queue generation job for content {}", contentId, e);
            content.markFailed("Failed to start generation: "
                    + (e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            contentItemRepository.save(content);
            throw e;
        }
        log.info("Queued generation job {} for content {} ('{}')", jobId, contentId, topicName);

        return new GenerateResponse(contentId, ContentStatus.GENERATING.getValue(),
                "Started generation for: " + topicName);
    }

    private void validate(GenerateRequest request) {
        if (request == null || request.getTopicName() == null || request.getTopicName().isBlank()) {
            throw new IllegalArgumentException("Topic name is required");
        }
    }

    private static String categoryOf(GenerateRequest request) {
        String category = request.getCategory();
        return category == null || category.isBlank() ? "engineering" : category.trim();
    }
}
