package com.edustream.studio.service;

import com.edustream.studio.model.ContentItem;
import com.edustream.studio.model.ContentStatus;
import com.edustream.studio.model.ScriptPayload;
import com.edustream.studio.repository.ContentItemRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jobrunr.jobs.annotations.Job;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Background half of a generation request: script, then diagram, then READY. Runs as a
 * JobRunr job; any failure leaves the item FAILED with the error text and is never retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GenerationPipeline {

    static final int RECENT_TEMPLATE_LIMIT = 50;

    private final ContentItemRepository contentItemRepository;
    private final ScriptGenerator scriptGenerator;
    private final DiagramRenderer diagramRenderer;

    @Job(name = "Generate content %0", retries = 0)
    public void run(Long contentId, String topicName, String category, String description) {
        ContentItem content = contentItemRepository.findById(contentId).orElse(null);
        if (content == null) {
            log.warn("Content {} disappeared before generation started", contentId);
            return;
        }

        try {
            ScriptPayload script = scriptGenerator.generate(topicName, category, description, recentTemplateIds());
            content.setScriptData(script);
            content.setScriptText(script.toScriptText());
            contentItemRepository.save(content);

            String title = script.getHookText() != null && !script.getHookText().isBlank()
                    ? script.getHookText() : topicName;
            String diagramPath = diagramRenderer.renderFromDescription(
                    title,
                    Objects.requireNonNullElse(script.getDiagramDescription(), ""),
                    script.getAnswerOptions(),
                    script.getCorrectAnswer());
            log.info("Diagram for content {} saved to {}", contentId, diagramPath);
            content.setDiagramPath(diagramPath);

            content.transitionTo(ContentStatus.READY);
            contentItemRepository.save(content);
            log.info("Content {} is ready (template {})", contentId, script.getTemplateId());
        } catch (Exception e) {
            log.error("Generation failed for content {}", contentId, e);
            markFailed(contentId, e);
        }
    }

    List<String> recentTemplateIds() {
        return contentItemRepository
                .findByScriptDataIsNotNullOrderByCreatedAtDesc(PageRequest.of(0, RECENT_TEMPLATE_LIMIT))
                .stream()
                .map(ContentItem::getScriptData)
                .map(ScriptPayload::getTemplateId)
                .filter(Objects::nonNull)
                .toList();
    }

    private void markFailed(Long contentId, Exception cause) {
        String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        // reload: the in-memory copy may hold half-applied changes
        contentItemRepository.findById(contentId).ifPresent(content -> {
            if (content.getStatus().isTerminal()) {
                return;
            }
            content.markFailed(message);
            contentItemRepository.save(content);
        });
    }
}
