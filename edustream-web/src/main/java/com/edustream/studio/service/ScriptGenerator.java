package com.edustream.studio.service;

import com.edustream.studio.model.ScriptPayload;
import com.edustream.studio.scenario.TemplatePool;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Produces a script for a topic: the template pool first, the AI writer when the pool fails
 * and an AI key is configured.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScriptGenerator {

    private final TemplatePool templatePool;
    private final AiScriptService aiScriptService;

    public ScriptPayload generate(String topic, String category, String description, List<String> recentTemplateIds) {
        try {
            ScriptPayload payload = templatePool.generate(topic, category, description, recentTemplateIds);
            log.info("Used template pool for '{}'", topic);
            return payload;
        } catch (RuntimeException e) {
            if (!aiScriptService.isConfigured()) {
                throw e;
            }
            log.warn("Template pool failed for '{}', falling back to AI: {}", topic, e.getMessage());
            return aiScriptService.generateScript(topic, category, description);
        }
    }
}
