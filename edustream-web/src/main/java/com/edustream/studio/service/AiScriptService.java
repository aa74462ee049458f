package com.edustream.studio.service;

import com.edustream.studio.model.ScriptPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

/**
 * Writes a quiz script with Gemini when the template pool cannot produce one.
 */
@Service
@Slf4j
public class AiScriptService {

    static final String GEMINI_URL =
            "https://generativelanguage.googleapis.com/v1beta/models/gemini-flash-lite-latest:generateContent?key=";

    private static final String PROMPT = """
            You are creating a short-form educational post about %s for social media.

            Topic: %s
            %s

            Create a PROBLEM/QUIZ post that:
            1. Hooks viewers with "Can you solve this?" or similar
            2. Presents a clear engineering/physics problem with specific numbers
            3. Shows 4 multiple choice answer options (A, B, C, D)
            4. Encourages viewers to comment their answer

            Return ONLY valid JSON with this structure:
            {
              "type": "problem",
              "hook_text": "Can you solve this beam problem?",
              "diagram_description": "beam type, supports, loads with exact values and positions",
              "content_steps": [
                {"text": "Given: describe the setup with numbers", "highlight": "what to emphasize"},
                {"text": "Find: what to calculate", "highlight": "target variable"}
              ],
              "answer_options": ["A: 5 kN", "B: 10 kN", "C: 15 kN", "D: 20 kN"],
              "correct_answer": "A",
              "explanation": "Brief explanation of why A is correct",
              "cta_text": "Comment A, B, C, or D!"
            }
            Make the problem solvable in about 30 seconds. No markdown formatting.""";

    private final String geminiKey;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public AiScriptService(@Value("${app.gemini.key:}") String geminiKey, RestTemplate restTemplate) {
        this.geminiKey = geminiKey;
        this.restTemplate = restTemplate;
    }

    public boolean isConfigured() {
        return geminiKey != null && !geminiKey.isBlank() && !geminiKey.contains("GEMINI_API_KEY");
    }

    /**
     * @throws IllegalStateException if the service is not configured or the reply is not a script
     */
    public ScriptPayload generateScript(String topic, String category, String description) {
        if (!isConfigured()) {
            throw new IllegalStateException("AI script generation is not configured. Set app.gemini.key");
        }
        String context = description != null && !description.isBlank() ? "Additional context: " + description : "";
        String reply = callGemini(String.format(PROMPT, category, topic, context));
        ScriptPayload payload = parseScript(reply);
        log.info("Generated AI script for topic '{}'", topic);
        return payload;
    }

    ScriptPayload parseScript(String reply) {
        String text = reply.strip();
        if (text.startsWith("```json")) {
            text = text.substring(7);
        } else if (text.startsWith("```")) {
            text = text.substring(3);
        }
        if (text.endsWith("```")) {
            text = text.substring(0, text.length() - 3);
        }
        text = text.strip();
        try {
            ScriptPayload payload = objectMapper.readValue(text, ScriptPayload.class);
            if (payload.getHookText() == null) {
                throw new IllegalStateException("AI script has no hook_text");
            }
            if (payload.getType() == null) {
                payload.setType("problem");
            }
            return payload;
        } catch (JsonProcessingException e) {
            String preview = text.length() > 500 ? text.substring(0, 500) : text;
            throw new IllegalStateException("Failed to parse AI response as JSON: " + preview, e);
        }
    }

    @SuppressWarnings("rawtypes")
    private String callGemini(String prompt) {
        Map<String, Object> requestBody = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        Map response = restTemplate.postForObject(GEMINI_URL + geminiKey, new HttpEntity<>(requestBody, headers), Map.class);

        // candidates[0].content.parts[0].text
        if (response != null && response.get("candidates") instanceof List candidates && !candidates.isEmpty()) {
            Map content = (Map) ((Map) candidates.get(0)).get("content");
            Map part = (Map) ((List) content.get("parts")).get(0);
            return (String) part.get("text");
        }
        throw new IllegalStateException("Gemini returned no candidates");
    }
}
