package com.edustream.studio.service;

import com.edustream.studio.model.ScriptPayload;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AiScriptServiceTest {

    private static final String SCRIPT_JSON = """
            {"hook_text": "Can you solve this?", "answer_options": ["A: 1", "B: 2", "C: 3", "D: 4"],
             "correct_answer": "B", "content_steps": [{"text": "Given: 4 m beam", "highlight": "beam"}]}""";

    @Mock
    private RestTemplate restTemplate;

    private AiScriptService aiScriptService;

    @BeforeEach
    void setUp() {
        aiScriptService = new AiScriptService("dummy-key", restTemplate);
    }

    @Test
    void isConfigured_shouldBeFalse_ForBlankOrPlaceholderKey() {
        assertFalse(new AiScriptService("", restTemplate).isConfigured());
        assertFalse(new AiScriptService("your_GEMINI_API_KEY", restTemplate).isConfigured());
        assertTrue(aiScriptService.isConfigured());
    }

    @Test
    void generateScript_shouldReject_WhenNotConfigured() {
        AiScriptService unconfigured = new AiScriptService(" ", restTemplate);

        assertThrows(IllegalStateException.class, () -> unconfigured.generateScript("Beams", "engineering", null));
        verifyNoInteractions(restTemplate);
    }

    @Test
    void generateScript_shouldParseFirstCandidate() {
        // Arrange
        Map<String, Object> reply = Map.of("candidates", List.of(
                Map.of("content", Map.of("parts", List.of(Map.of("text", "```json\n" + SCRIPT_JSON + "\n```"))))));
        when(restTemplate.postForObject(startsWith(AiScriptService.GEMINI_URL), any(), eq(Map.class))).thenReturn(reply);

        // Act
        ScriptPayload payload = aiScriptService.generateScript("Beams", "engineering", "simply supported");

        // Assert
        assertEquals("problem", payload.getType());
        assertEquals("Can you solve this?", payload.getHookText());
        assertEquals("B", payload.getCorrectAnswer());
        assertEquals(4, payload.getAnswerOptions().size());
        assertEquals("Given: 4 m beam", payload.getContentSteps().get(0).text());
    }

    @Test
    void generateScript_shouldPropagateApiFailure() {
        when(restTemplate.postForObject(anyString(), any(), eq(Map.class)))
                .thenThrow(new RestClientException("API Error"));

        assertThrows(RestClientException.class, () -> aiScriptService.generateScript("Beams", "engineering", null));
    }

    @Test
    void generateScript_shouldFail_WhenNoCandidates() {
        when(restTemplate.postForObject(anyString(), any(), eq(Map.class))).thenReturn(Map.of("candidates", List.of()));

        assertThrows(IllegalStateException.class, () -> aiScriptService.generateScript("Beams", "engineering", null));
    }

    @Test
    void parseScript_shouldStripPlainFences() {
        ScriptPayload payload = aiScriptService.parseScript("```\n" + SCRIPT_JSON + "\n```");

        assertEquals("Can you solve this?", payload.getHookText());
    }

    @Test
    void parseScript_shouldRejectInvalidJson() {
        assertThrows(IllegalStateException.class, () -> aiScriptService.parseScript("Sure! Here is a quiz."));
    }

    @Test
    void parseScript_shouldRejectScriptWithoutHook() {
        assertThrows(IllegalStateException.class, () -> aiScriptService.parseScript("{\"type\": \"problem\"}"));
    }
}
