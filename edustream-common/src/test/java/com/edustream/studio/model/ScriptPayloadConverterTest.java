package com.edustream.studio.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScriptPayloadConverterTest {

    private final ScriptPayloadConverter converter = new ScriptPayloadConverter();

    @Test
    void convertToDatabaseColumn_shouldUseSnakeCaseAndSkipNulls() {
        ScriptPayload payload = ScriptPayload.builder()
                .type("problem")
                .hookText("Find the force")
                .answerOptions(List.of("A: 1 N", "B: 2 N"))
                .templateId("stress_axial")
                .build();

        String json = converter.convertToDatabaseColumn(payload);

        assertTrue(json.contains("\"hook_text\":\"Find the force\""), json);
        assertTrue(json.contains("\"template_id\":\"stress_axial\""), json);
        assertFalse(json.contains("key_facts"), json);
    }

    @Test
    void convertToEntityAttribute_shouldIgnoreUnknownFields() {
        ScriptPayload payload = converter.convertToEntityAttribute(
                "{\"hook_text\":\"True or False?\",\"is_true\":true,\"statement\":\"Steel yields\"}");

        assertEquals("True or False?", payload.getHookText());
        assertEquals("Steel yields", payload.getStatement());
        assertNull(converter.convertToEntityAttribute(null));
    }
}
