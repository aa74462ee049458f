package com.edustream.studio.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured script of a content item, stored as JSON on {@link ContentItem}.
 * Optional fields depend on the engagement format that produced the script.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ScriptPayload {
    private String type;
    private String hookText;
    private String diagramDescription;
    private List<ContentStep> contentSteps;
    private List<String> answerOptions;
    private String correctAnswer;
    private String explanation;
    private String ctaText;
    private String tweetText;
    private String templateId;
    private List<String> keyFacts;
    private String formula;
    private String statement;

    /** Plain narration text: the hook followed by every step. */
    public String toScriptText() {
        String hook = hookText != null ? hookText : "";
        if (contentSteps == null || contentSteps.isEmpty()) {
            return hook;
        }
        String steps = contentSteps.stream()
                .map(step -> step.text() != null ? step.text() : "")
                .collect(Collectors.joining(" "));
        return hook + " " + steps;
    }
}
