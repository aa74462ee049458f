package com.edustream.studio.dto;

import com.edustream.studio.model.ContentItem;
import com.edustream.studio.model.ContentStatus;
import com.edustream.studio.model.ScriptPayload;
import com.fasterxml.jackson.annotation.JsonProperty;

public record GenerationStatus(
        @JsonProperty("content_id") Long contentId,
        ContentStatus status,
        @JsonProperty("has_script") boolean hasScript,
        @JsonProperty("has_diagram") boolean hasDiagram,
        @JsonProperty("has_audio") boolean hasAudio,
        @JsonProperty("has_video") boolean hasVideo,
        @JsonProperty("error_message") String errorMessage,
        @JsonProperty("script_data") ScriptPayload scriptData) {

    public static GenerationStatus of(ContentItem content) {
        return new GenerationStatus(
                content.getId(),
                content.getStatus(),
                content.hasScript(),
                content.hasDiagram(),
                content.hasAudio(),
                content.hasVideo(),
                content.getErrorMessage(),
                content.getScriptData());
    }
}
