package com.edustream.studio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.List;

@Data
public class PublishRequest {
    @NotNull(message = "Content id is required")
    @JsonProperty("content_id")
    private Long contentId;

    private String platform = "twitter";

    // overrides the caption built from the script
    private String caption;

    private List<String> hashtags;
}
