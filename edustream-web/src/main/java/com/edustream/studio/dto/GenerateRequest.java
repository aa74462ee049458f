package com.edustream.studio.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class GenerateRequest {
    @NotBlank(message = "Topic name is required")
    @JsonProperty("topic_name")
    private String topicName;

    private String category = "engineering";

    private String description;

    @JsonProperty("content_type")
    private String contentType = "problem";
}
