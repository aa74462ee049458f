package com.edustream.studio.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;

@Data
public class BatchGenerateRequest {
    @NotEmpty(message = "At least one topic is required")
    private List<@Valid GenerateRequest> topics;
}
