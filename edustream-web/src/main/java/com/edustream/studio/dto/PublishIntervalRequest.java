package com.edustream.studio.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;

@Data
public class PublishIntervalRequest {
    @NotNull(message = "Minutes are required")
    @Positive(message = "Publish interval must be a positive number of minutes")
    private Integer minutes;
}
