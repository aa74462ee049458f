package com.edustream.studio.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Envelope for acknowledgements and error bodies. {@code data} is left out of the JSON when absent.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String message, T data) {

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data);
    }

    public static ApiResponse<Void> failure(String message) {
        return new ApiResponse<>(false, message, null);
    }
}
