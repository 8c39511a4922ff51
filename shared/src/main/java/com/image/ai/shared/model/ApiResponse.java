package com.image.ai.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        String status,
        String message,
        T data) {

    public static final String STATUS_ERROR = "error";

    public static ApiResponse<Void> error(String message) {
        return new ApiResponse<>(STATUS_ERROR, message, null);
    }
}
