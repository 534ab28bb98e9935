package com.example.timesheet.common;

import java.util.Collections;
import java.util.Map;

/**
 * Envelope returned by every endpoint: a {@code success} flag, an optional message, the
 * payload, and free-form metadata (violation details on failures).
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return new ApiResponse<>(true, message, data, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> failure(String message) {
        return new ApiResponse<>(false, message, null, Collections.emptyMap());
    }

    public static <T> ApiResponse<T> failure(String message, Map<String, Object> meta) {
        return new ApiResponse<>(false, message, null, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
