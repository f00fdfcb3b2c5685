package com.example.gateway.api;

/**
 * Envelope shared by every endpoint except {@code /health}.
 */
public record ApiResponse<T>(
        boolean success,
        T data,
        String error,
        String message,
        PaginationMeta meta
) {
    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, null, message, null);
    }

    public static <T> ApiResponse<T> page(T data, String message, PaginationMeta meta) {
        return new ApiResponse<>(true, data, null, message, meta);
    }

    public static ApiResponse<Void> failure(String error, String message) {
        return new ApiResponse<>(false, null, error, message, null);
    }
}
