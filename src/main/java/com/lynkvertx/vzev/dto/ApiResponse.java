package com.lynkvertx.vzev.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Standard API Response wrapper
 * Provides unified response format for all API endpoints. Data-quality findings that
 * did not stop an operation travel in {@code warnings}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /**
     * Response status code
     */
    private int code;

    /**
     * Response message
     */
    private String message;

    /**
     * Response data payload
     */
    private T data;

    /**
     * Non-fatal findings (excluded months, cross-check deviations); omitted when empty
     */
    private List<String> warnings;

    /**
     * Response timestamp in ISO 8601 format
     */
    private String timestamp;

    /**
     * Create a successful response with data
     */
    public static <T> ApiResponse<T> success(T data) {
        return success("success", data);
    }

    /**
     * Create a successful response with custom message
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return ApiResponse.<T>builder()
            .code(200)
            .message(message)
            .data(data)
            .timestamp(Instant.now().toString())
            .build();
    }

    /**
     * Create a successful response carrying non-fatal warnings; an empty list is omitted
     */
    public static <T> ApiResponse<T> success(String message, T data, List<String> warnings) {
        return ApiResponse.<T>builder()
            .code(200)
            .message(message)
            .data(data)
            .warnings(warnings == null || warnings.isEmpty() ? null : warnings)
            .timestamp(Instant.now().toString())
            .build();
    }

    /**
     * Create an error response
     */
    public static <T> ApiResponse<T> error(int code, String message) {
        return error(code, message, null);
    }

    /**
     * Create an error response with data (e.g., validation errors)
     */
    public static <T> ApiResponse<T> error(int code, String message, T data) {
        return ApiResponse.<T>builder()
            .code(code)
            .message(message)
            .data(data)
            .timestamp(Instant.now().toString())
            .build();
    }
}
