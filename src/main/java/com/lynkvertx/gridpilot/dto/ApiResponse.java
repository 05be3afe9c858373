package com.lynkvertx.gridpilot.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Unified envelope for every GridPilot endpoint
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /** HTTP-like status code */
    private int code;

    /** Human-readable outcome, "success" unless a controller says otherwise */
    private String message;

    /** Payload; omitted from the JSON when null */
    private T data;

    /** ISO 8601 instant the response was built */
    private String timestamp;

    /**
     * Successful response with the default message
     */
    public static <T> ApiResponse<T> success(T data) {
        return success("success", data);
    }

    /**
     * Successful response with a custom message, e.g. "Home created successfully"
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
     * Error response without a payload
     */
    public static <T> ApiResponse<T> error(int code, String message) {
        return error(code, message, null);
    }

    /**
     * Error with a payload, e.g. field-level validation messages
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
