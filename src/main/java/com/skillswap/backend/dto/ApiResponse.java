package com.skillswap.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Unified API response wrapper class
 * @param <T> Response data type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApiResponse<T> {
    /**
     * HTTP status code (200, 400, 500, etc.)
     */
    private Integer code;

    /**
     * Response message
     */
    private String message;

    /**
     * Response data; for field-level failures a map of field to error message
     */
    private T data;

    /**
     * Timestamp
     */
    @Builder.Default
    private Long timestamp = System.currentTimeMillis();

    /**
     * Success response with data
     */
    public static <T> ApiResponse<T> success(T data) {
        return success("Success", data);
    }

    /**
     * Success response with custom message and data
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return ApiResponse.<T>builder()
                .code(200)
                .message(message)
                .data(data)
                .build();
    }

    /**
     * Created response (201) with custom message and data
     */
    public static <T> ApiResponse<T> created(String message, T data) {
        return ApiResponse.<T>builder()
                .code(201)
                .message(message)
                .data(data)
                .build();
    }

    /**
     * Error response with status code and message
     */
    public static <T> ApiResponse<T> error(Integer code, String message) {
        return error(code, message, null);
    }

    /**
     * Error response carrying details, e.g. field errors
     */
    public static <T> ApiResponse<T> error(Integer code, String message, T data) {
        return ApiResponse.<T>builder()
                .code(code)
                .message(message)
                .data(data)
                .build();
    }
}
