package com.williamcallahan.contextbudget.domain.errors;

import java.util.Objects;

/**
 * JSON error payload returned by the trim endpoints.
 *
 * @param status fixed status indicator ("error")
 * @param message user-facing error message
 * @param details optional diagnostic details, null when none apply
 */
public record ApiErrorResponse(String status, String message, String details) {
    private static final String STATUS_ERROR = "error";

    public ApiErrorResponse {
        Objects.requireNonNull(status, "Status is required");
        Objects.requireNonNull(message, "Error message is required");
    }

    public static ApiErrorResponse error(String message) {
        return new ApiErrorResponse(STATUS_ERROR, message, null);
    }

    public static ApiErrorResponse error(String message, String details) {
        return new ApiErrorResponse(STATUS_ERROR, message, details);
    }
}
