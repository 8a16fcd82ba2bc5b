package com.williamcallahan.contextbudget.web;

import com.williamcallahan.contextbudget.domain.errors.ApiErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * Builds the error responses shared by the trim controllers.
 */
@Component
public class ExceptionResponseBuilder {

    /**
     * Builds an error response with status and message.
     *
     * @param status HTTP status code
     * @param message error message
     * @return response carrying an {@link ApiErrorResponse}
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message));
    }

    /**
     * Builds an error response including the exception message as details.
     *
     * @param status HTTP status code
     * @param message error message
     * @param exception exception that caused the failure
     * @return response carrying an {@link ApiErrorResponse}
     */
    public ResponseEntity<ApiErrorResponse> buildErrorResponse(HttpStatus status, String message, Exception exception) {
        return ResponseEntity.status(status).body(ApiErrorResponse.error(message, describeException(exception)));
    }

    /**
     * Describes an exception for client diagnostics.
     *
     * @param exception exception to describe
     * @return simple class name and message, or null when no exception is provided
     */
    public String describeException(Exception exception) {
        if (exception == null) {
            return null;
        }
        String message = exception.getMessage();
        String type = exception.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }
}
