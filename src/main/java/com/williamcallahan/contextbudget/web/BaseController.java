package com.williamcallahan.contextbudget.web;

import com.williamcallahan.contextbudget.domain.errors.ApiErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * Common error handling for controllers.
 */
public abstract class BaseController {

    protected final ExceptionResponseBuilder exceptionBuilder;

    protected BaseController(ExceptionResponseBuilder exceptionBuilder) {
        this.exceptionBuilder = exceptionBuilder;
    }

    /**
     * Handles unexpected service failures with a 500 response.
     *
     * @param e the exception that occurred
     * @param operation description of the operation that failed
     * @return standardized error response
     */
    protected ResponseEntity<ApiErrorResponse> handleServiceException(Exception e, String operation) {
        return exceptionBuilder.buildErrorResponse(
                HttpStatus.INTERNAL_SERVER_ERROR, "Failed to " + operation, e);
    }

    /**
     * Handles malformed request values with a 400 response.
     *
     * @param validationException the validation exception
     * @return bad request error response
     */
    protected ResponseEntity<ApiErrorResponse> handleValidationException(IllegalArgumentException validationException) {
        return exceptionBuilder.buildErrorResponse(HttpStatus.BAD_REQUEST, validationException.getMessage());
    }
}
