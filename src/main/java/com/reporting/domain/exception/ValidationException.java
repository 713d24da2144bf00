package com.reporting.domain.exception;

/**
 * Thrown when a request is malformed. The pipeline never runs for such a request.
 */
public class ValidationException extends AggregationException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.VALIDATION_ERROR;
    }
}
