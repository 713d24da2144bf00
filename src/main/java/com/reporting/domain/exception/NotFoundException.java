package com.reporting.domain.exception;

/**
 * Thrown when a job or schema lookup misses.
 */
public class NotFoundException extends AggregationException {

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.NOT_FOUND;
    }
}
