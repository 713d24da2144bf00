package com.reporting.domain.exception;

/**
 * Base type for every failure raised by the aggregation engine.
 */
public abstract class AggregationException extends RuntimeException {

    protected AggregationException(String message) {
        super(message);
    }

    protected AggregationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCategory getCategory();
}
