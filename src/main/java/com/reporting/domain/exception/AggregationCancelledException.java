package com.reporting.domain.exception;

public class AggregationCancelledException extends AggregationException {

    public AggregationCancelledException(String reason) {
        super("aggregation cancelled: " + reason);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.CANCELLED;
    }
}
