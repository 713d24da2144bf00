package com.reporting.domain.exception;

/**
 * Failure of a single rule. Recorded in the result's failed rules; never
 * escalated to a request-level error.
 */
public class RuleExecutionException extends AggregationException {

    public RuleExecutionException(String message) {
        super(message);
    }

    public RuleExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorCategory getCategory() {
        return ErrorCategory.RULE_EXECUTION_ERROR;
    }
}
