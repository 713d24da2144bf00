package com.reporting.domain.exception;

/**
 * A rule condition that cannot be parsed. Fails the rule, never the request.
 */
public class ConditionSyntaxException extends RuleExecutionException {

    public ConditionSyntaxException(String expression, int position, String message) {
        super("Invalid condition at position " + position + ": " + message + " in '" + expression + "'");
    }
}
